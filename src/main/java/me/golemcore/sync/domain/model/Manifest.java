package me.golemcore.sync.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable snapshot of the knowledge repository at {@code commitId}: item id
 * to content hash plus minimal metadata.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Manifest {

    private String commitId;

    @Builder.Default
    private Map<String, ManifestEntry> items = new LinkedHashMap<>();

    /**
     * Id to content hash view, sorted by id.
     */
    @JsonIgnore
    public Map<String, String> hashes() {
        Map<String, String> hashes = new TreeMap<>();
        items.forEach((id, entry) -> hashes.put(id, entry.getContentHash()));
        return hashes;
    }

    /**
     * Narrows the manifest to the given ids, keeping the commit id.
     */
    public Manifest restrictTo(Set<String> ids) {
        Map<String, ManifestEntry> restricted = new LinkedHashMap<>();
        items.forEach((id, entry) -> {
            if (ids.contains(id)) {
                restricted.put(id, entry);
            }
        });
        return new Manifest(commitId, restricted);
    }
}
