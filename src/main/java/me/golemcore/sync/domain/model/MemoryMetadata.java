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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Metadata carried by a memory record, discriminated by its {@code type}
 * field.
 *
 * <p>
 * The variant is resolved once, when the record is read from the memory store:
 * {@code knowledge_pointer} metadata becomes {@link KnowledgePointerMetadata},
 * anything else becomes {@link PlainMemoryMetadata}. Code downstream of the
 * store boundary never inspects raw metadata maps.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type", visible = true, defaultImpl = PlainMemoryMetadata.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = KnowledgePointerMetadata.class, name = KnowledgePointerMetadata.TYPE)
})
public abstract class MemoryMetadata {

    public abstract String getType();
}
