package me.golemcore.sync.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Port for raw file storage.
 *
 * <p>
 * Paths are {@code directory/path} pairs relative to the configured base path.
 * All operations are asynchronous.
 */
public interface StoragePort {

    /**
     * Returns {@code null} when the file does not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * Writes through a temp file that is fsynced and then atomically moved over
     * the target, so readers never observe a half-written file.
     *
     * @param backup
     *            copy the previous file to {@code <path>.bak} before replacing
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);
}
