package me.golemcore.chatreport.port.outbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for persistent storage within the local data directory. Files are
 * organized by top-level directory ({@code messages}, {@code chats},
 * {@code reports}).
 */
public interface StoragePort {

    /**
     * Read text content from file, completing with {@code null} when the file is
     * absent.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * List files below {@code directory/prefix}, as paths relative to
     * {@code directory}.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Atomically write text content to file.
     *
     * <p>
     * The content is written to a {@code .tmp} sibling, fsynced and renamed over
     * the target, so readers observe either the previous file or the new one.
     *
     * @param directory
     *            top-level directory
     * @param path
     *            relative path within directory
     * @param content
     *            text content to write
     * @param backup
     *            if true, preserve previous version as .bak
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);

    /**
     * Whether the storage root exists and is writable.
     */
    boolean isAvailable();
}
