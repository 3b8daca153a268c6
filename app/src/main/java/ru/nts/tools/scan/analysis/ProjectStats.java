/*
 * Copyright 2025 Aristo
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
 */
package ru.nts.tools.scan.analysis;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate counters of one scan.
 *
 * @param totalFiles       Files seen, sensitive ones included.
 * @param totalSizeBytes   Size of analyzed files.
 * @param totalLines       Lines of analyzed text files.
 * @param filesByExtension Lower-case suffix (or {@code .no_extension}) to count, sorted by key.
 * @param hasTests         Test directory under the root or a test-like extension.
 * @param gitRepository    {@code .git} exists under the root.
 * @param filesAnalyzed    Files that were measured (not skipped).
 */
public record ProjectStats(long totalFiles,
                           long totalSizeBytes,
                           long totalLines,
                           Map<String, Integer> filesByExtension,
                           boolean hasTests,
                           boolean gitRepository,
                           int filesAnalyzed) {

    public ProjectStats {
        filesByExtension = Collections.unmodifiableMap(new TreeMap<>(filesByExtension));
    }
}
