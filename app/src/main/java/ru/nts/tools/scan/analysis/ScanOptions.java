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

import ru.nts.tools.scan.core.BoundedTreeWalker;

/**
 * Параметры сканирования проекта.
 *
 * @param skipSensitive Не считывать и не измерять чувствительные файлы.
 * @param maxDepth      Максимальная глубина обхода ({@link BoundedTreeWalker#UNBOUNDED} по умолчанию).
 * @param maxFiles      Предел проанализированных файлов; 0 означает без ограничения.
 */
public record ScanOptions(boolean skipSensitive, int maxDepth, int maxFiles) {

    public ScanOptions {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0, got " + maxDepth);
        }
        if (maxFiles < 0) {
            throw new IllegalArgumentException("maxFiles must be >= 0, got " + maxFiles);
        }
    }

    public static ScanOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasFileLimit() {
        return maxFiles > 0;
    }

    public static final class Builder {

        private boolean skipSensitive = true;
        private int maxDepth = BoundedTreeWalker.UNBOUNDED;
        private int maxFiles = 0;

        private Builder() {
        }

        public Builder skipSensitive(boolean skipSensitive) {
            this.skipSensitive = skipSensitive;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder maxFiles(int maxFiles) {
            this.maxFiles = maxFiles;
            return this;
        }

        public ScanOptions build() {
            return new ScanOptions(skipSensitive, maxDepth, maxFiles);
        }
    }
}
