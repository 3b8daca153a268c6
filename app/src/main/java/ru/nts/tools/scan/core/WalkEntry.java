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
package ru.nts.tools.scan.core;

import java.nio.file.Path;
import java.util.List;

/**
 * Один шаг обхода дерева.
 *
 * @param directory   Канонический путь директории внутри корня.
 * @param directories Имена проверенных поддиректорий, по алфавиту.
 * @param files       Имена проверенных файлов, по алфавиту.
 */
public record WalkEntry(Path directory, List<String> directories, List<String> files) {

    public WalkEntry {
        directories = List.copyOf(directories);
        files = List.copyOf(files);
    }

    public Path resolve(String name) {
        return directory.resolve(name);
    }
}
