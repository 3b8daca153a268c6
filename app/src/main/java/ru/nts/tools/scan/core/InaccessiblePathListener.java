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

/**
 * Receives entries skipped during enumeration (soft failures).
 * Called on the thread that consumes the walk.
 */
@FunctionalInterface
public interface InaccessiblePathListener {

    InaccessiblePathListener NONE = (path, code, detail) -> {
    };

    /**
     * @param path   Entry as it was listed (not resolved).
     * @param code   Reason the entry was skipped.
     * @param detail Low-level cause, may be null.
     */
    void onInaccessible(Path path, NtsErrorCode code, String detail);
}
