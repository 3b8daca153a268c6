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

/**
 * Closed set of boundary failure kinds.
 * The kind decides the propagation policy, not the concrete cause.
 */
public enum BoundaryErrorKind {

    /**
     * The project root itself is unusable. Always fatal, raised before any traversal.
     */
    INVALID_ROOT,

    /**
     * A path the caller asked for directly resolves outside the project root.
     * Fatal for that call.
     */
    BOUNDARY_VIOLATION,

    /**
     * The path cannot be used right now (missing, unreadable, escaping link during enumeration).
     * Skipped during enumeration, never fatal there.
     */
    INACCESSIBLE
}
