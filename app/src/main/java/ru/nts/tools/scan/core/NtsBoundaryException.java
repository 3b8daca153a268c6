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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception for project boundary errors (invalid root, path outside root, symlink attack, inaccessible path).
 * Thrown only from strict call sites; enumeration reports the same codes through {@link PathResolution}.
 */
public class NtsBoundaryException extends NtsException {

    public NtsBoundaryException(NtsErrorCode code, Path path) {
        super(code, Map.of("path", String.valueOf(path)));
    }

    public NtsBoundaryException(NtsErrorCode code, Map<String, Object> context) {
        super(code, context);
    }

    public NtsBoundaryException(NtsErrorCode code, Map<String, Object> context, Throwable cause) {
        super(code, context, cause);
    }

    /**
     * Boundary kind of the error code; every code this exception carries has one.
     */
    public BoundaryErrorKind getKind() {
        return getCode().getKind();
    }

    /**
     * Path that triggered the error, as passed by the caller.
     */
    public String getPath() {
        Object path = getContext().get("path");
        return path != null ? path.toString() : null;
    }

    /**
     * Factory: project root does not exist
     */
    public static NtsBoundaryException rootNotFound(Path root) {
        return new NtsBoundaryException(NtsErrorCode.ROOT_NOT_FOUND, root);
    }

    /**
     * Factory: project root is a file
     */
    public static NtsBoundaryException rootNotDirectory(Path root) {
        return new NtsBoundaryException(NtsErrorCode.ROOT_NOT_DIRECTORY, root);
    }

    /**
     * Factory: project root is a system directory
     */
    public static NtsBoundaryException rootForbidden(Path root, String forbiddenEntry) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("path", root.toString());
        ctx.put("forbidden", forbiddenEntry);
        return new NtsBoundaryException(NtsErrorCode.ROOT_FORBIDDEN, ctx);
    }
}
