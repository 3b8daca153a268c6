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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of validating one candidate path: either a canonical path inside the project root
 * or a typed failure. Produced per call and never thrown; {@link #orElseThrow()} is the
 * single place where a failure becomes an exception.
 */
public final class PathResolution {

    private final Path path;
    private final NtsErrorCode error;
    private final Map<String, Object> context;

    private PathResolution(Path path, NtsErrorCode error, Map<String, Object> context) {
        this.path = path;
        this.error = error;
        this.context = context;
    }

    public static PathResolution success(Path canonicalPath) {
        return new PathResolution(Objects.requireNonNull(canonicalPath), null, Collections.emptyMap());
    }

    public static PathResolution failure(NtsErrorCode error, Path candidate) {
        return failure(error, candidate, null, null);
    }

    /**
     * @param resolved Canonical form of the candidate, when resolution got that far.
     * @param detail   Low-level cause (exception text, link target), may be null.
     */
    public static PathResolution failure(NtsErrorCode error, Path candidate, Path resolved, String detail) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("path", String.valueOf(candidate));
        if (resolved != null) {
            ctx.put("resolved", resolved.toString());
        }
        if (detail != null) {
            ctx.put("detail", detail);
        }
        return new PathResolution(null, Objects.requireNonNull(error), Collections.unmodifiableMap(ctx));
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @throws IllegalStateException if this is a failure.
     */
    public Path getPath() {
        if (path == null) {
            throw new IllegalStateException("No path in failed resolution: " + error);
        }
        return path;
    }

    public NtsErrorCode getError() {
        return error;
    }

    public BoundaryErrorKind getKind() {
        return error != null ? error.getKind() : null;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public String getDetail() {
        Object detail = context.get("detail");
        return detail != null ? detail.toString() : null;
    }

    /**
     * Returns the canonical path or throws the failure.
     *
     * @throws NtsBoundaryException carrying the failure code and context.
     */
    public Path orElseThrow() {
        if (error != null) {
            throw new NtsBoundaryException(error, context);
        }
        return path;
    }

    @Override
    public String toString() {
        return isSuccess() ? "PathResolution[" + path + "]" : "PathResolution[" + error + " " + context + "]";
    }
}
