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

import java.util.Map;

/**
 * Structured error codes for NTS project scanning.
 * Each error has a human-readable message, a solution hint and the boundary kind
 * that decides whether it aborts the operation or is skipped.
 *
 * <p>Example usage in tool output:
 * <pre>
 * [ERROR: PATH_OUTSIDE_ROOT]
 * Message: Path resolves outside of project root
 * Solution: Use a path inside the project root.
 * Context: path=../secret.txt
 * </pre>
 */
public enum NtsErrorCode {

    // ============ Root Errors ============

    ROOT_NOT_FOUND("Project root does not exist",
            "Check the project path '%path%'.",
            BoundaryErrorKind.INVALID_ROOT),

    ROOT_NOT_DIRECTORY("Project root is not a directory",
            "Point the scanner at a directory, not at a file.",
            BoundaryErrorKind.INVALID_ROOT),

    ROOT_FORBIDDEN("Cannot analyze system directory",
            "System directories are forbidden for security. Choose a project directory.",
            BoundaryErrorKind.INVALID_ROOT),

    // ============ Boundary Errors ============

    PATH_OUTSIDE_ROOT("Path resolves outside of project root",
            "Use a path inside the project root.",
            BoundaryErrorKind.BOUNDARY_VIOLATION),

    SYMLINK_ATTACK("Symlink attack detected",
            "The link target is outside of project root. Links leaving the project are never followed.",
            BoundaryErrorKind.BOUNDARY_VIOLATION),

    // ============ Inaccessible Paths ============

    PATH_NOT_FOUND("Path does not exist",
            "Check the path. It may have been deleted during the scan.",
            BoundaryErrorKind.INACCESSIBLE),

    NOT_A_DIRECTORY("Not a directory",
            "Provide a directory path.",
            BoundaryErrorKind.INACCESSIBLE),

    SYMLINK_OUTSIDE_ROOT("Symlink points outside of project root",
            "The link was skipped. Its target is not part of the project.",
            BoundaryErrorKind.INACCESSIBLE),

    PERMISSION_DENIED("Permission denied",
            "Check file permissions. The path was skipped.",
            BoundaryErrorKind.INACCESSIBLE),

    IO_ERROR("I/O error occurred",
            "Check disk state and permissions. The path was skipped.",
            BoundaryErrorKind.INACCESSIBLE),

    // ============ Parameter Errors ============

    PARAM_MISSING("Required parameter missing",
            "Provide the required parameter '%param%'. Check tool documentation.",
            null),

    PARAM_INVALID("Invalid parameter value",
            "Check parameter type and format. Refer to tool documentation.",
            null),

    // ============ System Errors ============

    INTERNAL_ERROR("Internal error",
            "Unexpected error. Check logs for details.",
            null);

    private final String message;
    private final String solution;
    private final BoundaryErrorKind kind;

    NtsErrorCode(String message, String solution, BoundaryErrorKind kind) {
        this.message = message;
        this.solution = solution;
        this.kind = kind;
    }

    public String getMessage() {
        return message;
    }

    public String getSolution() {
        return solution;
    }

    /**
     * Boundary kind of this code, or null for codes outside the boundary model (parameters, internal errors).
     */
    public BoundaryErrorKind getKind() {
        return kind;
    }

    public boolean isKind(BoundaryErrorKind expected) {
        return kind == expected;
    }

    /**
     * Formats error message with optional context.
     *
     * @param context Optional context map (path, target, etc.)
     * @return Formatted error string
     */
    public String format(Map<String, Object> context) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[ERROR: %s]\n", this.name()));
        sb.append(String.format("Message: %s\n", message));

        // Интерполяция %placeholder% в solution
        String resolvedSolution = solution;
        if (context != null) {
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                resolvedSolution = resolvedSolution.replace(
                        "%" + entry.getKey() + "%", String.valueOf(entry.getValue()));
            }
        }
        resolvedSolution = resolvedSolution.replaceAll("%\\w+%", "...");
        sb.append(String.format("Solution: %s", resolvedSolution));

        if (context != null && !context.isEmpty()) {
            sb.append("\nContext: ");
            boolean first = true;
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(entry.getKey()).append("=").append(entry.getValue());
                first = false;
            }
        }

        return sb.toString();
    }

    public String format() {
        return format(null);
    }
}
