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
package ru.nts.tools.scan.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import ru.nts.tools.scan.core.sensitive.SensitivityVerdict;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Проверка пути на принадлежность проекту с выводом канонической формы.
 */
public class ValidatePathTool implements McpTool {

    private final ObjectMapper mapper = new ObjectMapper();

    private final ScanSession session;

    public ValidatePathTool(ScanSession session) {
        this.session = session;
    }

    @Override
    public String getName() {
        return "nts_validate_path";
    }

    @Override
    public String getDescription() {
        return "Check that a path stays inside the project root after resolving '..' and symlinks.";
    }

    @Override
    public String getCategory() {
        return "security";
    }

    @Override
    public JsonNode getInputSchema() {
        var schema = mapper.createObjectNode();
        schema.put("type", "object");
        var props = schema.putObject("properties");
        props.putObject("path").put("type", "string").put("description", "Path to check, relative to project root or absolute.");
        props.putObject("mustExist").put("type", "boolean").put("description", "Require the path to exist (default: true).");
        props.putObject("followSymlinks").put("type", "boolean").put("description", "Treat a symlink leaving the root as an attack (default: false).");
        schema.putArray("required").add("path");
        return schema;
    }

    @Override
    public JsonNode execute(JsonNode params) throws Exception {
        String pathStr = ScanSession.requireText(params, "path");
        boolean mustExist = params.path("mustExist").asBoolean(true);
        boolean followSymlinks = params.path("followSymlinks").asBoolean(false);

        Path canonical = session.getValidator().validate(Path.of(pathStr), mustExist, followSymlinks);
        String relative = session.display(canonical);
        SensitivityVerdict verdict = session.getClassifier().classify(session.getRoot().relativize(canonical));

        StringBuilder sb = new StringBuilder();
        sb.append("Path is inside the project root.\n");
        sb.append("Resolved: ").append(relative).append("\n");
        sb.append("Type: ").append(typeOf(canonical)).append("\n");
        sb.append("Sensitive: ").append(verdict.sensitive() ? "yes (" + verdict.reason() + ")" : "no");
        return McpTool.textResponse(mapper, sb.toString());
    }

    private static String typeOf(Path path) {
        if (Files.isDirectory(path)) {
            return "directory";
        }
        if (Files.isRegularFile(path)) {
            return "file";
        }
        return Files.exists(path) ? "other" : "missing";
    }
}
