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
import ru.nts.tools.scan.core.sensitive.SensitiveContentClassifier;
import ru.nts.tools.scan.core.sensitive.SensitiveMatch;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Аудит чувствительных элементов директории.
 * Содержимое файлов не читается: решение принимается только по пути.
 */
public class SensitiveAuditTool implements McpTool {

    private final ObjectMapper mapper = new ObjectMapper();

    private final ScanSession session;

    public SensitiveAuditTool(ScanSession session) {
        this.session = session;
    }

    @Override
    public String getName() {
        return "nts_sensitive_audit";
    }

    @Override
    public String getDescription() {
        return "List sensitive files and directories (keys, credentials, env files) without reading them.";
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
        props.putObject("path").put("type", "string").put("description", "Directory to audit, relative to project root (default: root).");
        props.putObject("recursive").put("type", "boolean").put("description", "Descend into subdirectories (default: true).");

        var dirs = props.putObject("extraDirectories");
        dirs.put("type", "array");
        dirs.putObject("items").put("type", "string");
        dirs.put("description", "Additional directory names treated as sensitive.");

        var patterns = props.putObject("extraPatterns");
        patterns.put("type", "array");
        patterns.putObject("items").put("type", "string");
        patterns.put("description", "Additional file name regular expressions (case-insensitive).");
        return schema;
    }

    @Override
    public JsonNode execute(JsonNode params) throws Exception {
        Path directory = session.resolveDirectory(params.path("path").asText("."));
        boolean recursive = params.path("recursive").asBoolean(true);
        List<String> extraDirectories = stringList(params.path("extraDirectories"));
        List<String> extraPatterns = stringList(params.path("extraPatterns"));

        SensitiveContentClassifier classifier = session.getClassifier();
        if (!extraDirectories.isEmpty() || !extraPatterns.isEmpty()) {
            classifier = SensitiveContentClassifier.builder()
                    .addDirectories(extraDirectories)
                    .addPatterns(extraPatterns)
                    .build();
        }

        List<SensitiveMatch> matches = classifier.scanDirectory(directory, session.getRoot(), recursive);

        StringBuilder sb = new StringBuilder();
        sb.append("Sensitive audit of ").append(session.display(directory));
        sb.append(recursive ? " (recursive)" : " (top level only)").append("\n\n");
        if (matches.isEmpty()) {
            sb.append("No sensitive items found.");
            return McpTool.textResponse(mapper, sb.toString());
        }

        int files = 0;
        for (SensitiveMatch match : matches) {
            sb.append("- [").append(match.type().label()).append("] ")
                    .append(session.display(match.path()))
                    .append(": ").append(match.reason()).append("\n");
            if (match.type() == SensitiveMatch.EntryType.FILE) {
                files++;
            }
        }
        sb.append("\nFound ").append(matches.size()).append(" sensitive items (")
                .append(files).append(" files, ").append(matches.size() - files).append(" directories). ")
                .append("Their contents were not read.");
        return McpTool.textResponse(mapper, sb.toString());
    }

    private static List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                values.add(item.asText());
            }
        } else if (!node.isMissingNode() && !node.isNull()) {
            throw new IllegalArgumentException("Expected an array of strings, got: " + node);
        }
        return values;
    }
}
