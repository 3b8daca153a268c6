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
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.scan.analysis.ProjectScanner;
import ru.nts.tools.scan.analysis.ScanOptions;
import ru.nts.tools.scan.analysis.ScanResult;
import ru.nts.tools.scan.core.BoundedTreeWalker;

import java.nio.file.Path;

/**
 * Сканирование проекта: статистика файлов, пропущенные чувствительные и недоступные пути.
 * Формат вывода: markdown-отчет или JSON.
 */
public class ScanProjectTool implements McpTool {

    private final ObjectMapper mapper = new ObjectMapper();

    private final ScanSession session;

    public ScanProjectTool(ScanSession session) {
        this.session = session;
    }

    @Override
    public String getName() {
        return "nts_scan_project";
    }

    @Override
    public String getDescription() {
        return "Scan the project tree inside its root: file counts, size, lines, extensions. Sensitive files are never read.";
    }

    @Override
    public String getCategory() {
        return "analysis";
    }

    @Override
    public JsonNode getInputSchema() {
        var schema = mapper.createObjectNode();
        schema.put("type", "object");
        var props = schema.putObject("properties");
        props.putObject("path").put("type", "string").put("description", "Directory to scan, relative to project root (default: root).");
        props.putObject("maxDepth").put("type", "integer").put("minimum", 0).put("description", "Maximum directory depth (default: unlimited).");
        props.putObject("maxFiles").put("type", "integer").put("minimum", 0).put("description", "Stop after this many analyzed files (0 = unlimited).");
        props.putObject("skipSensitive").put("type", "boolean").put("description", "Skip sensitive files (default: true).");
        var format = props.putObject("format");
        format.put("type", "string");
        format.putArray("enum").add("markdown").add("json");
        format.put("description", "Output format (default: markdown).");
        return schema;
    }

    @Override
    public JsonNode execute(JsonNode params) throws Exception {
        Path start = session.resolveDirectory(params.path("path").asText("."));
        String format = params.path("format").asText("markdown");
        if (!format.equals("markdown") && !format.equals("json")) {
            throw new IllegalArgumentException("Unknown format '" + format + "'. Use 'markdown' or 'json'.");
        }

        ScanOptions options = ScanOptions.builder()
                .maxDepth(ScanSession.optionalCount(params, "maxDepth", BoundedTreeWalker.UNBOUNDED))
                .maxFiles(ScanSession.optionalCount(params, "maxFiles", 0))
                .skipSensitive(params.path("skipSensitive").asBoolean(true))
                .build();

        ScanResult result = new ProjectScanner(session.getValidator(), options, session.getClassifier()).scan(start);

        if (format.equals("json")) {
            ObjectNode json = result.toJson(mapper);
            return McpTool.textResponse(mapper, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(json));
        }
        return McpTool.textResponse(mapper, result.toMarkdown());
    }
}
