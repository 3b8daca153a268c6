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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Результат сканирования проекта.
 * Все пути (чувствительные и недоступные) записаны относительно корня, через '/'.
 */
public record ScanResult(Instant timestamp,
                         Path projectPath,
                         ProjectStats stats,
                         List<String> sensitiveFilesSkipped,
                         List<String> inaccessiblePaths,
                         List<String> warnings,
                         boolean limitReached) {

    /**
     * Сколько чувствительных файлов перечисляется в отчете.
     */
    static final int SENSITIVE_PREVIEW_LIMIT = 10;

    private static final DateTimeFormatter GENERATED_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    public ScanResult {
        sensitiveFilesSkipped = List.copyOf(sensitiveFilesSkipped);
        inaccessiblePaths = List.copyOf(inaccessiblePaths);
        warnings = List.copyOf(warnings);
    }

    /**
     * Markdown-отчет для человека или LLM-клиента.
     */
    public String toMarkdown() {
        List<String> lines = new ArrayList<>();
        lines.add("# Project Scan Report");
        lines.add("");
        lines.add("**Generated**: " + GENERATED_FORMAT.format(timestamp));
        lines.add("**Project**: " + projectPath);
        lines.add("");
        lines.add("## Project Statistics");
        lines.add("");
        lines.add("- **Total Files**: " + stats.totalFiles());
        lines.add("- **Files Analyzed**: " + stats.filesAnalyzed());
        lines.add(String.format(Locale.ROOT, "- **Total Size**: %,d bytes", stats.totalSizeBytes()));
        lines.add(String.format(Locale.ROOT, "- **Total Lines**: %,d", stats.totalLines()));
        lines.add("- **Has Tests**: " + yesNo(stats.hasTests()));
        lines.add("- **Git Repository**: " + yesNo(stats.gitRepository()));
        lines.add("");
        lines.add("### Files by Extension");
        lines.add("");
        if (stats.filesByExtension().isEmpty()) {
            lines.add("(none)");
        }
        for (Map.Entry<String, Integer> entry : stats.filesByExtension().entrySet()) {
            lines.add("- `" + entry.getKey() + "`: " + entry.getValue() + " files");
        }

        if (!sensitiveFilesSkipped.isEmpty()) {
            lines.add("");
            lines.add("## Sensitive Files Skipped");
            lines.add("");
            lines.add("For privacy and security, " + sensitiveFilesSkipped.size() + " sensitive files were not analyzed:");
            lines.add("");
            for (String file : sensitiveFilesSkipped.subList(0, Math.min(SENSITIVE_PREVIEW_LIMIT, sensitiveFilesSkipped.size()))) {
                lines.add("- " + file);
            }
            if (sensitiveFilesSkipped.size() > SENSITIVE_PREVIEW_LIMIT) {
                lines.add("- ... and " + (sensitiveFilesSkipped.size() - SENSITIVE_PREVIEW_LIMIT) + " more");
            }
        }

        if (!inaccessiblePaths.isEmpty() || !warnings.isEmpty() || limitReached) {
            lines.add("");
            lines.add("## Scan Notes");
            lines.add("");
            if (limitReached) {
                lines.add("- File limit reached after " + stats.filesAnalyzed() + " files; the scan is partial.");
            }
            for (String path : inaccessiblePaths) {
                lines.add("- Inaccessible: " + path);
            }
            for (String warning : warnings) {
                lines.add("- " + warning);
            }
        }

        lines.add("");
        lines.add(summary());
        return String.join("\n", lines);
    }

    /**
     * Однострочная сводка пропусков.
     */
    public String summary() {
        return sensitiveFilesSkipped.size() + " sensitive files skipped, " + inaccessiblePaths.size() + " paths inaccessible";
    }

    /**
     * JSON-представление результата.
     */
    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode root = mapper.createObjectNode();
        root.put("timestamp", timestamp.toString());
        root.put("projectPath", projectPath.toString());

        ObjectNode statsNode = root.putObject("stats");
        statsNode.put("totalFiles", stats.totalFiles());
        statsNode.put("filesAnalyzed", stats.filesAnalyzed());
        statsNode.put("totalSizeBytes", stats.totalSizeBytes());
        statsNode.put("totalLines", stats.totalLines());
        statsNode.put("hasTests", stats.hasTests());
        statsNode.put("gitRepository", stats.gitRepository());
        ObjectNode byExtension = statsNode.putObject("filesByExtension");
        stats.filesByExtension().forEach(byExtension::put);

        fill(root.putArray("sensitiveFilesSkipped"), sensitiveFilesSkipped);
        fill(root.putArray("inaccessiblePaths"), inaccessiblePaths);
        fill(root.putArray("warnings"), warnings);
        root.put("limitReached", limitReached);
        return root;
    }

    private static void fill(ArrayNode array, List<String> values) {
        values.forEach(array::add);
    }

    private static String yesNo(boolean value) {
        return value ? "Yes" : "No";
    }
}
