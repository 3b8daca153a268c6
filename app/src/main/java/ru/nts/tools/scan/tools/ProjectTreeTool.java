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
import ru.nts.tools.scan.core.PathResolution;
import ru.nts.tools.scan.core.WalkEntry;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Визуализация структуры проекта в виде ASCII-дерева.
 *
 * Особенности:
 * 1. Дерево строится из шагов {@link ru.nts.tools.scan.core.BoundedTreeWalker}, поэтому в него
 *    попадают только элементы, прошедшие проверку границ.
 * 2. Чувствительные элементы помечаются {@code [sensitive]}; содержимое чувствительных директорий не показывается.
 * 3. Глубина ограничена параметром {@code maxDepth}.
 */
public class ProjectTreeTool implements McpTool {

    static final String SENSITIVE_MARK = "  [sensitive]";

    private final ObjectMapper mapper = new ObjectMapper();

    private final ScanSession session;

    public ProjectTreeTool(ScanSession session) {
        this.session = session;
    }

    @Override
    public String getName() {
        return "nts_project_tree";
    }

    @Override
    public String getDescription() {
        return "Generates an ASCII tree view of the project structure within the project root.";
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
        props.putObject("path").put("type", "string").put("description", "Root directory for the tree (default: project root).");
        props.putObject("maxDepth").put("type", "integer").put("minimum", 0).put("description", "Maximum recursion depth (default: 3).");
        return schema;
    }

    @Override
    public JsonNode execute(JsonNode params) throws Exception {
        Path start = session.resolveDirectory(params.path("path").asText("."));
        int maxDepth = ScanSession.optionalCount(params, "maxDepth", 3);

        // maxDepth - 1: элементы последнего уровня видны в списке родителя
        Map<Path, WalkEntry> entries = new HashMap<>();
        try (Stream<WalkEntry> walk = session.getWalker().walk(start, Math.max(0, maxDepth - 1))) {
            walk.forEach(entry -> entries.put(entry.directory(), entry));
        }

        StringBuilder sb = new StringBuilder();
        Path name = start.getFileName();
        sb.append(name == null ? start.toString() : name.toString()).append("/\n");

        int[] counts = new int[2];
        if (maxDepth > 0) {
            render(start, "", entries, sb, counts);
        }
        sb.append("\n").append(counts[0]).append(" directories, ").append(counts[1]).append(" files");
        return McpTool.textResponse(mapper, sb.toString());
    }

    private void render(Path directory, String prefix, Map<Path, WalkEntry> entries, StringBuilder sb, int[] counts) {
        WalkEntry entry = entries.get(directory);
        if (entry == null) {
            return;
        }

        List<Node> children = new ArrayList<>();
        entry.directories().forEach(d -> children.add(new Node(d, true)));
        entry.files().forEach(f -> children.add(new Node(f, false)));
        children.sort(Comparator.comparing(Node::name));

        for (int i = 0; i < children.size(); i++) {
            Node child = children.get(i);
            boolean last = i == children.size() - 1;
            Path childPath = entry.resolve(child.name());
            boolean sensitive = isSensitive(childPath);

            sb.append(prefix).append(last ? "└── " : "├── ").append(child.name());
            if (child.directory()) {
                sb.append("/");
                counts[0]++;
            } else {
                counts[1]++;
            }
            if (sensitive) {
                sb.append(SENSITIVE_MARK);
            }
            sb.append("\n");

            if (child.directory() && !sensitive) {
                render(childPath, prefix + (last ? "    " : "│   "), entries, sb, counts);
            }
        }
    }

    /**
     * Ссылка внутри корня помечается, если чувствительно ее имя или имя ее цели.
     */
    private boolean isSensitive(Path childPath) {
        Path root = session.getRoot();
        if (session.getClassifier().isSensitive(root.relativize(childPath))) {
            return true;
        }
        PathResolution resolution = session.getValidator().resolve(childPath, false, false);
        return resolution.isSuccess() && !resolution.getPath().equals(childPath)
                && session.getClassifier().isSensitive(root.relativize(resolution.getPath()));
    }

    private record Node(String name, boolean directory) {
    }
}
