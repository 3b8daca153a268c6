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
package ru.nts.tools.scan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;
import ru.nts.tools.scan.core.NtsException;
import ru.nts.tools.scan.tools.McpRouter;
import ru.nts.tools.scan.tools.ScanSession;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Точка входа командной строки.
 * Корень проекта: {@code --root}, иначе переменная окружения PROJECT_ROOT, иначе текущая директория.
 * Коды выхода: 0 успех, 1 ошибка инструмента или корня, 2 неверные аргументы.
 */
@Command(
        name = "nts-scan",
        mixinStandardHelpOptions = true,
        version = "nts-project-scan 1.0.0",
        description = "Scan a project directory without leaving its root or reading sensitive files."
)
public class ProjectScanCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ProjectScanCli.class);

    @Spec
    CommandSpec spec;

    @Option(names = "--root", description = "Project root (default: $PROJECT_ROOT or the working directory).")
    Path root;

    @Option(names = "--max-depth", description = "Maximum directory depth (default: unlimited for scans, 3 for --tree).")
    Integer maxDepth;

    @Option(names = "--max-files", defaultValue = "0", description = "Stop after this many analyzed files (0 = unlimited).")
    int maxFiles;

    @Option(names = "--json", description = "Print the scan result as JSON.")
    boolean json;

    @Option(names = "--audit", description = "List sensitive files and directories instead of scanning.")
    boolean audit;

    @Option(names = "--tree", description = "Print the project tree instead of scanning.")
    boolean tree;

    private final Function<String, String> environment;

    public ProjectScanCli() {
        this(System::getenv);
    }

    ProjectScanCli(Function<String, String> environment) {
        this.environment = environment;
    }

    @Override
    public Integer call() {
        if (audit && tree) {
            throw new ParameterException(spec.commandLine(), "--audit and --tree cannot be combined");
        }
        if (maxDepth != null && maxDepth < 0) {
            throw new ParameterException(spec.commandLine(), "--max-depth must be >= 0, got " + maxDepth);
        }
        if (maxFiles < 0) {
            throw new ParameterException(spec.commandLine(), "--max-files must be >= 0, got " + maxFiles);
        }

        Path projectRoot = resolveRoot();
        ScanSession session;
        try {
            session = new ScanSession(projectRoot);
        } catch (NtsException e) {
            log.error("Invalid project root: {}", e.toLogMessage());
            spec.commandLine().getErr().println(e.toUserMessage());
            return 1;
        }

        ObjectMapper mapper = new ObjectMapper();
        McpRouter router = session.createRouter(mapper);
        ObjectNode params = mapper.createObjectNode();
        String toolName;
        if (audit) {
            toolName = "nts_sensitive_audit";
        } else if (tree) {
            toolName = "nts_project_tree";
            if (maxDepth != null) {
                params.put("maxDepth", maxDepth);
            }
        } else {
            toolName = "nts_scan_project";
            if (maxDepth != null) {
                params.put("maxDepth", maxDepth);
            }
            params.put("maxFiles", maxFiles);
            params.put("format", json ? "json" : "markdown");
        }

        JsonNode response = router.callTool(toolName, params);
        String text = response.path("content").path(0).path("text").asText();
        if (response.path("isError").asBoolean(false)) {
            spec.commandLine().getErr().println(text);
            return 1;
        }
        spec.commandLine().getOut().println(text);
        return 0;
    }

    private Path resolveRoot() {
        if (root != null) {
            return root;
        }
        String fromEnv = environment.apply("PROJECT_ROOT");
        if (fromEnv != null && !fromEnv.isBlank()) {
            log.info("Project root set from PROJECT_ROOT env: {}", fromEnv);
            return Path.of(fromEnv);
        }
        Path cwd = Path.of("").toAbsolutePath();
        log.info("No PROJECT_ROOT env found, using CWD as root: {}", cwd);
        return cwd;
    }

    public static void main(String[] args) {
        // Вывод дерева и путей с кириллицей не должен зависеть от кодировки консоли
        System.setOut(new PrintStream(System.out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(System.err, true, StandardCharsets.UTF_8));

        int exitCode = new CommandLine(new ProjectScanCli()).execute(args);
        System.exit(exitCode);
    }
}
