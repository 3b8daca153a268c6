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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProjectScanCliTest {

    @TempDir
    Path base;

    private Path project;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        project = Files.createDirectory(base.resolve("project")).toRealPath();
        Files.writeString(project.resolve(".env"), "API_KEY=secret123\n");
        Files.writeString(project.resolve("README.md"), "# Project\n");
        Files.createDirectories(project.resolve("src"));
        Files.writeString(project.resolve("src/Main.java"), "class Main {\n}\n");
    }

    private int run(Map<String, String> env, String... args) {
        out = new StringWriter();
        err = new StringWriter();
        CommandLine cmd = new CommandLine(new ProjectScanCli(env::get));
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private int run(String... args) {
        return run(Map.of(), args);
    }

    @Test
    void scanPrintsMarkdownReport() {
        assertEquals(0, run("--root", project.toString()));
        assertTrue(out.toString().contains("# Project Scan Report"));
        assertTrue(out.toString().contains("- **Files Analyzed**: 2"));
        assertTrue(out.toString().contains("1 sensitive files skipped, 0 paths inaccessible"));
    }

    @Test
    void scanPrintsJson() throws IOException {
        assertEquals(0, run("--root", project.toString(), "--json", "--max-files", "1"));

        JsonNode json = new ObjectMapper().readTree(out.toString());
        assertEquals(1, json.get("stats").get("filesAnalyzed").asInt());
        assertTrue(json.get("limitReached").asBoolean());
    }

    @Test
    void auditMode() {
        assertEquals(0, run("--root", project.toString(), "--audit"));
        assertTrue(out.toString().startsWith("Sensitive audit of . (recursive)"));
        assertTrue(out.toString().contains("- [file] .env: Environment variables"));
    }

    @Test
    void treeMode() {
        assertEquals(0, run("--root", project.toString(), "--tree", "--max-depth", "1"));
        assertTrue(out.toString().startsWith("project/\n"));
        assertTrue(out.toString().contains("├── .env  [sensitive]"));
        assertTrue(out.toString().contains("1 directories, 2 files"));
    }

    @Test
    void rootFromEnvironment() {
        assertEquals(0, run(Map.of("PROJECT_ROOT", project.toString()), "--tree"));
        assertTrue(out.toString().startsWith("project/\n"));
    }

    @Test
    void optionWinsOverEnvironment() throws IOException {
        Path other = Files.createDirectory(base.resolve("other"));
        assertEquals(0, run(Map.of("PROJECT_ROOT", other.toString()), "--tree", "--root", project.toString()));
        assertTrue(out.toString().startsWith("project/\n"));
    }

    @Test
    void invalidRootExitsWithOne() throws IOException {
        assertEquals(1, run("--root", base.resolve("missing").toString()));
        assertTrue(err.toString().contains("Project root does not exist"));

        Path file = Files.writeString(base.resolve("file.txt"), "x");
        assertEquals(1, run("--root", file.toString()));
        assertTrue(err.toString().contains("Project root is not a directory"));
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertEquals(2, run("--root", project.toString(), "--audit", "--tree"));
        assertTrue(err.toString().contains("--audit and --tree cannot be combined"));

        assertEquals(2, run("--root", project.toString(), "--max-depth", "-1"));
        assertEquals(2, run("--root", project.toString(), "--max-files", "-5"));
        assertEquals(2, run("--unknown"));
        assertEquals(2, run("--max-depth", "deep"));
    }

    @Test
    void versionAndHelp() {
        assertEquals(0, run("--version"));
        assertTrue(out.toString().contains("nts-project-scan 1.0.0"));

        assertEquals(0, run("--help"));
        assertTrue(out.toString().contains("--audit"));
    }
}
