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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValidatePathToolTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private ToolFixture fixture;
    private ValidatePathTool tool;

    @BeforeEach
    void setUp(@TempDir Path base) throws IOException {
        fixture = new ToolFixture(base);
        tool = new ValidatePathTool(fixture.session);
    }

    private JsonNode check(String path) {
        return tool.executeWithFeedback(mapper.createObjectNode().put("path", path));
    }

    @Test
    void regularFile() {
        assertEquals("Path is inside the project root.\nResolved: src/Main.java\nType: file\nSensitive: no",
                ToolFixture.text(check("src/../src/./Main.java")));
    }

    @Test
    void absolutePathInsideRoot() {
        String text = ToolFixture.text(check(fixture.project.resolve("config").toString()));
        assertTrue(text.contains("Resolved: config\nType: directory"));
    }

    @Test
    void sensitivePathIsMarked() {
        assertTrue(ToolFixture.text(check(".env")).endsWith("Sensitive: yes (Environment variables)"));
        assertTrue(ToolFixture.text(check(".ssh/id_rsa")).endsWith("Sensitive: yes (In sensitive directory: .ssh)"));
    }

    @Test
    void missingPath() {
        JsonNode strict = check("docs/guide.md");
        assertTrue(ToolFixture.isError(strict));
        assertTrue(ToolFixture.text(strict).startsWith("Error [PATH_NOT_FOUND]"));

        var lenient = mapper.createObjectNode().put("path", "docs/guide.md").put("mustExist", false);
        String text = ToolFixture.text(tool.executeWithFeedback(lenient));
        assertTrue(text.contains("Resolved: docs/guide.md\nType: missing"));
    }

    @Test
    void escapeIsSecurityViolation() {
        JsonNode res = check("../outside/secret.txt");
        assertTrue(ToolFixture.isError(res));
        assertEquals("Error [SECURITY_VIOLATION]: Access denied: the path is outside the project root.", ToolFixture.text(res));
        assertFalse(ToolFixture.text(res).contains("secret.txt"));
    }

    @Test
    void externalSymlinkDependsOnFollowMode() throws IOException {
        fixture.symlink("leak.txt", fixture.outside.resolve("secret.txt"));

        assertTrue(ToolFixture.text(check("leak.txt")).startsWith("Error [SYMLINK_OUTSIDE_ROOT]"));

        var follow = mapper.createObjectNode().put("path", "leak.txt").put("followSymlinks", true);
        assertTrue(ToolFixture.text(tool.executeWithFeedback(follow)).startsWith("Error [SECURITY_VIOLATION]"));
    }

    @Test
    void internalSymlinkShowsTarget() throws IOException {
        fixture.symlink("main-link", fixture.project.resolve("src/Main.java"));
        assertTrue(ToolFixture.text(check("main-link")).contains("Resolved: src/Main.java\nType: file"));
    }

    @Test
    void pathIsRequired() {
        JsonNode res = tool.executeWithFeedback(mapper.createObjectNode());
        assertTrue(ToolFixture.isError(res));
        assertTrue(ToolFixture.text(res).startsWith("Error [PARAM_MISSING]"));
        assertTrue(ToolFixture.text(res).contains("'path'"));
    }
}
