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
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Валидация JSON Schema параметров всех инструментов (Draft-07).
 */
class ToolSchemaValidationTest {

    private static final ObjectMapper mapper = new ObjectMapper();

    private static final Set<String> VALID_TYPES = Set.of("object", "array", "string", "integer", "number", "boolean", "null");

    private static final String META_SCHEMA = """
            {
              "$schema": "http://json-schema.org/draft-07/schema#",
              "type": "object",
              "required": ["type"],
              "properties": {
                "type": { "type": "string", "enum": ["object", "array", "string", "integer", "number", "boolean", "null"] },
                "properties": { "type": "object" },
                "required": { "type": "array", "items": { "type": "string" } },
                "items": { "type": "object" },
                "description": { "type": "string" },
                "enum": { "type": "array" },
                "default": {}
              }
            }
            """;

    private static Path root;
    private static JsonSchema metaSchema;

    @BeforeAll
    static void setup() throws IOException {
        metaSchema = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7).getSchema(mapper.readTree(META_SCHEMA));
    }

    @AfterAll
    static void cleanup() throws IOException {
        if (root != null) {
            try (Stream<Path> paths = Files.walk(root)) {
                for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                    Files.delete(path);
                }
            }
        }
    }

    static Stream<McpTool> toolProvider() throws IOException {
        if (root == null) {
            root = Files.createTempDirectory("schema-project");
        }
        ScanSession session = new ScanSession(root);
        return Stream.of(
                new ScanProjectTool(session),
                new SensitiveAuditTool(session),
                new ValidatePathTool(session),
                new ProjectTreeTool(session));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("toolProvider")
    void schemaHasTypeObject(McpTool tool) {
        JsonNode schema = tool.getInputSchema();
        assertTrue(schema.isObject(), "Schema should be an object for tool: " + tool.getName());
        assertEquals("object", schema.path("type").asText(), "Schema type must be 'object' for tool: " + tool.getName());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("toolProvider")
    void schemaIsValidAgainstMetaSchema(McpTool tool) {
        Set<ValidationMessage> errors = metaSchema.validate(tool.getInputSchema());

        assertTrue(errors.isEmpty(),
                "Tool '" + tool.getName() + "' schema validation errors:\n" +
                        errors.stream()
                                .map(ValidationMessage::getMessage)
                                .reduce("", (a, b) -> a + "\n  - " + b));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("toolProvider")
    void arraysHaveItemsAndTypesAreValid(McpTool tool) {
        List<String> violations = new ArrayList<>();
        checkRecursively(tool.getInputSchema(), "", violations);

        assertTrue(violations.isEmpty(),
                "Tool '" + tool.getName() + "' has schema violations:\n" + String.join("\n", violations));
    }

    private void checkRecursively(JsonNode node, String path, List<String> violations) {
        if (node == null || !node.isObject()) {
            return;
        }
        String where = path.isEmpty() ? "root" : path;

        if (node.has("type")) {
            String type = node.get("type").asText();
            if (!VALID_TYPES.contains(type)) {
                violations.add("  - " + where + ": invalid type '" + type + "'");
            }
            if ("array".equals(type) && !node.has("items")) {
                violations.add("  - " + where + ": type=array but no 'items' defined");
            }
        }

        if (node.has("properties")) {
            Iterator<String> fieldNames = node.get("properties").fieldNames();
            while (fieldNames.hasNext()) {
                String fieldName = fieldNames.next();
                checkRecursively(node.get("properties").get(fieldName), path.isEmpty() ? fieldName : path + "." + fieldName, violations);
            }
        }

        if (node.has("items")) {
            checkRecursively(node.get("items"), path + ".items", violations);
        }
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("toolProvider")
    void requiredFieldsExistInProperties(McpTool tool) {
        JsonNode schema = tool.getInputSchema();
        if (!schema.has("required")) {
            return;
        }
        for (JsonNode field : schema.get("required")) {
            assertTrue(schema.path("properties").has(field.asText()),
                    "Tool '" + tool.getName() + "' requires unknown property: " + field.asText());
        }
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("toolProvider")
    void toolHasNameDescriptionAndCategory(McpTool tool) {
        assertTrue(tool.getName().startsWith("nts_"));
        assertFalse(tool.getDescription().isBlank(), "Tool '" + tool.getName() + "' description must not be blank");
        assertFalse(tool.getCategory().isBlank(), "Tool '" + tool.getName() + "' category must not be blank");
    }
}
