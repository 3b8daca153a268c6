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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Реестр инструментов и маршрутизация вызовов по имени.
 */
public class McpRouter {

    private static final Logger log = LoggerFactory.getLogger(McpRouter.class);

    /**
     * Инструменты по имени; порядок имен определяет порядок в {@link #listTools()}.
     */
    private final Map<String, McpTool> tools = new TreeMap<>();

    private final ObjectMapper mapper;

    public McpRouter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Регистрирует инструмент. Инструмент с тем же именем заменяется.
     */
    public void registerTool(McpTool tool) {
        if (tools.put(tool.getName(), tool) != null) {
            log.warn("Tool {} registered twice, previous instance replaced", tool.getName());
        }
    }

    /**
     * Описание всех инструментов: {@code {"tools":[{name, description, category, inputSchema}]}}.
     */
    public JsonNode listTools() {
        ArrayNode toolsArray = mapper.createArrayNode();
        for (McpTool tool : tools.values()) {
            ObjectNode toolNode = toolsArray.addObject();
            toolNode.put("name", tool.getName());
            toolNode.put("description", "[" + tool.getCategory().toUpperCase(Locale.ROOT) + "] " + tool.getDescription());
            toolNode.put("category", tool.getCategory());
            toolNode.set("inputSchema", tool.getInputSchema());
        }
        ObjectNode result = mapper.createObjectNode();
        result.set("tools", toolsArray);
        return result;
    }

    /**
     * Вызывает инструмент по имени. Ошибки выполнения возвращаются в ответе, а не исключением.
     *
     * @throws IllegalArgumentException если инструмент не зарегистрирован.
     */
    public JsonNode callTool(String name, JsonNode params) {
        McpTool tool = getTool(name);
        if (tool == null) {
            throw new IllegalArgumentException("Tool not found: " + name);
        }
        log.debug("Calling tool {} with {}", name, params);
        return tool.executeWithFeedback(params == null ? mapper.createObjectNode() : params);
    }

    /**
     * @return Инструмент или null, если он не зарегистрирован.
     */
    public McpTool getTool(String name) {
        return tools.get(name);
    }
}
