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
import org.slf4j.LoggerFactory;
import ru.nts.tools.scan.core.BoundaryErrorKind;
import ru.nts.tools.scan.core.NtsBoundaryException;
import ru.nts.tools.scan.core.NtsException;

/**
 * Базовый интерфейс инструментов сканирования в модели MCP.
 * Ответ инструмента: {@code {"content":[{"type":"text","text":...}]}}, при ошибке с {@code "isError": true}.
 */
public interface McpTool {

    String getName();

    String getDescription();

    String getCategory();

    JsonNode getInputSchema();

    JsonNode execute(JsonNode params) throws Exception;

    /**
     * Обертка над execute: любое исключение превращается в ответ с {@code isError}.
     * Нарушение границы проекта описывается общим сообщением, без разрешенного пути.
     */
    default JsonNode executeWithFeedback(JsonNode params) {
        try {
            return execute(params);
        } catch (NtsBoundaryException e) {
            LoggerFactory.getLogger(getClass()).warn("{} failed: {}", getName(), e.toLogMessage());
            if (e.getKind() == BoundaryErrorKind.BOUNDARY_VIOLATION) {
                return createErrorResponse("SECURITY_VIOLATION", "Access denied: the path is outside the project root.");
            }
            return createErrorResponse(e.getCode().name(), e.toUserMessage());
        } catch (NtsException e) {
            LoggerFactory.getLogger(getClass()).warn("{} failed: {}", getName(), e.toLogMessage());
            return createErrorResponse(e.getCode().name(), e.toUserMessage());
        } catch (IllegalArgumentException e) {
            return createErrorResponse("INVALID_ARGUMENTS", "Invalid request parameters: " + e.getMessage());
        } catch (java.io.IOException e) {
            return createErrorResponse("SYSTEM_ERROR", "System I/O error: " + e.getMessage());
        } catch (Exception e) {
            LoggerFactory.getLogger(getClass()).error("{} failed unexpectedly", getName(), e);
            return createErrorResponse("INTERNAL_BUG", "Internal error: " + e);
        }
    }

    /**
     * Успешный ответ с одним текстовым блоком.
     */
    static ObjectNode textResponse(ObjectMapper mapper, String text) {
        ObjectNode res = mapper.createObjectNode();
        res.putArray("content").addObject().put("type", "text").put("text", text);
        return res;
    }

    private JsonNode createErrorResponse(String type, String message) {
        ObjectNode res = textResponse(new ObjectMapper(), "Error [" + type + "]: " + message);
        res.put("isError", true);
        return res;
    }
}
