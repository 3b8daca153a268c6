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
import ru.nts.tools.scan.core.BoundedTreeWalker;
import ru.nts.tools.scan.core.NtsBoundaryException;
import ru.nts.tools.scan.core.NtsErrorCode;
import ru.nts.tools.scan.core.NtsException;
import ru.nts.tools.scan.core.PathBoundaryValidator;
import ru.nts.tools.scan.core.sensitive.SensitiveContentClassifier;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Общее состояние инструментов одного корня проекта: валидатор, обходчик и классификатор.
 * Создается один раз и разделяется всеми инструментами; изменяемого состояния не имеет.
 */
public class ScanSession {

    private final PathBoundaryValidator validator;
    private final BoundedTreeWalker walker;
    private final SensitiveContentClassifier classifier;

    /**
     * @throws NtsBoundaryException если корень непригоден.
     */
    public ScanSession(Path projectRoot) {
        this(new PathBoundaryValidator(projectRoot), new SensitiveContentClassifier());
    }

    public ScanSession(PathBoundaryValidator validator, SensitiveContentClassifier classifier) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.walker = new BoundedTreeWalker(validator);
    }

    public PathBoundaryValidator getValidator() {
        return validator;
    }

    public BoundedTreeWalker getWalker() {
        return walker;
    }

    public SensitiveContentClassifier getClassifier() {
        return classifier;
    }

    public Path getRoot() {
        return validator.getRoot();
    }

    /**
     * Строго проверяет директорию, переданную параметром инструмента.
     *
     * @param pathParam Путь относительно корня или абсолютный.
     *
     * @return Канонический путь директории.
     *
     * @throws NtsBoundaryException вне корня, не существует или не директория.
     */
    public Path resolveDirectory(String pathParam) {
        Path directory = validator.validate(Path.of(pathParam));
        if (!Files.isDirectory(directory)) {
            throw new NtsBoundaryException(NtsErrorCode.NOT_A_DIRECTORY, Path.of(pathParam));
        }
        return directory;
    }

    /**
     * Путь относительно корня для вывода пользователю.
     */
    public String display(Path canonicalPath) {
        return validator.getContext().relativize(canonicalPath);
    }

    /**
     * Роутер со всеми инструментами сканирования этого корня.
     */
    public McpRouter createRouter(ObjectMapper mapper) {
        McpRouter router = new McpRouter(mapper);
        router.registerTool(new ScanProjectTool(this));
        router.registerTool(new SensitiveAuditTool(this));
        router.registerTool(new ValidatePathTool(this));
        router.registerTool(new ProjectTreeTool(this));
        return router;
    }

    /**
     * Обязательный строковый параметр.
     *
     * @throws NtsException с кодом {@link NtsErrorCode#PARAM_MISSING}, если параметр не передан.
     */
    static String requireText(JsonNode params, String name) {
        JsonNode node = params.get(name);
        if (node == null || node.isNull() || node.asText().isBlank()) {
            throw new NtsException(NtsErrorCode.PARAM_MISSING, "param", name);
        }
        return node.asText();
    }

    /**
     * Необязательный неотрицательный целочисленный параметр.
     *
     * @throws IllegalArgumentException если значение не целое или отрицательное.
     */
    static int optionalCount(JsonNode params, String name, int defaultValue) {
        JsonNode node = params.get(name);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.canConvertToInt()) {
            throw new IllegalArgumentException("'" + name + "' must be an integer, got: " + node);
        }
        int value = node.asInt();
        if (value < 0) {
            throw new IllegalArgumentException("'" + name + "' must be >= 0, got: " + value);
        }
        return value;
    }
}
