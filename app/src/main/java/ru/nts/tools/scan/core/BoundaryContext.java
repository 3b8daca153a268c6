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
package ru.nts.tools.scan.core;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Неизменяемая граница сессии сканирования.
 * Создается один раз на сессию и разделяется (только для чтения) между валидатором,
 * обходчиком и любым количеством параллельных проверок.
 *
 * Инвариант: {@code root} канонический, существует, является директорией
 * и не лежит под запрещенным системным корнем.
 */
public final class BoundaryContext {

    /**
     * Канонический корень проекта.
     */
    private final Path root;

    /**
     * Запрещенные системные корни, с которыми сверялся {@link #root}.
     */
    private final List<String> forbiddenRoots;

    private BoundaryContext(Path root, List<String> forbiddenRoots) {
        this.root = root;
        this.forbiddenRoots = forbiddenRoots;
    }

    /**
     * Создает контекст со списком запрещенных корней по умолчанию.
     *
     * @param projectRoot Корень проекта (может быть относительным или содержать ссылки).
     *
     * @throws NtsBoundaryException с видом {@link BoundaryErrorKind#INVALID_ROOT}, если корень непригоден.
     */
    public static BoundaryContext of(Path projectRoot) {
        return of(projectRoot, ForbiddenRoots.DEFAULTS);
    }

    /**
     * Создает контекст с явным списком запрещенных корней.
     *
     * @throws NtsBoundaryException с видом {@link BoundaryErrorKind#INVALID_ROOT}, если корень непригоден.
     */
    public static BoundaryContext of(Path projectRoot, Collection<String> forbiddenRoots) {
        List<String> forbidden = List.copyOf(forbiddenRoots);
        return new BoundaryContext(checkRoot(projectRoot, forbidden), forbidden);
    }

    /**
     * Проверяет, что путь пригоден как корень проекта, не создавая контекст.
     *
     * @return Канонический корень.
     *
     * @throws NtsBoundaryException с видом {@link BoundaryErrorKind#INVALID_ROOT}, если корень непригоден.
     */
    public static Path validateProjectRoot(Path projectRoot) {
        return checkRoot(projectRoot, ForbiddenRoots.DEFAULTS);
    }

    public Path root() {
        return root;
    }

    public List<String> forbiddenRoots() {
        return forbiddenRoots;
    }

    /**
     * Проверка принадлежности канонического пути корню (включая сам корень).
     * Сравнение по сегментам через {@link Path#startsWith(Path)}, не по тексту.
     */
    public boolean contains(Path canonicalPath) {
        return canonicalPath.startsWith(root);
    }

    /**
     * Путь относительно корня с прямыми слешами, для отчетов.
     */
    public String relativize(Path canonicalPath) {
        if (canonicalPath.equals(root)) {
            return ".";
        }
        return root.relativize(canonicalPath).toString().replace('\\', '/');
    }

    private static Path checkRoot(Path projectRoot, List<String> forbidden) {
        Objects.requireNonNull(projectRoot, "projectRoot");
        Path canonical;
        try {
            canonical = PathCanonicalizer.canonicalize(projectRoot);
        } catch (IOException e) {
            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("path", projectRoot.toString());
            ctx.put("detail", e.toString());
            throw new NtsBoundaryException(NtsErrorCode.ROOT_NOT_FOUND, ctx, e);
        }

        if (!Files.exists(canonical)) {
            throw NtsBoundaryException.rootNotFound(projectRoot);
        }
        if (!Files.isDirectory(canonical)) {
            throw NtsBoundaryException.rootNotDirectory(projectRoot);
        }

        String match = ForbiddenRoots.findMatch(canonical.toString(), forbidden);
        if (match != null) {
            throw NtsBoundaryException.rootForbidden(canonical, match);
        }
        return canonical;
    }

    @Override
    public String toString() {
        return "BoundaryContext[root=" + root + "]";
    }
}
