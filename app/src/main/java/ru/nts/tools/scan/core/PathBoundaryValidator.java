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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Валидатор границы проекта (Path Boundary Validator).
 * Доказывает или опровергает, что путь после полного разрешения ссылок лежит внутри корня проекта.
 *
 * Две точки вызова с разной политикой ошибок:
 * 1. {@link #resolve} никогда не бросает исключений и возвращает {@link PathResolution}.
 *    Используется при перечислении, где ошибка одного элемента не должна прерывать обход.
 * 2. {@link #validate} строгая: любая ошибка превращается в {@link NtsBoundaryException}.
 *    Используется, когда вызывающий код собирается обратиться именно к этому пути.
 *
 * Экземпляр не имеет изменяемого состояния и безопасен для параллельного использования.
 */
public class PathBoundaryValidator {

    private static final Logger log = LoggerFactory.getLogger(PathBoundaryValidator.class);

    private static final Comparator<Path> BY_NAME = Comparator.comparing(p -> String.valueOf(p.getFileName()));

    private final BoundaryContext context;

    /**
     * Создает валидатор для корня со списком запрещенных корней по умолчанию.
     *
     * @throws NtsBoundaryException с видом {@link BoundaryErrorKind#INVALID_ROOT}, если корень непригоден.
     */
    public PathBoundaryValidator(Path projectRoot) {
        this(BoundaryContext.of(projectRoot));
    }

    public PathBoundaryValidator(BoundaryContext context) {
        this.context = Objects.requireNonNull(context, "context");
        log.info("PathBoundaryValidator initialized for: {}", context.root());
    }

    public BoundaryContext getContext() {
        return context;
    }

    public Path getRoot() {
        return context.root();
    }

    /**
     * Строгая проверка существующего пути без следования за внешними ссылками.
     *
     * @return Канонический путь внутри корня.
     *
     * @throws NtsBoundaryException при любой ошибке проверки.
     */
    public Path validate(Path candidate) {
        return validate(candidate, true, false);
    }

    /**
     * Строгая проверка пути.
     *
     * @param candidate      Путь (абсолютный или относительный к корню проекта).
     * @param mustExist      Требовать существования канонического пути.
     * @param followSymlinks Вызывающий собирается разыменовать ссылку; выход ссылки за корень
     *                       становится {@link NtsErrorCode#SYMLINK_ATTACK}, а не пропуском.
     *
     * @return Канонический путь внутри корня.
     *
     * @throws NtsBoundaryException при любой ошибке проверки.
     */
    public Path validate(Path candidate, boolean mustExist, boolean followSymlinks) {
        return resolve(candidate, mustExist, followSymlinks).orElseThrow();
    }

    /**
     * Мягкая проверка пути. Никогда не бросает {@link NtsBoundaryException}.
     *
     * Порядок проверки:
     * 1. Если сам кандидат является символической ссылкой (до разрешения), проверяется цель всей цепочки.
     * 2. Иначе путь приводится к каноническому виду.
     * 3. Канонический путь обязан лежать внутри корня.
     * 4. При {@code mustExist} канонический путь обязан существовать.
     */
    public PathResolution resolve(Path candidate, boolean mustExist, boolean followSymlinks) {
        Objects.requireNonNull(candidate, "candidate");
        Path absolute = toAbsolute(candidate);

        if (Files.isSymbolicLink(absolute)) {
            return resolveSymlink(candidate, absolute, mustExist, followSymlinks);
        }

        Path canonical;
        try {
            canonical = PathCanonicalizer.canonicalize(absolute);
        } catch (IOException e) {
            return PathResolution.failure(codeFor(e), candidate, null, e.toString());
        }

        if (!context.contains(canonical)) {
            log.debug("Path traversal detected: '{}' resolves to '{}' outside of '{}'", candidate, canonical, context.root());
            return PathResolution.failure(NtsErrorCode.PATH_OUTSIDE_ROOT, candidate, canonical, null);
        }

        if (mustExist && !Files.exists(canonical)) {
            return PathResolution.failure(NtsErrorCode.PATH_NOT_FOUND, candidate, canonical, null);
        }

        return PathResolution.success(canonical);
    }

    /**
     * Чистая проверка принадлежности корню по каноническому виду пути.
     * Относительные пути считаются от корня проекта. Путь, который не удалось разрешить, считается внешним.
     */
    public boolean isWithinRoot(Path path) {
        try {
            return context.contains(PathCanonicalizer.canonicalize(toAbsolute(path)));
        } catch (IOException e) {
            return false;
        }
    }

    /**
     * Перечисляет непосредственных потомков директории, отбрасывая небезопасные элементы.
     *
     * @see #safeIterdir(Path, InaccessiblePathListener)
     */
    public List<Path> safeIterdir(Path directory) {
        return safeIterdir(directory, InaccessiblePathListener.NONE);
    }

    /**
     * Перечисляет непосредственных потомков директории (отсортированных по имени).
     * Сама директория проверяется строго; каждый потомок проверяется мягко, без следования ссылкам.
     * Потомки, не прошедшие проверку, записываются в лог, передаются слушателю и пропускаются.
     * Нечитаемая директория дает пустой список, а не исключение.
     *
     * @return Канонические пути допустимых потомков.
     *
     * @throws NtsBoundaryException если сама директория вне корня, не существует или не является директорией.
     */
    public List<Path> safeIterdir(Path directory, InaccessiblePathListener listener) {
        Path validated = validate(directory, true, false);
        if (!Files.isDirectory(validated)) {
            throw new NtsBoundaryException(NtsErrorCode.NOT_A_DIRECTORY, directory);
        }

        List<Path> result = new ArrayList<>();
        for (Path child : readDirectory(validated, listener).orElse(List.of())) {
            resolveChild(child, listener).ifPresent(result::add);
        }
        return result;
    }

    /**
     * Читает список элементов уже проверенной директории.
     *
     * @return Отсортированные по имени элементы (не разрешенные) или пусто, если директорию прочитать не удалось.
     */
    Optional<List<Path>> readDirectory(Path directory, InaccessiblePathListener listener) {
        List<Path> children = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path child : stream) {
                children.add(child);
            }
        } catch (IOException | DirectoryIteratorException e) {
            IOException cause = e instanceof DirectoryIteratorException die ? die.getCause() : (IOException) e;
            NtsErrorCode code = codeFor(cause);
            log.warn("Skipping unreadable directory {} ({}): {}", directory, code, cause.toString());
            listener.onInaccessible(directory, code, cause.toString());
            return Optional.empty();
        }
        children.sort(BY_NAME);
        return Optional.of(children);
    }

    /**
     * Мягкая проверка одного элемента при перечислении.
     *
     * @return Канонический путь или пусто, если элемент пропущен.
     */
    Optional<Path> resolveChild(Path child, InaccessiblePathListener listener) {
        PathResolution resolution = resolve(child, false, false);
        if (resolution.isSuccess()) {
            return Optional.of(resolution.getPath());
        }
        // Выход ссылки за корень уже записан в resolveSymlink
        if (resolution.getError() != NtsErrorCode.SYMLINK_OUTSIDE_ROOT) {
            log.warn("Skipping unsafe path: {} ({})", child, resolution.getError());
        }
        listener.onInaccessible(child, resolution.getError(), resolution.getDetail());
        return Optional.empty();
    }

    /**
     * Проверка символической ссылки: разрешается вся цепочка, проверяется конечная цель.
     */
    private PathResolution resolveSymlink(Path candidate, Path link, boolean mustExist, boolean follow) {
        Path target;
        try {
            target = PathCanonicalizer.canonicalize(link);
        } catch (IOException e) {
            return PathResolution.failure(codeFor(e), candidate, null, "Cannot resolve symlink: " + e);
        }

        if (!context.contains(target)) {
            if (follow) {
                log.debug("Symlink attack detected: {} -> {}", link, target);
                return PathResolution.failure(NtsErrorCode.SYMLINK_ATTACK, candidate, target, null);
            }
            log.warn("Skipping symlink pointing outside project: {} -> {}", link, target);
            return PathResolution.failure(NtsErrorCode.SYMLINK_OUTSIDE_ROOT, candidate, target, null);
        }

        if (mustExist && !Files.exists(target)) {
            return PathResolution.failure(NtsErrorCode.PATH_NOT_FOUND, candidate, target, "dangling symlink");
        }

        log.debug("Following safe symlink: {} -> {}", link, target);
        return PathResolution.success(target);
    }

    private Path toAbsolute(Path candidate) {
        return candidate.isAbsolute() ? candidate : context.root().resolve(candidate);
    }

    private static NtsErrorCode codeFor(IOException e) {
        if (e instanceof AccessDeniedException) {
            return NtsErrorCode.PERMISSION_DENIED;
        }
        if (e instanceof NoSuchFileException) {
            return NtsErrorCode.PATH_NOT_FOUND;
        }
        if (e instanceof NotDirectoryException) {
            return NtsErrorCode.NOT_A_DIRECTORY;
        }
        return NtsErrorCode.IO_ERROR;
    }
}
