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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Тесты проверки путей на принадлежность корню проекта.
 * Структура: {@code base/project} (корень) и {@code base/outside} (внешние данные).
 */
class PathBoundaryValidatorTest {

    @TempDir
    Path base;

    private Path project;
    private Path outside;
    private PathBoundaryValidator validator;

    @BeforeEach
    void setUp() throws IOException {
        project = Files.createDirectory(base.resolve("project")).toRealPath();
        outside = Files.createDirectory(base.resolve("outside")).toRealPath();
        Files.writeString(outside.resolve("secret.txt"), "top secret");
        Files.createDirectories(project.resolve("src"));
        Files.writeString(project.resolve("src/Main.java"), "class Main {}");
        Files.writeString(project.resolve("README.md"), "# readme");
        validator = new PathBoundaryValidator(project);
    }

    private static void symlink(Path link, Path target) throws IOException {
        try {
            Files.createSymbolicLink(link, target);
        } catch (UnsupportedOperationException | FileSystemException e) {
            assumeTrue(false, "Symlinks are not supported: " + e);
        }
    }

    // ==================== Обычные пути ====================

    @Test
    void relativePathResolvesAgainstRoot() {
        assertEquals(project.resolve("src/Main.java"), validator.validate(Path.of("src/Main.java")));
    }

    @Test
    void rootItselfIsValid() {
        assertEquals(project, validator.validate(Path.of(".")));
        assertEquals(project, validator.validate(project));
    }

    @Test
    void innerDotDotIsAllowed() {
        assertEquals(project.resolve("README.md"), validator.validate(Path.of("src/../README.md")));
    }

    @Test
    void validationIsIdempotent() {
        Path once = validator.validate(Path.of("src/./Main.java"));
        assertEquals(once, validator.validate(once));
    }

    @Test
    void unicodeAndSpacesArePreserved() throws IOException {
        Path dir = Files.createDirectories(project.resolve("папка с пробелами/日本語 (1)"));
        Path file = Files.writeString(dir.resolve("файл #1.txt"), "данные");
        assertEquals(file, validator.validate(Path.of("папка с пробелами/日本語 (1)/файл #1.txt")));
    }

    @Test
    void deeplyNestedPathIsValid() throws IOException {
        Path deep = project;
        for (int i = 0; i < 60; i++) {
            deep = deep.resolve("level" + i);
        }
        Files.createDirectories(deep);
        assertEquals(deep, validator.validate(deep));
    }

    // ==================== Выход за корень ====================

    @Test
    void dotDotEscapeIsRejected() {
        NtsBoundaryException e = assertThrows(NtsBoundaryException.class,
                () -> validator.validate(Path.of("../outside/secret.txt")));
        assertEquals(NtsErrorCode.PATH_OUTSIDE_ROOT, e.getCode());
        assertEquals(BoundaryErrorKind.BOUNDARY_VIOLATION, e.getKind());
    }

    @Test
    void nestedDotDotEscapeIsRejected() {
        NtsBoundaryException e = assertThrows(NtsBoundaryException.class,
                () -> validator.validate(Path.of("src/../../outside/secret.txt")));
        assertEquals(NtsErrorCode.PATH_OUTSIDE_ROOT, e.getCode());
    }

    @Test
    void absoluteOutsidePathIsRejected() {
        NtsBoundaryException e = assertThrows(NtsBoundaryException.class,
                () -> validator.validate(outside.resolve("secret.txt")));
        assertEquals(BoundaryErrorKind.BOUNDARY_VIOLATION, e.getKind());
    }

    @Test
    void siblingWithCommonPrefixIsOutside() throws IOException {
        Path sibling = Files.createDirectory(base.resolve("project2"));
        Files.writeString(sibling.resolve("data.txt"), "x");
        assertThrows(NtsBoundaryException.class, () -> validator.validate(sibling.resolve("data.txt")));
        assertFalse(validator.isWithinRoot(sibling.resolve("data.txt")));
    }

    @Test
    void escapeDoesNotDependOnExistence() {
        PathResolution resolution = validator.resolve(Path.of("../outside/missing.txt"), false, false);
        assertFalse(resolution.isSuccess());
        assertEquals(NtsErrorCode.PATH_OUTSIDE_ROOT, resolution.getError());
    }

    // ==================== Существование ====================

    @Test
    void missingPathFailsOnlyWhenExistenceRequired() {
        NtsBoundaryException e = assertThrows(NtsBoundaryException.class,
                () -> validator.validate(Path.of("src/Missing.java")));
        assertEquals(NtsErrorCode.PATH_NOT_FOUND, e.getCode());
        assertEquals(BoundaryErrorKind.INACCESSIBLE, e.getKind());

        assertEquals(project.resolve("src/Missing.java"), validator.validate(Path.of("src/Missing.java"), false, false));
    }

    // ==================== Символические ссылки ====================

    @Test
    void internalSymlinkResolvesToTarget() throws IOException {
        Path link = project.resolve("main-link.java");
        symlink(link, project.resolve("src/Main.java"));
        assertEquals(project.resolve("src/Main.java"), validator.validate(link));
    }

    @Test
    void externalSymlinkIsSkippedWhenNotFollowed() throws IOException {
        Path link = project.resolve("leak.txt");
        symlink(link, outside.resolve("secret.txt"));

        PathResolution resolution = validator.resolve(link, true, false);
        assertFalse(resolution.isSuccess());
        assertEquals(NtsErrorCode.SYMLINK_OUTSIDE_ROOT, resolution.getError());
        assertEquals(BoundaryErrorKind.INACCESSIBLE, resolution.getKind());
    }

    @Test
    void externalSymlinkIsAttackWhenFollowed() throws IOException {
        Path link = project.resolve("leak.txt");
        symlink(link, outside.resolve("secret.txt"));

        NtsBoundaryException e = assertThrows(NtsBoundaryException.class, () -> validator.validate(link, true, true));
        assertEquals(NtsErrorCode.SYMLINK_ATTACK, e.getCode());
        assertEquals(BoundaryErrorKind.BOUNDARY_VIOLATION, e.getKind());
    }

    @Test
    void symlinkChainEndingOutsideIsRejected() throws IOException {
        Path second = project.resolve("second");
        Path first = project.resolve("first");
        symlink(second, outside.resolve("secret.txt"));
        symlink(first, second);

        PathResolution resolution = validator.resolve(first, true, false);
        assertEquals(NtsErrorCode.SYMLINK_OUTSIDE_ROOT, resolution.getError());
        assertEquals(outside.resolve("secret.txt").toString(), resolution.getContext().get("resolved"));

        NtsBoundaryException e = assertThrows(NtsBoundaryException.class, () -> validator.validate(first, true, true));
        assertEquals(NtsErrorCode.SYMLINK_ATTACK, e.getCode());
    }

    @Test
    void pathThroughEscapingDirectoryLinkIsRejected() throws IOException {
        symlink(project.resolve("escape"), outside);

        NtsBoundaryException e = assertThrows(NtsBoundaryException.class,
                () -> validator.validate(Path.of("escape/secret.txt")));
        assertEquals(NtsErrorCode.PATH_OUTSIDE_ROOT, e.getCode());
    }

    @Test
    void dotDotAfterLinkAppliesToLinkTarget() throws IOException {
        Path nested = Files.createDirectory(outside.resolve("nested"));
        symlink(project.resolve("deep"), nested);

        // deep/.. ведет в outside, а не обратно в project
        PathResolution resolution = validator.resolve(Path.of("deep/../secret.txt"), true, false);
        assertFalse(resolution.isSuccess());
        assertEquals(BoundaryErrorKind.BOUNDARY_VIOLATION, resolution.getKind());
    }

    @Test
    void danglingInternalSymlink() throws IOException {
        Path link = project.resolve("dangling");
        symlink(link, project.resolve("gone.txt"));

        PathResolution strict = validator.resolve(link, true, false);
        assertEquals(NtsErrorCode.PATH_NOT_FOUND, strict.getError());
        assertTrue(validator.resolve(link, false, false).isSuccess());
    }

    @Test
    void symlinkLoopIsInaccessible() throws IOException {
        Path a = project.resolve("loop-a");
        Path b = project.resolve("loop-b");
        symlink(a, b);
        symlink(b, a);

        PathResolution resolution = validator.resolve(a, false, false);
        assertFalse(resolution.isSuccess());
        assertEquals(NtsErrorCode.IO_ERROR, resolution.getError());
        assertEquals(BoundaryErrorKind.INACCESSIBLE, resolution.getKind());
    }

    // ==================== Перечисление ====================

    @Test
    void safeIterdirSkipsEscapingEntries() throws IOException {
        symlink(project.resolve("leak.txt"), outside.resolve("secret.txt"));
        List<Path> skipped = new ArrayList<>();

        List<Path> children = validator.safeIterdir(project, (path, code, detail) -> skipped.add(path));

        assertEquals(List.of(project.resolve("README.md"), project.resolve("src")), children);
        assertEquals(List.of(project.resolve("leak.txt")), skipped);
    }

    @Test
    void safeIterdirRejectsFilesAndOutsideDirectories() {
        NtsBoundaryException notDir = assertThrows(NtsBoundaryException.class,
                () -> validator.safeIterdir(project.resolve("README.md")));
        assertEquals(NtsErrorCode.NOT_A_DIRECTORY, notDir.getCode());

        NtsBoundaryException escape = assertThrows(NtsBoundaryException.class, () -> validator.safeIterdir(outside));
        assertEquals(NtsErrorCode.PATH_OUTSIDE_ROOT, escape.getCode());
    }

    // ==================== Параллельная проверка ====================

    @Test
    void concurrentValidationGivesSameResult() throws Exception {
        symlink(project.resolve("leak.txt"), outside.resolve("secret.txt"));
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                Callable<String> task = i % 2 == 0
                        ? () -> validator.validate(Path.of("src/Main.java")).toString()
                        : () -> validator.resolve(Path.of("leak.txt"), true, false).getError().name();
                results.add(executor.submit(task));
            }
            for (int i = 0; i < results.size(); i++) {
                String expected = i % 2 == 0 ? project.resolve("src/Main.java").toString() : "SYMLINK_OUTSIDE_ROOT";
                assertEquals(expected, results.get(i).get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
