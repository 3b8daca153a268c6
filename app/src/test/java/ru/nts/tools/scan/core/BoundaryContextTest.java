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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Тесты проверки корня проекта.
 */
class BoundaryContextTest {

    @Test
    void rootIsCanonicalized(@TempDir Path tempDir) throws IOException {
        Path project = Files.createDirectory(tempDir.resolve("project"));
        BoundaryContext context = BoundaryContext.of(project.resolve("."));
        assertEquals(project.toRealPath(), context.root());
        assertEquals(ForbiddenRoots.DEFAULTS, context.forbiddenRoots());
    }

    @Test
    void rootBehindSymlinkResolvesToTarget(@TempDir Path tempDir) throws IOException {
        Path project = Files.createDirectory(tempDir.resolve("project"));
        Path link = tempDir.resolve("link");
        try {
            Files.createSymbolicLink(link, project);
        } catch (UnsupportedOperationException | FileSystemException e) {
            assumeTrue(false, "Symlinks are not supported: " + e);
        }
        assertEquals(project.toRealPath(), BoundaryContext.of(link).root());
    }

    @Test
    void missingRootIsRejected(@TempDir Path tempDir) {
        NtsBoundaryException e = assertThrows(NtsBoundaryException.class,
                () -> BoundaryContext.of(tempDir.resolve("missing")));
        assertEquals(NtsErrorCode.ROOT_NOT_FOUND, e.getCode());
        assertEquals(BoundaryErrorKind.INVALID_ROOT, e.getKind());
    }

    @Test
    void fileRootIsRejected(@TempDir Path tempDir) throws IOException {
        Path file = Files.writeString(tempDir.resolve("file.txt"), "x");
        NtsBoundaryException e = assertThrows(NtsBoundaryException.class, () -> BoundaryContext.of(file));
        assertEquals(NtsErrorCode.ROOT_NOT_DIRECTORY, e.getCode());
        assertEquals(BoundaryErrorKind.INVALID_ROOT, e.getKind());
    }

    @Test
    void systemDirectoryIsRejected() {
        Path etc = Path.of("/etc");
        assumeTrue(Files.isDirectory(etc), "/etc is not available on this platform");
        NtsBoundaryException e = assertThrows(NtsBoundaryException.class, () -> BoundaryContext.of(etc));
        assertEquals(NtsErrorCode.ROOT_FORBIDDEN, e.getCode());
        assertEquals(BoundaryErrorKind.INVALID_ROOT, e.getKind());
        assertTrue(e.toUserMessage().contains("Cannot analyze system directory"));
    }

    @Test
    void customForbiddenListIsHonored(@TempDir Path tempDir) throws IOException {
        Path project = Files.createDirectory(tempDir.resolve("project"));
        String entry = tempDir.toRealPath().toString();

        NtsBoundaryException e = assertThrows(NtsBoundaryException.class,
                () -> BoundaryContext.of(project, List.of(entry)));
        assertEquals(NtsErrorCode.ROOT_FORBIDDEN, e.getCode());
        assertEquals(entry, e.getContext().get("forbidden"));

        // Пустой список ничего не запрещает
        assertEquals(project.toRealPath(), BoundaryContext.of(project, List.of()).root());
    }

    @Test
    void containsComparesBySegments(@TempDir Path tempDir) throws IOException {
        Path project = Files.createDirectory(tempDir.resolve("project"));
        Path sibling = Files.createDirectory(tempDir.resolve("project2"));
        BoundaryContext context = BoundaryContext.of(project);

        assertTrue(context.contains(context.root()));
        assertTrue(context.contains(context.root().resolve("src/Main.java")));
        assertFalse(context.contains(sibling.toRealPath()));
        assertFalse(context.contains(tempDir.toRealPath()));
    }

    @Test
    void relativizeUsesForwardSlashes(@TempDir Path tempDir) throws IOException {
        BoundaryContext context = BoundaryContext.of(Files.createDirectory(tempDir.resolve("project")));
        assertEquals(".", context.relativize(context.root()));
        assertEquals("src/main/App.java", context.relativize(context.root().resolve("src").resolve("main").resolve("App.java")));
    }

    @Test
    void validateProjectRootReturnsCanonicalRoot(@TempDir Path tempDir) throws IOException {
        Path project = Files.createDirectories(tempDir.resolve("a/b"));
        assertEquals(project.toRealPath(), BoundaryContext.validateProjectRoot(tempDir.resolve("a/./b/../b")));
    }
}
