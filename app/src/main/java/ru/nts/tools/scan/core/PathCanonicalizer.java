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
import java.nio.file.FileSystemLoopException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Приведение пути к каноническому виду без требования существования.
 *
 * В отличие от {@link Path#toRealPath} работает и для несуществующих путей:
 * существующая часть пути разрешается со всеми ссылками, остаток добавляется как есть.
 * Сегменты {@code ..} применяются после разрешения ссылок, поэтому
 * {@code link/..} ведет к родителю цели ссылки, а не обратно к директории ссылки.
 */
final class PathCanonicalizer {

    /**
     * Предел переходов по ссылкам за одно разрешение (как MAXSYMLINKS в Linux).
     */
    static final int MAX_LINK_HOPS = 40;

    private PathCanonicalizer() {
    }

    static Path canonicalize(Path path) throws IOException {
        Path absolute = path.toAbsolutePath();
        Path current = absolute.getRoot();

        Deque<String> pending = new ArrayDeque<>();
        for (Path part : absolute) {
            pending.addLast(part.toString());
        }

        int hops = 0;
        while (!pending.isEmpty()) {
            String name = pending.removeFirst();
            if (name.isEmpty() || ".".equals(name)) {
                continue;
            }
            if ("..".equals(name)) {
                Path parent = current.getParent();
                if (parent != null) {
                    current = parent;
                }
                continue;
            }

            Path next = current.resolve(name);
            if (!Files.isSymbolicLink(next)) {
                current = next;
                continue;
            }

            if (++hops > MAX_LINK_HOPS) {
                throw new FileSystemLoopException(next.toString());
            }
            Path target = Files.readSymbolicLink(next);
            // Сегменты цели встают перед оставшимися сегментами исходного пути
            Deque<String> targetParts = new ArrayDeque<>();
            for (Path part : target) {
                targetParts.addLast(part.toString());
            }
            Iterator<String> reversed = targetParts.descendingIterator();
            while (reversed.hasNext()) {
                pending.addFirst(reversed.next());
            }
            if (target.isAbsolute()) {
                current = target.getRoot();
            }
        }
        return current;
    }
}
