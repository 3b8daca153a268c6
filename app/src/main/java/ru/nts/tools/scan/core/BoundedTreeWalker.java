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

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Ленивый обход дерева директорий с ограничением глубины.
 * Каждый элемент каждой директории проходит через {@link PathBoundaryValidator};
 * недоступные поддеревья пропускаются, обход продолжается с соседями.
 *
 * Обход выполняется явным стеком (путь, глубина), а не рекурсией, поэтому глубина дерева
 * не ограничена стеком вызовов. Каждый вызов {@link #walk} начинает новый обход;
 * возвращаемый поток не перезапускается и рассчитан на одного потребителя.
 * Прекращение чтения потока прекращает обращения к файловой системе.
 *
 * Символические ссылки внутри корня попадают в результат под своим именем
 * (по типу цели), но обход в директории-ссылки не спускается.
 */
public class BoundedTreeWalker {

    private static final Logger log = LoggerFactory.getLogger(BoundedTreeWalker.class);

    /**
     * Глубина без ограничения.
     */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private final PathBoundaryValidator validator;

    public BoundedTreeWalker(PathBoundaryValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    public Stream<WalkEntry> walk(Path start) {
        return walk(start, UNBOUNDED, InaccessiblePathListener.NONE);
    }

    public Stream<WalkEntry> walk(Path start, int maxDepth) {
        return walk(start, maxDepth, InaccessiblePathListener.NONE);
    }

    /**
     * Начинает обход.
     *
     * @param start    Стартовая директория (внутри корня).
     * @param maxDepth Максимальная глубина; 0 означает только стартовую директорию.
     * @param listener Получает пропущенные элементы.
     *
     * @return Ленивый поток шагов обхода в порядке "сначала вглубь".
     *
     * @throws NtsBoundaryException     если стартовый путь вне корня, не существует или не директория.
     * @throws IllegalArgumentException если глубина отрицательна.
     */
    public Stream<WalkEntry> walk(Path start, int maxDepth, InaccessiblePathListener listener) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0, got " + maxDepth);
        }
        Objects.requireNonNull(listener, "listener");

        // Стартовую точку назвал вызывающий, поэтому здесь проверка строгая
        Path validatedStart = validator.validate(start, true, false);
        if (!Files.isDirectory(validatedStart)) {
            throw new NtsBoundaryException(NtsErrorCode.NOT_A_DIRECTORY, start);
        }

        WalkIterator iterator = new WalkIterator(validatedStart, maxDepth, listener);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    /**
     * Один элемент рабочего стека.
     */
    private record Frame(Path directory, int depth) {
    }

    private final class WalkIterator implements Iterator<WalkEntry> {

        private final Deque<Frame> stack = new ArrayDeque<>();
        private final int maxDepth;
        private final InaccessiblePathListener listener;
        private WalkEntry next;

        WalkIterator(Path start, int maxDepth, InaccessiblePathListener listener) {
            this.maxDepth = maxDepth;
            this.listener = listener;
            stack.push(new Frame(start, 0));
        }

        @Override
        public boolean hasNext() {
            while (next == null && !stack.isEmpty()) {
                next = visit(stack.pop());
            }
            return next != null;
        }

        @Override
        public WalkEntry next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            WalkEntry entry = next;
            next = null;
            return entry;
        }

        /**
         * Читает одну директорию и кладет ее поддиректории в стек.
         *
         * @return Шаг обхода или null, если директория пропущена.
         */
        private WalkEntry visit(Frame frame) {
            Path directory = frame.directory();

            if (frame.depth() > 0 && !stillSameDirectory(directory)) {
                return null;
            }

            Optional<List<Path>> children = validator.readDirectory(directory, listener);
            if (children.isEmpty()) {
                return null;
            }

            List<String> directoryNames = new ArrayList<>();
            List<String> fileNames = new ArrayList<>();
            List<Path> descend = new ArrayList<>();

            for (Path child : children.get()) {
                Optional<Path> resolved = validator.resolveChild(child, listener);
                if (resolved.isEmpty()) {
                    continue;
                }
                Path target = resolved.get();
                String name = child.getFileName().toString();

                if (Files.isDirectory(target)) {
                    directoryNames.add(name);
                    if (!Files.isSymbolicLink(child)) {
                        descend.add(target);
                    }
                } else if (Files.isRegularFile(target)) {
                    fileNames.add(name);
                } else {
                    // Висячая ссылка внутри корня, сокет, FIFO, устройство
                    log.debug("Skipping special entry: {}", child);
                }
            }

            if (frame.depth() < maxDepth) {
                // Обратный порядок, чтобы первой из стека выходила первая по алфавиту
                for (int i = descend.size() - 1; i >= 0; i--) {
                    stack.push(new Frame(descend.get(i), frame.depth() + 1));
                }
            }

            return new WalkEntry(directory, directoryNames, fileNames);
        }

        /**
         * Повторная проверка поддиректории перед чтением: между перечислением родителя и спуском
         * ее могли удалить или подменить ссылкой.
         */
        private boolean stillSameDirectory(Path directory) {
            PathResolution resolution = validator.resolve(directory, true, false);
            if (!resolution.isSuccess()) {
                log.warn("Skipping inaccessible directory {} ({})", directory, resolution.getError());
                listener.onInaccessible(directory, resolution.getError(), resolution.getDetail());
                return false;
            }
            if (!resolution.getPath().equals(directory) || !Files.isDirectory(directory)) {
                log.warn("Skipping directory changed during walk: {}", directory);
                listener.onInaccessible(directory, NtsErrorCode.IO_ERROR, "changed during walk");
                return false;
            }
            return true;
        }
    }
}
