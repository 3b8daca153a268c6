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
package ru.nts.tools.scan.core.sensitive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.scan.core.sensitive.SensitivePatterns.FilenamePattern;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Классификатор чувствительных файлов (ключи, учетные данные, env-файлы, служебные директории).
 *
 * Решение принимается только по строке пути: содержимое файлов никогда не открывается,
 * поэтому ошибка классификации не может привести к утечке секретных данных.
 *
 * Правила проверяются строго по порядку, причина берется у первого сработавшего:
 * 1. Любой сегмент пути совпадает с чувствительной директорией.
 * 2. Имя файла совпадает с шаблоном из упорядоченной таблицы.
 * 3. Расширение файла входит в набор чувствительных расширений.
 *
 * Экземпляр неизменяем. Создается владельцем сессии сканирования и передается по ссылке.
 */
public class SensitiveContentClassifier {

    private static final Logger log = LoggerFactory.getLogger(SensitiveContentClassifier.class);

    private static final String REPORT_RULE = "=".repeat(60);

    private final List<FilenamePattern> patterns;
    private final Set<String> directories;
    private final Set<String> extensions;

    /**
     * Классификатор только со встроенными таблицами.
     */
    public SensitiveContentClassifier() {
        this(new Builder());
    }

    private SensitiveContentClassifier(Builder builder) {
        this.patterns = List.copyOf(builder.patterns);
        this.directories = Set.copyOf(builder.directories);
        this.extensions = Set.copyOf(builder.extensions);
        log.info("SensitiveContentClassifier initialized with {} patterns, {} sensitive directories, {} extensions",
                patterns.size(), directories.size(), extensions.size());
    }

    public static Builder builder() {
        return new Builder();
    }

    public SensitivityVerdict classify(String path) {
        return classify(Path.of(path.replace('\\', '/')));
    }

    /**
     * Классифицирует путь (абсолютный или относительный) без обращения к файловой системе.
     */
    public SensitivityVerdict classify(Path path) {
        for (Path part : path) {
            String segment = part.toString();
            if (directories.contains(segment.toLowerCase(Locale.ROOT))) {
                log.debug("Sensitive directory detected: {} (contains '{}')", path, segment);
                return SensitivityVerdict.sensitive("In sensitive directory: " + segment, SensitivityCategory.DIRECTORY);
            }
        }

        Path fileNamePath = path.getFileName();
        if (fileNamePath == null) {
            return SensitivityVerdict.NOT_SENSITIVE;
        }
        String fileName = fileNamePath.toString();
        String lowerName = fileName.toLowerCase(Locale.ROOT);

        for (FilenamePattern pattern : patterns) {
            if (pattern.matches(lowerName)) {
                log.debug("Sensitive file detected: {} (matches '{}': {})", path, pattern.pattern().pattern(), pattern.description());
                return SensitivityVerdict.sensitive(pattern.description(), SensitivityCategory.FILENAME_PATTERN);
            }
        }

        String extension = extensionOf(fileName);
        if (!extension.isEmpty() && extensions.contains(extension.toLowerCase(Locale.ROOT))) {
            log.debug("Sensitive extension detected: {} ({})", path, extension);
            return SensitivityVerdict.sensitive("Sensitive file extension: " + extension, SensitivityCategory.EXTENSION);
        }

        return SensitivityVerdict.NOT_SENSITIVE;
    }

    public boolean isSensitive(Path path) {
        return classify(path).sensitive();
    }

    public boolean isSensitive(String path) {
        return classify(path).sensitive();
    }

    /**
     * @return Причина чувствительности или пусто.
     */
    public Optional<String> sensitivityReason(Path path) {
        return classify(path).reasonIfSensitive();
    }

    /**
     * Решение перед чтением содержимого: чувствительный путь читать нельзя.
     */
    public SensitivityVerdict shouldSkipContent(Path path) {
        return classify(path);
    }

    /**
     * Аудит директории, пути классифицируются относительно нее самой.
     *
     * @see #scanDirectory(Path, Path, boolean)
     */
    public List<SensitiveMatch> scanDirectory(Path directory, boolean recursive) throws IOException {
        return scanDirectory(directory, directory, recursive);
    }

    /**
     * Аудит директории: собирает все чувствительные элементы.
     * Обход независим от {@link ru.nts.tools.scan.core.BoundedTreeWalker}, ссылкам не следует.
     * Путь каждого элемента классифицируется относительно {@code base}, чтобы имена
     * директорий выше базы не влияли на результат, а директории между базой и {@code directory} учитывались.
     * Чувствительные директории попадают в результат и при рекурсивном обходе просматриваются дальше.
     *
     * @param directory Директория аудита.
     * @param base      База классификации (обычно корень проекта); должна содержать {@code directory}.
     * @param recursive Обходить поддиректории; иначе только непосредственные элементы.
     *
     * @return Совпадения, отсортированные по пути.
     *
     * @throws IOException если {@code directory} не является директорией.
     */
    public List<SensitiveMatch> scanDirectory(Path directory, Path base, boolean recursive) throws IOException {
        Path start = directory.toAbsolutePath().normalize();
        Path classificationBase = base.toAbsolutePath().normalize();
        if (!start.startsWith(classificationBase)) {
            throw new IllegalArgumentException("Audit directory " + start + " is not under " + classificationBase);
        }
        if (!Files.isDirectory(start)) {
            throw new NotDirectoryException(directory.toString());
        }

        List<SensitiveMatch> matches = new ArrayList<>();
        int maxDepth = recursive ? Integer.MAX_VALUE : 1;

        Files.walkFileTree(start, EnumSet.noneOf(FileVisitOption.class), maxDepth, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(start)) {
                    record(dir, SensitiveMatch.EntryType.DIRECTORY);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                // На предельной глубине директории приходят сюда же
                record(file, attrs.isDirectory() ? SensitiveMatch.EntryType.DIRECTORY : SensitiveMatch.EntryType.FILE);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.warn("Skipping inaccessible path during audit: {} - {}", file, exc.toString());
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                if (exc != null) {
                    log.warn("Directory listing interrupted during audit: {} - {}", dir, exc.toString());
                }
                return FileVisitResult.CONTINUE;
            }

            private void record(Path path, SensitiveMatch.EntryType type) {
                SensitivityVerdict verdict = classify(classificationBase.relativize(path));
                if (verdict.sensitive()) {
                    matches.add(new SensitiveMatch(path, verdict.reason(), verdict.category(), type));
                }
            }
        });

        matches.sort(Comparator.comparing(SensitiveMatch::path));
        log.info("Found {} sensitive items in {}", matches.size(), start);
        return matches;
    }

    /**
     * Разделяет список путей на безопасные и чувствительные по строке пути.
     */
    public PathPartition partition(Collection<Path> paths) {
        List<Path> safe = new ArrayList<>();
        List<Path> sensitive = new ArrayList<>();
        for (Path path : paths) {
            if (isSensitive(path)) {
                sensitive.add(path);
                log.debug("Filtered sensitive file: {}", path);
            } else {
                safe.add(path);
            }
        }
        if (!sensitive.isEmpty()) {
            log.info("Filtered {} sensitive files from {} total", sensitive.size(), paths.size());
        }
        return new PathPartition(safe, sensitive);
    }

    public List<Path> filterSafe(Collection<Path> paths) {
        return partition(paths).safe();
    }

    /**
     * Текстовый отчет о пропущенных файлах, сгруппированный по причине.
     */
    public String createSkipReport(Collection<Path> skippedFiles) {
        if (skippedFiles.isEmpty()) {
            return "No sensitive files skipped.";
        }

        Map<String, List<String>> byReason = new TreeMap<>();
        for (Path file : skippedFiles) {
            String reason = sensitivityReason(file).orElse("Unknown");
            byReason.computeIfAbsent(reason, k -> new ArrayList<>()).add(file.toString().replace('\\', '/'));
        }

        List<String> lines = new ArrayList<>();
        lines.add("Sensitive Files Skipped for Privacy:");
        lines.add(REPORT_RULE);
        for (Map.Entry<String, List<String>> group : byReason.entrySet()) {
            List<String> files = group.getValue();
            files.sort(Comparator.naturalOrder());
            lines.add("");
            lines.add(group.getKey() + " (" + files.size() + " files):");
            for (String file : files) {
                lines.add("  - " + file);
            }
        }
        lines.add("");
        lines.add(REPORT_RULE);
        lines.add("Total: " + skippedFiles.size() + " sensitive files protected");
        lines.add("");
        lines.add("These files were NOT read or analyzed for your privacy and security.");
        return String.join("\n", lines);
    }

    /**
     * Суффикс имени с точкой; у dot-файлов ({@code .env}) и имен без точки суффикса нет.
     */
    static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot);
    }

    /**
     * Дополняет встроенные таблицы; встроенные записи никогда не заменяются.
     */
    public static final class Builder {

        private final List<FilenamePattern> patterns = new ArrayList<>(SensitivePatterns.FILENAME_PATTERNS);
        private final Set<String> directories = new HashSet<>(SensitivePatterns.SENSITIVE_DIRECTORIES);
        private final Set<String> extensions = new HashSet<>(SensitivePatterns.SENSITIVE_EXTENSIONS);

        private Builder() {
        }

        /**
         * Добавляет регулярное выражение для имени файла (поиск без учета регистра).
         *
         * @throws java.util.regex.PatternSyntaxException если выражение некорректно.
         */
        public Builder addPattern(String regex) {
            return addPattern(regex, SensitivePatterns.CUSTOM_PATTERN_DESCRIPTION);
        }

        public Builder addPattern(String regex, String description) {
            patterns.add(FilenamePattern.of(regex, description));
            return this;
        }

        public Builder addPatterns(Collection<String> regexes) {
            regexes.forEach(this::addPattern);
            return this;
        }

        public Builder addDirectory(String name) {
            directories.add(name.toLowerCase(Locale.ROOT));
            return this;
        }

        public Builder addDirectories(Collection<String> names) {
            names.forEach(this::addDirectory);
            return this;
        }

        /**
         * @param extension Расширение с точкой или без ({@code "vault"} и {@code ".vault"} равнозначны).
         */
        public Builder addExtension(String extension) {
            String normalized = extension.toLowerCase(Locale.ROOT);
            extensions.add(normalized.startsWith(".") ? normalized : "." + normalized);
            return this;
        }

        public SensitiveContentClassifier build() {
            return new SensitiveContentClassifier(this);
        }
    }
}
