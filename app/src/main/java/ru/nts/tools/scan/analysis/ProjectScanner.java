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
package ru.nts.tools.scan.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.scan.core.BoundedTreeWalker;
import ru.nts.tools.scan.core.InaccessiblePathListener;
import ru.nts.tools.scan.core.PathBoundaryValidator;
import ru.nts.tools.scan.core.PathResolution;
import ru.nts.tools.scan.core.TextFileReader;
import ru.nts.tools.scan.core.WalkEntry;
import ru.nts.tools.scan.core.sensitive.SensitiveContentClassifier;
import ru.nts.tools.scan.core.sensitive.SensitivityVerdict;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Сканер проекта: собирает статистику по файлам внутри корня.
 *
 * Обход идет только через {@link BoundedTreeWalker}, поэтому за пределы корня сканер не выходит.
 * Чувствительные файлы при {@link ScanOptions#skipSensitive()} только учитываются по имени:
 * их метаданные и содержимое не запрашиваются. Каждый остальной файл повторно проверяется
 * валидатором непосредственно перед обращением к нему.
 */
public class ProjectScanner {

    private static final Logger log = LoggerFactory.getLogger(ProjectScanner.class);

    /**
     * Расширения, для которых считаются строки.
     */
    static final Set<String> TEXT_EXTENSIONS = Set.of(
            ".py", ".js", ".ts", ".jsx", ".tsx", ".java", ".go", ".rs", ".rb", ".php",
            ".c", ".cpp", ".h", ".md", ".txt", ".yml", ".yaml", ".json", ".xml");

    static final String NO_EXTENSION = ".no_extension";

    private static final List<String> TEST_DIRECTORIES = List.of("tests", "test", "__tests__");

    private final PathBoundaryValidator validator;
    private final BoundedTreeWalker walker;
    private final SensitiveContentClassifier classifier;
    private final ScanOptions options;

    public ProjectScanner(Path projectRoot) {
        this(projectRoot, ScanOptions.defaults(), new SensitiveContentClassifier());
    }

    /**
     * @throws ru.nts.tools.scan.core.NtsBoundaryException если корень непригоден.
     */
    public ProjectScanner(Path projectRoot, ScanOptions options, SensitiveContentClassifier classifier) {
        this(new PathBoundaryValidator(projectRoot), options, classifier);
    }

    public ProjectScanner(PathBoundaryValidator validator, ScanOptions options, SensitiveContentClassifier classifier) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.walker = new BoundedTreeWalker(validator);
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.options = Objects.requireNonNull(options, "options");
        log.info("ProjectScanner initialized for: {} ({})", validator.getRoot(), options);
    }

    public Path getRoot() {
        return validator.getRoot();
    }

    public ScanResult scan() {
        return scan(validator.getRoot());
    }

    /**
     * Сканирует поддерево, начиная с {@code start}. Пути в результате остаются относительными к корню проекта.
     *
     * @throws ru.nts.tools.scan.core.NtsBoundaryException если {@code start} вне корня или не директория.
     */
    public ScanResult scan(Path start) {
        Path root = validator.getRoot();
        log.info("Starting project scan: {}", start);

        List<String> sensitiveFiles = new ArrayList<>();
        List<String> inaccessible = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Map<String, Integer> byExtension = new HashMap<>();
        InaccessiblePathListener listener = (path, code, detail) -> inaccessible.add(relative(path));

        long totalFiles = 0;
        long totalSize = 0;
        long totalLines = 0;
        int analyzed = 0;
        boolean limitReached = false;

        try (Stream<WalkEntry> entries = walker.walk(start, options.maxDepth(), listener)) {
            Iterator<WalkEntry> iterator = entries.iterator();
            walk:
            while (iterator.hasNext()) {
                WalkEntry entry = iterator.next();
                for (String name : entry.files()) {
                    if (options.hasFileLimit() && analyzed >= options.maxFiles()) {
                        log.info("Reached maxFiles limit: {}", options.maxFiles());
                        limitReached = true;
                        break walk;
                    }

                    Path file = entry.resolve(name);
                    if (options.skipSensitive() && skipIfSensitive(root.relativize(file), file, sensitiveFiles)) {
                        totalFiles++;
                        continue;
                    }

                    PathResolution resolution = validator.resolve(file, true, false);
                    if (!resolution.isSuccess()) {
                        log.warn("File failed re-validation before read: {} ({})", file, resolution.getError());
                        inaccessible.add(relative(file));
                        continue;
                    }
                    Path target = resolution.getPath();

                    // Ссылка внутри корня классифицируется и по имени цели
                    if (options.skipSensitive() && !target.equals(file)
                            && skipIfSensitive(root.relativize(target), file, sensitiveFiles)) {
                        totalFiles++;
                        continue;
                    }

                    totalFiles++;
                    analyzed++;

                    long size;
                    try {
                        size = Files.size(target);
                    } catch (IOException e) {
                        log.debug("Cannot stat {}: {}", file, e.toString());
                        warnings.add("Could not read: " + name);
                        continue;
                    }
                    totalSize += size;

                    String extension = extensionOf(name);
                    byExtension.merge(extension, 1, Integer::sum);

                    if (TEXT_EXTENSIONS.contains(extension)) {
                        try {
                            totalLines += TextFileReader.read(target).lineCount();
                        } catch (IOException e) {
                            // Бинарные и слишком большие файлы просто не дают строк
                            log.debug("Cannot count lines of {}: {}", file, e.toString());
                        }
                    }
                }
            }
        }

        ProjectStats stats = new ProjectStats(totalFiles, totalSize, totalLines, byExtension,
                hasTests(root, byExtension), Files.exists(root.resolve(".git")), analyzed);

        log.info("Scan complete: {} files, {} analyzed, {} sensitive skipped, {} inaccessible",
                totalFiles, analyzed, sensitiveFiles.size(), inaccessible.size());
        return new ScanResult(Instant.now(), root, stats, sensitiveFiles, inaccessible, warnings, limitReached);
    }

    private boolean skipIfSensitive(Path classified, Path file, List<String> sensitiveFiles) {
        SensitivityVerdict verdict = classifier.shouldSkipContent(classified);
        if (!verdict.sensitive()) {
            return false;
        }
        log.debug("Skipping sensitive file {}: {}", file, verdict.reason());
        sensitiveFiles.add(relative(file));
        return true;
    }

    private static boolean hasTests(Path root, Map<String, Integer> byExtension) {
        for (String directory : TEST_DIRECTORIES) {
            if (Files.exists(root.resolve(directory))) {
                return true;
            }
        }
        return byExtension.keySet().stream().anyMatch(ext -> ext.contains("test"));
    }

    private String relative(Path path) {
        Path root = validator.getRoot();
        Path shown = path.startsWith(root) ? root.relativize(path) : path;
        return shown.toString().replace('\\', '/');
    }

    /**
     * Суффикс в нижнем регистре или {@link #NO_EXTENSION}.
     */
    static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return NO_EXTENSION;
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }
}
