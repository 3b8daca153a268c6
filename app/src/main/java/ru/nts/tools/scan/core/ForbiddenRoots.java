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

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Системные директории, которые никогда не могут быть корнем сканирования.
 *
 * Сопоставление выполняется по сегментам пути: запись совпадает с самой директорией
 * и всеми ее потомками, но не с соседями, имеющими общий текстовый префикс
 * ({@code /etc} запрещает {@code /etc/ssl}, но не {@code /etcetera}).
 * Запись, оканчивающаяся на {@code *}, сравнивается как префикс имени
 * (так задаются приватные временные каталоги systemd с уникальным суффиксом).
 * Записи с буквой диска (Windows) сравниваются без учета регистра.
 */
public final class ForbiddenRoots {

    /**
     * Список по умолчанию.
     */
    public static final List<String> DEFAULTS = List.of(
            "/etc",
            "/sys",
            "/proc",
            "/root",
            "/boot",
            "/dev",
            "/run",
            "/var/run",
            "/tmp/systemd-private-*",
            "C:\\Windows",
            "C:\\Windows\\System32",
            "C:\\Program Files");

    private ForbiddenRoots() {
    }

    /**
     * Ищет первую запись списка, под которую попадает путь.
     *
     * @param canonicalPath Канонический путь корня проекта.
     * @param entries       Список запрещенных корней.
     *
     * @return Совпавшая запись или null, если путь разрешен.
     */
    public static String findMatch(String canonicalPath, Collection<String> entries) {
        for (String entry : entries) {
            if (matches(canonicalPath, entry)) {
                return entry;
            }
        }
        return null;
    }

    /**
     * Проверяет один путь против одной записи.
     */
    public static boolean matches(String path, String entry) {
        String candidate = normalize(path);
        String forbidden = normalize(entry);
        if (forbidden.isEmpty()) {
            return false;
        }

        if (isDriveLetterPath(forbidden)) {
            candidate = candidate.toLowerCase(Locale.ROOT);
            forbidden = forbidden.toLowerCase(Locale.ROOT);
        }

        if (forbidden.endsWith("*")) {
            return candidate.startsWith(forbidden.substring(0, forbidden.length() - 1));
        }
        if (forbidden.equals("/")) {
            return candidate.startsWith("/");
        }
        return candidate.equals(forbidden) || candidate.startsWith(forbidden + "/");
    }

    private static String normalize(String path) {
        String normalized = path.replace('\\', '/');
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    private static boolean isDriveLetterPath(String path) {
        return path.length() >= 2 && Character.isLetter(path.charAt(0)) && path.charAt(1) == ':';
    }
}
