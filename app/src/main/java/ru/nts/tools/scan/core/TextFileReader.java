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

import org.mozilla.universalchardet.UniversalDetector;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Чтение текстовых файлов проекта для подсчета строк.
 * Кодировка определяется через UniversalDetector (juniversalchardet), невалидный UTF-8
 * трактуется как windows-1251. Бинарные и слишком большие файлы отклоняются.
 *
 * Вызывающий код обязан передавать только пути, уже прошедшие {@link PathBoundaryValidator}.
 */
public final class TextFileReader {

    /**
     * Максимальный размер читаемого файла (10 МБ).
     */
    public static final long MAX_TEXT_FILE_SIZE = 10 * 1024 * 1024;

    private static final Charset WINDOWS_1251 = Charset.forName("windows-1251");

    private static final int BINARY_CHECK_LIMIT = 8192;

    private TextFileReader() {
    }

    /**
     * Содержимое текстового файла с кодировкой, которой оно было декодировано.
     */
    public record TextFileContent(String content, Charset charset) {

        /**
         * Число строк; завершающий перевод строки новую строку не образует.
         */
        public long lineCount() {
            return content.lines().count();
        }
    }

    /**
     * Считывает файл целиком с автоопределением кодировки.
     *
     * @throws IOException если файл недоступен, больше {@link #MAX_TEXT_FILE_SIZE} или бинарный.
     */
    public static TextFileContent read(Path path) throws IOException {
        long size = Files.size(path);
        if (size > MAX_TEXT_FILE_SIZE) {
            throw new IOException(String.format("File is too large (%d bytes). Limit is %d bytes.", size, MAX_TEXT_FILE_SIZE));
        }

        byte[] bytes = Files.readAllBytes(path);
        Charset charset = detectCharset(bytes);
        bytes = stripBom(bytes, charset);

        String name = charset.name();
        if (!name.startsWith("UTF-16") && !name.startsWith("UTF-32")) {
            int limit = Math.min(bytes.length, BINARY_CHECK_LIMIT);
            for (int i = 0; i < limit; i++) {
                if (bytes[i] == 0) {
                    throw new IOException("Binary file detected (contains NUL bytes): " + path.getFileName());
                }
            }
        }
        return new TextFileContent(new String(bytes, charset), charset);
    }

    static Charset detectCharset(byte[] bytes) {
        UniversalDetector detector = new UniversalDetector(null);
        detector.handleData(bytes, 0, bytes.length);
        detector.dataEnd();
        String encoding = detector.getDetectedCharset();

        Charset charset = StandardCharsets.UTF_8;
        if (encoding != null) {
            try {
                charset = Charset.forName(encoding);
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                charset = StandardCharsets.UTF_8;
            }
        }
        // Кириллица без BOM часто не распознается детектором
        if ((encoding == null || charset.equals(StandardCharsets.UTF_8)) && !isValidUtf8(bytes)) {
            return WINDOWS_1251;
        }
        return charset;
    }

    private static byte[] stripBom(byte[] bytes, Charset charset) {
        int offset = 0;
        String name = charset.name();
        if (name.equals("UTF-8")) {
            if (bytes.length >= 3 && (bytes[0] & 0xFF) == 0xEF && (bytes[1] & 0xFF) == 0xBB && (bytes[2] & 0xFF) == 0xBF) {
                offset = 3;
            }
        } else if (name.startsWith("UTF-16") && bytes.length >= 2) {
            int b0 = bytes[0] & 0xFF;
            int b1 = bytes[1] & 0xFF;
            if ((b0 == 0xFE && b1 == 0xFF) || (b0 == 0xFF && b1 == 0xFE)) {
                offset = 2;
            }
        }
        if (offset == 0) {
            return bytes;
        }
        byte[] withoutBom = new byte[bytes.length - offset];
        System.arraycopy(bytes, offset, withoutBom, 0, withoutBom.length);
        return withoutBom;
    }

    private static boolean isValidUtf8(byte[] bytes) {
        int i = 0;
        while (i < bytes.length) {
            int b = bytes[i++] & 0xFF;
            if (b <= 0x7F) {
                continue;
            }
            int count;
            if (b >= 0xC2 && b <= 0xDF) {
                count = 1;
            } else if (b >= 0xE0 && b <= 0xEF) {
                count = 2;
            } else if (b >= 0xF0 && b <= 0xF4) {
                count = 3;
            } else {
                return false;
            }
            if (i + count > bytes.length) {
                return false;
            }
            for (int j = 0; j < count; j++) {
                int next = bytes[i++] & 0xFF;
                if (next < 0x80 || next > 0xBF) {
                    return false;
                }
            }
        }
        return true;
    }
}
