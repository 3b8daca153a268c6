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

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Встроенные таблицы классификатора.
 * Порядок {@link #FILENAME_PATTERNS} значим: причина берется у первого совпавшего шаблона.
 */
public final class SensitivePatterns {

    /**
     * Шаблон имени файла с описанием причины.
     * Шаблон ищется в любом месте имени (find), без учета регистра.
     */
    public record FilenamePattern(Pattern pattern, String description) {

        public static FilenamePattern of(String regex, String description) {
            return new FilenamePattern(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), description);
        }

        public boolean matches(String fileName) {
            return pattern.matcher(fileName).find();
        }
    }

    public static final String CUSTOM_PATTERN_DESCRIPTION = "Custom sensitive pattern";

    public static final List<FilenamePattern> FILENAME_PATTERNS = List.of(
            // Environment files
            FilenamePattern.of("\\.env$", "Environment variables"),
            FilenamePattern.of("\\.env\\..*", "Environment variables (specific environment)"),
            FilenamePattern.of("env\\..*", "Environment variables"),

            // Credentials and secrets
            FilenamePattern.of("credentials\\.json$", "GCP/AWS credentials"),
            FilenamePattern.of("credentials\\.ya?ml$", "Credentials file"),
            FilenamePattern.of("service-account.*\\.json$", "Service account credentials"),
            FilenamePattern.of("secrets\\.json$", "Secrets file"),
            FilenamePattern.of("secrets\\.ya?ml$", "Secrets file"),
            FilenamePattern.of("\\.secrets$", "Secrets file"),

            // Private keys and certificates
            FilenamePattern.of(".*\\.pem$", "PEM certificate/key"),
            FilenamePattern.of(".*\\.key$", "Private key"),
            FilenamePattern.of(".*\\.p12$", "PKCS12 certificate"),
            FilenamePattern.of(".*\\.pfx$", "PFX certificate"),
            FilenamePattern.of("id_rsa$", "SSH private key"),
            FilenamePattern.of("id_dsa$", "SSH private key"),
            FilenamePattern.of("id_ecdsa$", "SSH private key"),
            FilenamePattern.of("id_ed25519$", "SSH private key"),
            FilenamePattern.of(".*_rsa$", "RSA private key"),
            FilenamePattern.of(".*_dsa$", "DSA private key"),

            // API keys and tokens
            FilenamePattern.of("\\.?api[-_]?keys?\\..*", "API keys"),
            FilenamePattern.of("\\.?auth[-_]?tokens?\\..*", "Authentication tokens"),
            FilenamePattern.of("\\.npmrc$", "NPM credentials"),
            FilenamePattern.of("\\.pypirc$", "PyPI credentials"),

            // Cloud provider configs; файлы внутри .aws/.gcp/.azure ловятся по директории
            FilenamePattern.of("\\.aws/credentials$", "AWS credentials"),
            FilenamePattern.of("\\.aws/config$", "AWS config"),
            FilenamePattern.of("\\.gcp/credentials$", "GCP credentials"),
            FilenamePattern.of("\\.azure/credentials$", "Azure credentials"),

            // Database configs
            FilenamePattern.of("database\\.ya?ml$", "Database configuration"),
            FilenamePattern.of("db\\.ya?ml$", "Database configuration"),

            // Password files
            FilenamePattern.of("passwords?\\.txt$", "Password file"),
            FilenamePattern.of("passwd$", "Password file"),
            FilenamePattern.of("shadow$", "Shadow password file"),

            // Backups and dumps
            FilenamePattern.of(".*\\.sql\\.gz$", "Database dump"),
            FilenamePattern.of(".*\\.sql$", "Database dump"),
            FilenamePattern.of("backup.*\\.tar\\.gz$", "Backup archive"),

            // Private notes and documents
            FilenamePattern.of("private.*\\.txt$", "Private document"),
            FilenamePattern.of("confidential.*", "Confidential document"));

    /**
     * Имена директорий (в нижнем регистре), содержимое которых считается чувствительным целиком.
     */
    public static final Set<String> SENSITIVE_DIRECTORIES = Set.of(
            ".git",
            ".ssh",
            ".gnupg",
            ".aws",
            ".azure",
            ".gcp",
            "credentials",
            "secrets",
            "private",
            "confidential");

    /**
     * Расширения (в нижнем регистре, с точкой).
     */
    public static final Set<String> SENSITIVE_EXTENSIONS = Set.of(
            ".pem",
            ".key",
            ".p12",
            ".pfx",
            ".jks",
            ".keystore");

    private SensitivePatterns() {
    }
}
