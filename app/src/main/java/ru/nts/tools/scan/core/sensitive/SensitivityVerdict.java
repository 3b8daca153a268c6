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

import java.util.Objects;
import java.util.Optional;

/**
 * Вердикт классификатора для одного пути.
 *
 * @param sensitive Путь считается чувствительным.
 * @param reason    Причина (null для нечувствительных путей).
 * @param category  Сработавшее правило (null для нечувствительных путей).
 */
public record SensitivityVerdict(boolean sensitive, String reason, SensitivityCategory category) {

    public static final SensitivityVerdict NOT_SENSITIVE = new SensitivityVerdict(false, null, null);

    public SensitivityVerdict {
        if (sensitive) {
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(category, "category");
        }
    }

    public static SensitivityVerdict sensitive(String reason, SensitivityCategory category) {
        return new SensitivityVerdict(true, reason, category);
    }

    public Optional<String> reasonIfSensitive() {
        return Optional.ofNullable(reason);
    }
}
