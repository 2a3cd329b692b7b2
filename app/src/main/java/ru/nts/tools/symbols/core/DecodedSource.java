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
package ru.nts.tools.symbols.core;

import java.util.List;

/**
 * Текст исходника после декодирования.
 *
 * @param text           текст, некорректные последовательности заменены символом U+FFFD
 * @param malformedChars индексы символов-замен в {@code text}, по возрастанию
 */
public record DecodedSource(String text, List<Integer> malformedChars) {

    public DecodedSource {
        malformedChars = List.copyOf(malformedChars);
    }

    public boolean isClean() {
        return malformedChars.isEmpty();
    }
}
