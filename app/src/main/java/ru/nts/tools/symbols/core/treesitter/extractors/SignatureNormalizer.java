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
package ru.nts.tools.symbols.core.treesitter.extractors;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Приводит типы и сигнатуры к единому виду.
 * Правила применяются строго по порядку; повторная нормализация ничего не меняет.
 */
public final class SignatureNormalizer {

    private SignatureNormalizer() {}

    private record Rule(Pattern pattern, String replacement) {}

    private static final List<Rule> RULES = List.of(
            // "a\nb\nc" -> "a b c"
            new Rule(Pattern.compile("\n"), " "),
            // "int *" / "float &" -> "int*" / "float&"
            new Rule(Pattern.compile("\\s+(?=[*&])"), ""),
            // "a,b, c" -> "a, b, c"
            new Rule(Pattern.compile(",(?=\\S)"), ", "),
            // "pair< int, float >" -> "pair<int, float>"
            new Rule(Pattern.compile("(?<=<)\\s+|\\s+(?=>)"), ""),
            // "a   b" -> "a b"
            new Rule(Pattern.compile("\\s+"), " ")
    );

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Нормализует тип или сигнатуру.
     */
    public static String normalize(String text) {
        String result = text;
        for (Rule rule : RULES) {
            result = rule.pattern().matcher(result).replaceAll(rule.replacement());
        }
        return result.strip();
    }

    /**
     * Схлопывает любые пробельные последовательности в один пробел.
     */
    public static String collapseWhitespace(String text) {
        return WHITESPACE.matcher(text.strip()).replaceAll(" ").strip();
    }
}
