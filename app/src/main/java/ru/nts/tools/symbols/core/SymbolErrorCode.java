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

import java.util.Map;

/**
 * Коды ошибок извлечения символов.
 * Каждый код несет краткое сообщение и подсказку; подсказка может содержать
 * плейсхолдеры вида %key%, которые подставляются из контекста исключения.
 */
public enum SymbolErrorCode {

    // ============ Per-item errors (элемент пропускается) ============

    MISSING_NODE("Expected syntax node not found",
            "Declarator chain is malformed or was misidentified. Missing: %node%."),

    UNSUPPORTED_NODE("Unexpected syntax node kind",
            "Type reconstruction accepts function_definition or parameter nodes, got %nodeType%."),

    DECODE_FAILED("Cannot decode node text",
            "Bytes %start%-%end% are not valid UTF-8. Check the declared source encoding."),

    // ============ Tree production errors ============

    PARSE_FAILED("Failed to produce syntax tree",
            "tree-sitter returned no tree. Check that the C++ grammar is available."),

    SOURCE_TOO_LARGE("Source too large",
            "Source has %size% bytes, limit is %limit%. Raise CPP_SYMBOLS_MAX_SOURCE_BYTES if needed.");

    private final String message;
    private final String solution;

    SymbolErrorCode(String message, String solution) {
        this.message = message;
        this.solution = solution;
    }

    public String getMessage() {
        return message;
    }

    public String getSolution() {
        return solution;
    }

    /**
     * Форматирует сообщение об ошибке с подстановкой контекста.
     *
     * @param context значения для плейсхолдеров, может быть null
     * @return многострочное описание ошибки
     */
    public String format(Map<String, Object> context) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[ERROR: %s]\n", this.name()));
        sb.append(String.format("Message: %s\n", message));

        String resolvedSolution = solution;
        if (context != null) {
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                resolvedSolution = resolvedSolution.replace(
                        "%" + entry.getKey() + "%", String.valueOf(entry.getValue()));
            }
        }
        // Неиспользованные плейсхолдеры
        resolvedSolution = resolvedSolution.replaceAll("%\\w+%", "...");
        sb.append(String.format("Solution: %s", resolvedSolution));

        return sb.toString();
    }

    public String format() {
        return format(null);
    }
}
