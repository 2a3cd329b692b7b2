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
import java.util.Objects;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Настройки разбора одного исходника.
 *
 * @param encoding       объявленная кодировка байтов
 * @param maxSourceBytes максимальный размер исходника для разбора
 * @param diagnostics    получатель ошибок по отброшенным элементам
 */
public record ParserOptions(
        SourceEncoding encoding,
        long maxSourceBytes,
        Consumer<SymbolParseException> diagnostics
) {

    public static final String ENCODING_ENV = "CPP_SYMBOLS_ENCODING";
    public static final String MAX_SOURCE_BYTES_ENV = "CPP_SYMBOLS_MAX_SOURCE_BYTES";

    /**
     * Максимальный размер файла для парсинга по умолчанию (5MB).
     */
    public static final long DEFAULT_MAX_SOURCE_BYTES = 5 * 1024 * 1024;

    // До 18 цифр, чтобы значение заведомо помещалось в long
    private static final Pattern POSITIVE_NUMBER = Pattern.compile("\\+?\\d{1,18}");

    private static final ParserOptions DEFAULTS =
            new ParserOptions(SourceEncoding.UTF8, DEFAULT_MAX_SOURCE_BYTES, ExtractionDiagnostics.ignore());

    public ParserOptions {
        Objects.requireNonNull(encoding, "encoding");
        Objects.requireNonNull(diagnostics, "diagnostics");
        if (maxSourceBytes <= 0) {
            throw new IllegalArgumentException("maxSourceBytes must be positive: " + maxSourceBytes);
        }
    }

    public static ParserOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Настройки из переменных окружения процесса.
     */
    public static ParserOptions fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Настройки из переданного окружения. Некорректные значения молча игнорируются.
     */
    public static ParserOptions fromEnvironment(Map<String, String> env) {
        ParserOptions options = DEFAULTS;

        String encoding = env.get(ENCODING_ENV);
        if (encoding != null && !encoding.isBlank()) {
            options = SourceEncoding.fromId(encoding)
                    .map(options::withEncoding)
                    .orElse(options);
        }

        String maxBytes = env.get(MAX_SOURCE_BYTES_ENV);
        if (maxBytes != null && POSITIVE_NUMBER.matcher(maxBytes.trim()).matches()) {
            long parsed = Long.parseLong(maxBytes.trim());
            if (parsed > 0) {
                options = options.withMaxSourceBytes(parsed);
            }
        }
        return options;
    }

    public ParserOptions withEncoding(SourceEncoding newEncoding) {
        return new ParserOptions(newEncoding, maxSourceBytes, diagnostics);
    }

    public ParserOptions withMaxSourceBytes(long newMaxSourceBytes) {
        return new ParserOptions(encoding, newMaxSourceBytes, diagnostics);
    }

    public ParserOptions withDiagnostics(Consumer<SymbolParseException> newDiagnostics) {
        return new ParserOptions(encoding, maxSourceBytes, newDiagnostics);
    }
}
