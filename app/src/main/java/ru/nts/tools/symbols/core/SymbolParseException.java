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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Структурированная ошибка разбора.
 * Хранит код ошибки и контекст; ключ {@link #TEXT_KEY} содержит исходный текст,
 * на котором разбор был прерван.
 */
public class SymbolParseException extends RuntimeException {

    public static final String TEXT_KEY = "text";

    private final SymbolErrorCode code;
    private final Map<String, Object> context;

    public SymbolParseException(SymbolErrorCode code) {
        super(code.getMessage());
        this.code = code;
        this.context = Collections.emptyMap();
    }

    public SymbolParseException(SymbolErrorCode code, Map<String, Object> context) {
        super(code.getMessage());
        this.code = code;
        this.context = context != null ? new LinkedHashMap<>(context) : Collections.emptyMap();
    }

    public SymbolParseException(SymbolErrorCode code, String key, Object value) {
        super(code.getMessage());
        this.code = code;
        this.context = Map.of(key, value);
    }

    public SymbolParseException(SymbolErrorCode code, Map<String, Object> context, Throwable cause) {
        super(code.getMessage(), cause);
        this.code = code;
        this.context = context != null ? new LinkedHashMap<>(context) : Collections.emptyMap();
    }

    /**
     * Ошибка отсутствия ожидаемого узла или захвата.
     */
    public static SymbolParseException missing(String what) {
        return new SymbolParseException(SymbolErrorCode.MISSING_NODE, "node", what);
    }

    /**
     * Возвращает копию ошибки, привязанную к исходному тексту узла.
     * Исходная ошибка сохраняется как причина.
     */
    public SymbolParseException withText(String text) {
        Map<String, Object> tagged = new LinkedHashMap<>(context);
        tagged.put(TEXT_KEY, text);
        return new SymbolParseException(code, tagged, this);
    }

    public SymbolErrorCode getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return Collections.unmodifiableMap(context);
    }

    /**
     * Текст, который разбирался в момент ошибки, или null.
     */
    public String getText() {
        Object text = context.get(TEXT_KEY);
        return text != null ? text.toString() : null;
    }

    public String toUserMessage() {
        return code.format(context);
    }

    @Override
    public String getMessage() {
        String text = getText();
        if (text == null) {
            return code.getMessage();
        }
        return code.getMessage() + " While parsing: \"" + text + "\"";
    }

    /**
     * Компактное однострочное сообщение для логов.
     */
    public String toLogMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(code.name()).append("] ").append(code.getMessage());
        if (!context.isEmpty()) {
            sb.append(" | ");
            boolean first = true;
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                if (!first) sb.append(", ");
                String value = String.valueOf(entry.getValue()).replaceAll("\\s+", " ");
                sb.append(entry.getKey()).append("=").append(value);
                first = false;
            }
        }
        return sb.toString();
    }
}
