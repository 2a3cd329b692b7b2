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

import java.io.PrintStream;
import java.util.function.Consumer;

/**
 * Стандартные получатели ошибок по отброшенным элементам.
 * Сам движок ничего не пишет в лог; что делать с ошибкой, решает вызывающий код.
 */
public final class ExtractionDiagnostics {

    private static final Consumer<SymbolParseException> IGNORE = e -> { };

    private ExtractionDiagnostics() {}

    /**
     * Отбрасывает ошибки без вывода.
     */
    public static Consumer<SymbolParseException> ignore() {
        return IGNORE;
    }

    /**
     * Печатает однострочное сообщение в stderr.
     */
    public static Consumer<SymbolParseException> stderr() {
        return printTo(System.err);
    }

    public static Consumer<SymbolParseException> printTo(PrintStream out) {
        return e -> out.println("Skipped item: " + e.toLogMessage());
    }
}
