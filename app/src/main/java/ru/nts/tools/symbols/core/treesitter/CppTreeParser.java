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
package ru.nts.tools.symbols.core.treesitter;

import ru.nts.tools.symbols.core.ParserOptions;
import ru.nts.tools.symbols.core.SourceEncoding;
import ru.nts.tools.symbols.core.SymbolParseException;
import ru.nts.tools.symbols.core.treesitter.SyntaxChecker.SyntaxError;
import ru.nts.tools.symbols.core.treesitter.extractors.FactExtractor;
import ru.nts.tools.symbols.core.treesitter.extractors.FunctionExtractor;
import ru.nts.tools.symbols.core.treesitter.extractors.IncludeExtractor;
import ru.nts.tools.symbols.core.treesitter.extractors.PreprocessDefineExtractor;
import ru.nts.tools.symbols.core.treesitter.extractors.StringLiteralExtractor;
import ru.nts.tools.symbols.core.treesitter.extractors.SystemCallExtractor;

import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Точка входа: разбирает исходник C/C++ один раз и выдает факты по запросу.
 *
 * <p>Пример:
 * <pre>{@code
 * CppTreeParser parser = CppTreeParser.fromSource(bytes);
 * parser.parseFunctions().forEach(f -> System.out.println(f.fullSignature()));
 * }</pre>
 *
 * <p>Каждый вызов {@code parse*} возвращает новый ленивый одноразовый поток;
 * дерево переиспользуется. Потоки никогда не бросают исключений: ошибочные
 * элементы пропускаются и передаются в {@link ParserOptions#diagnostics()}.
 * Экземпляр не потокобезопасен, для параллельной обработки нужен парсер на каждый файл.
 */
public final class CppTreeParser {

    private static final FactExtractor<FunctionSymbol> FUNCTIONS = new FunctionExtractor();
    private static final FactExtractor<PreprocessDefine> DEFINES = new PreprocessDefineExtractor();
    private static final FactExtractor<StringLiteral> LITERALS = new StringLiteralExtractor();
    private static final FactExtractor<IncludeDirective> INCLUDES = new IncludeExtractor();
    private static final FactExtractor<SystemCall> SYSTEM_CALLS = new SystemCallExtractor();

    private final ParsedSource source;
    private final Consumer<SymbolParseException> diagnostics;

    private CppTreeParser(ParsedSource source, Consumer<SymbolParseException> diagnostics) {
        this.source = source;
        this.diagnostics = diagnostics;
    }

    /**
     * Разбирает UTF-8 исходник с настройками по умолчанию.
     *
     * @throws SymbolParseException PARSE_FAILED или SOURCE_TOO_LARGE
     */
    public static CppTreeParser fromSource(byte[] bytes) {
        return fromSource(bytes, ParserOptions.defaults());
    }

    public static CppTreeParser fromSource(byte[] bytes, SourceEncoding encoding) {
        return fromSource(bytes, ParserOptions.defaults().withEncoding(encoding));
    }

    /**
     * Разбирает исходник с явными настройками.
     *
     * @throws SymbolParseException PARSE_FAILED или SOURCE_TOO_LARGE
     */
    public static CppTreeParser fromSource(byte[] bytes, ParserOptions options) {
        ParsedSource source = TreeSitterManager.getInstance().parse(bytes, options);
        return new CppTreeParser(source, options.diagnostics());
    }

    /**
     * Разбирает уже декодированный исходник.
     */
    public static CppTreeParser fromString(String content) {
        return fromString(content, ParserOptions.defaults());
    }

    public static CppTreeParser fromString(String content, ParserOptions options) {
        ParsedSource source = TreeSitterManager.getInstance().parse(content);
        return new CppTreeParser(source, options.diagnostics());
    }

    public ParsedSource source() {
        return source;
    }

    public Stream<FunctionSymbol> parseFunctions() {
        return FUNCTIONS.extract(source, diagnostics);
    }

    public Stream<PreprocessDefine> parsePreprocDefs() {
        return DEFINES.extract(source, diagnostics);
    }

    public Stream<StringLiteral> parseStringLiterals() {
        return LITERALS.extract(source, diagnostics);
    }

    public Stream<IncludeDirective> parseIncludes() {
        return INCLUDES.extract(source, diagnostics);
    }

    public Stream<SystemCall> parseSystemCalls() {
        return SYSTEM_CALLS.extract(source, diagnostics);
    }

    /**
     * Собирает все виды фактов в один снимок.
     */
    public SourceFacts collectFacts() {
        return new SourceFacts(
                parseFunctions().collect(Collectors.toList()),
                parsePreprocDefs().collect(Collectors.toList()),
                parseStringLiterals().collect(Collectors.toList()),
                parseIncludes().collect(Collectors.toList()),
                parseSystemCalls().collect(Collectors.toList()));
    }

    /**
     * Первые синтаксические ошибки файла (для отчетов; на извлечение не влияет).
     */
    public List<SyntaxError> syntaxErrors() {
        return SyntaxChecker.collectErrors(source.root());
    }
}
