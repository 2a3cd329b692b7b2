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

import org.treesitter.TSNode;
import ru.nts.tools.symbols.core.SymbolParseException;
import ru.nts.tools.symbols.core.treesitter.FunctionSymbol;
import ru.nts.tools.symbols.core.treesitter.ParsedSource;
import ru.nts.tools.symbols.core.treesitter.QueryMatches;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Stream;

import static ru.nts.tools.symbols.core.treesitter.CppQueries.FUNCTION_DEFINITION;
import static ru.nts.tools.symbols.core.treesitter.CppQueries.FUNCTION_DEFINITION_CAPTURE;
import static ru.nts.tools.symbols.core.treesitter.CppQueries.containsErrors;

/**
 * Извлекает определения функций.
 * Функция, поддерево которой содержит ERROR/MISSING узлы, пропускается целиком
 * без передачи в диагностику: это не ошибка разбора, а ненадежное дерево.
 */
public class FunctionExtractor implements FactExtractor<FunctionSymbol> {

    @Override
    public Stream<FunctionSymbol> extract(ParsedSource source, Consumer<SymbolParseException> diagnostics) {
        // Квантификатор (type_qualifier)* может дать несколько совпадений на один узел
        Set<Long> seen = new HashSet<>();
        return QueryMatches.stream(FUNCTION_DEFINITION, source.root())
                .filter(match -> match.has(FUNCTION_DEFINITION_CAPTURE))
                .map(match -> match.first(FUNCTION_DEFINITION_CAPTURE))
                .filter(node -> seen.add(key(node)))
                .filter(node -> !containsErrors(node))
                .map(node -> parse(node, source, diagnostics))
                .flatMap(Optional::stream);
    }

    private static Optional<FunctionSymbol> parse(TSNode node, ParsedSource source,
                                                  Consumer<SymbolParseException> diagnostics) {
        return FactExtractor.attempt(() -> new CppFunctionParser(node, source).parseFunction(), diagnostics);
    }

    private static long key(TSNode node) {
        return ((long) node.getStartByte() << 32) | (node.getEndByte() & 0xFFFFFFFFL);
    }
}
