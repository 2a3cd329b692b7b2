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
import ru.nts.tools.symbols.core.treesitter.AstUtils;
import ru.nts.tools.symbols.core.treesitter.ParsedSource;
import ru.nts.tools.symbols.core.treesitter.QueryMatches;
import ru.nts.tools.symbols.core.treesitter.StringLiteral;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Stream;

import static ru.nts.tools.symbols.core.treesitter.CppQueries.*;

/**
 * Извлекает строковые литералы вместе с объявлением или выражением, в котором они стоят.
 * Каждый литерал дает отдельную запись, даже если выражение общее.
 * Литералы в {@code #include "..."} и литералы вне declaration/expression_statement
 * (аргументы макросов верхнего уровня, инициализаторы членов класса) отбрасываются.
 */
public class StringLiteralExtractor implements FactExtractor<StringLiteral> {

    private static final Set<String> INCLUDE_TYPES = Set.of("preproc_include");

    @Override
    public Stream<StringLiteral> extract(ParsedSource source, Consumer<SymbolParseException> diagnostics) {
        return QueryMatches.stream(STRING_LITERAL, source.root())
                .filter(match -> match.has(STRING_CAPTURE))
                .map(match -> match.first(STRING_CAPTURE))
                .filter(node -> !isIncludePath(node))
                .map(node -> AstUtils.nearestAncestor(node, STATEMENT_TYPES))
                .filter(Objects::nonNull)
                .map(statement -> FactExtractor.attempt(() -> toLiteral(statement, source), diagnostics))
                .flatMap(Optional::stream);
    }

    private static boolean isIncludePath(TSNode node) {
        return AstUtils.nearestAncestor(node, INCLUDE_TYPES) != null;
    }

    private static StringLiteral toLiteral(TSNode statement, ParsedSource source) {
        return new StringLiteral(source.text(statement).strip());
    }
}
