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
import ru.nts.tools.symbols.core.treesitter.IncludeDirective;
import ru.nts.tools.symbols.core.treesitter.IncludeDirective.Kind;
import ru.nts.tools.symbols.core.treesitter.ParsedSource;
import ru.nts.tools.symbols.core.treesitter.QueryMatch;
import ru.nts.tools.symbols.core.treesitter.QueryMatches;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Stream;

import static ru.nts.tools.symbols.core.treesitter.CppQueries.*;

/**
 * Извлекает директивы {@code #include <...>} и {@code #include "..."}.
 */
public class IncludeExtractor implements FactExtractor<IncludeDirective> {

    @Override
    public Stream<IncludeDirective> extract(ParsedSource source, Consumer<SymbolParseException> diagnostics) {
        return QueryMatches.stream(INCLUDE, source.root())
                .map(match -> FactExtractor.attempt(() -> toInclude(match, source), diagnostics))
                .flatMap(Optional::stream);
    }

    private static IncludeDirective toInclude(QueryMatch match, ParsedSource source) {
        if (match.has(SYSTEM_INCLUDE_CAPTURE)) {
            return new IncludeDirective(Kind.SYSTEM, unwrap(match.first(SYSTEM_INCLUDE_CAPTURE), source));
        }
        return new IncludeDirective(Kind.USER, unwrap(match.first(USER_INCLUDE_CAPTURE), source));
    }

    /** Снимает ограничители: {@code <stdio.h>} и {@code "util.h"}. */
    private static String unwrap(TSNode node, ParsedSource source) {
        String text = source.text(node).strip();
        if (text.length() < 2) {
            return "";
        }
        return text.substring(1, text.length() - 1);
    }
}
