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

import ru.nts.tools.symbols.core.SymbolParseException;
import ru.nts.tools.symbols.core.treesitter.ParsedSource;
import ru.nts.tools.symbols.core.treesitter.PreprocessDefine;
import ru.nts.tools.symbols.core.treesitter.QueryMatch;
import ru.nts.tools.symbols.core.treesitter.QueryMatches;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Stream;

import static ru.nts.tools.symbols.core.treesitter.CppQueries.*;

/**
 * Извлекает макросы со значением ({@code #define NAME value}).
 */
public class PreprocessDefineExtractor implements FactExtractor<PreprocessDefine> {

    @Override
    public Stream<PreprocessDefine> extract(ParsedSource source, Consumer<SymbolParseException> diagnostics) {
        return QueryMatches.stream(PREPROC_DEFINE, source.root())
                .map(match -> FactExtractor.attempt(() -> toDefine(match, source), diagnostics))
                .flatMap(Optional::stream);
    }

    private static PreprocessDefine toDefine(QueryMatch match, ParsedSource source) {
        String name = source.text(match.first(NAME_CAPTURE)).strip();
        String value = source.text(match.first(VALUE_CAPTURE)).strip();
        return new PreprocessDefine(name, value);
    }
}
