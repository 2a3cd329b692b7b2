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

import java.util.List;

/**
 * Все факты одного файла. Внутри каждого вида факты идут в порядке исходника.
 */
public record SourceFacts(
        List<FunctionSymbol> functions,
        List<PreprocessDefine> preprocDefines,
        List<StringLiteral> stringLiterals,
        List<IncludeDirective> includes,
        List<SystemCall> systemCalls
) {

    public SourceFacts {
        functions = List.copyOf(functions);
        preprocDefines = List.copyOf(preprocDefines);
        stringLiterals = List.copyOf(stringLiterals);
        includes = List.copyOf(includes);
        systemCalls = List.copyOf(systemCalls);
    }

    public boolean isEmpty() {
        return functions.isEmpty() && preprocDefines.isEmpty() && stringLiterals.isEmpty()
                && includes.isEmpty() && systemCalls.isEmpty();
    }
}
