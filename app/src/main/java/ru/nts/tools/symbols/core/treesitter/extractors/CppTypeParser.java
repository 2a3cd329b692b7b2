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
import ru.nts.tools.symbols.core.SymbolErrorCode;
import ru.nts.tools.symbols.core.SymbolParseException;
import ru.nts.tools.symbols.core.treesitter.ParsedSource;
import ru.nts.tools.symbols.core.treesitter.QueryMatches;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static ru.nts.tools.symbols.core.treesitter.AstUtils.*;
import static ru.nts.tools.symbols.core.treesitter.CppQueries.*;

/**
 * Восстанавливает полный тип из цепочки деклараторов C/C++.
 *
 * <p>Указатели, ссылки и массивы в грамматике оборачивают идентификатор изнутри наружу:
 * {@code int* arr[]} разбирается как pointer_declarator(array_declarator(arr)). Печатаются же
 * модификаторы рядом с базовым типом, поэтому цепочка собирается от идентификатора
 * наружу и применяется в обратном порядке.
 *
 * <p>Поддерживаются function_definition (возвращаемый тип) и
 * parameter_declaration / optional_parameter_declaration (тип параметра).
 * Функции, возвращающие указатель на функцию, не поддерживаются.
 */
public final class CppTypeParser {

    private CppTypeParser() {}

    /**
     * Возвращает нормализованный тип узла.
     *
     * @throws SymbolParseException если узел другого вида или у него нет поля type
     */
    public static String parseType(TSNode node, ParsedSource source) {
        String nodeType = node.getType();
        List<TSNode> wrappers;
        if (nodeType.equals("function_definition")) {
            TSNode declarator = QueryMatches.firstCapture(FUNCTION_DECLARATOR, node, FUNCTION_DECLARATOR_CAPTURE);
            wrappers = declarator != null ? ancestorsBelow(declarator, node) : List.of();
        } else if (PARAMETER_TYPES.contains(nodeType)) {
            wrappers = parameterWrappers(node);
        } else {
            throw new SymbolParseException(SymbolErrorCode.UNSUPPORTED_NODE, "nodeType", nodeType);
        }

        List<String> qualifiers = new ArrayList<>();
        for (TSNode qualifier : childrenOfType(node, "type_qualifier")) {
            qualifiers.add(source.text(qualifier).strip());
        }

        String baseType = source.text(requireField(node, "type")).strip();

        // Ближайшая к базовому типу обертка печатается первой
        List<TSNode> chain = new ArrayList<>(wrappers);
        Collections.reverse(chain);

        List<String> modifiers = new ArrayList<>();
        for (TSNode wrapper : chain) {
            for (TSNode child : children(wrapper)) {
                if (POINTER_TOKENS.contains(child.getType())) {
                    modifiers.add(child.getType());
                }
            }

            // Массив в параметре передается как указатель
            if (ARRAY_DECLARATOR_TYPES.contains(wrapper.getType())) {
                modifiers.add("*");
            }

            for (TSNode qualifier : childrenOfType(wrapper, "type_qualifier")) {
                modifiers.add(source.text(qualifier).strip());
            }
        }

        String finalType = String.join(" ", qualifiers) + " " + baseType + String.join(" ", modifiers);
        return SignatureNormalizer.normalize(finalType);
    }

    /**
     * Обертки между идентификатором параметра и самим параметром, от внутренней к внешней.
     * У безымянного параметра ({@code int*}, {@code char[]}) идентификатора нет:
     * модификаторы абстрактного декларатора не печатаются, остается базовый тип.
     */
    private static List<TSNode> parameterWrappers(TSNode param) {
        TSNode declarator = field(param, "declarator");
        if (declarator == null) {
            return List.of();
        }

        TSNode identifier = QueryMatches.firstCapture(PARAMETER_IDENTIFIER, declarator, PARAMETER_IDENTIFIER_CAPTURE);
        return identifier != null ? ancestorsBelow(identifier, param) : List.of();
    }
}
