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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static ru.nts.tools.symbols.core.treesitter.AstUtils.*;
import static ru.nts.tools.symbols.core.treesitter.CppQueries.*;

/**
 * Разбор одного узла function_definition в {@link FunctionSymbol}.
 */
public class CppFunctionParser {

    private final TSNode fnNode;
    private final ParsedSource source;

    public CppFunctionParser(TSNode fnNode, ParsedSource source) {
        this.fnNode = fnNode;
        this.source = source;
    }

    /**
     * Разбирает определение функции.
     *
     * @throws SymbolParseException если ожидаемый узел не найден; ошибка несет текст функции
     */
    public FunctionSymbol parseFunction() {
        try {
            String returnType = CppTypeParser.parseType(fnNode, source);

            TSNode fnDeclarator = QueryMatches.firstCapture(FUNCTION_DECLARATOR, fnNode, FUNCTION_DECLARATOR_CAPTURE);
            if (fnDeclarator == null) {
                throw SymbolParseException.missing("function_declarator");
            }

            String qualifiedName = qualify(fnDeclarator, source.text(requireField(fnDeclarator, "declarator")));

            // field_identifier вместо identifier у методов, объявленных внутри класса
            TSNode identifier = QueryMatches.firstCapture(FUNCTION_IDENTIFIER, fnDeclarator, IDENTIFIER_CAPTURE);
            if (identifier == null) {
                throw SymbolParseException.missing("identifier");
            }
            String name = SignatureNormalizer.normalize(source.text(identifier));

            // Модификаторы самой функции, например const у метода. throw()/noexcept отбрасываются
            List<String> modifiers = new ArrayList<>();
            for (TSNode qualifier : childrenOfType(fnDeclarator, "type_qualifier")) {
                modifiers.add(SignatureNormalizer.normalize(source.text(qualifier)));
            }

            TSNode parameterList = QueryMatches.firstCapture(PARAMETER_LIST, fnDeclarator, PARAMETER_LIST_CAPTURE);
            if (parameterList == null) {
                throw SymbolParseException.missing("parameter_list");
            }
            List<String> parameters = new ArrayList<>();
            for (TSNode param : children(parameterList)) {
                if (PARAMETER_TYPES.contains(param.getType())) {
                    parameters.add(CppTypeParser.parseType(param, source));
                }
            }

            String sourceText = signatureText();

            return new FunctionSymbol(returnType, name, qualifiedName, parameters, modifiers, sourceText);
        } catch (SymbolParseException e) {
            throw e.withText(source.lenientText(fnNode).strip());
        }
    }

    /**
     * Добавляет к имени квалификаторы охватывающих namespace/class/struct.
     * Анонимные области пропускаются.
     */
    private String qualify(TSNode fnDeclarator, String baseName) {
        List<TSNode> scopes = ancestors(fnDeclarator)
                .filter(node -> SCOPE_TYPES.contains(node.getType()))
                .collect(Collectors.toList());
        Collections.reverse(scopes);

        List<String> qualifiers = new ArrayList<>();
        for (TSNode scope : scopes) {
            TSNode nameNode = field(scope, "name");
            if (nameNode != null) {
                qualifiers.add(SignatureNormalizer.normalize(source.text(nameNode)));
            }
        }

        String qualifiedName = baseName;
        if (!qualifiers.isEmpty()) {
            qualifiedName = String.join("::", qualifiers) + "::" + baseName;
        }
        return SignatureNormalizer.normalize(qualifiedName);
    }

    /**
     * Текст определения без тела функции, пробелы схлопнуты.
     * Без поля body текст возвращается как есть.
     */
    private String signatureText() {
        TSNode body = field(fnNode, "body");
        if (body == null) {
            return source.text(fnNode);
        }
        return SignatureNormalizer.collapseWhitespace(source.textWithout(fnNode, body));
    }
}
