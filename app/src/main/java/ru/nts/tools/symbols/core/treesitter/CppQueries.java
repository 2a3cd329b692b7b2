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

import org.treesitter.TSNode;
import org.treesitter.TSQuery;

import java.util.Set;

/**
 * Каталог tree-sitter запросов для C/C++.
 * Запросы компилируются один раз и только читаются, поэтому общие для всех разборов;
 * курсор создается на каждый проход.
 */
public final class CppQueries {

    private CppQueries() {}

    public static final String FUNCTION_DEFINITION_CAPTURE = "function_definition";
    public static final String FUNCTION_DECLARATOR_CAPTURE = "function_declarator";
    public static final String IDENTIFIER_CAPTURE = "identifier";
    public static final String PARAMETER_LIST_CAPTURE = "parameter_list";
    public static final String PARAMETER_IDENTIFIER_CAPTURE = "declarator";
    public static final String NAME_CAPTURE = "name";
    public static final String VALUE_CAPTURE = "value";
    public static final String STRING_CAPTURE = "string";
    public static final String SYSTEM_INCLUDE_CAPTURE = "system_include";
    public static final String USER_INCLUDE_CAPTURE = "user_include";
    public static final String CALL_FUNCTION_CAPTURE = "function_name";
    public static final String CALL_ARGUMENTS_CAPTURE = "arg_list";

    /**
     * Определения функций: квалификаторы, тип и декларатор.
     */
    public static final TSQuery FUNCTION_DEFINITION = query("""
            (
                function_definition
                    (type_qualifier)* @type_qualifier
                    type: (_) @type
                    declarator: (_) @declarator
            ) @function_definition
            """);

    /**
     * Собственный декларатор функции (внутри оберток pointer/reference).
     */
    public static final TSQuery FUNCTION_DECLARATOR = query(
            "(function_declarator) @function_declarator");

    /**
     * Короткое имя функции; field_identifier встречается у методов внутри класса.
     */
    public static final TSQuery FUNCTION_IDENTIFIER = query(
            "[(identifier) (field_identifier) (operator_name)] @identifier");

    public static final TSQuery PARAMETER_LIST = query(
            "(function_declarator parameters: (parameter_list) @parameter_list)");

    public static final TSQuery PARAMETER_IDENTIFIER = query(
            "(identifier) @declarator");

    /**
     * Только макросы со значением: {@code #define PI 3.14}, но не include guard.
     */
    public static final TSQuery PREPROC_DEFINE = query("""
            (
                preproc_def
                    name: (_) @name
                    value: (_) @value
            )
            """);

    public static final TSQuery STRING_LITERAL = query(
            "(string_literal) @string");

    public static final TSQuery INCLUDE = query("""
            (preproc_include
                (system_lib_string) @system_include
            )
            (preproc_include
                (string_literal) @user_include
            )
            """);

    public static final TSQuery CALL = query("""
            (call_expression
                function: (identifier) @function_name
                arguments: (argument_list) @arg_list
            )
            """);

    /** Типы узлов-параметров в parameter_list. Остальные дети это пунктуация. */
    public static final Set<String> PARAMETER_TYPES =
            Set.of("parameter_declaration", "optional_parameter_declaration");

    /** Области видимости, добавляющие квалификатор к имени функции. */
    public static final Set<String> SCOPE_TYPES =
            Set.of("namespace_definition", "class_specifier", "struct_specifier");

    /** Узлы, внутри которых строковый литерал считается частью выражения. */
    public static final Set<String> STATEMENT_TYPES =
            Set.of("declaration", "expression_statement");

    /** Литеральные токены указателей и ссылок в цепочке деклараторов. */
    public static final Set<String> POINTER_TOKENS = Set.of("*", "&", "&&");

    public static final Set<String> ARRAY_DECLARATOR_TYPES = Set.of("array_declarator");

    /**
     * Есть ли в поддереве ERROR/MISSING узлы.
     */
    public static boolean containsErrors(TSNode node) {
        return SyntaxChecker.hasErrors(node);
    }

    private static TSQuery query(String source) {
        return new TSQuery(TreeSitterManager.getInstance().getLanguage(), source);
    }
}
