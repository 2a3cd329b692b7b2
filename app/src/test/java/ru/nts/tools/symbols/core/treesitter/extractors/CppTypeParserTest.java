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

import org.junit.jupiter.api.Test;
import org.treesitter.TSNode;
import ru.nts.tools.symbols.core.SymbolErrorCode;
import ru.nts.tools.symbols.core.SymbolParseException;
import ru.nts.tools.symbols.core.treesitter.ParsedSource;
import ru.nts.tools.symbols.core.treesitter.TestNodes;

import static org.junit.jupiter.api.Assertions.*;

class CppTypeParserTest {

    @Test
    void returnTypeOfPlainFunction() {
        ParsedSource source = TestNodes.parse("unsigned long hash(const char* s){ return 0; }");
        TSNode function = TestNodes.find(source.root(), "function_definition");

        assertEquals("unsigned long", CppTypeParser.parseType(function, source));
    }

    @Test
    void referenceToPointerParameter() {
        ParsedSource source = TestNodes.parse("void reset(int*& ptr){}");
        TSNode param = TestNodes.find(source.root(), "parameter_declaration");

        assertEquals("int*&", CppTypeParser.parseType(param, source));
    }

    @Test
    void constPointerKeepsQualifierAfterStar() {
        ParsedSource source = TestNodes.parse("void fixed(char* const p){}");
        TSNode param = TestNodes.find(source.root(), "parameter_declaration");

        assertEquals("char* const", CppTypeParser.parseType(param, source));
    }

    @Test
    void optionalParameterIgnoresDefaultValue() {
        ParsedSource source = TestNodes.parse("void retry(int attempts = 3){}");
        TSNode param = TestNodes.find(source.root(), "optional_parameter_declaration");

        assertEquals("int", CppTypeParser.parseType(param, source));
    }

    @Test
    void twoDimensionalArrayDecaysTwice() {
        ParsedSource source = TestNodes.parse("void grid(int cells[][4]){}");
        TSNode param = TestNodes.find(source.root(), "parameter_declaration");

        assertEquals("int**", CppTypeParser.parseType(param, source));
    }

    @Test
    void unnamedParameterDropsAbstractDeclarator() {
        ParsedSource source = TestNodes.parse("void sink(const char**){}");
        TSNode param = TestNodes.find(source.root(), "parameter_declaration");

        assertEquals("const char", CppTypeParser.parseType(param, source));
    }

    @Test
    void unsupportedNodeIsRejected() {
        ParsedSource source = TestNodes.parse("int x = 1;");
        TSNode declaration = TestNodes.find(source.root(), "declaration");

        SymbolParseException e = assertThrows(SymbolParseException.class,
                () -> CppTypeParser.parseType(declaration, source));
        assertEquals(SymbolErrorCode.UNSUPPORTED_NODE, e.getCode());
        assertEquals("declaration", e.getContext().get("nodeType"));
    }
}
