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

import org.junit.jupiter.api.Test;
import org.treesitter.TSNode;
import ru.nts.tools.symbols.core.SymbolErrorCode;
import ru.nts.tools.symbols.core.SymbolParseException;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class AstUtilsTest {

    private final ParsedSource source = TestNodes.parse("namespace outer { int** grid(int n) { return 0; } }");

    @Test
    void ancestorsEndAtRoot() {
        TSNode identifier = TestNodes.find(source.root(), "identifier");

        List<String> types = AstUtils.ancestors(identifier).map(TSNode::getType).collect(Collectors.toList());

        assertEquals("function_declarator", types.get(0));
        assertEquals("translation_unit", types.get(types.size() - 1));
        assertNull(AstUtils.parentOf(source.root()));
    }

    @Test
    void ancestorsBelowStopsAtOuterNode() {
        TSNode function = TestNodes.find(source.root(), "function_definition");
        TSNode declarator = TestNodes.find(function, "function_declarator");

        List<String> types = AstUtils.ancestorsBelow(declarator, function).stream()
                .map(TSNode::getType)
                .collect(Collectors.toList());

        assertEquals(List.of("pointer_declarator", "pointer_declarator"), types);
    }

    @Test
    void nearestAncestorFindsScope() {
        TSNode identifier = TestNodes.find(source.root(), "identifier");

        TSNode scope = AstUtils.nearestAncestor(identifier, CppQueries.SCOPE_TYPES);

        assertNotNull(scope);
        assertEquals("namespace_definition", scope.getType());
        assertNull(AstUtils.nearestAncestor(identifier, Set.of("class_specifier")));
    }

    @Test
    void childrenIncludeAnonymousTokens() {
        TSNode pointer = TestNodes.find(source.root(), "pointer_declarator");

        List<String> types = AstUtils.children(pointer).stream().map(TSNode::getType).collect(Collectors.toList());

        assertEquals("*", types.get(0));
        assertEquals(1, AstUtils.childrenOfType(pointer, "*").size());
    }

    @Test
    void requireFieldReportsMissingField() {
        TSNode identifier = TestNodes.find(source.root(), "identifier");

        assertNull(AstUtils.field(identifier, "type"));
        SymbolParseException e = assertThrows(SymbolParseException.class,
                () -> AstUtils.requireField(identifier, "type"));
        assertEquals(SymbolErrorCode.MISSING_NODE, e.getCode());
        assertEquals("identifier.type", e.getContext().get("node"));
    }

    @Test
    void sameNodeComparesRangeAndType() {
        TSNode first = TestNodes.find(source.root(), "function_definition");
        TSNode second = TestNodes.find(source.root(), "function_definition");

        assertTrue(AstUtils.sameNode(first, second));
        assertFalse(AstUtils.sameNode(first, source.root()));
    }
}
