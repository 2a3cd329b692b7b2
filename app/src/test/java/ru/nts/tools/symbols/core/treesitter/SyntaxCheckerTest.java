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

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxCheckerTest {

    @Test
    void validCodeHasNoErrors() {
        ParsedSource source = TestNodes.parse("""
                #include <vector>
                template <typename T>
                T sum(const std::vector<T>& items) {
                    T total{};
                    for (const auto& item : items) total += item;
                    return total;
                }
                """);

        assertFalse(SyntaxChecker.hasErrors(source.root()));
        assertTrue(SyntaxChecker.collectErrors(source.root()).isEmpty());
    }

    @Test
    void missingSemicolonIsDetectedInsideFunction() {
        ParsedSource source = TestNodes.parse("int broken() {\n    int a = 1\n    return a;\n}\n");
        TSNode function = TestNodes.find(source.root(), "function_definition");

        assertNotNull(function);
        assertTrue(SyntaxChecker.hasErrors(function));
    }

    @Test
    void errorsAreLimited() {
        StringBuilder code = new StringBuilder();
        for (int i = 0; i < 20; i++) {
            code.append("int f").append(i).append("( { ;\n");
        }

        List<SyntaxChecker.SyntaxError> errors = SyntaxChecker.collectErrors(TestNodes.parse(code.toString()).root());

        assertFalse(errors.isEmpty());
        assertTrue(errors.size() <= 5);
    }
}
