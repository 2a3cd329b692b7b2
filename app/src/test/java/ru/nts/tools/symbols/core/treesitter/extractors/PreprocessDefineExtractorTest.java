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
import ru.nts.tools.symbols.core.treesitter.CppTreeParser;
import ru.nts.tools.symbols.core.treesitter.PreprocessDefine;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PreprocessDefineExtractorTest {

    @Test
    void extractsDefinesWithValuesOnly() {
        List<PreprocessDefine> defines = CppTreeParser.fromString("""
                #ifndef CONFIG_H
                #define CONFIG_H
                #define PI 3.14159
                #define VERSION   "1.2.3"
                #define BUFFER_SIZE (4 * 1024)
                #endif
                """).parsePreprocDefs().collect(Collectors.toList());

        assertEquals(List.of(
                new PreprocessDefine("PI", "3.14159"),
                new PreprocessDefine("VERSION", "\"1.2.3\""),
                new PreprocessDefine("BUFFER_SIZE", "(4 * 1024)")
        ), defines);
    }

    @Test
    void functionLikeMacrosAreNotPlainDefines() {
        List<PreprocessDefine> defines = CppTreeParser.fromString("#define SQUARE(x) ((x) * (x))\n")
                .parsePreprocDefs().collect(Collectors.toList());

        assertTrue(defines.isEmpty());
    }
}
