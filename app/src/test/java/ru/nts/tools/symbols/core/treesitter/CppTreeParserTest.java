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
import ru.nts.tools.symbols.core.ParserOptions;
import ru.nts.tools.symbols.core.SourceEncoding;
import ru.nts.tools.symbols.core.SymbolErrorCode;
import ru.nts.tools.symbols.core.SymbolParseException;
import ru.nts.tools.symbols.core.treesitter.extractors.FunctionExtractor;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CppTreeParserTest {

    private static final String LIBRARY = """
            #include <stdlib.h>
            #include "version.h"
            #define MAX_RETRIES 5

            namespace net {
            int connect(const char* host, int port) {
                const char* fallback = "localhost";
                system("/usr/bin/ping -c 1 localhost");
                return port;
            }
            }
            """;

    @Test
    void collectsAllFactKinds() {
        SourceFacts facts = CppTreeParser.fromString(LIBRARY).collectFacts();

        assertEquals(1, facts.functions().size());
        assertEquals("int net::connect(const char*, int)", facts.functions().get(0).fullSignature());
        assertEquals(List.of(new PreprocessDefine("MAX_RETRIES", "5")), facts.preprocDefines());
        assertEquals(List.of(
                new StringLiteral("const char* fallback = \"localhost\";"),
                new StringLiteral("system(\"/usr/bin/ping -c 1 localhost\");")
        ), facts.stringLiterals());
        assertEquals(2, facts.includes().size());
        assertEquals(List.of(new SystemCall("system", "ping")), facts.systemCalls());
        assertFalse(facts.isEmpty());
    }

    @Test
    void emptySourceHasNoFacts() {
        SourceFacts facts = CppTreeParser.fromSource(new byte[0]).collectFacts();

        assertTrue(facts.isEmpty());
    }

    @Test
    void utf16SourceIsDecodedBeforeParsing() {
        byte[] bytes = "double area(double r) { return r * r; }".getBytes(StandardCharsets.UTF_16LE);

        List<FunctionSymbol> functions = CppTreeParser.fromSource(bytes, SourceEncoding.UTF16LE)
                .parseFunctions().collect(Collectors.toList());

        assertEquals(1, functions.size());
        assertEquals("double area(double)", functions.get(0).fullSignature());
    }

    @Test
    void utf8ByteOrderMarkIsIgnored() {
        byte[] code = "void start(){}".getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[code.length + 3];
        bytes[0] = (byte) 0xEF;
        bytes[1] = (byte) 0xBB;
        bytes[2] = (byte) 0xBF;
        System.arraycopy(code, 0, bytes, 3, code.length);

        assertEquals(List.of("start"), CppTreeParser.fromSource(bytes).parseFunctions()
                .map(FunctionSymbol::symbolName).collect(Collectors.toList()));
    }

    @Test
    void oversizedSourceIsRejected() {
        ParserOptions options = ParserOptions.defaults().withMaxSourceBytes(8);

        SymbolParseException e = assertThrows(SymbolParseException.class,
                () -> CppTreeParser.fromSource("int main() { return 0; }".getBytes(StandardCharsets.UTF_8), options));
        assertEquals(SymbolErrorCode.SOURCE_TOO_LARGE, e.getCode());
    }

    @Test
    void droppedFunctionIsReportedToDiagnostics() {
        String code = "int f(int x){}\nint g(int y){}";
        ParsedSource parsed = TestNodes.parse(code);
        byte[] corrupted = code.getBytes(StandardCharsets.UTF_8);
        corrupted[4] = (byte) 0xFF;
        ParsedSource source = new ParsedSource(parsed.tree(), corrupted);
        List<SymbolParseException> diagnostics = new ArrayList<>();

        List<FunctionSymbol> functions = new FunctionExtractor().extract(source, diagnostics::add)
                .collect(Collectors.toList());

        assertEquals(List.of("g"), functions.stream().map(FunctionSymbol::symbolName).collect(Collectors.toList()));
        assertEquals(1, diagnostics.size());
        assertEquals(SymbolErrorCode.DECODE_FAILED, diagnostics.get(0).getCode());
        assertTrue(diagnostics.get(0).getText().startsWith("int "), diagnostics.get(0).getText());
    }

    @Test
    void malformedBytesDropOnlyItemsThatContainThem() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write("int f(const char* s = \"".getBytes(StandardCharsets.UTF_8));
        out.write(0xFF);
        out.write("\") {\n    const char* t = \"".getBytes(StandardCharsets.UTF_8));
        out.write(0xFE);
        out.write("\";\n    return 0;\n}\nint g(int y) { const char* ok = \"fine\"; return y; }\n"
                .getBytes(StandardCharsets.UTF_8));
        List<SymbolParseException> diagnostics = new ArrayList<>();
        ParserOptions options = ParserOptions.defaults().withDiagnostics(diagnostics::add);

        SourceFacts facts = CppTreeParser.fromSource(out.toByteArray(), options).collectFacts();

        assertEquals(List.of("g"), facts.functions().stream()
                .map(FunctionSymbol::symbolName).collect(Collectors.toList()));
        assertEquals(List.of(new StringLiteral("const char* ok = \"fine\";")), facts.stringLiterals());
        assertTrue(diagnostics.size() >= 2, diagnostics.toString());
        for (SymbolParseException e : diagnostics) {
            assertEquals(SymbolErrorCode.DECODE_FAILED, e.getCode());
        }
    }

    @Test
    void syntaxErrorsAreReportedWithPositions() {
        CppTreeParser parser = CppTreeParser.fromString("int ok() { return 1; }\nint bad( { }\n");

        List<SyntaxChecker.SyntaxError> errors = parser.syntaxErrors();

        assertFalse(errors.isEmpty());
        assertTrue(errors.get(0).line() >= 1);
        assertTrue(errors.get(0).column() >= 1);
    }
}
