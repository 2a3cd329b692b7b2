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
package ru.nts.tools.symbols.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SourceEncodingTest {

    @ParameterizedTest
    @CsvSource({
            "utf8, UTF8",
            "UTF-8, UTF8",
            "utf-16, UTF16",
            "UTF_16LE, UTF16LE",
            "utf16be, UTF16BE"
    })
    void resolvesIdentifiers(String id, SourceEncoding expected) {
        assertEquals(Optional.of(expected), SourceEncoding.fromId(id));
    }

    @Test
    void unknownIdentifierIsEmpty() {
        assertTrue(SourceEncoding.fromId("latin1").isEmpty());
        assertTrue(SourceEncoding.fromId(null).isEmpty());
    }

    @Test
    void utf16UsesByteOrderMark() {
        byte[] bigEndian = withPrefix(new byte[]{(byte) 0xFE, (byte) 0xFF}, "int a;".getBytes(StandardCharsets.UTF_16BE));
        byte[] littleEndian = withPrefix(new byte[]{(byte) 0xFF, (byte) 0xFE}, "int a;".getBytes(StandardCharsets.UTF_16LE));

        assertEquals("int a;", SourceEncoding.UTF16.decode(bigEndian));
        assertEquals("int a;", SourceEncoding.UTF16.decode(littleEndian));
    }

    @Test
    void utf16WithoutMarkIsLittleEndian() {
        assertEquals("int a;", SourceEncoding.UTF16.decode("int a;".getBytes(StandardCharsets.UTF_16LE)));
    }

    @Test
    void utf8MarkIsStrippedAndMalformedBytesReplaced() {
        byte[] bytes = withPrefix(new byte[]{(byte) 0xEF, (byte) 0xBB, (byte) 0xBF},
                new byte[]{'a', (byte) 0xC3, 'b'});

        assertEquals("a�b", SourceEncoding.UTF8.decode(bytes));
    }

    @Test
    void trackingReportsOnlyInsertedReplacements() {
        byte[] bytes = withPrefix(new byte[]{'a', (byte) 0xFF, 'b'},
                "\uFFFD".getBytes(StandardCharsets.UTF_8));
        byte[] tail = withPrefix(bytes, new byte[]{(byte) 0x80});

        DecodedSource decoded = SourceEncoding.UTF8.decodeTracking(tail);

        assertEquals("a\uFFFDb\uFFFD\uFFFD", decoded.text());
        assertEquals(List.of(1, 4), decoded.malformedChars());
        assertEquals(decoded.text(), SourceEncoding.UTF8.decode(tail));
    }

    @Test
    void cleanSourceHasNoReplacements() {
        DecodedSource decoded = SourceEncoding.UTF16.decodeTracking(
                withPrefix(new byte[]{(byte) 0xFE, (byte) 0xFF}, "int a;".getBytes(StandardCharsets.UTF_16BE)));

        assertEquals("int a;", decoded.text());
        assertTrue(decoded.isClean());
    }

    @Test
    void detectsByteOrderMarks() {
        assertEquals(SourceEncoding.UTF16BE, SourceEncoding.detect(new byte[]{(byte) 0xFE, (byte) 0xFF, 0, 'a'}));
        assertEquals(SourceEncoding.UTF16LE, SourceEncoding.detect(new byte[]{(byte) 0xFF, (byte) 0xFE, 'a', 0}));
    }

    @Test
    void plainSourceIsDetectedAsUtf8() {
        byte[] bytes = "int main() { return 0; } // привет, мир".getBytes(StandardCharsets.UTF_8);

        assertEquals(SourceEncoding.UTF8, SourceEncoding.detect(bytes));
        assertEquals(SourceEncoding.UTF8, SourceEncoding.detect(new byte[0]));
    }

    private static byte[] withPrefix(byte[] prefix, byte[] body) {
        byte[] result = new byte[prefix.length + body.length];
        System.arraycopy(prefix, 0, result, 0, prefix.length);
        System.arraycopy(body, 0, result, prefix.length, body.length);
        return result;
    }
}
