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

import org.mozilla.universalchardet.UniversalDetector;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Объявленная кодировка исходного файла.
 * Декодирование снимает BOM и не падает на некорректных байтах:
 * проблемные последовательности заменяются символом U+FFFD.
 */
public enum SourceEncoding {

    UTF8("utf8", StandardCharsets.UTF_8),
    /** Порядок байт определяется по BOM, без BOM little-endian. */
    UTF16("utf16", StandardCharsets.UTF_16LE),
    UTF16LE("utf16le", StandardCharsets.UTF_16LE),
    UTF16BE("utf16be", StandardCharsets.UTF_16BE);

    private static final char REPLACEMENT = '\uFFFD';

    private final String id;
    private final Charset charset;

    SourceEncoding(String id, Charset charset) {
        this.id = id;
        this.charset = charset;
    }

    public String id() {
        return id;
    }

    public Charset charset() {
        return charset;
    }

    /**
     * Находит кодировку по идентификатору ("utf8", "UTF-16LE", "utf16be" и т.п.).
     */
    public static Optional<SourceEncoding> fromId(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
        return Arrays.stream(values())
                .filter(e -> e.id.equals(normalized))
                .findFirst();
    }

    /**
     * Декодирует байты исходника в строку.
     */
    public String decode(byte[] bytes) {
        return decodeTracking(bytes).text();
    }

    /**
     * Декодирует байты и запоминает, где стоят замены некорректных последовательностей.
     * Текст совпадает с {@link #decode(byte[])}.
     */
    public DecodedSource decodeTracking(byte[] bytes) {
        Charset effective = effectiveCharset(bytes);
        int offset = bomLength(bytes);
        CharsetDecoder decoder = effective.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);

        ByteBuffer in = ByteBuffer.wrap(bytes, offset, bytes.length - offset);
        CharBuffer out = CharBuffer.allocate(Math.max(64, bytes.length - offset));
        StringBuilder text = new StringBuilder(bytes.length - offset);
        List<Integer> malformed = new ArrayList<>();

        while (true) {
            CoderResult result = decoder.decode(in, out, true);
            out.flip();
            text.append(out);
            out.clear();
            if (result.isError()) {
                malformed.add(text.length());
                text.append(REPLACEMENT);
                in.position(in.position() + result.length());
            } else if (result.isUnderflow()) {
                break;
            }
        }
        decoder.flush(out);
        out.flip();
        text.append(out);

        return new DecodedSource(text.toString(), malformed);
    }

    /**
     * Для UTF16 порядок байт задает BOM.
     */
    private Charset effectiveCharset(byte[] bytes) {
        if (this == UTF16 && bytes.length >= 2 && (bytes[0] & 0xFF) == 0xFE && (bytes[1] & 0xFF) == 0xFF) {
            return StandardCharsets.UTF_16BE;
        }
        return charset;
    }

    private int bomLength(byte[] bytes) {
        if (bytes.length < 2) return 0;

        int b0 = bytes[0] & 0xFF;
        int b1 = bytes[1] & 0xFF;
        return switch (this) {
            case UTF8 -> bytes.length >= 3 && b0 == 0xEF && b1 == 0xBB && (bytes[2] & 0xFF) == 0xBF ? 3 : 0;
            case UTF16 -> (b0 == 0xFF && b1 == 0xFE) || (b0 == 0xFE && b1 == 0xFF) ? 2 : 0;
            case UTF16LE -> b0 == 0xFF && b1 == 0xFE ? 2 : 0;
            case UTF16BE -> b0 == 0xFE && b1 == 0xFF ? 2 : 0;
        };
    }

    /**
     * Определяет кодировку по содержимому через UniversalDetector (juniversalchardet).
     * Все, что не распознано как UTF-16, считается UTF-8.
     *
     * @param bytes содержимое файла
     * @return определенная кодировка, UTF8 по умолчанию
     */
    public static SourceEncoding detect(byte[] bytes) {
        if (bytes.length >= 2) {
            int b0 = bytes[0] & 0xFF;
            int b1 = bytes[1] & 0xFF;
            if (b0 == 0xFE && b1 == 0xFF) return UTF16BE;
            if (b0 == 0xFF && b1 == 0xFE) return UTF16LE;
        }

        UniversalDetector detector = new UniversalDetector(null);
        detector.handleData(bytes, 0, bytes.length);
        detector.dataEnd();
        String detected = detector.getDetectedCharset();
        detector.reset();

        if (detected == null) {
            return UTF8;
        }
        return switch (detected.toUpperCase(Locale.ROOT)) {
            case "UTF-16BE" -> UTF16BE;
            case "UTF-16LE" -> UTF16LE;
            default -> UTF8;
        };
    }
}
