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
import org.treesitter.TSTree;
import ru.nts.tools.symbols.core.SymbolErrorCode;
import ru.nts.tools.symbols.core.SymbolParseException;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;

/**
 * Результат парсинга: дерево и байты, по которым оно построено.
 * Узлы дерева живут, пока жив этот объект.
 *
 * <p>Если исходные байты декодировались с заменами, в UTF-8 буфере на месте каждой
 * некорректной последовательности стоит U+FFFD (3 байта). Такие диапазоны запоминаются:
 * текст, который их задевает, не читается и дает DECODE_FAILED.
 */
public final class ParsedSource {

    private static final int REPLACEMENT_BYTES = 3;

    private final TSTree tree;
    private final byte[] bytes;
    private final int[] malformedStarts;

    ParsedSource(TSTree tree, byte[] bytes) {
        this(tree, bytes, new int[0]);
    }

    /**
     * @param malformedStarts байтовые смещения замен в {@code bytes}, по возрастанию
     */
    ParsedSource(TSTree tree, byte[] bytes, int[] malformedStarts) {
        this.tree = tree;
        this.bytes = bytes;
        this.malformedStarts = malformedStarts;
    }

    public TSTree tree() {
        return tree;
    }

    public TSNode root() {
        return tree.getRootNode();
    }

    public int length() {
        return bytes.length;
    }

    /**
     * Текст узла. Некорректный UTF-8 внутри узла ломает только этот узел.
     *
     * @throws SymbolParseException с кодом DECODE_FAILED
     */
    public String text(TSNode node) {
        return text(node.getStartByte(), node.getEndByte());
    }

    /**
     * Текст байтового диапазона [start, end).
     */
    public String text(int start, int end) {
        if (start < 0 || end > bytes.length || start >= end) {
            return "";
        }
        requireDecodable(start, end, start, end);
        return decode(ByteBuffer.wrap(bytes, start, end - start), start, end);
    }

    /**
     * Текст узла без байтов вложенного узла {@code hole}.
     */
    public String textWithout(TSNode node, TSNode hole) {
        int start = node.getStartByte();
        int end = node.getEndByte();
        int holeStart = Math.max(start, hole.getStartByte());
        int holeEnd = Math.min(end, hole.getEndByte());
        if (holeStart >= holeEnd) {
            return text(start, end);
        }
        requireDecodable(start, holeStart, start, end);
        requireDecodable(holeEnd, end, start, end);

        ByteBuffer joined = ByteBuffer.allocate((holeStart - start) + (end - holeEnd));
        joined.put(bytes, start, holeStart - start);
        joined.put(bytes, holeEnd, end - holeEnd);
        joined.flip();
        return decode(joined, start, end);
    }

    /**
     * Текст узла с заменой некорректных байтов. Только для диагностики.
     */
    public String lenientText(TSNode node) {
        int start = node.getStartByte();
        int end = node.getEndByte();
        if (start < 0 || end > bytes.length || start >= end) {
            return "";
        }
        return new String(bytes, start, end - start, StandardCharsets.UTF_8);
    }

    /**
     * Есть ли замена некорректных байтов, пересекающаяся с [from, to).
     */
    boolean hasMalformed(int from, int to) {
        if (from >= to || malformedStarts.length == 0) {
            return false;
        }
        // Первая замена, которая заканчивается после from
        int index = Arrays.binarySearch(malformedStarts, from - REPLACEMENT_BYTES + 1);
        if (index < 0) {
            index = -index - 1;
        }
        return index < malformedStarts.length && malformedStarts[index] < to;
    }

    private void requireDecodable(int from, int to, int start, int end) {
        if (hasMalformed(from, to)) {
            throw new SymbolParseException(SymbolErrorCode.DECODE_FAILED, Map.of("start", start, "end", end));
        }
    }

    private static String decode(ByteBuffer buffer, int start, int end) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(buffer)
                    .toString();
        } catch (CharacterCodingException e) {
            throw new SymbolParseException(SymbolErrorCode.DECODE_FAILED,
                    Map.of("start", start, "end", end), e);
        }
    }
}
