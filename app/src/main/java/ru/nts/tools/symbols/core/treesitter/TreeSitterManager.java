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

import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterBash;
import org.treesitter.TreeSitterCpp;
import ru.nts.tools.symbols.core.DecodedSource;
import ru.nts.tools.symbols.core.ParserOptions;
import ru.nts.tools.symbols.core.SymbolErrorCode;
import ru.nts.tools.symbols.core.SymbolParseException;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Менеджер tree-sitter парсеров: C/C++ для исходников и bash для командных строк
 * из вызовов system/exec.
 * TSLanguage потокобезопасен и переиспользуется, TSParser нет,
 * поэтому парсеры хранятся в ThreadLocal.
 */
public final class TreeSitterManager {

    private static final TreeSitterManager INSTANCE = new TreeSitterManager();

    private final TSLanguage language = new TreeSitterCpp();
    private final TSLanguage shellLanguage = new TreeSitterBash();

    private final ThreadLocal<TSParser> parsers = parserFor(language);
    private final ThreadLocal<TSParser> shellParsers = parserFor(shellLanguage);

    private TreeSitterManager() {}

    public static TreeSitterManager getInstance() {
        return INSTANCE;
    }

    /**
     * Грамматика C++ (покрывает и C).
     */
    public TSLanguage getLanguage() {
        return language;
    }

    /**
     * Грамматика bash для разбора командных строк.
     */
    public TSLanguage getShellLanguage() {
        return shellLanguage;
    }

    private static ThreadLocal<TSParser> parserFor(TSLanguage lang) {
        return ThreadLocal.withInitial(() -> {
            TSParser parser = new TSParser();
            parser.setLanguage(lang);
            return parser;
        });
    }

    /**
     * Парсит байты исходника в объявленной кодировке.
     *
     * @param source  содержимое файла
     * @param options кодировка и лимит размера
     * @return дерево вместе с UTF-8 буфером, на который ссылаются его смещения
     * @throws SymbolParseException если исходник слишком большой или дерево не построено
     */
    public ParsedSource parse(byte[] source, ParserOptions options) {
        if (source.length > options.maxSourceBytes()) {
            throw new SymbolParseException(SymbolErrorCode.SOURCE_TOO_LARGE,
                    Map.of("size", source.length, "limit", options.maxSourceBytes()));
        }
        DecodedSource decoded = options.encoding().decodeTracking(source);
        String content = decoded.text();
        return new ParsedSource(parseTree(content), content.getBytes(StandardCharsets.UTF_8),
                replacementOffsets(decoded));
    }

    /**
     * Парсит строку исходного кода.
     * КРИТИЧНО: tree-sitter работает с UTF-8 и возвращает байтовые смещения,
     * поэтому вместе с деревом сохраняется UTF-8 представление контента.
     */
    public ParsedSource parse(String content) {
        return new ParsedSource(parseTree(content), content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Парсит командную строку оболочки.
     */
    public ParsedSource parseShell(String command) {
        return new ParsedSource(parseTree(shellParsers.get(), command), command.getBytes(StandardCharsets.UTF_8));
    }

    private TSTree parseTree(String content) {
        return parseTree(parsers.get(), content);
    }

    private static TSTree parseTree(TSParser parser, String content) {
        TSTree tree = parser.parseString(null, content);
        if (tree == null) {
            throw new SymbolParseException(SymbolErrorCode.PARSE_FAILED);
        }
        return tree;
    }

    /**
     * Байтовые смещения символов-замен в UTF-8 представлении текста.
     * Непарный суррогат String.getBytes кодирует одним байтом '?'.
     */
    static int[] replacementOffsets(DecodedSource decoded) {
        String text = decoded.text();
        List<Integer> chars = decoded.malformedChars();
        int[] offsets = new int[chars.size()];

        int next = 0;
        int bytePos = 0;
        for (int i = 0; i < text.length() && next < offsets.length; i++) {
            if (i == chars.get(next)) {
                offsets[next++] = bytePos;
            }
            char c = text.charAt(i);
            if (c < 0x80) {
                bytePos += 1;
            } else if (c < 0x800) {
                bytePos += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < text.length()
                    && Character.isLowSurrogate(text.charAt(i + 1))) {
                bytePos += 4;
                i++;
            } else if (Character.isSurrogate(c)) {
                bytePos += 1;
            } else {
                bytePos += 3;
            }
        }
        return offsets;
    }
}
