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

import java.util.ArrayList;
import java.util.List;

/**
 * Поиск ERROR и MISSING узлов в поддереве.
 * Функция с такими узлами разобрана ненадежно и целиком пропускается.
 */
public final class SyntaxChecker {

    private static final int MAX_ERRORS = 5;

    private SyntaxChecker() {}

    public record SyntaxError(int line, int column, String message) {}

    /**
     * Есть ли в поддереве хотя бы один ERROR или MISSING узел.
     */
    public static boolean hasErrors(TSNode node) {
        if (isErrorNode(node)) {
            return true;
        }
        int childCount = node.getChildCount();
        for (int i = 0; i < childCount; i++) {
            TSNode child = node.getChild(i);
            if (child != null && !child.isNull() && hasErrors(child)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Первые ошибки поддерева с позициями (1-based).
     */
    public static List<SyntaxError> collectErrors(TSNode node) {
        List<SyntaxError> errors = new ArrayList<>();
        collectErrors(node, errors);
        return List.copyOf(errors);
    }

    private static void collectErrors(TSNode node, List<SyntaxError> errors) {
        if (errors.size() >= MAX_ERRORS) return;

        if (isErrorNode(node)) {
            int line = node.getStartPoint().getRow() + 1; // tree-sitter: 0-based -> 1-based
            int column = node.getStartPoint().getColumn() + 1;

            String message;
            if (node.isMissing()) {
                message = "Missing expected syntax: " + node.getType();
            } else {
                TSNode parent = AstUtils.parentOf(node);
                message = "Syntax error in " + (parent != null ? parent.getType() : "unknown");
            }
            errors.add(new SyntaxError(line, column, message));
            return; // Не рекурсим в ERROR-узлы
        }

        int childCount = node.getChildCount();
        for (int i = 0; i < childCount && errors.size() < MAX_ERRORS; i++) {
            TSNode child = node.getChild(i);
            if (child != null && !child.isNull()) {
                collectErrors(child, errors);
            }
        }
    }

    private static boolean isErrorNode(TSNode node) {
        return node.getType().equals("ERROR") || node.isMissing();
    }
}
