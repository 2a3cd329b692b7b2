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
import ru.nts.tools.symbols.core.SymbolParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Утилиты обхода AST дерева tree-sitter.
 */
public final class AstUtils {

    private AstUtils() {}

    /**
     * Родитель узла или null для корня.
     */
    public static TSNode parentOf(TSNode node) {
        TSNode parent = node.getParent();
        if (parent == null || parent.isNull()) {
            return null;
        }
        return parent;
    }

    /**
     * Все предки узла: родитель, дед, ... корень.
     * Обход только по ссылке на родителя, поэтому конечен.
     */
    public static Stream<TSNode> ancestors(TSNode node) {
        return Stream.iterate(parentOf(node), Objects::nonNull, AstUtils::parentOf);
    }

    /**
     * Предки узла строго ниже {@code outer}, от ближайшего к дальнему.
     * Если {@code outer} не является предком, возвращаются все предки.
     */
    public static List<TSNode> ancestorsBelow(TSNode node, TSNode outer) {
        return ancestors(node)
                .takeWhile(n -> !sameNode(n, outer))
                .collect(Collectors.toList());
    }

    /**
     * Ближайший предок одного из указанных типов или null.
     */
    public static TSNode nearestAncestor(TSNode node, Set<String> types) {
        return ancestors(node)
                .filter(n -> types.contains(n.getType()))
                .findFirst()
                .orElse(null);
    }

    /**
     * Дочерние узлы (включая анонимные токены) в порядке исходника.
     */
    public static List<TSNode> children(TSNode parent) {
        int childCount = parent.getChildCount();
        List<TSNode> result = new ArrayList<>(childCount);
        for (int i = 0; i < childCount; i++) {
            TSNode child = parent.getChild(i);
            if (child != null && !child.isNull()) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Дочерние узлы указанного типа.
     */
    public static List<TSNode> childrenOfType(TSNode parent, String type) {
        return children(parent).stream()
                .filter(child -> child.getType().equals(type))
                .collect(Collectors.toList());
    }

    /**
     * Дочерний узел по имени поля грамматики или null.
     */
    public static TSNode field(TSNode node, String fieldName) {
        TSNode child = node.getChildByFieldName(fieldName);
        if (child == null || child.isNull()) {
            return null;
        }
        return child;
    }

    /**
     * Дочерний узел по имени поля. Если поля нет, это ошибка разбора.
     */
    public static TSNode requireField(TSNode node, String fieldName) {
        TSNode child = field(node, fieldName);
        if (child == null) {
            throw SymbolParseException.missing(node.getType() + "." + fieldName);
        }
        return child;
    }

    /**
     * Сравнивает узлы по типу и байтовому диапазону.
     */
    public static boolean sameNode(TSNode a, TSNode b) {
        return a.getStartByte() == b.getStartByte()
                && a.getEndByte() == b.getEndByte()
                && a.getType().equals(b.getType());
    }
}
