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

import java.util.List;
import java.util.Map;

/**
 * Одно совпадение запроса: имя захвата -> захваченные узлы в порядке исходника.
 *
 * @param patternIndex индекс паттерна внутри запроса
 * @param captures     захваты совпадения
 */
public record QueryMatch(int patternIndex, Map<String, List<TSNode>> captures) {

    public QueryMatch {
        captures = Map.copyOf(captures);
    }

    public boolean has(String captureName) {
        return captures.containsKey(captureName);
    }

    /**
     * Первый узел захвата; если захвата нет, бросается ошибка разбора.
     */
    public TSNode first(String captureName) {
        List<TSNode> nodes = captures.get(captureName);
        if (nodes == null || nodes.isEmpty()) {
            throw SymbolParseException.missing("@" + captureName);
        }
        return nodes.get(0);
    }
}
