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
import org.treesitter.TSQuery;
import org.treesitter.TSQueryCapture;
import org.treesitter.TSQueryCursor;
import org.treesitter.TSQueryMatch;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Ленивый обход совпадений запроса в поддереве узла.
 * TSQueryMatch переиспользуется курсором, поэтому захваты копируются
 * в {@link QueryMatch} сразу при чтении.
 */
public final class QueryMatches implements Iterator<QueryMatch> {

    private final TSQuery query;
    private final TSQueryCursor cursor;
    private final TSQueryMatch match = new TSQueryMatch();

    private QueryMatch next;
    private boolean exhausted;

    private QueryMatches(TSQuery query, TSNode node) {
        this.query = query;
        this.cursor = new TSQueryCursor();
        this.cursor.exec(query, node);
    }

    /**
     * Поток совпадений в порядке исходника. Одноразовый.
     */
    public static Stream<QueryMatch> stream(TSQuery query, TSNode node) {
        QueryMatches iterator = new QueryMatches(query, node);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    /**
     * Первое совпадение запроса в поддереве.
     */
    public static Optional<QueryMatch> first(TSQuery query, TSNode node) {
        QueryMatches iterator = new QueryMatches(query, node);
        return iterator.hasNext() ? Optional.of(iterator.next()) : Optional.empty();
    }

    /**
     * Первый узел указанного захвата в поддереве или null.
     */
    public static TSNode firstCapture(TSQuery query, TSNode node, String captureName) {
        return first(query, node)
                .filter(m -> m.has(captureName))
                .map(m -> m.first(captureName))
                .orElse(null);
    }

    @Override
    public boolean hasNext() {
        if (next == null && !exhausted) {
            if (cursor.nextMatch(match)) {
                next = copy(match);
            } else {
                exhausted = true;
            }
        }
        return next != null;
    }

    @Override
    public QueryMatch next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        QueryMatch result = next;
        next = null;
        return result;
    }

    private QueryMatch copy(TSQueryMatch source) {
        Map<String, List<TSNode>> captures = new LinkedHashMap<>();
        for (TSQueryCapture capture : source.getCaptures()) {
            TSNode node = capture.getNode();
            if (node == null || node.isNull()) continue;

            String name = query.getCaptureNameForId(capture.getIndex());
            captures.computeIfAbsent(name, k -> new ArrayList<>()).add(node);
        }
        captures.replaceAll((k, v) -> List.copyOf(v));
        return new QueryMatch(source.getPatternIndex(), captures);
    }
}
