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

import ru.nts.tools.symbols.core.SymbolParseException;
import ru.nts.tools.symbols.core.treesitter.ParsedSource;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Интерфейс для извлечения фактов одного вида из дерева.
 *
 * @param <T> тип факта
 */
public interface FactExtractor<T> {

    /**
     * Извлекает факты из дерева.
     * Поток ленивый и одноразовый; ошибка разбора отдельного элемента не прерывает поток,
     * элемент отбрасывается, а ошибка передается в {@code diagnostics}.
     *
     * @param source      разобранный исходник
     * @param diagnostics получатель ошибок по отброшенным элементам
     * @return факты в порядке исходника
     */
    Stream<T> extract(ParsedSource source, Consumer<SymbolParseException> diagnostics);

    /**
     * Выполняет разбор одного элемента; ошибка разбора превращается в пустой результат.
     */
    static <T> Optional<T> attempt(Supplier<T> parse, Consumer<SymbolParseException> diagnostics) {
        try {
            return Optional.ofNullable(parse.get());
        } catch (SymbolParseException e) {
            diagnostics.accept(e);
            return Optional.empty();
        }
    }
}
