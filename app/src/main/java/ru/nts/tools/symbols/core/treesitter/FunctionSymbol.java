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

import java.util.List;
import java.util.Objects;

/**
 * Определение функции с канонической сигнатурой.
 * Равенство и хеш не учитывают {@code sourceText}: два вхождения, отличающиеся
 * только форматированием, совпадают по канонической сигнатуре.
 *
 * @param returnType          нормализованный возвращаемый тип
 * @param symbolName          имя без квалификации
 * @param qualifiedSymbolName имя с namespace/class квалификацией
 * @param paramList           типы параметров по порядку
 * @param modifiers           модификаторы после списка параметров (например, const)
 * @param sourceText          сигнатура из исходника без тела, может быть null
 */
public record FunctionSymbol(
        String returnType,
        String symbolName,
        String qualifiedSymbolName,
        List<String> paramList,
        List<String> modifiers,
        String sourceText
) {

    public FunctionSymbol {
        Objects.requireNonNull(returnType, "returnType");
        Objects.requireNonNull(symbolName, "symbolName");
        Objects.requireNonNull(qualifiedSymbolName, "qualifiedSymbolName");
        paramList = List.copyOf(paramList);
        modifiers = modifiers != null ? List.copyOf(modifiers) : List.of();
    }

    /**
     * Создает FunctionSymbol без модификаторов и исходного текста.
     */
    public FunctionSymbol(String returnType, String symbolName, String qualifiedSymbolName, List<String> paramList) {
        this(returnType, symbolName, qualifiedSymbolName, paramList, List.of(), null);
    }

    /**
     * Создает FunctionSymbol без исходного текста.
     */
    public FunctionSymbol(String returnType, String symbolName, String qualifiedSymbolName,
                          List<String> paramList, List<String> modifiers) {
        this(returnType, symbolName, qualifiedSymbolName, paramList, modifiers, null);
    }

    /**
     * Параметры через запятую: "int, const char*".
     */
    public String params() {
        return String.join(", ", paramList);
    }

    /**
     * Каноническая сигнатура для точного сравнения с символами из бинарников.
     * Формат: "{returnType} {qualifiedName}({params}) {modifiers}", без хвостового
     * пробела при отсутствии модификаторов.
     */
    public String fullSignature() {
        String signature = returnType + " " + qualifiedSymbolName + "(" + params() + ")";
        if (modifiers.isEmpty()) {
            return signature;
        }
        return signature + " " + String.join(" ", modifiers);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionSymbol)) return false;
        FunctionSymbol that = (FunctionSymbol) o;
        return returnType.equals(that.returnType)
                && symbolName.equals(that.symbolName)
                && qualifiedSymbolName.equals(that.qualifiedSymbolName)
                && paramList.equals(that.paramList)
                && modifiers.equals(that.modifiers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(returnType, symbolName, qualifiedSymbolName, paramList, modifiers);
    }
}
