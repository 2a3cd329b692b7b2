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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Locale;

/**
 * JSON представление {@link SourceFacts}.
 * Дерево строится вручную, чтобы формат не зависел от имен методов record-ов
 * и включал производные поля (params, fullSignature).
 */
public final class SourceFactsJsonWriter {

    private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private SourceFactsJsonWriter() {}

    public static ObjectNode toJson(SourceFacts facts) {
        ObjectNode root = mapper.createObjectNode();

        ArrayNode functions = root.putArray("functions");
        for (FunctionSymbol function : facts.functions()) {
            functions.add(toJson(function));
        }

        ArrayNode defines = root.putArray("preprocDefines");
        for (PreprocessDefine define : facts.preprocDefines()) {
            defines.addObject()
                    .put("name", define.name())
                    .put("value", define.value());
        }

        ArrayNode literals = root.putArray("stringLiterals");
        for (StringLiteral literal : facts.stringLiterals()) {
            literals.addObject().put("value", literal.value());
        }

        ArrayNode includes = root.putArray("includes");
        for (IncludeDirective include : facts.includes()) {
            includes.addObject()
                    .put("kind", include.kind().name().toLowerCase(Locale.ROOT))
                    .put("path", include.path());
        }

        ArrayNode systemCalls = root.putArray("systemCalls");
        for (SystemCall call : facts.systemCalls()) {
            systemCalls.addObject()
                    .put("function", call.function())
                    .put("program", call.program());
        }
        return root;
    }

    public static ObjectNode toJson(FunctionSymbol function) {
        ObjectNode node = mapper.createObjectNode();
        node.put("returnType", function.returnType());
        node.put("symbolName", function.symbolName());
        node.put("qualifiedSymbolName", function.qualifiedSymbolName());
        node.put("params", function.params());
        ArrayNode paramList = node.putArray("paramList");
        function.paramList().forEach(paramList::add);
        ArrayNode modifiers = node.putArray("modifiers");
        function.modifiers().forEach(modifiers::add);
        node.put("fullSignature", function.fullSignature());
        if (function.sourceText() != null) {
            node.put("sourceText", function.sourceText());
        } else {
            node.putNull("sourceText");
        }
        return node;
    }

    public static String write(SourceFacts facts) throws JsonProcessingException {
        return mapper.writeValueAsString(toJson(facts));
    }

    /**
     * Пишет JSON в поток. Поток не закрывается.
     */
    public static void write(SourceFacts facts, OutputStream out) throws IOException {
        mapper.writer()
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValue(out, toJson(facts));
    }
}
