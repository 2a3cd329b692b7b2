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

import org.treesitter.TSNode;
import org.treesitter.TSQuery;
import ru.nts.tools.symbols.core.SymbolParseException;
import ru.nts.tools.symbols.core.treesitter.AstUtils;
import ru.nts.tools.symbols.core.treesitter.ParsedSource;
import ru.nts.tools.symbols.core.treesitter.QueryMatch;
import ru.nts.tools.symbols.core.treesitter.QueryMatches;
import ru.nts.tools.symbols.core.treesitter.SystemCall;
import ru.nts.tools.symbols.core.treesitter.TreeSitterManager;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import static ru.nts.tools.symbols.core.treesitter.CppQueries.*;

/**
 * Извлекает вызовы, запускающие внешние программы: system, execlp, execve.
 * Имя программы берется из первого строкового литерала среди аргументов:
 * литерал разбирается как командная строка bash, и берется имя первой команды
 * (в конвейере, цепочке {@code &&} или подоболочке это самая левая команда).
 */
public class SystemCallExtractor implements FactExtractor<SystemCall> {

    private static final Set<String> PROCESS_FUNCTIONS = Set.of("system", "execlp", "execve");

    /** Присваивание окружения перед командой: {@code LANG=C ls}. */
    private static final Pattern ENV_ASSIGNMENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*=.*");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final String COMMAND_NAME_CAPTURE = "cmd_name";

    /**
     * Имена команд в дереве bash.
     */
    private static final TSQuery COMMAND_NAME = new TSQuery(
            TreeSitterManager.getInstance().getShellLanguage(),
            "(command name: (command_name) @cmd_name)");

    @Override
    public Stream<SystemCall> extract(ParsedSource source, Consumer<SymbolParseException> diagnostics) {
        return QueryMatches.stream(CALL, source.root())
                .map(match -> FactExtractor.attempt(() -> toSystemCall(match, source), diagnostics))
                .flatMap(Optional::stream);
    }

    /**
     * Возвращает null, если вызов не запускает процесс или команда не определяется.
     */
    private static SystemCall toSystemCall(QueryMatch match, ParsedSource source) {
        String function = source.text(match.first(CALL_FUNCTION_CAPTURE)).strip();
        if (!PROCESS_FUNCTIONS.contains(function.toLowerCase(Locale.ROOT))) {
            return null;
        }

        TSNode literal = firstStringLiteral(match.first(CALL_ARGUMENTS_CAPTURE));
        if (literal == null) {
            return null;
        }

        String program = programName(unquote(source.text(literal)));
        if (program.isEmpty()) {
            return null;
        }
        return new SystemCall(function, program);
    }

    /**
     * Первый string_literal в порядке исходника (обход в глубину слева направо).
     */
    static TSNode firstStringLiteral(TSNode node) {
        if (node.getType().equals("string_literal")) {
            return node;
        }
        for (TSNode child : AstUtils.children(node)) {
            TSNode found = firstStringLiteral(child);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /**
     * Имя программы из командной строки без каталога и кавычек.
     * Если bash не нашел ни одной команды, берется первое слово после присваиваний окружения.
     */
    static String programName(String command) {
        ParsedSource shell = TreeSitterManager.getInstance().parseShell(command);
        String program = QueryMatches.stream(COMMAND_NAME, shell.root())
                .filter(match -> match.has(COMMAND_NAME_CAPTURE))
                .map(match -> shell.lenientText(match.first(COMMAND_NAME_CAPTURE)).strip())
                .filter(name -> !name.isEmpty())
                .findFirst()
                .orElseGet(() -> firstWord(command));
        return baseName(stripQuotes(program));
    }

    private static String firstWord(String command) {
        for (String token : WHITESPACE.split(command.strip())) {
            if (!token.isEmpty() && !ENV_ASSIGNMENT.matcher(token).matches()) {
                return token;
            }
        }
        return "";
    }

    private static String stripQuotes(String word) {
        if (word.length() >= 2) {
            char first = word.charAt(0);
            if ((first == '"' || first == '\'') && word.charAt(word.length() - 1) == first) {
                return word.substring(1, word.length() - 1);
            }
        }
        return word;
    }

    private static String baseName(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    // L"...", u8"..." и т.п.: префикс до первой кавычки отбрасывается
    private static String unquote(String literal) {
        int open = literal.indexOf('"');
        int close = literal.lastIndexOf('"');
        if (open < 0 || close <= open) {
            return "";
        }
        return literal.substring(open + 1, close);
    }
}
