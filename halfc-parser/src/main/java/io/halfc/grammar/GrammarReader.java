/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.halfc.grammar;

import io.halfc.common.FileUtils;
import io.halfc.common.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a grammar written in the BNF dialect of the original analyzer:
 * <pre>
 * // comment
 * &lt;STATEMENT&gt; ::= &lt;IDENTIFIER&gt; = &lt;EXPRESSION&gt; ;
 *              | CALL &lt;IDENTIFIER&gt; ;
 * </pre>
 * A definition starts in column 1 with a bracketed left-hand side. An
 * alternative starts with {@code |} as the first non-blank character of a
 * following line. Symbols are separated by blanks; a bracketed name may
 * contain blanks. An empty alternative derives the empty string. Any symbol
 * that never appears on a left-hand side is a terminal, and the first
 * left-hand side is the start symbol.
 */
public class GrammarReader {

    static final Logger logger = LoggerFactory.getLogger(GrammarReader.class);

    private static final String DEFINES = "::=";

    private final String source;

    // left-hand side name to its alternatives, in definition order
    private final Map<String, List<List<String>>> rules = new LinkedHashMap<>();
    private final Set<String> symbols = new LinkedHashSet<>();
    private String currentLhs;

    private GrammarReader(String source) {
        this.source = source;
    }

    public static Grammar read(Resource resource) {
        String name = resource.getRelativePath();
        GrammarReader reader = new GrammarReader(name.isEmpty() ? "(grammar)" : name);
        return reader.parse(resource.getText());
    }

    public static Grammar read(String text) {
        return new GrammarReader("(grammar)").parse(text);
    }

    private Grammar parse(String text) {
        String[] lines = FileUtils.toLines(text);
        for (int i = 0; i < lines.length; i++) {
            parseLine(lines[i], i + 1);
        }
        if (rules.isEmpty()) {
            throw new GrammarException(source + ": no productions");
        }
        return build();
    }

    private void parseLine(String line, int lineNumber) {
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("//")) {
            return;
        }
        if (line.charAt(0) == '<') {
            int pos = line.indexOf('>');
            if (pos == -1) {
                throw error(lineNumber, "unterminated left-hand side");
            }
            currentLhs = line.substring(0, pos + 1);
            String rest = line.substring(pos + 1).trim();
            if (!rest.startsWith(DEFINES)) {
                throw error(lineNumber, "expected " + DEFINES + " after " + currentLhs);
            }
            addAlternative(rest.substring(DEFINES.length()), lineNumber);
        } else if (trimmed.charAt(0) == '|' && Character.isWhitespace(line.charAt(0))) {
            if (currentLhs == null) {
                throw error(lineNumber, "alternative before any definition");
            }
            addAlternative(trimmed.substring(1), lineNumber);
        } else {
            throw error(lineNumber, "expected a definition or an alternative: " + trimmed);
        }
    }

    private void addAlternative(String text, int lineNumber) {
        List<String> rhs = tokenize(text, lineNumber);
        symbols.addAll(rhs);
        rules.computeIfAbsent(currentLhs, k -> new ArrayList<>()).add(rhs);
    }

    private List<String> tokenize(String text, int lineNumber) {
        List<String> list = new ArrayList<>();
        int pos = 0;
        int length = text.length();
        while (pos < length) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }
            int end;
            if (c == '<' && pos + 1 < length && isNameStart(text.charAt(pos + 1))) {
                end = text.indexOf('>', pos);
                if (end == -1) {
                    throw error(lineNumber, "unterminated symbol: " + text.substring(pos));
                }
                end++;
            } else {
                end = pos;
                while (end < length && !Character.isWhitespace(text.charAt(end))) {
                    end++;
                }
            }
            list.add(text.substring(pos, end));
            pos = end;
        }
        return list;
    }

    private static boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '$' || c == '#';
    }

    private GrammarException error(int lineNumber, String message) {
        return new GrammarException(source + ":" + lineNumber + " " + message);
    }

    private Grammar build() {
        List<String> terminals = new ArrayList<>();
        for (String symbol : symbols) {
            if (!rules.containsKey(symbol)) {
                terminals.add(symbol);
            }
        }
        List<String> nonterminals = new ArrayList<>(rules.keySet());
        if (nonterminals.contains(Grammar.GOAL)) {
            throw new GrammarException(source + ": " + Grammar.GOAL + " is reserved");
        }
        String start = nonterminals.get(0);
        nonterminals.add(Grammar.GOAL);
        Vocabulary vocabulary = new Vocabulary(terminals, nonterminals);
        List<Production> productions = new ArrayList<>();
        productions.add(new Production(0, vocabulary.getIndex(Grammar.GOAL), new int[]{vocabulary.getIndex(start)}));
        rules.forEach((lhs, alternatives) -> {
            int lhsIndex = vocabulary.getIndex(lhs);
            for (List<String> rhs : alternatives) {
                int[] temp = new int[rhs.size()];
                for (int i = 0; i < temp.length; i++) {
                    temp[i] = vocabulary.getIndex(rhs.get(i));
                }
                productions.add(new Production(productions.size(), lhsIndex, temp));
            }
        });
        Grammar grammar = new Grammar(vocabulary, productions);
        warnUnreachable(grammar);
        logger.debug("{}: {}", source, grammar);
        return grammar;
    }

    private void warnUnreachable(Grammar grammar) {
        Vocabulary vocabulary = grammar.getVocabulary();
        BitSet reached = new BitSet(vocabulary.size());
        List<Integer> pending = new ArrayList<>();
        pending.add(grammar.getGoalSymbol());
        reached.set(grammar.getGoalSymbol());
        while (!pending.isEmpty()) {
            int symbol = pending.remove(pending.size() - 1);
            for (int number : grammar.getProductionsFor(symbol)) {
                for (int next : grammar.getProduction(number).rhs) {
                    if (vocabulary.isNonterminal(next) && !reached.get(next)) {
                        reached.set(next);
                        pending.add(next);
                    }
                }
            }
        }
        for (int i = vocabulary.getTerminalCount() + 1; i < vocabulary.size(); i++) {
            if (!reached.get(i)) {
                logger.warn("{}: unreachable nonterminal {}", source, vocabulary.getName(i));
            }
        }
    }

}
