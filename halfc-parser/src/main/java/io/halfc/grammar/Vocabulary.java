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

import io.halfc.charset.CharClass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Ordered grammar symbols. Index 0 is reserved, terminals occupy
 * {@code 1..terminalCount} and nonterminals follow. Indices never change once
 * built; every table refers to them.
 */
public class Vocabulary {

    public static final String IDENTIFIER = "<IDENTIFIER>";
    public static final String SIMPLE_NUMBER = "<SIMPLE NUMBER>";
    public static final String COMPOUND_NUMBER = "<COMPOUND NUMBER>";
    public static final String CHAR_STRING = "<CHAR STRING>";
    public static final String TEXT = "<TEXT>";
    public static final String END_OF_FILE = "<EOF>";

    public static final int NONE = 0;

    private final String[] names;
    private final SymbolKind[] kinds;
    private final int terminalCount;
    private final Map<String, Integer> indexes = new HashMap<>();
    private final List<String> specials;
    private final int maxSpecialLength;

    // cached indexes of the synthetic terminals, NONE when absent
    public final int identifier;
    public final int simpleNumber;
    public final int compoundNumber;
    public final int charString;
    public final int text;
    public final int endOfFile;

    /**
     * The end-of-file terminal is appended when the list does not name it.
     */
    public Vocabulary(List<String> terminals, List<String> nonterminals) {
        List<String> temp = new ArrayList<>(terminals);
        if (!temp.contains(END_OF_FILE)) {
            temp.add(END_OF_FILE);
        }
        terminalCount = temp.size();
        names = new String[1 + terminalCount + nonterminals.size()];
        kinds = new SymbolKind[names.length];
        names[0] = "";
        int index = 1;
        List<String> specialList = new ArrayList<>();
        for (String name : temp) {
            kinds[index] = classify(name);
            if (kinds[index] == SymbolKind.SPECIAL) {
                specialList.add(name);
            }
            add(name, index++);
        }
        for (String name : nonterminals) {
            kinds[index] = SymbolKind.NONTERMINAL;
            add(name, index++);
        }
        specialList.sort((a, b) -> b.length() - a.length());
        specials = Collections.unmodifiableList(specialList);
        maxSpecialLength = specialList.isEmpty() ? 0 : specialList.get(0).length();
        identifier = find(IDENTIFIER);
        simpleNumber = find(SIMPLE_NUMBER);
        compoundNumber = find(COMPOUND_NUMBER);
        charString = find(CHAR_STRING);
        text = find(TEXT);
        endOfFile = find(END_OF_FILE);
    }

    private void add(String name, int index) {
        if (name == null || name.isEmpty()) {
            throw new GrammarException("empty symbol name at index " + index);
        }
        if (indexes.put(name, index) != null) {
            throw new GrammarException("duplicate symbol: " + name);
        }
        names[index] = name;
    }

    private int find(String name) {
        Integer index = indexes.get(name);
        return index == null || !isTerminal(index) ? NONE : index;
    }

    static SymbolKind classify(String name) {
        if (name.length() > 2 && name.charAt(0) == '<' && name.charAt(name.length() - 1) == '>') {
            return SymbolKind.SYNTHETIC;
        }
        if (CharClass.of(name.charAt(0)) == CharClass.LETTER) {
            for (int i = 1; i < name.length(); i++) {
                if (!CharClass.isIdentifierPart(name.charAt(i))) {
                    throw new GrammarException("invalid reserved word: " + name);
                }
            }
            return SymbolKind.RESERVED_WORD;
        }
        for (int i = 0; i < name.length(); i++) {
            CharClass cc = CharClass.of(name.charAt(i));
            if (cc != CharClass.SPECIAL) {
                throw new GrammarException("terminal mixes special and other characters: " + name);
            }
        }
        return SymbolKind.SPECIAL;
    }

    public int size() {
        return names.length;
    }

    public int getTerminalCount() {
        return terminalCount;
    }

    public int getNonterminalCount() {
        return names.length - 1 - terminalCount;
    }

    public boolean isTerminal(int index) {
        return index >= 1 && index <= terminalCount;
    }

    public boolean isNonterminal(int index) {
        return index > terminalCount && index < names.length;
    }

    public String getName(int index) {
        if (index < 0 || index >= names.length) {
            return "?" + index;
        }
        return names[index];
    }

    public SymbolKind getKind(int index) {
        return kinds[index];
    }

    /**
     * Index of the named symbol, or {@link #NONE}.
     */
    public int getIndex(String name) {
        Integer index = indexes.get(name);
        return index == null ? NONE : index;
    }

    /**
     * Reserved word lookup; the text is upper-cased before matching.
     */
    public int lookupReserved(String text) {
        Integer index = indexes.get(text.toUpperCase(Locale.ROOT));
        if (index == null || kinds[index] != SymbolKind.RESERVED_WORD) {
            return NONE;
        }
        return index;
    }

    /**
     * Special terminals, longest first.
     */
    public List<String> getSpecials() {
        return specials;
    }

    public int getMaxSpecialLength() {
        return maxSpecialLength;
    }

    public List<String> getTerminals() {
        List<String> list = new ArrayList<>(terminalCount);
        for (int i = 1; i <= terminalCount; i++) {
            list.add(names[i]);
        }
        return list;
    }

    public List<String> getNonterminals() {
        List<String> list = new ArrayList<>();
        for (int i = terminalCount + 1; i < names.length; i++) {
            list.add(names[i]);
        }
        return list;
    }

    @Override
    public String toString() {
        return "terminals: " + terminalCount + ", nonterminals: " + getNonterminalCount();
    }

}
