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
package io.halfc.parser;

import io.halfc.grammar.Grammar;
import io.halfc.grammar.Production;
import io.halfc.grammar.Vocabulary;
import net.minidev.json.JSONStyle;
import net.minidev.json.JSONValue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes automaton tables as JSON so they can be generated once and loaded
 * at startup. Symbols are stored by name, everything else by index.
 */
public class TableWriter {

    public static final String FORMAT = "halfc-tables";
    public static final int VERSION = 1;

    private static final JSONStyle JSON_STYLE = new JSONStyle(JSONStyle.FLAG_PROTECT_4WEB);

    private TableWriter() {
        // only static methods
    }

    public static String toJson(AutomatonTables tables) {
        return JSONValue.toJSONString(toMap(tables), JSON_STYLE);
    }

    public static void write(AutomatonTables tables, Path path) {
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.writeString(path, toJson(tables), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TableException("Failed to write tables to: " + path, e);
        }
    }

    static Map<String, Object> toMap(AutomatonTables tables) {
        Grammar grammar = tables.getGrammar();
        Vocabulary vocabulary = grammar.getVocabulary();
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("format", FORMAT);
        map.put("version", VERSION);
        map.put("terminals", vocabulary.getTerminals());
        map.put("nonterminals", vocabulary.getNonterminals());
        List<List<Integer>> productions = new ArrayList<>();
        for (Production p : grammar.getProductions()) {
            List<Integer> row = new ArrayList<>(p.length() + 1);
            row.add(p.lhs);
            for (int symbol : p.getRhs()) {
                row.add(symbol);
            }
            productions.add(row);
        }
        map.put("productions", productions);
        Map<String, Object> read = index(tables.getReadIndex());
        read.put("symbol", list(tables.getRead1()));
        read.put("state", list(tables.getRead2()));
        map.put("read", read);
        Map<String, Object> look = index(tables.getLookIndex());
        look.put("terminal", list(tables.getLook1()));
        look.put("production", list(tables.getLook2()));
        map.put("look", look);
        Map<String, Object> apply = index(tables.getApplyIndex());
        apply.put("production", list(tables.getApply1()));
        map.put("apply", apply);
        return map;
    }

    private static Map<String, Object> index(IndexTable index) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("offset", list(index.getOffsets()));
        map.put("count", list(index.getCounts()));
        return map;
    }

    private static List<Integer> list(int[] values) {
        List<Integer> list = new ArrayList<>(values.length);
        for (int v : values) {
            list.add(v);
        }
        return list;
    }

}
