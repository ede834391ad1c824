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

import io.halfc.common.Resource;
import io.halfc.grammar.Grammar;
import io.halfc.grammar.GrammarException;
import io.halfc.grammar.Production;
import io.halfc.grammar.Vocabulary;
import net.minidev.json.JSONValue;
import net.minidev.json.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads tables written by {@link TableWriter}. The structure is validated on
 * load; any inconsistency is a {@link TableException}.
 */
public class TableReader {

    static final Logger logger = LoggerFactory.getLogger(TableReader.class);

    private TableReader() {
        // only static methods
    }

    public static AutomatonTables read(Resource resource) {
        try {
            AutomatonTables tables = fromJson(resource.getText());
            logger.debug("loaded {} from {}", tables, resource);
            return tables;
        } catch (TableException e) {
            throw new TableException("Failed to load tables from: " + resource + ": " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    public static AutomatonTables fromJson(String json) {
        Object parsed;
        try {
            parsed = JSONValue.parseWithException(json);
        } catch (ParseException e) {
            throw new TableException("invalid json: " + e.getMessage(), e);
        }
        if (!(parsed instanceof Map)) {
            throw new TableException("expected a JSON object");
        }
        Map<String, Object> map = (Map<String, Object>) parsed;
        if (!TableWriter.FORMAT.equals(map.get("format"))) {
            throw new TableException("not a table file, format: " + map.get("format"));
        }
        int version = toInt(map.get("version"), "version");
        if (version != TableWriter.VERSION) {
            throw new TableException("unsupported table version: " + version);
        }
        try {
            Vocabulary vocabulary = new Vocabulary(strings(map, "terminals"), strings(map, "nonterminals"));
            List<Production> productions = new ArrayList<>();
            for (Object row : (List<Object>) require(map, "productions")) {
                int[] values = ints((List<Object>) row, "productions");
                if (values.length == 0) {
                    throw new TableException("empty production row");
                }
                int[] rhs = new int[values.length - 1];
                System.arraycopy(values, 1, rhs, 0, rhs.length);
                productions.add(new Production(productions.size(), values[0], rhs));
            }
            Grammar grammar = new Grammar(vocabulary, productions);
            Map<String, Object> read = section(map, "read");
            Map<String, Object> look = section(map, "look");
            Map<String, Object> apply = section(map, "apply");
            return new AutomatonTables(grammar,
                    index(read), ints(read, "symbol"), ints(read, "state"),
                    index(look), ints(look, "terminal"), ints(look, "production"),
                    index(apply), ints(apply, "production"));
        } catch (GrammarException | ClassCastException e) {
            throw new TableException("invalid tables: " + e.getMessage(), e);
        }
    }

    private static Object require(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            throw new TableException("missing: " + key);
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> map, String key) {
        return (Map<String, Object>) require(map, key);
    }

    @SuppressWarnings("unchecked")
    private static List<String> strings(Map<String, Object> map, String key) {
        return (List<String>) require(map, key);
    }

    private static IndexTable index(Map<String, Object> map) {
        return new IndexTable(ints(map, "offset"), ints(map, "count"));
    }

    @SuppressWarnings("unchecked")
    private static int[] ints(Map<String, Object> map, String key) {
        return ints((List<Object>) require(map, key), key);
    }

    private static int[] ints(List<Object> list, String name) {
        int[] result = new int[list.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = toInt(list.get(i), name);
        }
        return result;
    }

    private static int toInt(Object value, String name) {
        if (!(value instanceof Number)) {
            throw new TableException("expected a number in " + name + ": " + value);
        }
        return ((Number) value).intValue();
    }

}
