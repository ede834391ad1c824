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

import io.halfc.TestUtils;
import io.halfc.common.Resource;
import io.halfc.grammar.Vocabulary;
import net.minidev.json.JSONObject;
import net.minidev.json.JSONValue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TableReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testRoundTripKeepsDecisions() {
        AutomatonTables tables = TestUtils.halTables();
        AutomatonTables copy = TableReader.fromJson(TableWriter.toJson(tables));
        assertSameAutomaton(tables, copy);
    }

    @Test
    void testWriteAndRead() {
        AutomatonTables tables = TestUtils.tables(TestUtils.ASSIGNMENT_BNF);
        Path path = tempDir.resolve("tables/assignment.json");
        TableWriter.write(tables, path);
        AutomatonTables copy = TableReader.read(Resource.from(path));
        assertSameAutomaton(tables, copy);
        assertEquals(tables.getGrammar().toString(TestUtils.P_ASSIGNMENT),
                copy.getGrammar().toString(TestUtils.P_ASSIGNMENT));
    }

    @Test
    void testInvalidFiles() {
        String json = TableWriter.toJson(TestUtils.tables(TestUtils.ASSIGNMENT_BNF));
        assertThrows(TableException.class, () -> TableReader.fromJson("[1, 2]"));
        assertThrows(TableException.class, () -> TableReader.fromJson("{ not json"));
        assertThrows(TableException.class, () -> TableReader.fromJson(edit(json, "format", "other")));
        assertThrows(TableException.class, () -> TableReader.fromJson(edit(json, "version", 99)));
        assertThrows(TableException.class, () -> TableReader.fromJson(edit(json, "look", null)));
        assertThrows(TableException.class, () -> TableReader.fromJson(edit(json, "terminals", "x")));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testReadTargetOutOfRange() {
        JSONObject map = (JSONObject) JSONValue.parse(TableWriter.toJson(TestUtils.tables(TestUtils.ASSIGNMENT_BNF)));
        Map<String, Object> read = (Map<String, Object>) map.get("read");
        List<Object> states = (List<Object>) read.get("state");
        states.set(0, 1000);
        TableException e = assertThrows(TableException.class, () -> TableReader.fromJson(map.toJSONString()));
        assertTrue(e.getMessage().contains("read target out of range"), e.getMessage());
    }

    @Test
    void testMissingFile() {
        Resource resource = Resource.from(tempDir.resolve("missing.json"));
        assertThrows(RuntimeException.class, () -> TableReader.read(resource));
    }

    private static String edit(String json, String key, Object value) {
        JSONObject map = (JSONObject) JSONValue.parse(json);
        if (value == null) {
            map.remove(key);
        } else {
            map.put(key, value);
        }
        return map.toJSONString();
    }

    private static void assertSameAutomaton(AutomatonTables expected, AutomatonTables actual) {
        Vocabulary vocabulary = expected.getVocabulary();
        assertEquals(vocabulary.getTerminals(), actual.getVocabulary().getTerminals());
        assertEquals(vocabulary.getNonterminals(), actual.getVocabulary().getNonterminals());
        assertEquals(expected.getStateCount(), actual.getStateCount());
        for (int state = 0; state < expected.getStateCount(); state++) {
            for (int symbol = 1; symbol < vocabulary.size(); symbol++) {
                if (vocabulary.isTerminal(symbol)) {
                    assertEquals(expected.decide(state, symbol), actual.decide(state, symbol));
                } else {
                    assertEquals(expected.readEntry(state, symbol), actual.readEntry(state, symbol));
                }
            }
        }
    }

}
