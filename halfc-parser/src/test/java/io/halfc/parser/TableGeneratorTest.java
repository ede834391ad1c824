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
import io.halfc.grammar.Grammar;
import io.halfc.grammar.GrammarException;
import io.halfc.grammar.Vocabulary;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class TableGeneratorTest {

    static final String AMBIGUOUS_SUM = """
            <E> ::= <E> + <E>
                 | x
            """;

    static final String AMBIGUOUS_REDUCE = """
            <S> ::= <A>
                 | <B>
            <A> ::= x
            <B> ::= x
            """;

    @Test
    void testAssignmentGrammar() {
        Grammar grammar = TestUtils.grammar(TestUtils.ASSIGNMENT_BNF);
        TableGenerator generator = new TableGenerator(grammar).failOnConflict(true);
        AutomatonTables tables = generator.generate();
        assertEquals(14, tables.getStateCount());
        assertEquals(0, generator.getShiftReduceConflicts());
        assertEquals(0, generator.getReduceReduceConflicts());
        assertEquals(0, tables.countShadowedEntries());
        Vocabulary vocabulary = grammar.getVocabulary();
        int initial = AutomatonTables.INITIAL_STATE;
        assertEquals(List.of(vocabulary.identifier), tables.expectedTerminals(initial));
        assertEquals(ActionType.SHIFT, tables.decide(initial, vocabulary.identifier).type);
        assertEquals(Action.ERROR, tables.decide(initial, vocabulary.getIndex(";")));
        assertEquals(Action.ERROR, tables.decide(initial, vocabulary.endOfFile));
    }

    @Test
    void testAcceptOnlyAtEndOfFile() {
        Grammar grammar = TestUtils.grammar(TestUtils.ASSIGNMENT_BNF);
        AutomatonTables tables = TableGenerator.generate(grammar);
        OptionalInt state = tables.readEntry(AutomatonTables.INITIAL_STATE, grammar.getStartSymbol());
        assertTrue(state.isPresent());
        Vocabulary vocabulary = grammar.getVocabulary();
        assertTrue(tables.isUnconditional(state.getAsInt()));
        assertEquals(Action.ACCEPT, tables.decide(state.getAsInt(), vocabulary.endOfFile));
        assertEquals(Action.ERROR, tables.decide(state.getAsInt(), vocabulary.getIndex(";")));
        assertEquals(Action.ERROR, tables.decide(state.getAsInt(), vocabulary.identifier));
    }

    @Test
    void testProductionData() {
        AutomatonTables tables = TestUtils.tables(TestUtils.ASSIGNMENT_BNF);
        Vocabulary vocabulary = tables.getVocabulary();
        assertEquals(3, tables.getRhsLength(TestUtils.P_ASSIGNMENT));
        assertEquals(vocabulary.getIndex("<ASSIGNMENT>"), tables.getLhs(TestUtils.P_ASSIGNMENT));
        assertEquals(1, tables.getRhsLength(0));
    }

    @Test
    void testBundledGrammarIsDeterministic() {
        Grammar grammar = TestUtils.halGrammar();
        TableGenerator generator = new TableGenerator(grammar).failOnConflict(true);
        AutomatonTables tables = generator.generate();
        assertEquals(0, tables.countShadowedEntries());
        Vocabulary vocabulary = grammar.getVocabulary();
        for (int state = 0; state < tables.getStateCount(); state++) {
            for (int t = 1; t <= vocabulary.getTerminalCount(); t++) {
                assertTrue(tables.actionCount(state, t) <= 1, "state " + state + " terminal " + vocabulary.getName(t));
            }
            assertTrue(tables.applyCount(state) <= 1 || tables.lookCount(state) > 0);
        }
    }

    @Test
    void testShiftReduceConflictPrefersShift() {
        Grammar grammar = TestUtils.grammar(AMBIGUOUS_SUM);
        assertThrows(GrammarException.class, () -> new TableGenerator(grammar).failOnConflict(true).generate());
        TableGenerator generator = new TableGenerator(grammar);
        AutomatonTables tables = generator.generate();
        assertEquals(1, generator.getShiftReduceConflicts());
        assertEquals(0, generator.getReduceReduceConflicts());
        assertEquals(0, tables.countShadowedEntries());
        // the conflict resolved to shift makes the sum right-associative
        Vocabulary vocabulary = grammar.getVocabulary();
        int state = AutomatonTables.INITIAL_STATE;
        state = tables.decide(state, vocabulary.getIndex("x")).value;
        Action action = tables.decide(state, vocabulary.getIndex("+"));
        assertEquals(ActionType.REDUCE, action.type);
        state = tables.readEntry(AutomatonTables.INITIAL_STATE, vocabulary.getIndex("<E>")).getAsInt();
        state = tables.decide(state, vocabulary.getIndex("+")).value;
        state = tables.decide(state, vocabulary.getIndex("x")).value;
        assertEquals(Action.reduce(2), tables.decide(state, vocabulary.getIndex("+")));
        int afterSecond = tables.readEntry(tables.readEntry(AutomatonTables.INITIAL_STATE,
                vocabulary.getIndex("<E>")).getAsInt(), vocabulary.getIndex("+")).getAsInt();
        int top = tables.readEntry(afterSecond, vocabulary.getIndex("<E>")).getAsInt();
        assertEquals(ActionType.SHIFT, tables.decide(top, vocabulary.getIndex("+")).type);
        assertEquals(Action.reduce(1), tables.decide(top, vocabulary.endOfFile));
    }

    @Test
    void testReduceReduceConflictPrefersLowerProduction() {
        Grammar grammar = TestUtils.grammar(AMBIGUOUS_REDUCE);
        assertThrows(GrammarException.class, () -> new TableGenerator(grammar).failOnConflict(true).generate());
        TableGenerator generator = new TableGenerator(grammar);
        AutomatonTables tables = generator.generate();
        assertEquals(0, generator.getShiftReduceConflicts());
        assertEquals(1, generator.getReduceReduceConflicts());
        Vocabulary vocabulary = grammar.getVocabulary();
        int state = tables.decide(AutomatonTables.INITIAL_STATE, vocabulary.getIndex("x")).value;
        assertEquals(Action.reduce(3), tables.decide(state, vocabulary.endOfFile));
    }

    @Test
    void testEmptyProduction() {
        Grammar grammar = TestUtils.grammar("""
                <LIST> ::= <ITEMS> ;
                <ITEMS> ::=
                         | <ITEMS> x
                """);
        TableGenerator generator = new TableGenerator(grammar).failOnConflict(true);
        AutomatonTables tables = generator.generate();
        Vocabulary vocabulary = grammar.getVocabulary();
        Action action = tables.decide(AutomatonTables.INITIAL_STATE, vocabulary.getIndex(";"));
        assertEquals(Action.reduce(2), action);
    }

}
