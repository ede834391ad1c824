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
import io.halfc.common.Diagnostic;
import io.halfc.common.Diagnostics;
import io.halfc.common.Location;
import io.halfc.common.Severity;
import io.halfc.grammar.Grammar;
import io.halfc.grammar.Vocabulary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LalrParserTest {

    static final String SAMPLE = """
            SAMPLE: PROGRAM;
               DECLARE I INTEGER, X SCALAR INITIAL(1.5), DONE BOOLEAN, NAME CHARACTER(8);
               REPLACE SQUARE(V) BY "V ** 2";
               I = 0;
               DO WHILE I < 10;
                  I = I + 1;
                  IF I = 5 THEN X = X * 2; ELSE X = -X / 3;
               END;
               DO I = 1 TO 3;
                  CALL PRINT(I, 'DONE');
               END;
               WRITE(6) X, SQUARE(I);
               LOOP: DO;
                  IF X >= 100 THEN DONE = 1;
                  ;
               END;
            CLOSE SAMPLE;
            """;

    AutomatonTables tables;
    Diagnostics diagnostics;
    List<Integer> reductions;

    @BeforeEach
    void beforeEach() {
        tables = TestUtils.tables(TestUtils.ASSIGNMENT_BNF);
        diagnostics = new Diagnostics();
        reductions = new ArrayList<>();
    }

    private ParseResult parse(String text) {
        return parse(text, new ParserOptions());
    }

    private ParseResult parse(String text, ParserOptions options) {
        SemanticActions actions = (production, values) -> {
            reductions.add(production);
            return null;
        };
        LalrParser parser = new LalrParser(tables, TestUtils.scanner(text, tables.getVocabulary(), diagnostics),
                actions, diagnostics, options);
        return parser.parse();
    }

    private List<String> messages(Severity severity) {
        return diagnostics.get(severity).stream().map(d -> d.message).toList();
    }

    // ========== Reduction order ==========

    @Test
    void testReductionOrder() {
        ParseResult result = parse("A := B + C ;");
        assertTrue(result.isAccepted());
        int ident = TestUtils.P_IDENT;
        assertEquals(List.of(ident, ident, TestUtils.P_ADDITIVE, TestUtils.P_ASSIGNMENT, TestUtils.P_STATEMENT, 2, 1),
                reductions);
        assertEquals(7, result.reductions);
        assertEquals(6, result.tokensShifted);
        assertEquals(0, result.syntaxErrors);
        assertEquals(0, result.ambiguousDecisions);
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void testTreeBuilder() {
        Grammar grammar = tables.getGrammar();
        LalrParser parser = new LalrParser(tables, TestUtils.scanner("A := B + C ; D := E + F ;",
                grammar.getVocabulary(), diagnostics), new TreeBuilder(grammar), diagnostics);
        ParseResult result = parser.parse();
        assertTrue(result.isAccepted());
        Node root = (Node) result.value;
        assertSame(root, parser.getValue());
        Vocabulary vocabulary = grammar.getVocabulary();
        assertEquals(vocabulary.getIndex("<PROGRAM>"), root.symbol);
        assertEquals(1, root.production);
        assertEquals("A := B + C ; D := E + F ;", root.getText());
        List<Node> assignments = root.findAll(vocabulary.getIndex("<ASSIGNMENT>"));
        assertEquals(2, assignments.size());
        Node second = assignments.get(1);
        assertEquals("D := E + F", second.getText());
        assertEquals("D", second.getFirst().getText());
        assertTrue(second.getFirst().isToken());
        assertEquals(new Location("", 1, 14), second.getFirstToken().location);
        Node additive = second.findFirstChild(vocabulary.getIndex("<ADDITIVE>"));
        assertEquals(3, additive.size());
        assertSame(second, additive.getParent());
        assertEquals("[6] E + F", additive.toString());
    }

    // ========== Error recovery ==========

    @Test
    void testMissingSemicolonReportedOnce() {
        ParseResult result = parse("A := B + C D := E + F ; G := H + I ;");
        assertTrue(result.isAccepted());
        assertEquals(1, result.syntaxErrors);
        assertEquals(List.of("syntax error at 'D', expected ;"), messages(Severity.ERROR));
        assertEquals(new Location("", 1, 12), diagnostics.getAll().get(0).location);
        assertEquals(List.of(7, 7, 6, 5, 4, 2, 7, 7, 6, 5, 4, 3, 1), reductions);
    }

    @Test
    void testErrorRightAfterRecoveryNotReported() {
        ParseResult result = parse("A := B + C ; ; ;");
        assertTrue(result.isAccepted());
        assertEquals(List.of("syntax error at ';', expected <IDENTIFIER>, <EOF>"), messages(Severity.ERROR));
    }

    @Test
    void testSeparateErrorsReported() {
        ParseResult result = parse("A := B + C D ; E := F + G H ; I := J + K ;");
        assertTrue(result.isAccepted());
        assertEquals(2, result.syntaxErrors);
        assertEquals(List.of("syntax error at 'D', expected ;", "syntax error at 'H', expected ;"),
                messages(Severity.ERROR));
    }

    @Test
    void testErrorLimit() {
        ParseResult result = parse("A := B + C D ; E := F + G H ; I := J + K ;", new ParserOptions().errorLimit(2));
        assertTrue(result.isAborted());
        assertEquals(2, diagnostics.count(Severity.ERROR));
        assertEquals(List.of("syntax error limit of 2 reached"), messages(Severity.FATAL));
    }

    @Test
    void testNoRecoveryBeforeEndOfFile() {
        ParseResult result = parse("A := B + C");
        assertTrue(result.isAborted());
        assertNull(result.value);
        List<Diagnostic> all = diagnostics.getAll();
        assertEquals(2, all.size());
        assertEquals("syntax error at end of file, expected ;", all.get(0).message);
        assertEquals(Severity.FATAL, all.get(1).severity);
        assertEquals("no recovery point found before end of file", all.get(1).message);
    }

    @Test
    void testBrokenFirstStatementAbandonsUnit() {
        ParseResult result = parse("A := ; B := ; C := D + E ;");
        assertEquals(ParseOutcome.ABORT, result.outcome);
        assertEquals(1, diagnostics.count(Severity.ERROR));
        assertTrue(diagnostics.hasFatal());
    }

    @Test
    void testUnknownSyncTerminalIgnored() {
        ParseResult result = parse("A := B + C D := E + F ; G := H + I ;",
                new ParserOptions().syncTerminals(List.of("NOSUCH", ";")));
        assertTrue(result.isAccepted());
        assertEquals(1, result.syntaxErrors);
    }

    // ========== Limits ==========

    @Test
    void testStackOverflow() {
        ParseResult result = parse("A := B + C ;", new ParserOptions().stackSize(3));
        assertTrue(result.isAborted());
        assertEquals(3, result.maxStackDepth);
        Diagnostic fatal = diagnostics.get(Severity.FATAL).get(0);
        assertEquals("parse stack overflow, more than 3 entries", fatal.message);
        assertEquals(new Location("", 1, 6), fatal.location);
    }

    @Test
    void testStepByStep() {
        LalrParser parser = new LalrParser(tables, TestUtils.scanner("A := B + C ;", tables.getVocabulary(),
                diagnostics), SemanticActions.NONE, diagnostics);
        assertEquals(1, parser.getStackDepth());
        int steps = 0;
        ParseOutcome outcome;
        do {
            outcome = parser.step();
            steps++;
        } while (outcome == ParseOutcome.CONTINUE);
        assertEquals(ParseOutcome.ACCEPT, outcome);
        // six shifts and seven reductions
        assertEquals(14, steps);
        assertEquals(7, parser.getReductions());
        assertEquals(0, parser.getSyntaxErrors());
    }

    // ========== Bundled grammar ==========

    @Test
    void testSampleProgram() {
        tables = TestUtils.halTables();
        ParseResult result = parse(SAMPLE);
        assertTrue(result.isAccepted(), diagnostics.toString());
        assertTrue(diagnostics.isEmpty(), diagnostics.toString());
        assertEquals(0, result.ambiguousDecisions);
        assertEquals(116, result.tokensShifted);
        assertEquals(207, result.reductions);
    }

    @Test
    void testSampleProgramTree() {
        tables = TestUtils.halTables();
        Grammar grammar = tables.getGrammar();
        LalrParser parser = new LalrParser(tables, TestUtils.scanner(SAMPLE, grammar.getVocabulary(), diagnostics),
                new TreeBuilder(grammar), diagnostics);
        Node root = (Node) parser.parse().value;
        Vocabulary vocabulary = grammar.getVocabulary();
        assertEquals(vocabulary.getIndex("<COMPILATION>"), root.symbol);
        assertEquals(2, root.findAll(vocabulary.getIndex("<IF STATEMENT>")).size());
        assertEquals(3, root.findAll(vocabulary.getIndex("<DO GROUP>")).size());
        assertEquals("REPLACE SQUARE ( V ) BY \"V ** 2\"",
                root.findFirstChild(vocabulary.getIndex("<REPLACE STATEMENT>")).getText());
    }

    @Test
    void testRecoveryInBundledGrammar() {
        tables = TestUtils.halTables();
        ParseResult result = parse("X = 1; Y = ; Z = 2; IF X THEN Y = 3;");
        assertTrue(result.isAccepted());
        List<String> errors = messages(Severity.ERROR);
        assertEquals(2, errors.size());
        assertEquals("syntax error at ';', expected <IDENTIFIER>, (, <SIMPLE NUMBER>, -, <CHAR STRING>, "
                + "<COMPOUND NUMBER>", errors.get(0));
        assertTrue(errors.get(1).startsWith("syntax error at 'THEN', expected =, <, >, <=, >=, ~=, -, +"));
    }

}
