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
package io.halfc.scanner;

import io.halfc.TestUtils;
import io.halfc.charset.CharacterTranslator;
import io.halfc.common.Diagnostics;
import io.halfc.common.Location;
import io.halfc.common.Severity;
import io.halfc.grammar.Vocabulary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScannerTest {

    Vocabulary vocabulary;
    Diagnostics diagnostics;

    @BeforeEach
    void beforeEach() {
        vocabulary = TestUtils.halVocabulary();
        diagnostics = new Diagnostics();
    }

    private List<Token> scan(String text) {
        return TestUtils.drain(TestUtils.scanner(text, vocabulary, diagnostics), vocabulary);
    }

    private int symbol(String name) {
        return vocabulary.getIndex(name);
    }

    private static String internal(String external) {
        StringBuilder sb = new StringBuilder();
        for (char c : external.toCharArray()) {
            sb.append((char) CharacterTranslator.translateIn(c));
        }
        return sb.toString();
    }

    // ========== Identifiers ==========

    @Test
    void testIdentifiersAndReservedWords() {
        List<Token> tokens = scan("declare Alpha_1 INTEGER;");
        assertEquals(4, tokens.size());
        assertEquals(symbol("DECLARE"), tokens.get(0).symbol);
        assertEquals("declare", tokens.get(0).text);
        assertEquals(vocabulary.identifier, tokens.get(1).symbol);
        assertEquals("Alpha_1", tokens.get(1).text);
        assertEquals(symbol("INTEGER"), tokens.get(2).symbol);
        assertEquals(symbol(";"), tokens.get(3).symbol);
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void testLongIdentifierTruncated() {
        Scanner scanner = TestUtils.scanner("ABCDEFGH = 1", vocabulary, diagnostics).identifierLimit(4);
        List<Token> tokens = TestUtils.drain(scanner, vocabulary);
        assertEquals("ABCD", tokens.get(0).text);
        assertEquals(1, diagnostics.getErrorCount());
        assertTrue(diagnostics.getAll().get(0).message.startsWith("identifier longer than 4"));
    }

    @Test
    void testReservedWordIsNotTruncated() {
        Scanner scanner = TestUtils.scanner("REPLACE", vocabulary, diagnostics).identifierLimit(3);
        List<Token> tokens = TestUtils.drain(scanner, vocabulary);
        assertEquals(symbol("REPLACE"), tokens.get(0).symbol);
        assertTrue(diagnostics.isEmpty());
    }

    // ========== Numbers ==========

    @Test
    void testNumbers() {
        List<Token> tokens = scan("12 1.5 .5 3E2 2E-3 1.5E+2B4 7");
        assertEquals("12 1.5 .5 3E2 2E-3 1.5E+2B4 7", TestUtils.texts(tokens));
        assertEquals(vocabulary.simpleNumber, tokens.get(0).symbol);
        for (int i = 1; i < 6; i++) {
            assertEquals(vocabulary.compoundNumber, tokens.get(i).symbol, tokens.get(i).text);
        }
        assertEquals(vocabulary.simpleNumber, tokens.get(6).symbol);
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void testExponentLetterWithoutDigits() {
        List<Token> tokens = scan("7E;");
        assertEquals("7 E ;", TestUtils.texts(tokens));
        assertEquals(vocabulary.simpleNumber, tokens.get(0).symbol);
        assertEquals(vocabulary.identifier, tokens.get(1).symbol);
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void testMalformedExponent() {
        List<Token> tokens = scan("5E+;");
        assertEquals("5E+ ;", TestUtils.texts(tokens));
        assertEquals(vocabulary.compoundNumber, tokens.get(0).symbol);
        assertEquals(1, diagnostics.getErrorCount());
    }

    // ========== Character strings ==========

    @Test
    void testCharacterString() {
        List<Token> tokens = scan("'IT''S' 'AB'");
        assertEquals(2, tokens.size());
        Token token = tokens.get(0);
        assertEquals(vocabulary.charString, token.symbol);
        assertEquals("'IT''S'", token.text);
        assertEquals(internal("IT'S"), token.value);
        assertEquals(internal("AB"), tokens.get(1).value);
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void testEscapesInString() {
        List<Token> tokens = scan("'`A``A`0'");
        String value = tokens.get(0).value;
        assertEquals(3, value.length());
        assertEquals(0x10, value.charAt(0));
        assertEquals(0x57, value.charAt(1));
        assertEquals(0x00, value.charAt(2));
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void testBadStringCharacters() {
        List<Token> tokens = scan("'A[B' '```A' '`('");
        assertEquals(3, tokens.size());
        assertEquals(internal("A B"), tokens.get(0).value);
        assertEquals(internal(" "), tokens.get(1).value);
        assertEquals(internal(" "), tokens.get(2).value);
        assertEquals(3, diagnostics.getErrorCount());
    }

    @Test
    void testUnterminatedStringEndsAtLine() {
        List<Token> tokens = scan("'ABC\nX");
        assertEquals(2, tokens.size());
        assertEquals(internal("ABC"), tokens.get(0).value);
        assertEquals("X", tokens.get(1).text);
        assertEquals(new Location("", 2, 1), tokens.get(1).location);
        assertEquals(1, diagnostics.getErrorCount());
        assertEquals("unterminated character string", diagnostics.getAll().get(0).message);
    }

    @Test
    void testLongStringTruncated() {
        Scanner scanner = TestUtils.scanner("'ABCDE'", vocabulary, diagnostics).stringLimit(3);
        List<Token> tokens = TestUtils.drain(scanner, vocabulary);
        assertEquals(internal("ABC"), tokens.get(0).value);
        assertEquals("'ABCDE'", tokens.get(0).text);
        assertEquals(1, diagnostics.getErrorCount());
    }

    // ========== Replace text ==========

    @Test
    void testReplaceText() {
        List<Token> tokens = scan("REPLACE N BY \"X + \"\"1\"\"\nAND Y\";");
        assertEquals(5, tokens.size());
        Token text = tokens.get(3);
        assertEquals(vocabulary.text, text.symbol);
        assertEquals("X + \"1\"\nAND Y", text.value);
        assertEquals(symbol(";"), tokens.get(4).symbol);
        assertEquals(2, tokens.get(4).location.line);
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void testUnterminatedReplaceText() {
        List<Token> tokens = scan("\"A + B");
        assertEquals(1, tokens.size());
        assertEquals("A + B", tokens.get(0).value);
        assertEquals(1, diagnostics.getErrorCount());
    }

    // ========== Specials and comments ==========

    @Test
    void testLongestSpecialWins() {
        List<Token> tokens = scan("X**2<=Y~=Z<W*V");
        assertEquals("X ** 2 <= Y ~= Z < W * V", TestUtils.texts(tokens));
        assertEquals(symbol("**"), tokens.get(1).symbol);
        assertEquals(symbol("<="), tokens.get(3).symbol);
        assertEquals(symbol("~="), tokens.get(5).symbol);
        assertEquals(symbol("<"), tokens.get(7).symbol);
        assertEquals(symbol("*"), tokens.get(9).symbol);
    }

    @Test
    void testComments() {
        List<Token> tokens = scan("A /* one\n two */ B/**/C /* open");
        assertEquals("A B C", TestUtils.texts(tokens));
        assertEquals(1, diagnostics.getErrorCount());
        assertEquals("unterminated comment", diagnostics.getAll().get(0).message);
    }

    @Test
    void testIllegalCharactersSkipped() {
        List<Token> tokens = scan("A [ B . C `D");
        assertEquals("A B C D", TestUtils.texts(tokens));
        List<String> messages = diagnostics.get(Severity.ERROR).stream().map(d -> d.message).toList();
        assertEquals(List.of("illegal character '['", "unexpected character '.'",
                "escape character outside a character string"), messages);
    }

    @Test
    void testLocationsAndEndOfFile() {
        Scanner scanner = TestUtils.scanner("A\n  B", vocabulary, diagnostics);
        Token a = scanner.nextToken();
        Token b = scanner.nextToken();
        assertEquals(new Location("", 1, 1), a.location);
        assertEquals(new Location("", 2, 3), b.location);
        assertEquals(vocabulary.endOfFile, scanner.nextToken().symbol);
        assertEquals(vocabulary.endOfFile, scanner.nextToken().symbol);
        assertEquals(4, scanner.getTokenCount());
    }

}
