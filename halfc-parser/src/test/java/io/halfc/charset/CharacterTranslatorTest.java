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
package io.halfc.charset;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CharacterTranslatorTest {

    @Test
    void testDirectTranslation() {
        assertEquals(0xC1, CharacterTranslator.translateIn('A'));
        assertEquals(0x81, CharacterTranslator.translateIn('a'));
        assertEquals(0xF0, CharacterTranslator.translateIn('0'));
        assertEquals(0x40, CharacterTranslator.translateIn(' '));
        assertEquals(0x5E, CharacterTranslator.translateIn(';'));
        assertEquals(0x5F, CharacterTranslator.translateIn('~'));
    }

    @Test
    void testUndefinedCharactersRejected() {
        assertEquals(CharacterTranslator.UNDEFINED, CharacterTranslator.translateIn('['));
        assertEquals(CharacterTranslator.UNDEFINED, CharacterTranslator.translateIn('{'));
        assertEquals(CharacterTranslator.UNDEFINED, CharacterTranslator.translateIn(CharacterTranslator.ESCAPE_CHAR));
        assertEquals(CharacterTranslator.UNDEFINED, CharacterTranslator.translateIn('é'));
        assertFalse(CharacterTranslator.isDefined('['));
        assertTrue(CharacterTranslator.isDefined('~'));
    }

    @Test
    void testEscapeLevels() {
        assertEquals(0x10, CharacterTranslator.escape(1, 'A'));
        assertEquals(0x57, CharacterTranslator.escape(2, 'A'));
        assertEquals(0xBC, CharacterTranslator.escape(2, '0'));
        assertEquals(CharacterTranslator.UNDEFINED, CharacterTranslator.escape(0, 'A'));
        assertEquals(CharacterTranslator.UNDEFINED, CharacterTranslator.escape(3, 'A'));
        assertEquals(CharacterTranslator.UNDEFINED, CharacterTranslator.escape(1, '('));
        assertEquals(CharacterTranslator.UNDEFINED, CharacterTranslator.escape(1, '['));
    }

    @Test
    void testZeroOnlyThroughValidatedOverpunch() {
        assertEquals(0, CharacterTranslator.overpunch('_', '0'));
        assertEquals(0, CharacterTranslator.escape(1, '0'));
        assertEquals(0xBC, CharacterTranslator.overpunch('=', '0'));
        // no other combination may produce zero
        for (char c = ' '; c < 127; c++) {
            for (char op : CharacterTranslator.OVERPUNCH_CHARS) {
                if (op == CharacterTranslator.VALID_00_OP && c == CharacterTranslator.VALID_00_CHAR) {
                    continue;
                }
                assertNotEquals(0, CharacterTranslator.overpunch(op, c), op + " over " + c);
            }
        }
    }

    @Test
    void testOverpunchMatchesEscape() {
        for (char c = ' '; c < 127; c++) {
            assertEquals(CharacterTranslator.escape(1, c), CharacterTranslator.overpunch('_', c));
            assertEquals(CharacterTranslator.escape(2, c), CharacterTranslator.overpunch('=', c));
        }
        assertEquals(CharacterTranslator.UNDEFINED, CharacterTranslator.overpunch('+', 'A'));
    }

    @Test
    void testTranslateOut() {
        assertEquals(new Escape(0, 'A'), CharacterTranslator.translateOut(0xC1));
        assertEquals(new Escape(1, 'A'), CharacterTranslator.translateOut(0x10));
        assertEquals(new Escape(1, '0'), CharacterTranslator.translateOut(0));
        assertTrue(CharacterTranslator.translateOut(0xC1).isDirect());
        assertNull(CharacterTranslator.translateOut(-1));
        assertNull(CharacterTranslator.translateOut(256));
    }

    @Test
    void testRoundTripOverEveryCode() {
        int escaped = 0;
        for (int code = 0; code < 256; code++) {
            Escape e = CharacterTranslator.translateOut(code);
            if (e == null) {
                continue;
            }
            if (e.isDirect()) {
                assertEquals(code, CharacterTranslator.translateIn(e.base), "direct " + code);
            } else {
                escaped++;
                assertEquals(code, CharacterTranslator.escape(e.level, e.base), "escaped " + code + " as " + e);
            }
        }
        assertTrue(escaped > 100);
    }

    @Test
    void testToExternal() {
        String internal = new String(new char[]{0xC1, 0x10, 0x00, 0x40, 0x57});
        assertEquals("A`A`0 ``A", CharacterTranslator.toExternal(internal));
        assertEquals("HELLO", CharacterTranslator.toExternal(CharacterTranslator.toInternal("HELLO", ' ')));
    }

    @Test
    void testToInternalPlaceholder() {
        String internal = CharacterTranslator.toInternal("A[B", ' ');
        assertEquals(3, internal.length());
        assertEquals(0x40, internal.charAt(1));
        assertEquals("A B", CharacterTranslator.toExternal(internal));
    }

}
