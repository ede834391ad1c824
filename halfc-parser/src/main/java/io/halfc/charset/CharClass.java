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

/**
 * Scanner classification of external characters.
 */
public enum CharClass {

    BLANK,
    LETTER,
    DIGIT,
    SPECIAL,
    QUOTE,
    DOUBLE_QUOTE,
    ESCAPE,
    ILLEGAL;

    private static final CharClass[] TABLE = new CharClass[128];

    static {
        for (int i = 0; i < TABLE.length; i++) {
            char c = (char) i;
            if (c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f') {
                TABLE[i] = BLANK;
            } else if ((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z')) {
                TABLE[i] = LETTER;
            } else if (c >= '0' && c <= '9') {
                TABLE[i] = DIGIT;
            } else if (c == '\'') {
                TABLE[i] = QUOTE;
            } else if (c == '"') {
                TABLE[i] = DOUBLE_QUOTE;
            } else if (c == CharacterTranslator.ESCAPE_CHAR) {
                TABLE[i] = ESCAPE;
            } else if (CharacterTranslator.isDefined(c)) {
                TABLE[i] = SPECIAL;
            } else {
                TABLE[i] = ILLEGAL;
            }
        }
    }

    public static CharClass of(int c) {
        if (c < 0 || c >= TABLE.length) {
            return ILLEGAL;
        }
        return TABLE[c];
    }

    /**
     * Letters, digits and the break character may continue an identifier.
     */
    public static boolean isIdentifierPart(int c) {
        CharClass cc = of(c);
        return cc == LETTER || cc == DIGIT || c == '_';
    }

}
