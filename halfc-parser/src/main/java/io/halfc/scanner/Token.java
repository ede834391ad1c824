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

import io.halfc.common.Expansion;
import io.halfc.common.Location;

/**
 * Unit handed from the scanner, through macro expansion, to the parser.
 * {@code symbol} is the vocabulary index; {@code text} is the literal as
 * written; {@code value} holds the internal-code contents of a character
 * string or replace text and is null otherwise.
 */
public class Token {

    public final int symbol;
    public final String text;
    public final String value;
    public final Location location;
    public final Expansion expansion;

    public Token(int symbol, String text, String value, Location location, Expansion expansion) {
        this.symbol = symbol;
        this.text = text;
        this.value = value;
        this.location = location == null ? Location.UNKNOWN : location;
        this.expansion = expansion;
    }

    public Token(int symbol, String text, Location location) {
        this(symbol, text, null, location, null);
    }

    public Token withExpansion(Expansion expansion) {
        return new Token(symbol, text, value, location, expansion);
    }

    public boolean isFromExpansion() {
        return expansion != null;
    }

    public String getPositionDisplay() {
        return location.getPositionDisplay();
    }

    /**
     * Same symbol and text, ignoring where the token came from.
     */
    public boolean sameAs(Token other) {
        return other != null && symbol == other.symbol && text.equals(other.text);
    }

    @Override
    public String toString() {
        return text.isEmpty() ? "#" + symbol : text;
    }

}
