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

import io.halfc.common.Location;

/**
 * Free text without card columns, such as a macro body. Locations are
 * computed relative to where the text starts.
 */
public class TextSource implements CharSource {

    private final String text;
    private final Location start;

    private int pos;
    private int line;
    private int column;

    public TextSource(String text, Location start) {
        this.text = text;
        this.start = start == null ? Location.UNKNOWN : start;
        this.line = this.start.line;
        this.column = Math.max(this.start.column, 1);
    }

    public TextSource(String text) {
        this(text, new Location("", 1, 1));
    }

    @Override
    public int next() {
        if (pos >= text.length()) {
            return EOF;
        }
        char c = text.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    @Override
    public int peek(int ahead) {
        int index = pos + ahead;
        if (index >= text.length()) {
            return ahead == 0 ? EOF : '\n';
        }
        return text.charAt(index);
    }

    @Override
    public Location location() {
        return new Location(start.source, line, column);
    }

}
