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
package io.halfc.common;

/**
 * One physical record read from a sequential file or a partitioned member.
 * The two sentinels are compared by identity.
 */
public class SourceLine {

    /**
     * Character that never occurs in printable source text.
     */
    public static final char EOF_CHAR = 'þ';

    public static final SourceLine END_OF_FILE = new SourceLine(String.valueOf(EOF_CHAR), "", 0);
    public static final SourceLine END_OF_MEMBER = new SourceLine("", "", 0);

    public final String text;
    public final String source;
    public final int lineNumber;

    public SourceLine(String text, String source, int lineNumber) {
        this.text = text;
        this.source = source;
        this.lineNumber = lineNumber;
    }

    public boolean isEndOfFile() {
        return this == END_OF_FILE;
    }

    public boolean isEndOfMember() {
        return this == END_OF_MEMBER;
    }

    public boolean isSentinel() {
        return this == END_OF_FILE || this == END_OF_MEMBER;
    }

    public Location getLocation(int column) {
        return new Location(source, lineNumber, column);
    }

    @Override
    public String toString() {
        if (this == END_OF_FILE) {
            return "<EOF>";
        }
        if (this == END_OF_MEMBER) {
            return "<EOM>";
        }
        return source + ":" + lineNumber + " " + text;
    }

}
