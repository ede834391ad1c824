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

import java.util.Objects;

/**
 * Position in a source resource. Line and column are 1-based; a column of 0
 * means the whole line.
 */
public class Location {

    public static final Location UNKNOWN = new Location("", 0, 0);

    public final String source;
    public final int line;
    public final int column;

    public Location(String source, int line, int column) {
        this.source = source == null ? "" : source;
        this.line = line;
        this.column = column;
    }

    public Location withColumn(int column) {
        return new Location(source, line, column);
    }

    public String getPositionDisplay() {
        return line + ":" + column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Location)) {
            return false;
        }
        Location other = (Location) o;
        return line == other.line && column == other.column && source.equals(other.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, line, column);
    }

    @Override
    public String toString() {
        if (this == UNKNOWN) {
            return "?";
        }
        return source.isEmpty() ? getPositionDisplay() : source + ":" + getPositionDisplay();
    }

}
