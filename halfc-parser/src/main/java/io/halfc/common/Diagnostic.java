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

public class Diagnostic {

    public final Severity severity;
    public final Location location;
    public final String message;
    public final Expansion expansion;

    public Diagnostic(Severity severity, Location location, String message, Expansion expansion) {
        this.severity = severity;
        this.location = location == null ? Location.UNKNOWN : location;
        this.message = message;
        this.expansion = expansion;
    }

    public Diagnostic(Severity severity, Location location, String message) {
        this(severity, location, message, null);
    }

    public boolean isFromExpansion() {
        return expansion != null;
    }

    @Override
    public String toString() {
        String text = "[" + severity + "] " + location + " " + message;
        return expansion == null ? text : text + "\n" + expansion;
    }

}
