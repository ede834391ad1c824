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
 * Fatal condition that ends the compilation unit. Thrown from wherever it is
 * detected and caught only by the unit driver, which records it as a
 * {@link Severity#FATAL} diagnostic.
 */
public class CompilationAbortedException extends RuntimeException {

    private final Location location;
    private final Expansion expansion;

    public CompilationAbortedException(String message, Location location, Expansion expansion) {
        super(message);
        this.location = location == null ? Location.UNKNOWN : location;
        this.expansion = expansion;
    }

    public CompilationAbortedException(String message, Location location) {
        this(message, location, null);
    }

    public Location getLocation() {
        return location;
    }

    public Expansion getExpansion() {
        return expansion;
    }

    public Diagnostic toDiagnostic() {
        return new Diagnostic(Severity.FATAL, location, getMessage(), expansion);
    }

}
