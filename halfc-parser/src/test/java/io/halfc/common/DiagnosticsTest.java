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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticsTest {

    @Test
    void testOrderAndCounts() {
        Diagnostics diagnostics = new Diagnostics();
        Location location = new Location("main.hal", 3, 7);
        diagnostics.report(Severity.WARNING, location, "first");
        diagnostics.report(Severity.ERROR, location, "second");
        diagnostics.report(Severity.INFO, location, "third");
        assertEquals(3, diagnostics.size());
        assertEquals("first", diagnostics.getAll().get(0).message);
        assertEquals("third", diagnostics.getAll().get(2).message);
        assertEquals(1, diagnostics.getErrorCount());
        assertEquals(1, diagnostics.count(Severity.WARNING));
        assertFalse(diagnostics.hasFatal());
        diagnostics.report(new CompilationAbortedException("stop", location).toDiagnostic());
        assertTrue(diagnostics.hasFatal());
        assertEquals(2, diagnostics.getErrorCount());
    }

    @Test
    void testExpansionChainInMessage() {
        Location call = new Location("main.hal", 5, 2);
        Location outerCall = new Location("main.hal", 9, 4);
        Expansion outer = new Expansion("OUTER", outerCall, Location.UNKNOWN, null);
        Expansion inner = new Expansion("INNER", call, new Location("main.hal", 1, 20), outer);
        assertEquals(2, inner.getDepth());
        assertEquals(outerCall, inner.getOriginalCallSite());
        Diagnostic diagnostic = new Diagnostic(Severity.ERROR, call, "bad", inner);
        String text = diagnostic.toString();
        assertTrue(text.startsWith("[ERROR] main.hal:5:2 bad"));
        assertTrue(text.contains("in expansion of INNER at main.hal:5:2 (defined at main.hal:1:20)"));
        assertTrue(text.contains("in expansion of OUTER at main.hal:9:4 (defined at ?)"));
    }

}
