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
 * Provenance of a token that came out of a macro body: which macro, where it
 * was invoked and where it was defined. Nested expansions chain through
 * {@link #parent}, innermost first.
 */
public class Expansion {

    public final String macroName;
    public final Location callSite;
    public final Location definition;
    public final Expansion parent;

    public Expansion(String macroName, Location callSite, Location definition, Expansion parent) {
        this.macroName = macroName;
        this.callSite = callSite;
        this.definition = definition;
        this.parent = parent;
    }

    public int getDepth() {
        int depth = 0;
        Expansion temp = this;
        while (temp != null) {
            depth++;
            temp = temp.parent;
        }
        return depth;
    }

    /**
     * The outermost call site, which is always in physical source text.
     */
    public Location getOriginalCallSite() {
        Expansion temp = this;
        while (temp.parent != null) {
            temp = temp.parent;
        }
        return temp.callSite;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        Expansion temp = this;
        while (temp != null) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append("  in expansion of ").append(temp.macroName)
                    .append(" at ").append(temp.callSite)
                    .append(" (defined at ").append(temp.definition).append(')');
            temp = temp.parent;
        }
        return sb.toString();
    }

}
