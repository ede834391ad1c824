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
package io.halfc.parser;

/**
 * Outcome and counters of one parse.
 */
public class ParseResult {

    public final ParseOutcome outcome;
    public final Object value;
    public final int reductions;
    public final int tokensShifted;
    public final int maxStackDepth;
    public final int syntaxErrors;
    public final int ambiguousDecisions;

    public ParseResult(ParseOutcome outcome, Object value, int reductions, int tokensShifted,
                       int maxStackDepth, int syntaxErrors, int ambiguousDecisions) {
        this.outcome = outcome;
        this.value = value;
        this.reductions = reductions;
        this.tokensShifted = tokensShifted;
        this.maxStackDepth = maxStackDepth;
        this.syntaxErrors = syntaxErrors;
        this.ambiguousDecisions = ambiguousDecisions;
    }

    public boolean isAccepted() {
        return outcome == ParseOutcome.ACCEPT;
    }

    public boolean isAborted() {
        return outcome == ParseOutcome.ABORT;
    }

    @Override
    public String toString() {
        return outcome + " reductions: " + reductions + ", shifted: " + tokensShifted
                + ", max depth: " + maxStackDepth + ", syntax errors: " + syntaxErrors;
    }

}
