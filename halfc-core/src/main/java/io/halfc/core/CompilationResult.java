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
package io.halfc.core;

import io.halfc.common.Diagnostic;
import io.halfc.common.Severity;
import io.halfc.macro.MacroTable;
import io.halfc.parser.ParseOutcome;
import io.halfc.parser.ParseResult;

import java.util.Collections;
import java.util.List;

/**
 * Everything one compilation unit produced: the outcome, the value of the
 * goal reduction, the diagnostics in emission order and the counters.
 */
public class CompilationResult {

    private final String sourceName;
    private final ParseResult parse;
    private final List<Diagnostic> diagnostics;
    private final MacroTable macros;
    private final int linesRead;
    private final int tokensScanned;
    private final int macroExpansions;
    private final int maxMacroDepth;
    private final long durationMillis;

    CompilationResult(String sourceName, ParseResult parse, List<Diagnostic> diagnostics, MacroTable macros,
                      int linesRead, int tokensScanned, int macroExpansions, int maxMacroDepth, long durationMillis) {
        this.sourceName = sourceName;
        this.parse = parse;
        this.diagnostics = Collections.unmodifiableList(diagnostics);
        this.macros = macros;
        this.linesRead = linesRead;
        this.tokensScanned = tokensScanned;
        this.macroExpansions = macroExpansions;
        this.maxMacroDepth = maxMacroDepth;
        this.durationMillis = durationMillis;
    }

    public boolean isAccepted() {
        return parse.isAccepted();
    }

    public boolean isAborted() {
        return parse.isAborted();
    }

    /**
     * Accepted with no error or fatal diagnostic.
     */
    public boolean isSuccess() {
        return isAccepted() && getErrorCount() == 0;
    }

    public ParseOutcome getOutcome() {
        return parse.outcome;
    }

    @SuppressWarnings("unchecked")
    public <T> T getValue() {
        return (T) parse.value;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<Diagnostic> getDiagnostics(Severity severity) {
        return diagnostics.stream().filter(d -> d.severity == severity).toList();
    }

    public int getErrorCount() {
        return (int) diagnostics.stream().filter(d -> d.severity.isError()).count();
    }

    public String getSourceName() {
        return sourceName;
    }

    public ParseResult getParseResult() {
        return parse;
    }

    /**
     * Macros in effect at the end of the unit, with their invocation sites.
     * Null when the compiler was given its own macro store.
     */
    public MacroTable getMacros() {
        return macros;
    }

    public int getLinesRead() {
        return linesRead;
    }

    public int getTokensScanned() {
        return tokensScanned;
    }

    public int getMacroExpansions() {
        return macroExpansions;
    }

    public int getMaxMacroDepth() {
        return maxMacroDepth;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    @Override
    public String toString() {
        return sourceName + ": " + parse.outcome + ", lines: " + linesRead + ", tokens: " + tokensScanned
                + ", diagnostics: " + diagnostics.size();
    }

}
