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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Collects diagnostics for one compilation unit and cascades each one to the
 * "halfc.diagnostic" SLF4J category as it arrives.
 */
public class Diagnostics implements DiagnosticSink {

    public static final Logger DIAGNOSTIC_LOGGER = LoggerFactory.getLogger("halfc.diagnostic");

    private final List<Diagnostic> list = new ArrayList<>();
    private final Map<Severity, Integer> counts = new EnumMap<>(Severity.class);

    @Override
    public void report(Diagnostic diagnostic) {
        list.add(diagnostic);
        counts.merge(diagnostic.severity, 1, Integer::sum);
        switch (diagnostic.severity) {
            case INFO -> DIAGNOSTIC_LOGGER.debug("{}", diagnostic);
            case WARNING -> DIAGNOSTIC_LOGGER.warn("{}", diagnostic);
            default -> DIAGNOSTIC_LOGGER.error("{}", diagnostic);
        }
    }

    public List<Diagnostic> getAll() {
        return Collections.unmodifiableList(list);
    }

    public List<Diagnostic> get(Severity severity) {
        List<Diagnostic> result = new ArrayList<>();
        for (Diagnostic d : list) {
            if (d.severity == severity) {
                result.add(d);
            }
        }
        return result;
    }

    public int count(Severity severity) {
        return counts.getOrDefault(severity, 0);
    }

    public int getErrorCount() {
        return count(Severity.ERROR) + count(Severity.FATAL);
    }

    public boolean hasFatal() {
        return count(Severity.FATAL) > 0;
    }

    public boolean isEmpty() {
        return list.isEmpty();
    }

    public int size() {
        return list.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic d : list) {
            sb.append(d).append('\n');
        }
        return sb.toString();
    }

}
