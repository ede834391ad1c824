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

import io.halfc.common.DiagnosticSink;
import io.halfc.common.LineReader;
import io.halfc.common.Location;
import io.halfc.common.PartitionedFile;
import io.halfc.common.SequentialFile;
import io.halfc.common.Severity;
import io.halfc.common.SourceLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;

/**
 * Reads source records in card format. Column 1 holds the card type and the
 * text starts in column 2:
 * <ul>
 * <li>blank or {@code M}: main line text</li>
 * <li>{@code C}: comment, skipped</li>
 * <li>{@code D}: compiler directive; {@code D INCLUDE name} reads the named
 * member of the include library in place of the card</li>
 * <li>{@code E} and {@code S}: exponent and subscript lines of the
 * multi-line format, reported and skipped</li>
 * </ul>
 * An unknown card type is reported and the card is read as main text.
 */
public class SourceReader implements CharSource {

    static final Logger logger = LoggerFactory.getLogger(SourceReader.class);

    public static final int DEFAULT_INCLUDE_DEPTH_LIMIT = 1;

    private static final String INCLUDE = "INCLUDE";

    private final DiagnosticSink sink;
    private final PartitionedFile library;
    private final int includeDepthLimit;
    private final Deque<LineReader> readers = new ArrayDeque<>();

    private SourceLine line;
    private String buffer;
    private int pos;
    private boolean eof;
    private int linesRead;

    public SourceReader(LineReader primary, PartitionedFile library, DiagnosticSink sink, int includeDepthLimit) {
        this.sink = sink;
        this.library = library;
        this.includeDepthLimit = includeDepthLimit;
        readers.push(primary);
    }

    public SourceReader(SequentialFile primary, DiagnosticSink sink) {
        this(primary, null, sink, DEFAULT_INCLUDE_DEPTH_LIMIT);
    }

    public int getLinesRead() {
        return linesRead;
    }

    public int getIncludeDepth() {
        return readers.size() - 1;
    }

    @Override
    public int next() {
        if (!fill()) {
            return EOF;
        }
        return buffer.charAt(pos++);
    }

    @Override
    public int peek(int ahead) {
        if (!fill()) {
            return EOF;
        }
        int index = pos + ahead;
        return index < buffer.length() ? buffer.charAt(index) : '\n';
    }

    @Override
    public Location location() {
        if (!fill()) {
            return line == null ? Location.UNKNOWN : line.getLocation(buffer == null ? 1 : buffer.length() + 1);
        }
        // the card type occupies column 1
        return line.getLocation(pos + 2);
    }

    private boolean fill() {
        while (!eof && (buffer == null || pos >= buffer.length())) {
            SourceLine next = readers.peek().readLine();
            if (next.isEndOfMember() && readers.size() > 1) {
                LineReader finished = readers.pop();
                logger.debug("end of member {}", finished.getName());
                continue;
            }
            if (next.isSentinel()) {
                eof = true;
                return false;
            }
            linesRead++;
            line = next;
            pos = 0;
            buffer = card(next);
        }
        return !eof;
    }

    /**
     * Text of the card from column 2 with its line end, or null when the card
     * contributes no text.
     */
    private String card(SourceLine next) {
        String text = next.text;
        if (text.isEmpty()) {
            return "\n";
        }
        char type = Character.toUpperCase(text.charAt(0));
        String rest = text.substring(1);
        switch (type) {
            case ' ':
            case 'M':
                return rest + "\n";
            case 'C':
                return null;
            case 'D':
                directive(rest.trim(), next);
                return null;
            case 'E':
            case 'S':
                sink.report(Severity.ERROR, next.getLocation(1),
                        "multi-line format not supported, " + type + " card skipped");
                return null;
            default:
                sink.report(Severity.ERROR, next.getLocation(1),
                        "unknown card type '" + text.charAt(0) + "', read as M");
                return rest + "\n";
        }
    }

    private void directive(String text, SourceLine card) {
        String[] parts = text.split("\\s+");
        if (parts.length == 0 || parts[0].isEmpty()) {
            sink.report(Severity.WARNING, card.getLocation(1), "empty directive ignored");
            return;
        }
        String keyword = parts[0].toUpperCase(Locale.ROOT);
        if (!INCLUDE.equals(keyword)) {
            sink.report(Severity.INFO, card.getLocation(2), "directive ignored: " + keyword);
            return;
        }
        if (parts.length < 2) {
            sink.report(Severity.ERROR, card.getLocation(2), "INCLUDE without a member name");
            return;
        }
        String member = parts[1];
        if (library == null) {
            sink.report(Severity.ERROR, card.getLocation(2), "no include library, cannot include " + member);
            return;
        }
        if (getIncludeDepth() >= includeDepthLimit) {
            sink.report(Severity.ERROR, card.getLocation(2),
                    "include nesting exceeds " + includeDepthLimit + ", " + member + " not included");
            return;
        }
        if (!library.hasMember(member)) {
            sink.report(Severity.ERROR, card.getLocation(2), "member not found in include library: " + member);
            return;
        }
        logger.debug("including member {} from {}", member, library.getName());
        readers.push(library.openMember(member));
    }

}
