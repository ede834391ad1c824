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
package io.halfc.macro;

import io.halfc.common.Diagnostic;
import io.halfc.common.DiagnosticSink;
import io.halfc.common.Expansion;
import io.halfc.common.Location;
import io.halfc.common.Severity;
import io.halfc.grammar.Vocabulary;
import io.halfc.scanner.Scanner;
import io.halfc.scanner.TextSource;
import io.halfc.scanner.Token;
import io.halfc.scanner.TokenSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sits between the scanner and the parser and replaces macro invocations by
 * their bodies.
 * <p>
 * Tokens come from the top expansion frame, or from the scanner when no
 * frame is active. An identifier naming a macro starts an invocation: the
 * parenthesized actual parameters are collected from the tokens that follow
 * and a frame is pushed. A frame is popped when the next token is wanted and
 * its body is used up, so a macro that invokes itself keeps nesting until
 * the depth limit stops the compilation.
 * <p>
 * {@code REPLACE name [(formals)] BY "text"} passes through to the parser
 * unchanged and also defines the macro in a writable store. The name and the
 * formals of such a statement are never expanded.
 */
public class MacroExpander implements TokenSource {

    static final Logger logger = LoggerFactory.getLogger(MacroExpander.class);

    public static final int DEFAULT_EXPANSION_LIMIT = 8;
    public static final int DEFAULT_MAX_PARAMETERS = 12;

    private static final String REPLACE = "REPLACE";
    private static final String BY = "BY";

    private enum Capture {
        NONE, NAME, AFTER_NAME, FORMALS, AFTER_FORMALS, TEXT
    }

    private final Scanner scanner;
    private final Vocabulary vocabulary;
    private final MacroStore store;
    private final DiagnosticSink sink;
    private final Deque<MacroFrame> frames = new ArrayDeque<>();
    private final Map<MacroDefinition, MacroBody> bodies = new IdentityHashMap<>();

    private int expansionLimit = DEFAULT_EXPANSION_LIMIT;
    private int maxParameters = DEFAULT_MAX_PARAMETERS;
    private boolean expansionEnabled = true;

    // one token read ahead from the scanner
    private Token scannerPeek;

    private Capture capture = Capture.NONE;
    private Token captureName;
    private final List<String> captureFormals = new ArrayList<>();

    private int expansionCount;
    private int maxDepth;

    public MacroExpander(Scanner scanner, MacroStore store, DiagnosticSink sink) {
        this.scanner = scanner;
        this.vocabulary = scanner.getVocabulary();
        this.store = store;
        this.sink = sink;
    }

    public MacroExpander expansionLimit(int value) {
        this.expansionLimit = value;
        return this;
    }

    public MacroExpander maxParameters(int value) {
        this.maxParameters = value;
        return this;
    }

    public void setExpansionEnabled(boolean value) {
        this.expansionEnabled = value;
    }

    public boolean isExpansionEnabled() {
        return expansionEnabled;
    }

    public int getDepth() {
        return frames.size();
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getExpansionCount() {
        return expansionCount;
    }

    @Override
    public Token nextToken() {
        while (true) {
            Token token = rawNext();
            if (isExpandable(token)) {
                Optional<MacroDefinition> definition = store.lookup(token.text);
                if (definition.isPresent()) {
                    invoke(definition.get(), token);
                    continue;
                }
            }
            track(token);
            return token;
        }
    }

    private boolean isExpandable(Token token) {
        return expansionEnabled
                && token.symbol == vocabulary.identifier
                && capture != Capture.NAME
                && capture != Capture.FORMALS;
    }

    // ========== Token sources ==========

    /**
     * Next token from the active source, popping used-up frames first.
     */
    private Token rawNext() {
        while (!frames.isEmpty()) {
            MacroFrame frame = frames.peek();
            boolean first = frame.isFirstTime();
            Token token = frame.next();
            if (token != null) {
                if (first) {
                    logger.trace("first token of {} at depth {}", frame.definition.name, frames.size());
                }
                return token;
            }
            frames.pop();
        }
        if (scannerPeek != null) {
            Token token = scannerPeek;
            scannerPeek = null;
            return token;
        }
        return scanner.nextToken();
    }

    /**
     * The token {@link #rawNext()} would return, without consuming it.
     */
    private Token rawPeek() {
        for (MacroFrame frame : frames) {
            Token token = frame.peek();
            if (token != null) {
                return token;
            }
        }
        if (scannerPeek == null) {
            scannerPeek = scanner.nextToken();
        }
        return scannerPeek;
    }

    // ========== Invocation ==========

    private void invoke(MacroDefinition definition, Token nameToken) {
        Location callSite = nameToken.location;
        List<List<Token>> actuals = definition.getParameterCount() == 0
                ? Collections.emptyList()
                : collectActuals(definition, nameToken);
        if (frames.size() >= expansionLimit) {
            throw new MacroExpansionException("macro expansion depth exceeds " + expansionLimit
                    + " expanding " + definition.name, callSite, nameToken.expansion);
        }
        store.recordReference(definition.name, callSite);
        Expansion expansion = new Expansion(definition.name, callSite, definition.location, nameToken.expansion);
        MacroBody body = body(definition);
        for (Diagnostic diagnostic : body.diagnostics) {
            sink.report(diagnostic.severity, diagnostic.location, diagnostic.message, expansion);
        }
        frames.push(new MacroFrame(definition, body, actuals, expansion));
        expansionCount++;
        maxDepth = Math.max(maxDepth, frames.size());
        logger.debug("expanding {} at {}, depth {}", definition, callSite, frames.size());
    }

    private List<List<Token>> collectActuals(MacroDefinition definition, Token nameToken) {
        int expected = definition.getParameterCount();
        List<List<Token>> actuals = new ArrayList<>();
        if (!isSpecial(rawPeek(), "(")) {
            sink.report(Severity.ERROR, nameToken.location, "missing argument list for macro " + definition.name
                    + ", " + expected + " empty arguments assumed", nameToken.expansion);
        } else {
            rawNext();
            List<Token> current = new ArrayList<>();
            int depth = 1;
            while (true) {
                Token token = rawNext();
                if (token.symbol == vocabulary.endOfFile) {
                    throw new MacroExpansionException("end of file while collecting arguments of macro "
                            + definition.name, nameToken.location, nameToken.expansion);
                }
                if (isSpecial(token, "(")) {
                    depth++;
                } else if (isSpecial(token, ")")) {
                    depth--;
                    if (depth == 0) {
                        actuals.add(current);
                        break;
                    }
                } else if (depth == 1 && isSpecial(token, ",")) {
                    actuals.add(current);
                    current = new ArrayList<>();
                    continue;
                }
                current.add(token);
            }
        }
        if (actuals.size() > maxParameters) {
            sink.report(Severity.ERROR, nameToken.location, "more than " + maxParameters
                    + " arguments for macro " + definition.name, nameToken.expansion);
        }
        if (!actuals.isEmpty() && actuals.size() != expected) {
            String message = "macro " + definition.name + " expects " + expected + " arguments, got " + actuals.size();
            sink.report(Severity.ERROR, nameToken.location, actuals.size() < expected
                    ? message + ", missing arguments are empty"
                    : message + ", extra arguments ignored", nameToken.expansion);
        }
        while (actuals.size() > expected) {
            actuals.remove(actuals.size() - 1);
        }
        while (actuals.size() < expected) {
            actuals.add(Collections.emptyList());
        }
        return actuals;
    }

    private static boolean isSpecial(Token token, String text) {
        return token.value == null && token.text.equals(text);
    }

    /**
     * Scans the body text once per definition.
     */
    private MacroBody body(MacroDefinition definition) {
        MacroBody body = bodies.get(definition);
        if (body != null) {
            return body;
        }
        List<Diagnostic> diagnostics = new ArrayList<>();
        Scanner bodyScanner = new Scanner(new TextSource(definition.body, definition.location), vocabulary,
                diagnostics::add);
        List<Token> tokens = new ArrayList<>();
        while (true) {
            Token token = bodyScanner.nextToken();
            if (token.symbol == vocabulary.endOfFile) {
                break;
            }
            tokens.add(token);
        }
        int[] parameters = new int[tokens.size()];
        Iterator<Token> iterator = tokens.iterator();
        for (int i = 0; iterator.hasNext(); i++) {
            Token token = iterator.next();
            parameters[i] = token.symbol == vocabulary.identifier ? definition.indexOfFormal(token.text) : -1;
        }
        body = new MacroBody(tokens, parameters, diagnostics);
        bodies.put(definition, body);
        return body;
    }

    // ========== REPLACE capture ==========

    private void track(Token token) {
        switch (capture) {
            case NONE:
                if (isReserved(token, REPLACE)) {
                    capture = Capture.NAME;
                }
                break;
            case NAME:
                if (token.symbol == vocabulary.identifier) {
                    captureName = token;
                    captureFormals.clear();
                    capture = Capture.AFTER_NAME;
                } else {
                    capture = Capture.NONE;
                }
                break;
            case AFTER_NAME:
                if (isSpecial(token, "(")) {
                    capture = Capture.FORMALS;
                } else {
                    capture = isReserved(token, BY) ? Capture.TEXT : Capture.NONE;
                }
                break;
            case FORMALS:
                if (token.symbol == vocabulary.identifier) {
                    captureFormals.add(token.text);
                } else if (isSpecial(token, ")")) {
                    capture = Capture.AFTER_FORMALS;
                } else if (!isSpecial(token, ",")) {
                    capture = Capture.NONE;
                }
                break;
            case AFTER_FORMALS:
                capture = isReserved(token, BY) ? Capture.TEXT : Capture.NONE;
                break;
            case TEXT:
                if (token.symbol == vocabulary.text && token.value != null) {
                    define(token);
                }
                capture = Capture.NONE;
                break;
        }
    }

    private boolean isReserved(Token token, String word) {
        int symbol = vocabulary.lookupReserved(word);
        return symbol != Vocabulary.NONE && token.symbol == symbol;
    }

    private void define(Token textToken) {
        List<String> formals = new ArrayList<>(captureFormals);
        if (formals.size() > maxParameters) {
            sink.report(Severity.ERROR, captureName.location, "macro " + captureName.text + " has more than "
                    + maxParameters + " parameters, the rest are ignored");
            formals = new ArrayList<>(formals.subList(0, maxParameters));
        }
        if (!store.isWritable()) {
            sink.report(Severity.WARNING, captureName.location,
                    "macro store is read-only, definition of " + captureName.text + " ignored");
            return;
        }
        MacroDefinition definition = new MacroDefinition(captureName.text, formals, textToken.value,
                textToken.location.withColumn(textToken.location.column + 1));
        store.define(definition).ifPresent(previous -> sink.report(Severity.WARNING, captureName.location,
                "macro " + definition.name + " redefined, previous definition at " + previous.location));
        logger.debug("defined macro {} at {}", definition, definition.location);
    }

}
