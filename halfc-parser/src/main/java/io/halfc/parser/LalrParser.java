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

import io.halfc.common.CompilationAbortedException;
import io.halfc.common.DiagnosticSink;
import io.halfc.common.Severity;
import io.halfc.grammar.Vocabulary;
import io.halfc.scanner.Token;
import io.halfc.scanner.TokenSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;

/**
 * Table-driven shift-reduce parser. One instance parses one compilation unit;
 * the tables may be shared.
 * <p>
 * On a syntax error the parser reports the expected terminals, skips input to
 * the next synchronizing terminal, and pops the stack to the deepest state
 * from which that terminal would be shifted. The test runs the automaton on a
 * copy of the state stack with no semantic actions. If end of file is reached
 * with no such state the unit is abandoned. An error met before any token
 * past the synchronizing one has been shifted is not reported again.
 */
public class LalrParser {

    static final Logger logger = LoggerFactory.getLogger(LalrParser.class);

    private static final int MAX_EXPECTED_SHOWN = 12;

    private final AutomatonTables tables;
    private final Vocabulary vocabulary;
    private final TokenSource source;
    private final SemanticActions actions;
    private final DiagnosticSink sink;
    private final ParserOptions options;
    private final ParseStack stack;
    private final int[] syncTerminals;

    private Token lookahead;
    // the synchronizing token shifted on resumption does not count
    private int shiftsSinceRecovery = Integer.MAX_VALUE;
    private Object value;

    private int reductions;
    private int tokensShifted;
    private int syntaxErrors;
    private int ambiguousDecisions;

    public LalrParser(AutomatonTables tables, TokenSource source, SemanticActions actions,
                      DiagnosticSink sink, ParserOptions options) {
        this.tables = tables;
        this.vocabulary = tables.getVocabulary();
        this.source = source;
        this.actions = actions == null ? SemanticActions.NONE : actions;
        this.sink = sink;
        this.options = options;
        this.stack = new ParseStack(options.getStackSize());
        this.syncTerminals = resolveSyncTerminals(options.getSyncTerminals());
        stack.push(AutomatonTables.INITIAL_STATE, null, null);
    }

    public LalrParser(AutomatonTables tables, TokenSource source, SemanticActions actions, DiagnosticSink sink) {
        this(tables, source, actions, sink, new ParserOptions());
    }

    private int[] resolveSyncTerminals(List<String> names) {
        List<Integer> list = new ArrayList<>();
        for (String name : names) {
            int index = vocabulary.getIndex(name);
            if (index == Vocabulary.NONE || !vocabulary.isTerminal(index)) {
                logger.warn("synchronizing terminal not in vocabulary: {}", name);
            } else {
                list.add(index);
            }
        }
        list.add(vocabulary.endOfFile);
        return list.stream().mapToInt(Integer::intValue).distinct().sorted().toArray();
    }

    /**
     * Runs to acceptance or abandonment. A fatal condition raised anywhere
     * below, including by the token source, is reported and ends the parse.
     */
    public ParseResult parse() {
        ParseOutcome outcome;
        try {
            do {
                outcome = step();
            } while (outcome == ParseOutcome.CONTINUE || outcome == ParseOutcome.RESYNCHRONIZE);
        } catch (CompilationAbortedException e) {
            logger.debug("parse aborted: {}", e.getMessage());
            sink.report(e.toDiagnostic());
            outcome = ParseOutcome.ABORT;
        }
        return new ParseResult(outcome, value, reductions, tokensShifted, stack.getMaxSize(),
                syntaxErrors, ambiguousDecisions);
    }

    /**
     * One shift, one reduction, acceptance or one error recovery.
     */
    public ParseOutcome step() {
        Token token = lookahead();
        int state = stack.topState();
        if (tables.actionCount(state, token.symbol) > 1) {
            ambiguousDecisions++;
        }
        Action action = tables.decide(state, token.symbol);
        switch (action.type) {
            case SHIFT:
                if (logger.isTraceEnabled()) {
                    logger.trace("shift {} to state {}", token, action.value);
                }
                stack.push(action.value, token, token);
                lookahead = null;
                tokensShifted++;
                if (shiftsSinceRecovery < Integer.MAX_VALUE) {
                    shiftsSinceRecovery++;
                }
                return ParseOutcome.CONTINUE;
            case REDUCE:
                reduce(action.value, token);
                return ParseOutcome.CONTINUE;
            case ACCEPT:
                value = stack.topValue();
                logger.debug("accepted after {} reductions", reductions);
                return ParseOutcome.ACCEPT;
            default:
                return recover(token);
        }
    }

    private Token lookahead() {
        if (lookahead == null) {
            lookahead = source.nextToken();
        }
        return lookahead;
    }

    private void reduce(int production, Token token) {
        List<Object> values = stack.pop(tables.getRhsLength(production));
        Object result = actions.onReduce(production, values);
        reductions++;
        int lhs = tables.getLhs(production);
        OptionalInt target = tables.readEntry(stack.topState(), lhs);
        if (target.isEmpty()) {
            throw new TableException("no goto for " + vocabulary.getName(lhs) + " in state " + stack.topState());
        }
        if (logger.isTraceEnabled()) {
            logger.trace("reduce {}", tables.getGrammar().toString(production));
        }
        stack.push(target.getAsInt(), result, token);
    }

    // ========== Error recovery ==========

    private ParseOutcome recover(Token token) {
        int state = stack.topState();
        if (shiftsSinceRecovery > 1) {
            syntaxErrors++;
            sink.report(Severity.ERROR, token.location, "syntax error at " + describe(token)
                    + ", expected " + expected(state), token.expansion);
            if (syntaxErrors >= options.getErrorLimit()) {
                throw new CompilationAbortedException("syntax error limit of " + options.getErrorLimit()
                        + " reached", token.location, token.expansion);
            }
        } else {
            logger.debug("syntax error at {} in state {} not reported, nothing shifted since the last recovery",
                    token.getPositionDisplay(), state);
        }
        shiftsSinceRecovery = 0;
        int skipped = 0;
        while (true) {
            if (isSync(token.symbol)) {
                for (int depth = stack.size(); depth >= 1; depth--) {
                    if (canResume(depth, token.symbol)) {
                        logger.debug("resuming at {} in state {}, skipped {} tokens, popped {} states",
                                token.getPositionDisplay(), stack.state(depth - 1), skipped, stack.size() - depth);
                        stack.truncate(depth);
                        lookahead = token;
                        return ParseOutcome.RESYNCHRONIZE;
                    }
                }
                if (token.symbol == vocabulary.endOfFile) {
                    throw new CompilationAbortedException("no recovery point found before end of file",
                            token.location, token.expansion);
                }
            }
            skipped++;
            token = source.nextToken();
            lookahead = token;
        }
    }

    private boolean isSync(int symbol) {
        return Arrays.binarySearch(syncTerminals, symbol) >= 0;
    }

    /**
     * True if the prefix of the state stack of the given depth shifts the
     * terminal, or accepts at end of file, after zero or more reductions.
     */
    boolean canResume(int depth, int terminal) {
        int[] states = Arrays.copyOf(stack.copyStates(), stack.capacity() + 1);
        int size = depth;
        for (int steps = 0; steps < options.getRecoverySteps(); steps++) {
            Action action = tables.decide(states[size - 1], terminal);
            switch (action.type) {
                case SHIFT:
                case ACCEPT:
                    return true;
                case REDUCE:
                    int length = tables.getRhsLength(action.value);
                    if (length >= size) {
                        return false;
                    }
                    size -= length;
                    OptionalInt target = tables.readEntry(states[size - 1], tables.getLhs(action.value));
                    if (target.isEmpty() || size == states.length) {
                        return false;
                    }
                    states[size++] = target.getAsInt();
                    break;
                default:
                    return false;
            }
        }
        return false;
    }

    private String describe(Token token) {
        if (token.symbol == vocabulary.endOfFile) {
            return "end of file";
        }
        return "'" + token.text + "'";
    }

    private String expected(int state) {
        List<Integer> terminals = tables.expectedTerminals(state);
        if (terminals.isEmpty()) {
            return vocabulary.getName(vocabulary.endOfFile);
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < terminals.size() && i < MAX_EXPECTED_SHOWN; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(vocabulary.getName(terminals.get(i)));
        }
        if (terminals.size() > MAX_EXPECTED_SHOWN) {
            sb.append(", ...");
        }
        return sb.toString();
    }

    // ========== State ==========

    public int getStackDepth() {
        return stack.size();
    }

    public int getReductions() {
        return reductions;
    }

    public int getSyntaxErrors() {
        return syntaxErrors;
    }

    public Object getValue() {
        return value;
    }

}
