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

import io.halfc.grammar.Grammar;
import io.halfc.grammar.Production;
import io.halfc.grammar.Vocabulary;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;

/**
 * Read-only description of the LALR(1) automaton, shared by any number of
 * parsers.
 * <ul>
 * <li>read: (state, symbol) to successor state, terminals and nonterminals
 * alike, entries of a state sorted by symbol</li>
 * <li>look: (state, terminal) to production, for states that must see the
 * next terminal before reducing</li>
 * <li>apply: state to the productions reducible in it; one production with no
 * look entries means reduce unconditionally</li>
 * </ul>
 * Each of the three is a flattened entries array addressed through an
 * {@link IndexTable}.
 */
public class AutomatonTables {

    public static final int INITIAL_STATE = 0;

    private final Grammar grammar;
    private final int stateCount;

    private final IndexTable readIndex;
    private final int[] read1;
    private final int[] read2;

    private final IndexTable lookIndex;
    private final int[] look1;
    private final int[] look2;

    private final IndexTable applyIndex;
    private final int[] apply1;

    // per production, copied out of the grammar for the reduce path
    private final int[] lhs;
    private final int[] rhsLength;

    public AutomatonTables(Grammar grammar,
                           IndexTable readIndex, int[] read1, int[] read2,
                           IndexTable lookIndex, int[] look1, int[] look2,
                           IndexTable applyIndex, int[] apply1) {
        this.grammar = grammar;
        this.stateCount = readIndex.size();
        this.readIndex = readIndex;
        this.read1 = read1.clone();
        this.read2 = read2.clone();
        this.lookIndex = lookIndex;
        this.look1 = look1.clone();
        this.look2 = look2.clone();
        this.applyIndex = applyIndex;
        this.apply1 = apply1.clone();
        int count = grammar.getProductionCount();
        lhs = new int[count];
        rhsLength = new int[count];
        for (Production p : grammar.getProductions()) {
            lhs[p.number] = p.lhs;
            rhsLength[p.number] = p.length();
        }
        validate();
    }

    public Grammar getGrammar() {
        return grammar;
    }

    public Vocabulary getVocabulary() {
        return grammar.getVocabulary();
    }

    public int getStateCount() {
        return stateCount;
    }

    public int getLhs(int production) {
        return lhs[production];
    }

    public int getRhsLength(int production) {
        return rhsLength[production];
    }

    // ========== Lookups ==========

    /**
     * Successor state on {@code symbol}: a shift for a terminal, the goto
     * after a reduction for a nonterminal.
     */
    public OptionalInt readEntry(int state, int symbol) {
        int offset = readIndex.offset(state);
        int index = Arrays.binarySearch(read1, offset, offset + readIndex.count(state), symbol);
        return index < 0 ? OptionalInt.empty() : OptionalInt.of(read2[index]);
    }

    /**
     * Production chosen by the lookahead table for {@code terminal}.
     */
    public OptionalInt lookEntry(int state, int terminal) {
        int offset = lookIndex.offset(state);
        int index = Arrays.binarySearch(look1, offset, offset + lookIndex.count(state), terminal);
        return index < 0 ? OptionalInt.empty() : OptionalInt.of(look2[index]);
    }

    public int applyCount(int state) {
        return applyIndex.count(state);
    }

    public int applyProduction(int state, int i) {
        if (i < 0 || i >= applyIndex.count(state)) {
            throw new IndexOutOfBoundsException("apply entry " + i + " of state " + state);
        }
        return apply1[applyIndex.offset(state) + i];
    }

    public int lookCount(int state) {
        return lookIndex.count(state);
    }

    /**
     * True when the state reduces by its single apply production without
     * consulting the next terminal.
     */
    public boolean isUnconditional(int state) {
        return applyIndex.count(state) == 1 && lookIndex.count(state) == 0;
    }

    /**
     * Parser decision for the terminal: a read entry shifts, otherwise an
     * unconditional or lookahead-selected reduce, otherwise an error. Reducing
     * by the goal production is acceptance, legal only at end of file.
     */
    public Action decide(int state, int terminal) {
        OptionalInt read = readEntry(state, terminal);
        if (read.isPresent()) {
            return Action.shift(read.getAsInt());
        }
        int production;
        if (isUnconditional(state)) {
            production = applyProduction(state, 0);
        } else {
            OptionalInt look = lookEntry(state, terminal);
            if (look.isEmpty()) {
                return Action.ERROR;
            }
            production = look.getAsInt();
        }
        if (production == Grammar.GOAL_PRODUCTION) {
            return terminal == getVocabulary().endOfFile ? Action.ACCEPT : Action.ERROR;
        }
        return Action.reduce(production);
    }

    /**
     * Number of table entries that claim the pair. Generated tables give
     * exactly one for every pair met in a valid parse.
     */
    public int actionCount(int state, int terminal) {
        int count = 0;
        if (readEntry(state, terminal).isPresent()) {
            count++;
        }
        if (isUnconditional(state)) {
            count++;
        } else if (lookEntry(state, terminal).isPresent()) {
            count++;
        }
        return count;
    }

    /**
     * Terminals the state can act on without error, for diagnostics. Empty
     * for a state that reduces unconditionally.
     */
    public List<Integer> expectedTerminals(int state) {
        Vocabulary vocabulary = getVocabulary();
        List<Integer> list = new ArrayList<>();
        int offset = readIndex.offset(state);
        for (int i = offset; i < offset + readIndex.count(state); i++) {
            if (vocabulary.isTerminal(read1[i])) {
                list.add(read1[i]);
            }
        }
        offset = lookIndex.offset(state);
        for (int i = offset; i < offset + lookIndex.count(state); i++) {
            if (!list.contains(look1[i])) {
                list.add(look1[i]);
            }
        }
        list.sort(null);
        return list;
    }

    // ========== Validation ==========

    private void validate() {
        Vocabulary vocabulary = getVocabulary();
        if (stateCount == 0) {
            throw new TableException("no states");
        }
        if (lookIndex.size() != stateCount || applyIndex.size() != stateCount) {
            throw new TableException("index tables differ in state count");
        }
        if (read1.length != read2.length || look1.length != look2.length) {
            throw new TableException("entry arrays differ in length");
        }
        readIndex.validate("read", read1.length);
        lookIndex.validate("look", look1.length);
        applyIndex.validate("apply", apply1.length);
        int productionCount = grammar.getProductionCount();
        for (int state = 0; state < stateCount; state++) {
            int offset = readIndex.offset(state);
            int previous = 0;
            for (int i = offset; i < offset + readIndex.count(state); i++) {
                if (read1[i] <= previous || read1[i] >= vocabulary.size()) {
                    throw new TableException("read entries of state " + state + " not sorted or out of range");
                }
                if (read2[i] < 0 || read2[i] >= stateCount) {
                    throw new TableException("read target out of range in state " + state + ": " + read2[i]);
                }
                previous = read1[i];
            }
            offset = applyIndex.offset(state);
            for (int i = offset; i < offset + applyIndex.count(state); i++) {
                if (apply1[i] < 0 || apply1[i] >= productionCount) {
                    throw new TableException("apply production out of range in state " + state + ": " + apply1[i]);
                }
            }
            if (applyIndex.count(state) > 1 && lookIndex.count(state) == 0) {
                throw new TableException("state " + state + " has several apply productions but no look entries");
            }
            offset = lookIndex.offset(state);
            previous = 0;
            for (int i = offset; i < offset + lookIndex.count(state); i++) {
                if (look1[i] <= previous || !vocabulary.isTerminal(look1[i])) {
                    throw new TableException("look entries of state " + state + " not sorted or not terminals");
                }
                if (!isApplyProduction(state, look2[i])) {
                    throw new TableException("look entry of state " + state + " names production "
                            + look2[i] + " which is not in its apply set");
                }
                previous = look1[i];
            }
        }
    }

    private boolean isApplyProduction(int state, int production) {
        int offset = applyIndex.offset(state);
        for (int i = offset; i < offset + applyIndex.count(state); i++) {
            if (apply1[i] == production) {
                return true;
            }
        }
        return false;
    }

    /**
     * Count of look entries and unconditional reductions hidden behind a read
     * entry for the same terminal. Zero for generated tables; a supplied table
     * may rely on read priority.
     */
    public int countShadowedEntries() {
        Vocabulary vocabulary = getVocabulary();
        int count = 0;
        for (int state = 0; state < stateCount; state++) {
            int offset = lookIndex.offset(state);
            for (int i = offset; i < offset + lookIndex.count(state); i++) {
                if (readEntry(state, look1[i]).isPresent()) {
                    count++;
                }
            }
            if (isUnconditional(state)) {
                offset = readIndex.offset(state);
                for (int i = offset; i < offset + readIndex.count(state); i++) {
                    if (vocabulary.isTerminal(read1[i])) {
                        count++;
                    }
                }
            }
        }
        return count;
    }

    // ========== Raw access for table files ==========

    IndexTable getReadIndex() {
        return readIndex;
    }

    IndexTable getLookIndex() {
        return lookIndex;
    }

    IndexTable getApplyIndex() {
        return applyIndex;
    }

    int[] getRead1() {
        return read1.clone();
    }

    int[] getRead2() {
        return read2.clone();
    }

    int[] getLook1() {
        return look1.clone();
    }

    int[] getLook2() {
        return look2.clone();
    }

    int[] getApply1() {
        return apply1.clone();
    }

    @Override
    public String toString() {
        return "states: " + stateCount + ", read: " + read1.length + ", look: " + look1.length
                + ", apply: " + apply1.length;
    }

}
