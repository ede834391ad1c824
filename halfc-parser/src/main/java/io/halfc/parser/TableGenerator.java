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
import io.halfc.grammar.GrammarException;
import io.halfc.grammar.Production;
import io.halfc.grammar.Vocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds LALR(1) tables for a grammar: the LR(0) collection first, then
 * lookaheads found spontaneously or propagated between kernel items.
 * <p>
 * A state becomes one of three kinds. With no complete items it only reads.
 * With exactly one complete item and no terminal to shift it reduces
 * unconditionally. Otherwise every lookahead terminal gets a look entry.
 * Shift-reduce conflicts are resolved in favour of the shift and
 * reduce-reduce conflicts in favour of the lower production number; both are
 * logged and counted.
 */
public class TableGenerator {

    static final Logger logger = LoggerFactory.getLogger(TableGenerator.class);

    private final Grammar grammar;
    private final Vocabulary vocabulary;
    private final int terminalCount;
    // stands for "propagate from the source item" while computing closures
    private final int dummy;

    // LR(0) items are numbered consecutively: itemBase[p] + dot
    private final int[] itemBase;
    private final int[] itemProduction;
    private final int[] itemDot;

    private final boolean[] nullable;
    private final BitSet[] first;

    private final List<int[]> kernels = new ArrayList<>();
    private final List<TreeMap<Integer, Integer>> transitions = new ArrayList<>();
    private int[] kernelBase;

    private boolean failOnConflict;
    private int shiftReduceConflicts;
    private int reduceReduceConflicts;

    public TableGenerator(Grammar grammar) {
        this.grammar = grammar;
        this.vocabulary = grammar.getVocabulary();
        this.terminalCount = vocabulary.getTerminalCount();
        this.dummy = terminalCount + 1;
        int productionCount = grammar.getProductionCount();
        itemBase = new int[productionCount];
        int total = 0;
        for (int p = 0; p < productionCount; p++) {
            itemBase[p] = total;
            total += grammar.getProduction(p).length() + 1;
        }
        itemProduction = new int[total];
        itemDot = new int[total];
        for (int p = 0; p < productionCount; p++) {
            for (int dot = 0; dot <= grammar.getProduction(p).length(); dot++) {
                itemProduction[itemBase[p] + dot] = p;
                itemDot[itemBase[p] + dot] = dot;
            }
        }
        nullable = new boolean[vocabulary.size()];
        first = new BitSet[vocabulary.size()];
        computeFirstSets();
    }

    /**
     * Throw a {@link GrammarException} on the first conflict instead of
     * resolving it.
     */
    public TableGenerator failOnConflict(boolean value) {
        this.failOnConflict = value;
        return this;
    }

    public int getShiftReduceConflicts() {
        return shiftReduceConflicts;
    }

    public int getReduceReduceConflicts() {
        return reduceReduceConflicts;
    }

    public static AutomatonTables generate(Grammar grammar) {
        return new TableGenerator(grammar).generate();
    }

    // ========== First sets ==========

    private void computeFirstSets() {
        for (int i = 0; i < first.length; i++) {
            first[i] = new BitSet(dummy + 1);
            if (vocabulary.isTerminal(i)) {
                first[i].set(i);
            }
        }
        boolean change;
        do {
            change = false;
            for (Production p : grammar.getProductions()) {
                BitSet target = first[p.lhs];
                int before = target.cardinality();
                boolean allNullable = true;
                for (int i = 0; i < p.length(); i++) {
                    int symbol = p.get(i);
                    target.or(first[symbol]);
                    if (!nullable[symbol]) {
                        allNullable = false;
                        break;
                    }
                }
                if (allNullable && !nullable[p.lhs]) {
                    nullable[p.lhs] = true;
                    change = true;
                }
                if (target.cardinality() != before) {
                    change = true;
                }
            }
        } while (change);
    }

    /**
     * FIRST of the symbols after position {@code from} of the production,
     * with {@code follow} added when they can all derive the empty string.
     */
    private BitSet firstOfRest(Production p, int from, BitSet follow) {
        BitSet result = new BitSet(dummy + 1);
        for (int i = from; i < p.length(); i++) {
            int symbol = p.get(i);
            result.or(first[symbol]);
            if (!nullable[symbol]) {
                return result;
            }
        }
        result.or(follow);
        return result;
    }

    // ========== LR(0) collection ==========

    private BitSet closure0(int[] kernel) {
        BitSet items = new BitSet(itemProduction.length);
        Deque<Integer> pending = new ArrayDeque<>();
        for (int item : kernel) {
            items.set(item);
            pending.push(item);
        }
        BitSet expanded = new BitSet(vocabulary.size());
        while (!pending.isEmpty()) {
            int item = pending.pop();
            int symbol = nextSymbol(item);
            if (symbol > 0 && vocabulary.isNonterminal(symbol) && !expanded.get(symbol)) {
                expanded.set(symbol);
                for (int p : grammar.getProductionsFor(symbol)) {
                    int added = itemBase[p];
                    if (!items.get(added)) {
                        items.set(added);
                        pending.push(added);
                    }
                }
            }
        }
        return items;
    }

    private int nextSymbol(int item) {
        Production p = grammar.getProduction(itemProduction[item]);
        int dot = itemDot[item];
        return dot < p.length() ? p.get(dot) : 0;
    }

    private void buildStates() {
        Map<String, Integer> stateIds = new HashMap<>();
        int[] start = {itemBase[Grammar.GOAL_PRODUCTION]};
        kernels.add(start);
        stateIds.put(Arrays.toString(start), 0);
        for (int state = 0; state < kernels.size(); state++) {
            BitSet items = closure0(kernels.get(state));
            // successor kernels keyed by symbol, items added in ascending order
            Map<Integer, List<Integer>> successors = new TreeMap<>();
            for (int item = items.nextSetBit(0); item >= 0; item = items.nextSetBit(item + 1)) {
                int symbol = nextSymbol(item);
                if (symbol > 0) {
                    successors.computeIfAbsent(symbol, k -> new ArrayList<>()).add(item + 1);
                }
            }
            TreeMap<Integer, Integer> edges = new TreeMap<>();
            for (Map.Entry<Integer, List<Integer>> entry : successors.entrySet()) {
                int[] kernel = entry.getValue().stream().mapToInt(Integer::intValue).toArray();
                String key = Arrays.toString(kernel);
                Integer target = stateIds.get(key);
                if (target == null) {
                    target = kernels.size();
                    kernels.add(kernel);
                    stateIds.put(key, target);
                }
                edges.put(entry.getKey(), target);
            }
            transitions.add(edges);
        }
        kernelBase = new int[kernels.size() + 1];
        for (int i = 0; i < kernels.size(); i++) {
            kernelBase[i + 1] = kernelBase[i] + kernels.get(i).length;
        }
        logger.debug("LR(0) states: {}, kernel items: {}", kernels.size(), kernelBase[kernels.size()]);
    }

    private int kernelId(int state, int item) {
        int position = Arrays.binarySearch(kernels.get(state), item);
        if (position < 0) {
            throw new IllegalStateException("item " + item + " is not in the kernel of state " + state);
        }
        return kernelBase[state] + position;
    }

    // ========== Lookaheads ==========

    /**
     * LR(1) closure of items already carrying lookahead sets.
     */
    private Map<Integer, BitSet> closure1(Map<Integer, BitSet> start) {
        Map<Integer, BitSet> result = new LinkedHashMap<>();
        Deque<Integer> pending = new ArrayDeque<>();
        start.forEach((item, lookahead) -> {
            result.put(item, (BitSet) lookahead.clone());
            pending.add(item);
        });
        while (!pending.isEmpty()) {
            int item = pending.poll();
            int symbol = nextSymbol(item);
            if (symbol == 0 || !vocabulary.isNonterminal(symbol)) {
                continue;
            }
            Production p = grammar.getProduction(itemProduction[item]);
            BitSet lookahead = firstOfRest(p, itemDot[item] + 1, result.get(item));
            for (int number : grammar.getProductionsFor(symbol)) {
                int added = itemBase[number];
                BitSet existing = result.get(added);
                if (existing == null) {
                    result.put(added, (BitSet) lookahead.clone());
                    pending.add(added);
                } else {
                    BitSet missing = (BitSet) lookahead.clone();
                    missing.andNot(existing);
                    if (!missing.isEmpty()) {
                        existing.or(missing);
                        pending.add(added);
                    }
                }
            }
        }
        return result;
    }

    private BitSet[] computeLookaheads() {
        int kernelCount = kernelBase[kernels.size()];
        BitSet[] lookaheads = new BitSet[kernelCount];
        List<List<Integer>> propagation = new ArrayList<>(kernelCount);
        for (int i = 0; i < kernelCount; i++) {
            lookaheads[i] = new BitSet(dummy + 1);
            propagation.add(new ArrayList<>());
        }
        lookaheads[0].set(vocabulary.endOfFile);
        BitSet probe = new BitSet(dummy + 1);
        probe.set(dummy);
        for (int state = 0; state < kernels.size(); state++) {
            for (int kernelItem : kernels.get(state)) {
                int source = kernelId(state, kernelItem);
                Map<Integer, BitSet> closure = closure1(Map.of(kernelItem, probe));
                for (Map.Entry<Integer, BitSet> entry : closure.entrySet()) {
                    int item = entry.getKey();
                    int symbol = nextSymbol(item);
                    if (symbol == 0) {
                        continue;
                    }
                    int target = kernelId(transitions.get(state).get(symbol), item + 1);
                    BitSet lookahead = entry.getValue();
                    for (int t = lookahead.nextSetBit(0); t >= 0; t = lookahead.nextSetBit(t + 1)) {
                        if (t == dummy) {
                            if (!propagation.get(source).contains(target)) {
                                propagation.get(source).add(target);
                            }
                        } else {
                            lookaheads[target].set(t);
                        }
                    }
                }
            }
        }
        boolean change;
        int passes = 0;
        do {
            change = false;
            passes++;
            for (int source = 0; source < kernelCount; source++) {
                for (int target : propagation.get(source)) {
                    BitSet missing = (BitSet) lookaheads[source].clone();
                    missing.andNot(lookaheads[target]);
                    if (!missing.isEmpty()) {
                        lookaheads[target].or(missing);
                        change = true;
                    }
                }
            }
        } while (change);
        logger.debug("lookahead propagation converged after {} passes", passes);
        return lookaheads;
    }

    // ========== Tables ==========

    public AutomatonTables generate() {
        buildStates();
        BitSet[] lookaheads = computeLookaheads();
        int stateCount = kernels.size();
        int[] readCounts = new int[stateCount];
        int[] lookCounts = new int[stateCount];
        int[] applyCounts = new int[stateCount];
        List<Integer> read1 = new ArrayList<>();
        List<Integer> read2 = new ArrayList<>();
        List<Integer> look1 = new ArrayList<>();
        List<Integer> look2 = new ArrayList<>();
        List<Integer> apply1 = new ArrayList<>();
        for (int state = 0; state < stateCount; state++) {
            TreeMap<Integer, Integer> edges = transitions.get(state);
            edges.forEach((symbol, target) -> {
                read1.add(symbol);
                read2.add(target);
            });
            readCounts[state] = edges.size();
            TreeMap<Integer, BitSet> reductions = reductions(state, lookaheads);
            if (reductions.isEmpty()) {
                continue;
            }
            boolean shifts = edges.keySet().stream().anyMatch(vocabulary::isTerminal);
            TreeMap<Integer, Integer> owners = resolve(state, edges, reductions);
            if (reductions.size() == 1 && !shifts) {
                apply1.add(reductions.firstKey());
                applyCounts[state] = 1;
                continue;
            }
            for (int production : reductions.keySet()) {
                apply1.add(production);
            }
            applyCounts[state] = reductions.size();
            owners.forEach((terminal, production) -> {
                look1.add(terminal);
                look2.add(production);
            });
            lookCounts[state] = owners.size();
        }
        AutomatonTables tables = new AutomatonTables(grammar,
                IndexTable.fromCounts(readCounts), toArray(read1), toArray(read2),
                IndexTable.fromCounts(lookCounts), toArray(look1), toArray(look2),
                IndexTable.fromCounts(applyCounts), toArray(apply1));
        logger.debug("generated {}, shift-reduce conflicts: {}, reduce-reduce conflicts: {}",
                tables, shiftReduceConflicts, reduceReduceConflicts);
        return tables;
    }

    /**
     * Complete items of the state with their lookahead sets, keyed by
     * production number.
     */
    private TreeMap<Integer, BitSet> reductions(int state, BitSet[] lookaheads) {
        Map<Integer, BitSet> kernel = new LinkedHashMap<>();
        for (int item : kernels.get(state)) {
            kernel.put(item, lookaheads[kernelId(state, item)]);
        }
        TreeMap<Integer, BitSet> result = new TreeMap<>();
        closure1(kernel).forEach((item, lookahead) -> {
            if (nextSymbol(item) == 0) {
                result.put(itemProduction[item], lookahead);
            }
        });
        return result;
    }

    /**
     * Removes conflicting terminals from the lookahead sets and returns the
     * terminal to production map that remains. Productions left with no
     * lookahead are dropped from the reductions.
     */
    private TreeMap<Integer, Integer> resolve(int state, TreeMap<Integer, Integer> edges, TreeMap<Integer, BitSet> reductions) {
        TreeMap<Integer, Integer> owners = new TreeMap<>();
        List<Integer> dropped = new ArrayList<>();
        for (Map.Entry<Integer, BitSet> entry : reductions.entrySet()) {
            int production = entry.getKey();
            BitSet lookahead = entry.getValue();
            for (int t = lookahead.nextSetBit(0); t >= 0; t = lookahead.nextSetBit(t + 1)) {
                if (edges.containsKey(t)) {
                    conflict("shift-reduce conflict, state " + state + ", terminal " + vocabulary.getName(t)
                            + ", production " + grammar.toString(production) + ": choosing to shift");
                    shiftReduceConflicts++;
                    lookahead.clear(t);
                } else if (owners.containsKey(t)) {
                    conflict("reduce-reduce conflict, state " + state + ", terminal " + vocabulary.getName(t)
                            + ": choosing " + grammar.toString(owners.get(t)) + " over " + grammar.toString(production));
                    reduceReduceConflicts++;
                    lookahead.clear(t);
                } else {
                    owners.put(t, production);
                }
            }
            if (lookahead.isEmpty()) {
                dropped.add(production);
            }
        }
        for (int production : dropped) {
            logger.warn("state {}: production never reduced: {}", state, grammar.toString(production));
            reductions.remove(production);
        }
        return owners;
    }

    private void conflict(String message) {
        if (failOnConflict) {
            throw new GrammarException(message);
        }
        logger.warn(message);
    }

    private static int[] toArray(List<Integer> list) {
        int[] result = new int[list.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = list.get(i);
        }
        return result;
    }

}
