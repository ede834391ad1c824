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
package io.halfc.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Vocabulary plus numbered productions. Production 0 is always the augmented
 * goal {@code $GOAL ::= <start>}; reducing by it accepts the input.
 */
public class Grammar {

    public static final String GOAL = "$GOAL";
    public static final int GOAL_PRODUCTION = 0;

    private final Vocabulary vocabulary;
    private final List<Production> productions;
    private final int startSymbol;
    private final int goalSymbol;
    // production numbers grouped by left-hand side, indexed by symbol
    private final List<List<Integer>> byLhs;

    public Grammar(Vocabulary vocabulary, List<Production> productions) {
        this.vocabulary = vocabulary;
        this.productions = Collections.unmodifiableList(new ArrayList<>(productions));
        if (productions.isEmpty()) {
            throw new GrammarException("grammar has no productions");
        }
        Production goal = productions.get(GOAL_PRODUCTION);
        if (goal.length() != 1 || !GOAL.equals(vocabulary.getName(goal.lhs))) {
            throw new GrammarException("production 0 must be " + GOAL + " ::= <start>");
        }
        goalSymbol = goal.lhs;
        startSymbol = goal.get(0);
        byLhs = new ArrayList<>(vocabulary.size());
        for (int i = 0; i < vocabulary.size(); i++) {
            byLhs.add(new ArrayList<>());
        }
        for (int i = 0; i < productions.size(); i++) {
            Production p = productions.get(i);
            if (p.number != i) {
                throw new GrammarException("production out of sequence: " + p.number + " at " + i);
            }
            if (!vocabulary.isNonterminal(p.lhs)) {
                throw new GrammarException("left-hand side is not a nonterminal: " + vocabulary.getName(p.lhs));
            }
            for (int symbol : p.rhs) {
                if (symbol <= 0 || symbol >= vocabulary.size() || symbol == goalSymbol) {
                    throw new GrammarException("invalid symbol " + symbol + " in production " + i);
                }
            }
            byLhs.get(p.lhs).add(i);
        }
        for (int i = vocabulary.getTerminalCount() + 1; i < vocabulary.size(); i++) {
            if (byLhs.get(i).isEmpty()) {
                throw new GrammarException("nonterminal has no productions: " + vocabulary.getName(i));
            }
        }
    }

    public Vocabulary getVocabulary() {
        return vocabulary;
    }

    public List<Production> getProductions() {
        return productions;
    }

    public Production getProduction(int number) {
        return productions.get(number);
    }

    public int getProductionCount() {
        return productions.size();
    }

    public List<Integer> getProductionsFor(int lhs) {
        return Collections.unmodifiableList(byLhs.get(lhs));
    }

    public int getStartSymbol() {
        return startSymbol;
    }

    public int getGoalSymbol() {
        return goalSymbol;
    }

    public String getName(int symbol) {
        return vocabulary.getName(symbol);
    }

    public String toString(int production) {
        Production p = productions.get(production);
        StringBuilder sb = new StringBuilder();
        sb.append(vocabulary.getName(p.lhs)).append(" ::=");
        for (int symbol : p.rhs) {
            sb.append(' ').append(vocabulary.getName(symbol));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return vocabulary + ", productions: " + productions.size();
    }

}
