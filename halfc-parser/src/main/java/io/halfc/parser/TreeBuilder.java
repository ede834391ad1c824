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
import io.halfc.scanner.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link Node} tree, one node per reduction.
 */
public class TreeBuilder implements SemanticActions {

    private final Grammar grammar;

    public TreeBuilder(Grammar grammar) {
        this.grammar = grammar;
    }

    @Override
    public Object onReduce(int production, List<Object> values) {
        List<Node> children = new ArrayList<>(values.size());
        for (Object value : values) {
            if (value instanceof Node) {
                children.add((Node) value);
            } else if (value instanceof Token) {
                children.add(new Node((Token) value));
            }
        }
        return new Node(grammar.getProduction(production).lhs, production, children);
    }

}
