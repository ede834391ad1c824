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

import io.halfc.scanner.Token;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Parse tree node: a token leaf, or the reduction of a production with one
 * child per right-hand-side symbol.
 */
public class Node implements Iterable<Node> {

    public final int symbol;
    public final int production;
    public final Token token;
    private final List<Node> children;
    private Node parent;
    private String cachedText;

    public Node(Token token) {
        this.symbol = token.symbol;
        this.production = -1;
        this.token = token;
        this.children = List.of();
    }

    public Node(int symbol, int production, List<Node> children) {
        this.symbol = symbol;
        this.production = production;
        this.token = null;
        this.children = new ArrayList<>(children);
        for (Node child : children) {
            child.parent = this;
        }
    }

    public boolean isToken() {
        return token != null;
    }

    public Node getParent() {
        return parent;
    }

    public Token getFirstToken() {
        if (isToken()) {
            return token;
        }
        for (Node child : children) {
            Token first = child.getFirstToken();
            if (first != null) {
                return first;
            }
        }
        return null;
    }

    public Node findFirstChild(int symbol) {
        for (Node child : children) {
            if (child.symbol == symbol) {
                return child;
            }
            Node temp = child.findFirstChild(symbol);
            if (temp != null) {
                return temp;
            }
        }
        return null;
    }

    public List<Node> findAll(int symbol) {
        List<Node> results = new ArrayList<>();
        findAll(symbol, results);
        return results;
    }

    private void findAll(int symbol, List<Node> results) {
        for (Node child : children) {
            if (child.symbol == symbol) {
                results.add(child);
            }
            child.findAll(symbol, results);
        }
    }

    /**
     * Token texts of the leaves, blank separated.
     */
    public String getText() {
        if (cachedText != null) {
            return cachedText;
        }
        if (isToken()) {
            cachedText = token.text;
            return cachedText;
        }
        StringBuilder sb = new StringBuilder();
        for (Node child : children) {
            String text = child.getText();
            if (text.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(text);
        }
        cachedText = sb.toString();
        return cachedText;
    }

    public Node get(int index) {
        if (index < 0 || index >= children.size()) {
            throw new IndexOutOfBoundsException(index);
        }
        return children.get(index);
    }

    public int size() {
        return children.size();
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    @Override
    public Iterator<Node> iterator() {
        return children.iterator();
    }

    public Node getFirst() {
        if (children.isEmpty()) {
            throw new NoSuchElementException();
        }
        return children.get(0);
    }

    @Override
    public String toString() {
        return isToken() ? token.text : "[" + production + "] " + getText();
    }

}
