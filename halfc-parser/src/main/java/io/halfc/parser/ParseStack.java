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
import java.util.Arrays;
import java.util.List;

/**
 * Parallel state and value stacks of fixed capacity.
 */
public class ParseStack {

    public static final int DEFAULT_CAPACITY = 75;

    private final int[] states;
    private final Object[] values;
    private int size;
    private int maxSize;

    public ParseStack(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("stack capacity must be positive: " + capacity);
        }
        states = new int[capacity];
        values = new Object[capacity];
    }

    public ParseStack() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param token the lookahead, for the location of an overflow
     */
    public void push(int state, Object value, Token token) {
        if (size == states.length) {
            throw new ParseStackOverflowException(states.length,
                    token == null ? null : token.location, token == null ? null : token.expansion);
        }
        states[size] = state;
        values[size] = value;
        size++;
        if (size > maxSize) {
            maxSize = size;
        }
    }

    public int topState() {
        return states[size - 1];
    }

    public Object topValue() {
        return values[size - 1];
    }

    public int state(int depth) {
        return states[depth];
    }

    /**
     * Removes the top {@code count} entries and returns their values bottom
     * first.
     */
    public List<Object> pop(int count) {
        if (count > size - 1) {
            throw new IllegalStateException("cannot pop " + count + " of " + size + " entries");
        }
        List<Object> list = new ArrayList<>(count);
        for (int i = size - count; i < size; i++) {
            list.add(values[i]);
            values[i] = null;
        }
        size -= count;
        return list;
    }

    public void truncate(int newSize) {
        Arrays.fill(values, newSize, size, null);
        size = newSize;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return states.length;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public int[] copyStates() {
        return Arrays.copyOf(states, size);
    }

    @Override
    public String toString() {
        return Arrays.toString(copyStates());
    }

}
