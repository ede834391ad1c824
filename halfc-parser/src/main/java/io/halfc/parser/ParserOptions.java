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

import java.util.List;

/**
 * Limits and recovery settings of one parser instance.
 */
public class ParserOptions {

    public static final int DEFAULT_ERROR_LIMIT = 100;
    public static final List<String> DEFAULT_SYNC_TERMINALS = List.of(";");

    private int stackSize = ParseStack.DEFAULT_CAPACITY;
    private int errorLimit = DEFAULT_ERROR_LIMIT;
    private List<String> syncTerminals = DEFAULT_SYNC_TERMINALS;
    private int recoverySteps = 1000;

    public ParserOptions stackSize(int value) {
        this.stackSize = value;
        return this;
    }

    public ParserOptions errorLimit(int value) {
        this.errorLimit = value;
        return this;
    }

    public ParserOptions syncTerminals(List<String> value) {
        this.syncTerminals = List.copyOf(value);
        return this;
    }

    /**
     * Bound on the reductions simulated when testing a recovery state.
     */
    public ParserOptions recoverySteps(int value) {
        this.recoverySteps = value;
        return this;
    }

    public int getStackSize() {
        return stackSize;
    }

    public int getErrorLimit() {
        return errorLimit;
    }

    public List<String> getSyncTerminals() {
        return syncTerminals;
    }

    public int getRecoverySteps() {
        return recoverySteps;
    }

}
