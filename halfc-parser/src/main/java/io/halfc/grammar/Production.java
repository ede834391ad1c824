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

import java.util.Arrays;

public class Production {

    public final int number;
    public final int lhs;
    final int[] rhs;

    public Production(int number, int lhs, int[] rhs) {
        this.number = number;
        this.lhs = lhs;
        this.rhs = rhs.clone();
    }

    public int length() {
        return rhs.length;
    }

    public int get(int position) {
        return rhs[position];
    }

    public int[] getRhs() {
        return rhs.clone();
    }

    public boolean isEmpty() {
        return rhs.length == 0;
    }

    @Override
    public String toString() {
        return number + ": " + lhs + " ::= " + Arrays.toString(rhs);
    }

}
