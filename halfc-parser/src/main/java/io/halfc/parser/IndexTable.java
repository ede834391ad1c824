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

/**
 * Per-state offset and count into one flattened entries array. States with
 * no entries cost one pair of ints instead of a table row.
 */
public class IndexTable {

    private final int[] offsets;
    private final int[] counts;

    public IndexTable(int[] offsets, int[] counts) {
        if (offsets.length != counts.length) {
            throw new TableException("index arrays differ in length: " + offsets.length + " / " + counts.length);
        }
        this.offsets = offsets.clone();
        this.counts = counts.clone();
    }

    /**
     * Lays the states out back to back in state order.
     */
    public static IndexTable fromCounts(int[] counts) {
        int[] offsets = new int[counts.length];
        int total = 0;
        for (int i = 0; i < counts.length; i++) {
            offsets[i] = total;
            total += counts[i];
        }
        return new IndexTable(offsets, counts);
    }

    public int offset(int state) {
        return offsets[state];
    }

    public int count(int state) {
        return counts[state];
    }

    public int size() {
        return offsets.length;
    }

    int[] getOffsets() {
        return offsets.clone();
    }

    int[] getCounts() {
        return counts.clone();
    }

    void validate(String name, int entries) {
        for (int i = 0; i < offsets.length; i++) {
            if (counts[i] < 0 || offsets[i] < 0 || offsets[i] + counts[i] > entries) {
                throw new TableException(name + " index out of range for state " + i
                        + ": offset " + offsets[i] + ", count " + counts[i] + ", entries " + entries);
            }
        }
    }

}
