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
 * Decision for one (state, terminal) pair. The value is the target state for
 * a shift and the production number for a reduce.
 */
public class Action {

    public static final Action ERROR = new Action(ActionType.ERROR, -1);
    public static final Action ACCEPT = new Action(ActionType.ACCEPT, 0);

    public final ActionType type;
    public final int value;

    private Action(ActionType type, int value) {
        this.type = type;
        this.value = value;
    }

    public static Action shift(int state) {
        return new Action(ActionType.SHIFT, state);
    }

    public static Action reduce(int production) {
        return new Action(ActionType.REDUCE, production);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Action)) {
            return false;
        }
        Action other = (Action) o;
        return type == other.type && value == other.value;
    }

    @Override
    public int hashCode() {
        return type.hashCode() * 31 + value;
    }

    @Override
    public String toString() {
        return switch (type) {
            case SHIFT -> "shift " + value;
            case REDUCE -> "reduce " + value;
            case ACCEPT -> "accept";
            case ERROR -> "error";
        };
    }

}
