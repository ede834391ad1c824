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
package io.halfc.macro;

import io.halfc.common.Expansion;
import io.halfc.scanner.Token;

import java.util.List;

/**
 * One active invocation: the scanned body, a cursor into it and the actual
 * parameters bound to formal positions. A body token that stands for a
 * formal is replaced by the tokens of the bound actual, which keep their own
 * provenance.
 */
class MacroFrame {

    final MacroDefinition definition;
    final MacroBody body;
    final List<List<Token>> actuals;
    final Expansion expansion;

    private int cursor;
    private List<Token> actual;
    private int actualCursor;
    private boolean firstTime = true;

    MacroFrame(MacroDefinition definition, MacroBody body, List<List<Token>> actuals, Expansion expansion) {
        this.definition = definition;
        this.body = body;
        this.actuals = actuals;
        this.expansion = expansion;
    }

    /**
     * True until the first token has been taken.
     */
    boolean isFirstTime() {
        return firstTime;
    }

    Token peek() {
        return advance(false);
    }

    Token next() {
        Token token = advance(true);
        if (token != null) {
            firstTime = false;
        }
        return token;
    }

    private Token advance(boolean consume) {
        while (true) {
            if (actual != null) {
                if (actualCursor < actual.size()) {
                    Token token = actual.get(actualCursor);
                    if (consume) {
                        actualCursor++;
                    }
                    return token;
                }
                actual = null;
                cursor++;
                continue;
            }
            if (cursor >= body.size()) {
                return null;
            }
            int parameter = body.parameters[cursor];
            if (parameter >= 0) {
                actual = parameter < actuals.size() ? actuals.get(parameter) : List.of();
                actualCursor = 0;
                continue;
            }
            Token token = body.tokens.get(cursor).withExpansion(expansion);
            if (consume) {
                cursor++;
            }
            return token;
        }
    }

    @Override
    public String toString() {
        return definition.name + "@" + cursor + "/" + body.size();
    }

}
