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

import io.halfc.common.Location;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Named replacement text with optional formal parameters. Names are matched
 * case-insensitively and stored upper case.
 */
public class MacroDefinition {

    public final String name;
    public final List<String> formals;
    public final String body;
    public final Location location;

    public MacroDefinition(String name, List<String> formals, String body, Location location) {
        this.name = normalize(name);
        List<String> temp = new ArrayList<>(formals.size());
        for (String formal : formals) {
            temp.add(normalize(formal));
        }
        this.formals = Collections.unmodifiableList(temp);
        this.body = body == null ? "" : body;
        this.location = location == null ? Location.UNKNOWN : location;
    }

    public MacroDefinition(String name, String body) {
        this(name, Collections.emptyList(), body, null);
    }

    public static String normalize(String name) {
        return name.toUpperCase(Locale.ROOT);
    }

    public int getParameterCount() {
        return formals.size();
    }

    /**
     * Position of the formal parameter with this name, or -1.
     */
    public int indexOfFormal(String identifier) {
        return formals.indexOf(normalize(identifier));
    }

    @Override
    public String toString() {
        return formals.isEmpty() ? name : name + formals;
    }

}
