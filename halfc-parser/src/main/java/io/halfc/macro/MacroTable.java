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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory macro store with a cross-reference of invocation sites.
 */
public class MacroTable implements MacroStore {

    private final Map<String, MacroDefinition> definitions = new LinkedHashMap<>();
    private final Map<String, List<Location>> references = new LinkedHashMap<>();

    @Override
    public Optional<MacroDefinition> lookup(String name) {
        return Optional.ofNullable(definitions.get(MacroDefinition.normalize(name)));
    }

    @Override
    public boolean isWritable() {
        return true;
    }

    @Override
    public Optional<MacroDefinition> define(MacroDefinition definition) {
        return Optional.ofNullable(definitions.put(definition.name, definition));
    }

    public MacroTable define(String name, String body) {
        define(new MacroDefinition(name, body));
        return this;
    }

    public MacroTable define(String name, List<String> formals, String body) {
        define(new MacroDefinition(name, formals, body, null));
        return this;
    }

    @Override
    public void recordReference(String name, Location callSite) {
        references.computeIfAbsent(MacroDefinition.normalize(name), k -> new ArrayList<>()).add(callSite);
    }

    /**
     * New table with the same definitions and no references.
     */
    public MacroTable copy() {
        MacroTable table = new MacroTable();
        table.definitions.putAll(definitions);
        return table;
    }

    public List<Location> getReferences(String name) {
        List<Location> list = references.get(MacroDefinition.normalize(name));
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
    }

    public Set<String> getNames() {
        return Collections.unmodifiableSet(definitions.keySet());
    }

    public int size() {
        return definitions.size();
    }

}
