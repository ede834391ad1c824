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
package io.halfc.core;

import io.halfc.macro.MacroExpander;
import io.halfc.parser.ParseStack;
import io.halfc.parser.ParserOptions;
import io.halfc.scanner.Scanner;
import io.halfc.scanner.SourceReader;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Limits and inputs of a compilation, loaded from {@code halfc.json}. Every
 * field is optional and defaults to the limit of the original compiler.
 * <p>
 * Example halfc.json:
 * <pre>
 * {
 *   "grammar": "classpath:hal-subset.bnf",
 *   "tables": "target/hal-subset.json",
 *   "includeLibrary": "src/hal/include",
 *   "macroExpansionLimit": 8,
 *   "maxParameters": 12,
 *   "parseStackSize": 75,
 *   "identifierLimit": 32,
 *   "stringLimit": 256,
 *   "includeDepthLimit": 1,
 *   "errorLimit": 100,
 *   "synchronizingTokens": [";"],
 *   "macros": {
 *     "PI": "3.14159",
 *     "SQUARE(X)": "X * X"
 *   }
 * }
 * </pre>
 * A {@code tables} file, when given, is used instead of generating tables
 * from the grammar.
 */
public class CompilerConfig {

    public static final String DEFAULT_FILE_NAME = "halfc.json";
    public static final String DEFAULT_GRAMMAR = "classpath:hal-subset.bnf";

    private String grammar = DEFAULT_GRAMMAR;
    private String tables;
    private String includeLibrary;
    private int macroExpansionLimit = MacroExpander.DEFAULT_EXPANSION_LIMIT;
    private int maxParameters = MacroExpander.DEFAULT_MAX_PARAMETERS;
    private int parseStackSize = ParseStack.DEFAULT_CAPACITY;
    private int identifierLimit = Scanner.DEFAULT_IDENTIFIER_LIMIT;
    private int stringLimit = Scanner.DEFAULT_STRING_LIMIT;
    private int includeDepthLimit = SourceReader.DEFAULT_INCLUDE_DEPTH_LIMIT;
    private int errorLimit = ParserOptions.DEFAULT_ERROR_LIMIT;
    private List<String> synchronizingTokens = new ArrayList<>(ParserOptions.DEFAULT_SYNC_TERMINALS);
    private List<MacroSpec> macros = new ArrayList<>();

    /**
     * Macro predefined for every compilation. The key of the json entry is
     * the name, optionally followed by the formals in parentheses.
     */
    public static class MacroSpec {

        public final String name;
        public final List<String> formals;
        public final String body;

        public MacroSpec(String name, List<String> formals, String body) {
            this.name = name;
            this.formals = List.copyOf(formals);
            this.body = body;
        }

        static MacroSpec parse(String key, String body) {
            int pos = key.indexOf('(');
            if (pos == -1) {
                return new MacroSpec(key.trim(), List.of(), body);
            }
            if (!key.endsWith(")")) {
                throw new RuntimeException("Invalid config: malformed macro name: " + key);
            }
            List<String> formals = new ArrayList<>();
            for (String formal : key.substring(pos + 1, key.length() - 1).split(",")) {
                if (!formal.isBlank()) {
                    formals.add(formal.trim());
                }
            }
            return new MacroSpec(key.substring(0, pos).trim(), formals, body);
        }

    }

    public static CompilerConfig load(String configPath) {
        return load(Path.of(configPath));
    }

    /**
     * @throws RuntimeException if the file cannot be read or parsed
     */
    public static CompilerConfig load(Path configPath) {
        try {
            String content = Files.readString(configPath);
            return parse(content);
        } catch (Exception e) {
            throw new RuntimeException("Failed to load config from: " + configPath, e);
        }
    }

    public static CompilerConfig parse(String json) {
        Json j = Json.of(json);
        if (!j.isObject()) {
            throw new RuntimeException("Invalid config: expected JSON object");
        }
        CompilerConfig config = new CompilerConfig();
        try {
            j.<String>getOptional("grammar").ifPresent(config::setGrammar);
            j.<String>getOptional("tables").ifPresent(config::setTables);
            j.<String>getOptional("includeLibrary").ifPresent(config::setIncludeLibrary);
            j.<Integer>getOptional("macroExpansionLimit").ifPresent(config::setMacroExpansionLimit);
            j.<Integer>getOptional("maxParameters").ifPresent(config::setMaxParameters);
            j.<Integer>getOptional("parseStackSize").ifPresent(config::setParseStackSize);
            j.<Integer>getOptional("identifierLimit").ifPresent(config::setIdentifierLimit);
            j.<Integer>getOptional("stringLimit").ifPresent(config::setStringLimit);
            j.<Integer>getOptional("includeDepthLimit").ifPresent(config::setIncludeDepthLimit);
            j.<Integer>getOptional("errorLimit").ifPresent(config::setErrorLimit);
            j.<List<String>>getOptional("synchronizingTokens").ifPresent(config::setSynchronizingTokens);
            j.<Map<String, String>>getOptional("macros").ifPresent(map -> {
                List<MacroSpec> list = new ArrayList<>();
                map.forEach((key, body) -> list.add(MacroSpec.parse(key, body)));
                config.setMacros(list);
            });
        } catch (ClassCastException e) {
            throw new RuntimeException("Invalid config: " + e.getMessage(), e);
        }
        return config;
    }

    public ParserOptions toParserOptions() {
        return new ParserOptions()
                .stackSize(parseStackSize)
                .errorLimit(errorLimit)
                .syncTerminals(synchronizingTokens);
    }

    private static int positive(String name, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
        return value;
    }

    // ========== Getters and Setters ==========

    public String getGrammar() {
        return grammar;
    }

    public void setGrammar(String grammar) {
        this.grammar = grammar;
    }

    public String getTables() {
        return tables;
    }

    public void setTables(String tables) {
        this.tables = tables;
    }

    public String getIncludeLibrary() {
        return includeLibrary;
    }

    public void setIncludeLibrary(String includeLibrary) {
        this.includeLibrary = includeLibrary;
    }

    public int getMacroExpansionLimit() {
        return macroExpansionLimit;
    }

    public void setMacroExpansionLimit(int macroExpansionLimit) {
        this.macroExpansionLimit = positive("macroExpansionLimit", macroExpansionLimit);
    }

    public int getMaxParameters() {
        return maxParameters;
    }

    public void setMaxParameters(int maxParameters) {
        this.maxParameters = positive("maxParameters", maxParameters);
    }

    public int getParseStackSize() {
        return parseStackSize;
    }

    public void setParseStackSize(int parseStackSize) {
        this.parseStackSize = positive("parseStackSize", parseStackSize);
    }

    public int getIdentifierLimit() {
        return identifierLimit;
    }

    public void setIdentifierLimit(int identifierLimit) {
        this.identifierLimit = positive("identifierLimit", identifierLimit);
    }

    public int getStringLimit() {
        return stringLimit;
    }

    public void setStringLimit(int stringLimit) {
        this.stringLimit = positive("stringLimit", stringLimit);
    }

    public int getIncludeDepthLimit() {
        return includeDepthLimit;
    }

    public void setIncludeDepthLimit(int includeDepthLimit) {
        if (includeDepthLimit < 0) {
            throw new IllegalArgumentException("includeDepthLimit must not be negative: " + includeDepthLimit);
        }
        this.includeDepthLimit = includeDepthLimit;
    }

    public int getErrorLimit() {
        return errorLimit;
    }

    public void setErrorLimit(int errorLimit) {
        this.errorLimit = positive("errorLimit", errorLimit);
    }

    public List<String> getSynchronizingTokens() {
        return synchronizingTokens;
    }

    public void setSynchronizingTokens(List<String> synchronizingTokens) {
        this.synchronizingTokens = synchronizingTokens != null ? new ArrayList<>(synchronizingTokens) : new ArrayList<>();
    }

    public List<MacroSpec> getMacros() {
        return macros;
    }

    public void setMacros(List<MacroSpec> macros) {
        this.macros = macros != null ? new ArrayList<>(macros) : new ArrayList<>();
    }

}
