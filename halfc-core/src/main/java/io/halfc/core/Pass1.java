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

import io.halfc.common.Diagnostics;
import io.halfc.common.PartitionedFile;
import io.halfc.common.Resource;
import io.halfc.common.SequentialFile;
import io.halfc.grammar.Grammar;
import io.halfc.grammar.GrammarReader;
import io.halfc.macro.MacroExpander;
import io.halfc.macro.MacroStore;
import io.halfc.macro.MacroTable;
import io.halfc.parser.AutomatonTables;
import io.halfc.parser.LalrParser;
import io.halfc.parser.ParseResult;
import io.halfc.parser.SemanticActions;
import io.halfc.parser.TableGenerator;
import io.halfc.parser.TableReader;
import io.halfc.parser.TreeBuilder;
import io.halfc.scanner.Scanner;
import io.halfc.scanner.SourceReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;

/**
 * Compiles units through source reading, scanning, macro expansion and
 * parsing. The tables are built once and shared by every unit; all other
 * state is created per unit, so one instance may compile many units.
 * <pre>
 * Pass1 pass1 = Pass1.builder()
 *         .config(CompilerConfig.load("halfc.json"))
 *         .macro("PI", "3.14159")
 *         .build();
 * CompilationResult result = pass1.compile(Resource.path("src/hal/main.hal"));
 * </pre>
 */
public class Pass1 {

    static final Logger logger = LoggerFactory.getLogger(Pass1.class);

    private final AutomatonTables tables;
    private final CompilerConfig config;
    private final MacroTable predefined;
    private final MacroStore macroStore;
    private final Supplier<SemanticActions> actions;
    private final PartitionedFile library;

    private Pass1(Builder builder, AutomatonTables tables, PartitionedFile library, MacroTable predefined) {
        this.tables = tables;
        this.config = builder.config;
        this.predefined = predefined;
        this.macroStore = builder.macroStore;
        this.library = library;
        if (builder.actions != null) {
            this.actions = builder.actions;
        } else {
            Grammar grammar = tables.getGrammar();
            this.actions = () -> new TreeBuilder(grammar);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public AutomatonTables getTables() {
        return tables;
    }

    public CompilerConfig getConfig() {
        return config;
    }

    public CompilationResult compile(String text) {
        return compile(Resource.text(text));
    }

    public CompilationResult compile(Resource source) {
        long start = System.currentTimeMillis();
        SequentialFile file = new SequentialFile(source);
        String name = file.getName();
        logger.debug("compiling {}", name);
        Diagnostics diagnostics = new Diagnostics();
        MacroTable macros = macroStore == null ? predefined.copy() : null;
        SourceReader reader = new SourceReader(file, library, diagnostics,
                config.getIncludeDepthLimit());
        Scanner scanner = new Scanner(reader, tables.getVocabulary(), diagnostics)
                .identifierLimit(config.getIdentifierLimit())
                .stringLimit(config.getStringLimit());
        MacroExpander expander = new MacroExpander(scanner, macros == null ? macroStore : macros, diagnostics)
                .expansionLimit(config.getMacroExpansionLimit())
                .maxParameters(config.getMaxParameters());
        LalrParser parser = new LalrParser(tables, expander, actions.get(), diagnostics, config.toParserOptions());
        ParseResult parse = parser.parse();
        long duration = System.currentTimeMillis() - start;
        CompilationResult result = new CompilationResult(name, parse, diagnostics.getAll(), macros,
                reader.getLinesRead(), scanner.getTokenCount(), expander.getExpansionCount(),
                expander.getMaxDepth(), duration);
        if (result.isAborted()) {
            logger.warn("{} aborted after {} lines", name, result.getLinesRead());
        } else {
            logger.info("{}: {} lines, {} errors, {} ms", name, result.getLinesRead(), result.getErrorCount(), duration);
        }
        return result;
    }

    public static class Builder {

        private CompilerConfig config = new CompilerConfig();
        private Grammar grammar;
        private AutomatonTables tables;
        private final MacroTable predefined = new MacroTable();
        private MacroStore macroStore;
        private Supplier<SemanticActions> actions;
        private PartitionedFile library;

        public Builder config(CompilerConfig config) {
            this.config = config;
            return this;
        }

        public Builder grammar(Grammar grammar) {
            this.grammar = grammar;
            return this;
        }

        public Builder grammar(Resource resource) {
            return grammar(GrammarReader.read(resource));
        }

        public Builder tables(AutomatonTables tables) {
            this.tables = tables;
            return this;
        }

        public Builder macro(String name, String body) {
            predefined.define(name, body);
            return this;
        }

        public Builder macro(String name, List<String> formals, String body) {
            predefined.define(name, formals, body);
            return this;
        }

        /**
         * Uses the store as is for every unit instead of a fresh table per
         * unit. Predefined macros are then ignored.
         */
        public Builder macros(MacroStore store) {
            this.macroStore = store;
            return this;
        }

        /**
         * Supplies the actions for each unit.
         */
        public Builder semanticActions(Supplier<SemanticActions> actions) {
            this.actions = actions;
            return this;
        }

        public Builder includeLibrary(PartitionedFile library) {
            this.library = library;
            return this;
        }

        public Pass1 build() {
            AutomatonTables resolved = tables;
            if (resolved == null && config.getTables() != null) {
                logger.debug("reading tables from {}", config.getTables());
                resolved = TableReader.read(Resource.path(config.getTables()));
            }
            if (resolved == null) {
                Grammar temp = grammar;
                if (temp == null) {
                    logger.debug("reading grammar from {}", config.getGrammar());
                    temp = GrammarReader.read(Resource.path(config.getGrammar()));
                }
                resolved = TableGenerator.generate(temp);
            }
            PartitionedFile resolvedLibrary = library;
            if (resolvedLibrary == null && config.getIncludeLibrary() != null) {
                resolvedLibrary = PartitionedFile.fromDirectory(Path.of(config.getIncludeLibrary()));
            }
            MacroTable all = new MacroTable();
            for (CompilerConfig.MacroSpec spec : config.getMacros()) {
                all.define(spec.name, spec.formals, spec.body);
            }
            for (String name : predefined.getNames()) {
                predefined.lookup(name).ifPresent(all::define);
            }
            return new Pass1(this, resolved, resolvedLibrary, all);
        }

    }

}
