package io.halfc.core;

import io.halfc.parser.ParserOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompilerConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        CompilerConfig config = new CompilerConfig();
        assertEquals(CompilerConfig.DEFAULT_GRAMMAR, config.getGrammar());
        assertNull(config.getTables());
        assertNull(config.getIncludeLibrary());
        assertEquals(8, config.getMacroExpansionLimit());
        assertEquals(12, config.getMaxParameters());
        assertEquals(75, config.getParseStackSize());
        assertEquals(32, config.getIdentifierLimit());
        assertEquals(256, config.getStringLimit());
        assertEquals(1, config.getIncludeDepthLimit());
        assertEquals(100, config.getErrorLimit());
        assertEquals(List.of(";"), config.getSynchronizingTokens());
        assertTrue(config.getMacros().isEmpty());
    }

    @Test
    void testParse() {
        String json = """
                {
                  "grammar": "grammars/full.bnf",
                  "includeLibrary": "src/hal/include",
                  "macroExpansionLimit": 4,
                  "parseStackSize": 200,
                  "identifierLimit": 16,
                  "errorLimit": 10,
                  "synchronizingTokens": [";", "END"],
                  "macros": {
                    "PI": "3.14159",
                    "SQUARE( X )": "X * X",
                    "SUM(A, B)": "A + B"
                  }
                }
                """;
        CompilerConfig config = CompilerConfig.parse(json);
        assertEquals("grammars/full.bnf", config.getGrammar());
        assertEquals("src/hal/include", config.getIncludeLibrary());
        assertEquals(4, config.getMacroExpansionLimit());
        assertEquals(12, config.getMaxParameters());
        assertEquals(200, config.getParseStackSize());
        assertEquals(16, config.getIdentifierLimit());
        assertEquals(256, config.getStringLimit());
        assertEquals(10, config.getErrorLimit());
        assertEquals(List.of(";", "END"), config.getSynchronizingTokens());
        List<CompilerConfig.MacroSpec> macros = config.getMacros();
        assertEquals(3, macros.size());
        assertEquals("PI", macros.get(0).name);
        assertTrue(macros.get(0).formals.isEmpty());
        assertEquals("3.14159", macros.get(0).body);
        assertEquals("SQUARE", macros.get(1).name);
        assertEquals(List.of("X"), macros.get(1).formals);
        assertEquals(List.of("A", "B"), macros.get(2).formals);
        ParserOptions options = config.toParserOptions();
        assertEquals(200, options.getStackSize());
        assertEquals(10, options.getErrorLimit());
        assertEquals(List.of(";", "END"), options.getSyncTerminals());
    }

    @Test
    void testLoadFromFile() throws Exception {
        Path path = tempDir.resolve(CompilerConfig.DEFAULT_FILE_NAME);
        Files.writeString(path, "{ \"tables\": \"target/tables.json\", \"stringLimit\": 80 }");
        CompilerConfig config = CompilerConfig.load(path.toString());
        assertEquals("target/tables.json", config.getTables());
        assertEquals(80, config.getStringLimit());
    }

    @Test
    void testLoadMissingFile() {
        Path path = tempDir.resolve("missing.json");
        RuntimeException e = assertThrows(RuntimeException.class, () -> CompilerConfig.load(path));
        assertTrue(e.getMessage().startsWith("Failed to load config from: "));
    }

    @Test
    void testInvalidConfig() {
        assertThrows(RuntimeException.class, () -> CompilerConfig.parse("[1, 2]"));
        assertThrows(RuntimeException.class, () -> CompilerConfig.parse("{ \"errorLimit\": \"many\" }"));
        assertThrows(RuntimeException.class, () -> CompilerConfig.parse("{ \"macros\": { \"F(X\": \"X\" } }"));
        assertThrows(IllegalArgumentException.class, () -> CompilerConfig.parse("{ \"parseStackSize\": 0 }"));
        assertThrows(IllegalArgumentException.class, () -> new CompilerConfig().setIncludeDepthLimit(-1));
        CompilerConfig config = CompilerConfig.parse("{ \"includeDepthLimit\": 0 }");
        assertEquals(0, config.getIncludeDepthLimit());
    }

}
