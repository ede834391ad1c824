package io.halfc.scanner;

import io.halfc.TestUtils;
import io.halfc.common.Diagnostic;
import io.halfc.common.Diagnostics;
import io.halfc.common.Location;
import io.halfc.common.PartitionedFile;
import io.halfc.common.Resource;
import io.halfc.common.SequentialFile;
import io.halfc.common.Severity;
import io.halfc.grammar.Vocabulary;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SourceReaderTest {

    final Vocabulary vocabulary = TestUtils.halVocabulary();
    final Diagnostics diagnostics = new Diagnostics();

    private SourceReader reader(String text, PartitionedFile library, int depthLimit) {
        SequentialFile file = new SequentialFile(Resource.text(text, "main.hal"));
        return new SourceReader(file, library, diagnostics, depthLimit);
    }

    private List<Token> tokens(SourceReader reader) {
        return TestUtils.drain(new Scanner(reader, vocabulary, diagnostics), vocabulary);
    }

    private static String read(SourceReader reader) {
        StringBuilder sb = new StringBuilder();
        int c;
        while ((c = reader.next()) != CharSource.EOF) {
            sb.append((char) c);
        }
        return sb.toString();
    }

    @Test
    void testCardTypes() {
        SourceReader reader = reader("""
                 X = 1;
                C this is a comment
                MY = 2;
                m Z = 3;
                """, null, 1);
        assertEquals("X = 1;\nY = 2;\n Z = 3;\n", read(reader));
        assertEquals(4, reader.getLinesRead());
        assertTrue(diagnostics.isEmpty());
        assertEquals(CharSource.EOF, reader.peek());
    }

    @Test
    void testLocationsSkipCardColumn() {
        SourceReader reader = reader("""
                 A = B;
                C
                   C = D;
                """, null, 1);
        List<Token> tokens = tokens(reader);
        assertEquals("A = B ; C = D ;", TestUtils.texts(tokens));
        assertEquals(new Location("main.hal", 1, 2), tokens.get(0).location);
        assertEquals(new Location("main.hal", 1, 4), tokens.get(1).location);
        assertEquals(new Location("main.hal", 3, 4), tokens.get(4).location);
    }

    @Test
    void testUnsupportedAndUnknownCards() {
        SourceReader reader = reader("""
                E  2
                S  I
                X Y = 1;
                """, null, 1);
        assertEquals(" Y = 1;\n", read(reader));
        List<Diagnostic> errors = diagnostics.get(Severity.ERROR);
        assertEquals(3, errors.size());
        assertEquals("multi-line format not supported, E card skipped", errors.get(0).message);
        assertEquals("unknown card type 'X', read as M", errors.get(2).message);
        assertEquals(new Location("main.hal", 3, 1), errors.get(2).location);
    }

    @Test
    void testEmptyLineIsBlank() {
        SourceReader reader = reader(" A\n\n B", null, 1);
        assertEquals("A B", TestUtils.texts(tokens(reader)));
    }

    // ========== Include ==========

    @Test
    void testIncludeMember() {
        PartitionedFile library = PartitionedFile.of("LIB", Map.of("consts", " DECLARE K INTEGER;\n"));
        SourceReader reader = reader("""
                 X = 1;
                D INCLUDE CONSTS
                 Y = 2;
                """, library, 1);
        List<Token> tokens = tokens(reader);
        assertEquals("X = 1 ; DECLARE K INTEGER ; Y = 2 ;", TestUtils.texts(tokens));
        assertEquals(new Location("LIB(CONSTS)", 1, 2), tokens.get(4).location);
        assertEquals(new Location("main.hal", 3, 2), tokens.get(8).location);
        assertTrue(diagnostics.isEmpty());
        assertEquals(0, reader.getIncludeDepth());
        assertEquals(4, reader.getLinesRead());
    }

    @Test
    void testIncludeErrors() {
        PartitionedFile library = PartitionedFile.of("LIB", Map.of(
                "OUTER", "D INCLUDE INNER\n A = 1;",
                "INNER", " B = 2;"));
        SourceReader reader = reader("""
                D INCLUDE OUTER
                D INCLUDE MISSING
                D INCLUDE
                D OPTION LIST
                 C = 3;
                """, library, 1);
        assertEquals("A = 1 ; C = 3 ;", TestUtils.texts(tokens(reader)));
        List<String> errors = diagnostics.get(Severity.ERROR).stream().map(d -> d.message).toList();
        assertEquals(List.of(
                "include nesting exceeds 1, INNER not included",
                "member not found in include library: MISSING",
                "INCLUDE without a member name"), errors);
        assertEquals(1, diagnostics.count(Severity.INFO));
    }

    @Test
    void testNestedIncludeWithinLimit() {
        PartitionedFile library = PartitionedFile.of("LIB", Map.of(
                "OUTER", "D INCLUDE INNER\n A = 1;",
                "INNER", " B = 2;"));
        SourceReader reader = reader("D INCLUDE OUTER\n C = 3;", library, 2);
        assertEquals("B = 2 ; A = 1 ; C = 3 ;", TestUtils.texts(tokens(reader)));
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void testIncludeWithoutLibrary() {
        SourceReader reader = reader("D INCLUDE CONSTS\n A = 1;", null, 1);
        assertEquals("A = 1 ;", TestUtils.texts(tokens(reader)));
        assertEquals("no include library, cannot include CONSTS", diagnostics.getAll().get(0).message);
    }

}
