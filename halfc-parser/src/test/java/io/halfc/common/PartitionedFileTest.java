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
package io.halfc.common;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PartitionedFileTest {

    @TempDir
    Path tempDir;

    @Test
    void testSequentialFileEndsWithEndOfFile() {
        SequentialFile file = new SequentialFile(Resource.text("one\ntwo\n"));
        SourceLine first = file.readLine();
        assertEquals("one", first.text);
        assertEquals(1, first.lineNumber);
        assertEquals("(memory)", first.source);
        assertEquals("two", file.readLine().text);
        assertSame(SourceLine.END_OF_FILE, file.readLine());
        assertSame(SourceLine.END_OF_FILE, file.readLine());
    }

    @Test
    void testMemberEndsWithEndOfMember() {
        PartitionedFile library = PartitionedFile.of("LIB", Map.of("defs", " X = 1;"));
        assertTrue(library.hasMember("DEFS"));
        assertTrue(library.hasMember("defs"));
        LineReader reader = library.openMember("Defs");
        assertEquals("DEFS", reader.getName());
        assertEquals(" X = 1;", reader.readLine().text);
        SourceLine end = reader.readLine();
        assertTrue(end.isEndOfMember());
        assertFalse(end.isEndOfFile());
        assertEquals("", end.text);
    }

    @Test
    void testSentinelsAreDistinct() {
        assertNotSame(SourceLine.END_OF_FILE, SourceLine.END_OF_MEMBER);
        assertEquals(String.valueOf(SourceLine.EOF_CHAR), SourceLine.END_OF_FILE.text);
        assertTrue(SourceLine.END_OF_FILE.isSentinel());
        assertTrue(SourceLine.END_OF_MEMBER.isSentinel());
        assertFalse(new SourceLine("", "x", 1).isSentinel());
    }

    @Test
    void testMissingMember() {
        PartitionedFile library = PartitionedFile.of("LIB", Map.of());
        assertFalse(library.hasMember("NONE"));
        assertThrows(ResourceNotFoundException.class, () -> library.openMember("NONE"));
    }

    @Test
    void testFromDirectory() throws Exception {
        Files.writeString(tempDir.resolve("consts.hal"), " DECLARE PI SCALAR;\n");
        Files.writeString(tempDir.resolve("types.hal"), " DECLARE N INTEGER;\n");
        Files.createDirectory(tempDir.resolve("nested"));
        PartitionedFile library = PartitionedFile.fromDirectory(tempDir);
        assertEquals(Set.of("CONSTS", "TYPES"), library.getMemberNames());
        LineReader reader = library.openMember("consts");
        assertEquals(" DECLARE PI SCALAR;", reader.readLine().text);
        assertTrue(reader.readLine().isEndOfMember());
    }

    @Test
    void testFromMissingDirectory() {
        assertThrows(ResourceNotFoundException.class,
                () -> PartitionedFile.fromDirectory(tempDir.resolve("missing")));
    }

}
