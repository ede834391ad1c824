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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Library of named members, such as the include library. Member names are
 * case-insensitive. A member read handle returns the member's lines and then
 * {@link SourceLine#END_OF_MEMBER}.
 */
public class PartitionedFile {

    static final Logger logger = LoggerFactory.getLogger(PartitionedFile.class);

    private final String name;
    private final Map<String, Resource> members;

    private PartitionedFile(String name, Map<String, Resource> members) {
        this.name = name;
        this.members = members;
    }

    public static PartitionedFile of(String name, Map<String, String> texts) {
        Map<String, Resource> members = new LinkedHashMap<>();
        texts.forEach((k, v) -> {
            String memberName = normalize(k);
            members.put(memberName, Resource.text(v, name + "(" + memberName + ")"));
        });
        return new PartitionedFile(name, members);
    }

    /**
     * Every regular file in the directory is a member named after the file
     * without its extension.
     */
    public static PartitionedFile fromDirectory(Path dir) {
        if (!Files.isDirectory(dir)) {
            throw new ResourceNotFoundException(dir.toString());
        }
        Map<String, Resource> members = new LinkedHashMap<>();
        try (Stream<Path> stream = Files.list(dir)) {
            stream.filter(Files::isRegularFile).sorted().forEach(p -> {
                Resource resource = new PathResource(p);
                String memberName = normalize(resource.getFileNameWithoutExtension());
                Resource existing = members.putIfAbsent(memberName, resource);
                if (existing != null) {
                    logger.warn("duplicate member {} in {}, keeping {}", memberName, dir, existing);
                }
            });
        } catch (IOException e) {
            throw new RuntimeException("Failed to list members of: " + dir, e);
        }
        return new PartitionedFile(dir.toString(), members);
    }

    private static String normalize(String memberName) {
        return memberName.trim().toUpperCase(Locale.ROOT);
    }

    public String getName() {
        return name;
    }

    public boolean hasMember(String memberName) {
        return members.containsKey(normalize(memberName));
    }

    public Set<String> getMemberNames() {
        return Collections.unmodifiableSet(members.keySet());
    }

    public LineReader openMember(String memberName) {
        Resource resource = members.get(normalize(memberName));
        if (resource == null) {
            throw new ResourceNotFoundException(name + "(" + normalize(memberName) + ")");
        }
        return new MemberReader(normalize(memberName), resource);
    }

    static class MemberReader implements LineReader {

        private final String memberName;
        private final SequentialFile file;

        MemberReader(String memberName, Resource resource) {
            this.memberName = memberName;
            this.file = new SequentialFile(resource);
        }

        @Override
        public SourceLine readLine() {
            SourceLine line = file.readLine();
            return line.isEndOfFile() ? SourceLine.END_OF_MEMBER : line;
        }

        @Override
        public String getName() {
            return memberName;
        }

    }

}
