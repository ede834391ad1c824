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

import java.nio.file.Files;
import java.nio.file.Path;

public class PathResource implements Resource {

    private final Path path;
    private final String relativePath;

    // lazy
    private String text;
    private String[] lines;

    public PathResource(Path path) {
        this(path, FileUtils.WORKING_DIR.toPath());
    }

    public PathResource(Path path, Path root) {
        this.path = path.toAbsolutePath().normalize();
        Path base = root != null ? root.toAbsolutePath().normalize() : FileUtils.WORKING_DIR.toPath();
        this.relativePath = computeRelativePath(base);
    }

    private String computeRelativePath(Path root) {
        if (root.getRoot() != null && path.getRoot() != null
                && !root.getRoot().equals(path.getRoot())) {
            return path.toString().replace('\\', '/');
        }
        try {
            return root.relativize(path).toString().replace('\\', '/');
        } catch (IllegalArgumentException e) {
            return path.toString().replace('\\', '/');
        }
    }

    @Override
    public String getRelativePath() {
        return relativePath;
    }

    @Override
    public String getText() {
        if (text == null) {
            if (!Files.isRegularFile(path)) {
                throw new ResourceNotFoundException(path.toString());
            }
            try {
                text = FileUtils.toString(Files.readAllBytes(path));
            } catch (Exception e) {
                throw new RuntimeException("Failed to read text from: " + path, e);
            }
        }
        return text;
    }

    @Override
    public String getLine(int index) {
        String[] temp = getLines();
        if (index < 0 || index >= temp.length) {
            return "";
        }
        return temp[index];
    }

    @Override
    public int getLineCount() {
        return getLines().length;
    }

    private String[] getLines() {
        if (lines == null) {
            lines = FileUtils.toLines(getText());
        }
        return lines;
    }

    @Override
    public String toString() {
        return relativePath;
    }

}
