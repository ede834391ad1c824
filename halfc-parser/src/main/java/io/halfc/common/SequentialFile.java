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

/**
 * Sequential file: its lines, then {@link SourceLine#END_OF_FILE}.
 */
public class SequentialFile implements LineReader {

    private final Resource resource;
    private final String name;
    private final int count;

    private int index;

    public SequentialFile(Resource resource) {
        this.resource = resource;
        String path = resource.getRelativePath();
        this.name = path.isEmpty() ? "(memory)" : path;
        this.count = resource.getLineCount();
    }

    @Override
    public SourceLine readLine() {
        if (index >= count) {
            return SourceLine.END_OF_FILE;
        }
        String text = resource.getLine(index);
        index++;
        return new SourceLine(text, name, index);
    }

    @Override
    public String getName() {
        return name;
    }

    public Resource getResource() {
        return resource;
    }

}
