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

import java.io.InputStream;
import java.net.URL;
import java.nio.file.Path;

/**
 * Source text handed to the compiler: a file on disk, a classpath entry or a
 * string held in memory. Lines are addressed 0-indexed.
 */
public interface Resource {

    String CLASSPATH_COLON = "classpath:";
    String FILE_COLON = "file:";

    /**
     * Name used in diagnostics, relative to the working directory for files.
     */
    String getRelativePath();

    String getText();

    String getLine(int index);

    int getLineCount();

    default String getSimpleName() {
        String path = getRelativePath();
        int pos = path.lastIndexOf('/');
        return pos == -1 ? path : path.substring(pos + 1);
    }

    default String getFileNameWithoutExtension() {
        String name = getSimpleName();
        int pos = name.lastIndexOf('.');
        return pos == -1 ? name : name.substring(0, pos);
    }

    static String removePrefix(String text) {
        if (text.startsWith(CLASSPATH_COLON) || text.startsWith(FILE_COLON)) {
            return text.substring(text.indexOf(':') + 1);
        } else {
            return text;
        }
    }

    static Resource text(String text) {
        return new MemoryResource(text);
    }

    static Resource text(String text, String relativePath) {
        return new MemoryResource(text, relativePath);
    }

    static Resource from(Path path) {
        return new PathResource(path);
    }

    /**
     * Creates a resource from a path string; the "classpath:" prefix reads
     * through the context class loader and keeps the content in memory.
     */
    static Resource path(String path) {
        if (path == null) {
            path = "";
        }
        if (path.startsWith(CLASSPATH_COLON)) {
            String relativePath = removePrefix(path);
            if (relativePath.startsWith("/")) {
                relativePath = relativePath.substring(1);
            }
            URL url = null;
            ClassLoader contextCL = Thread.currentThread().getContextClassLoader();
            if (contextCL != null) {
                url = contextCL.getResource(relativePath);
            }
            if (url == null) {
                url = ClassLoader.getSystemResource(relativePath);
            }
            if (url == null) {
                throw new ResourceNotFoundException(path);
            }
            try (InputStream is = url.openStream()) {
                return new MemoryResource(FileUtils.toString(is), relativePath);
            } catch (Exception e) {
                throw new RuntimeException("Failed to create resource from classpath: " + path, e);
            }
        }
        return new PathResource(Path.of(removePrefix(path)));
    }

}
