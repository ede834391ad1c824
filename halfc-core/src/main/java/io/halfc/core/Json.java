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

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;
import net.minidev.json.JSONValue;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Path access over a parsed JSON document. Paths without a leading {@code $}
 * are relative to the root object.
 */
public class Json {

    private final DocumentContext doc;
    private final boolean object;

    private Json(DocumentContext doc) {
        this.doc = doc;
        object = doc.json() instanceof Map;
    }

    public static Json of(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("input string must not be empty or blank");
        }
        return new Json(JsonPath.parse(parseLenient(json)));
    }

    public static Object parseLenient(String json) {
        try {
            Object result = JSONValue.parseKeepingOrder(json);
            if (!(result instanceof Map || result instanceof List)) {
                throw new RuntimeException("invalid json: not a JSON object or array");
            }
            return result;
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("invalid json: " + e.getMessage(), e);
        }
    }

    private static String prefix(String path) {
        return path.charAt(0) == '$' ? path : "$." + path;
    }

    public boolean isObject() {
        return object;
    }

    public <T> T get(String path) {
        return doc.read(prefix(path));
    }

    public <T> Optional<T> getOptional(String path) {
        try {
            return Optional.ofNullable(get(path));
        } catch (PathNotFoundException e) {
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return doc.jsonString();
    }

}
