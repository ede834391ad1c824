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
package io.halfc.scanner;

import io.halfc.charset.CharClass;
import io.halfc.charset.CharacterTranslator;
import io.halfc.common.DiagnosticSink;
import io.halfc.common.Location;
import io.halfc.common.Severity;
import io.halfc.grammar.Vocabulary;

/**
 * Assembles tokens from a {@link CharSource}. Every lexical error is reported
 * to the sink and repaired locally, so the scanner itself never stops the
 * compilation.
 */
public class Scanner implements TokenSource {

    public static final int DEFAULT_IDENTIFIER_LIMIT = 32;
    public static final int DEFAULT_STRING_LIMIT = 256;

    // internal code substituted for an untranslatable string character
    private static final char PLACEHOLDER = (char) CharacterTranslator.translateIn(' ');

    private final CharSource source;
    private final Vocabulary vocabulary;
    private final DiagnosticSink sink;

    private int identifierLimit = DEFAULT_IDENTIFIER_LIMIT;
    private int stringLimit = DEFAULT_STRING_LIMIT;
    private int tokenCount;

    public Scanner(CharSource source, Vocabulary vocabulary, DiagnosticSink sink) {
        this.source = source;
        this.vocabulary = vocabulary;
        this.sink = sink;
    }

    public Scanner identifierLimit(int value) {
        this.identifierLimit = value;
        return this;
    }

    public Scanner stringLimit(int value) {
        this.stringLimit = value;
        return this;
    }

    public Vocabulary getVocabulary() {
        return vocabulary;
    }

    public int getTokenCount() {
        return tokenCount;
    }

    @Override
    public Token nextToken() {
        Token token = scan();
        tokenCount++;
        return token;
    }

    private Token scan() {
        while (true) {
            skipWhitespace();
            Location location = source.location();
            int c = source.peek();
            if (c == CharSource.EOF) {
                return new Token(vocabulary.endOfFile, "", location);
            }
            switch (CharClass.of(c)) {
                case LETTER:
                    return identifier(location);
                case DIGIT:
                    return number(location);
                case QUOTE:
                    return string(location);
                case DOUBLE_QUOTE:
                    return text(location);
                case SPECIAL:
                    if (c == '.' && CharClass.of(source.peek(1)) == CharClass.DIGIT) {
                        return number(location);
                    }
                    Token special = special(location);
                    if (special != null) {
                        return special;
                    }
                    break;
                case ESCAPE:
                    source.next();
                    error(location, "escape character outside a character string");
                    break;
                default:
                    source.next();
                    error(location, "illegal character '" + (char) c + "'");
                    break;
            }
        }
    }

    private void error(Location location, String message) {
        sink.report(Severity.ERROR, location, message);
    }

    // ========== Whitespace and comments ==========

    private void skipWhitespace() {
        while (true) {
            int c = source.peek();
            if (c != CharSource.EOF && CharClass.of(c) == CharClass.BLANK) {
                source.next();
            } else if (c == '/' && source.peek(1) == '*') {
                skipComment();
            } else {
                return;
            }
        }
    }

    private void skipComment() {
        Location start = source.location();
        source.next();
        source.next();
        while (true) {
            int c = source.next();
            if (c == CharSource.EOF) {
                error(start, "unterminated comment");
                return;
            }
            if (c == '*' && source.peek() == '/') {
                source.next();
                return;
            }
        }
    }

    // ========== Identifiers and reserved words ==========

    private Token identifier(Location location) {
        StringBuilder sb = new StringBuilder();
        while (CharClass.isIdentifierPart(source.peek())) {
            sb.append((char) source.next());
        }
        String text = sb.toString();
        int reserved = vocabulary.lookupReserved(text);
        if (reserved != Vocabulary.NONE) {
            return new Token(reserved, text, location);
        }
        if (text.length() > identifierLimit) {
            error(location, "identifier longer than " + identifierLimit + " characters truncated: " + text);
            text = text.substring(0, identifierLimit);
        }
        return new Token(vocabulary.identifier, text, location);
    }

    // ========== Numbers ==========

    /**
     * Digits with an optional fraction and any number of exponent parts
     * ({@code E} decimal, {@code B} binary, {@code H} hexadecimal), each with
     * an optional sign. The text is kept verbatim.
     */
    private Token number(Location location) {
        StringBuilder sb = new StringBuilder();
        boolean compound = false;
        digits(sb);
        if (source.peek() == '.') {
            compound = true;
            sb.append((char) source.next());
            digits(sb);
        }
        while (isExponentLetter(source.peek())) {
            int sign = source.peek(1);
            boolean signed = sign == '+' || sign == '-';
            int after = signed ? source.peek(2) : sign;
            if (CharClass.of(after) == CharClass.DIGIT) {
                compound = true;
                sb.append((char) source.next());
                if (signed) {
                    sb.append((char) source.next());
                }
                digits(sb);
            } else if (signed) {
                sb.append((char) source.next());
                sb.append((char) source.next());
                error(location, "malformed exponent in number " + sb);
                compound = true;
                break;
            } else {
                break;
            }
        }
        int symbol = compound ? vocabulary.compoundNumber : vocabulary.simpleNumber;
        return new Token(symbol, sb.toString(), location);
    }

    private void digits(StringBuilder sb) {
        while (CharClass.of(source.peek()) == CharClass.DIGIT) {
            sb.append((char) source.next());
        }
    }

    private static boolean isExponentLetter(int c) {
        return c == 'E' || c == 'e' || c == 'B' || c == 'b' || c == 'H' || c == 'h';
    }

    // ========== Character strings ==========

    /**
     * A string ends at its closing quote or at the end of the line; two
     * quotes in a row stand for one. The value is kept in internal code with
     * escapes applied.
     */
    private Token string(Location location) {
        StringBuilder text = new StringBuilder();
        StringBuilder value = new StringBuilder();
        text.append((char) source.next());
        boolean truncated = false;
        while (true) {
            int c = source.peek();
            if (c == CharSource.EOF || c == '\n') {
                error(location, "unterminated character string");
                break;
            }
            Location charLocation = source.location();
            text.append((char) source.next());
            int code;
            if (c == '\'') {
                if (source.peek() != '\'') {
                    break;
                }
                text.append((char) source.next());
                code = CharacterTranslator.translateIn('\'');
            } else if (c == CharacterTranslator.ESCAPE_CHAR) {
                code = escape(text, charLocation);
            } else {
                code = CharacterTranslator.translateIn((char) c);
                if (code == CharacterTranslator.UNDEFINED) {
                    error(charLocation, "character '" + (char) c + "' not in the character set");
                    code = PLACEHOLDER;
                }
            }
            if (value.length() < stringLimit) {
                value.append((char) code);
            } else if (!truncated) {
                truncated = true;
                error(location, "character string longer than " + stringLimit + " characters truncated");
            }
        }
        return new Token(vocabulary.charString, text.toString(), value.toString(), location, null);
    }

    /**
     * Called after the first escape character has been consumed.
     */
    private int escape(StringBuilder text, Location location) {
        int level = 1;
        while (source.peek() == CharacterTranslator.ESCAPE_CHAR) {
            text.append((char) source.next());
            level++;
        }
        int c = source.peek();
        if (c == CharSource.EOF || c == '\n') {
            error(location, "escape character at end of line");
            return PLACEHOLDER;
        }
        text.append((char) source.next());
        if (level > CharacterTranslator.MAX_ESCAPE_LEVEL) {
            error(location, "escape level " + level + " exceeds " + CharacterTranslator.MAX_ESCAPE_LEVEL);
            return PLACEHOLDER;
        }
        int code = CharacterTranslator.escape(level, (char) c);
        if (code == CharacterTranslator.UNDEFINED) {
            error(location, "invalid escape sequence " + "`".repeat(level) + (char) c);
            return PLACEHOLDER;
        }
        return code;
    }

    // ========== Replace text ==========

    /**
     * Double-quoted replace text, which may span lines. Two double quotes in
     * a row stand for one. The value is the raw external text.
     */
    private Token text(Location location) {
        StringBuilder text = new StringBuilder();
        StringBuilder value = new StringBuilder();
        text.append((char) source.next());
        while (true) {
            int c = source.next();
            if (c == CharSource.EOF) {
                error(location, "unterminated replace text");
                break;
            }
            text.append((char) c);
            if (c == '"') {
                if (source.peek() != '"') {
                    break;
                }
                text.append((char) source.next());
            }
            value.append((char) c);
        }
        return new Token(vocabulary.text, text.toString(), value.toString(), location, null);
    }

    // ========== Specials ==========

    /**
     * Longest special terminal starting at the next character, or null after
     * reporting a character that starts none.
     */
    private Token special(Location location) {
        int max = vocabulary.getMaxSpecialLength();
        StringBuilder sb = new StringBuilder(max);
        for (int i = 0; i < max; i++) {
            int c = source.peek(i);
            if (c == CharSource.EOF || CharClass.of(c) != CharClass.SPECIAL) {
                break;
            }
            sb.append((char) c);
        }
        String ahead = sb.toString();
        for (String special : vocabulary.getSpecials()) {
            if (ahead.startsWith(special)) {
                for (int i = 0; i < special.length(); i++) {
                    source.next();
                }
                return new Token(vocabulary.getIndex(special), special, location);
            }
        }
        int c = source.next();
        error(location, "unexpected character '" + (char) c + "'");
        return null;
    }

}
