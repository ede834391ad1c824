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
package io.halfc.charset;

import java.util.Arrays;

/**
 * Maps between the external character set (7-bit ASCII source text) and the
 * one-byte internal code of the compiler, which is the HAL/S EBCDIC set.
 * <p>
 * Characters missing from the external set are written with the escape
 * character (backquote, standing in for the cent sign) once or twice in
 * front of a base character. The equivalent overpunch form uses {@code _}
 * for level 1 and {@code =} for level 2. The internal code 0x00 can only be
 * produced by the level 1 overpunch of {@code 0}; every other escape that
 * lands on zero is undefined.
 * <p>
 * All methods are pure lookups over static tables.
 */
public final class CharacterTranslator {

    public static final int UNDEFINED = -1;

    public static final char ESCAPE_CHAR = '`';
    public static final char[] OVERPUNCH_CHARS = {'_', '='};
    public static final char VALID_00_OP = '_';
    public static final char VALID_00_CHAR = '0';
    public static final int MAX_ESCAPE_LEVEL = 2;

    /**
     * Indexed by internal (EBCDIC) code: level 1 escape result in the low
     * byte, level 2 in the high byte, zero when undefined.
     */
    private static final int[] TRANS_IN = {
            0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // 00
            0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // 08
            0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // 10
            0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // 18
            0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // 20
            0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // 28
            0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // 30
            0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // 38
            0xFF4A, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // 40
            0x0000, 0x0000, 0x0000, 0xDCAF, 0xEA21, 0x0000, 0xD044, 0xDE0D, // 48
            0xE048, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // 50
            0x0000, 0x0000, 0x0000, 0xEE53, 0xDB46, 0x0000, 0xFA55, 0xDF47, // 58
            0xDA45, 0xDD0E, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // 60
            0x0000, 0x0000, 0x0000, 0xEF54, 0xFD00, 0xFC16, 0xEB20, 0x0000, // 68
            0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // 70
            0x0000, 0x0000, 0xFB56, 0xEC51, 0xED52, 0x0000, 0xE149, 0xFE00, // 78
            0x0000, 0x8E29, 0x8F2A, 0x902B, 0x9A2C, 0x9C2D, 0x9D2E, 0x9E2F, // 80
            0x9F30, 0xA031, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // 88
            0x0000, 0xA132, 0xAA33, 0xAB34, 0xAC35, 0xAE36, 0xB037, 0xB138, // 90
            0xB239, 0xB33A, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // 98
            0x0000, 0x0000, 0xB43B, 0xB53C, 0xB63D, 0xB73E, 0xB83F, 0xB941, // A0
            0xBA42, 0xBB43, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // A8
            0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // B0
            0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // B8
            0x0000, 0x5710, 0x5811, 0x5919, 0x6213, 0x6314, 0x641A, 0x6512, // C0
            0x660B, 0x670C, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // C8
            0x0000, 0x680F, 0x6922, 0x6A1F, 0x7023, 0x7124, 0x721C, 0x7317, // D0
            0x7425, 0x751E, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // D8
            0x0000, 0x0000, 0x7618, 0x7715, 0x7826, 0x790A, 0x801D, 0x8A27, // E0
            0x8C1B, 0x8D28, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // E8
            0xBC00, 0xBE01, 0xBF02, 0xC003, 0xCA04, 0xCB05, 0xCC06, 0xCD07, // F0
            0xCE08, 0xCF09, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000 // F8
    };

    /**
     * Indexed by internal code: the EBCDIC base character in the low byte and
     * the escape level minus one in the high byte; zero when the character is
     * not produced by an escape.
     */
    private static final int[] TRANS_OUT = {
            0x00F0, 0x00F1, 0x00F2, 0x00F3, 0x00F4, 0x00F5, 0x00F6, 0x00F7, // 00
            0x00F8, 0x00F9, 0x00E5, 0x00C8, 0x00C9, 0x004F, 0x0061, 0x00D1, // 08
            0x00C1, 0x00C2, 0x00C7, 0x00C4, 0x00C5, 0x00E3, 0x006D, 0x00D7, // 10
            0x00E2, 0x00C3, 0x00C6, 0x00E8, 0x00D6, 0x00E6, 0x00D9, 0x00D3, // 18
            0x006E, 0x004C, 0x00D2, 0x00D4, 0x00D5, 0x00D8, 0x00E4, 0x00E7, // 20
            0x00E9, 0x0081, 0x0082, 0x0083, 0x0084, 0x0085, 0x0086, 0x0087, // 28
            0x0088, 0x0089, 0x0091, 0x0092, 0x0093, 0x0094, 0x0095, 0x0096, // 30
            0x0097, 0x0098, 0x0099, 0x00A2, 0x00A3, 0x00A4, 0x00A5, 0x00A6, // 38
            0x0000, 0x00A7, 0x00A8, 0x00A9, 0x004E, 0x0060, 0x005C, 0x005F, // 40
            0x0050, 0x007E, 0x0040, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // 48
            0x0000, 0x007B, 0x007C, 0x005B, 0x006B, 0x005E, 0x007A, 0x01C1, // 50
            0x01C2, 0x01C3, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // 58
            0x0000, 0x0000, 0x01C4, 0x01C5, 0x01C6, 0x01C7, 0x01C8, 0x01C9, // 60
            0x01D1, 0x01D2, 0x01D3, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // 68
            0x01D4, 0x01D5, 0x01D6, 0x01D7, 0x01D8, 0x01D9, 0x01E2, 0x01E3, // 70
            0x01E4, 0x01E5, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // 78
            0x01E6, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // 80
            0x0000, 0x0000, 0x01E7, 0x0000, 0x01E8, 0x01E9, 0x0181, 0x0182, // 88
            0x0183, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // 90
            0x0000, 0x0000, 0x0184, 0x0000, 0x0185, 0x0186, 0x0187, 0x0188, // 98
            0x0189, 0x0191, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // A0
            0x0000, 0x0000, 0x0192, 0x0193, 0x0194, 0x0000, 0x0195, 0x004B, // A8
            0x0196, 0x0197, 0x0198, 0x0199, 0x01A2, 0x01A3, 0x01A4, 0x01A5, // B0
            0x01A6, 0x01A7, 0x01A8, 0x01A9, 0x01F0, 0x0000, 0x01F1, 0x01F2, // B8
            0x01F3, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // C0
            0x0000, 0x0000, 0x01F4, 0x01F5, 0x01F6, 0x01F7, 0x01F8, 0x01F9, // C8
            0x014E, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // D0
            0x0000, 0x0000, 0x0160, 0x015C, 0x014B, 0x0161, 0x014F, 0x015F, // D8
            0x0150, 0x017E, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // E0
            0x0000, 0x0000, 0x014C, 0x016E, 0x017B, 0x017C, 0x015B, 0x016B, // E8
            0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, 0x0000, // F0
            0x0000, 0x0000, 0x015E, 0x017A, 0x016D, 0x016C, 0x017F, 0x0140 // F8
    };

    private static final int[] ASCII_TO_INTERNAL = new int[128];
    private static final char[] INTERNAL_TO_ASCII = new char[256];

    static {
        Arrays.fill(ASCII_TO_INTERNAL, UNDEFINED);
        map(' ', 0x40);
        map('.', 0x4B);
        map('<', 0x4C);
        map('(', 0x4D);
        map('+', 0x4E);
        map('|', 0x4F);
        map('&', 0x50);
        map('!', 0x5A);
        map('$', 0x5B);
        map('*', 0x5C);
        map(')', 0x5D);
        map(';', 0x5E);
        map('~', 0x5F); // logical not
        map('-', 0x60);
        map('/', 0x61);
        map(',', 0x6B);
        map('%', 0x6C);
        map('_', 0x6D);
        map('>', 0x6E);
        map('?', 0x6F);
        map(':', 0x7A);
        map('#', 0x7B);
        map('@', 0x7C);
        map('\'', 0x7D);
        map('=', 0x7E);
        map('"', 0x7F);
        mapRange('a', 'i', 0x81);
        mapRange('j', 'r', 0x91);
        mapRange('s', 'z', 0xA2);
        mapRange('A', 'I', 0xC1);
        mapRange('J', 'R', 0xD1);
        mapRange('S', 'Z', 0xE2);
        mapRange('0', '9', 0xF0);
    }

    private static void map(char external, int internal) {
        ASCII_TO_INTERNAL[external] = internal;
        INTERNAL_TO_ASCII[internal] = external;
    }

    private static void mapRange(char first, char last, int internal) {
        for (char c = first; c <= last; c++) {
            map(c, internal++);
        }
    }

    private CharacterTranslator() {
        // only static methods
    }

    /**
     * Direct translation of one external character, or {@link #UNDEFINED}.
     * The escape character itself has no direct translation.
     */
    public static int translateIn(char ch) {
        if (ch >= ASCII_TO_INTERNAL.length) {
            return UNDEFINED;
        }
        return ASCII_TO_INTERNAL[ch];
    }

    public static boolean isDefined(char ch) {
        return translateIn(ch) != UNDEFINED;
    }

    /**
     * Internal code for {@code ch} preceded by {@code level} escape
     * characters, or {@link #UNDEFINED}.
     */
    public static int escape(int level, char ch) {
        if (level < 1 || level > MAX_ESCAPE_LEVEL) {
            return UNDEFINED;
        }
        return overpunch(OVERPUNCH_CHARS[level - 1], ch);
    }

    /**
     * Internal code for {@code ch} overpunched by {@code op}, or
     * {@link #UNDEFINED} when the combination has no translation.
     */
    public static int overpunch(char op, char ch) {
        int level = overpunchLevel(op);
        int base = translateIn(ch);
        if (level == 0 || base == UNDEFINED) {
            return UNDEFINED;
        }
        int entry = TRANS_IN[base];
        int code = level == 1 ? entry & 0xFF : (entry >> 8) & 0xFF;
        if (code == 0 && !(op == VALID_00_OP && ch == VALID_00_CHAR)) {
            return UNDEFINED;
        }
        return code;
    }

    private static int overpunchLevel(char op) {
        for (int i = 0; i < OVERPUNCH_CHARS.length; i++) {
            if (OVERPUNCH_CHARS[i] == op) {
                return i + 1;
            }
        }
        return 0;
    }

    /**
     * How to write the internal code externally, or null when the code has
     * neither a direct nor an escaped spelling.
     */
    public static Escape translateOut(int code) {
        if (code < 0 || code > 0xFF) {
            return null;
        }
        int entry = TRANS_OUT[code];
        if (entry == 0) {
            char direct = INTERNAL_TO_ASCII[code];
            if (direct == 0) {
                return null;
            }
            return new Escape(0, direct);
        }
        char base = INTERNAL_TO_ASCII[entry & 0xFF];
        if (base == 0) {
            return null;
        }
        return new Escape(((entry >> 8) & 0xFF) + 1, base);
    }

    /**
     * Re-emits internal text in the external character set, escaping where
     * needed. Codes with no external spelling come out as '?'.
     */
    public static String toExternal(CharSequence internal) {
        StringBuilder sb = new StringBuilder(internal.length());
        for (int i = 0; i < internal.length(); i++) {
            Escape e = translateOut(internal.charAt(i));
            if (e == null) {
                sb.append('?');
            } else {
                sb.append(e);
            }
        }
        return sb.toString();
    }

    /**
     * Translates external text that contains no escapes, each undefined
     * character replaced by {@code placeholder}.
     */
    public static String toInternal(CharSequence external, char placeholder) {
        StringBuilder sb = new StringBuilder(external.length());
        for (int i = 0; i < external.length(); i++) {
            int code = translateIn(external.charAt(i));
            sb.append((char) (code == UNDEFINED ? translateIn(placeholder) : code));
        }
        return sb.toString();
    }

}
