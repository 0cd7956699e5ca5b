/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.instrumental.cpp;

import javax.annotation.Nonnull;

/**
 * Decoding of C literal tokens, and encoding of Java string literals.
 */
/* pp */ final class CLiterals {

    private CLiterals() {
    }

    /**
     * Returns true if the numeric token text denotes a floating
     * constant rather than an integer.
     */
    /* pp */ static boolean isFloating(@Nonnull String text) {
        String s = text.toLowerCase();
        if (s.startsWith("0x"))
            return s.indexOf('.') != -1 || s.indexOf('p') != -1;
        return s.indexOf('.') != -1 || s.indexOf('e') != -1;
    }

    /**
     * Strips integer suffixes (any mix of u, U, l, L).
     */
    @Nonnull
    /* pp */ static String stripIntegerSuffix(@Nonnull String text) {
        int end = text.length();
        while (end > 0 && "uUlL".indexOf(text.charAt(end - 1)) != -1)
            end--;
        return text.substring(0, end);
    }

    /**
     * Strips a floating suffix (f, F, l or L).
     */
    @Nonnull
    /* pp */ static String stripFloatingSuffix(@Nonnull String text) {
        int end = text.length();
        if (end == 0)
            return text;
        String s = text.toLowerCase();
        /* In a hexadecimal constant 'f' is a digit unless an exponent precedes it. */
        boolean hex = s.startsWith("0x");
        if ("fl".indexOf(s.charAt(end - 1)) != -1 && (!hex || s.indexOf('p') != -1))
            end--;
        return text.substring(0, end);
    }

    /**
     * Parses a C integer constant: decimal, octal, hexadecimal or
     * binary, with optional suffixes. Values above
     * {@link Long#MAX_VALUE} wrap as unsigned 64-bit values.
     *
     * @throws NumberFormatException if the text is not an integer constant.
     */
    /* pp */ static long parseInteger(@Nonnull String text) {
        String s = stripIntegerSuffix(text);
        int radix = 10;
        if (s.length() > 2 && (s.startsWith("0x") || s.startsWith("0X"))) {
            radix = 16;
            s = s.substring(2);
        } else if (s.length() > 2 && (s.startsWith("0b") || s.startsWith("0B"))) {
            radix = 2;
            s = s.substring(2);
        } else if (s.length() > 1 && s.charAt(0) == '0') {
            radix = 8;
            s = s.substring(1);
        }
        if (s.isEmpty())
            throw new NumberFormatException("Bad integer constant " + text);
        return Long.parseUnsignedLong(s, radix);
    }

    /**
     * Parses a C floating constant.
     *
     * @throws NumberFormatException if the text is not a floating constant.
     */
    /* pp */ static double parseFloating(@Nonnull String text) {
        String s = stripFloatingSuffix(text);
        if (s.startsWith("0x") || s.startsWith("0X")) {
            if (s.toLowerCase().indexOf('p') == -1)
                s = s + "p0";
            return Double.parseDouble(s);
        }
        return Double.parseDouble(s);
    }

    /**
     * Returns the value of a character constant such as {@code 'a'} or
     * {@code '\x1b'}. Multi-character constants combine their
     * characters big-endian, as GCC does.
     *
     * @throws NumberFormatException if the text is not a character constant.
     */
    /* pp */ static long parseCharacter(@Nonnull String text) {
        if (text.length() < 3 || text.charAt(0) != '\'' || text.charAt(text.length() - 1) != '\'')
            throw new NumberFormatException("Bad character constant " + text);
        String value = unescape(text.substring(1, text.length() - 1));
        if (value.isEmpty())
            throw new NumberFormatException("Empty character constant " + text);
        long result = 0;
        for (int i = 0; i < value.length(); i++)
            result = (result << 8) | (value.charAt(i) & 0xFF);
        if (value.length() == 1 && value.charAt(0) > 0xFF)
            result = value.charAt(0);
        return result;
    }

    /**
     * Returns the value of a string literal, with its quotes removed and
     * escapes decoded.
     */
    @Nonnull
    /* pp */ static String parseString(@Nonnull String text) {
        if (text.length() < 2 || text.charAt(0) != '"' || text.charAt(text.length() - 1) != '"')
            throw new NumberFormatException("Bad string literal " + text);
        return unescape(text.substring(1, text.length() - 1));
    }

    @Nonnull
    private static String unescape(@Nonnull String s) {
        StringBuilder buf = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c != '\\' || i + 1 == s.length()) {
                buf.append(c);
                continue;
            }
            c = s.charAt(++i);
            switch (c) {
                case 'n':
                    buf.append('\n');
                    break;
                case 't':
                    buf.append('\t');
                    break;
                case 'r':
                    buf.append('\r');
                    break;
                case 'a':
                    buf.append('\u0007');
                    break;
                case 'b':
                    buf.append('\b');
                    break;
                case 'f':
                    buf.append('\f');
                    break;
                case 'v':
                    buf.append('\u000B');
                    break;
                case 'x': {
                    int end = i + 1;
                    while (end < s.length() && Character.digit(s.charAt(end), 16) != -1)
                        end++;
                    if (end == i + 1)
                        throw new NumberFormatException("\\x used with no following hex digits");
                    buf.append((char) Integer.parseInt(s.substring(i + 1, end), 16));
                    i = end - 1;
                    break;
                }
                case '0':
                case '1':
                case '2':
                case '3':
                case '4':
                case '5':
                case '6':
                case '7': {
                    int end = i;
                    while (end < s.length() && end < i + 3 && s.charAt(end) >= '0' && s.charAt(end) <= '7')
                        end++;
                    buf.append((char) Integer.parseInt(s.substring(i, end), 8));
                    i = end - 1;
                    break;
                }
                default:
                    /* \\ \' \" \? and unknown escapes stand for themselves. */
                    buf.append(c);
                    break;
            }
        }
        return buf.toString();
    }

    /**
     * Quotes the given value as a Java string literal.
     */
    @Nonnull
    /* pp */ static String javaString(@Nonnull String value) {
        StringBuilder buf = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\':
                    buf.append("\\\\");
                    break;
                case '"':
                    buf.append("\\\"");
                    break;
                case '\n':
                    buf.append("\\n");
                    break;
                case '\r':
                    buf.append("\\r");
                    break;
                case '\t':
                    buf.append("\\t");
                    break;
                default:
                    if (c < 0x20)
                        buf.append(String.format("\\%03o", (int) c));
                    else if (c > 0x7E)
                        buf.append(String.format("\\u%04x", (int) c));
                    else
                        buf.append(c);
                    break;
            }
        }
        return buf.append('"').toString();
    }
}
