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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.EnumMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Does not handle digraphs or trigraphs.
 *
 * At every position each registered pattern is tried and the longest
 * match wins; ties go to the pattern registered first (the declaration
 * order of {@link TokenType}). Every input character ends up in exactly
 * one token, including whitespace, newlines and comments, so the
 * concatenated token texts reproduce the input minus its
 * backslash-newline continuations.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private static final Map<TokenType, Pattern> PATTERNS = new EnumMap<TokenType, Pattern>(TokenType.class);

    static {
        PATTERNS.put(TokenType.DEFINED, Pattern.compile("defined"));
        PATTERNS.put(TokenType.IDENTIFIER, Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*"));
        /* The exponent sign must be tried before the plain character class. */
        PATTERNS.put(TokenType.NUMBER, Pattern.compile("\\.?[0-9](?:[eEpP][+-]|[0-9a-zA-Z_.])*"));
        PATTERNS.put(TokenType.STRING, Pattern.compile("\"[^\"\\\\\\n]*(?:\\\\.[^\"\\\\\\n]*)*\""));
        PATTERNS.put(TokenType.CHARACTER, Pattern.compile("'[^'\\\\\\n]*(?:\\\\.[^'\\\\\\n]*)*'"));
        PATTERNS.put(TokenType.HEADER, Pattern.compile("<[^>\\n]*>"));
        PATTERNS.put(TokenType.PUNCTUATOR, Pattern.compile(
                "<<=|>>=|\\.\\.\\.|->|\\+\\+|--|<<|>>|&&|\\|\\||##|[<>=!*/%&^|+-]="
                + "|[{}\\[\\]()<>.&*+\\-~!/%^|=;:,?#]"));
        PATTERNS.put(TokenType.NEWLINE, Pattern.compile("\\n"));
        PATTERNS.put(TokenType.WHITESPACE, Pattern.compile("[ \\t\\f\\u000B]+"));
        PATTERNS.put(TokenType.LINE_COMMENT, Pattern.compile("//[^\\n]*"));
        PATTERNS.put(TokenType.BLOCK_COMMENT, Pattern.compile("(?s)/\\*.*?\\*/"));
    }

    /* Offsets into the joined text at which a continuation was removed. */
    private int[] splices = new int[0];
    private int line;
    private int column;
    /* Set between '#include' and the end of its line. */
    private boolean headerAllowed;

    /**
     * Lexes the given header text.
     *
     * @param text the full text of one header.
     * @return every token of the text, in order.
     * @throws LexerException if no pattern matches at some position.
     */
    @Nonnull
    public List<Token> lex(@Nonnull String text)
            throws LexerException {
        String joined = join(normalize(text));
        List<Token> tokens = new ArrayList<Token>();
        int pos = 0;
        int splice = 0;
        line = 1;
        column = 1;
        headerAllowed = false;
        int directive = 0;  /* Non-white tokens seen on the current line. */
        String first = null;

        while (pos < joined.length()) {
            while (splice < splices.length && splices[splice] <= pos) {
                line++;
                column = 1;
                splice++;
            }
            Token tok = readToken(joined, pos);
            if (tok == null) {
                throw new LexerException("Error at " + line + ":" + column
                        + ": No acceptable token found at '"
                        + excerpt(joined, pos) + "'");
            }
            tokens.add(tok);

            /* Advance the physical position, honouring any continuation
             * that was joined into the middle of this token. */
            String s = tok.getText();
            for (int i = 0; i < s.length(); i++) {
                if (i > 0) {
                    while (splice < splices.length && splices[splice] <= pos + i) {
                        line++;
                        column = 1;
                        splice++;
                    }
                }
                if (s.charAt(i) == '\n') {
                    line++;
                    column = 1;
                } else {
                    column++;
                }
            }
            pos += s.length();

            switch (tok.getType()) {
                case NEWLINE:
                    directive = 0;
                    first = null;
                    headerAllowed = false;
                    break;
                case WHITESPACE:
                case LINE_COMMENT:
                case BLOCK_COMMENT:
                    break;
                default:
                    if (directive == 0)
                        first = s;
                    directive++;
                    headerAllowed = directive == 2 && "#".equals(first)
                            && ("include".equals(s) || "include_next".equals(s));
                    break;
            }
        }
        LOG.debug("Lexed " + tokens.size() + " tokens from " + line + " lines");
        return tokens;
    }

    /**
     * Reads the longest token at the given position, or null if no
     * pattern matches.
     */
    @CheckForNull
    /* pp */ Token readToken(@Nonnull String text, int pos) {
        Token best = null;
        int bestSize = 0;
        for (Map.Entry<TokenType, Pattern> e : PATTERNS.entrySet()) {
            if (e.getKey() == TokenType.HEADER && !headerAllowed)
                continue;
            Matcher m = e.getValue().matcher(text);
            m.region(pos, text.length());
            if (m.lookingAt()) {
                int size = m.end() - m.start();
                if (size > bestSize) {
                    best = new Token(e.getKey(), m.group(), line, column);
                    bestSize = size;
                }
            }
        }
        return best;
    }

    /**
     * Returns true if lexing the given text produces a first token of
     * exactly {@code length} characters.
     *
     * Used by the minifying writer to decide whether two neighbouring
     * tokens may be written without a separator.
     */
    /* pp */ boolean endsAt(@Nonnull String text, int length) {
        headerAllowed = false;
        line = 1;
        column = 1;
        Token tok = readToken(text, 0);
        return tok != null && tok.getText().length() == length;
    }

    @Nonnull
    private static String normalize(@Nonnull String text) {
        if (text.indexOf('\r') == -1)
            return text;
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    /* Removes backslash-newline pairs, remembering where they were. */
    @Nonnull
    private String join(@Nonnull String text) {
        int idx = text.indexOf("\\\n");
        if (idx == -1) {
            splices = new int[0];
            return text;
        }
        StringBuilder buf = new StringBuilder(text.length());
        int[] found = new int[16];
        int count = 0;
        int start = 0;
        while (idx != -1) {
            buf.append(text, start, idx);
            if (count == found.length)
                found = Arrays.copyOf(found, count * 2);
            found[count++] = buf.length();
            start = idx + 2;
            idx = text.indexOf("\\\n", start);
        }
        buf.append(text, start, text.length());
        splices = Arrays.copyOf(found, count);
        return buf.toString();
    }

    @Nonnull
    private static String excerpt(@Nonnull String text, int pos) {
        int end = Math.min(text.length(), pos + 16);
        int nl = text.indexOf('\n', pos);
        if (nl != -1 && nl < end)
            end = nl;
        return text.substring(pos, end);
    }
}
