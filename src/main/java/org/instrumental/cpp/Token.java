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

import com.google.gson.JsonObject;

/**
 * A preprocessor token.
 *
 * Tokens are immutable. The line and column refer to the physical
 * position of the first character in the original input, even when
 * backslash-newline continuations were joined before lexing.
 *
 * @see Lexer
 */
public final class Token {

    /** A single space, used when a separator has to be synthesized. */
    public static final Token space = new Token(TokenType.WHITESPACE, " ");
    /** A synthesized newline. */
    public static final Token newline = new Token(TokenType.NEWLINE, "\n");

    private final TokenType type;
    private final String text;
    private final int line;
    private final int column;

    public Token(@Nonnull TokenType type, @Nonnull String text, int line, int column) {
        this.type = type;
        this.text = text;
        this.line = line;
        this.column = column;
    }

    public Token(@Nonnull TokenType type, @Nonnull String text) {
        this(type, text, -1, -1);
    }

    @Nonnull
    public TokenType getType() {
        return type;
    }

    /**
     * Returns the exact source text of this token.
     */
    @Nonnull
    public String getText() {
        return text;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean isWhite() {
        return type.isWhite();
    }

    public boolean is(@Nonnull TokenType type, @Nonnull String text) {
        return this.type == type && this.text.equals(text);
    }

    /**
     * Returns true if this is the punctuator with the given text.
     */
    public boolean isPunctuator(@Nonnull String text) {
        return is(TokenType.PUNCTUATOR, text);
    }

    /**
     * Returns a copy of this token relocated to the given position.
     */
    @Nonnull
    public Token at(int line, int column) {
        return new Token(type, text, line, column);
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("type", type.name());
        result.addProperty("text", text);
        if (line >= 0) {
            result.addProperty("line", line);
            result.addProperty("col", column);
        }
        return result;
    }

    /**
     * Two tokens are equal if they have the same type and text.
     * Positions are not compared.
     */
    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Token))
            return false;
        Token o = (Token) obj;
        return o.type == type && o.text.equals(text);
    }

    @Override
    public int hashCode() {
        return type.hashCode() * 31 + text.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        buf.append(type.name()).append('(');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\n':
                    buf.append("\\n");
                    break;
                case '\t':
                    buf.append("\\t");
                    break;
                default:
                    buf.append(c);
                    break;
            }
        }
        buf.append(')');
        if (line >= 0)
            buf.append('@').append(line).append(':').append(column);
        return buf.toString();
    }
}
