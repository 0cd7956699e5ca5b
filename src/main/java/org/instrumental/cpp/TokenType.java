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

/**
 * The lexical classes produced by the {@link Lexer}.
 *
 * The declaration order is the lexer's registration order, which
 * breaks ties between equally long matches. This is why
 * {@link #DEFINED} precedes {@link #IDENTIFIER}.
 */
public enum TokenType {

    DEFINED,
    IDENTIFIER,
    NUMBER,
    STRING,
    CHARACTER,
    /** An angle-bracket header name, as in {@code #include <stdio.h>}. */
    HEADER,
    PUNCTUATOR,
    NEWLINE,
    WHITESPACE,
    LINE_COMMENT,
    BLOCK_COMMENT;

    /**
     * Returns true for whitespace and comments.
     *
     * Newlines are not white: they terminate logical lines.
     */
    public boolean isWhite() {
        return this == WHITESPACE || this == LINE_COMMENT || this == BLOCK_COMMENT;
    }

    /**
     * Returns true for tokens which need a separating space from an
     * adjacent token of the same kind.
     */
    /* pp */ boolean isWord() {
        return this == DEFINED || this == IDENTIFIER || this == NUMBER;
    }
}
