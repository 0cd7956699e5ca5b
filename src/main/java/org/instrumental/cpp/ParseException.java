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
 * A structural error in the header: an unmatched or unterminated
 * conditional, a malformed directive, or a macro invoked with the
 * wrong number of arguments.
 */
public class ParseException extends LexerException {

    private final int line;
    private final int column;

    public ParseException(int line, int column, @Nonnull String msg) {
        super("(" + line + ":" + column + ") " + msg);
        this.line = line;
        this.column = column;
    }

    public ParseException(@Nonnull Token tok, @Nonnull String msg) {
        this(tok.getLine(), tok.getColumn(), msg);
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
