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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * A macro object.
 *
 * This encapsulates a name, an argument count, and a token stream
 * for replacement. The replacement token stream never starts or ends
 * with whitespace or comments.
 */
public class Macro {

    private final String name;
    private final int line;
    private final int column;
    /* Null for an object-like macro. */
    @CheckForNull
    private final List<String> args;
    private final List<Token> tokens;
    private final Set<String> dependsOn;

    private Macro(@Nonnull String name, int line, int column,
            @CheckForNull List<String> args, @Nonnull List<Token> tokens) {
        this.name = name;
        this.line = line;
        this.column = column;
        this.args = args == null ? null : Collections.unmodifiableList(new ArrayList<String>(args));
        this.tokens = Collections.unmodifiableList(new ArrayList<Token>(tokens));
        Set<String> deps = new LinkedHashSet<String>();
        for (Token tok : this.tokens)
            if (tok.getType() == TokenType.IDENTIFIER)
                deps.add(tok.getText());
        this.dependsOn = Collections.unmodifiableSet(deps);
    }

    /**
     * Creates an object-like macro defined by the given name token.
     */
    @Nonnull
    public static Macro object(@Nonnull Token name, @Nonnull List<Token> body) {
        return new Macro(name.getText(), name.getLine(), name.getColumn(), null, body);
    }

    /**
     * Creates a function-like macro defined by the given name token.
     */
    @Nonnull
    public static Macro function(@Nonnull Token name, @Nonnull List<String> args, @Nonnull List<Token> body) {
        return new Macro(name.getText(), name.getLine(), name.getColumn(), args, body);
    }

    /**
     * Returns a copy of this macro with a new replacement list, for
     * instance after the body has been macro-expanded.
     *
     * The set of dependencies is recomputed from the new body.
     */
    @Nonnull
    public Macro withTokens(@Nonnull List<Token> tokens) {
        return new Macro(name, line, column, args, tokens);
    }

    /**
     * Returns the name of this macro.
     */
    @Nonnull
    public String getName() {
        return name;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * Returns true if this is a function-like macro.
     */
    public boolean isFunctionLike() {
        return args != null;
    }

    /**
     * Returns the parameter names of this function-like macro, or an
     * empty list for an object-like macro.
     */
    @Nonnull
    public List<String> getArgs() {
        if (args == null)
            return Collections.emptyList();
        return args;
    }

    /**
     * Returns the expansion of this macro.
     */
    @Nonnull
    public List<Token> getTokens() {
        return tokens;
    }

    /**
     * Returns the identifiers referenced by the expansion, in order of
     * first appearance.
     */
    @Nonnull
    public Set<String> getDependsOn() {
        return dependsOn;
    }

    /**
     * Returns the expansion as source text.
     */
    @Nonnull
    public String getText() {
        StringBuilder buf = new StringBuilder();
        for (Token tok : tokens)
            buf.append(tok.getText());
        return buf.toString();
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("name", name);
        if (args != null) {
            JsonArray params = new JsonArray();
            for (String arg : args)
                params.add(new JsonPrimitive(arg));
            result.add("params", params);
        }
        result.addProperty("body", getText());
        if (line >= 0) {
            result.addProperty("line", line);
            result.addProperty("col", column);
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder(name);
        if (args != null) {
            buf.append('(');
            boolean first = true;
            for (String arg : args) {
                if (!first)
                    buf.append(", ");
                buf.append(arg);
                first = false;
            }
            buf.append(')');
        }
        if (!tokens.isEmpty())
            buf.append(" => ").append(getText());
        return buf.toString();
    }
}
