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
import java.util.List;
import javax.annotation.Nonnull;

import org.pcollections.Empty;
import org.pcollections.PSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands macro invocations in a token sequence.
 *
 * Expansion is a recursive descent over the token list. The names of
 * the macros currently being expanded are threaded through the
 * recursion as persistent sets, one for object-like and one for
 * function-like macros; a name in its set is left alone, so
 * {@code #define X X} expands {@code X} to {@code X}.
 */
public class MacroExpander {

    private static final Logger LOG = LoggerFactory.getLogger(MacroExpander.class);

    private final MacroTable macros;
    private boolean debug;

    public MacroExpander(@Nonnull MacroTable macros) {
        this.macros = macros;
    }

    /* pp */ void setDebug(boolean debug) {
        this.debug = debug;
    }

    /**
     * Fully expands the given tokens.
     *
     * @throws ParseException if a function-like macro is invoked with
     * the wrong number of arguments, or its argument list is not closed.
     */
    @Nonnull
    public List<Token> expand(@Nonnull List<Token> tokens)
            throws ParseException {
        return expand(tokens, Empty.<String>set(), Empty.<String>set());
    }

    /**
     * Expands the given tokens, leaving alone the object-like macros
     * in {@code disabled} and the function-like macros in
     * {@code disabledFunctions}.
     */
    @Nonnull
    public List<Token> expand(@Nonnull List<Token> tokens,
            @Nonnull PSet<String> disabled, @Nonnull PSet<String> disabledFunctions)
            throws ParseException {
        List<Token> expansion = new ArrayList<Token>();
        int i = 0;
        EXPANSION:
        while (i < tokens.size()) {
            Token tok = tokens.get(i);
            if (tok.getType() != TokenType.IDENTIFIER) {
                expansion.add(tok);
                i++;
                continue;
            }

            String name = tok.getText();
            Macro m = macros.getFunctionMacro(name);
            if (m != null && !disabledFunctions.contains(name)) {
                int open = i + 1;
                while (open < tokens.size() && isSpace(tokens.get(open)))
                    open++;
                if (open < tokens.size() && tokens.get(open).isPunctuator("(")) {
                    List<List<Token>> args = new ArrayList<List<Token>>();
                    i = arguments(tok, tokens, open, args);
                    expansion.addAll(invoke(tok, m, args, disabled, disabledFunctions));
                    continue EXPANSION;
                }
                /* A function-like macro name without arguments is ordinary. */
            }

            m = macros.getObjectMacro(name);
            if (m != null && !disabled.contains(name)) {
                if (debug)
                    LOG.debug("Expanding " + m);
                expansion.addAll(expand(m.getTokens(), disabled.plus(name), disabledFunctions));
            } else {
                expansion.add(tok);
            }
            i++;
        }
        return expansion;
    }

    /**
     * Collects the arguments of an invocation whose '(' is at
     * {@code open}, splitting on top-level commas.
     *
     * @return the index following the closing ')'.
     */
    private int arguments(@Nonnull Token name, @Nonnull List<Token> tokens, int open,
            @Nonnull List<List<Token>> args)
            throws ParseException {
        List<Token> arg = new ArrayList<Token>();
        int depth = 0;
        for (int i = open + 1; i < tokens.size(); i++) {
            Token tok = tokens.get(i);
            if (tok.getType() == TokenType.PUNCTUATOR) {
                String text = tok.getText();
                if ("(".equals(text)) {
                    depth++;
                } else if (")".equals(text)) {
                    if (depth == 0) {
                        args.add(trim(arg));
                        return i + 1;
                    }
                    depth--;
                } else if (",".equals(text) && depth == 0) {
                    args.add(trim(arg));
                    arg = new ArrayList<Token>();
                    continue;
                }
            }
            /* An invocation may span lines; the newline acts as a space. */
            if (tok.getType() == TokenType.NEWLINE)
                tok = Token.space.at(tok.getLine(), tok.getColumn());
            arg.add(tok);
        }
        throw new ParseException(name, "Unterminated argument list for macro " + name.getText());
    }

    @Nonnull
    private List<Token> invoke(@Nonnull Token name, @Nonnull Macro m, @Nonnull List<List<Token>> args,
            @Nonnull PSet<String> disabled, @Nonnull PSet<String> disabledFunctions)
            throws ParseException {
        List<String> params = m.getArgs();
        /* M() supplies one empty argument, which is no argument at all for a
         * macro without parameters. */
        if (params.isEmpty() && args.size() == 1 && args.get(0).isEmpty())
            args = Collections.emptyList();
        if (args.size() != params.size()) {
            throw new ParseException(name,
                    "macro " + m.getName()
                    + " has " + params.size() + " parameters "
                    + "but given " + args.size() + " args");
        }

        if (debug)
            LOG.debug("Expanding " + m + " with " + args);

        PSet<String> guard = disabledFunctions.plus(m.getName());
        List<List<Token>> expanded = new ArrayList<List<Token>>(args.size());
        for (List<Token> arg : args)
            expanded.add(expand(arg, disabled, guard));

        List<Token> body = new ArrayList<Token>();
        for (Token tok : m.getTokens()) {
            int idx = tok.getType() == TokenType.IDENTIFIER ? params.indexOf(tok.getText()) : -1;
            if (idx == -1)
                body.add(tok);
            else
                body.addAll(expanded.get(idx));
        }
        return expand(body, disabled, guard);
    }

    /* Strips leading and trailing whitespace from an argument. */
    @Nonnull
    private static List<Token> trim(@Nonnull List<Token> arg) {
        int start = 0;
        int end = arg.size();
        while (start < end && arg.get(start).isWhite())
            start++;
        while (end > start && arg.get(end - 1).isWhite())
            end--;
        return new ArrayList<Token>(arg.subList(start, end));
    }

    private static boolean isSpace(@Nonnull Token tok) {
        return tok.isWhite() || tok.getType() == TokenType.NEWLINE;
    }
}
