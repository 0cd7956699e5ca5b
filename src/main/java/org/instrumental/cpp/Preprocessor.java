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
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.Stack;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A C preprocessor for a single header.
 *
 * The Preprocessor consumes the token stream of one header a logical
 * line at a time. Directives maintain the conditional-compilation
 * state and the macro table; code lines are macro-expanded and, unless
 * they lie in a skipped block, appended to the output through the
 * platform replacement rules.
 *
 * Includes are not followed: #include, #pragma and #line are consumed
 * and dropped.
 *
 * A Preprocessor is single-use and not thread-safe.
 *
 * @see TokenWriter
 * @see MacroTranslator
 */
public class Preprocessor {

    private static final Logger LOG = LoggerFactory.getLogger(Preprocessor.class);

    private final Lexer lexer;
    private final MacroTable macros;
    private final MacroExpander expander;
    private final ExpressionEvaluator evaluator;
    private final Stack<State> states;
    private final Set<Feature> features;
    private final Set<Warning> warnings;
    private List<ReplacementRule> rules;
    @CheckForNull
    private PreprocessorListener listener;

    /* Input. */
    private List<Token> tokens;
    private int index;
    private int totalLines;

    /* Output. */
    private final List<Token> out;
    /* The raw tokens of the directive being processed. */
    private List<Token> outLine;

    public Preprocessor() {
        this.lexer = new Lexer();
        this.macros = new MacroTable();
        this.expander = new MacroExpander(macros);
        this.evaluator = new ExpressionEvaluator(this, macros, expander);
        this.states = new Stack<State>();
        states.push(new State());
        this.features = EnumSet.of(Feature.EXPAND_MACRO_BODIES);
        this.warnings = EnumSet.of(Warning.UNDEF, Warning.DIRECTIVE);
        this.rules = Platform.current().getReplacementRules();
        this.tokens = Collections.emptyList();
        this.out = new ArrayList<Token>();
        this.outLine = new ArrayList<Token>();
    }

    public Preprocessor(@Nonnull String input)
            throws LexerException {
        this();
        addInput(input);
    }

    /**
     * Sets the PreprocessorListener which handles events for
     * this Preprocessor.
     *
     * The listener is notified of warnings, errors and progress.
     */
    public void setListener(@CheckForNull PreprocessorListener listener) {
        this.listener = listener;
    }

    @CheckForNull
    public PreprocessorListener getListener() {
        return listener;
    }

    /**
     * Returns the feature-set for this Preprocessor.
     *
     * This set may be freely modified by user code.
     */
    @Nonnull
    public Set<Feature> getFeatures() {
        return features;
    }

    /**
     * Adds a feature to the feature-set of this Preprocessor.
     */
    public void addFeature(@Nonnull Feature f) {
        features.add(f);
    }

    /**
     * Adds features to the feature-set of this Preprocessor.
     */
    public void addFeatures(@Nonnull Collection<Feature> f) {
        features.addAll(f);
    }

    /**
     * Adds features to the feature-set of this Preprocessor.
     */
    public void addFeatures(Feature... f) {
        addFeatures(Arrays.asList(f));
    }

    /**
     * Returns true if the given feature is in
     * the feature-set of this Preprocessor.
     */
    public boolean getFeature(@Nonnull Feature f) {
        return features.contains(f);
    }

    /**
     * Returns the warning-set for this Preprocessor.
     *
     * This set may be freely modified by user code.
     */
    @Nonnull
    public Set<Warning> getWarnings() {
        return warnings;
    }

    /**
     * Adds a warning to the warning-set of this Preprocessor.
     */
    public void addWarning(@Nonnull Warning w) {
        warnings.add(w);
    }

    /**
     * Adds warnings to the warning-set of this Preprocessor.
     */
    public void addWarnings(@Nonnull Collection<Warning> w) {
        warnings.addAll(w);
    }

    /**
     * Returns true if the given warning is in
     * the warning-set of this Preprocessor.
     */
    public boolean getWarning(@Nonnull Warning w) {
        return warnings.contains(w);
    }

    /**
     * Sets the rules applied to the output as tokens are appended.
     *
     * The default is the rule set of {@link Platform#current()}.
     */
    public void setReplacementRules(@Nonnull List<ReplacementRule> rules) {
        this.rules = new ArrayList<ReplacementRule>(rules);
    }

    @Nonnull
    public List<ReplacementRule> getReplacementRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Sets the header text to be processed.
     *
     * @throws LexerException if the text cannot be lexed.
     */
    public void addInput(@Nonnull String text)
            throws LexerException {
        addInput(lexer.lex(text));
    }

    /**
     * Sets the tokens of the header to be processed.
     */
    public void addInput(@Nonnull List<Token> tokens) {
        this.tokens = new ArrayList<Token>(tokens);
        this.index = 0;
        this.totalLines = tokens.isEmpty() ? 0 : Math.max(0, tokens.get(tokens.size() - 1).getLine());
    }

    /**
     * Handles an error.
     *
     * If a PreprocessorListener is installed, it receives the
     * error. Otherwise, an exception is thrown.
     */
    protected void error(int line, int column, @Nonnull String msg)
            throws LexerException {
        if (listener != null)
            listener.handleError(line, column, msg);
        else
            throw new ParseException(line, column, msg);
    }

    /**
     * Handles an error.
     *
     * If a PreprocessorListener is installed, it receives the
     * error. Otherwise, an exception is thrown.
     *
     * @see #error(int, int, String)
     */
    protected void error(@Nonnull Token tok, @Nonnull String msg)
            throws LexerException {
        error(tok.getLine(), tok.getColumn(), msg);
    }

    /**
     * Handles a warning.
     *
     * If a PreprocessorListener is installed, it receives the
     * warning. Otherwise, the warning is logged.
     */
    protected void warning(int line, int column, @Nonnull String msg)
            throws LexerException {
        if (warnings.contains(Warning.ERROR))
            error(line, column, msg);
        else if (listener != null)
            listener.handleWarning(line, column, msg);
        else
            LOG.warn(line + ":" + column + ": warning: " + msg);
    }

    /**
     * Handles a warning.
     *
     * @see #warning(int, int, String)
     */
    protected void warning(@Nonnull Token tok, @Nonnull String msg)
            throws LexerException {
        warning(tok.getLine(), tok.getColumn(), msg);
    }

    /**
     * Adds a Macro to this Preprocessor.
     *
     * @throws LexerException if the definition is illegal.
     */
    public void addMacro(@Nonnull Macro m)
            throws LexerException {
        if ("defined".equals(m.getName()))
            throw new LexerException("Cannot redefine name 'defined'");
        macros.define(m);
    }

    /**
     * Defines the given name as a macro.
     *
     * The String value is lexed into a token stream, which is
     * used as the macro expansion.
     *
     * @throws LexerException if the definition fails or is otherwise illegal.
     */
    public void addMacro(@Nonnull String name, @Nonnull String value)
            throws LexerException {
        List<Token> body = new ArrayList<Token>();
        for (Token tok : lexer.lex(value))
            if (tok.getType() != TokenType.NEWLINE)
                body.add(tok);
        addMacro(Macro.object(new Token(TokenType.IDENTIFIER, name), trim(body)));
    }

    /**
     * Defines the given name as a macro, with the value <code>1</code>.
     *
     * This is a convenience method, and is equivalent to
     * <code>addMacro(name, "1")</code>.
     *
     * @throws LexerException if the definition fails or is otherwise illegal.
     */
    public void addMacro(@Nonnull String name)
            throws LexerException {
        addMacro(name, "1");
    }

    /**
     * Returns the macro table of this Preprocessor.
     */
    @Nonnull
    public MacroTable getMacros() {
        return macros;
    }

    /**
     * Returns the named macro, or null if it is not currently defined.
     */
    @CheckForNull
    public Macro getMacro(@Nonnull String name) {
        return macros.getMacro(name);
    }

    @Nonnull
    /* pp */ MacroExpander getExpander() {
        return expander;
    }

    /**
     * Returns the output tokens produced so far.
     */
    @Nonnull
    public List<Token> getOutput() {
        return Collections.unmodifiableList(out);
    }

    /**
     * Processes the whole input.
     *
     * @throws LexerException if the header is malformed.
     */
    public void process()
            throws LexerException {
        expander.setDebug(getFeature(Feature.DEBUG));
        try {
            for (;;) {
                line();
                if (listener != null && index > 0)
                    listener.handleProgress(tokens.get(index - 1).getLine(), totalLines);
            }
        } catch (EndOfStreamException e) {
            /* Done. */
        }

        if (states.size() > 1) {
            Token opener = states.peek().getOpener();
            error(opener, "Unterminated conditional #" + opener.getText());
        }
        if (getFeature(Feature.DEBUG))
            LOG.debug("Processed " + totalLines + " lines; macros:\n" + macros);
    }

    /* Processes the given text and returns the output tokens. */
    @Nonnull
    public List<Token> process(@Nonnull String text)
            throws LexerException {
        addInput(text);
        process();
        return getOutput();
    }

    /* State machine. */

    private boolean isActive() {
        State state = states.peek();
        return state.isParentActive() && state.isActive();
    }

    private void push_state(@Nonnull Token opener, boolean condition) {
        State top = states.peek();
        states.push(new State(top, opener, condition));
        if (getFeature(Feature.DEBUG))
            LOG.debug("push_state(" + opener.getText() + ") -> " + states.peek());
    }

    /* Token source. */

    /* Returns the next token of the input, or null at the end. */
    @CheckForNull
    private Token source_token() {
        if (index >= tokens.size())
            return null;
        Token tok = tokens.get(index++);
        outLine.add(tok);
        return tok;
    }

    @CheckForNull
    private Token source_peek() {
        if (index >= tokens.size())
            return null;
        return tokens.get(index);
    }

    /* Skips whitespace and comments, but not newlines. */
    @CheckForNull
    private Token source_token_nonwhite() {
        Token tok;
        do {
            tok = source_token();
        } while (tok != null && tok.isWhite());
        return tok;
    }

    private static boolean isEndOfLine(@CheckForNull Token tok) {
        return tok == null || tok.getType() == TokenType.NEWLINE;
    }

    /* Consumes the rest of the line, returning it without the newline. */
    @Nonnull
    private List<Token> source_rest_of_line() {
        List<Token> line = new ArrayList<Token>();
        for (;;) {
            Token tok = source_token();
            if (isEndOfLine(tok))
                return line;
            line.add(tok);
        }
    }

    /* Consumes the rest of the line, which may contain only whitespace. */
    private void source_skipline_empty()
            throws LexerException {
        for (;;) {
            Token tok = source_token();
            if (isEndOfLine(tok))
                return;
            if (!tok.isWhite()) {
                error(tok, "Rest of line should be devoid of any tokens, found " + tok.getText());
                source_rest_of_line();
                return;
            }
        }
    }

    /* Output. */

    private void append(@Nonnull Token tok) {
        out.add(tok);
        if (tok.isWhite() || tok.getType() == TokenType.NEWLINE)
            return;
        for (ReplacementRule rule : rules) {
            if (rule.apply(out)) {
                if (getFeature(Feature.DEBUG))
                    LOG.debug("Applied replacement " + rule);
                break;
            }
        }
    }

    private void appendAll(@Nonnull List<Token> toks) {
        for (Token tok : toks)
            append(tok);
    }

    /* Processes one logical line. */
    private void line()
            throws LexerException {
        outLine = new ArrayList<Token>();
        Token tok = source_token_nonwhite();
        if (tok == null) {
            if (isActive())
                appendAll(outLine);
            throw new EndOfStreamException();
        }

        if (tok.getType() == TokenType.NEWLINE) {
            if (isActive())
                appendAll(outLine);
        } else if (tok.isPunctuator("#")) {
            directive();
        } else {
            code(tok);
        }
    }

    /*
     * A code line. The line is extended while a function-like macro
     * invocation is open, so arguments may span lines.
     */
    private void code(@Nonnull Token first)
            throws LexerException {
        if (!isActive()) {
            source_rest_of_line();
            return;
        }

        List<Token> chunk = new ArrayList<Token>(outLine);
        Token tok = first;
        Token invocation = null;
        int depth = 0;
        LINE:
        for (;;) {
            if (invocation != null) {
                if (tok.isPunctuator("(")) {
                    depth++;
                } else if (tok.isPunctuator(")")) {
                    if (--depth == 0)
                        invocation = null;
                }
            } else if (tok.getType() == TokenType.NEWLINE) {
                break LINE;
            } else if (tok.getType() == TokenType.IDENTIFIER
                    && macros.getFunctionMacro(tok.getText()) != null) {
                /* Open an invocation if '(' follows on this line. */
                int i = index;
                while (i < tokens.size() && tokens.get(i).isWhite())
                    i++;
                if (i < tokens.size() && tokens.get(i).isPunctuator("("))
                    invocation = tok;
            }

            tok = source_token();
            if (tok == null) {
                if (invocation != null)
                    throw new ParseException(invocation,
                            "Unterminated argument list for macro " + invocation.getText());
                break LINE;
            }
            chunk.add(tok);
        }

        for (Token t : expander.expand(chunk))
            append(t);
    }

    private void directive()
            throws LexerException {
        Token tok = source_token_nonwhite();
        if (isEndOfLine(tok))
            return;     /* The null directive. */

        PreprocessorCommand ppcmd = null;
        if (tok.getType() == TokenType.IDENTIFIER)
            ppcmd = PreprocessorCommand.forText(tok.getText());
        if (ppcmd == null) {
            if (isActive())
                error(tok, "Unknown preprocessor directive " + tok.getText());
            source_rest_of_line();
            return;
        }

        switch (ppcmd) {
            case PP_DEFINE:
                if (!isActive()) {
                    source_rest_of_line();
                } else {
                    define(tok);
                    keep();
                }
                break;

            case PP_UNDEF:
                if (!isActive()) {
                    source_rest_of_line();
                } else {
                    undef(tok);
                    keep();
                }
                break;

            case PP_INCLUDE:
            case PP_PRAGMA:
            case PP_LINE:
                source_rest_of_line();
                break;

            case PP_ERROR: {
                List<Token> text = source_rest_of_line();
                if (isActive())
                    error(tok, "#error " + text(trim(text)));
                break;
            }

            case PP_WARNING: {
                List<Token> text = source_rest_of_line();
                if (isActive() && getWarning(Warning.DIRECTIVE))
                    warning(tok, "#warning " + text(trim(text)));
                break;
            }

            case PP_IF: {
                List<Token> expr = source_rest_of_line();
                if (!isActive())
                    push_state(tok, false);
                else
                    push_state(tok, evaluator.evaluate(tok, expr));
                break;
            }

            case PP_ELIF: {
                List<Token> expr = source_rest_of_line();
                State state = states.peek();
                if (states.size() == 1) {
                    error(tok, "#elif without #if");
                } else if (state.sawElse()) {
                    error(tok, "#elif after #else");
                } else if (!state.isParentActive() || state.isTaken()) {
                    /* Some branch was live; this one cannot be. */
                    replaceState(state.withElif(false));
                } else {
                    replaceState(state.withElif(evaluator.evaluate(tok, expr)));
                }
                break;
            }

            case PP_ELSE: {
                State state = states.peek();
                if (states.size() == 1)
                    error(tok, "#else without #if");
                else if (state.sawElse())
                    error(tok, "#else after #else");
                else
                    replaceState(state.withElse());
                source_skipline_empty();
                break;
            }

            case PP_IFDEF:
            case PP_IFNDEF: {
                if (!isActive()) {
                    source_rest_of_line();
                    push_state(tok, false);
                    break;
                }
                Token name = source_token_nonwhite();
                if (isEndOfLine(name) || name.getType() != TokenType.IDENTIFIER) {
                    error(name == null ? tok : name,
                            "Expected identifier after #" + tok.getText());
                    if (!isEndOfLine(name))
                        source_rest_of_line();
                    /* Keep the nesting balanced for the matching #endif. */
                    push_state(tok, false);
                    break;
                }
                boolean defined = macros.isDefined(name.getText());
                push_state(tok, ppcmd == PreprocessorCommand.PP_IFDEF ? defined : !defined);
                source_skipline_empty();
                break;
            }

            case PP_ENDIF:
                if (states.size() == 1)
                    error(tok, "#endif without #if");
                else
                    states.pop();
                source_skipline_empty();
                break;

            default:
                throw new InternalException("Unhandled preprocessor command " + ppcmd);
        }
    }

    private void replaceState(@Nonnull State state) {
        states.pop();
        states.push(state);
        if (getFeature(Feature.DEBUG))
            LOG.debug("state -> " + state);
    }

    /* Copies the current #define or #undef line to the output. */
    private void keep() {
        if (!getFeature(Feature.KEEP_DEFINES))
            return;
        appendAll(outLine);
        if (outLine.isEmpty() || outLine.get(outLine.size() - 1).getType() != TokenType.NEWLINE)
            append(Token.newline);
    }

    /* processes a #define directive */
    private void define(@Nonnull Token directive)
            throws LexerException {
        Token tok = source_token_nonwhite();
        if (isEndOfLine(tok) || tok.getType() != TokenType.IDENTIFIER) {
            if (tok != null && tok.getType() == TokenType.DEFINED) {
                error(tok, "Cannot redefine name 'defined'");
            } else {
                error(tok == null ? directive : tok, "Expected identifier");
            }
            if (!isEndOfLine(tok))
                source_rest_of_line();
            return;
        }
        Token name = tok;

        /* The very next token, with no whitespace, must be '(' for a function-like macro. */
        List<String> args = null;
        Token la = source_peek();
        if (la != null && la.isPunctuator("(")) {
            source_token();
            args = new ArrayList<String>();
            tok = source_token_nonwhite();
            if (tok == null || !tok.isPunctuator(")")) {
                ARGS:
                for (;;) {
                    if (isEndOfLine(tok)) {
                        error(tok == null ? name : tok, "Unterminated macro parameter list");
                        return;
                    }
                    if (tok.getType() != TokenType.IDENTIFIER) {
                        error(tok, "error in macro parameters: " + tok.getText());
                        source_rest_of_line();
                        return;
                    }
                    args.add(tok.getText());
                    tok = source_token_nonwhite();
                    if (isEndOfLine(tok)) {
                        error(tok == null ? name : tok, "Unterminated macro parameters");
                        return;
                    }
                    if (tok.isPunctuator(")"))
                        break ARGS;
                    if (!tok.isPunctuator(",")) {
                        error(tok, "Bad token in macro parameters: " + tok.getText());
                        source_rest_of_line();
                        return;
                    }
                    tok = source_token_nonwhite();
                }
            }
        }

        List<Token> body = trim(source_rest_of_line());
        Macro m = args == null
                ? Macro.object(name, body)
                : Macro.function(name, args, body);
        if (getFeature(Feature.DEBUG))
            LOG.debug("Defined macro " + m);
        macros.define(m);
    }

    /* processes an #undef directive */
    private void undef(@Nonnull Token directive)
            throws LexerException {
        Token tok = source_token_nonwhite();
        if (isEndOfLine(tok) || tok.getType() != TokenType.IDENTIFIER) {
            error(tok == null ? directive : tok,
                    "Expected identifier, not " + (tok == null ? "end of input" : tok.getText()));
            if (!isEndOfLine(tok))
                source_rest_of_line();
            return;
        }
        Macro m = macros.undefine(tok.getText());
        if (m != null && getFeature(Feature.DEBUG))
            LOG.debug("Undefined macro " + m);
        source_skipline_empty();
    }

    /* Strips whitespace and comments from both ends. */
    @Nonnull
    private static List<Token> trim(@Nonnull List<Token> tokens) {
        int start = 0;
        int end = tokens.size();
        while (start < end && tokens.get(start).isWhite())
            start++;
        while (end > start && tokens.get(end - 1).isWhite())
            end--;
        return new ArrayList<Token>(tokens.subList(start, end));
    }

    @Nonnull
    private static String text(@Nonnull List<Token> tokens) {
        StringBuilder buf = new StringBuilder();
        for (Token tok : tokens)
            buf.append(tok.getText());
        return buf.toString();
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        buf.append("Preprocessor at token ").append(index).append(" of ").append(tokens.size());
        buf.append(", conditional depth ").append(states.size() - 1).append('\n');
        buf.append(macros);
        return buf.toString();
    }
}
