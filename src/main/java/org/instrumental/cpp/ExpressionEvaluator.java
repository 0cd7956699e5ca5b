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
import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates the condition of an #if or #elif directive.
 *
 * The evaluator is a small precedence-climbing interpreter over
 * {@code long} values. It understands integer and character constants,
 * parentheses, the unary operators {@code + - ~ !}, the usual binary
 * operators and {@code ?:}. Identifiers left over after macro expansion
 * count as 0, with a warning.
 */
/* pp */ class ExpressionEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private final Preprocessor pp;
    private final MacroTable macros;
    private final MacroExpander expander;

    private List<Token> tokens;
    private int index;
    @CheckForNull
    private Token last;

    /* pp */ ExpressionEvaluator(@Nonnull Preprocessor pp, @Nonnull MacroTable macros, @Nonnull MacroExpander expander) {
        this.pp = pp;
        this.macros = macros;
        this.expander = expander;
    }

    /**
     * Evaluates the tokens following {@code #if} or {@code #elif}.
     *
     * @param directive the directive token, for error positions.
     * @param line the rest of the directive line.
     */
    /* pp */ boolean evaluate(@Nonnull Token directive, @Nonnull List<Token> line)
            throws LexerException {
        /* defined() must see the names before expansion replaces them. */
        List<Token> expanded = expander.expand(resolveDefined(line));
        tokens = new ArrayList<Token>();
        for (Token tok : resolveDefined(expanded))
            if (!tok.isWhite() && tok.getType() != TokenType.NEWLINE)
                tokens.add(tok);
        index = 0;
        last = directive;

        if (tokens.isEmpty())
            throw new ParseException(directive, "#" + directive.getText() + " with no expression");
        long value = expr(0, true);
        if (index < tokens.size()) {
            Token tok = tokens.get(index);
            throw new ParseException(tok, "Bad token in expression: " + tok.getText());
        }
        if (pp.getFeature(Feature.DEBUG))
            LOG.debug("#" + directive.getText() + " " + tokens + " => " + value);
        return value != 0;
    }

    /* Replaces defined X and defined(X) with 1 or 0. */
    @Nonnull
    private List<Token> resolveDefined(@Nonnull List<Token> line)
            throws ParseException {
        List<Token> out = new ArrayList<Token>(line.size());
        for (int i = 0; i < line.size(); i++) {
            Token tok = line.get(i);
            if (tok.getType() != TokenType.DEFINED) {
                out.add(tok);
                continue;
            }
            int j = skipWhite(line, i + 1);
            boolean paren = j < line.size() && line.get(j).isPunctuator("(");
            if (paren)
                j = skipWhite(line, j + 1);
            if (j >= line.size() || line.get(j).getType() != TokenType.IDENTIFIER) {
                Token bad = j < line.size() ? line.get(j) : tok;
                throw new ParseException(bad, "Need either '(' or identifier after `defined`");
            }
            Token name = line.get(j);
            if (paren) {
                j = skipWhite(line, j + 1);
                if (j >= line.size() || !line.get(j).isPunctuator(")")) {
                    Token bad = j < line.size() ? line.get(j) : name;
                    throw new ParseException(bad, "Missing ) in defined()");
                }
            }
            String value = macros.isDefined(name.getText()) ? "1" : "0";
            out.add(new Token(TokenType.NUMBER, value, tok.getLine(), tok.getColumn()));
            i = j;
        }
        return out;
    }

    private static int skipWhite(@Nonnull List<Token> line, int i) {
        while (i < line.size() && line.get(i).isWhite())
            i++;
        return i;
    }

    @CheckForNull
    private Token peek() {
        if (index < tokens.size())
            return tokens.get(index);
        return null;
    }

    @Nonnull
    private Token next()
            throws ParseException {
        if (index >= tokens.size())
            throw new ParseException(last, "Unexpected end of expression");
        last = tokens.get(index++);
        return last;
    }

    private static int priority(@CheckForNull Token op) {
        if (op == null || op.getType() != TokenType.PUNCTUATOR)
            return 0;
        String text = op.getText();
        switch (text) {
            case "/":
            case "%":
            case "*":
                return 11;
            case "+":
            case "-":
                return 10;
            case "<<":
            case ">>":
                return 9;
            case "<":
            case ">":
            case "<=":
            case ">=":
                return 8;
            case "==":
            case "!=":
                return 7;
            case "&":
                return 6;
            case "^":
                return 5;
            case "|":
                return 4;
            case "&&":
                return 3;
            case "||":
                return 2;
            case "?":
                return 1;
            default:
                return 0;
        }
    }

    /*
     * 'live' is false inside the unevaluated operand of && || or ?:,
     * where division by zero is not an error.
     */
    private long expr(int priority, boolean live)
            throws LexerException {
        long lhs = primary(live);

        for (;;) {
            Token op = peek();
            int pri = priority(op);	/* 0 if not a binop. */
            if (pri == 0 || priority >= pri)
                break;
            next();

            String text = op.getText();
            if ("?".equals(text)) {
                long whenTrue = expr(0, live && lhs != 0);
                Token colon = next();
                if (!colon.isPunctuator(":"))
                    throw new ParseException(colon, "Missing : in conditional expression. Got " + colon.getText());
                /* Right associative. */
                long whenFalse = expr(0, live && lhs == 0);
                lhs = lhs != 0 ? whenTrue : whenFalse;
                continue;
            }
            if ("&&".equals(text)) {
                long rhs = expr(pri, live && lhs != 0);
                lhs = (lhs != 0) && (rhs != 0) ? 1 : 0;
                continue;
            }
            if ("||".equals(text)) {
                long rhs = expr(pri, live && lhs == 0);
                lhs = (lhs != 0) || (rhs != 0) ? 1 : 0;
                continue;
            }

            long rhs = expr(pri, live);
            switch (text) {
                case "/":
                    if (rhs == 0) {
                        if (live)
                            throw new ParseException(op, "Division by zero");
                        lhs = 0;
                    } else {
                        lhs = lhs / rhs;
                    }
                    break;
                case "%":
                    if (rhs == 0) {
                        if (live)
                            throw new ParseException(op, "Modulus by zero");
                        lhs = 0;
                    } else {
                        lhs = lhs % rhs;
                    }
                    break;
                case "*":
                    lhs = lhs * rhs;
                    break;
                case "+":
                    lhs = lhs + rhs;
                    break;
                case "-":
                    lhs = lhs - rhs;
                    break;
                case "<":
                    lhs = lhs < rhs ? 1 : 0;
                    break;
                case ">":
                    lhs = lhs > rhs ? 1 : 0;
                    break;
                case "&":
                    lhs = lhs & rhs;
                    break;
                case "^":
                    lhs = lhs ^ rhs;
                    break;
                case "|":
                    lhs = lhs | rhs;
                    break;
                case "<<":
                    lhs = lhs << rhs;
                    break;
                case ">>":
                    lhs = lhs >> rhs;
                    break;
                case "<=":
                    lhs = lhs <= rhs ? 1 : 0;
                    break;
                case ">=":
                    lhs = lhs >= rhs ? 1 : 0;
                    break;
                case "==":
                    lhs = lhs == rhs ? 1 : 0;
                    break;
                case "!=":
                    lhs = lhs != rhs ? 1 : 0;
                    break;
                default:
                    throw new InternalException("Unexpected operator " + text);
            }
        }
        return lhs;
    }

    private long primary(boolean live)
            throws LexerException {
        Token tok = next();
        switch (tok.getType()) {
            case PUNCTUATOR: {
                String text = tok.getText();
                switch (text) {
                    case "(": {
                        long value = expr(0, live);
                        Token close = next();
                        if (!close.isPunctuator(")"))
                            throw new ParseException(close, "Missing ) in expression. Got " + close.getText());
                        return value;
                    }
                    case "~":
                        return ~primary(live);
                    case "!":
                        return primary(live) == 0 ? 1 : 0;
                    case "-":
                        return -primary(live);
                    case "+":
                        return primary(live);
                    default:
                        throw new ParseException(tok, "Bad token in expression: " + text);
                }
            }
            case NUMBER:
                if (CLiterals.isFloating(tok.getText()))
                    throw new ParseException(tok, "Floating constant in preprocessor expression");
                try {
                    return CLiterals.parseInteger(tok.getText());
                } catch (NumberFormatException e) {
                    throw new ParseException(tok, "Bad number in expression: " + tok.getText());
                }
            case CHARACTER:
                try {
                    return CLiterals.parseCharacter(tok.getText());
                } catch (NumberFormatException e) {
                    throw new ParseException(tok, e.getMessage());
                }
            case IDENTIFIER:
                if (pp.getWarning(Warning.UNDEF))
                    pp.warning(tok, "Undefined identifier " + tok.getText()
                            + " in expression, treating as 0");
                return 0;
            default:
                throw new ParseException(tok, "Bad token in expression: " + tok.getText());
        }
    }
}
