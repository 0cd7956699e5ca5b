package org.instrumental.cpp;

import java.util.ArrayList;
import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * Parses the body of a macro as a C constant expression.
 *
 * The grammar covers literals (adjacent string literals are joined),
 * identifiers, calls, parentheses, casts to primitive types,
 * {@code sizeof(type)}, the unary operators {@code + - ~ !}, the
 * arithmetic, shift, relational, bitwise and logical binary operators,
 * and {@code ?:}. Anything with side effects or more than one
 * expression is rejected.
 */
public class CExpressionParser {

    private List<Token> tokens;
    private int index;

    /**
     * Parses the given source text.
     */
    @Nonnull
    public CExpression parse(@Nonnull String text)
            throws ConvertException {
        List<Token> lexed;
        try {
            lexed = new Lexer().lex(text);
        } catch (LexerException e) {
            throw new ConvertException(e.getMessage(), e);
        }
        return parse(lexed);
    }

    /**
     * Parses the given tokens, ignoring whitespace, comments and
     * newlines.
     *
     * @throws ConvertException if the tokens are not exactly one
     * supported constant expression.
     */
    @Nonnull
    public CExpression parse(@Nonnull List<Token> input)
            throws ConvertException {
        tokens = new ArrayList<Token>();
        for (Token tok : input) {
            if (tok.isWhite() || tok.getType() == TokenType.NEWLINE)
                continue;
            if (tok.isPunctuator(";"))
                throw new ConvertException("Only expressions are supported, not statements");
            tokens.add(tok);
        }
        index = 0;
        if (tokens.isEmpty())
            throw new ConvertException("Empty expression");

        CExpression e = expr(0);
        Token tok = peek();
        if (tok != null)
            throw new ConvertException(unsupported(tok));
        return e;
    }

    @CheckForNull
    private Token peek() {
        return peek(0);
    }

    @CheckForNull
    private Token peek(int offset) {
        int i = index + offset;
        if (i < tokens.size())
            return tokens.get(i);
        return null;
    }

    @Nonnull
    private Token next()
            throws ConvertException {
        if (index >= tokens.size())
            throw new ConvertException("Unexpected end of expression");
        return tokens.get(index++);
    }

    private void expect(@Nonnull String punctuator)
            throws ConvertException {
        Token tok = next();
        if (!tok.isPunctuator(punctuator))
            throw new ConvertException("Expected '" + punctuator + "', got '" + tok.getText() + "'");
    }

    @Nonnull
    private static String unsupported(@Nonnull Token tok) {
        switch (tok.getText()) {
            case "=":
            case "+=":
            case "-=":
            case "*=":
            case "/=":
            case "%=":
            case "&=":
            case "|=":
            case "^=":
            case "<<=":
            case ">>=":
                return "Assignment is not supported";
            case "++":
            case "--":
                return "Increment and decrement are not supported";
            case ".":
            case "->":
                return "Member access is not supported";
            case ",":
                return "The comma operator is not supported";
            case "[":
                return "Subscripts are not supported";
            default:
                return "Unexpected token '" + tok.getText() + "'";
        }
    }

    private static int priority(@CheckForNull Token op) {
        if (op == null || op.getType() != TokenType.PUNCTUATOR)
            return 0;
        switch (op.getText()) {
            case "*":
            case "/":
            case "%":
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

    @Nonnull
    private CExpression expr(int priority)
            throws ConvertException {
        CExpression lhs = unary();
        for (;;) {
            Token op = peek();
            int pri = priority(op);
            if (pri == 0 || priority >= pri)
                return lhs;
            next();
            if (op.isPunctuator("?")) {
                CExpression ifTrue = expr(0);
                expect(":");
                /* Right associative. */
                CExpression ifFalse = expr(0);
                lhs = new CExpression.Conditional(lhs, ifTrue, ifFalse);
            } else {
                lhs = new CExpression.Binary(op.getText(), lhs, expr(pri));
            }
        }
    }

    @Nonnull
    private CExpression unary()
            throws ConvertException {
        Token tok = next();
        if (tok.getType() == TokenType.PUNCTUATOR) {
            switch (tok.getText()) {
                case "+":
                case "-":
                case "~":
                case "!":
                    return new CExpression.Unary(tok.getText(), unary());
                case "*":
                    throw new ConvertException("Dereference is not supported");
                case "&":
                    throw new ConvertException("Address-of is not supported");
                case "(": {
                    CType type = castType();
                    if (type != null)
                        return new CExpression.Cast(type, unary());
                    CExpression e = expr(0);
                    expect(")");
                    return e;
                }
                default:
                    throw new ConvertException(unsupported(tok));
            }
        }
        if (tok.getType() == TokenType.IDENTIFIER && "sizeof".equals(tok.getText())) {
            Token open = next();
            CType type = open.isPunctuator("(") ? castType() : null;
            if (type == null)
                throw new ConvertException("sizeof is only supported for primitive types");
            return new CExpression.SizeOf(type);
        }
        return primary(tok);
    }

    /*
     * Called after '('. If a primitive type name and ')' follow, consumes
     * them and returns the type; otherwise consumes nothing.
     */
    @CheckForNull
    private CType castType()
            throws ConvertException {
        List<String> words = new ArrayList<String>();
        int i = 0;
        for (;;) {
            Token tok = peek(i);
            if (tok == null)
                return null;
            if (tok.getType() == TokenType.IDENTIFIER && CType.isTypeWord(tok.getText())) {
                words.add(tok.getText());
                i++;
                continue;
            }
            if (words.isEmpty())
                return null;
            if (tok.isPunctuator("*"))
                throw new ConvertException("Pointer casts are not supported");
            if (!tok.isPunctuator(")"))
                return null;
            break;
        }
        CType type = CType.forWords(words);
        if (type == null)
            throw new ConvertException("Unsupported type " + words);
        index += i + 1;
        return type;
    }

    @Nonnull
    private CExpression primary(@Nonnull Token tok)
            throws ConvertException {
        switch (tok.getType()) {
            case NUMBER:
                try {
                    if (CLiterals.isFloating(tok.getText()))
                        return new CExpression.Literal(CExpression.Literal.Kind.FLOATING, tok.getText(),
                                Double.valueOf(CLiterals.parseFloating(tok.getText())));
                    return new CExpression.Literal(CExpression.Literal.Kind.INTEGER, tok.getText(),
                            Long.valueOf(CLiterals.parseInteger(tok.getText())));
                } catch (NumberFormatException e) {
                    throw new ConvertException("Bad number " + tok.getText(), e);
                }
            case CHARACTER:
                try {
                    return new CExpression.Literal(CExpression.Literal.Kind.CHARACTER, tok.getText(),
                            Long.valueOf(CLiterals.parseCharacter(tok.getText())));
                } catch (NumberFormatException e) {
                    throw new ConvertException(e.getMessage(), e);
                }
            case STRING: {
                StringBuilder text = new StringBuilder(tok.getText());
                StringBuilder value = new StringBuilder(CLiterals.parseString(tok.getText()));
                for (Token la = peek(); la != null && la.getType() == TokenType.STRING; la = peek()) {
                    next();
                    text.append(' ').append(la.getText());
                    value.append(CLiterals.parseString(la.getText()));
                }
                return new CExpression.Literal(CExpression.Literal.Kind.STRING, text.toString(), value.toString());
            }
            case IDENTIFIER: {
                Token la = peek();
                if (la == null || !la.isPunctuator("("))
                    return new CExpression.Identifier(tok.getText());
                next();
                List<CExpression> args = new ArrayList<CExpression>();
                la = peek();
                if (la != null && la.isPunctuator(")")) {
                    next();
                } else {
                    for (;;) {
                        args.add(expr(0));
                        Token sep = next();
                        if (sep.isPunctuator(")"))
                            break;
                        if (!sep.isPunctuator(","))
                            throw new ConvertException(unsupported(sep));
                    }
                }
                return new CExpression.Call(tok.getText(), args);
            }
            case DEFINED:
                throw new ConvertException("'defined' is only valid in #if");
            default:
                throw new ConvertException(unsupported(tok));
        }
    }
}
