package org.instrumental.cpp;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * Translates a {@link CExpression} into a Java expression.
 *
 * The result is fully parenthesized and typed as one of
 * {@link JavaType}. Integers are {@code long}; C truth values are made
 * explicit ({@code x != 0L}) and turned back into integers
 * ({@code b ? 1L : 0L}) where C would use them as numbers. Casts to
 * narrower integral types narrow, and casts to unsigned types mask.
 */
public class JavaSourceGenerator implements CExpression.Visitor<JavaSourceGenerator.JavaExpression> {

    private static final Set<String> RESERVED = new HashSet<String>(Arrays.asList(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch",
            "char", "class", "const", "continue", "default", "do", "double",
            "else", "enum", "extends", "final", "finally", "float", "for",
            "goto", "if", "implements", "import", "instanceof", "int",
            "interface", "long", "native", "new", "package", "private",
            "protected", "public", "return", "short", "static", "strictfp",
            "super", "switch", "synchronized", "this", "throw", "throws",
            "transient", "try", "void", "volatile", "while", "true", "false",
            "null", "var", "record", "yield", "_"));

    /**
     * A Java expression and its type.
     */
    public static class JavaExpression {

        private final String source;
        private final JavaType type;

        public JavaExpression(@Nonnull String source, @Nonnull JavaType type) {
            this.source = source;
            this.type = type;
        }

        @Nonnull
        public String getSource() {
            return source;
        }

        @Nonnull
        public JavaType getType() {
            return type;
        }

        @Override
        public String toString() {
            return source + " : " + type.getJavaName();
        }
    }

    @CheckForNull
    private final String qualifier;
    private final List<String> params;
    private final Map<String, JavaType> types;
    private final Set<String> functions;

    /**
     * @param qualifier the class name to prefix references to other
     * macros with, or null for simple names.
     * @param params the parameters of the macro being translated.
     * @param types the known types of other macros; others are long.
     * @param functions the names of function-like macros, which may
     * only be called.
     */
    public JavaSourceGenerator(@CheckForNull String qualifier, @Nonnull List<String> params,
            @Nonnull Map<String, JavaType> types, @Nonnull Set<String> functions) {
        this.qualifier = qualifier;
        this.params = params;
        this.types = types;
        this.functions = functions;
    }

    public JavaSourceGenerator(@CheckForNull String qualifier, @Nonnull List<String> params,
            @Nonnull Map<String, JavaType> types) {
        this(qualifier, params, types, Collections.<String>emptySet());
    }

    public JavaSourceGenerator() {
        this(null, Collections.<String>emptyList(), Collections.<String, JavaType>emptyMap());
    }

    /**
     * Returns a legal Java identifier for the given C identifier.
     */
    @Nonnull
    public static String javaIdentifier(@Nonnull String name) {
        if (RESERVED.contains(name))
            return name + "_";
        return name;
    }

    @Nonnull
    public JavaExpression generate(@Nonnull CExpression e)
            throws ConvertException {
        return e.accept(this);
    }

    /* Conversions. */

    @Nonnull
    private static String asLong(@Nonnull JavaExpression e, @Nonnull String context)
            throws ConvertException {
        switch (e.getType()) {
            case LONG:
                return e.getSource();
            case BOOLEAN:
                return "(" + e.getSource() + " ? 1L : 0L)";
            default:
                throw new ConvertException("Invalid " + e.getType().getJavaName() + " operand to " + context);
        }
    }

    @Nonnull
    private static String asBoolean(@Nonnull JavaExpression e, @Nonnull String context)
            throws ConvertException {
        switch (e.getType()) {
            case BOOLEAN:
                return e.getSource();
            case LONG:
                return "(" + e.getSource() + " != 0L)";
            case DOUBLE:
                return "(" + e.getSource() + " != 0.0)";
            default:
                throw new ConvertException("Invalid " + e.getType().getJavaName() + " operand to " + context);
        }
    }

    /* A long or double; booleans become long. */
    @Nonnull
    private static JavaExpression asNumber(@Nonnull JavaExpression e, @Nonnull String context)
            throws ConvertException {
        switch (e.getType()) {
            case LONG:
            case DOUBLE:
                return e;
            case BOOLEAN:
                return new JavaExpression(asLong(e, context), JavaType.LONG);
            default:
                throw new ConvertException("Invalid " + e.getType().getJavaName() + " operand to " + context);
        }
    }

    @Nonnull
    private String qualify(@Nonnull String name) {
        String id = javaIdentifier(name);
        if (qualifier == null)
            return id;
        return qualifier + "." + id;
    }

    @Nonnull
    private JavaType typeOf(@Nonnull String name) {
        JavaType type = types.get(name);
        return type == null ? JavaType.LONG : type;
    }

    /* Visitor. */

    @Override
    public JavaExpression visitLiteral(CExpression.Literal e) {
        switch (e.getKind()) {
            case INTEGER: {
                String digits = CLiterals.stripIntegerSuffix(e.getText());
                long value = ((Long) e.getValue()).longValue();
                if (digits.length() > 1 && digits.charAt(0) == '0')
                    /* Hexadecimal, binary and octal are spelled the same in Java. */
                    return new JavaExpression(digits + "L", JavaType.LONG);
                if (value < 0)
                    return new JavaExpression("0x" + Long.toHexString(value).toUpperCase() + "L", JavaType.LONG);
                return new JavaExpression(value + "L", JavaType.LONG);
            }
            case FLOATING: {
                double value = ((Double) e.getValue()).doubleValue();
                if (Double.isNaN(value))
                    return new JavaExpression("Double.NaN", JavaType.DOUBLE);
                if (Double.isInfinite(value))
                    return new JavaExpression("Double.POSITIVE_INFINITY", JavaType.DOUBLE);
                return new JavaExpression(Double.toString(value), JavaType.DOUBLE);
            }
            case CHARACTER:
                return new JavaExpression(e.getValue() + "L", JavaType.LONG);
            case STRING:
                return new JavaExpression(CLiterals.javaString((String) e.getValue()), JavaType.STRING);
            default:
                throw new InternalException("Unknown literal kind " + e.getKind());
        }
    }

    @Override
    public JavaExpression visitIdentifier(CExpression.Identifier e)
            throws ConvertException {
        String name = e.getName();
        if (params.contains(name))
            return new JavaExpression(javaIdentifier(name), JavaType.LONG);
        if (functions.contains(name))
            throw new ConvertException("Function-like macro " + name + " used without arguments");
        return new JavaExpression(qualify(name), typeOf(name));
    }

    @Override
    public JavaExpression visitUnary(CExpression.Unary e)
            throws ConvertException {
        JavaExpression operand = generate(e.getOperand());
        String op = e.getOp();
        switch (op) {
            case "+": {
                JavaExpression n = asNumber(operand, op);
                return new JavaExpression("(+" + n.getSource() + ")", n.getType());
            }
            case "-": {
                JavaExpression n = asNumber(operand, op);
                return new JavaExpression("(-" + n.getSource() + ")", n.getType());
            }
            case "~":
                return new JavaExpression("(~" + asLong(operand, op) + ")", JavaType.LONG);
            case "!":
                return new JavaExpression("(!" + asBoolean(operand, op) + ")", JavaType.BOOLEAN);
            default:
                throw new ConvertException("Unsupported unary operator '" + op + "'");
        }
    }

    @Override
    public JavaExpression visitBinary(CExpression.Binary e)
            throws ConvertException {
        JavaExpression left = generate(e.getLeft());
        JavaExpression right = generate(e.getRight());
        String op = e.getOp();
        switch (op) {
            case "*":
            case "/":
            case "+":
            case "-":
            case "%": {
                JavaExpression l = asNumber(left, op);
                JavaExpression r = asNumber(right, op);
                JavaType type = l.getType() == JavaType.DOUBLE || r.getType() == JavaType.DOUBLE
                        ? JavaType.DOUBLE : JavaType.LONG;
                if ("%".equals(op) && type == JavaType.DOUBLE)
                    throw new ConvertException("Invalid double operand to %");
                return new JavaExpression("(" + l.getSource() + " " + op + " " + r.getSource() + ")", type);
            }
            case "<<":
            case ">>":
            case "&":
            case "^":
            case "|":
                return new JavaExpression("(" + asLong(left, op) + " " + op + " " + asLong(right, op) + ")",
                        JavaType.LONG);
            case "<":
            case ">":
            case "<=":
            case ">=":
            case "==":
            case "!=":
                return new JavaExpression("(" + asNumber(left, op).getSource() + " " + op + " "
                        + asNumber(right, op).getSource() + ")", JavaType.BOOLEAN);
            case "&&":
            case "||":
                return new JavaExpression("(" + asBoolean(left, op) + " " + op + " " + asBoolean(right, op) + ")",
                        JavaType.BOOLEAN);
            default:
                throw new ConvertException("Unsupported binary operator '" + op + "'");
        }
    }

    @Override
    public JavaExpression visitConditional(CExpression.Conditional e)
            throws ConvertException {
        String condition = asBoolean(generate(e.getCondition()), "?:");
        JavaExpression ifTrue = generate(e.getIfTrue());
        JavaExpression ifFalse = generate(e.getIfFalse());
        JavaType type;
        String t;
        String f;
        if (ifTrue.getType() == ifFalse.getType()) {
            type = ifTrue.getType();
            t = ifTrue.getSource();
            f = ifFalse.getSource();
        } else {
            JavaExpression nt = asNumber(ifTrue, "?:");
            JavaExpression nf = asNumber(ifFalse, "?:");
            type = nt.getType() == JavaType.DOUBLE || nf.getType() == JavaType.DOUBLE
                    ? JavaType.DOUBLE : JavaType.LONG;
            t = nt.getSource();
            f = nf.getSource();
        }
        return new JavaExpression("(" + condition + " ? " + t + " : " + f + ")", type);
    }

    @Override
    public JavaExpression visitCast(CExpression.Cast e)
            throws ConvertException {
        CType type = e.getType();
        String context = "cast to " + type;
        JavaExpression operand = generate(e.getOperand());
        if (type.isBoolean())
            return new JavaExpression("(" + asBoolean(operand, context) + " ? 1L : 0L)", JavaType.LONG);

        JavaExpression n = asNumber(operand, context);
        String src = n.getSource();
        if (type.isFloating()) {
            if (type.getSize() == 4)
                return new JavaExpression("((double) (float) " + src + ")", JavaType.DOUBLE);
            return new JavaExpression("((double) " + src + ")", JavaType.DOUBLE);
        }

        if (n.getType() == JavaType.DOUBLE)
            src = "((long) " + src + ")";
        switch (type.getSize()) {
            case 8:
                return new JavaExpression(src, JavaType.LONG);
            case 4:
                if (type.isUnsigned())
                    return new JavaExpression("(" + src + " & 0xFFFFFFFFL)", JavaType.LONG);
                return new JavaExpression("((long) (int) " + src + ")", JavaType.LONG);
            case 2:
                if (type.isUnsigned())
                    return new JavaExpression("(" + src + " & 0xFFFFL)", JavaType.LONG);
                return new JavaExpression("((long) (short) " + src + ")", JavaType.LONG);
            case 1:
                if (type.isUnsigned())
                    return new JavaExpression("(" + src + " & 0xFFL)", JavaType.LONG);
                return new JavaExpression("((long) (byte) " + src + ")", JavaType.LONG);
            default:
                throw new ConvertException("Unsupported cast to " + type);
        }
    }

    @Override
    public JavaExpression visitSizeOf(CExpression.SizeOf e) {
        return new JavaExpression(e.getType().getSize() + "L", JavaType.LONG);
    }

    @Override
    public JavaExpression visitCall(CExpression.Call e)
            throws ConvertException {
        StringBuilder buf = new StringBuilder(qualify(e.getName())).append('(');
        boolean first = true;
        for (CExpression arg : e.getArgs()) {
            if (!first)
                buf.append(", ");
            buf.append(asLong(generate(arg), e.getName() + "()"));
            first = false;
        }
        buf.append(')');
        return new JavaExpression(buf.toString(), typeOf(e.getName()));
    }
}
