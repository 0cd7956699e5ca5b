package org.instrumental.cpp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import javax.annotation.Nonnull;

/**
 * Evaluates a {@link CExpression} with the semantics of the Java source
 * {@link JavaSourceGenerator} emits for it.
 *
 * Values are {@link Long}, {@link Double}, {@link Boolean} or
 * {@link String}.
 */
public class ConstantEvaluator implements CExpression.Visitor<Object> {

    /**
     * Resolves the macros an expression refers to.
     */
    public interface Scope {

        /**
         * Returns the value of the named object-like macro.
         *
         * @throws ConvertException if the name has no value.
         */
        @Nonnull
        Object getValue(@Nonnull String name) throws ConvertException;

        /**
         * Invokes the named function-like macro.
         *
         * @throws ConvertException if the name is not callable.
         */
        @Nonnull
        Object call(@Nonnull String name, @Nonnull List<Object> args) throws ConvertException;
    }

    private final Scope scope;
    private final JavaSourceGenerator generator;
    private final Map<String, Object> bindings;

    /**
     * @param scope resolves references to other macros.
     * @param generator supplies the static types of subexpressions.
     * @param bindings the values of the parameters.
     */
    public ConstantEvaluator(@Nonnull Scope scope, @Nonnull JavaSourceGenerator generator,
            @Nonnull Map<String, Object> bindings) {
        this.scope = scope;
        this.generator = generator;
        this.bindings = bindings;
    }

    public ConstantEvaluator(@Nonnull Scope scope, @Nonnull JavaSourceGenerator generator) {
        this(scope, generator, Collections.<String, Object>emptyMap());
    }

    @Nonnull
    public Object evaluate(@Nonnull CExpression e)
            throws ConvertException {
        return e.accept(this);
    }

    /* Conversions. */

    /* pp */ static long asLong(@Nonnull Object value)
            throws ConvertException {
        if (value instanceof Long)
            return ((Long) value).longValue();
        if (value instanceof Boolean)
            return ((Boolean) value).booleanValue() ? 1L : 0L;
        throw new ConvertException("Not an integer: " + value);
    }

    /* pp */ static boolean asBoolean(@Nonnull Object value)
            throws ConvertException {
        if (value instanceof Boolean)
            return ((Boolean) value).booleanValue();
        if (value instanceof Long)
            return ((Long) value).longValue() != 0L;
        if (value instanceof Double)
            return ((Double) value).doubleValue() != 0.0;
        throw new ConvertException("Not a truth value: " + value);
    }

    @Nonnull
    private static Object asNumber(@Nonnull Object value)
            throws ConvertException {
        if (value instanceof Long || value instanceof Double)
            return value;
        return Long.valueOf(asLong(value));
    }

    /**
     * Converts a value to the given Java type, as the Java compiler
     * would for an assignment.
     */
    @Nonnull
    public static Object coerce(@Nonnull Object value, @Nonnull JavaType type)
            throws ConvertException {
        switch (type) {
            case LONG:
                return Long.valueOf(asLong(value));
            case DOUBLE:
                return Double.valueOf(((Number) asNumber(value)).doubleValue());
            case BOOLEAN:
                if (value instanceof Boolean)
                    return value;
                break;
            case STRING:
                if (value instanceof String)
                    return value;
                break;
            default:
                break;
        }
        throw new ConvertException("Cannot convert " + value + " to " + type.getJavaName());
    }

    /* Visitor. */

    @Override
    public Object visitLiteral(CExpression.Literal e) {
        return e.getValue();
    }

    @Override
    public Object visitIdentifier(CExpression.Identifier e)
            throws ConvertException {
        Object value = bindings.get(e.getName());
        if (value != null)
            return value;
        return scope.getValue(e.getName());
    }

    @Override
    public Object visitUnary(CExpression.Unary e)
            throws ConvertException {
        Object operand = evaluate(e.getOperand());
        switch (e.getOp()) {
            case "+":
                return asNumber(operand);
            case "-": {
                Object n = asNumber(operand);
                if (n instanceof Double)
                    return Double.valueOf(-((Double) n).doubleValue());
                return Long.valueOf(-((Long) n).longValue());
            }
            case "~":
                return Long.valueOf(~asLong(operand));
            case "!":
                return Boolean.valueOf(!asBoolean(operand));
            default:
                throw new ConvertException("Unsupported unary operator '" + e.getOp() + "'");
        }
    }

    @Override
    public Object visitBinary(CExpression.Binary e)
            throws ConvertException {
        String op = e.getOp();
        /* Short-circuit, as Java does. */
        if ("&&".equals(op))
            return Boolean.valueOf(asBoolean(evaluate(e.getLeft())) && asBoolean(evaluate(e.getRight())));
        if ("||".equals(op))
            return Boolean.valueOf(asBoolean(evaluate(e.getLeft())) || asBoolean(evaluate(e.getRight())));

        Object left = evaluate(e.getLeft());
        Object right = evaluate(e.getRight());
        switch (op) {
            case "<<":
                return Long.valueOf(asLong(left) << asLong(right));
            case ">>":
                return Long.valueOf(asLong(left) >> asLong(right));
            case "&":
                return Long.valueOf(asLong(left) & asLong(right));
            case "^":
                return Long.valueOf(asLong(left) ^ asLong(right));
            case "|":
                return Long.valueOf(asLong(left) | asLong(right));
            default:
                break;
        }

        Object l = asNumber(left);
        Object r = asNumber(right);
        if (l instanceof Double || r instanceof Double)
            return arithmetic(op, ((Number) l).doubleValue(), ((Number) r).doubleValue());
        return arithmetic(op, ((Long) l).longValue(), ((Long) r).longValue());
    }

    @Nonnull
    private static Object arithmetic(@Nonnull String op, long l, long r)
            throws ConvertException {
        switch (op) {
            case "*":
                return Long.valueOf(l * r);
            case "/":
                if (r == 0)
                    throw new ConvertException("Division by zero");
                return Long.valueOf(l / r);
            case "%":
                if (r == 0)
                    throw new ConvertException("Modulus by zero");
                return Long.valueOf(l % r);
            case "+":
                return Long.valueOf(l + r);
            case "-":
                return Long.valueOf(l - r);
            case "<":
                return Boolean.valueOf(l < r);
            case ">":
                return Boolean.valueOf(l > r);
            case "<=":
                return Boolean.valueOf(l <= r);
            case ">=":
                return Boolean.valueOf(l >= r);
            case "==":
                return Boolean.valueOf(l == r);
            case "!=":
                return Boolean.valueOf(l != r);
            default:
                throw new ConvertException("Unsupported binary operator '" + op + "'");
        }
    }

    @Nonnull
    private static Object arithmetic(@Nonnull String op, double l, double r)
            throws ConvertException {
        switch (op) {
            case "*":
                return Double.valueOf(l * r);
            case "/":
                return Double.valueOf(l / r);
            case "+":
                return Double.valueOf(l + r);
            case "-":
                return Double.valueOf(l - r);
            case "<":
                return Boolean.valueOf(l < r);
            case ">":
                return Boolean.valueOf(l > r);
            case "<=":
                return Boolean.valueOf(l <= r);
            case ">=":
                return Boolean.valueOf(l >= r);
            case "==":
                return Boolean.valueOf(l == r);
            case "!=":
                return Boolean.valueOf(l != r);
            default:
                throw new ConvertException("Invalid double operand to " + op);
        }
    }

    @Override
    public Object visitConditional(CExpression.Conditional e)
            throws ConvertException {
        JavaType type = generator.generate(e).getType();
        Object value = asBoolean(evaluate(e.getCondition()))
                ? evaluate(e.getIfTrue())
                : evaluate(e.getIfFalse());
        return coerce(value, type);
    }

    @Override
    public Object visitCast(CExpression.Cast e)
            throws ConvertException {
        CType type = e.getType();
        Object operand = evaluate(e.getOperand());
        if (type.isBoolean())
            return Long.valueOf(asBoolean(operand) ? 1L : 0L);

        Object n = asNumber(operand);
        if (type.isFloating()) {
            double d = ((Number) n).doubleValue();
            if (type.getSize() == 4)
                d = (float) d;
            return Double.valueOf(d);
        }

        long value = n instanceof Double ? (long) ((Double) n).doubleValue() : ((Long) n).longValue();
        switch (type.getSize()) {
            case 8:
                return Long.valueOf(value);
            case 4:
                return Long.valueOf(type.isUnsigned() ? value & 0xFFFFFFFFL : (int) value);
            case 2:
                return Long.valueOf(type.isUnsigned() ? value & 0xFFFFL : (short) value);
            case 1:
                return Long.valueOf(type.isUnsigned() ? value & 0xFFL : (byte) value);
            default:
                throw new ConvertException("Unsupported cast to " + type);
        }
    }

    @Override
    public Object visitSizeOf(CExpression.SizeOf e) {
        return Long.valueOf(e.getType().getSize());
    }

    @Override
    public Object visitCall(CExpression.Call e)
            throws ConvertException {
        List<Object> args = new ArrayList<Object>(e.getArgs().size());
        for (CExpression arg : e.getArgs())
            args.add(Long.valueOf(asLong(evaluate(arg))));
        return scope.call(e.getName(), args);
    }
}
