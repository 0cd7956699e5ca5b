package org.instrumental.cpp;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nonnull;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * A macro whose body was translated into a Java expression.
 *
 * An object-like macro has a value; a function-like macro may be
 * called with one {@code long} per parameter. Both are computed on
 * demand against the {@link MacroDefinitions} the macro belongs to.
 */
public class TranspiledMacro {

    private final MacroDefinitions definitions;
    private final Macro macro;
    private final CExpression expression;
    private final JavaSourceGenerator generator;
    private final JavaSourceGenerator.JavaExpression java;
    private final Set<String> dependencies;
    private final boolean dependenciesSatisfied;
    private final boolean live;

    /* pp */ TranspiledMacro(@Nonnull MacroDefinitions definitions, @Nonnull Macro macro,
            @Nonnull CExpression expression, @Nonnull JavaSourceGenerator generator,
            @Nonnull JavaSourceGenerator.JavaExpression java,
            boolean dependenciesSatisfied, boolean live) {
        this.definitions = definitions;
        this.macro = macro;
        this.expression = expression;
        this.generator = generator;
        this.java = java;
        Set<String> deps = new LinkedHashSet<String>(expression.getNames());
        deps.removeAll(macro.getArgs());
        this.dependencies = Collections.unmodifiableSet(deps);
        this.dependenciesSatisfied = dependenciesSatisfied;
        this.live = live;
    }

    @Nonnull
    public String getName() {
        return macro.getName();
    }

    /**
     * Returns the macro, with its body as it was translated.
     */
    @Nonnull
    public Macro getMacro() {
        return macro;
    }

    public boolean isFunctionLike() {
        return macro.isFunctionLike();
    }

    @Nonnull
    public CExpression getExpression() {
        return expression;
    }

    /**
     * Returns the Java expression for the body.
     */
    @Nonnull
    public String getJavaSource() {
        return java.getSource();
    }

    @Nonnull
    public JavaType getJavaType() {
        return java.getType();
    }

    /**
     * Returns the other macros the body refers to.
     */
    @Nonnull
    public Set<String> getDependencies() {
        return dependencies;
    }

    /**
     * Returns true if every macro the body refers to was defined at the
     * end of the header.
     */
    public boolean isDependenciesSatisfied() {
        return dependenciesSatisfied;
    }

    /**
     * Returns true if this definition was still in effect at the end
     * of the header.
     */
    public boolean isLive() {
        return live;
    }

    /**
     * Returns the value of this object-like macro: a Long, Double,
     * Boolean or String according to {@link #getJavaType()}.
     *
     * @throws ConvertException if the value cannot be computed.
     */
    @Nonnull
    public Object getValue()
            throws ConvertException {
        if (isFunctionLike())
            throw new IllegalStateException(getName() + " is a function-like macro");
        ConstantEvaluator evaluator = new ConstantEvaluator(definitions, generator);
        return ConstantEvaluator.coerce(evaluator.evaluate(expression), getJavaType());
    }

    /**
     * Calls this function-like macro.
     *
     * @param args one integer per parameter.
     * @throws ConvertException if the value cannot be computed.
     */
    @Nonnull
    public Object call(@Nonnull Object... args)
            throws ConvertException {
        if (!isFunctionLike())
            throw new IllegalStateException(getName() + " is an object-like macro");
        List<String> params = macro.getArgs();
        if (args.length != params.size())
            throw new ConvertException("macro " + getName()
                    + " has " + params.size() + " parameters "
                    + "but given " + args.length + " args");
        Map<String, Object> bindings = new LinkedHashMap<String, Object>();
        for (int i = 0; i < args.length; i++) {
            Object arg = args[i];
            if (arg instanceof Integer || arg instanceof Short || arg instanceof Byte)
                arg = Long.valueOf(((Number) arg).longValue());
            bindings.put(params.get(i), Long.valueOf(ConstantEvaluator.asLong(arg)));
        }
        ConstantEvaluator evaluator = new ConstantEvaluator(definitions, generator, bindings);
        return ConstantEvaluator.coerce(evaluator.evaluate(expression), getJavaType());
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("name", getName());
        if (isFunctionLike()) {
            JsonArray params = new JsonArray();
            for (String arg : macro.getArgs())
                params.add(new JsonPrimitive(arg));
            result.add("params", params);
        }
        result.addProperty("body", macro.getText());
        result.addProperty("java", getJavaSource());
        result.addProperty("type", getJavaType().getJavaName());
        JsonArray deps = new JsonArray();
        for (String dep : dependencies)
            deps.add(new JsonPrimitive(dep));
        result.add("dependencies", deps);
        result.addProperty("dependenciesSatisfied", dependenciesSatisfied);
        result.addProperty("live", live);
        if (!isFunctionLike() && dependenciesSatisfied) {
            try {
                Object value = getValue();
                if (value instanceof Number)
                    result.addProperty("value", (Number) value);
                else if (value instanceof Boolean)
                    result.addProperty("value", (Boolean) value);
                else
                    result.addProperty("value", value.toString());
            } catch (ConvertException e) {
                result.addProperty("error", e.getMessage());
            }
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        if (!dependenciesSatisfied)
            buf.append("// ");
        buf.append(getJavaType().getJavaName()).append(' ').append(getName());
        if (isFunctionLike()) {
            buf.append('(');
            boolean first = true;
            for (String arg : macro.getArgs()) {
                if (!first)
                    buf.append(", ");
                buf.append("long ").append(arg);
                first = false;
            }
            buf.append(')');
        }
        return buf.append(" = ").append(getJavaSource()).toString();
    }
}
