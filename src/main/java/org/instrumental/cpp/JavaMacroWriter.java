package org.instrumental.cpp;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * Renders {@link MacroDefinitions} as the source of a Java class.
 *
 * Object-like macros become {@code public static final} fields and
 * function-like macros {@code public static} methods taking one
 * {@code long} per parameter. A definition is written after the
 * definitions it refers to. A definition which refers to a macro that
 * is undefined, untranslated or itself commented out is written as a
 * comment, so that the class always compiles.
 */
public class JavaMacroWriter {

    private static final String INDENT = "    ";

    @CheckForNull
    private final String packageName;
    private final String className;

    public JavaMacroWriter(@CheckForNull String packageName, @Nonnull String className) {
        this.packageName = packageName;
        this.className = className;
    }

    @Nonnull
    public String getClassName() {
        return className;
    }

    public void write(@Nonnull Appendable out, @Nonnull MacroDefinitions definitions)
            throws IOException {
        out.append("// Generated macro definitions\n");
        if (packageName != null && !packageName.isEmpty())
            out.append("package ").append(packageName).append(";\n");
        out.append('\n');
        out.append("public final class ").append(className).append(" {\n\n");
        out.append(INDENT).append("private ").append(className).append("() {\n");
        out.append(INDENT).append("}\n");

        Map<String, Boolean> writable = new HashMap<String, Boolean>();
        for (TranspiledMacro entry : order(definitions)) {
            out.append('\n');
            boolean ok = isWritable(definitions, entry, writable, new HashSet<String>());
            for (String line : declaration(entry)) {
                out.append(INDENT);
                if (!ok)
                    out.append("// ");
                out.append(line).append('\n');
            }
        }
        out.append("}\n");
    }

    @Nonnull
    public String render(@Nonnull MacroDefinitions definitions) {
        StringBuilder buf = new StringBuilder();
        try {
            write(buf, definitions);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return buf.toString();
    }

    @Nonnull
    private static List<String> declaration(@Nonnull TranspiledMacro entry) {
        List<String> lines = new ArrayList<String>();
        String type = entry.getJavaType().getJavaName();
        String name = JavaSourceGenerator.javaIdentifier(entry.getName());
        if (!entry.isFunctionLike()) {
            lines.add("public static final " + type + " " + name + " = " + entry.getJavaSource() + ";");
            return lines;
        }
        StringBuilder buf = new StringBuilder();
        buf.append("public static ").append(type).append(' ').append(name).append('(');
        boolean first = true;
        for (String arg : entry.getMacro().getArgs()) {
            if (!first)
                buf.append(", ");
            buf.append("long ").append(JavaSourceGenerator.javaIdentifier(arg));
            first = false;
        }
        buf.append(") {");
        lines.add(buf.toString());
        lines.add(INDENT + "return " + entry.getJavaSource() + ";");
        lines.add("}");
        return lines;
    }

    /* Definition order, with every definition after those it refers to. */
    @Nonnull
    private static List<TranspiledMacro> order(@Nonnull MacroDefinitions definitions) {
        List<TranspiledMacro> out = new ArrayList<TranspiledMacro>();
        Set<String> seen = new HashSet<String>();
        for (TranspiledMacro entry : definitions.getAll())
            visit(definitions, entry, seen, out);
        return out;
    }

    private static void visit(@Nonnull MacroDefinitions definitions, @Nonnull TranspiledMacro entry,
            @Nonnull Set<String> seen, @Nonnull List<TranspiledMacro> out) {
        if (!seen.add(entry.getName()))
            return;
        for (String dep : entry.getDependencies()) {
            TranspiledMacro target = definitions.get(dep);
            if (target != null)
                visit(definitions, target, seen, out);
        }
        out.add(entry);
    }

    private static boolean isWritable(@Nonnull MacroDefinitions definitions, @Nonnull TranspiledMacro entry,
            @Nonnull Map<String, Boolean> memo, @Nonnull Set<String> path) {
        Boolean cached = memo.get(entry.getName());
        if (cached != null)
            return cached.booleanValue();
        /* A cycle can never be initialized. */
        if (!path.add(entry.getName()))
            return false;
        boolean ok = entry.isDependenciesSatisfied();
        for (String dep : entry.getDependencies()) {
            if (!ok)
                break;
            TranspiledMacro target = definitions.get(dep);
            ok = target != null && isWritable(definitions, target, memo, path);
        }
        path.remove(entry.getName());
        memo.put(entry.getName(), Boolean.valueOf(ok));
        return ok;
    }
}
