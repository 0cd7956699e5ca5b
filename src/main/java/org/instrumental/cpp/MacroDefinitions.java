package org.instrumental.cpp;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;

/**
 * The translated macros of one header, in order of first definition.
 *
 * @see MacroTranslator
 */
public class MacroDefinitions implements ConstantEvaluator.Scope {

    private final Map<String, TranspiledMacro> entries = new LinkedHashMap<String, TranspiledMacro>();
    /* Names being evaluated, to stop cycles such as A -> B -> A. */
    private final Set<String> evaluating = new HashSet<String>();

    /* pp */ void add(@Nonnull TranspiledMacro entry) {
        entries.put(entry.getName(), entry);
    }

    @CheckForNull
    public TranspiledMacro get(@Nonnull String name) {
        return entries.get(name);
    }

    @Nonnull
    public Collection<TranspiledMacro> getAll() {
        return Collections.unmodifiableCollection(entries.values());
    }

    public int size() {
        return entries.size();
    }

    @Nonnull
    private TranspiledMacro lookup(@Nonnull String name)
            throws ConvertException {
        TranspiledMacro entry = entries.get(name);
        if (entry == null)
            throw new ConvertException("No definition for " + name);
        return entry;
    }

    @Override
    public Object getValue(String name)
            throws ConvertException {
        TranspiledMacro entry = lookup(name);
        if (entry.isFunctionLike())
            throw new ConvertException(name + " is a function-like macro");
        if (!evaluating.add(name))
            throw new ConvertException("Recursive definition of " + name);
        try {
            return entry.getValue();
        } finally {
            evaluating.remove(name);
        }
    }

    @Override
    public Object call(String name, List<Object> args)
            throws ConvertException {
        TranspiledMacro entry = lookup(name);
        if (!entry.isFunctionLike())
            throw new ConvertException(name + " is not a function-like macro");
        if (!evaluating.add(name))
            throw new ConvertException("Recursive call of " + name);
        try {
            return entry.call(args.toArray());
        } finally {
            evaluating.remove(name);
        }
    }

    @Nonnull
    public JsonArray toJson() {
        JsonArray result = new JsonArray();
        for (TranspiledMacro entry : entries.values())
            result.add(entry.toJson());
        return result;
    }

    /**
     * Renders the definitions as indented JSON.
     */
    @Nonnull
    public String toJsonString() {
        return new GsonBuilder().setPrettyPrinting().create().toJson(toJson());
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        for (TranspiledMacro entry : entries.values())
            buf.append(entry).append('\n');
        return buf.toString();
    }
}
