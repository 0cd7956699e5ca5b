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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * The macros of one preprocessor run.
 *
 * Object-like and function-like macros live in separate maps; a name
 * is in at most one of them at any time. A third, insertion-ordered
 * map remembers every macro ever defined, keeping the latest
 * definition of each name; it drives the final transpiling pass.
 */
public class MacroTable {

    private final Map<String, Macro> objects = new LinkedHashMap<String, Macro>();
    private final Map<String, Macro> functions = new LinkedHashMap<String, Macro>();
    private final Map<String, Macro> all = new LinkedHashMap<String, Macro>();

    /**
     * Defines a macro, replacing any earlier definition of the name.
     *
     * A redefinition is not checked for compatibility.
     */
    public void define(@Nonnull Macro m) {
        String name = m.getName();
        objects.remove(name);
        functions.remove(name);
        if (m.isFunctionLike())
            functions.put(name, m);
        else
            objects.put(name, m);
        all.put(name, m);
    }

    /**
     * Removes the named macro from the active table.
     *
     * The macro is kept in {@link #getAllMacros()}.
     *
     * @return the removed macro, or null if the name was not defined.
     */
    @CheckForNull
    public Macro undefine(@Nonnull String name) {
        Macro m = objects.remove(name);
        if (m == null)
            m = functions.remove(name);
        return m;
    }

    /**
     * Returns true if the name is currently defined, as an object-like
     * or a function-like macro.
     */
    public boolean isDefined(@Nonnull String name) {
        return objects.containsKey(name) || functions.containsKey(name);
    }

    @CheckForNull
    public Macro getObjectMacro(@Nonnull String name) {
        return objects.get(name);
    }

    @CheckForNull
    public Macro getFunctionMacro(@Nonnull String name) {
        return functions.get(name);
    }

    /**
     * Returns the active macro of the given name, or null.
     */
    @CheckForNull
    public Macro getMacro(@Nonnull String name) {
        Macro m = objects.get(name);
        if (m == null)
            m = functions.get(name);
        return m;
    }

    @Nonnull
    public Map<String, Macro> getObjectMacros() {
        return Collections.unmodifiableMap(objects);
    }

    @Nonnull
    public Map<String, Macro> getFunctionMacros() {
        return Collections.unmodifiableMap(functions);
    }

    /**
     * Returns every macro ever defined, in order of first definition,
     * each with its latest body.
     */
    @Nonnull
    public Collection<Macro> getAllMacros() {
        return Collections.unmodifiableCollection(all.values());
    }

    /**
     * Returns every macro ever defined, each flagged with whether it is
     * still defined.
     */
    @Nonnull
    public JsonArray toJson() {
        JsonArray result = new JsonArray();
        for (Macro macro : all.values()) {
            JsonObject json = macro.toJson();
            json.addProperty("defined", getMacro(macro.getName()) == macro);
            result.add(json);
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        for (Macro macro : all.values()) {
            buf.append("#").append("macro ").append(macro);
            if (!isDefined(macro.getName()))
                buf.append(" (undefined)");
            buf.append("\n");
        }
        return buf.toString();
    }
}
