package org.instrumental.cpp;

import javax.annotation.Nonnull;

/**
 * The Java type of a transpiled expression.
 */
public enum JavaType {

    LONG("long"),
    DOUBLE("double"),
    BOOLEAN("boolean"),
    STRING("String");

    private final String name;

    JavaType(String name) {
        this.name = name;
    }

    /**
     * Returns the type as spelled in Java source.
     */
    @Nonnull
    public String getJavaName() {
        return name;
    }

    public boolean isNumeric() {
        return this == LONG || this == DOUBLE;
    }
}
