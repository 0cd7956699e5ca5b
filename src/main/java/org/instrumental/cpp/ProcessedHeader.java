package org.instrumental.cpp;

import java.util.Collections;
import java.util.List;
import javax.annotation.Nonnull;

/**
 * The result of processing one header: the cleaned header text and
 * the translated macros.
 *
 * @see HeaderProcessor
 */
public class ProcessedHeader {

    private final List<Token> tokens;
    private final String header;
    private final MacroTable macros;
    private final MacroDefinitions definitions;
    private final String javaSource;

    /* pp */ ProcessedHeader(@Nonnull List<Token> tokens, @Nonnull String header,
            @Nonnull MacroTable macros, @Nonnull MacroDefinitions definitions,
            @Nonnull String javaSource) {
        this.tokens = Collections.unmodifiableList(tokens);
        this.header = header;
        this.macros = macros;
        this.definitions = definitions;
        this.javaSource = javaSource;
    }

    /**
     * Returns the output tokens of the preprocessor.
     */
    @Nonnull
    public List<Token> getTokens() {
        return tokens;
    }

    /**
     * Returns the cleaned header, verbatim or minified.
     */
    @Nonnull
    public String getHeader() {
        return header;
    }

    /**
     * Returns the macro table as it stood at the end of the header.
     */
    @Nonnull
    public MacroTable getMacros() {
        return macros;
    }

    @Nonnull
    public MacroDefinitions getDefinitions() {
        return definitions;
    }

    /**
     * Returns the source of a Java class holding the definitions.
     */
    @Nonnull
    public String getJavaSource() {
        return javaSource;
    }
}
