package org.instrumental.cpp;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import javax.annotation.Nonnull;

/**
 * The host platform, which decides the replacement rules applied to the
 * output.
 *
 * Rules are ordered by precedence, longest match first.
 */
public enum Platform {

    WINDOWS(
            ReplacementRule.identifier("uint8_t", "unsigned", "__int8"),
            ReplacementRule.identifier("int8_t", "__int8"),
            ReplacementRule.identifier("uint16_t", "unsigned", "__int16"),
            ReplacementRule.identifier("int16_t", "__int16"),
            ReplacementRule.identifier("uint32_t", "unsigned", "__int32"),
            ReplacementRule.identifier("int32_t", "__int32"),
            ReplacementRule.identifier("uint64_t", "unsigned", "__int64"),
            ReplacementRule.identifier("int64_t", "__int64")),
    LINUX,
    DARWIN;

    private final List<ReplacementRule> rules;

    Platform(ReplacementRule... rules) {
        this.rules = Collections.unmodifiableList(Arrays.asList(rules));
    }

    @Nonnull
    public List<ReplacementRule> getReplacementRules() {
        return rules;
    }

    /**
     * Returns the platform this JVM runs on, defaulting to
     * {@link #LINUX} for unrecognized systems.
     */
    @Nonnull
    public static Platform current() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.startsWith("windows"))
            return WINDOWS;
        if (os.startsWith("mac") || os.startsWith("darwin"))
            return DARWIN;
        return LINUX;
    }

    /**
     * Looks up a platform by name, ignoring case.
     *
     * @throws IllegalArgumentException for an unknown name.
     */
    @Nonnull
    public static Platform forName(@Nonnull String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
