package org.instrumental.cpp;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * A primitive C type, as named in a cast or a sizeof.
 *
 * Sizes are those of an LP64 target.
 */
public final class CType {

    private static final Map<String, CType> TYPEDEFS = new HashMap<String, CType>();

    static {
        TYPEDEFS.put("int8_t", new CType("int8_t", 1, false, false));
        TYPEDEFS.put("int16_t", new CType("int16_t", 2, false, false));
        TYPEDEFS.put("int32_t", new CType("int32_t", 4, false, false));
        TYPEDEFS.put("int64_t", new CType("int64_t", 8, false, false));
        TYPEDEFS.put("uint8_t", new CType("uint8_t", 1, true, false));
        TYPEDEFS.put("uint16_t", new CType("uint16_t", 2, true, false));
        TYPEDEFS.put("uint32_t", new CType("uint32_t", 4, true, false));
        TYPEDEFS.put("uint64_t", new CType("uint64_t", 8, true, false));
        TYPEDEFS.put("size_t", new CType("size_t", 8, true, false));
        TYPEDEFS.put("ssize_t", new CType("ssize_t", 8, false, false));
        TYPEDEFS.put("intptr_t", new CType("intptr_t", 8, false, false));
        TYPEDEFS.put("uintptr_t", new CType("uintptr_t", 8, true, false));
        TYPEDEFS.put("ptrdiff_t", new CType("ptrdiff_t", 8, false, false));
    }

    private final String name;
    private final int size;
    private final boolean unsigned;
    private final boolean floating;

    private CType(@Nonnull String name, int size, boolean unsigned, boolean floating) {
        this.name = name;
        this.size = size;
        this.unsigned = unsigned;
        this.floating = floating;
    }

    /**
     * Returns true if the word may start or continue a type name.
     */
    public static boolean isTypeWord(@Nonnull String word) {
        switch (word) {
            case "signed":
            case "unsigned":
            case "char":
            case "short":
            case "int":
            case "long":
            case "float":
            case "double":
            case "_Bool":
            case "const":
            case "volatile":
                return true;
            default:
                return TYPEDEFS.containsKey(word);
        }
    }

    /**
     * Parses a sequence of type words such as {@code unsigned long long}.
     *
     * @return the type, or null if the words do not name a primitive type.
     */
    @CheckForNull
    public static CType forWords(@Nonnull List<String> words) {
        int signedness = 0;     /* -1 signed, 1 unsigned */
        int longs = 0;
        boolean sawInt = false;
        String base = null;
        StringBuilder name = new StringBuilder();
        for (String word : words) {
            switch (word) {
                case "const":
                case "volatile":
                    continue;
                case "signed":
                case "unsigned":
                    if (signedness != 0)
                        return null;
                    signedness = "signed".equals(word) ? -1 : 1;
                    break;
                case "long":
                    if (++longs > 2)
                        return null;
                    break;
                case "int":
                    /* 'short int' and 'long int' name the same types as 'short' and 'long'. */
                    if (sawInt)
                        return null;
                    sawInt = true;
                    break;
                case "char":
                case "short":
                case "float":
                case "double":
                case "_Bool":
                    if (base != null)
                        return null;
                    base = word;
                    break;
                default:
                    if (words.size() != 1)
                        return null;
                    return TYPEDEFS.get(word);
            }
            if (name.length() > 0)
                name.append(' ');
            name.append(word);
        }
        if (name.length() == 0)
            return null;

        String text = name.toString();
        boolean unsigned = signedness == 1;
        if (base == null)
            base = "int";
        else if (sawInt && !"short".equals(base))
            return null;
        switch (base) {
            case "char":
                if (longs > 0)
                    return null;
                return new CType(text, 1, unsigned, false);
            case "short":
                if (longs > 0)
                    return null;
                return new CType(text, 2, unsigned, false);
            case "int":
                return new CType(text, longs > 0 ? 8 : 4, unsigned, false);
            case "_Bool":
                if (longs > 0 || signedness != 0)
                    return null;
                return new CType(text, 1, true, false);
            case "float":
                if (longs > 0 || signedness != 0)
                    return null;
                return new CType(text, 4, false, true);
            case "double":
                if (longs > 1 || signedness != 0)
                    return null;
                return new CType(text, longs > 0 ? 16 : 8, false, true);
            default:
                throw new InternalException("Unexpected base type " + base);
        }
    }

    @Nonnull
    public String getName() {
        return name;
    }

    /** Returns the size in bytes. */
    public int getSize() {
        return size;
    }

    public boolean isUnsigned() {
        return unsigned;
    }

    public boolean isFloating() {
        return floating;
    }

    public boolean isBoolean() {
        return "_Bool".equals(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
