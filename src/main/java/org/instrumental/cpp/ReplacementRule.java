package org.instrumental.cpp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nonnull;

/**
 * Replaces a run of output tokens by other tokens.
 *
 * A rule matches when the texts of the most recently emitted
 * non-white output tokens equal {@link #getMatch()}. The matched tokens,
 * and any whitespace or comments between them, are removed and the
 * replacement tokens appended instead.
 */
public final class ReplacementRule {

    private final List<String> match;
    private final List<Token> replacement;

    public ReplacementRule(@Nonnull List<String> match, @Nonnull List<Token> replacement) {
        if (match.isEmpty())
            throw new IllegalArgumentException("Empty replacement pattern");
        this.match = Collections.unmodifiableList(new ArrayList<String>(match));
        this.replacement = Collections.unmodifiableList(new ArrayList<Token>(replacement));
    }

    /**
     * Creates a rule replacing the given words by one identifier.
     */
    @Nonnull
    public static ReplacementRule identifier(@Nonnull String replacement, @Nonnull String... match) {
        return new ReplacementRule(Arrays.asList(match),
                Collections.singletonList(new Token(TokenType.IDENTIFIER, replacement)));
    }

    @Nonnull
    public List<String> getMatch() {
        return match;
    }

    @Nonnull
    public List<Token> getReplacement() {
        return replacement;
    }

    /**
     * Applies this rule to the tail of the output.
     *
     * White tokens between the matched words are removed with them.
     * White tokens after the last matched word are kept.
     *
     * @return true if the rule matched and the output was rewritten.
     */
    /* pp */ boolean apply(@Nonnull List<Token> out) {
        int end = out.size();
        while (end > 0 && isBlank(out.get(end - 1)))
            end--;
        int i = end - 1;
        for (int m = match.size() - 1; m >= 0; m--) {
            while (i >= 0 && isBlank(out.get(i)))
                i--;
            if (i < 0 || !match.get(m).equals(out.get(i).getText()))
                return false;
            i--;
        }
        List<Token> trailing = new ArrayList<Token>(out.subList(end, out.size()));
        out.subList(i + 1, out.size()).clear();
        out.addAll(replacement);
        out.addAll(trailing);
        return true;
    }

    private static boolean isBlank(@Nonnull Token tok) {
        return tok.isWhite() || tok.getType() == TokenType.NEWLINE;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        for (String s : match)
            buf.append(s).append(' ');
        buf.append("=>");
        for (Token tok : replacement)
            buf.append(' ').append(tok.getText());
        return buf.toString();
    }
}
