package org.instrumental.cpp;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * Renders a token stream as header text.
 *
 * In verbatim mode every token is written unchanged. In minified mode
 * whitespace and comments are dropped, a single space is written only
 * where the neighbouring tokens would otherwise lex differently, and a
 * newline is written only at the end of a line which contained a
 * {@code ;} or a {@code #}.
 */
public class TokenWriter {

    private final boolean minify;
    private final Lexer lexer = new Lexer();

    public TokenWriter(boolean minify) {
        this.minify = minify;
    }

    public boolean isMinify() {
        return minify;
    }

    /**
     * Writes the tokens to the given output.
     */
    public void write(@Nonnull Appendable out, @Nonnull List<Token> tokens)
            throws IOException {
        if (!minify) {
            for (Token tok : tokens)
                out.append(tok.getText());
            return;
        }

        Token prev = null;
        boolean acceptNewline = false;
        for (Token tok : tokens) {
            switch (tok.getType()) {
                case NEWLINE:
                    if (acceptNewline) {
                        out.append('\n');
                        prev = null;
                    }
                    acceptNewline = false;
                    break;
                case WHITESPACE:
                case LINE_COMMENT:
                case BLOCK_COMMENT:
                    break;
                default:
                    if (needsSpace(prev, tok))
                        out.append(' ');
                    out.append(tok.getText());
                    prev = tok;
                    if (tok.isPunctuator(";") || tok.isPunctuator("#"))
                        acceptNewline = true;
                    break;
            }
        }
    }

    /**
     * Renders the tokens as a String.
     */
    @Nonnull
    public String render(@Nonnull List<Token> tokens) {
        StringBuilder buf = new StringBuilder();
        try {
            write(buf, tokens);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return buf.toString();
    }

    /* True if writing the two texts back to back would lex differently. */
    private boolean needsSpace(@CheckForNull Token prev, @Nonnull Token tok) {
        if (prev == null)
            return false;
        String left = prev.getText();
        String right = tok.getText();
        /* Would open a comment, which the lexer only sees with its end. */
        if (left.endsWith("/") && (right.startsWith("*") || right.startsWith("/")))
            return true;
        return !lexer.endsAt(left + right, left.length());
    }
}
