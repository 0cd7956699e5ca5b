package org.instrumental.cpp;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenWriterTest {

    private static String minify(String text) throws LexerException {
        return new TokenWriter(true).render(new Lexer().lex(text));
    }

    private static List<String> significant(String text) throws LexerException {
        List<String> out = new ArrayList<String>();
        for (Token tok : new Lexer().lex(text))
            if (!tok.isWhite() && tok.getType() != TokenType.NEWLINE)
                out.add(tok.getText());
        return out;
    }

    @Test
    void testVerbatim() throws Exception {
        String text = "int  x; /* c */\n\n// tail\n";
        TokenWriter writer = new TokenWriter(false);
        assertFalse(writer.isMinify());
        assertEquals(text, writer.render(new Lexer().lex(text)));
    }

    @Test
    void testMinifyDropsWhitespaceAndComments() throws Exception {
        assertEquals("int x;\nint y;\n", minify("int  x ;  /* c */\n\n  int y; // y\n"));
    }

    @Test
    void testMinifyKeepsNewlinesOnlyAfterStatementsAndDirectives() throws Exception {
        assertEquals("struct s{int a;\n}", minify("struct s {\n  int a;\n}\n"));
        assertEquals("#define A 1\n", minify("#define A 1\n"));
    }

    @Test
    void testMinifySeparatesTokensThatWouldMerge() throws Exception {
        assertEquals("a- -b", minify("a - -b"));
        assertEquals("a+ +b", minify("a + +b"));
        assertEquals("x/ *p", minify("x / *p"));
        assertEquals("1 .5", minify("1 .5"));
        assertEquals("unsigned long x", minify("unsigned long x"));
        assertEquals("x.y", minify("x . y"));
        assertEquals("f(a,b)", minify("f ( a , b )"));
    }

    @Test
    void testMinifyPreservesTokens() throws Exception {
        String[] headers = {
            "typedef unsigned int UINT;\nUINT f(int a, int *b);\n",
            "enum { A = 1 << 2, B = A-- - -1 };\n",
            "int x = a / *p; char *s = \"a // b\";\n",
            "#define MAX(a, b) ((a) > (b) ? (a) : (b))\nint y = 1.e+5 + .5f;\n",
        };
        for (String header : headers) {
            String once = minify(header);
            assertEquals(significant(header), significant(once), "Minifying changed the tokens of " + header);
            assertEquals(once, minify(once), "Minifying is not idempotent for " + header);
        }
    }

    @Test
    void testWriteToAppendable() throws Exception {
        StringBuilder buf = new StringBuilder("> ");
        new TokenWriter(true).write(buf, new Lexer().lex("a  b;\n"));
        assertEquals("> a b;\n", buf.toString());
    }
}
