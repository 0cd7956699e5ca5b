package org.instrumental.cpp;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    private static List<Token> lex(String text) throws LexerException {
        return new Lexer().lex(text);
    }

    /* Non-white, non-newline tokens. */
    private static List<Token> significant(String text) throws LexerException {
        List<Token> out = new ArrayList<Token>();
        for (Token tok : lex(text))
            if (!tok.isWhite() && tok.getType() != TokenType.NEWLINE)
                out.add(tok);
        return out;
    }

    private static String join(List<Token> tokens) {
        StringBuilder buf = new StringBuilder();
        for (Token tok : tokens)
            buf.append(tok.getText());
        return buf.toString();
    }

    @Test
    void testLongestMatchWins() throws Exception {
        List<Token> tokens = significant("a<<=b");
        assertEquals(3, tokens.size());
        assertEquals("<<=", tokens.get(1).getText());
        assertEquals(TokenType.PUNCTUATOR, tokens.get(1).getType());
    }

    @Test
    void testDefinedBeatsIdentifierOnTie() throws Exception {
        List<Token> tokens = significant("defined(X) definedX");
        assertEquals(TokenType.DEFINED, tokens.get(0).getType());
        assertEquals(TokenType.IDENTIFIER, tokens.get(4).getType());
        assertEquals("definedX", tokens.get(4).getText());
    }

    @Test
    void testNumbers() throws Exception {
        List<Token> tokens = significant("1e+5 0x1Fu 3.25f x+1");
        assertEquals("1e+5", tokens.get(0).getText());
        assertEquals(TokenType.NUMBER, tokens.get(0).getType());
        assertEquals("0x1Fu", tokens.get(1).getText());
        assertEquals("3.25f", tokens.get(2).getText());
        assertEquals("x", tokens.get(3).getText());
        assertEquals("+", tokens.get(4).getText(), "A sign without an exponent is an operator");
        assertEquals("1", tokens.get(5).getText());
    }

    @Test
    void testStringsAndCharacters() throws Exception {
        List<Token> tokens = significant("\"a \\\"quoted\\\" b\" 'x' '\\n'");
        assertEquals(3, tokens.size());
        assertEquals(TokenType.STRING, tokens.get(0).getType());
        assertEquals("\"a \\\"quoted\\\" b\"", tokens.get(0).getText());
        assertEquals(TokenType.CHARACTER, tokens.get(1).getType());
        assertEquals(TokenType.CHARACTER, tokens.get(2).getType());
    }

    @Test
    void testHeaderNameOnlyAfterInclude() throws Exception {
        List<Token> include = significant("#include <stdio.h>\n");
        assertEquals(TokenType.HEADER, include.get(2).getType());
        assertEquals("<stdio.h>", include.get(2).getText());

        List<Token> compare = significant("a <b> c\n");
        assertEquals(TokenType.PUNCTUATOR, compare.get(1).getType());
        assertEquals("<", compare.get(1).getText());
    }

    @Test
    void testComments() throws Exception {
        List<Token> tokens = lex("a /* x\ny */ b // tail\n");
        assertEquals(TokenType.BLOCK_COMMENT, tokens.get(2).getType());
        assertEquals("/* x\ny */", tokens.get(2).getText());
        Token b = tokens.get(4);
        assertEquals("b", b.getText());
        assertEquals(2, b.getLine());
        assertEquals(TokenType.LINE_COMMENT, tokens.get(6).getType());
    }

    @Test
    void testPositions() throws Exception {
        List<Token> tokens = significant("int x;\n  long y;\n");
        Token y = tokens.get(4);
        assertEquals("y", y.getText());
        assertEquals(2, y.getLine());
        assertEquals(8, y.getColumn());
    }

    @Test
    void testContinuationKeepsPhysicalLines() throws Exception {
        List<Token> tokens = significant("#define A \\\n  1\nB\n");
        Token one = tokens.get(3);
        assertEquals("1", one.getText());
        assertEquals(2, one.getLine());
        assertEquals(3, one.getColumn());
        Token b = tokens.get(4);
        assertEquals("B", b.getText());
        assertEquals(3, b.getLine());
        assertEquals(1, b.getColumn());
    }

    @Test
    void testContinuationInsideIdentifier() throws Exception {
        List<Token> tokens = significant("FO\\\nO + 1\n");
        assertEquals("FOO", tokens.get(0).getText());
        assertEquals(1, tokens.get(0).getLine());
        assertEquals(2, tokens.get(1).getLine());
    }

    @Test
    void testTextIsPreservedExceptContinuations() throws Exception {
        String text = "#if A /* c */\n\tint  x = 1;\t// y\n#endif\n";
        assertEquals(text, join(lex(text)));
        assertEquals("#define A 1\n", join(lex("#define A \\\n1\n")));
    }

    @Test
    void testCarriageReturnsAreNewlines() throws Exception {
        List<Token> tokens = lex("a\r\nb\rc");
        assertEquals(TokenType.NEWLINE, tokens.get(1).getType());
        assertEquals("\n", tokens.get(1).getText());
        assertEquals(2, tokens.get(2).getLine());
        assertEquals(3, tokens.get(4).getLine());
    }

    @Test
    void testNoAcceptableToken() {
        LexerException e = assertThrows(LexerException.class, () -> lex("int a;\nint @b;\n"));
        assertTrue(e.getMessage().contains("2:5"), "Message should carry the position: " + e.getMessage());
    }

    @Test
    void testEndsAt() {
        Lexer lexer = new Lexer();
        assertTrue(lexer.endsAt("a+", 1));
        assertFalse(lexer.endsAt("ab", 1));
        assertFalse(lexer.endsAt("--", 1));
        assertTrue(lexer.endsAt("1;", 1));
    }
}
