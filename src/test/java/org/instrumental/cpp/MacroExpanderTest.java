package org.instrumental.cpp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.pcollections.Empty;

import static org.junit.jupiter.api.Assertions.*;

class MacroExpanderTest {

    private final Lexer lexer = new Lexer();
    private final MacroTable macros = new MacroTable();
    private final MacroExpander expander = new MacroExpander(macros);

    private List<Token> lex(String text) throws LexerException {
        return lexer.lex(text);
    }

    private void object(String name, String body) throws LexerException {
        macros.define(Macro.object(new Token(TokenType.IDENTIFIER, name), lex(body)));
    }

    private void function(String name, List<String> args, String body) throws LexerException {
        macros.define(Macro.function(new Token(TokenType.IDENTIFIER, name), args, lex(body)));
    }

    private String expand(String text) throws LexerException {
        StringBuilder buf = new StringBuilder();
        for (Token tok : expander.expand(lex(text)))
            if (!tok.isWhite())
                buf.append(tok.getText());
        return buf.toString();
    }

    @Test
    void testNoMacros() throws Exception {
        assertEquals("a+b", expand("a + b"));
    }

    @Test
    void testObjectMacroChain() throws Exception {
        object("A", "B + 1");
        object("B", "2");
        assertEquals("2+1", expand("A"));
    }

    @Test
    void testSelfReferenceStops() throws Exception {
        object("X", "X + 1");
        assertEquals("X+1", expand("X"));
    }

    @Test
    void testIndirectSelfReferenceStops() throws Exception {
        object("A", "B");
        object("B", "A");
        assertEquals("A", expand("A"));
        assertEquals("B", expand("B"));
    }

    @Test
    void testFunctionMacro() throws Exception {
        function("MAX", Arrays.asList("a", "b"), "((a) > (b) ? (a) : (b))");
        assertEquals("((1)>(2)?(1):(2))", expand("MAX(1, 2)"));
    }

    @Test
    void testNestedParenthesesInArguments() throws Exception {
        function("FIRST", Arrays.asList("a", "b"), "a");
        assertEquals("f(1,2)", expand("FIRST(f(1, 2), 3)"));
    }

    @Test
    void testArgumentsArePrescanned() throws Exception {
        object("N", "7");
        function("ID", Arrays.asList("x"), "x");
        assertEquals("7", expand("ID(N)"));
    }

    @Test
    void testInvokedMacroIsDisabledInsideItsArguments() throws Exception {
        object("N", "7");
        function("ID", Arrays.asList("x"), "x");
        assertEquals("ID(7)", expand("ID(ID(N))"));
    }

    @Test
    void testEmptyArgumentList() throws Exception {
        function("ZERO", new ArrayList<String>(), "0");
        assertEquals("0", expand("ZERO()"));
        assertEquals("0", expand("ZERO ( )"));
    }

    @Test
    void testEmptyArgument() throws Exception {
        function("PAIR", Arrays.asList("a", "b"), "[a|b]");
        assertEquals("[|2]", expand("PAIR(,2)"));
    }

    @Test
    void testFunctionNameWithoutArguments() throws Exception {
        function("F", Arrays.asList("x"), "x");
        assertEquals("F;", expand("F;"));
    }

    @Test
    void testFunctionMacroNotReexpandedInItsOwnBody() throws Exception {
        function("F", Arrays.asList("x"), "F(x)");
        assertEquals("F(1)", expand("F(1)"));
    }

    @Test
    void testArgumentCountMismatch() throws Exception {
        function("ADD", Arrays.asList("a", "b"), "a + b");
        ParseException e = assertThrows(ParseException.class, () -> expand("ADD(1)"));
        assertTrue(e.getMessage().contains("has 2 parameters but given 1 args"), e.getMessage());
        assertThrows(ParseException.class, () -> expand("ADD(1, 2, 3)"));
    }

    @Test
    void testUnterminatedArguments() throws Exception {
        function("F", Arrays.asList("x"), "x");
        assertThrows(ParseException.class, () -> expand("F(1, (2)"));
    }

    @Test
    void testDisabledNames() throws Exception {
        object("A", "1");
        List<Token> out = expander.expand(lex("A"), Empty.<String>set().plus("A"), Empty.<String>set());
        assertEquals(1, out.size());
        assertEquals("A", out.get(0).getText());
    }
}
