package org.instrumental.cpp;

import java.util.Arrays;
import java.util.ArrayList;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CExpressionParserTest {

    private final CExpressionParser parser = new CExpressionParser();

    private String parse(String text) throws ConvertException {
        return parser.parse(text).toString();
    }

    private String error(final String text) {
        ConvertException e = assertThrows(ConvertException.class, () -> parser.parse(text));
        return e.getMessage();
    }

    @Test
    void testPrecedence() throws Exception {
        assertEquals("(1 + (2 * 3))", parse("1 + 2 * 3"));
        assertEquals("((1 << 2) | (a & b))", parse("1 << 2 | a & b"));
        assertEquals("((a < b) == (c >= d))", parse("a < b == c >= d"));
        assertEquals("((a && b) || c)", parse("a && b || c"));
    }

    @Test
    void testLeftAssociativity() throws Exception {
        assertEquals("((a - b) - c)", parse("a - b - c"));
        assertEquals("((a / b) % c)", parse("a / b % c"));
    }

    @Test
    void testConditionalIsRightAssociative() throws Exception {
        assertEquals("(a ? b : (c ? d : e))", parse("a ? b : c ? d : e"));
        assertEquals("((x > 0) ? x : (-x))", parse("x > 0 ? x : -x"));
    }

    @Test
    void testUnary() throws Exception {
        assertEquals("(-(~(!x)))", parse("-~!x"));
        assertEquals("(+1)", parse("+1"));
    }

    @Test
    void testParentheses() throws Exception {
        assertEquals("((a + b) * c)", parse("(a + b) * c"));
        assertEquals("(x + 1)", parse("(x) + 1"));
    }

    @Test
    void testCasts() throws Exception {
        CExpression e = parser.parse("(unsigned char) 300");
        assertTrue(e instanceof CExpression.Cast);
        CType type = ((CExpression.Cast) e).getType();
        assertEquals("unsigned char", type.getName());
        assertEquals(1, type.getSize());
        assertTrue(type.isUnsigned());

        assertEquals("((uint32_t) (-1))", parse("(uint32_t) -1"));
        assertEquals("((long long) 1)", parse("(const long long) 1"));
        assertEquals("((double) ((int) x))", parse("(double)(int)x"));
    }

    @Test
    void testSizeOf() throws Exception {
        CExpression e = parser.parse("sizeof(unsigned short)");
        assertTrue(e instanceof CExpression.SizeOf);
        assertEquals(2, ((CExpression.SizeOf) e).getType().getSize());
        assertEquals("sizeof is only supported for primitive types", error("sizeof(struct foo)"));
        assertEquals("sizeof is only supported for primitive types", error("sizeof x"));
    }

    @Test
    void testLiterals() throws Exception {
        CExpression.Literal hex = (CExpression.Literal) parser.parse("0x7FFFu");
        assertEquals(CExpression.Literal.Kind.INTEGER, hex.getKind());
        assertEquals(Long.valueOf(0x7FFF), hex.getValue());

        CExpression.Literal real = (CExpression.Literal) parser.parse("2.5e3f");
        assertEquals(CExpression.Literal.Kind.FLOATING, real.getKind());
        assertEquals(Double.valueOf(2500.0), real.getValue());

        CExpression.Literal chr = (CExpression.Literal) parser.parse("'\\n'");
        assertEquals(CExpression.Literal.Kind.CHARACTER, chr.getKind());
        assertEquals(Long.valueOf(10), chr.getValue());
    }

    @Test
    void testAdjacentStringsAreJoined() throws Exception {
        CExpression.Literal s = (CExpression.Literal) parser.parse("\"ab\" \"c\\td\"");
        assertEquals(CExpression.Literal.Kind.STRING, s.getKind());
        assertEquals("abc\td", s.getValue());
    }

    @Test
    void testCalls() throws Exception {
        CExpression e = parser.parse("MAX(1, f()) + g(a ? b : c)");
        assertEquals("(MAX(1, f()) + g((a ? b : c)))", e.toString());
        CExpression.Call call = (CExpression.Call) ((CExpression.Binary) e).getLeft();
        assertEquals("MAX", call.getName());
        assertEquals(2, call.getArgs().size());
    }

    @Test
    void testNames() throws Exception {
        CExpression e = parser.parse("A + F(B, 1) * (int) C + sizeof(long) + A");
        assertEquals(new ArrayList<String>(Arrays.asList("A", "F", "B", "C")), new ArrayList<String>(e.getNames()));
    }

    @Test
    void testUnsupported() {
        assertEquals("Only expressions are supported, not statements", error("x = 1;"));
        assertEquals("Empty expression", error("  /* nothing */ "));
        assertEquals("Assignment is not supported", error("x = 1"));
        assertEquals("Increment and decrement are not supported", error("x++"));
        assertEquals("Member access is not supported", error("s.x"));
        assertEquals("Member access is not supported", error("p->x"));
        assertEquals("The comma operator is not supported", error("1, 2"));
        assertEquals("Subscripts are not supported", error("a[1]"));
        assertEquals("Dereference is not supported", error("*p"));
        assertEquals("Address-of is not supported", error("&x"));
        assertEquals("Pointer casts are not supported", error("(char *) 0"));
        assertEquals("'defined' is only valid in #if", error("defined(X)"));
        assertEquals("Unexpected end of expression", error("1 +"));
    }

    @Test
    void testLexErrorsBecomeConvertErrors() {
        ConvertException e = assertThrows(ConvertException.class, () -> parser.parse("1 @ 2"));
        assertTrue(e.getCause() instanceof LexerException);
    }
}
