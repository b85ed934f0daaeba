/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

import static org.junit.Assert.assertEquals;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

public class LexerTest {

    private Lexer calculator = new Lexer(Environment.calculator());
    private Lexer grapher    = new Lexer(Environment.grapher());

    @Test
    public void testTokens() throws ParseException {
        List<Token> tokens = calculator.tokenize("2.5*pi");
        assertEquals(4, tokens.size());
        assertToken(tokens.get(0), Token.Kind.NUMBER,     "2.5", 0);
        assertEquals(2.5, tokens.get(0).value, 0);
        assertToken(tokens.get(1), Token.Kind.OPERATOR,   "*",   3);
        assertToken(tokens.get(2), Token.Kind.IDENTIFIER, "pi",  4);
        assertToken(tokens.get(3), Token.Kind.END,        "",    6);
    }

    @Test
    public void testPunctuationAndWhitespace() throws ParseException {
        List<Token> tokens = calculator.tokenize("max( 12 ,3)");
        assertToken(tokens.get(0), Token.Kind.IDENTIFIER,  "max", 0);
        assertToken(tokens.get(1), Token.Kind.LEFT_PAREN,  "(",   3);
        assertToken(tokens.get(2), Token.Kind.NUMBER,      "12",  5);
        assertToken(tokens.get(3), Token.Kind.COMMA,       ",",   8);
        assertToken(tokens.get(4), Token.Kind.NUMBER,      "3",   9);
        assertToken(tokens.get(5), Token.Kind.RIGHT_PAREN, ")",   10);
        assertToken(tokens.get(6), Token.Kind.END,         "",    11);
    }

    @Test
    public void testNumbers() throws ParseException {
        List<Token> tokens = calculator.tokenize("1.2.3");
        assertToken(tokens.get(0), Token.Kind.NUMBER, "1.2", 0);
        assertToken(tokens.get(1), Token.Kind.NUMBER, ".3",  3);
        assertEquals(0.3, tokens.get(1).value, 0);

        tokens = calculator.tokenize("5.");
        assertEquals(5.0, tokens.get(0).value, 0);
    }

    @Test
    public void testLongestIdentifier() throws ParseException {
        List<Token> tokens = grapher.tokenize("sin*x");
        assertToken(tokens.get(0), Token.Kind.IDENTIFIER, "sin", 0);
        assertToken(tokens.get(2), Token.Kind.IDENTIFIER, "x",   4);
        expectFail(grapher, "sinx", UnknownIdentifierException.class, "Unknown name 'sinx' at position 0");
    }

    @Test
    public void testIdentifiersDependOnEnvironment() throws ParseException {
        expectFail(calculator, "sin(1)", UnknownIdentifierException.class, "Unknown name 'sin' at position 0");
        expectFail(calculator, "2*x",    UnknownIdentifierException.class, "Unknown name 'x' at position 2");
        expectFail(grapher,    "min(x,1)", UnknownIdentifierException.class, "Unknown name 'min' at position 0");
        assertEquals(5, grapher.tokenize("sin(x)").size());
    }

    @Test
    public void testBadCharacters() {
        ParseException e = expectFail(calculator, "2&3", LexException.class, "Unexpected character '&' at position 1");
        assertEquals(1, e.column);
        expectFail(calculator, "2×3", LexException.class, "Unexpected character '×' at position 1");
        expectFail(calculator, "1+.", LexException.class, "Malformed number '.' at position 2");
    }



    ///////////////////
    // SUPPLEMENTAL //
    ///////////////////

    protected void assertToken(Token t, Token.Kind kind, String text, int position) {
        assertEquals(kind,     t.kind);
        assertEquals(text,     t.text);
        assertEquals(position, t.position);
    }

    protected ParseException expectFail(Lexer lexer, String input, Class<? extends ParseException> expectedClass, String expectedError) {
        try {
            List<Token> tokens = lexer.tokenize(input);
            Assert.fail("Expected error but found " + tokens + " (" + input + ")");
            return null;
        } catch(ParseException ex) {
            assertEquals(input, expectedClass, ex.getClass());
            assertEquals(input, expectedError, ex.getMessage());
            return ex;
        }
    }
}
