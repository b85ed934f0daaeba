/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Assert;
import org.junit.Test;

public class NormalizerTest {

    private Normalizer calculator = new Normalizer(false);
    private Normalizer grapher    = new Normalizer(true);

    @Test
    public void testCanonicalOperators() throws ParseException {
        String[] cases = {
            "  2+3 ",     "2+3",
            "2^3",        "2^3",
            "2**3",       "2^3",
            "6×2÷3",      "6*2/3",
            "max(1,2)",   "max(1,2)",
            "round(2.5)", "round(2.5)",
        };
        for(int c = 0; c < cases.length; c += 2) {
            assertEquals(cases[c], cases[c + 1], calculator.normalize(cases[c]));
        }
    }

    @Test
    public void testImplicitMultiplication() throws ParseException {
        String[] cases = {
            "2(3+4)",      "2*(3+4)",
            "(1+2)(3+4)",  "(1+2)*(3+4)",
            "(2)3",        "(2)*3",
            "2pi",         "2*pi",
            "(1+1)sqrt(4)", "(1+1)*sqrt(4)",
        };
        for(int c = 0; c < cases.length; c += 2) {
            assertEquals(cases[c], cases[c + 1], calculator.normalize(cases[c]));
        }
    }

    @Test
    public void testFunctionOfX() throws ParseException {
        String[] cases = {
            "f(x)=x^2",      "x^2",
            "F(X) = 2x+1",   "2*x+1",
            "3sin(x)",       "3*sin(x)",
            "x(x+1)",        "x*(x+1)",
            "(x+1)x",        "(x+1)*x",
            "2x(1)",         "2*x*(1)",
            "(x+1)(x-1)",    "(x+1)*(x-1)",
        };
        for(int c = 0; c < cases.length; c += 2) {
            assertEquals(cases[c], cases[c + 1], grapher.normalize(cases[c]));
        }
    }

    @Test
    public void testHeaderOnlyStrippedForGrapher() {
        expectFail(calculator, "f(x)=2", InvalidCharacterException.class, "Invalid characters in expression: f=");
    }

    @Test
    public void testEmpty() {
        expectFail(calculator, "",      EmptyInputException.class, "Empty expression");
        expectFail(calculator, "   ",   EmptyInputException.class, "Empty expression");
        expectFail(calculator, null,    EmptyInputException.class, "Empty expression");
        expectFail(grapher,    "f(x)=", EmptyInputException.class, "Empty expression");
    }

    @Test
    public void testInvalidCharacters() {
        ParseException e = expectFail(calculator, "2$3#$", InvalidCharacterException.class, "Invalid characters in expression: $#");
        assertEquals(1, e.column);
        assertEquals("$#", ((InvalidCharacterException) e).characters);
        expectFail(calculator, "2 = 2", InvalidCharacterException.class, "Invalid characters in expression: =");
        expectFail(grapher,    "y+1",   InvalidCharacterException.class, "Invalid characters in expression: y");
    }

    @Test
    public void testUnbalancedParentheses() {
        ParseException e = expectFail(calculator, "(2+3", UnbalancedParenthesesException.class, "Unbalanced parentheses: missing closing parenthesis");
        assertEquals(4, e.column);
        e = expectFail(calculator, "2+3)", UnbalancedParenthesesException.class, "Unbalanced parentheses: extra closing parenthesis");
        assertEquals(3, e.column);
        e = expectFail(calculator, ")(", UnbalancedParenthesesException.class, "Unbalanced parentheses: extra closing parenthesis");
        assertEquals(0, e.column);
    }

    @Test
    public void testCharactersCheckedBeforeParentheses() {
        expectFail(calculator, "(2#", InvalidCharacterException.class, "Invalid characters in expression: #");
    }

    @Test
    public void testAllowedCharacters() {
        assertTrue(Normalizer.isAllowed('7'));
        assertTrue(Normalizer.isAllowed('\t'));
        assertTrue(Normalizer.isAllowed('×'));
        assertTrue(Normalizer.isAllowed('q'));
        Assert.assertFalse(Normalizer.isAllowed('f'));
        Assert.assertFalse(Normalizer.isAllowed('P'));
    }



    ///////////////////
    // SUPPLEMENTAL //
    ///////////////////

    protected ParseException expectFail(Normalizer normalizer, String input, Class<? extends ParseException> expectedClass, String expectedError) {
        try {
            String result = normalizer.normalize(input);
            Assert.fail("Expected error but found '" + result + "' (" + input + ")");
            return null;
        } catch(ParseException ex) {
            assertEquals(input, expectedClass, ex.getClass());
            assertEquals(input, expectedError, ex.getMessage());
            return ex;
        }
    }
}
