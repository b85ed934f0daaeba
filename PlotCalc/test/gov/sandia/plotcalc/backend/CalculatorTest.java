/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import gov.sandia.plotcalc.language.DivisionByZeroException;
import gov.sandia.plotcalc.language.EmptyInputException;
import gov.sandia.plotcalc.language.LanguageException;
import gov.sandia.plotcalc.language.SyntaxException;
import gov.sandia.plotcalc.language.UnbalancedParenthesesException;
import gov.sandia.plotcalc.language.UndefinedResultException;
import gov.sandia.plotcalc.language.UnknownIdentifierException;

import org.junit.Assert;
import org.junit.Test;

public class CalculatorTest {

    private Calculator calculator = new Calculator();

    @Test
    public void testPrecedence() throws LanguageException {
        assertEquals(14.0, calculator.evaluateArithmeticExpression("2 + 3 * 4"), 0);
        assertEquals(20.0, calculator.evaluateArithmeticExpression("(2 + 3) * 4"), 0);
        assertEquals(512.0, calculator.evaluateArithmeticExpression("2^3^2"), 0);
        assertEquals(-4.0, calculator.evaluateArithmeticExpression("-2^2"), 0);
        assertEquals(8.0, calculator.evaluateArithmeticExpression("2**3"), 0);
        assertEquals(1.5, calculator.evaluateArithmeticExpression("2×3÷4"), 0);
    }

    @Test
    public void testConstantsAndFunctions() throws LanguageException {
        assertEquals(Math.PI * 2, calculator.evaluateArithmeticExpression("2pi"), 1e-15);
        assertEquals(3.0, calculator.evaluateArithmeticExpression("sqrt(9)"), 0);
        assertEquals(5.0, calculator.evaluateArithmeticExpression("abs(-5)"), 0);
        assertEquals(3.14, calculator.evaluateArithmeticExpression("round(pi, 2)"), 1e-15);
        assertEquals(1.0, calculator.evaluateArithmeticExpression("min(3, 1, 2)"), 0);
        assertEquals(6.0, calculator.evaluateArithmeticExpression("2(3)"), 0);
    }

    @Test
    public void testErrors() {
        expectFail("5/0", DivisionByZeroException.class, "Cannot divide by zero");
        expectFail("(2+3", UnbalancedParenthesesException.class, "Unbalanced parentheses: missing closing parenthesis");
        expectFail("", EmptyInputException.class, "Empty expression");
        expectFail("2+abc", UnknownIdentifierException.class, "Unknown name 'abc' at position 2");
        expectFail("sin(1)", UnknownIdentifierException.class, null);
        expectFail("x+1", UnknownIdentifierException.class, null);
    }

    @Test
    public void testCalculate() throws LanguageException {
        assertEquals(8.0,  calculator.calculate(5, '+', 3), 0);
        assertEquals(2.0,  calculator.calculate(5, '-', 3), 0);
        assertEquals(15.0, calculator.calculate(5, '×', 3), 0);
        assertEquals(2.5,  calculator.calculate(5, '÷', 2), 0);
        try {
            calculator.calculate(1, '%', 2);
            Assert.fail("Expected invalid operator");
        } catch(SyntaxException e) {
            assertEquals("Invalid operator: %", e.getMessage());
        }
        try {
            calculator.calculate(1e308, '*', 10);
            Assert.fail("Expected overflow");
        } catch(UndefinedResultException e) {
            assertTrue(e.getMessage().startsWith("Result is undefined"));
        }
        try {
            calculator.calculate(1, '/', 0);
            Assert.fail("Expected division by zero");
        } catch(DivisionByZeroException e) {
            assertEquals("Cannot divide by zero", e.getMessage());
        }
    }

    @Test
    public void testFormat() {
        assertEquals("14",             Calculator.format(14.0));
        assertEquals("-3",             Calculator.format(-3.0));
        assertEquals("0.3333333333",   Calculator.format(1.0 / 3));
        assertEquals("0.6666666667",   Calculator.format(2.0 / 3));
        assertEquals("0.3",            Calculator.format(0.1 + 0.2));
        assertEquals("0.0001",         Calculator.format(0.0001));
        assertEquals("1e-05",          Calculator.format(0.00001));
        assertEquals("100000000000000000000", Calculator.format(1e20));
        assertEquals("1.23456789e+10", Calculator.format(12345678901.5));
    }

    @Test
    public void testToggleSign() {
        assertEquals("-(5)", Calculator.toggleSign("5"));
        assertEquals("5",    Calculator.toggleSign("-(5)"));
        assertEquals("5",    Calculator.toggleSign("-5"));
        assertEquals("",     Calculator.toggleSign(""));
    }

    @Test
    public void testCompile() throws LanguageException {
        assertEquals("2*3", calculator.compile("2(3)").render());
        assertEquals(7.0, calculator.evaluate(calculator.compile("1+2*3")), 0);
    }

    @Test
    public void testNoStateBetweenCalls() throws LanguageException {
        assertEquals(4.0, calculator.evaluateArithmeticExpression("2+2"), 0);
        expectFail("5/0", DivisionByZeroException.class, null);
        assertEquals(4.0, calculator.evaluateArithmeticExpression("2+2"), 0);
    }



    ///////////////////
    // SUPPLEMENTAL //
    ///////////////////

    protected void expectFail(String text, Class<? extends LanguageException> expectedClass, String expectedMessage) {
        try {
            calculator.evaluateArithmeticExpression(text);
            Assert.fail("Expected failure for '" + text + "'");
        } catch(LanguageException e) {
            assertEquals(expectedClass, e.getClass());
            if(expectedMessage != null) {
                assertEquals(expectedMessage, e.getMessage());
            }
        }
    }
}
