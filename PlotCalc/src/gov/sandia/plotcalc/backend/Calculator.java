/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.backend;

import gov.sandia.plotcalc.language.Environment;
import gov.sandia.plotcalc.language.EvaluationException;
import gov.sandia.plotcalc.language.Expression;
import gov.sandia.plotcalc.language.LanguageException;
import gov.sandia.plotcalc.language.Normalizer;
import gov.sandia.plotcalc.language.Operation;
import gov.sandia.plotcalc.language.Parser;
import gov.sandia.plotcalc.language.SyntaxException;
import gov.sandia.plotcalc.language.UndefinedResultException;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

import org.apache.log4j.Logger;

/**
    Entry point for the calculator display. Evaluates typed arithmetic with the usual precedence,
    the constants pi and e, and the functions sqrt, abs, round, min and max.
    Keeps no result between calls; the caller decides what history to retain.
**/
public class Calculator
{
    private static Logger logger = Logger.getLogger (Calculator.class);

    /** Significant digits shown for a non-integral result. **/
    public static final int DISPLAY_DIGITS = 10;

    protected final Environment environment;
    protected final Normalizer  normalizer;
    protected final Parser      parser;

    public Calculator ()
    {
        environment = Environment.calculator ();
        normalizer  = new Normalizer (false);
        parser      = new Parser (environment);
    }

    public Environment getEnvironment ()
    {
        return environment;
    }

    /**
        Normalizes, parses and evaluates the given text.
        @return A finite value.
    **/
    public double evaluateArithmeticExpression (String text) throws LanguageException
    {
        Expression expression = compile (text);
        double result = expression.eval (environment);
        if (logger.isDebugEnabled ()) logger.debug (text + " -> " + expression + " = " + result);
        return result;
    }

    /**
        Parses without evaluating. Mostly useful for showing the user how their input was understood.
    **/
    public Expression compile (String text) throws LanguageException
    {
        return parser.parse (normalizer.normalize (text));
    }

    /**
        Two-operand form used by the keypad.
        @param operator One of + - * / or the glyphs × ÷
    **/
    public double calculate (double a, char operator, double b) throws LanguageException
    {
        Operation op;
        switch (operator)
        {
            case '+':           op = Operation.ADD;      break;
            case '-':           op = Operation.SUBTRACT; break;
            case '*': case '×': op = Operation.MULTIPLY; break;
            case '/': case '÷': op = Operation.DIVIDE;   break;
            default: throw new SyntaxException ("Invalid operator: " + operator);
        }
        double result = op.apply (a, b);
        if (! Double.isFinite (result)) throw new UndefinedResultException (a + " " + operator + " " + b);
        return result;
    }

    /**
        Display form of a result: integral values without a decimal point, everything else
        with up to DISPLAY_DIGITS significant digits and no trailing zeros.
        Exponent notation is used for very large or very small magnitudes.
    **/
    public static String format (double value)
    {
        if (Double.isNaN (value)  ||  Double.isInfinite (value)) return String.valueOf (value);
        if (value == Math.rint (value)) return new BigDecimal (value).toBigInteger ().toString ();

        BigDecimal rounded = new BigDecimal (value).round (new MathContext (DISPLAY_DIGITS, RoundingMode.HALF_EVEN)).stripTrailingZeros ();
        int exponent = rounded.precision () - rounded.scale () - 1;
        if (exponent < -4  ||  exponent >= DISPLAY_DIGITS)
        {
            String mantissa = rounded.movePointLeft (exponent).toPlainString ();
            return mantissa + (exponent < 0 ? "e-" : "e+") + String.format ("%02d", Math.abs (exponent));
        }
        return rounded.toPlainString ();
    }

    /**
        The keypad's +/- key. Unwraps "-(...)", drops a leading minus, or wraps the whole text as "-(...)".
    **/
    public static String toggleSign (String text)
    {
        if (text == null  ||  text.isEmpty ()) return text;
        if (text.startsWith ("-(")  &&  text.endsWith (")")) return text.substring (2, text.length () - 1);
        if (text.startsWith ("-"))                           return text.substring (1);
        return "-(" + text + ")";
    }

    /**
        Evaluates a tree built elsewhere against the calculator environment.
    **/
    public double evaluate (Expression expression) throws EvaluationException
    {
        return expression.eval (environment);
    }
}
