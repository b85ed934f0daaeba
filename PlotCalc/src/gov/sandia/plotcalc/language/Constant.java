/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

import java.math.BigDecimal;

public class Constant extends Expression
{
    public final double value;

    public Constant (double value)
    {
        this.value = value;
    }

    /**
        A negative literal prints with a leading minus, so it needs the same protection as a negation.
    **/
    public int precedence ()
    {
        if (value < 0  ||  isNegativeZero ()) return Operation.NEGATE.precedence;
        return 1;
    }

    public double eval (Environment context) throws EvaluationException
    {
        return check (value);
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append (format (value));
    }

    /**
        Plain decimal form, without exponent notation, since the Lexer does not accept exponents.
    **/
    public static String format (double value)
    {
        if (Double.isNaN (value)  ||  Double.isInfinite (value)) return String.valueOf (value);
        String result = BigDecimal.valueOf (value).stripTrailingZeros ().toPlainString ();
        if (value == 0  &&  1 / value < 0) return "-" + result;
        return result;
    }

    protected boolean isNegativeZero ()
    {
        return value == 0  &&  1 / value < 0;
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Constant)) return false;
        return Double.compare (value, ((Constant) that).value) == 0;
    }

    public int hashCode ()
    {
        return Double.hashCode (value);
    }
}
