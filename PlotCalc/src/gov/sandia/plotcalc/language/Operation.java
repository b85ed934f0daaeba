/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

import gov.sandia.plotcalc.language.Expression.Associativity;

/**
    The closed set of arithmetic operators. Each constant carries its own evaluation rule,
    so a tree built from these can never hold an operator that lacks one.
    Precedence follows the usual convention for this code: a lower number binds tighter.
**/
public enum Operation
{
    POWER ("^", 2, 2, Associativity.RIGHT_TO_LEFT)
    {
        public double apply (double a, double b)
        {
            return Math.pow (a, b);
        }
    },
    NEGATE ("-", 1, 3, Associativity.RIGHT_TO_LEFT)
    {
        public double apply (double a, double b)
        {
            return -a;
        }
    },
    MULTIPLY ("*", 2, 4, Associativity.LEFT_TO_RIGHT)
    {
        public double apply (double a, double b)
        {
            return a * b;
        }
    },
    DIVIDE ("/", 2, 4, Associativity.LEFT_TO_RIGHT)
    {
        public double apply (double a, double b) throws EvaluationException
        {
            if (b == 0) throw new DivisionByZeroException ();
            return a / b;
        }
    },
    ADD ("+", 2, 6, Associativity.LEFT_TO_RIGHT)
    {
        public double apply (double a, double b)
        {
            return a + b;
        }
    },
    SUBTRACT ("-", 2, 6, Associativity.LEFT_TO_RIGHT)
    {
        public double apply (double a, double b)
        {
            return a - b;
        }
    };

    public final String        symbol;
    public final int           arity;
    public final int           precedence;
    public final Associativity associativity;

    Operation (String symbol, int arity, int precedence, Associativity associativity)
    {
        this.symbol        = symbol;
        this.arity         = arity;
        this.precedence    = precedence;
        this.associativity = associativity;
    }

    /**
        @param b Ignored by unary operators.
    **/
    public abstract double apply (double a, double b) throws EvaluationException;

    /**
        Finds the binary operator written with the given symbol.
        @return null if the symbol is not a binary operator.
    **/
    public static Operation binary (String symbol)
    {
        for (Operation o : values ())
        {
            if (o.arity == 2  &&  o.symbol.equals (symbol)) return o;
        }
        return null;
    }
}
