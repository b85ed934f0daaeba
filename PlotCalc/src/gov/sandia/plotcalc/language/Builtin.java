/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
    Every function an expression may call. Which of them are visible depends on the Environment.
**/
public enum Builtin
{
    SQRT ("sqrt", 1, 1)
    {
        public double apply (double[] args) throws EvaluationException
        {
            if (args[0] < 0) throw new DomainException ("sqrt() of negative number " + args[0]);
            return Math.sqrt (args[0]);
        }
    },
    ABS ("abs", 1, 1)
    {
        public double apply (double[] args)
        {
            return Math.abs (args[0]);
        }
    },
    /**
        Ties go to the even neighbor. The optional second argument gives the number of decimal digits to keep.
    **/
    ROUND ("round", 1, 2)
    {
        public double apply (double[] args) throws EvaluationException
        {
            double value = args[0];
            if (args.length == 1) return Math.rint (value);

            double digits = args[1];
            if (digits != Math.rint (digits)) throw new DomainException ("round() digit count must be an integer, not " + digits);
            if (digits >  MAX_DIGITS) return value;
            if (digits < -MAX_DIGITS) return 0 * value;  // keeps the sign of zero
            BigDecimal exact = new BigDecimal (value);  // rounds the binary value, not its shortest decimal form
            return exact.setScale ((int) digits, RoundingMode.HALF_EVEN).doubleValue ();
        }
    },
    MIN ("min", 2, Integer.MAX_VALUE)
    {
        public double apply (double[] args)
        {
            double result = args[0];
            for (int i = 1; i < args.length; i++) result = Math.min (result, args[i]);
            return result;
        }
    },
    MAX ("max", 2, Integer.MAX_VALUE)
    {
        public double apply (double[] args)
        {
            double result = args[0];
            for (int i = 1; i < args.length; i++) result = Math.max (result, args[i]);
            return result;
        }
    },
    SIN ("sin", 1, 1)
    {
        public double apply (double[] args)
        {
            return Math.sin (args[0]);
        }
    },
    COS ("cos", 1, 1)
    {
        public double apply (double[] args)
        {
            return Math.cos (args[0]);
        }
    },
    TAN ("tan", 1, 1)
    {
        public double apply (double[] args)
        {
            return Math.tan (args[0]);
        }
    };

    /** Beyond this many digits, in either direction, a double has nothing left to round. **/
    public static final int MAX_DIGITS = 400;

    public final String name;
    public final int    minArgs;
    public final int    maxArgs;

    Builtin (String name, int minArgs, int maxArgs)
    {
        this.name    = name;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    public abstract double apply (double[] args) throws EvaluationException;

    public boolean accepts (int count)
    {
        return count >= minArgs  &&  count <= maxArgs;
    }

    /**
        Human-readable arity, for diagnostics.
    **/
    public String describeArity ()
    {
        if (minArgs == maxArgs)            return minArgs + (minArgs == 1 ? " argument" : " arguments");
        if (maxArgs == Integer.MAX_VALUE)  return minArgs + " or more arguments";
        return minArgs + " to " + maxArgs + " arguments";
    }

    /**
        @return null if no function has the given name.
    **/
    public static Builtin find (String name)
    {
        for (Builtin b : values ())
        {
            if (b.name.equals (name)) return b;
        }
        return null;
    }
}
