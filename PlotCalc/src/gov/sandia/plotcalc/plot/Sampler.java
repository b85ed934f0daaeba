/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.plot;

import gov.sandia.plotcalc.language.EmptyDomainException;
import gov.sandia.plotcalc.language.Environment;
import gov.sandia.plotcalc.language.EvaluationException;
import gov.sandia.plotcalc.language.Expression;
import gov.sandia.plotcalc.language.InvalidRangeException;

import org.apache.log4j.Logger;

/**
    Evaluates an expression at evenly spaced points of an interval.
    A point whose evaluation fails (pole, domain violation, overflow) is left out of the series
    rather than failing the whole curve. Only a curve with no point at all is an error.
**/
public class Sampler
{
    private static Logger logger = Logger.getLogger (Sampler.class);

    protected final Environment environment;

    /**
        @param environment Base environment. The sampled variable is bound in a fresh copy for every point.
    **/
    public Sampler (Environment environment)
    {
        this.environment = environment;
    }

    /**
        @param count Number of points, including both ends of the interval. Must be at least 2.
    **/
    public PlotSeries sample (Expression expression, String variable, double xMin, double xMax, int count) throws InvalidRangeException, EmptyDomainException
    {
        if (! environment.isVariable (variable)) throw new IllegalArgumentException ("'" + variable + "' is not a variable of this environment");
        checkRange (xMin, xMax, count);

        double step = (xMax - xMin) / (count - 1);
        if (! Double.isFinite (step)) throw new InvalidRangeException ("Domain [" + xMin + ", " + xMax + "] is too wide to sample");

        PlotSeries result = new PlotSeries ();
        int skipped = 0;
        double previous = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < count; i++)
        {
            double x = xMin + i * step;
            if (x <= previous) continue;  // step is below the resolution of x
            previous = x;
            try
            {
                double y = expression.eval (environment.bind (variable, x));
                result.add (x, y);
            }
            catch (EvaluationException e)
            {
                skipped++;
                if (logger.isDebugEnabled ()) logger.debug ("skipping " + variable + "=" + x + ": " + e.getMessage ());
            }
        }
        if (logger.isDebugEnabled ()) logger.debug ("sampled " + expression + ": kept " + result.size () + " of " + count + " points, skipped " + skipped);

        if (result.isEmpty ())
        {
            throw new EmptyDomainException ("Could not evaluate function anywhere in [" + xMin + ", " + xMax + "]: " + expression);
        }
        return result;
    }

    public static void checkRange (double xMin, double xMax, int count) throws InvalidRangeException
    {
        if (! Double.isFinite (xMin)  ||  ! Double.isFinite (xMax)) throw new InvalidRangeException ("x min and x max must be finite numbers");
        if (xMin >= xMax) throw new InvalidRangeException ("x min must be less than x max");
        if (count < 2) throw new InvalidRangeException ("At least 2 sample points are needed, not " + count);
    }
}
