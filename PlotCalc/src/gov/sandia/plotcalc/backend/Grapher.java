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
import gov.sandia.plotcalc.language.ParseException;
import gov.sandia.plotcalc.language.Parser;
import gov.sandia.plotcalc.plot.PlotSeries;
import gov.sandia.plotcalc.plot.Sampler;

import org.apache.log4j.Logger;

/**
    Entry point for the function plotter. Functions are written in terms of x, optionally
    prefixed by "f(x)=", and may use pi, e, sin, cos, tan, sqrt and abs.
    Compile once, then evaluate or sample the returned tree as often as needed.
**/
public class Grapher
{
    private static Logger logger = Logger.getLogger (Grapher.class);

    public static final String VARIABLE = "x";

    protected final Environment environment;
    protected final Normalizer  normalizer;
    protected final Parser      parser;
    protected final Sampler     sampler;

    public Grapher ()
    {
        environment = Environment.grapher ();
        normalizer  = new Normalizer (true);
        parser      = new Parser (environment);
        sampler     = new Sampler (environment);
    }

    public Environment getEnvironment ()
    {
        return environment;
    }

    public Expression compileFunctionOfX (String text) throws ParseException
    {
        Expression result = parser.parse (normalizer.normalize (text));
        if (logger.isDebugEnabled ()) logger.debug ("compiled " + text + " -> " + result);
        return result;
    }

    public double evaluateAt (Expression expression, double x) throws EvaluationException
    {
        return expression.eval (environment.bind (VARIABLE, x));
    }

    public PlotSeries samplePlot (Expression expression, double xMin, double xMax, int count) throws LanguageException
    {
        return sampler.sample (expression, VARIABLE, xMin, xMax, count);
    }
}
