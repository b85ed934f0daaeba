/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc;

import gov.sandia.plotcalc.backend.Calculator;
import gov.sandia.plotcalc.backend.Grapher;
import gov.sandia.plotcalc.language.Expression;
import gov.sandia.plotcalc.language.LanguageException;
import gov.sandia.plotcalc.language.ParseException;
import gov.sandia.plotcalc.plot.PlotSeries;

import java.io.PrintStream;

import org.apache.log4j.Logger;

/**
    Headless front end.
    <pre>
    -calc=&lt;expression&gt;                 print the value of an arithmetic expression
    -plot=&lt;function of x&gt;              print sampled points as x,y lines
        -xmin=&lt;number&gt; -xmax=&lt;number&gt;   domain (defaults from Settings)
        -points=&lt;count&gt;                 number of samples (default from Settings)
        -csv                            add a header line
    </pre>
**/
public class Main
{
    private static Logger logger = Logger.getLogger (Main.class);

    public static final int SUCCESS = 0;
    public static final int FAILURE = 1;
    public static final int USAGE   = 2;

    public static void main (String[] args)
    {
        System.exit (run (args, System.out, System.err));
    }

    public static int run (String[] args, PrintStream out, PrintStream err)
    {
        // Parse command line
        String  calc   = null;
        String  plot   = null;
        String  xmin   = null;
        String  xmax   = null;
        String  points = null;
        boolean csv    = false;
        for (String arg : args)
        {
            if      (arg.startsWith ("-calc="  )) calc   = arg.substring (6);
            else if (arg.startsWith ("-plot="  )) plot   = arg.substring (6);
            else if (arg.startsWith ("-xmin="  )) xmin   = arg.substring (6);
            else if (arg.startsWith ("-xmax="  )) xmax   = arg.substring (6);
            else if (arg.startsWith ("-points=")) points = arg.substring (8);
            else if (arg.equals     ("-csv"    )) csv    = true;
            else
            {
                err.println ("Unrecognized argument: " + arg);
                usage (err);
                return USAGE;
            }
        }
        if ((calc == null) == (plot == null))
        {
            usage (err);
            return USAGE;
        }

        try
        {
            if (calc != null)
            {
                Calculator calculator = new Calculator ();
                out.println (Calculator.format (calculator.evaluateArithmeticExpression (calc)));
                return SUCCESS;
            }

            double[] range = Settings.getRange ();
            double lo    = range[0];
            double hi    = range[1];
            int    count = Settings.getPoints ();
            try
            {
                if (xmin   != null) lo    = Double.parseDouble (xmin);
                if (xmax   != null) hi    = Double.parseDouble (xmax);
                if (points != null) count = Integer.parseInt (points);
            }
            catch (NumberFormatException e)
            {
                err.println ("Not a number: " + e.getMessage ());
                return USAGE;
            }

            Grapher grapher = new Grapher ();
            Expression f = grapher.compileFunctionOfX (plot);
            PlotSeries series = grapher.samplePlot (f, lo, hi, count);
            if (csv) out.println ("x,y");
            for (PlotSeries.Point p : series) out.println (p.x + "," + p.y);
            return SUCCESS;
        }
        catch (ParseException e)
        {
            logger.warn ("Could not read expression: " + e.getMessage ());
            e.print (err);
            return FAILURE;
        }
        catch (LanguageException e)
        {
            logger.warn ("Could not evaluate: " + e.getMessage ());
            err.println ("Error: " + e.getMessage ());
            return FAILURE;
        }
    }

    public static void usage (PrintStream err)
    {
        err.println ("Usage: plotcalc -calc=<expression>");
        err.println ("       plotcalc -plot=<function of x> [-xmin=<number>] [-xmax=<number>] [-points=<count>] [-csv]");
    }
}
