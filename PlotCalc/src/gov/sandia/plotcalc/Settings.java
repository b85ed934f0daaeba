/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc;

import org.apache.log4j.Logger;

/**
    Defaults for plotting, read from system properties so they can be changed with -D on the command line.
    A malformed value falls back to the built-in default.
**/
public class Settings
{
    private static Logger logger = Logger.getLogger (Settings.class);

    public static final String POINTS = "plotcalc.points";
    public static final String XMIN   = "plotcalc.xmin";
    public static final String XMAX   = "plotcalc.xmax";

    public static final int    DEFAULT_POINTS = 500;
    public static final double DEFAULT_XMIN   = -10;
    public static final double DEFAULT_XMAX   =  10;

    public static int getPoints ()
    {
        String value = System.getProperty (POINTS);
        if (value == null) return DEFAULT_POINTS;
        try
        {
            int result = Integer.parseInt (value.trim ());
            if (result >= 2) return result;
            logger.warn ("Ignoring " + POINTS + "=" + value + " since at least 2 points are needed; using " + DEFAULT_POINTS);
        }
        catch (NumberFormatException e)
        {
            logger.warn ("Ignoring " + POINTS + "=" + value + "; using " + DEFAULT_POINTS);
        }
        return DEFAULT_POINTS;
    }

    public static double getXMin ()
    {
        double[] range = getRange ();
        return range[0];
    }

    public static double getXMax ()
    {
        double[] range = getRange ();
        return range[1];
    }

    /**
        Both ends are checked together, since neither is usable if they are out of order.
    **/
    public static double[] getRange ()
    {
        double xmin = getDouble (XMIN, DEFAULT_XMIN);
        double xmax = getDouble (XMAX, DEFAULT_XMAX);
        if (xmin < xmax) return new double[] {xmin, xmax};
        logger.warn ("Ignoring " + XMIN + "=" + xmin + " and " + XMAX + "=" + xmax + " because they are out of order");
        return new double[] {DEFAULT_XMIN, DEFAULT_XMAX};
    }

    protected static double getDouble (String key, double defaultValue)
    {
        String value = System.getProperty (key);
        if (value == null) return defaultValue;
        try
        {
            double result = Double.parseDouble (value.trim ());
            if (Double.isFinite (result)) return result;
            logger.warn ("Ignoring " + key + "=" + value + " since it is not finite; using " + defaultValue);
        }
        catch (NumberFormatException e)
        {
            logger.warn ("Ignoring " + key + "=" + value + "; using " + defaultValue);
        }
        return defaultValue;
    }
}
