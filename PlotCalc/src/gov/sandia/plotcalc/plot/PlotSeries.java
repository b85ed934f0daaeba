/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.plot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.jfree.data.xy.XYSeries;

/**
    Points of one sampled curve, in ascending x. Every stored coordinate is finite.
    Only the Sampler adds points; everyone else sees a read-only series.
**/
public class PlotSeries implements Iterable<PlotSeries.Point>
{
    public static class Point
    {
        public final double x;
        public final double y;

        public Point (double x, double y)
        {
            this.x = x;
            this.y = y;
        }

        public boolean equals (Object that)
        {
            if (! (that instanceof Point)) return false;
            Point p = (Point) that;
            return Double.compare (x, p.x) == 0  &&  Double.compare (y, p.y) == 0;
        }

        public int hashCode ()
        {
            return Double.hashCode (x) * 31 + Double.hashCode (y);
        }

        public String toString ()
        {
            return "(" + x + ", " + y + ")";
        }
    }

    protected final List<Point> points = new ArrayList<Point> ();

    void add (double x, double y)
    {
        if (! Double.isFinite (x)  ||  ! Double.isFinite (y)) throw new IllegalArgumentException ("Non-finite point (" + x + ", " + y + ")");
        if (! points.isEmpty ()  &&  x <= points.get (points.size () - 1).x) throw new IllegalArgumentException ("Points must be added in ascending x");
        points.add (new Point (x, y));
    }

    public int size ()
    {
        return points.size ();
    }

    public boolean isEmpty ()
    {
        return points.isEmpty ();
    }

    public Point get (int i)
    {
        return points.get (i);
    }

    public List<Point> getPoints ()
    {
        return Collections.unmodifiableList (points);
    }

    public Iterator<Point> iterator ()
    {
        return getPoints ().iterator ();
    }

    public double[] getX ()
    {
        double[] result = new double[points.size ()];
        for (int i = 0; i < result.length; i++) result[i] = points.get (i).x;
        return result;
    }

    public double[] getY ()
    {
        double[] result = new double[points.size ()];
        for (int i = 0; i < result.length; i++) result[i] = points.get (i).y;
        return result;
    }

    /**
        @return Smallest y in the series, or NaN if the series is empty.
    **/
    public double getMinY ()
    {
        double result = Double.NaN;
        for (Point p : points) if (Double.isNaN (result)  ||  p.y < result) result = p.y;
        return result;
    }

    /**
        @return Largest y in the series, or NaN if the series is empty.
    **/
    public double getMaxY ()
    {
        double result = Double.NaN;
        for (Point p : points) if (Double.isNaN (result)  ||  p.y > result) result = p.y;
        return result;
    }

    /**
        Copies the points into a chart series, for handing to a renderer.
    **/
    public XYSeries toXYSeries (Comparable<?> key)
    {
        XYSeries result = new XYSeries (key, false, false);
        for (Point p : points) result.add (p.x, p.y, false);
        return result;
    }

    public String toString ()
    {
        return points.toString ();
    }
}
