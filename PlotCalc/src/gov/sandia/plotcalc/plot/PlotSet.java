/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.plot;

import gov.sandia.plotcalc.Settings;
import gov.sandia.plotcalc.backend.Grapher;
import gov.sandia.plotcalc.language.Expression;
import gov.sandia.plotcalc.language.LanguageException;

import java.util.ArrayList;
import java.util.List;

import org.jfree.data.xy.XYSeriesCollection;

/**
    The list of functions shown together on one graph, all sampled over the same domain.
    Each function is identified by the text the user typed. Not thread-safe; owned by the UI.
**/
public class PlotSet
{
    public static class Entry
    {
        public final String     text;
        public final Expression expression;
        public final PlotSeries series;

        public Entry (String text, Expression expression, PlotSeries series)
        {
            this.text       = text;
            this.expression = expression;
            this.series     = series;
        }
    }

    protected final Grapher     grapher;
    protected final int         points;
    protected double            xMin;
    protected double            xMax;
    protected List<Entry>       entries = new ArrayList<Entry> ();

    public PlotSet (Grapher grapher)
    {
        this (grapher, Settings.getXMin (), Settings.getXMax (), Settings.getPoints ());
    }

    public PlotSet (Grapher grapher, double xMin, double xMax, int points)
    {
        this.grapher = grapher;
        this.xMin    = xMin;
        this.xMax    = xMax;
        this.points  = points;
    }

    /**
        Compiles and samples a new function.
        @return false if the same text is already plotted, in which case nothing changes.
    **/
    public boolean add (String text) throws LanguageException
    {
        text = text.trim ();
        if (indexOf (text) >= 0) return false;
        entries.add (build (text));
        return true;
    }

    /**
        Replaces the function at index, keeping its position in the list.
        @return false if the text is already plotted at some other index, in which case nothing changes.
    **/
    public boolean update (int index, String text) throws LanguageException
    {
        text = text.trim ();
        int existing = indexOf (text);
        if (existing >= 0  &&  existing != index) return false;
        entries.set (index, build (text));
        return true;
    }

    public void remove (int index)
    {
        entries.remove (index);
    }

    public void clear ()
    {
        entries.clear ();
    }

    /**
        Re-samples every function over a new domain. Either all of them succeed, or nothing changes.
    **/
    public void setRange (double xMin, double xMax) throws LanguageException
    {
        Sampler.checkRange (xMin, xMax, points);
        List<Entry> resampled = new ArrayList<Entry> (entries.size ());
        for (Entry e : entries)
        {
            resampled.add (new Entry (e.text, e.expression, grapher.samplePlot (e.expression, xMin, xMax, points)));
        }
        this.xMin = xMin;
        this.xMax = xMax;
        entries   = resampled;
    }

    public int indexOf (String text)
    {
        text = text.trim ();
        for (int i = 0; i < entries.size (); i++)
        {
            if (entries.get (i).text.equals (text)) return i;
        }
        return -1;
    }

    public int size ()
    {
        return entries.size ();
    }

    public Entry get (int index)
    {
        return entries.get (index);
    }

    public double getXMin ()
    {
        return xMin;
    }

    public double getXMax ()
    {
        return xMax;
    }

    public int getPoints ()
    {
        return points;
    }

    /**
        One chart series per function, keyed by the function's text, in list order.
    **/
    public XYSeriesCollection getDataset ()
    {
        XYSeriesCollection result = new XYSeriesCollection ();
        for (Entry e : entries) result.addSeries (e.series.toXYSeries (e.text));
        return result;
    }

    protected Entry build (String text) throws LanguageException
    {
        Expression expression = grapher.compileFunctionOfX (text);
        return new Entry (text, expression, grapher.samplePlot (expression, xMin, xMax, points));
    }
}
