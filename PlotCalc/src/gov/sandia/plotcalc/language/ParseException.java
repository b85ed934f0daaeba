/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

import java.io.PrintStream;

/**
    Failure to turn text into an expression tree.
    Carries the text being processed and the zero-based column of the problem, when known.
**/
@SuppressWarnings("serial")
public class ParseException extends LanguageException
{
    public String line   = "";
    public int    column = -1;

    public ParseException (String message)
    {
        super (message);
    }

    public ParseException (String message, String line, int column)
    {
        super (message);
        this.line   = line;
        this.column = column;
    }

    public void print (PrintStream ps)
    {
        ps.println (getMessage ());
        if (line.isEmpty ()) return;
        ps.println (line);
        if (column < 0) return;
        for (int i = 0; i < column; i++) ps.print (" ");
        ps.println ("^");
    }
}
