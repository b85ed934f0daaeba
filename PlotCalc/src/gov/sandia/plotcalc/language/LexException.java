/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

/**
    A character that cannot start any token.
**/
@SuppressWarnings("serial")
public class LexException extends ParseException
{
    public LexException (String message, String line, int column)
    {
        super (message, line, column);
    }
}
