/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

/**
    The token sequence does not follow the grammar.
**/
@SuppressWarnings("serial")
public class SyntaxException extends ParseException
{
    public SyntaxException (String message)
    {
        super (message);
    }

    public SyntaxException (String message, String line, int column)
    {
        super (message, line, column);
    }
}
