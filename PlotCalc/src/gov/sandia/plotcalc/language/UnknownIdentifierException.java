/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

@SuppressWarnings("serial")
public class UnknownIdentifierException extends ParseException
{
    public String name;

    public UnknownIdentifierException (String name, String line, int column)
    {
        super ("Unknown name '" + name + "' at position " + column, line, column);
        this.name = name;
    }
}
