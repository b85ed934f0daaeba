/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

/**
    The sampling domain or point count cannot produce a series.
**/
@SuppressWarnings("serial")
public class InvalidRangeException extends LanguageException
{
    public InvalidRangeException (String message)
    {
        super (message);
    }
}
