/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

/**
    Root of all failures produced while turning user text into a number or a plot.
    The message is meant to be shown to the user as-is.
**/
@SuppressWarnings("serial")
public class LanguageException extends Exception
{
    public LanguageException (String message)
    {
        super (message);
    }

    public LanguageException (String message, Throwable cause)
    {
        super (message, cause);
    }
}
