/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

/**
    Failure while reducing a well-formed tree to a number.
**/
@SuppressWarnings("serial")
public class EvaluationException extends LanguageException
{
    public EvaluationException (String message)
    {
        super (message);
    }
}
