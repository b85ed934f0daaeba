/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

@SuppressWarnings("serial")
public class UndefinedResultException extends EvaluationException
{
    public UndefinedResultException (String what)
    {
        super ("Result is undefined (infinity or NaN) in " + what);
    }
}
