/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

/**
    A function received an argument outside its mathematical domain.
**/
@SuppressWarnings("serial")
public class DomainException extends EvaluationException
{
    public DomainException (String message)
    {
        super (message);
    }
}
