/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

/**
    No point of the sampled domain produced a finite value.
**/
@SuppressWarnings("serial")
public class EmptyDomainException extends LanguageException
{
    public EmptyDomainException (String message)
    {
        super (message);
    }
}
