/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

/**
    The input contains characters outside the accepted vocabulary.
**/
@SuppressWarnings("serial")
public class InvalidCharacterException extends ParseException
{
    public String characters;  // distinct offending characters, in order of first appearance

    public InvalidCharacterException (String characters, String line, int column)
    {
        super ("Invalid characters in expression: " + characters, line, column);
        this.characters = characters;
    }
}
