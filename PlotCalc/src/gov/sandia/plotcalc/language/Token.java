/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

/**
    One lexical unit of canonical text. Immutable.
**/
public class Token
{
    public enum Kind
    {
        NUMBER,
        IDENTIFIER,
        OPERATOR,
        LEFT_PAREN,
        RIGHT_PAREN,
        COMMA,
        END
    }

    public final Kind   kind;
    public final String text;      // exact source characters. Empty for END.
    public final double value;     // only meaningful for NUMBER
    public final int    position;  // zero-based column in the canonical text

    public Token (Kind kind, String text, int position)
    {
        this (kind, text, 0, position);
    }

    public Token (Kind kind, String text, double value, int position)
    {
        this.kind     = kind;
        this.text     = text;
        this.value    = value;
        this.position = position;
    }

    public boolean is (Kind kind)
    {
        return this.kind == kind;
    }

    public boolean isOperator (String symbol)
    {
        return kind == Kind.OPERATOR  &&  text.equals (symbol);
    }

    /**
        Form used in diagnostics.
    **/
    public String describe ()
    {
        if (kind == Kind.END) return "end of input";
        return "'" + text + "'";
    }

    public boolean equals (Object o)
    {
        if (! (o instanceof Token)) return false;
        Token that = (Token) o;
        return kind == that.kind  &&  text.equals (that.text)  &&  position == that.position;
    }

    public int hashCode ()
    {
        return (kind.hashCode () * 31 + text.hashCode ()) * 31 + position;
    }

    public String toString ()
    {
        return kind + "(" + text + ")@" + position;
    }
}
