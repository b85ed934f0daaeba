/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

/**
    Reference by name to a constant (such as pi) or to a free variable (such as x).
    The name is resolved against the Environment at evaluation time.
**/
public class AccessVariable extends Expression
{
    public final String name;

    public AccessVariable (String name)
    {
        if (name == null) throw new NullPointerException ("name");
        this.name = name;
    }

    public double eval (Environment context) throws EvaluationException
    {
        return check (context.get (name));
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append (name);
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof AccessVariable)) return false;
        return name.equals (((AccessVariable) that).name);
    }

    public int hashCode ()
    {
        return name.hashCode ();
    }
}
