/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

import java.util.Set;
import java.util.TreeSet;

/**
    Base class of the expression tree. A tree is built once by the Parser, never changes afterward,
    and may be evaluated any number of times, from any thread, against different Environments.
**/
public abstract class Expression
{
    public enum Associativity
    {
        LEFT_TO_RIGHT,
        RIGHT_TO_LEFT
    }

    public Associativity associativity ()
    {
        return Associativity.LEFT_TO_RIGHT;
    }

    /**
        Lower numbers bind tighter. Leaves and function calls never need parentheses, so they return 1.
    **/
    public int precedence ()
    {
        return 1;
    }

    /**
        Number of levels in this subtree, counting this node. A leaf has depth 1.
    **/
    public int depth ()
    {
        return 1;
    }

    /**
        Reduces this subtree to a number. Children are evaluated first, then this node's rule is applied.
        @return Always a finite value.
    **/
    public abstract double eval (Environment context) throws EvaluationException;

    public void visit (Visitor visitor)
    {
        visitor.visit (this);
    }

    /**
        Names of all variables and constants referenced by this tree, in sorted order.
    **/
    public Set<String> variables ()
    {
        final Set<String> result = new TreeSet<String> ();
        visit (new Visitor ()
        {
            public boolean visit (Expression e)
            {
                if (e instanceof AccessVariable) result.add (((AccessVariable) e).name);
                return true;
            }
        });
        return result;
    }

    public String render ()
    {
        Renderer renderer = new Renderer ();
        render (renderer);
        return renderer.result.toString ();
    }

    public abstract void render (Renderer renderer);

    /**
        Rejects NaN and infinity. Every node passes its result through here.
    **/
    protected double check (double value) throws UndefinedResultException
    {
        if (Double.isNaN (value)  ||  Double.isInfinite (value)) throw new UndefinedResultException (render ());
        return value;
    }

    public String toString ()
    {
        return render ();
    }
}
