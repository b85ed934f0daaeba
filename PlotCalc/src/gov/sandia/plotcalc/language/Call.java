/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

import java.util.Arrays;

/**
    Application of a built-in function to a fixed list of arguments.
**/
public class Call extends Expression
{
    public final Builtin function;
    protected final Expression[] operands;
    protected final int          depth;

    public Call (Builtin function, Expression... operands)
    {
        if (! function.accepts (operands.length)) throw new IllegalArgumentException (function.name + "() takes " + function.describeArity ());
        this.function = function;
        this.operands = operands.clone ();
        int deepest = 0;
        for (Expression e : this.operands)
        {
            if (e == null) throw new NullPointerException ("operand");
            deepest = Math.max (deepest, e.depth ());
        }
        depth = deepest + 1;
    }

    public int depth ()
    {
        return depth;
    }

    public int getOperandCount ()
    {
        return operands.length;
    }

    public Expression getOperand (int i)
    {
        return operands[i];
    }

    /**
        @throws IllegalArgumentException if the context does not offer this function.
        A tree compiled for one environment should only be evaluated against that environment.
    **/
    public double eval (Environment context) throws EvaluationException
    {
        if (! context.hasFunction (function)) throw new IllegalArgumentException (function.name + "() is not available in this environment");
        double[] args = new double[operands.length];
        for (int i = 0; i < operands.length; i++) args[i] = operands[i].eval (context);
        return check (function.apply (args));
    }

    public void visit (Visitor visitor)
    {
        if (! visitor.visit (this)) return;
        for (Expression e : operands) e.visit (visitor);
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append (function.name);
        renderer.result.append ("(");
        for (int i = 0; i < operands.length; i++)
        {
            if (i > 0) renderer.result.append (",");
            operands[i].render (renderer);
        }
        renderer.result.append (")");
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Call)) return false;
        Call c = (Call) that;
        return function == c.function  &&  Arrays.equals (operands, c.operands);
    }

    public int hashCode ()
    {
        return function.hashCode () * 31 + Arrays.hashCode (operands);
    }
}
