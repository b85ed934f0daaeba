/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

public class OperatorUnary extends Expression
{
    public final Operation  operator;
    public final Expression operand;
    protected final int     depth;

    public OperatorUnary (Operation operator, Expression operand)
    {
        if (operator.arity != 1) throw new IllegalArgumentException (operator + " is not a unary operator");
        if (operand == null) throw new NullPointerException ("operand");
        this.operator = operator;
        this.operand  = operand;
        depth = operand.depth () + 1;
    }

    public int depth ()
    {
        return depth;
    }

    public Associativity associativity ()
    {
        return operator.associativity;
    }

    public int precedence ()
    {
        return operator.precedence;
    }

    public double eval (Environment context) throws EvaluationException
    {
        return check (operator.apply (operand.eval (context), 0));
    }

    public void visit (Visitor visitor)
    {
        if (! visitor.visit (this)) return;
        operand.visit (visitor);
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append (operator.symbol);
        boolean needParens = precedence () < operand.precedence ();
        if (needParens) renderer.result.append ("(");
        operand.render (renderer);
        if (needParens) renderer.result.append (")");
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof OperatorUnary)) return false;
        OperatorUnary o = (OperatorUnary) that;
        return operator == o.operator  &&  operand.equals (o.operand);
    }

    public int hashCode ()
    {
        return operator.hashCode () * 31 + operand.hashCode ();
    }
}
