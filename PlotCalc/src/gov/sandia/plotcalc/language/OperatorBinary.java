/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

public class OperatorBinary extends Expression
{
    public final Operation  operator;
    public final Expression operand0;
    public final Expression operand1;
    protected final int     depth;

    public OperatorBinary (Operation operator, Expression operand0, Expression operand1)
    {
        if (operator.arity != 2) throw new IllegalArgumentException (operator + " is not a binary operator");
        if (operand0 == null) throw new NullPointerException ("operand0");
        if (operand1 == null) throw new NullPointerException ("operand1");
        this.operator = operator;
        this.operand0 = operand0;
        this.operand1 = operand1;
        depth = Math.max (operand0.depth (), operand1.depth ()) + 1;
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
        double a = operand0.eval (context);
        double b = operand1.eval (context);
        return check (operator.apply (a, b));
    }

    public void visit (Visitor visitor)
    {
        if (! visitor.visit (this)) return;
        operand0.visit (visitor);
        operand1.visit (visitor);
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;

        // Left-hand child
        boolean needParens =    precedence () < operand0.precedence ()   // read "<" as "comes before" rather than "less"
                             ||    precedence () == operand0.precedence ()
                                && associativity () == Associativity.RIGHT_TO_LEFT;
        if (needParens) renderer.result.append ("(");
        operand0.render (renderer);
        if (needParens) renderer.result.append (")");

        renderer.result.append (operator.symbol);

        // Right-hand child
        needParens =    precedence () < operand1.precedence ()
                     ||    precedence () == operand1.precedence ()
                        && associativity () == Associativity.LEFT_TO_RIGHT;
        if (needParens) renderer.result.append ("(");
        operand1.render (renderer);
        if (needParens) renderer.result.append (")");
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof OperatorBinary)) return false;
        OperatorBinary o = (OperatorBinary) that;
        return operator == o.operator  &&  operand0.equals (o.operand0)  &&  operand1.equals (o.operand1);
    }

    public int hashCode ()
    {
        return (operator.hashCode () * 31 + operand0.hashCode ()) * 31 + operand1.hashCode ();
    }
}
