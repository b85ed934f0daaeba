/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

import java.util.ArrayList;
import java.util.List;

/**
    Recursive-descent parser for the expression grammar, from lowest to highest precedence:
    <pre>
    expr  := term (('+'|'-') term)*
    term  := unary (('*'|'/') unary)*
    unary := ('-'|'+') unary | power
    power := atom ('^' unary)?
    atom  := NUMBER | CONSTANT | VARIABLE | FUNCTION '(' expr (',' expr)* ')' | '(' expr ')'
    </pre>
    Thus + - * / group left to right, ^ groups right to left, and a leading minus applies
    after any power: -2^2 is -(2^2).
    A Parser holds no state between calls, so one instance may serve many threads.
    Nesting (parentheses, signs, powers, function arguments) and the depth of the resulting tree
    are both limited to MAX_DEPTH, so that neither parsing nor evaluation can exhaust the stack.
**/
public class Parser
{
    public static final int MAX_DEPTH = 500;

    protected final Environment environment;

    public Parser (Environment environment)
    {
        this.environment = environment;
    }

    /**
        Convenience for tokenizing and parsing canonical text in one step.
    **/
    public Expression parse (String canonical) throws ParseException
    {
        List<Token> tokens = new Lexer (environment).tokenize (canonical);
        return new Cursor (tokens, canonical).parse ();
    }

    public Expression parse (List<Token> tokens) throws ParseException
    {
        if (tokens.isEmpty ()  ||  ! tokens.get (tokens.size () - 1).is (Token.Kind.END))
        {
            List<Token> terminated = new ArrayList<Token> (tokens);
            int end = tokens.isEmpty () ? 0 : tokens.get (tokens.size () - 1).position + tokens.get (tokens.size () - 1).text.length ();
            terminated.add (new Token (Token.Kind.END, "", end));
            tokens = terminated;
        }
        return new Cursor (tokens, "").parse ();
    }

    /**
        Position within one token sequence. Lives only for the duration of a single parse.
    **/
    protected class Cursor
    {
        protected final List<Token> tokens;
        protected final String      line;  // for diagnostics only; may be empty
        protected int               index;
        protected int               nesting;

        public Cursor (List<Token> tokens, String line)
        {
            this.tokens = tokens;
            this.line   = line;
        }

        public Expression parse () throws ParseException
        {
            Expression result = expr ();
            Token t = peek ();
            if (! t.is (Token.Kind.END)) throw unexpected (t);
            return result;
        }

        protected Expression expr () throws ParseException
        {
            Expression result = term ();
            while (true)
            {
                Token t = peek ();
                Operation op = binary (t, Operation.ADD.precedence);
                if (op == null) break;
                index++;
                result = limit (new OperatorBinary (op, result, term ()), t);
            }
            return result;
        }

        protected Expression term () throws ParseException
        {
            Expression result = unary ();
            while (true)
            {
                Token t = peek ();
                Operation op = binary (t, Operation.MULTIPLY.precedence);
                if (op == null) break;
                index++;
                result = limit (new OperatorBinary (op, result, unary ()), t);
            }
            return result;
        }

        /**
            Every recursive path of the grammar passes through here, so this is where nesting is counted.
        **/
        protected Expression unary () throws ParseException
        {
            Token t = peek ();
            if (++nesting > MAX_DEPTH) throw tooDeep (t);
            try
            {
                if (t.isOperator ("-"))
                {
                    index++;
                    return limit (new OperatorUnary (Operation.NEGATE, unary ()), t);
                }
                if (t.isOperator ("+"))
                {
                    index++;
                    return unary ();
                }
                return power ();
            }
            finally
            {
                nesting--;
            }
        }

        protected Expression power () throws ParseException
        {
            Expression base = atom ();
            Token t = peek ();
            if (binary (t, Operation.POWER.precedence) == null) return base;
            index++;
            return limit (new OperatorBinary (Operation.POWER, base, unary ()), t);
        }

        protected Expression atom () throws ParseException
        {
            Token t = next ();
            switch (t.kind)
            {
                case NUMBER:
                    return new Constant (t.value);
                case IDENTIFIER:
                    Builtin function = environment.getFunction (t.text);
                    if (function != null) return call (function, t);
                    if (environment.isConstant (t.text)  ||  environment.isVariable (t.text)) return new AccessVariable (t.text);
                    throw new UnknownIdentifierException (t.text, line, t.position);
                case LEFT_PAREN:
                    Expression result = expr ();
                    expect (Token.Kind.RIGHT_PAREN, t);
                    return result;
                default:
                    throw new SyntaxException ("Missing operand: expected a number, name or '(' but found " + t.describe () + " at position " + t.position, line, t.position);
            }
        }

        protected Expression call (Builtin function, Token name) throws ParseException
        {
            Token open = next ();
            if (! open.is (Token.Kind.LEFT_PAREN))
            {
                throw new SyntaxException ("Expected '(' after " + function.name + " but found " + open.describe () + " at position " + open.position, line, open.position);
            }
            List<Expression> arguments = new ArrayList<Expression> ();
            arguments.add (expr ());
            while (peek ().is (Token.Kind.COMMA))
            {
                index++;
                arguments.add (expr ());
            }
            expect (Token.Kind.RIGHT_PAREN, open);
            if (! function.accepts (arguments.size ()))
            {
                throw new SyntaxException (function.name + "() takes " + function.describeArity () + " but was given " + arguments.size () + " at position " + name.position, line, name.position);
            }
            return limit (new Call (function, arguments.toArray (new Expression[arguments.size ()])), name);
        }

        protected void expect (Token.Kind kind, Token open) throws SyntaxException
        {
            Token t = next ();
            if (t.is (kind)) return;
            throw new SyntaxException ("Expected ')' to match '(' at position " + open.position + " but found " + t.describe () + " at position " + t.position, line, t.position);
        }

        /**
            @return The binary operator at t with the given precedence, or null if t is anything else.
        **/
        protected Operation binary (Token t, int precedence)
        {
            if (! t.is (Token.Kind.OPERATOR)) return null;
            Operation result = Operation.binary (t.text);
            if (result == null  ||  result.precedence != precedence) return null;
            return result;
        }

        protected Expression limit (Expression e, Token at) throws SyntaxException
        {
            if (e.depth () > MAX_DEPTH) throw tooDeep (at);
            return e;
        }

        protected SyntaxException tooDeep (Token at)
        {
            return new SyntaxException ("Expression is nested more than " + MAX_DEPTH + " levels deep at position " + at.position, line, at.position);
        }

        protected Token peek ()
        {
            return tokens.get (index);
        }

        protected Token next ()
        {
            Token result = tokens.get (index);
            if (! result.is (Token.Kind.END)) index++;  // END is sticky
            return result;
        }

        protected SyntaxException unexpected (Token t)
        {
            return new SyntaxException ("Unexpected " + t.describe () + " at position " + t.position, line, t.position);
        }
    }
}
