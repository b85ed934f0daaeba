/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

import java.util.ArrayList;
import java.util.List;

/**
    Splits canonical text into tokens. The returned list always ends with a single END token.
**/
public class Lexer
{
    protected static final String operators = "+-*/^";

    protected final Environment environment;

    /**
        @param environment Decides which identifiers are acceptable.
    **/
    public Lexer (Environment environment)
    {
        this.environment = environment;
    }

    public List<Token> tokenize (String text) throws ParseException
    {
        List<Token> result = new ArrayList<Token> ();
        int count = text.length ();
        int i = 0;
        while (i < count)
        {
            char c = text.charAt (i);
            if (Character.isWhitespace (c))
            {
                i++;
                continue;
            }

            int start = i;
            if (isDigit (c)  ||  c == '.')
            {
                boolean point = false;
                boolean digits = false;
                while (i < count)
                {
                    c = text.charAt (i);
                    if (isDigit (c)) digits = true;
                    else if (c == '.'  &&  ! point) point = true;
                    else break;
                    i++;
                }
                String number = text.substring (start, i);
                if (! digits) throw new LexException ("Malformed number '" + number + "' at position " + start, text, start);
                result.add (new Token (Token.Kind.NUMBER, number, Double.parseDouble (number), start));
            }
            else if (isLetter (c))
            {
                while (i < count  &&  isLetter (text.charAt (i))) i++;
                String name = text.substring (start, i);
                if (! environment.recognizes (name)) throw new UnknownIdentifierException (name, text, start);
                result.add (new Token (Token.Kind.IDENTIFIER, name, start));
            }
            else
            {
                Token.Kind kind;
                if      (operators.indexOf (c) >= 0) kind = Token.Kind.OPERATOR;
                else if (c == '(')                   kind = Token.Kind.LEFT_PAREN;
                else if (c == ')')                   kind = Token.Kind.RIGHT_PAREN;
                else if (c == ',')                   kind = Token.Kind.COMMA;
                else throw new LexException ("Unexpected character '" + c + "' at position " + start, text, start);
                result.add (new Token (kind, String.valueOf (c), start));
                i++;
            }
        }
        result.add (new Token (Token.Kind.END, "", count));
        return result;
    }

    protected static boolean isDigit (char c)
    {
        return c >= '0'  &&  c <= '9';
    }

    protected static boolean isLetter (char c)
    {
        return (c >= 'a'  &&  c <= 'z')  ||  (c >= 'A'  &&  c <= 'Z');
    }
}
