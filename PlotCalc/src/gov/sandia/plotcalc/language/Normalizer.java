/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
    Rewrites user-typed text into canonical form and rejects text that is obviously malformed.
    Canonical form uses ^ for powers, ASCII * and /, and an explicit * wherever the user
    relied on juxtaposition ("2(3+4)", "3sin(x)", "(x+1)(x-1)").
    Names are not checked here beyond their letters. The Lexer has the final word on identifiers.
**/
public class Normalizer
{
    /** Every name the language knows, across all environments. **/
    public static final String[] IDENTIFIERS = {"pi", "e", "sqrt", "abs", "round", "min", "max", "sin", "cos", "tan", "x"};

    protected static final String  symbols = "+-*/^(),.×÷";
    protected static final String  letters;
    protected static final Pattern functionHeader = Pattern.compile ("^[fF]\\s*\\(\\s*[xX]\\s*\\)\\s*=");

    // Implicit multiplication, applied in this order.
    protected static final Pattern digitParen  = Pattern.compile ("(?<=\\d)(?=\\()");
    protected static final Pattern closeAny    = Pattern.compile ("(?<=\\))(?=[\\d(A-Za-z])");
    protected static final Pattern digitName   = Pattern.compile ("(?<=\\d)(?=[A-Za-z])");
    protected static final Pattern xParen      = Pattern.compile ("(?<![A-Za-z])x(?=\\()");

    static
    {
        StringBuilder b = new StringBuilder ();
        for (String name : IDENTIFIERS)
        {
            for (char c : name.toCharArray ()) if (b.indexOf (String.valueOf (c)) < 0) b.append (c);
        }
        letters = b.toString ();
    }

    protected final boolean functionOfX;

    /**
        @param functionOfX Accept and discard a leading "f(x)=" header. Used by the plotter.
    **/
    public Normalizer (boolean functionOfX)
    {
        this.functionOfX = functionOfX;
    }

    public String normalize (String raw) throws ParseException
    {
        if (raw == null) throw new EmptyInputException ();
        String text = raw.trim ();
        if (functionOfX) text = stripHeader (text).trim ();
        if (text.isEmpty ()) throw new EmptyInputException ();

        validate (text);

        text = text.replace ("**", "^");
        text = text.replace ('×', '*').replace ('÷', '/');

        text = digitParen.matcher (text).replaceAll ("*");
        text = closeAny  .matcher (text).replaceAll ("*");
        text = digitName .matcher (text).replaceAll ("*");
        text = xParen    .matcher (text).replaceAll ("x*");
        return text;
    }

    public static String stripHeader (String text)
    {
        Matcher m = functionHeader.matcher (text);
        if (m.find ()) return text.substring (m.end ());
        return text;
    }

    /**
        Checks the character set and the nesting of parentheses.
        Runs on the text as the user typed it, so columns in the diagnostics match what they see.
    **/
    public static void validate (String text) throws ParseException
    {
        Set<Character> invalid = new LinkedHashSet<Character> ();
        int firstInvalid = -1;
        int count = text.length ();
        for (int i = 0; i < count; i++)
        {
            char c = text.charAt (i);
            if (isAllowed (c)) continue;
            invalid.add (c);
            if (firstInvalid < 0) firstInvalid = i;
        }
        if (! invalid.isEmpty ())
        {
            StringBuilder characters = new StringBuilder ();
            for (char c : invalid) characters.append (c);
            throw new InvalidCharacterException (characters.toString (), text, firstInvalid);
        }

        int depth = 0;
        for (int i = 0; i < count; i++)
        {
            char c = text.charAt (i);
            if      (c == '(') depth++;
            else if (c == ')') depth--;
            if (depth < 0) throw new UnbalancedParenthesesException ("extra closing parenthesis", text, i);
        }
        if (depth != 0) throw new UnbalancedParenthesesException ("missing closing parenthesis", text, count);
    }

    public static boolean isAllowed (char c)
    {
        if (c >= '0'  &&  c <= '9') return true;
        if (Character.isWhitespace (c)) return true;
        return symbols.indexOf (c) >= 0  ||  letters.indexOf (c) >= 0;
    }
}
