/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc.language;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
    Names visible during one evaluation: constants, functions and free variables.
    Instances are immutable. Binding a variable produces a new Environment, so one instance
    may be shared freely between threads.
**/
public class Environment
{
    protected final Map<String,Double> constants;
    protected final Set<Builtin>       functions;
    protected final Set<String>        variables;  // declared free variables, bound or not
    protected final Map<String,Double> bindings;

    public Environment (Map<String,Double> constants, Set<Builtin> functions, Set<String> variables)
    {
        this (constants, functions, variables, Collections.<String,Double>emptyMap ());
    }

    protected Environment (Map<String,Double> constants, Set<Builtin> functions, Set<String> variables, Map<String,Double> bindings)
    {
        this.constants = Collections.unmodifiableMap (new TreeMap<String,Double> (constants));
        this.functions = Collections.unmodifiableSet (functions.isEmpty () ? EnumSet.noneOf (Builtin.class) : EnumSet.copyOf (functions));
        this.variables = Collections.unmodifiableSet (new TreeSet<String> (variables));
        this.bindings  = Collections.unmodifiableMap (new TreeMap<String,Double> (bindings));
    }

    public static Map<String,Double> standardConstants ()
    {
        Map<String,Double> result = new TreeMap<String,Double> ();
        result.put ("pi", Math.PI);
        result.put ("e",  Math.E);
        return result;
    }

    /**
        Environment of the calculator display: pi, e, sqrt, abs, round, min, max. No free variable.
    **/
    public static Environment calculator ()
    {
        return new Environment (standardConstants (), EnumSet.of (Builtin.SQRT, Builtin.ABS, Builtin.ROUND, Builtin.MIN, Builtin.MAX), Collections.<String>emptySet ());
    }

    /**
        Environment of the function plotter: pi, e, sin, cos, tan, sqrt, abs, and the free variable x.
    **/
    public static Environment grapher ()
    {
        return new Environment (standardConstants (), EnumSet.of (Builtin.SIN, Builtin.COS, Builtin.TAN, Builtin.SQRT, Builtin.ABS), Collections.singleton ("x"));
    }

    /**
        @return A copy of this environment with the given variable bound to value.
        @throws IllegalArgumentException if name is not a declared variable.
    **/
    public Environment bind (String name, double value)
    {
        if (! variables.contains (name)) throw new IllegalArgumentException ("'" + name + "' is not a variable of this environment");
        Map<String,Double> b = new TreeMap<String,Double> (bindings);
        b.put (name, value);
        return new Environment (constants, functions, variables, b);
    }

    public boolean isConstant (String name)
    {
        return constants.containsKey (name);
    }

    public boolean isVariable (String name)
    {
        return variables.contains (name);
    }

    public boolean hasFunction (Builtin function)
    {
        return functions.contains (function);
    }

    /**
        @return The function with the given name, or null if it does not exist or is not visible here.
    **/
    public Builtin getFunction (String name)
    {
        Builtin result = Builtin.find (name);
        if (result == null  ||  ! functions.contains (result)) return null;
        return result;
    }

    /**
        Determines whether the Lexer should accept the given identifier.
    **/
    public boolean recognizes (String name)
    {
        return isConstant (name)  ||  isVariable (name)  ||  getFunction (name) != null;
    }

    /**
        Resolves a variable or constant. A bound variable shadows a constant of the same name.
    **/
    public double get (String name) throws UnboundVariableException
    {
        Double result = bindings.get (name);
        if (result == null) result = constants.get (name);
        if (result == null) throw new UnboundVariableException (name);
        return result;
    }

    public Map<String,Double> getConstants ()
    {
        return constants;
    }

    public Set<Builtin> getFunctions ()
    {
        return functions;
    }

    public Set<String> getVariables ()
    {
        return variables;
    }
}
