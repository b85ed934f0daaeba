/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.plotcalc;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import org.junit.Before;
import org.junit.Test;

public class MainTest {

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @Before
    public void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    @Test
    public void testCalc() {
        assertEquals(Main.SUCCESS, run("-calc=2+3*4"));
        assertEquals("14", out.toString().trim());
    }

    @Test
    public void testPlot() {
        assertEquals(Main.SUCCESS, run("-plot=f(x)=x^2", "-xmin=0", "-xmax=2", "-points=3", "-csv"));
        String[] lines = out.toString().trim().split("\\R");
        assertArrayEquals(new String[] {"x,y", "0.0,0.0", "1.0,1.0", "2.0,4.0"}, lines);
    }

    @Test
    public void testEvaluationFailure() {
        assertEquals(Main.FAILURE, run("-calc=5/0"));
        assertTrue(err.toString().contains("Cannot divide by zero"));
        assertEquals("", out.toString());
    }

    @Test
    public void testParseFailureShowsPosition() {
        assertEquals(Main.FAILURE, run("-calc=(2"));
        String[] lines = err.toString().split("\\R");
        assertEquals("Unbalanced parentheses: missing closing parenthesis", lines[0]);
        assertEquals("(2", lines[1]);
        assertEquals("  ^", lines[2]);
    }

    @Test
    public void testTooDeep() {
        StringBuilder sum = new StringBuilder("-calc=1");
        for(int i = 0; i < 20000; i++) {
            sum.append("+1");
        }
        assertEquals(Main.FAILURE, run(sum.toString()));
        assertTrue(err.toString().startsWith("Expression is nested more than 500 levels deep"));
    }

    @Test
    public void testEmptyDomain() {
        assertEquals(Main.FAILURE, run("-plot=sqrt(x)", "-xmin=-2", "-xmax=-1"));
        assertTrue(err.toString().startsWith("Error: Could not evaluate function anywhere"));
    }

    @Test
    public void testUsage() {
        assertEquals(Main.USAGE, run());
        assertEquals(Main.USAGE, run("-calc=1", "-plot=x"));
        assertEquals(Main.USAGE, run("-bogus"));
        assertEquals(Main.USAGE, run("-plot=x", "-points=abc"));
        assertTrue(err.toString().contains("Usage:"));
    }



    ///////////////////
    // SUPPLEMENTAL //
    ///////////////////

    protected int run(String... args) {
        return Main.run(args, new PrintStream(out, true), new PrintStream(err, true));
    }
}
