/*@LICENSE@
 */

package org.rxdht.regex;

import static junit.framework.Assert.*;

import java.util.ArrayList;
import java.util.List;


/**
 * Static asserts over every representation of a regex: the NFA, the
 * minimized DFA and the DFA path compressed at several lengths.
 */
public final class RegexAssert {

    private RegexAssert() {}   // not instantiable.

    private static final int[] COMPRESSIONS = { 1, 0, 4, 8 };

    public static List<Automaton> allAutomata(String regex) {
        List<Automaton> ret = new ArrayList<Automaton>();
        ret.add(Automaton.compileNfa(regex));
        for (int maxLen : COMPRESSIONS) {
            ret.add(Automaton.compile(regex, maxLen));
        }
        return ret;
    }

    public static void assertMatches(String regex, String... inputs) {
        for (Automaton a : allAutomata(regex)) {
            for (String input : inputs) {
                assertTrue(a + " should match `" + input + "'", a.eval(input));
            }
        }
    }

    public static void assertNotMatches(String regex, String... inputs) {
        for (Automaton a : allAutomata(regex)) {
            for (String input : inputs) {
                assertFalse(a + " should not match `" + input + "'", a.eval(input));
            }
        }
    }

    /**
     * Checks the automata against <code>java.util.regex</code> on the given
     * inputs.
     */
    public static void assertSameAsJava(String regex, List<String> inputs) {
        java.util.regex.Pattern p = java.util.regex.Pattern.compile(regex);
        List<Automaton> automata = allAutomata(regex);
        for (String input : inputs) {
            boolean expected = p.matcher(input).matches();
            for (Automaton a : automata) {
                assertEquals(a + " on `" + input + "'", expected, a.eval(input));
            }
        }
    }

    public static void assertCanonical(String expected, String regex) {
        assertEquals("canonical form of `" + regex + "'",
            expected, Automaton.compile(regex).canonicalRegex());
    }

    public static void assertSameCanonical(String regex1, String regex2) {
        assertEquals(Automaton.compile(regex1).canonicalRegex(),
            Automaton.compile(regex2).canonicalRegex());
    }

    /**
     * The canonical form of a canonical form is itself.
     */
    public static void assertCanonicalStable(String regex) {
        String c1 = Automaton.compile(regex).canonicalRegex();
        String c2 = Automaton.compile(c1).canonicalRegex();
        assertEquals("canonical form of `" + regex + "' not stable", c1, c2);
    }
}
