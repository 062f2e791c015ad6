/* @LICENSE@
 */

package org.rxdht.regex;

import static org.rxdht.regex.RegexAssert.*;

import org.rxdht.regex.Automaton.State;
import org.rxdht.regex.Automaton.Transition;

public class PathCompressionTestCase extends AbstractRxTestCase {

    public PathCompressionTestCase(String name) {
        super(name);
    }

    static final String LONG_LITERAL = "abcdefghijklmnopqrstuvwxyz0123456789";

    public void testLiteralCollapses() {
        Automaton dfa = Automaton.compile("hello", 0);
        assertEquals(2, dfa.stateCount());
        assertEquals(1, dfa.transitionCount());
        assertEquals("hello", dfa.start.transitions.get(0).label);
        assertTrue(dfa.eval("hello"));
        assertFalse(dfa.eval("hell"));
        assertFalse(dfa.eval("h"));
    }

    public void testNoCompression() {
        Automaton dfa = Automaton.compile("hello", 1);
        assertEquals(6, dfa.stateCount());
        assertEquals(5, dfa.transitionCount());
    }

    public void testNegativeLength() {
        try {
            Automaton.compile("hello", -1);
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    public void testBranches() {
        Automaton dfa = Automaton.compile("hello(world|there)", 0);
        assertEquals(2, dfa.stateCount());
        assertEquals(2, dfa.transitionCount());
        assertMatches("hello(world|there)", "helloworld", "hellothere");
        assertNotMatches("hello(world|there)", "hello", "helloworl", "hellother", "hellowhere");
    }

    public void testInitialWindow() {
        Automaton dfa = Automaton.compile(LONG_LITERAL, 0);
        assertEquals(3, dfa.stateCount());
        assertEquals(2, dfa.transitionCount());
        assertEquals(LONG_LITERAL.substring(0, Automaton.INITIAL_BYTES),
            dfa.start.transitions.get(0).label);
        assertTrue(dfa.eval(LONG_LITERAL));

        dfa = Automaton.compile(LONG_LITERAL, 4);
        assertEquals(5, dfa.stateCount());
        assertEquals(4, dfa.transitionCount());
        for (State s : dfa.states) {
            for (Transition t : s.transitions) {
                int limit = s == dfa.start ? Automaton.INITIAL_BYTES : 4;
                assertEquals(limit, t.label.length());
            }
        }
        assertTrue(dfa.eval(LONG_LITERAL));
        assertFalse(dfa.eval(LONG_LITERAL.substring(0, 30)));
    }

    public void testKeysSurviveCompression() {
        Automaton plain = Automaton.compile(LONG_LITERAL);
        Automaton compressed = Automaton.compile(LONG_LITERAL, 4);
        for (State s : compressed.states) {
            boolean found = false;
            for (State p : plain.states) {
                if (p.hash.equals(s.hash)) found = true;
            }
            assertTrue(s.toString(), found);
            assertTrue(Automaton.checkProof(s.proof, s.hash));
        }
        assertEquals(plain.canonicalRegex(), compressed.canonicalRegex());
    }

    public void testLoopsKept() {
        assertMatches("(ab)*", "", "ab", "ababab");
        assertNotMatches("(ab)*", "a", "aba", "b");
        assertMatches("x(abc)*y", "xy", "xabcy", "xabcabcy");
        assertNotMatches("x(abc)*y", "xaby", "xabcab");
        assertMatches("ab*c", "ac", "abbbc");
    }

    public void testRandomPreservesLanguage() {
        for (int i = 0; i < 100; ++i) {
            String regex = randomRegex(3);
            Automaton reference = Automaton.compile(regex);
            Automaton[] compressed = {
                Automaton.compile(regex, 0),
                Automaton.compile(regex, 2),
                Automaton.compile(regex, 3),
            };
            for (int j = 0; j < 20; ++j) {
                String input = randomString(10);
                boolean expected = reference.eval(input);
                for (Automaton a : compressed) {
                    assertEquals(regex + " on `" + input + "'", expected, a.eval(input));
                }
            }
        }
    }

    public void testMultiStrides() {
        Automaton dfa = Automaton.compile("hello");
        assertFalse(dfa.isMultistrided());
        dfa.addMultiStrides(2);
        assertTrue(dfa.isMultistrided());
        assertEquals(6, dfa.stateCount());
        assertEquals(9, dfa.transitionCount());
        assertTrue(dfa.eval("hello"));
        assertFalse(dfa.eval("hell"));

        // applied once only
        dfa.addMultiStrides(2);
        assertEquals(9, dfa.transitionCount());
    }

    public void testMultiStridesSkipSelfLoops() {
        Automaton dfa = Automaton.compile("ab*");
        dfa.addMultiStrides(2);
        assertEquals(2, dfa.transitionCount());
        dfa = Automaton.compile("abc");
        dfa.addMultiStrides(3);
        assertEquals(4, dfa.transitionCount());
        assertTrue(dfa.eval("abc"));
    }

    public void testStridesNeedDfa() {
        try {
            Automaton.compileNfa("ab").addMultiStrides(2);
            fail();
        } catch (IllegalStateException e) {
            // expected
        }
    }
}
