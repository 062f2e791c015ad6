/* @LICENSE@
 */

package org.rxdht.regex;

import static org.rxdht.regex.RegexAssert.*;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;

import org.rxdht.regex.Automaton.State;
import org.rxdht.regex.Automaton.Type;

public class DFATestCase extends AbstractRxTestCase {

    public DFATestCase(String name) {
        super(name);
    }

    private static Automaton minimal(String regex) {
        Automaton dfa = DFA.determinize(Automaton.compileNfa(regex));
        DFA.minimize(dfa);
        return dfa;
    }

    public void testSizes() {
        Automaton dfa = Automaton.compile("a|b");
        assertEquals(Type.DFA, dfa.type());
        assertEquals(2, dfa.stateCount());
        assertEquals(2, dfa.transitionCount());

        dfa = Automaton.compile("(a|b)*");
        assertEquals(1, dfa.stateCount());
        assertEquals(2, dfa.transitionCount());

        dfa = Automaton.compile("hello");
        assertEquals(6, dfa.stateCount());
        assertEquals(5, dfa.transitionCount());

        dfa = Automaton.compile("a+");
        assertEquals(2, dfa.stateCount());
        assertEquals(2, dfa.transitionCount());
    }

    public void testDeterminizeConsumesNfa() {
        Automaton nfa = Automaton.compileNfa("ab|cb");
        Automaton dfa = DFA.determinize(nfa);
        assertEquals(0, nfa.stateCount());
        assertEquals(5, dfa.stateCount());
        for (State s : dfa.states) {
            assertNotNull(s.nfaSet);
            assertFalse(s.nfaSet.isEmpty());
        }
    }

    public void testMergeEquivalent() {
        Automaton dfa = minimal("ab|cb");
        assertEquals(3, dfa.stateCount());
        assertEquals(3, dfa.transitionCount());
        for (State s : dfa.states) {
            assertNull(s.nfaSet);
        }
        assertTrue(dfa.eval("ab"));
        assertTrue(dfa.eval("cb"));
        assertFalse(dfa.eval("ac"));
    }

    public void testSameLanguageSameSize() {
        assertEquals(minimal("a+").stateCount(), minimal("a|aa*a").stateCount());
        assertEquals(minimal("(a|b)*").stateCount(), minimal("(a*b*)*").stateCount());
        assertEquals(minimal("a(b|c)").stateCount(), minimal("ab|ac").stateCount());
    }

    public void testRemoveUnreachableAndDead() {
        Automaton dfa = new Automaton(Type.DFA, "a");
        State s0 = new State(0, false);
        State s1 = new State(1, true);
        State dead = new State(2, false);
        State unreachable = new State(3, true);
        s0.addTransition("a", s1);
        s0.addTransition("b", dead);
        dead.addTransition("b", dead);
        unreachable.addTransition("a", s0);
        dfa.add(unreachable);
        dfa.add(dead);
        dfa.add(s1);
        dfa.add(s0);
        dfa.start = s0;

        assertTrue(dead.dead());
        assertFalse(s1.dead());
        DFA.minimize(dfa);

        assertEquals(2, dfa.stateCount());
        assertEquals(1, dfa.transitionCount());
        assertTrue(dfa.states.contains(s0));
        assertTrue(dfa.states.contains(s1));
        assertTrue(dfa.eval("a"));
        assertFalse(dfa.eval("b"));
    }

    public void testLongestLabelWins() {
        State s = new State(0, false);
        State t1 = new State(1, true);
        State t2 = new State(2, true);
        s.addTransition("a", t1);
        s.addTransition("ab", t2);
        assertSame(t2, DFA.move(s, "abc", 0).to);
        assertSame(t1, DFA.move(s, "xac", 1).to);
        assertNull(DFA.move(s, "b", 0));
    }

    public void testEmptyInput() {
        assertTrue(Automaton.compile("a*").eval(""));
        assertFalse(Automaton.compile("a+").eval(""));
        assertTrue(Automaton.compileNfa("(a|b)*").eval(""));
        assertFalse(Automaton.compileNfa("a").eval(""));
    }

    public void testConstructionLimit() {
        StringBuilder sb = new StringBuilder("(a|b)*a");
        for (int i = 0; i < 14; ++i) {
            sb.append("(a|b)");
        }
        try {
            Automaton.compile(sb.toString());
            fail("DFA should exceed " + DFA.MAX_STATE_COUNT + " states");
        } catch (Automaton.ConstructionException e) {
            logger.log(Level.FINE, "expected", e);
        }
    }

    public void testFixedCases() {
        assertMatches("ab?(abcd)?", "ababcd", "aabcd", "a");
        assertNotMatches("ab?(abcd)?", "abab", "abb");
        assertMatches("(bla)*", "", "bla", "blabla");
        assertNotMatches("(bla)*", "bl", "blab");
    }

    public void testRandomAgainstJava() {
        for (int i = 0; i < 150; ++i) {
            String regex = randomRegex(3);
            List<String> inputs = new ArrayList<String>();
            for (int j = 0; j < 20; ++j) {
                inputs.add(randomString(8));
            }
            if (logger.isLoggable(level)) {
                logger.log(level, "random regex " + i + ": " + regex);
            }
            assertSameAsJava(regex, inputs);
        }
    }
}
