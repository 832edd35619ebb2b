/* @LICENSE@
 */

package org.formlang.test;

import static org.formlang.FlAssert.*;
import static org.formlang.InvalidInputException.Category.*;

import java.util.Map;
import java.util.Set;

import org.formlang.AbstractFlTestCase;
import org.formlang.DFA;
import org.formlang.InvalidInputException;
import org.formlang.NFA;
import org.formlang.Pair;

public class NFATestCase extends AbstractFlTestCase {

    private static final Set<String> AB = set("a", "b");

    /** Strings over {0,1} whose third symbol from the end is 1. */
    private NFA thirdFromLast;

    /** a* followed by b*, through an epsilon move. */
    private NFA asThenBs;

    public static void main(String[] args) {
        junit.textui.TestRunner.run(NFATestCase.class);
    }

    public NFATestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
        thirdFromLast = new NFA(nfaTf(
            "q0 0 q0", "q0 1 q0 q1",
            "q1 0 q2", "q1 1 q2",
            "q2 0 q3", "q2 1 q3",
            "q3 0", "q3 1"), "q0", set("q3"));
        asThenBs = new NFA(nfaTf(
            "p a p", "p b", "p eps r",
            "r a", "r b r"), "p", set("r"));
    }

    public void testAccepts() {
        assertAccepts(thirdFromLast, "100", "0111", "1101");
        assertRejects(thirdFromLast, "", "1", "10", "011", "1011");
        assertAccepts(asThenBs, "", "a", "b", "aabbb");
        assertRejects(asThenBs, "ba", "aba");
        assertEquals(set("a", "b"), asThenBs.alphabet());
    }

    public void testBadInput() {
        try {
            thirdFromLast.accepts("102");
            fail();
        } catch (InvalidInputException e) {
            assertInvalid(e, INPUT_SYMBOL, "2");
        }
    }

    public void testConstructionErrors() {
        try {
            new NFA(nfaTf("q a q r", "q b"), "q", set("q"));
            fail();
        } catch (InvalidInputException e) {
            assertInvalid(e, RANGE, "r");
        }
        Map<Pair<String, String>, Set<String>> tf = nfaTf("q a q", "q b");
        tf.put(Pair.of("q", "b"), null);
        try {
            new NFA(tf, "q", set("q"));
            fail();
        } catch (InvalidInputException e) {
            assertInvalid(e, RANGE_TYPE, "(q, b)");
        }
        try {
            new NFA(nfaTf("q a q", "r a q", "r b r"), "q", set("q"));
            fail();
        } catch (InvalidInputException e) {
            assertInvalid(e, DOMAIN, "(q, b)");
        }
        try {
            new NFA(nfaTf("q a q", "q b"), "q", set("q", "x"));
            fail();
        } catch (InvalidInputException e) {
            assertInvalid(e, ACCEPT_STATES, "x");
        }
    }

    public void testEpsilonNotInAlphabet() {
        // epsilon keys are optional; totality is over real symbols only
        NFA nfa = new NFA(nfaTf("q a r", "q eps r", "r a r"), "q", set("r"));
        assertEquals(set("a"), nfa.alphabet());
        assertAccepts(nfa, "", "a", "aa");
    }

    public void testImmutable() {
        Map<Pair<String, String>, Set<String>> tf = nfaTf("p a p", "p b", "p eps r", "r a", "r b r");
        NFA nfa = new NFA(tf, "p", set("r"));
        tf.get(Pair.of("p", "b")).add("r");
        tf.remove(Pair.of("r", "b"));
        assertRejects(nfa, "ba");
        assertAccepts(nfa, "abb");

        Map<Pair<String, String>, Set<String>> copy = nfa.transitionFunction();
        copy.clear();
        assertEquals(5, nfa.transitionFunction().size());
        try {
            nfa.transitionFunction().get(Pair.of("p", "a")).add("r");
            fail();
        } catch (UnsupportedOperationException e) {
            // expected
        }
        assertEquals(set("p"), nfa.transitionFunction().get(Pair.of("p", "a")));
        try {
            nfa.acceptStates().add("p");
            fail();
        } catch (UnsupportedOperationException e) {
            // expected
        }
    }

    public void testDeterminize() {
        DFA dfa = thirdFromLast.determinize();
        log(dfa);
        assertEquals(8, dfa.states().size());
        assertEquals("{q0}", dfa.startState());
        assertSameLanguage(thirdFromLast, dfa, 8);

        dfa = asThenBs.determinize();
        assertEquals("{p,r}", dfa.startState());
        // {p,r}, {r} and the dead state {}
        assertEquals(set("{p,r}", "{r}", "{}"), dfa.states());
        assertSameLanguage(asThenBs, dfa, 7);
    }

    public void testDeterminizeEmptyAlphabet() {
        NFA nfa = new NFA(nfaTf("q eps q"), "q", set("q"));
        assertTrue(nfa.accepts(""));
        try {
            nfa.determinize();
            fail();
        } catch (InvalidInputException e) {
            assertInvalid(e, ALPHABET);
        }
    }

    public void testFitScenario() {
        NFA nfa = NFA.fit("(ab)*", AB);
        assertAccepts(nfa, "", "ab", "abab");
        assertRejects(nfa, "b", "aba");
    }

    public void testFitDefaultAlphabet() {
        NFA nfa = NFA.fit("(x|y)z*");
        assertTrue(nfa.alphabet().contains("~"));
        assertFalse(nfa.alphabet().contains("*"));
        assertAccepts(nfa, "x", "yzz");
        assertRejects(nfa, "", "z", "xy", "xz~");
    }

    public void testFitErrors() {
        try {
            NFA.fit("a)", AB);
            fail();
        } catch (InvalidInputException e) {
            assertInvalid(e, REGEX_UNBALANCED_RIGHT, ")");
        }
        try {
            NFA.fit("a", set("a", "€"));
            fail();
        } catch (InvalidInputException e) {
            assertInvalid(e, REGEX_RESERVED_IN_ALPHABET, "€");
        }
        assertTrue(NFA.RESERVED_CHARACTERS.contains("Ø"));
        assertTrue(NFA.RESERVED_CHARACTERS.contains("•"));
    }

    public void testUnion() {
        NFA a = NFA.fit("a*", AB);
        NFA b = NFA.fit("ba|b", AB);
        NFA union = a.union(b);
        log(union);
        for (String s : strings(AB, 6)) {
            assertEquals(s, a.accepts(s) || b.accepts(s), union.accepts(s));
        }
        // both operands have states q1 and q2
        assertEquals(a.states().size() + b.states().size() + 1, union.states().size());
    }

    public void testUnionOfDifferentAlphabets() {
        NFA zeros = NFA.fit("0*", set("0"));
        NFA ones = NFA.fit("11", set("1"));
        NFA union = zeros.union(ones);
        assertEquals(set("0", "1"), union.alphabet());
        assertAccepts(union, "", "000", "11");
        assertRejects(union, "1", "01", "110");
    }

    public void testConcat() {
        NFA a = NFA.fit("a|ab", AB);
        NFA b = NFA.fit("b*a", AB);
        NFA concat = a.concat(b);
        for (String s : strings(AB, 6)) {
            boolean expected = false;
            for (int k = 0; k <= s.length(); ++k) {
                expected |= a.accepts(s.substring(0, k)) && b.accepts(s.substring(k));
            }
            assertEquals(s, expected, concat.accepts(s));
        }
    }

    private static boolean inStar(NFA nfa, String s) {
        if (s.length() == 0) return true;
        for (int k = 1; k <= s.length(); ++k) {
            if (nfa.accepts(s.substring(0, k)) && inStar(nfa, s.substring(k))) return true;
        }
        return false;
    }

    public void testStar() {
        for (NFA nfa : new NFA[] {NFA.fit("ab|b", AB), NFA.fit("a*b", AB), asThenBs, NFA.fit("Ø", AB)}) {
            NFA star = nfa.star();
            assertTrue(star.accepts(""));
            for (String s : strings(AB, 6)) {
                assertEquals(s, inStar(nfa, s), star.accepts(s));
            }
        }
    }

    public void testStarKeepsEpsilonMoves() {
        // accept state t has an epsilon move of its own: {a, ab}
        NFA nfa = new NFA(nfaTf(
            "s a t", "s b",
            "t a", "t b", "t eps u",
            "u a", "u b v",
            "v a", "v b"), "s", set("t", "v"));
        assertAccepts(nfa, "a", "ab");
        NFA star = nfa.star();
        assertAccepts(star, "", "ab", "aab", "aba", "abab");
        assertRejects(star, "b", "abb");
    }

    public void testEncode() {
        for (String regex : new String[] {"(ab)*", "a|b*", "(a|b)*abb", "€", "Ø", "a€b"}) {
            NFA nfa = NFA.fit(regex, AB);
            String encoded = nfa.encode();
            log(regex + " -> " + encoded);
            assertSameLanguage(nfa, NFA.fit(encoded, AB), 7);
        }
    }
}
