/* @LICENSE@
 */

package org.formlang;

import static org.formlang.FlAssert.assertChomskyNormal;
import static org.formlang.FlAssert.assertInvalid;
import static org.formlang.FlAssert.cykAccepts;
import static org.formlang.FlAssert.list;
import static org.formlang.FlAssert.rules;
import static org.formlang.FlAssert.set;
import static org.formlang.FlAssert.strings;

import java.util.List;
import java.util.Map;
import java.util.Set;

public class ChomskyNormalizerTestCase extends AbstractFlTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(ChomskyNormalizerTestCase.class);
    }

    public ChomskyNormalizerTestCase(String name) {
        super(name);
    }

    private static CFG normalized(String start, String... lines) {
        CFG cnf = new ChomskyNormalizer(new CFG(rules(lines), start)).normalize();
        log(cnf);
        assertChomskyNormal(cnf);
        return cnf;
    }

    private static void assertLanguage(CFG cnf, String[] in, String[] out) {
        for (String s : in) assertTrue("'" + s + "'", cykAccepts(cnf, s));
        for (String s : out) assertFalse("'" + s + "'", cykAccepts(cnf, s));
    }

    public void testMixedGrammar() {
        CFG cnf = normalized("S",
            "S -> A S A | a B",
            "A -> B | S",
            "B -> b | €");
        assertEquals("S'", cnf.startVariable());
        assertLanguage(cnf,
            new String[] {"a", "ab", "aa", "ba", "bab", "abb", "aab"},
            new String[] {"", "b", "bb", "bbb"});
    }

    public void testBalanced() {
        CFG cnf = normalized("S", "S -> a S b | S S | €");
        assertLanguage(cnf,
            new String[] {"", "ab", "abab", "aabb", "aabbab"},
            new String[] {"a", "b", "ba", "abb", "aab", "abba"});
    }

    public void testStartVariableIsFresh() {
        CFG cnf = normalized("S", "S -> S' a | a", "S' -> b");
        assertEquals("S'1", cnf.startVariable());
        assertLanguage(cnf, new String[] {"a", "ba"}, new String[] {"", "b", "ab"});
    }

    public void testLongRulesChain() {
        CFG cnf = normalized("A", "A -> a b c d");
        assertLanguage(cnf, new String[] {"abcd"}, new String[] {"", "abc", "abdc", "abcda"});
        // A' -> V2 V, V -> V3 V1, V1 -> V4 V5, one variable per terminal
        assertEquals(1 + 2 + 4, cnf.variables().size());
        assertFalse(cnf.variables().contains("A"));
    }

    public void testOneVariablePerTerminal() {
        CFG cnf = normalized("S", "S -> a S | a a");
        int aRules = 0;
        for (Set<List<String>> substitutions : cnf.rules().values()) {
            if (substitutions.contains(list("a"))) ++aRules;
        }
        // one fresh variable serves every occurrence of a
        assertEquals(1, aRules);
        assertLanguage(cnf, new String[] {"aa", "aaa"}, new String[] {"", "a"});
    }

    public void testUnitChains() {
        CFG cnf = normalized("A", "A -> B", "B -> C", "C -> c | A A");
        assertLanguage(cnf, new String[] {"c", "cc", "ccc"}, new String[] {""});
        for (Map.Entry<String, Set<List<String>>> e : cnf.rules().entrySet()) {
            for (List<String> s : e.getValue()) {
                assertFalse(e.getKey() + " -> " + s,
                    s.size() == 1 && cnf.variables().contains(s.get(0)));
            }
        }
    }

    public void testEpsilonInsideLongerSubstitution() {
        CFG cnf = normalized("S", "S -> a € b");
        assertLanguage(cnf, new String[] {"ab"}, new String[] {"", "a", "b"});
    }

    public void testOnlyEmptyString() {
        CFG cnf = normalized("S", "S -> €");
        assertLanguage(cnf, new String[] {""}, new String[] {});
        assertEquals(1, cnf.rules().size());
    }

    public void testUselessVariablesPruned() {
        CFG cnf = normalized("S", "S -> a | B", "B -> b B");
        assertLanguage(cnf, new String[] {"a"}, new String[] {"", "b", "ab"});
        assertFalse(cnf.variables().contains("B"));
    }

    public void testEmptyLanguage() {
        CFG cnf = normalized("S", "S -> a S");
        assertEquals(3, cnf.rules().size());
        assertEquals(set("a"), cnf.terminals());
        for (String s : strings(set("a"), 6)) {
            assertFalse("'" + s + "'", cykAccepts(cnf, s));
        }
    }

    public void testEmptyLanguageWithoutTerminals() {
        try {
            new ChomskyNormalizer(new CFG(rules("S -> S", "X -> €"), "S")).normalize();
            fail();
        } catch (InvalidInputException e) {
            assertInvalid(e, InvalidInputException.Category.NO_TERMINALS, "S");
        }
    }
}
