/* @LICENSE@
 */

package org.formlang.test;

import static org.formlang.FlAssert.assertInvalid;
import static org.formlang.FlAssert.fstTf;
import static org.formlang.FlAssert.set;
import static org.formlang.InvalidInputException.Category.*;

import java.util.Map;

import org.formlang.AbstractFlTestCase;
import org.formlang.FST;
import org.formlang.InvalidInputException;
import org.formlang.InvalidInputException.Category;
import org.formlang.Pair;

public class FSTTestCase extends AbstractFlTestCase {

    private FST flip;
    private FST delay;

    public static void main(String[] args) {
        junit.textui.TestRunner.run(FSTTestCase.class);
    }

    public FSTTestCase(String name) {
        super(name);
    }

    /*
     * Outputs the previous input bit, 0 at first.
     */
    private static Map<Pair<String, String>, Pair<String, String>> delayTf() {
        return fstTf(
            "s0 0 s0 0", "s0 1 s1 0",
            "s1 0 s0 1", "s1 1 s1 1");
    }

    protected void setUp() throws Exception {
        super.setUp();
        flip = new FST(fstTf("q 0 q 1", "q 1 q 0"), "q");
        delay = new FST(delayTf(), "s0");
    }

    private static void assertConstructionFails(
            Map<Pair<String, String>, Pair<String, String>> tf, String start,
            Category category, String... offenders) {
        try {
            new FST(tf, start);
            fail();
        } catch (InvalidInputException e) {
            assertInvalid(e, category, offenders);
        }
    }

    public void testProcess() {
        assertEquals("1001", flip.process("0110"));
        assertEquals("", flip.process(""));
        assertEquals("0110", delay.process("1101"));
        log(delay);
    }

    public void testDerivedSets() {
        assertEquals(set("s0", "s1"), delay.states());
        assertEquals(set("s0", "s1"), delay.range());
        assertEquals(set("0", "1"), delay.inputAlphabet());
        assertEquals(set("0", "1"), delay.outputAlphabet());

        FST upper = new FST(fstTf("q a q A", "q b r B", "r a q A", "r b r B"), "q");
        assertEquals(set("a", "b"), upper.inputAlphabet());
        assertEquals(set("A", "B"), upper.outputAlphabet());
        assertEquals("ABBA", upper.process("abba"));
    }

    public void testImmutable() {
        Map<Pair<String, String>, Pair<String, String>> tf = delayTf();
        FST fst = new FST(tf, "s0");
        tf.put(Pair.of("s0", "1"), Pair.of("s0", "1"));
        assertEquals("0110", fst.process("1101"));

        fst.transitionFunction().clear();
        assertEquals(4, fst.transitionFunction().size());
        try {
            fst.range().add("s2");
            fail();
        } catch (UnsupportedOperationException e) {
            // expected
        }
        try {
            fst.outputAlphabet().add("2");
            fail();
        } catch (UnsupportedOperationException e) {
            // expected
        }
        assertEquals(set("s0", "s1"), fst.range());
    }

    public void testBadInput() {
        try {
            delay.process("0120");
            fail();
        } catch (InvalidInputException e) {
            assertInvalid(e, INPUT_SYMBOL, "2");
        }
    }

    public void testConstructionErrors() {
        assertConstructionFails(delayTf(), "s2", START_STATE, "s2");

        Map<Pair<String, String>, Pair<String, String>> tf = delayTf();
        tf.put(Pair.of("s0", "01"), Pair.of("s0", "0"));
        assertConstructionFails(tf, "s0", ALPHABET, "01");

        tf = delayTf();
        tf.put(Pair.of("s0", "1"), Pair.of("s1", "xy"));
        assertConstructionFails(tf, "s0", ALPHABET, "xy");

        tf = delayTf();
        tf.put(Pair.of("s1", "0"), Pair.of("s2", "1"));
        assertConstructionFails(tf, "s0", RANGE, "s2");

        tf = delayTf();
        tf.remove(Pair.of("s1", "1"));
        assertConstructionFails(tf, "s0", DOMAIN, "(s1, 1)");

        tf = delayTf();
        tf.put(Pair.of("s1", "1"), null);
        tf.put(Pair.of("s0", "1"), Pair.of((String) null, "1"));
        assertConstructionFails(tf, "s0", RANGE_TYPE, "(s0, 1)", "(s1, 1)");

        assertConstructionFails(null, "s0", SHAPE);
    }

    public void testCheckOrder() {
        // input alphabet before range before domain
        Map<Pair<String, String>, Pair<String, String>> tf = delayTf();
        tf.put(Pair.of("s0", "22"), Pair.of("s9", "0"));
        tf.remove(Pair.of("s1", "1"));
        assertConstructionFails(tf, "s0", ALPHABET, "22");

        tf = delayTf();
        tf.put(Pair.of("s1", "0"), Pair.of("s9", "0"));
        tf.remove(Pair.of("s1", "1"));
        assertConstructionFails(tf, "s0", RANGE, "s9");
    }
}
