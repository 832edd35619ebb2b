/* @LICENSE@
 */
package org.formlang;

import static org.formlang.Misc.LS;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * A finite state transducer. The transition function maps each
 * <code>(state, input symbol)</code> pair to a
 * <code>(successor state, output symbol)</code> pair; the input alphabet is
 * inferred from the keys, the output alphabet from the values. There are no
 * accept states: a transducer defines a function from strings to strings,
 * not a language.
 * <p>
 * Construction checks, in this order: shape, start state, input alphabet,
 * value shape, output alphabet, range, domain. The first check that fails
 * throws an {@link InvalidInputException} naming every offender.
 */
public final class FST extends Machine<Pair<String, String>> {

    final Set<String> inputAlphabet;
    final Set<String> outputAlphabet;

    public FST(Map<Pair<String, String>, Pair<String, String>> transitionFunction,
            String startState) {
        super(transitionFunction, startState);
        this.inputAlphabet = Collections.unmodifiableSet(
            new TreeSet<String>(seconds(transitions.keySet())));
        checkStart();
        Validation.checkAlphabet(inputAlphabet, "input alphabet");
        checkRangeType();
        this.outputAlphabet = Collections.unmodifiableSet(
            new TreeSet<String>(seconds(transitions.values())));
        Validation.checkAlphabet(outputAlphabet, "output alphabet");
        checkRange();
        checkDomain(inputAlphabet);
    }

    private void checkRangeType() {
        Set<String> bad = new LinkedHashSet<String>();
        for (Map.Entry<Pair<String, String>, Pair<String, String>> e
                : transitions.entrySet()) {
            Pair<String, String> value = e.getValue();
            if (value == null || value.first() == null || value.second() == null) {
                bad.add(e.getKey().toString());
            }
        }
        Validation.raiseIfAny(InvalidInputException.Category.RANGE_TYPE, bad,
            "Transition %s is not a (state, output symbol) pair.",
            "Transitions %s are not (state, output symbol) pairs.");
    }

    @Override
    void checkRange() {
        Validation.checkRange(firsts(transitions.values()), states);
    }

    /**
     * @return the sorted input alphabet
     */
    public Set<String> inputAlphabet() {
        return inputAlphabet;
    }

    /**
     * @return the sorted output alphabet
     */
    public Set<String> outputAlphabet() {
        return outputAlphabet;
    }

    /**
     * @return the states named by transition values; a subset of
     *         {@link #states()}
     */
    public Set<String> range() {
        return Collections.unmodifiableSet(firsts(transitions.values()));
    }

    /**
     * Runs the transducer on <code>string</code>, emitting one output symbol
     * per input symbol.
     *
     * @throws InvalidInputException if the string contains symbols outside
     *             the input alphabet
     */
    public String process(String string) {
        Validation.checkInput(string, inputAlphabet);
        StringBuilder sb = new StringBuilder();
        String state = startState;
        for (int i = 0; i < string.length(); ++i) {
            Pair<String, String> next =
                transitions.get(Pair.of(state, String.valueOf(string.charAt(i))));
            sb.append(next.second());
            state = next.first();
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("fst: ").append(states.size()).append(" states, start: ")
            .append(startState).append(LS);
        for (Map.Entry<Pair<String, String>, Pair<String, String>> e
                : transitions.entrySet()) {
            sb.append("    ").append(e.getKey()).append(" --> ")
                .append(e.getValue()).append(LS);
        }
        return sb.toString();
    }
}
