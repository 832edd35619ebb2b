/* @LICENSE@
 */
package org.formlang;

import static org.formlang.Misc.LS;
import static org.formlang.Misc.pairName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A deterministic finite automaton. The transition function maps each
 * <code>(state, symbol)</code> pair to exactly one state:
 * <blockquote><pre>
 *   Map&lt;Pair&lt;String, String>, String> tf = new HashMap&lt;Pair&lt;String, String>, String>();
 *   tf.put(Pair.of("q1", "0"), "q1");
 *   tf.put(Pair.of("q1", "1"), "q2");
 *   tf.put(Pair.of("q2", "0"), "q1");
 *   tf.put(Pair.of("q2", "1"), "q2");
 *   DFA endsInOne = new DFA(tf, "q1", Collections.singleton("q2"));
 * </pre></blockquote>
 * See {@link FSA} for the checks made on construction. A DFA may not use
 * the epsilon marker as a symbol.
 */
public final class DFA extends FSA<String> {

    private static final Logger logger = Logger.getLogger("org.formlang");
    private static final Level level = Level.FINEST;

    public DFA(Map<Pair<String, String>, String> transitionFunction,
            String startState, Set<String> acceptStates) {
        super(transitionFunction, startState, acceptStates, null);
        wellDefined();
    }

    @Override
    void checkRange() {
        Validation.checkRangeType(transitions);
        Validation.checkRange(transitions.values(), states);
    }

    /**
     * Walks the automaton one symbol at a time; accepts iff it stops in an
     * accept state.
     */
    @Override
    public boolean accepts(String string) {
        Validation.checkInput(string, alphabet);
        String state = startState;
        for (int i = 0; i < string.length(); ++i) {
            state = transitions.get(Pair.of(state, String.valueOf(string.charAt(i))));
        }
        return acceptStates.contains(state);
    }

    /**
     * Product construction. The states of the result are pairs of states of
     * the operands. Operands with different alphabets are first completed
     * over the union alphabet with a fresh sink state each.
     *
     * @return a DFA accepting the union of the two languages
     */
    public DFA union(DFA other) {
        Set<String> sigma = Misc.union(alphabet, other.alphabet);
        DFA lhs = completedOver(sigma);
        DFA rhs = other.completedOver(sigma);

        Map<Pair<String, String>, String> tf =
            new LinkedHashMap<Pair<String, String>, String>();
        Set<String> accept = new LinkedHashSet<String>();
        for (String s1 : lhs.states) {
            for (String s2 : rhs.states) {
                String state = pairName(s1, s2);
                for (String symbol : sigma) {
                    tf.put(Pair.of(state, symbol), pairName(
                        lhs.transitions.get(Pair.of(s1, symbol)),
                        rhs.transitions.get(Pair.of(s2, symbol))));
                }
                if (lhs.acceptStates.contains(s1) || rhs.acceptStates.contains(s2)) {
                    accept.add(state);
                }
            }
        }
        DFA ret = new DFA(tf, pairName(startState, other.startState), accept);
        if (logger.isLoggable(level)) {
            logger.log(level, "union: " + states.size() + " x " + other.states.size()
                + " -> " + ret.states.size() + " states");
        }
        return ret;
    }

    /*
     * Adds one absorbing sink state, taking every symbol the automaton does
     * not know.
     */
    DFA completedOver(Set<String> sigma) {
        Set<String> extra = Misc.difference(sigma, alphabet);
        if (extra.isEmpty()) return this;
        String sink = Misc.freshName(states, "sink");
        Map<Pair<String, String>, String> tf = transitionFunction();
        for (String symbol : sigma) {
            tf.put(Pair.of(sink, symbol), sink);
        }
        for (String state : states) {
            for (String symbol : extra) {
                tf.put(Pair.of(state, symbol), sink);
            }
        }
        return new DFA(tf, startState, acceptStates);
    }

    /**
     * Concatenation, by way of the NFA construction and determinization;
     * expensive for large automata.
     *
     * @return a DFA accepting every string of this automaton's language
     *         followed by a string of the other's
     */
    public DFA concat(DFA other) {
        return nonDeterminize().concat(other.nonDeterminize()).determinize();
    }

    /**
     * Kleene closure, by way of the NFA construction and determinization.
     */
    public DFA star() {
        return nonDeterminize().star().determinize();
    }

    /**
     * @return an NFA with the same states, each transition a singleton set
     */
    public NFA nonDeterminize() {
        Map<Pair<String, String>, Set<String>> tf =
            new LinkedHashMap<Pair<String, String>, Set<String>>();
        for (Map.Entry<Pair<String, String>, String> e : transitions.entrySet()) {
            tf.put(e.getKey(), Collections.singleton(e.getValue()));
        }
        return new NFA(tf, startState, acceptStates);
    }

    /**
     * Extracts a regular expression for the language of this automaton, by
     * state elimination. The regex uses the syntax accepted by
     * {@link NFA#fit(String, Set)} and is liable to be much longer than
     * necessary.
     *
     * @throws InvalidInputException if the alphabet contains one of
     *             {@link NFA#RESERVED_CHARACTERS}
     */
    public String encode() {
        Validation.raiseIfAny(InvalidInputException.Category.REGEX_RESERVED_IN_ALPHABET,
            Misc.intersect(alphabet, RegexCompiler.RESERVED),
            "Alphabet cannot contain character %s.",
            "Alphabet cannot contain characters %s.");
        return GNFA.from(this).reduce();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("dfa: ").append(states.size()).append(" states, start: ")
            .append(startState).append(", accept: ")
            .append(new TreeSet<String>(acceptStates)).append(LS);
        for (Map.Entry<Pair<String, String>, String> e : transitions.entrySet()) {
            sb.append("    ").append(e.getKey()).append(" --> ")
                .append(e.getValue()).append(LS);
        }
        return sb.toString();
    }
}
