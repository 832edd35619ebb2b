/* @LICENSE@
 */
package org.formlang;

import static org.formlang.Misc.LS;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A nondeterministic finite automaton. The transition function maps each
 * <code>(state, symbol)</code> pair to a set of successor states; the empty
 * set is a legal value and has to be given explicitly, since the function
 * must be total. Epsilon moves are keyed by the {@link #EPSILON} symbol;
 * they are optional, and the epsilon symbol is not part of the alphabet.
 * <p>
 * See {@link FSA} for the checks made on construction.
 */
public final class NFA extends FSA<Set<String>> {

    private static final Logger logger = Logger.getLogger("org.formlang");
    private static final Level level = Level.FINEST;

    /**
     * The symbol of epsilon moves: the empty string.
     */
    public static final String EPSILON = "";

    /**
     * Characters with a meaning in the regex syntax of {@link #fit}; they
     * may not be alphabet symbols there.
     */
    public static final Set<String> RESERVED_CHARACTERS = RegexCompiler.RESERVED;

    public NFA(Map<Pair<String, String>, ? extends Set<String>> transitionFunction,
            String startState, Set<String> acceptStates) {
        super(normalized(transitionFunction), startState, acceptStates, EPSILON);
        wellDefined();
    }

    /*
     * Copies each successor set, so that the caller's sets can't change
     * under us. Null values are kept for checkRange() to report.
     */
    private static Map<Pair<String, String>, Set<String>> normalized(
            Map<Pair<String, String>, ? extends Set<String>> transitionFunction) {
        if (transitionFunction == null) return null;
        Map<Pair<String, String>, Set<String>> ret =
            new LinkedHashMap<Pair<String, String>, Set<String>>();
        Set<String> bad = new LinkedHashSet<String>();
        for (Map.Entry<Pair<String, String>, ? extends Set<String>> e
                : transitionFunction.entrySet()) {
            Set<String> successors = null;
            if (e.getValue() != null) {
                if (e.getValue().contains(null)) bad.add(String.valueOf(e.getKey()));
                successors = Collections.unmodifiableSet(
                    new LinkedHashSet<String>(e.getValue()));
            }
            ret.put(e.getKey(), successors);
        }
        Validation.raiseIfAny(InvalidInputException.Category.SHAPE, bad,
            "Successor set of %s contains null.",
            "Successor sets of %s contain null.");
        return ret;
    }

    @Override
    void checkRange() {
        Validation.checkRangeType(transitions);
        Set<String> range = new LinkedHashSet<String>();
        for (Set<String> successors : transitions.values()) {
            range.addAll(successors);
        }
        Validation.checkRange(range, states);
    }

    private Set<String> successors(Set<String> stateSet, String symbol) {
        Set<String> ret = new LinkedHashSet<String>();
        for (String state : stateSet) {
            Set<String> next = transitions.get(Pair.of(state, symbol));
            if (next != null) ret.addAll(next);
        }
        return ret;
    }

    /*
     * Keeps adding epsilon successors until nothing new turns up; the state
     * set is finite, so this terminates.
     */
    private Set<String> epsilonClosure(Set<String> stateSet) {
        Set<String> ret = new LinkedHashSet<String>(stateSet);
        Set<String> frontier = stateSet;
        while (!frontier.isEmpty()) {
            frontier = Misc.difference(successors(frontier, EPSILON), ret);
            ret.addAll(frontier);
        }
        return ret;
    }

    private Set<String> transition(Set<String> stateSet, String symbol) {
        return epsilonClosure(successors(stateSet, symbol));
    }

    /**
     * Simulates the automaton on a set of current states, closed under
     * epsilon moves before the first symbol and after every symbol.
     */
    @Override
    public boolean accepts(String string) {
        Validation.checkInput(string, alphabet);
        Set<String> current = epsilonClosure(Collections.singleton(startState));
        for (int i = 0; i < string.length(); ++i) {
            current = transition(current, String.valueOf(string.charAt(i)));
        }
        return !Misc.disjoint(current, acceptStates);
    }

    /**
     * Subset construction as breadth first search: one DFA state per set of
     * NFA states reachable from the epsilon closure of the start state. The
     * empty set, when reachable, becomes the dead state. A DFA state accepts
     * iff its set contains an accept state.
     * <p>
     * The number of DFA states is exponential in the number of NFA states in
     * the worst case. Don't determinize big NFAs.
     */
    public DFA determinize() {
        if (alphabet.isEmpty()) {
            throw new InvalidInputException(InvalidInputException.Category.ALPHABET,
                "An automaton with an empty alphabet has no deterministic form.");
        }
        final Map<Set<String>, String> names = new LinkedHashMap<Set<String>, String>();
        final LinkedList<Set<String>> gray = new LinkedList<Set<String>>();
        final Map<Pair<String, String>, String> tf =
            new LinkedHashMap<Pair<String, String>, String>();
        final Set<String> accept = new LinkedHashSet<String>();

        Set<String> init = epsilonClosure(Collections.singleton(startState));
        names.put(init, Misc.setName(init));
        gray.add(init);
        while (!gray.isEmpty()) {
            Set<String> stateSet = gray.removeFirst();
            String name = names.get(stateSet);
            if (!Misc.disjoint(stateSet, acceptStates)) accept.add(name);
            for (String symbol : alphabet) {
                Set<String> next = transition(stateSet, symbol);
                String nextName = names.get(next);
                if (nextName == null) {
                    nextName = Misc.setName(next);
                    names.put(next, nextName);
                    gray.addLast(next);
                }
                tf.put(Pair.of(name, symbol), nextName);
            }
        }
        DFA ret = new DFA(tf, names.get(init), accept);
        if (logger.isLoggable(level)) {
            logger.log(level, "determinized: " + states.size() + " nfa states -> "
                + ret.states().size() + " dfa states" + LS + ret);
        }
        return ret;
    }

    /**
     * Let A be the language of this automaton and B the language of the
     * other. Returns an automaton for A union B, with one state more than the
     * two operands together: a fresh start state with epsilon moves to both
     * start states. The operands may have different alphabets; states the
     * operands share are renamed apart first.
     */
    public NFA union(NFA other) {
        NFA rhs = renamedApart(other);
        Set<String> sigma = Misc.union(alphabet, rhs.alphabet);
        Map<Pair<String, String>, Set<String>> tf = paddedOver(sigma);
        tf.putAll(rhs.paddedOver(sigma));

        String start = Misc.freshName(Misc.union(states, rhs.states), "start");
        Set<String> starts = new LinkedHashSet<String>();
        starts.add(startState);
        starts.add(rhs.startState);
        tf.put(Pair.of(start, EPSILON), starts);
        for (String symbol : sigma) {
            tf.put(Pair.of(start, symbol), Collections.<String>emptySet());
        }
        return new NFA(tf, start, Misc.union(acceptStates, rhs.acceptStates));
    }

    /**
     * Returns an automaton for the concatenation of this automaton's language
     * with the other's: epsilon moves lead from each accept state of this
     * automaton to the start state of the other. Not commutative.
     */
    public NFA concat(NFA other) {
        NFA rhs = renamedApart(other);
        Set<String> sigma = Misc.union(alphabet, rhs.alphabet);
        Map<Pair<String, String>, Set<String>> tf = paddedOver(sigma);
        tf.putAll(rhs.paddedOver(sigma));
        for (String state : acceptStates) {
            addEpsilon(tf, state, rhs.startState);
        }
        return new NFA(tf, startState, rhs.acceptStates);
    }

    /**
     * Kleene closure: a fresh, accepting start state with an epsilon move to
     * the old start state, and epsilon moves back from every accept state.
     * The result always accepts the empty string.
     */
    public NFA star() {
        String start = Misc.freshName(states, "start");
        Map<Pair<String, String>, Set<String>> tf = paddedOver(alphabet);
        tf.put(Pair.of(start, EPSILON), Collections.singleton(startState));
        for (String symbol : alphabet) {
            tf.put(Pair.of(start, symbol), Collections.<String>emptySet());
        }
        for (String state : acceptStates) {
            addEpsilon(tf, state, startState);
        }
        Set<String> accept = new LinkedHashSet<String>(acceptStates);
        accept.add(start);
        return new NFA(tf, start, accept);
    }

    /**
     * Extracts a regular expression for the language of this automaton, via
     * {@link #determinize()} and {@link DFA#encode()}.
     */
    public String encode() {
        return determinize().encode();
    }

    private static void addEpsilon(Map<Pair<String, String>, Set<String>> tf,
            String from, String to) {
        Pair<String, String> key = Pair.of(from, EPSILON);
        Set<String> successors = new LinkedHashSet<String>();
        if (tf.containsKey(key)) successors.addAll(tf.get(key));
        successors.add(to);
        tf.put(key, successors);
    }

    /*
     * A mutable copy of the transition function, with empty successor sets
     * for the symbols of sigma this automaton doesn't know.
     */
    private Map<Pair<String, String>, Set<String>> paddedOver(Set<String> sigma) {
        Map<Pair<String, String>, Set<String>> ret = transitionFunction();
        for (String symbol : Misc.difference(sigma, alphabet)) {
            for (String state : states) {
                ret.put(Pair.of(state, symbol), Collections.<String>emptySet());
            }
        }
        return ret;
    }

    /*
     * The other automaton, its states suffixed if any of them is also one of
     * ours.
     */
    private NFA renamedApart(NFA other) {
        if (Misc.disjoint(other.states, states)) return other;
        return other.renamed(Misc.freshSuffix(other.states, states));
    }

    private NFA renamed(String suffix) {
        Map<Pair<String, String>, Set<String>> tf =
            new LinkedHashMap<Pair<String, String>, Set<String>>();
        for (Map.Entry<Pair<String, String>, Set<String>> e : transitions.entrySet()) {
            tf.put(Pair.of(e.getKey().first() + suffix, e.getKey().second()),
                suffixed(e.getValue(), suffix));
        }
        return new NFA(tf, startState + suffix, suffixed(acceptStates, suffix));
    }

    private static Set<String> suffixed(Set<String> stateSet, String suffix) {
        Set<String> ret = new LinkedHashSet<String>();
        for (String state : stateSet) ret.add(state + suffix);
        return ret;
    }

    /**
     * Compiles a regular expression over the default alphabet: the printable
     * ASCII characters and the ASCII white space, minus the
     * {@linkplain #RESERVED_CHARACTERS reserved characters}.
     *
     * @see #fit(String, Set)
     */
    public static NFA fit(String regex) {
        return fit(regex, RegexCompiler.DEFAULT_ALPHABET);
    }

    /**
     * Compiles a regular expression into an NFA recognizing its language
     * over the given alphabet. The syntax is simple: alphabet symbols are
     * literals, <code>(</code> and <code>)</code> group, <code>|</code> is
     * alternation, <code>*</code> is Kleene star, and concatenation is
     * implicit or written explicitly as <code>&#x2022;</code>.
     * <code>&#x20AC;</code> matches the empty string, and
     * <code>&#x00D8;</code> matches nothing. Star binds tighter than
     * concatenation, which binds tighter than alternation.
     *
     * @throws InvalidInputException if the alphabet contains a reserved
     *             character, or the regex is malformed
     */
    public static NFA fit(String regex, Set<String> alphabet) {
        return new RegexCompiler(regex, alphabet).compile();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("nfa: ").append(states.size()).append(" states, start: ")
            .append(startState).append(", accept: ")
            .append(new TreeSet<String>(acceptStates)).append(LS);
        for (Map.Entry<Pair<String, String>, Set<String>> e : transitions.entrySet()) {
            sb.append("    ").append(e.getKey()).append(" --> ")
                .append(e.getValue()).append(LS);
        }
        return sb.toString();
    }
}
