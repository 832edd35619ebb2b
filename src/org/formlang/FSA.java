/* @LICENSE@
 */
package org.formlang;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * A finite state acceptor: a {@link Machine} plus a set of accept states.
 * The alphabet is inferred from the second members of the transition
 * function keys.
 * <p>
 * Construction checks, in this order, and throws an
 * {@link InvalidInputException} for the first one that fails:
 * <ol>
 * <li>the transition function, its keys and the start and accept states
 * are all present ({@link InvalidInputException.Category#SHAPE SHAPE});</li>
 * <li>the start state is one of the states;</li>
 * <li>the accept states are all states;</li>
 * <li>every alphabet symbol is a one character string;</li>
 * <li>every transition has a value, and every state named by a value is
 * one of the states;</li>
 * <li>the transition function is total: every (state, symbol) pair is a
 * key.</li>
 * </ol>
 *
 * @param <V> the kind of value the transition function maps to
 */
public abstract class FSA<V> extends Machine<V> {

    final Set<String> acceptStates;
    final Set<String> alphabet;

    FSA(Map<Pair<String, String>, ? extends V> transitionFunction,
            String startState, Set<String> acceptStates, String epsilon) {
        super(transitionFunction, startState);
        Validation.checkAcceptShape(acceptStates);
        this.acceptStates = Collections.unmodifiableSet(
            new LinkedHashSet<String>(acceptStates));
        Set<String> symbols = new TreeSet<String>(seconds(transitions.keySet()));
        if (epsilon != null) symbols.remove(epsilon);
        this.alphabet = Collections.unmodifiableSet(symbols);
    }

    /*
     * Subclass constructors call this once all fields are set.
     */
    final void wellDefined() {
        checkStart();
        Validation.checkAccept(acceptStates, states);
        Validation.checkAlphabet(alphabet, "alphabet");
        checkRange();
        checkDomain(alphabet);
    }

    public Set<String> acceptStates() {
        return acceptStates;
    }

    /**
     * @return the alphabet, sorted
     */
    public Set<String> alphabet() {
        return alphabet;
    }

    /**
     * Runs the acceptor on <code>string</code>, one character per symbol.
     *
     * @throws InvalidInputException if the string contains symbols outside
     *             the alphabet
     */
    public abstract boolean accepts(String string);
}
