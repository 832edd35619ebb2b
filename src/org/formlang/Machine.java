/* @LICENSE@
 */
package org.formlang;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Common base of finite state machines: a transition function keyed by
 * <code>(state, symbol)</code> pairs and a start state. The state set is
 * inferred from the first members of the keys, never given separately.
 * <p>
 * Instances are immutable; the accessors return copies, so mutating a
 * returned map does not touch the machine.
 *
 * @param <V> the kind of value the transition function maps to
 */
public abstract class Machine<V> {

    final Map<Pair<String, String>, V> transitions;
    final String startState;
    final Set<String> states;

    Machine(Map<Pair<String, String>, ? extends V> transitionFunction,
            String startState) {
        Validation.checkShape(transitionFunction, startState);
        this.transitions = Collections.unmodifiableMap(
            new LinkedHashMap<Pair<String, String>, V>(transitionFunction));
        this.startState = startState;
        this.states = Collections.unmodifiableSet(firsts(transitions.keySet()));
    }

    static Set<String> firsts(Collection<Pair<String, String>> pairs) {
        Set<String> ret = new LinkedHashSet<String>();
        for (Pair<String, String> p : pairs) ret.add(p.first());
        return ret;
    }

    static Set<String> seconds(Collection<Pair<String, String>> pairs) {
        Set<String> ret = new LinkedHashSet<String>();
        for (Pair<String, String> p : pairs) ret.add(p.second());
        return ret;
    }

    /**
     * @return a copy of the transition function
     */
    public Map<Pair<String, String>, V> transitionFunction() {
        return new LinkedHashMap<Pair<String, String>, V>(transitions);
    }

    public String startState() {
        return startState;
    }

    /**
     * @return the states, as inferred from the transition function
     */
    public Set<String> states() {
        return states;
    }

    final void checkStart() {
        Validation.checkStart(startState, states);
    }

    final void checkDomain(Set<String> alphabet) {
        Validation.checkDomain(states, alphabet, transitions.keySet());
    }

    /*
     * Range values of the wrong kind first, then range values naming
     * unknown states.
     */
    abstract void checkRange();
}
