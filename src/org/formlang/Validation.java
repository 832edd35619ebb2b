/* @LICENSE@
 */
package org.formlang;

import static org.formlang.InvalidInputException.Category.ACCEPT_STATES;
import static org.formlang.InvalidInputException.Category.ALPHABET;
import static org.formlang.InvalidInputException.Category.DOMAIN;
import static org.formlang.InvalidInputException.Category.INPUT_SYMBOL;
import static org.formlang.InvalidInputException.Category.RANGE;
import static org.formlang.InvalidInputException.Category.RANGE_TYPE;
import static org.formlang.InvalidInputException.Category.SHAPE;
import static org.formlang.InvalidInputException.Category.START_STATE;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.formlang.InvalidInputException.Category;

/**
 * The well-formedness checks shared by automata and transducers. Each check
 * either returns silently or throws an {@link InvalidInputException} naming
 * every offending element of its category.
 */
final class Validation {

    private Validation() {
    } // never instantiated

    /**
     * Throws if <code>bad</code> is not empty. The messages take the quoted
     * offenders in place of <code>%s</code>.
     */
    static void raiseIfAny(Category category, Collection<?> bad,
            String singular, String plural) {
        if (bad.isEmpty()) return;
        List<String> names = new ArrayList<String>();
        for (Object o : bad) names.add(String.valueOf(o));
        String msg = String.format(
            names.size() == 1 ? singular : plural, Misc.quoted(names));
        throw new InvalidInputException(category, msg, names);
    }

    static void checkShape(Map<Pair<String, String>, ?> transitionFunction,
            String startState) {
        if (transitionFunction == null) {
            throw new InvalidInputException(SHAPE,
                "Transition function cannot be null.");
        }
        if (transitionFunction.isEmpty()) {
            throw new InvalidInputException(SHAPE,
                "Transition function cannot be empty.");
        }
        Set<String> bad = new LinkedHashSet<String>();
        for (Pair<String, String> key : transitionFunction.keySet()) {
            if (key == null || key.first() == null || key.second() == null) {
                bad.add(String.valueOf(key));
            }
        }
        raiseIfAny(SHAPE, bad,
            "Key %s of the transition function is not a (state, symbol) pair.",
            "Keys %s of the transition function are not (state, symbol) pairs.");
        if (startState == null) {
            throw new InvalidInputException(SHAPE,
                "Start state cannot be null.");
        }
    }

    static void checkAcceptShape(Set<String> acceptStates) {
        if (acceptStates == null) {
            throw new InvalidInputException(SHAPE,
                "Accept state set cannot be null.");
        }
        for (String state : acceptStates) {
            if (state == null) {
                throw new InvalidInputException(SHAPE,
                    "Accept state set cannot contain null.");
            }
        }
    }

    static void checkStart(String startState, Set<String> states) {
        if (!states.contains(startState)) {
            throw new InvalidInputException(START_STATE,
                "Start state '" + startState
                    + "' is not a member of the state set.",
                Collections.singleton(startState));
        }
    }

    static void checkAccept(Set<String> acceptStates, Set<String> states) {
        raiseIfAny(ACCEPT_STATES, Misc.difference(acceptStates, states),
            "Accept state %s is not a member of the state set.",
            "Accept states %s are not members of the state set.");
    }

    static void checkAlphabet(Collection<String> alphabet, String name) {
        Set<String> bad = new LinkedHashSet<String>();
        for (String symbol : alphabet) {
            if (symbol.length() != 1) bad.add(symbol);
        }
        raiseIfAny(ALPHABET, bad,
            "Symbol %s in the " + name + " is not a single character string.",
            "Symbols %s in the " + name + " are not single character strings.");
    }

    static void checkRangeType(Map<Pair<String, String>, ?> transitionFunction) {
        Set<String> bad = new LinkedHashSet<String>();
        for (Map.Entry<Pair<String, String>, ?> e : transitionFunction.entrySet()) {
            if (e.getValue() == null) bad.add(e.getKey().toString());
        }
        raiseIfAny(RANGE_TYPE, bad,
            "Transition %s has no value.",
            "Transitions %s have no value.");
    }

    static void checkRange(Collection<String> range, Set<String> states) {
        raiseIfAny(RANGE, Misc.difference(range, states),
            "State %s in the range of the transition function is not in the state set.",
            "States %s in the range of the transition function are not in the state set.");
    }

    static void checkDomain(Set<String> states, Set<String> alphabet,
            Set<Pair<String, String>> domain) {
        raiseIfAny(DOMAIN,
            Misc.difference(Misc.product(states, alphabet), domain),
            "Pair %s is missing from the transition function domain.",
            "Pairs %s are missing from the transition function domain.");
    }

    static void checkInput(String string, Set<String> alphabet) {
        if (string == null) {
            throw new InvalidInputException(SHAPE, "Input string cannot be null.");
        }
        Set<String> bad = new LinkedHashSet<String>();
        for (int i = 0; i < string.length(); ++i) {
            String symbol = String.valueOf(string.charAt(i));
            if (!alphabet.contains(symbol)) bad.add(symbol);
        }
        raiseIfAny(INPUT_SYMBOL, bad,
            "Symbol %s is not in the alphabet.",
            "Symbols %s are not in the alphabet.");
    }
}
