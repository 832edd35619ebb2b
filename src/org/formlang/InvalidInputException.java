/* @LICENSE@
 */
package org.formlang;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * A runtime exception thrown when an automaton, transducer or grammar is
 * constructed from malformed input, or when one of their operations is
 * called with input it cannot handle. The {@link Category} tells which
 * well-formedness rule was violated; {@link #offenders()} names every
 * element that violated it.
 */
public final class InvalidInputException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * The well-formedness rules, in the order in which construction checks
     * them.
     */
    public enum Category {
        /** Null or empty containers, keys, values or members. */
        SHAPE,
        /** Start state is not one of the inferred states. */
        START_STATE,
        /** Accept states are not all inferred states. */
        ACCEPT_STATES,
        /** Alphabet symbols that are not exactly one character. */
        ALPHABET,
        /** Transition values of the wrong kind. */
        RANGE_TYPE,
        /** Transition values naming states outside the state set. */
        RANGE,
        /** (state, symbol) pairs missing from the transition function. */
        DOMAIN,
        /** Input string symbols outside the alphabet. */
        INPUT_SYMBOL,
        /** Empty regex or empty parenthesized group. */
        REGEX_EMPTY,
        /** Regex or group starting with an operator. */
        REGEX_START_OPERATOR,
        /** Regex characters that are neither symbols nor regex syntax. */
        REGEX_CHARACTER,
        /** Binary operator followed by an operator, ')' or the end. */
        REGEX_OPERATOR_SEQUENCE,
        /** ')' without a matching '('. */
        REGEX_UNBALANCED_RIGHT,
        /** '(' without a matching ')'. */
        REGEX_UNBALANCED_LEFT,
        /** Alphabet containing reserved regex characters. */
        REGEX_RESERVED_IN_ALPHABET,
        /** Grammar with no terminals. */
        NO_TERMINALS,
        /** Start variable is not a rule key. */
        START_VARIABLE;
    }

    private final Category category;
    private final Set<String> offenders;

    public InvalidInputException(Category category, String msg) {
        this(category, msg, Collections.<String>emptySet());
    }

    public InvalidInputException(Category category, String msg,
            Collection<String> offenders) {
        super(msg);
        this.category = category;
        this.offenders = Collections.unmodifiableSet(
            new TreeSet<String>(offenders));
    }

    public Category category() {
        return category;
    }

    /**
     * @return the names of the offending states, symbols, pairs or
     *         characters, sorted; empty for categories about the whole input
     */
    public Set<String> offenders() {
        return offenders;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + category + "]: " + getMessage();
    }
}
