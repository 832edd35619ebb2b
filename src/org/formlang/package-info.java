/*
 * @LICENSE@
 */

/**
 * <h3><b>formlang</b> - Finite automata, transducers and context free
 * grammars, with the classic constructions between them.</h3>
 * <p>
 * <h4>Machines.</h4>
 * <p>
 * {@link org.formlang.DFA}, {@link org.formlang.NFA} and
 * {@link org.formlang.FST} are built from a transition function keyed by
 * <code>(state, symbol)</code> {@linkplain org.formlang.Pair pairs} and a
 * start state; acceptors also take a set of accept states. The states and
 * the alphabet are never given separately, they are read off the transition
 * function. Every machine is checked in full when constructed, so a machine
 * you hold is always well formed; a malformed one is reported by an
 * {@link org.formlang.InvalidInputException} whose
 * {@linkplain org.formlang.InvalidInputException.Category category} tells
 * which rule was broken and which states, symbols or pairs broke it.
 * <p>
 * <h4>Constructions.</h4>
 * <ul>
 * <li>determinization of an NFA (subset construction);</li>
 * <li>union, concatenation and Kleene star of acceptors;</li>
 * <li>regex to NFA ({@link org.formlang.NFA#fit(String, java.util.Set)}) and
 * DFA to regex ({@link org.formlang.DFA#encode()}, by state
 * elimination);</li>
 * <li>Chomsky normal form of a {@link org.formlang.CFG}.</li>
 * </ul>
 * All constructions return new objects; nothing is ever mutated, and
 * instances may be shared freely between threads.
 * <p>
 * <h4>Logging.</h4>
 * Constructions log their progress to the <code>org.formlang</code>
 * {@link java.util.logging.Logger} at levels <code>FINER</code> and
 * <code>FINEST</code>.
 */
package org.formlang;
