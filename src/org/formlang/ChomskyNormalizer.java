/* @LICENSE@
 */
package org.formlang;

import static org.formlang.CFG.EPSILON;
import static org.formlang.CFG.isEpsilon;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rewrites a grammar into Chomsky normal form. Works on a flat set of
 * <code>(variable, substitution)</code> rules, in stages:
 * <ol>
 * <li>a fresh start variable, with the single rule <code>S' -> S</code>;</li>
 * <li>empty substitutions are eliminated, except for the fresh start;</li>
 * <li>unit rules <code>V -> W</code> are eliminated;</li>
 * <li>rules with variables that derive no terminal string, and rules of
 * variables the start never reaches, are dropped; a start that derives
 * nothing gets the normal form of the empty language;</li>
 * <li>substitutions longer than two are chained through fresh
 * variables;</li>
 * <li>terminals in two symbol substitutions are replaced by fresh
 * variables.</li>
 * </ol>
 * One instance per normalization.
 */
final class ChomskyNormalizer {

    private static final Logger logger = Logger.getLogger("org.formlang");
    private static final Level level = Level.FINER;

    private static final List<String> EMPTY = Collections.singletonList(EPSILON);

    private final CFG grammar;
    private final Set<Pair<String, List<String>>> rules =
        new LinkedHashSet<Pair<String, List<String>>>();
    private final Set<String> variables;
    private final Set<String> taken;
    private String start;

    ChomskyNormalizer(CFG grammar) {
        this.grammar = grammar;
        this.variables = new LinkedHashSet<String>(grammar.variables);
        this.taken = Misc.union(grammar.variables, grammar.terminals);
        for (Map.Entry<String, Set<List<String>>> e : grammar.rules.entrySet()) {
            for (List<String> substitution : e.getValue()) {
                rules.add(Pair.of(e.getKey(), withoutEpsilons(substitution)));
            }
        }
    }

    /*
     * The empty marker only means something as a substitution of its own.
     */
    private static List<String> withoutEpsilons(List<String> substitution) {
        if (substitution.size() == 1) return substitution;
        List<String> ret = new ArrayList<String>(substitution);
        ret.removeAll(EMPTY);
        return ret.isEmpty() ? EMPTY : ret;
    }

    private boolean isVariable(String symbol) {
        return variables.contains(symbol);
    }

    private boolean isUnit(List<String> substitution) {
        return substitution.size() == 1 && isVariable(substitution.get(0));
    }

    private String freshVariable(String stem) {
        String ret = Misc.freshName(taken, stem);
        taken.add(ret);
        variables.add(ret);
        return ret;
    }

    private void log(String stage) {
        if (logger.isLoggable(level)) {
            logger.log(level, stage + ": " + rules.size() + " rules");
        }
    }

    CFG normalize() {
        isolateStart();
        log("start isolated");
        eliminateEpsilons();
        log("empty substitutions eliminated");
        eliminateUnits();
        log("unit rules eliminated");
        pruneNonGenerating();
        pruneUnreachable();
        log("useless rules pruned");
        chainLongRules();
        log("long rules chained");
        replaceTerminals();
        log("terminals replaced");

        Map<String, Set<List<String>>> grouped = new LinkedHashMap<String, Set<List<String>>>();
        for (Pair<String, List<String>> rule : rules) {
            Set<List<String>> substitutions = grouped.get(rule.first());
            if (substitutions == null) {
                substitutions = new LinkedHashSet<List<String>>();
                grouped.put(rule.first(), substitutions);
            }
            substitutions.add(rule.second());
        }
        return new CFG(grouped, start);
    }

    private void isolateStart() {
        start = freshVariable(grammar.startVariable + "'");
        rules.add(Pair.of(start, Collections.singletonList(grammar.startVariable)));
    }

    private Pair<String, List<String>> find(boolean epsilon) {
        for (Pair<String, List<String>> rule : rules) {
            if (epsilon ? isEpsilon(rule.second()) && !rule.first().equals(start)
                        : isUnit(rule.second())) {
                return rule;
            }
        }
        return null;
    }

    /*
     * Removing V -> e adds, for each rule mentioning V, one variant per non
     * empty subset of V's occurrences with those occurrences dropped. An
     * empty substitution once removed is never added again.
     */
    private void eliminateEpsilons() {
        Set<Pair<String, List<String>>> removed = new HashSet<Pair<String, List<String>>>();
        for (Pair<String, List<String>> rule = find(true); rule != null; rule = find(true)) {
            rules.remove(rule);
            removed.add(rule);
            String nullable = rule.first();
            for (Pair<String, List<String>> other : new ArrayList<Pair<String, List<String>>>(rules)) {
                List<String> substitution = other.second();
                List<Integer> positions = new ArrayList<Integer>();
                for (int i = 0; i < substitution.size(); ++i) {
                    if (substitution.get(i).equals(nullable)) positions.add(i);
                }
                for (List<Integer> dropped : Misc.nonEmptySubsets(positions)) {
                    List<String> kept = new ArrayList<String>();
                    for (int i = 0; i < substitution.size(); ++i) {
                        if (!dropped.contains(i)) kept.add(substitution.get(i));
                    }
                    Pair<String, List<String>> variant =
                        Pair.of(other.first(), kept.isEmpty() ? EMPTY : kept);
                    if (!removed.contains(variant)) rules.add(variant);
                }
            }
        }
    }

    /*
     * Removing V -> W copies every rule of W to V, unit rules included; a
     * unit rule once removed is never added again, and V -> V is dropped.
     */
    private void eliminateUnits() {
        Set<Pair<String, List<String>>> removed = new HashSet<Pair<String, List<String>>>();
        for (Pair<String, List<String>> rule = find(false); rule != null; rule = find(false)) {
            rules.remove(rule);
            removed.add(rule);
            String variable = rule.first();
            String target = rule.second().get(0);
            if (variable.equals(target)) continue;
            for (Pair<String, List<String>> other : new ArrayList<Pair<String, List<String>>>(rules)) {
                if (!other.first().equals(target)) continue;
                Pair<String, List<String>> copy = Pair.of(variable, other.second());
                boolean selfUnit = isUnit(copy.second())
                    && copy.second().get(0).equals(variable);
                if (!selfUnit && !removed.contains(copy)) rules.add(copy);
            }
        }
    }

    /*
     * A variable generates if one of its rules has only terminals and
     * generating variables. Rules mentioning any other variable can never
     * take part in deriving a terminal string.
     */
    private void pruneNonGenerating() {
        Set<String> generating = new HashSet<String>();
        for (boolean grew = true; grew; ) {
            grew = false;
            for (Pair<String, List<String>> rule : rules) {
                if (!generating.contains(rule.first()) && generates(rule.second(), generating)) {
                    generating.add(rule.first());
                    grew = true;
                }
            }
        }
        if (!generating.contains(start)) {
            replaceWithEmptyLanguage();
            return;
        }
        Set<Pair<String, List<String>>> kept = new LinkedHashSet<Pair<String, List<String>>>();
        for (Pair<String, List<String>> rule : rules) {
            if (generating.contains(rule.first()) && generates(rule.second(), generating)) {
                kept.add(rule);
            }
        }
        rules.retainAll(kept);
    }

    /*
     * The start derives no terminal string. The normal form of the empty
     * language is S' -> T N, N -> T N, T -> t for some terminal t other
     * than the empty marker.
     */
    private void replaceWithEmptyLanguage() {
        String terminal = null;
        for (String candidate : grammar.terminals) {
            if (!candidate.equals(EPSILON)) {
                terminal = candidate;
                break;
            }
        }
        if (terminal == null) {
            throw new InvalidInputException(InvalidInputException.Category.NO_TERMINALS,
                "Start variable '" + grammar.startVariable + "' derives no string and '"
                    + EPSILON + "' is the only terminal; no normal form grammar has a terminal.",
                Collections.singleton(grammar.startVariable));
        }
        if (logger.isLoggable(level)) {
            logger.log(level, "start variable " + grammar.startVariable + " derives no string");
        }
        String symbol = freshVariable("V");
        String loop = freshVariable("V");
        rules.clear();
        rules.add(Pair.of(start, pair(symbol, loop)));
        rules.add(Pair.of(loop, pair(symbol, loop)));
        rules.add(Pair.of(symbol, Collections.singletonList(terminal)));
    }

    /*
     * Drops the rules of variables the start variable never reaches.
     */
    private void pruneUnreachable() {
        Set<String> reached = new HashSet<String>();
        LinkedList<String> gray = new LinkedList<String>();
        reached.add(start);
        gray.add(start);
        while (!gray.isEmpty()) {
            String variable = gray.removeFirst();
            for (Pair<String, List<String>> rule : rules) {
                if (!rule.first().equals(variable)) continue;
                for (String symbol : rule.second()) {
                    if (isVariable(symbol) && reached.add(symbol)) gray.addLast(symbol);
                }
            }
        }
        Set<Pair<String, List<String>>> kept = new LinkedHashSet<Pair<String, List<String>>>();
        for (Pair<String, List<String>> rule : rules) {
            if (reached.contains(rule.first())) kept.add(rule);
        }
        rules.retainAll(kept);
    }

    private boolean generates(List<String> substitution, Set<String> generating) {
        for (String symbol : substitution) {
            if (isVariable(symbol) && !generating.contains(symbol)) return false;
        }
        return true;
    }

    /*
     * A -> x1 x2 ... xn becomes A -> x1 V1, V1 -> x2 V2, ..., Vk -> x(n-1) xn.
     */
    private void chainLongRules() {
        for (Pair<String, List<String>> rule : new ArrayList<Pair<String, List<String>>>(rules)) {
            List<String> substitution = rule.second();
            if (substitution.size() < 3) continue;
            rules.remove(rule);
            String variable = rule.first();
            for (int i = 0; i < substitution.size() - 2; ++i) {
                String next = freshVariable("V");
                rules.add(Pair.of(variable, pair(substitution.get(i), next)));
                variable = next;
            }
            int n = substitution.size();
            rules.add(Pair.of(variable, pair(substitution.get(n - 2), substitution.get(n - 1))));
        }
    }

    private void replaceTerminals() {
        Map<String, String> replacements = new LinkedHashMap<String, String>();
        for (Pair<String, List<String>> rule : new ArrayList<Pair<String, List<String>>>(rules)) {
            List<String> substitution = rule.second();
            if (substitution.size() != 2) continue;
            if (isVariable(substitution.get(0)) && isVariable(substitution.get(1))) continue;
            rules.remove(rule);
            List<String> replaced = new ArrayList<String>();
            for (String symbol : substitution) {
                assert !symbol.equals(EPSILON) : rule;
                if (isVariable(symbol)) {
                    replaced.add(symbol);
                    continue;
                }
                String variable = replacements.get(symbol);
                if (variable == null) {
                    variable = freshVariable("V");
                    replacements.put(symbol, variable);
                    rules.add(Pair.of(variable, Collections.singletonList(symbol)));
                }
                replaced.add(variable);
            }
            rules.add(Pair.of(rule.first(), replaced));
        }
    }

    private static List<String> pair(String first, String second) {
        List<String> ret = new ArrayList<String>(2);
        ret.add(first);
        ret.add(second);
        return ret;
    }
}
