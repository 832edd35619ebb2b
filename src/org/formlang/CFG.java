/* @LICENSE@
 */
package org.formlang;

import static org.formlang.InvalidInputException.Category.NO_TERMINALS;
import static org.formlang.InvalidInputException.Category.SHAPE;
import static org.formlang.InvalidInputException.Category.START_VARIABLE;
import static org.formlang.Misc.LS;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * A context free grammar. Rules map each variable to its set of
 * substitutions; a substitution is a list of symbols, each a variable or a
 * terminal. Every key of the rule map is a variable, and every symbol in a
 * substitution that is not a variable is a terminal. The substitution
 * consisting of {@link #EPSILON} alone is the empty substitution.
 * <blockquote><pre>
 *   Map&lt;String, Set&lt;List&lt;String>>> rules = new HashMap&lt;String, Set&lt;List&lt;String>>>();
 *   rules.put("S", new HashSet&lt;List&lt;String>>(Arrays.asList(
 *       Arrays.asList("a", "S", "b"), Arrays.asList(CFG.EPSILON))));
 *   CFG anbn = new CFG(rules, "S");
 * </pre></blockquote>
 * Construction throws an {@link InvalidInputException} if the rules are
 * malformed (null or empty anywhere), if there are no terminals, or if the
 * start variable has no rules.
 */
public final class CFG {

    /**
     * The empty substitution marker, the euro sign.
     */
    public static final String EPSILON = "\u20AC";

    final Map<String, Set<List<String>>> rules;
    final String startVariable;
    final Set<String> variables;
    final Set<String> terminals;

    public CFG(Map<String, ? extends Set<List<String>>> rules, String startVariable) {
        this.rules = copied(rules);
        this.variables = Collections.unmodifiableSet(
            new LinkedHashSet<String>(this.rules.keySet()));
        Set<String> symbols = new TreeSet<String>();
        for (Set<List<String>> substitutions : this.rules.values()) {
            for (List<String> substitution : substitutions) {
                symbols.addAll(substitution);
            }
        }
        symbols.removeAll(variables);
        if (symbols.isEmpty()) {
            throw new InvalidInputException(NO_TERMINALS,
                "There are no terminals in the rule substitutions.");
        }
        this.terminals = Collections.unmodifiableSet(symbols);
        if (startVariable == null) {
            throw new InvalidInputException(SHAPE, "Start variable cannot be null.");
        }
        if (!variables.contains(startVariable)) {
            throw new InvalidInputException(START_VARIABLE,
                "Start variable '" + startVariable + "' is not in the variable set.",
                Collections.singleton(startVariable));
        }
        this.startVariable = startVariable;
    }

    /*
     * Deep, unmodifiable copy; every malformed rule is reported as SHAPE,
     * named by its variable.
     */
    private static Map<String, Set<List<String>>> copied(
            Map<String, ? extends Set<List<String>>> rules) {
        if (rules == null) {
            throw new InvalidInputException(SHAPE, "Rules cannot be null.");
        }
        if (rules.isEmpty()) {
            throw new InvalidInputException(SHAPE, "Rules cannot be empty.");
        }
        Map<String, Set<List<String>>> ret = new LinkedHashMap<String, Set<List<String>>>();
        Set<String> bad = new LinkedHashSet<String>();
        for (Map.Entry<String, ? extends Set<List<String>>> e : rules.entrySet()) {
            String variable = e.getKey();
            if (variable == null || variable.length() == 0) {
                bad.add(String.valueOf(variable));
                continue;
            }
            Set<List<String>> substitutions = e.getValue();
            if (substitutions == null || substitutions.isEmpty()) {
                bad.add(variable);
                continue;
            }
            Set<List<String>> copy = new LinkedHashSet<List<String>>();
            for (List<String> substitution : substitutions) {
                if (!wellFormed(substitution)) {
                    bad.add(variable);
                    break;
                }
                copy.add(Collections.unmodifiableList(new ArrayList<String>(substitution)));
            }
            ret.put(variable, Collections.unmodifiableSet(copy));
        }
        Validation.raiseIfAny(SHAPE, bad,
            "Rules for variable %s are malformed.",
            "Rules for variables %s are malformed.");
        return Collections.unmodifiableMap(ret);
    }

    private static boolean wellFormed(List<String> substitution) {
        if (substitution == null || substitution.isEmpty()) return false;
        for (String symbol : substitution) {
            if (symbol == null || symbol.length() == 0) return false;
        }
        return true;
    }

    static boolean isEpsilon(List<String> substitution) {
        return substitution.size() == 1 && substitution.get(0).equals(EPSILON);
    }

    /**
     * @return a copy of the rules; changing it does not change the grammar
     */
    public Map<String, Set<List<String>>> rules() {
        Map<String, Set<List<String>>> ret = new LinkedHashMap<String, Set<List<String>>>();
        for (Map.Entry<String, Set<List<String>>> e : rules.entrySet()) {
            ret.put(e.getKey(), new LinkedHashSet<List<String>>(e.getValue()));
        }
        return ret;
    }

    public String startVariable() {
        return startVariable;
    }

    public Set<String> variables() {
        return variables;
    }

    /**
     * @return the sorted terminals, the empty substitution marker included
     *         if some rule uses it
     */
    public Set<String> terminals() {
        return terminals;
    }

    /**
     * Checks that each sentential form in <code>derivation</code> follows
     * from the one before. A step may rewrite any number of variables of the
     * previous form at once, each by one of its substitutions, or rewrite
     * nothing at all. An empty substitution rewrites a variable to nothing.
     * A derivation of fewer than two forms is trivially valid.
     *
     * @throws InvalidInputException if the derivation, one of its forms or
     *             one of their symbols is null
     */
    public boolean isValidDerivation(List<List<String>> derivation) {
        if (derivation == null) {
            throw new InvalidInputException(SHAPE, "Derivation cannot be null.");
        }
        for (List<String> form : derivation) {
            if (form == null || form.contains(null)) {
                throw new InvalidInputException(SHAPE,
                    "Sentential forms cannot be null or contain null.");
            }
        }
        for (int i = 0; i + 1 < derivation.size(); ++i) {
            if (!yields(derivation.get(i), 0, derivation.get(i + 1), 0)) return false;
        }
        return true;
    }

    /*
     * Backtracking: the leading symbol of from[i..] either stays as is or
     * is replaced by one of its substitutions, and the rest of from has to
     * yield the rest of to.
     */
    private boolean yields(List<String> from, int i, List<String> to, int j) {
        if (from.subList(i, from.size()).equals(to.subList(j, to.size()))) return true;
        if (i == from.size()) return false;
        String symbol = from.get(i);
        if (j < to.size() && to.get(j).equals(symbol) && yields(from, i + 1, to, j + 1)) {
            return true;
        }
        Set<List<String>> substitutions = rules.get(symbol);
        if (substitutions == null) return false;
        for (List<String> substitution : substitutions) {
            if (startsWith(to, j, substitution)
                    && yields(from, i + 1, to, j + substitution.size())) {
                return true;
            }
            if (isEpsilon(substitution) && yields(from, i + 1, to, j)) return true;
        }
        return false;
    }

    private static boolean startsWith(List<String> list, int offset, List<String> prefix) {
        return list.size() - offset >= prefix.size()
            && list.subList(offset, offset + prefix.size()).equals(prefix);
    }

    /**
     * Returns an equivalent grammar in Chomsky normal form: every
     * substitution is a single terminal or two variables, neither of them
     * the start variable, and only the start variable may have the empty
     * substitution. The start variable is always a fresh one. The result
     * tends to be much bigger than the smallest normal form grammar for the
     * language.
     *
     * A grammar deriving no string at all normalizes to a three rule grammar
     * for the empty language over its first terminal.
     *
     * @throws InvalidInputException with {@code NO_TERMINALS} if such a
     *             grammar has no terminal but the empty marker
     */
    public CFG chomskyNormalize() {
        return new ChomskyNormalizer(this).normalize();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("cfg: ").append(variables.size()).append(" variables, start: ")
            .append(startVariable).append(LS);
        for (Map.Entry<String, Set<List<String>>> e : rules.entrySet()) {
            for (List<String> substitution : e.getValue()) {
                sb.append("    ").append(e.getKey()).append(" --> ")
                    .append(substitution).append(LS);
            }
        }
        return sb.toString();
    }
}
