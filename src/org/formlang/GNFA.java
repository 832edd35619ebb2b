/* @LICENSE@
 */
package org.formlang;

import static org.formlang.RegexCompiler.ALT;
import static org.formlang.RegexCompiler.EMPTY_SET;
import static org.formlang.RegexCompiler.EMPTY_STRING;
import static org.formlang.RegexCompiler.LEFT;
import static org.formlang.RegexCompiler.RIGHT;
import static org.formlang.RegexCompiler.STAR;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Generalized NFA, for extracting a regex from a {@link DFA}. Transitions
 * are labeled with regexes; every ordered pair of states carries exactly one
 * label, except that nothing leaves the accept state and nothing enters the
 * start state. Missing paths are labeled with the empty-set regex.
 * <p>
 * Built once from a DFA, then reduced in place one body state at a time
 * until only start and accept are left.
 */
final class GNFA {

    private static final Logger logger = Logger.getLogger("org.formlang");
    private static final Level level = Level.FINEST;

    static final String NOTHING = String.valueOf(EMPTY_SET);
    static final String EMPTY = String.valueOf(EMPTY_STRING);

    private final Map<Pair<String, String>, String> labels;
    private final Set<String> body;
    final String start;
    final String accept;

    private GNFA(Map<Pair<String, String>, String> labels, Set<String> body,
            String start, String accept) {
        this.labels = labels;
        this.body = body;
        this.start = start;
        this.accept = accept;
    }

    /*
     * Parallel single-symbol edges merge into one alternation; a fresh start
     * and a fresh accept state are wired in with empty-string edges.
     */
    static GNFA from(DFA dfa) {
        Map<Pair<String, String>, String> labels =
            new LinkedHashMap<Pair<String, String>, String>();
        Map<Pair<String, String>, String> sorted =
            new TreeMap<Pair<String, String>, String>(PAIR_ORDER);
        sorted.putAll(dfa.transitions);
        for (Map.Entry<Pair<String, String>, String> e : sorted.entrySet()) {
            Pair<String, String> edge = Pair.of(e.getKey().first(), e.getValue());
            String symbol = e.getKey().second();
            labels.put(edge, labels.containsKey(edge)
                ? labels.get(edge) + ALT + symbol : symbol);
        }
        Set<String> body = new TreeSet<String>(dfa.states);
        String start = Misc.freshName(body, "start");
        String accept = Misc.freshName(Misc.union(body, Collections.singleton(start)), "accept");
        labels.put(Pair.of(start, dfa.startState), EMPTY);
        for (String state : dfa.acceptStates) {
            labels.put(Pair.of(state, accept), EMPTY);
        }
        GNFA ret = new GNFA(labels, body, start, accept);
        for (String from : ret.sources()) {
            for (String to : ret.targets()) {
                if (!labels.containsKey(Pair.of(from, to))) {
                    labels.put(Pair.of(from, to), NOTHING);
                }
            }
        }
        return ret;
    }

    private static final Comparator<Pair<String, String>> PAIR_ORDER =
        new Comparator<Pair<String, String>>() {
            public int compare(Pair<String, String> lhs, Pair<String, String> rhs) {
                int ret = lhs.first().compareTo(rhs.first());
                return ret != 0 ? ret : lhs.second().compareTo(rhs.second());
            }
        };

    private Set<String> sources() {
        Set<String> ret = new LinkedHashSet<String>();
        ret.add(start);
        ret.addAll(body);
        return ret;
    }

    private Set<String> targets() {
        Set<String> ret = new LinkedHashSet<String>(body);
        ret.add(accept);
        return ret;
    }

    String label(String from, String to) {
        String ret = labels.get(Pair.of(from, to));
        assert ret != null : from + " -> " + to;
        return ret;
    }

    int size() {
        return body.size() + 2;
    }

    /**
     * Eliminates <code>rip</code>: every surviving pair (from, to) gets the
     * label <code>R1 R2* R3 | R4</code>, where R1 labels from -> rip, R2 is
     * rip's self loop, R3 labels rip -> to, and R4 labels from -> to.
     */
    void eliminate(String rip) {
        assert body.contains(rip) : rip;
        body.remove(rip);
        final String loop = star(labels.remove(Pair.of(rip, rip)));
        Map<Pair<String, String>, String> reduced =
            new LinkedHashMap<Pair<String, String>, String>();
        for (String from : sources()) {
            String r1 = labels.get(Pair.of(from, rip));
            for (String to : targets()) {
                String r3 = labels.get(Pair.of(rip, to));
                String r4 = labels.get(Pair.of(from, to));
                reduced.put(Pair.of(from, to), union(concat(concat(r1, loop), r3), r4));
            }
        }
        labels.clear();
        labels.putAll(reduced);
        if (logger.isLoggable(level)) {
            logger.log(level, "eliminated " + rip + ", " + body.size()
                + " body states left, start -> accept: " + label(start, accept));
        }
    }

    /**
     * Eliminates the body states in sorted order; any order gives an
     * equivalent regex.
     *
     * @return the label from start to accept
     */
    String reduce() {
        for (String rip : new TreeSet<String>(body)) {
            eliminate(rip);
        }
        assert size() == 2;
        return label(start, accept);
    }

    /*
     * Regex composition, simplifying with the empty-string and empty-set
     * identities.
     */
    static boolean unionAtTopLevel(String regex) {
        int depth = 0;
        for (int i = 0; i < regex.length(); ++i) {
            char c = regex.charAt(i);
            if (c == LEFT) {
                ++depth;
            } else if (c == RIGHT) {
                --depth;
            } else if (c == ALT && depth == 0) {
                return true;
            }
        }
        return false;
    }

    static String star(String regex) {
        if (regex.equals(NOTHING) || regex.equals(EMPTY)) {
            return EMPTY;
        } else if (regex.length() == 1) {
            return regex + STAR;
        } else {
            return LEFT + regex + RIGHT + STAR;
        }
    }

    static String concat(String lhs, String rhs) {
        if (lhs.equals(NOTHING) || rhs.equals(NOTHING)) {
            return NOTHING;
        } else if (lhs.equals(EMPTY)) {
            return rhs;
        } else if (rhs.equals(EMPTY)) {
            return lhs;
        }
        return grouped(lhs) + grouped(rhs);
    }

    private static String grouped(String regex) {
        return unionAtTopLevel(regex) ? LEFT + regex + RIGHT : regex;
    }

    static String union(String lhs, String rhs) {
        if (lhs.equals(NOTHING)) {
            return rhs;
        } else if (rhs.equals(NOTHING)) {
            return lhs;
        }
        return lhs + ALT + rhs;
    }
}
