/*
 * @LICENSE@
 */

package org.formlang;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;


/**
 * This class implements a bunch of reusable, miscellaneous static methods:
 * set algebra, fresh name allocation and canonical names for derived
 * states.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    static <T> HashSet<T> intersect(Collection<T> lhs, Collection<T> rhs) {
        HashSet<T> ret = new HashSet<T>(lhs);
        for (T t : lhs) if (!rhs.contains(t)) ret.remove(t);
        return ret;
    }

    static <T> boolean disjoint(Collection<T> lhs, Collection<T> rhs) {
        for (T t : lhs) if (rhs.contains(t)) return false;
        return true;
    }

    static <T> LinkedHashSet<T> difference(Collection<T> lhs, Collection<T> rhs) {
        LinkedHashSet<T> ret = new LinkedHashSet<T>(lhs);
        ret.removeAll(rhs);
        return ret;
    }

    static <T> LinkedHashSet<T> union(Collection<T> lhs, Collection<T> rhs) {
        LinkedHashSet<T> ret = new LinkedHashSet<T>(lhs);
        ret.addAll(rhs);
        return ret;
    }

    static <A, B> Set<Pair<A, B>> product(Collection<A> lhs, Collection<B> rhs) {
        Set<Pair<A, B>> ret = new LinkedHashSet<Pair<A, B>>();
        for (A a : lhs) for (B b : rhs) ret.add(Pair.of(a, b));
        return ret;
    }

    /**
     * Every non-empty subset of <code>items</code>, each in the order of the
     * given list. Exponential, for the short lists of symbol positions in
     * a grammar rule.
     */
    static <T> List<List<T>> nonEmptySubsets(List<T> items) {
        if (items.size() >= Integer.SIZE - 1) {
            throw new IllegalArgumentException(
                "Too many items for subset enumeration: " + items.size());
        }
        List<List<T>> ret = new ArrayList<List<T>>();
        for (int bits = 1; bits < (1 << items.size()); ++bits) {
            List<T> subset = new ArrayList<T>();
            for (int i = 0; i < items.size(); ++i) {
                if ((bits & (1 << i)) != 0) subset.add(items.get(i));
            }
            ret.add(subset);
        }
        return ret;
    }

    /**
     * @return <code>stem</code> if not taken, else the first of
     *         <code>stem1, stem2, ...</code> that is not taken
     */
    static String freshName(Collection<String> taken, String stem) {
        String name = stem;
        for (int n = 1; taken.contains(name); ++n) {
            name = stem + n;
        }
        return name;
    }

    /**
     * Finds a suffix which, appended to each of <code>names</code>, yields
     * names none of which is taken: <code>'1</code>, <code>'2</code>, ...
     * Appending one suffix to every name keeps distinct names distinct.
     */
    static String freshSuffix(Collection<String> names, Collection<String> taken) {
        for (int n = 1; ; ++n) {
            String suffix = "'" + n;
            boolean free = true;
            for (String name : names) {
                if (taken.contains(name + suffix)) {
                    free = false;
                    break;
                }
            }
            if (free) return suffix;
        }
    }

    /*
     * Canonical names for derived states. Component names are escaped so
     * that distinct sets and pairs always get distinct names.
     */
    static String setName(Collection<String> states) {
        StringBuilder sb = new StringBuilder();
        sb.append('{');
        final int mark = sb.length();
        for (String state : new TreeSet<String>(states)) {
            if (sb.length() != mark) sb.append(',');
            Esc.NAME.esc(sb, state);
        }
        sb.append('}');
        return sb.toString();
    }

    static String pairName(String lhs, String rhs) {
        StringBuilder sb = new StringBuilder();
        sb.append('(');
        Esc.NAME.esc(sb, lhs);
        sb.append(',');
        Esc.NAME.esc(sb, rhs);
        sb.append(')');
        return sb.toString();
    }

    /**
     * @return <code>'a', 'b', 'c'</code>, sorted
     */
    static String quoted(Collection<?> members) {
        Set<String> sorted = new TreeSet<String>();
        for (Object o : members) sorted.add(String.valueOf(o));
        StringBuilder sb = new StringBuilder();
        for (String s : sorted) {
            sb.append(sb.length() == 0 ? "" : ", ").append('\'').append(s).append('\'');
        }
        return sb.toString();
    }

    private static final class MapEscaper {
        private final Map<Character, String> map =
                new HashMap<Character, String>();

        boolean esc(StringBuilder sb, char c) {
            boolean ret = map.containsKey(c);
            if (ret)
                sb.append(map.get(c));
            return ret;
        }

        MapEscaper map(Character c, String s) {
            map.put(c, s);
            return this;
        }
    }

    private static final MapEscaper nameEscaper =
            new MapEscaper().map('\\', "\\\\").map(',', "\\,")
                .map('{', "\\{").map('}', "\\}")
                .map('(', "\\(").map(')', "\\)");

    /**
     * Singleton escapers, replacing certain characters by escape sequences.
     */
    enum Esc {

        /**
         * State name escaper - escapes the delimiters of set and pair names
         */
        NAME(nameEscaper);

        private final MapEscaper[] path;

        Esc(final MapEscaper... path) {
            this.path = path;
        }

        void esc(StringBuilder sb, char c) {
            for (MapEscaper e : path) {
                if (e.esc(sb, c))
                    return;
            }
            sb.append(c);
        }

        void esc(StringBuilder sb, CharSequence cs) {
            for (int i = 0; i < cs.length(); ++i) {
                esc(sb, cs.charAt(i));
            }
        }
    }
}
