/* @LICENSE@
 */
package org.formlang;

/**
 * An immutable ordered pair. Transition functions are keyed by
 * <code>(state, symbol)</code> pairs, transducers map to
 * <code>(state, output symbol)</code> pairs.
 *
 * @param <A> type of the first member
 * @param <B> type of the second member
 */
public final class Pair<A, B> {

    private final A first;
    private final B second;

    private Pair(A first, B second) {
        this.first = first;
        this.second = second;
    }

    public static <A, B> Pair<A, B> of(A first, B second) {
        return new Pair<A, B>(first, second);
    }

    public A first() {
        return first;
    }

    public B second() {
        return second;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + ((first == null) ? 0 : first.hashCode());
        result = prime * result + ((second == null) ? 0 : second.hashCode());
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null)
            return false;
        if (!(o instanceof Pair<?, ?>))
            return false;
        final Pair<?, ?> p = (Pair<?, ?>) o;
        if (first == null) {
            if (p.first != null)
                return false;
        } else if (!first.equals(p.first))
            return false;
        if (second == null) {
            if (p.second != null)
                return false;
        } else if (!second.equals(p.second))
            return false;
        return true;
    }

    /*
     * The offender names of validation errors use this form.
     */
    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
