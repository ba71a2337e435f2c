/*
 * @LICENSE@
 */

package org.refauto;

/**
 * A state of a {@linkplain Product product automaton}: one state of each
 * operand.
 */
public final class StatePair<A, B> implements Comparable<StatePair<A, B>> {

    final A first;
    final B second;

    StatePair(A first, B second) {
        assert first != null && second != null;
        this.first = first;
        this.second = second;
    }

    public A first() {
        return first;
    }

    public B second() {
        return second;
    }

    public int compareTo(StatePair<A, B> other) {
        int ret = Misc.ORDER.compare(first, other.first);
        return ret != 0 ? ret : Misc.ORDER.compare(second, other.second);
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + first.hashCode();
        result = prime * result + second.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof StatePair))
            return false;
        final StatePair<?, ?> other = (StatePair<?, ?>) obj;
        return first.equals(other.first) && second.equals(other.second);
    }

    @Override
    public String toString() {
        return "(" + first + "," + second + ")";
    }
}
