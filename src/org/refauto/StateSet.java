/*
 * @LICENSE@
 */

package org.refauto;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable finite set of opaque state identifiers. Equality and hash code
 * depend on the members only, never on insertion order, so a
 * <code>StateSet</code> is itself usable as a state identifier (the states of
 * a determinized automaton are sets of the source automaton's states).
 * <p>
 * Union is associative and {@link #empty()} is its identity.
 *
 * @param <Q>
 *            the state identifier type
 */
public final class StateSet<Q> implements Iterable<Q>, Comparable<StateSet<Q>> {

    private static final StateSet<Object> EMPTY =
        new StateSet<Object>(Collections.emptySet());

    private final Set<Q> elements;
    private String s;

    private StateSet(Set<Q> elements) {
        this.elements = elements;
    }

    /**
     * The identity element of union; also the sink state of every
     * determinized automaton.
     */
    @SuppressWarnings("unchecked")
    public static <Q> StateSet<Q> empty() {
        return (StateSet<Q>) EMPTY;
    }

    @SafeVarargs
    public static <Q> StateSet<Q> of(Q... qs) {
        Set<Q> set = new LinkedHashSet<Q>(qs.length * 2);
        for (Q q : qs) set.add(nonNull(q));
        return wrap(set);
    }

    public static <Q> StateSet<Q> of(Collection<? extends Q> qs) {
        if (qs.isEmpty()) return empty();
        Set<Q> set = new LinkedHashSet<Q>(qs.size() * 2);
        for (Q q : qs) set.add(nonNull(q));
        return wrap(set);
    }

    /**
     * @return the union of all the given sets, {@link #empty()} if there are
     *         none
     */
    public static <Q> StateSet<Q> unionAll(Iterable<StateSet<Q>> sets) {
        Set<Q> set = new LinkedHashSet<Q>();
        for (StateSet<Q> ss : sets) set.addAll(ss.elements);
        return wrap(set);
    }

    private static <Q> Q nonNull(Q q) {
        if (q == null) {
            throw new IllegalArgumentException("null state identifier");
        }
        return q;
    }

    private static <Q> StateSet<Q> wrap(Set<Q> set) {
        return set.isEmpty()
                ? StateSet.<Q>empty()
                : new StateSet<Q>(Collections.unmodifiableSet(set));
    }

    public StateSet<Q> union(StateSet<Q> other) {
        if (other.isEmpty() || this == other) return this;
        if (isEmpty()) return other;
        Set<Q> set = new LinkedHashSet<Q>(elements);
        return set.addAll(other.elements) ? wrap(set) : this;
    }

    public StateSet<Q> intersection(StateSet<Q> other) {
        Set<Q> set = new LinkedHashSet<Q>(elements);
        set.retainAll(other.elements);
        return wrap(set);
    }

    public StateSet<Q> difference(StateSet<Q> other) {
        Set<Q> set = new LinkedHashSet<Q>(elements);
        set.removeAll(other.elements);
        return wrap(set);
    }

    public StateSet<Q> with(Q q) {
        if (elements.contains(q)) return this;
        Set<Q> set = new LinkedHashSet<Q>(elements);
        set.add(nonNull(q));
        return wrap(set);
    }

    public boolean contains(Object q) {
        return elements.contains(q);
    }

    public boolean containsAll(StateSet<?> other) {
        return elements.containsAll(other.elements);
    }

    public boolean intersects(StateSet<?> other) {
        StateSet<?> small = size() <= other.size() ? this : other;
        StateSet<?> large = small == this ? other : this;
        for (Object q : small.elements) {
            if (large.elements.contains(q)) return true;
        }
        return false;
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public int size() {
        return elements.size();
    }

    /**
     * @return an unmodifiable view, in insertion order
     */
    public Set<Q> asSet() {
        return elements;
    }

    public Iterator<Q> iterator() {
        return elements.iterator();
    }

    /*
     * smaller sets first, then member by member in sorted order.
     */
    public int compareTo(StateSet<Q> other) {
        if (size() != other.size()) return size() < other.size() ? -1 : 1;
        List<Q> lhs = Misc.sorted(elements);
        List<Q> rhs = Misc.sorted(other.elements);
        for (int i = 0; i < lhs.size(); ++i) {
            int ret = Misc.ORDER.compare(lhs.get(i), rhs.get(i));
            if (ret != 0) return ret;
        }
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateSet)) return false;
        return elements.equals(((StateSet<?>) o).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    /*
     * members in sorted order, so that equal sets print the same.
     */
    @Override
    public String toString() {
        if (s != null) return s;
        StringBuilder sb = new StringBuilder();
        sb.append('{');
        for (Q q : Misc.sorted(elements)) {
            sb.append(sb.length() == 1 ? "" : ",").append(q);
        }
        sb.append('}');
        return s = sb.toString();
    }
}
