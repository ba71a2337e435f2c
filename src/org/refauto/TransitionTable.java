/*
 * @LICENSE@
 */

package org.refauto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable transition table: <code>(state, symbol) -&gt; image</code>. The
 * image is whatever the owning automaton makes of a transition - a
 * {@link StateSet} of successors for an {@link Nfa}, a single successor for a
 * {@link Dfa}. A missing entry is reported as <code>null</code>; the
 * automata decide what that means.
 *
 * @param <Q>
 *            state identifier type
 * @param <T>
 *            transition image type
 */
public final class TransitionTable<Q, T> {

    private final Map<Q, Map<Integer, T>> rows;
    private final int size;

    private TransitionTable(Map<Q, Map<Integer, T>> rows) {
        int n = 0;
        Map<Q, Map<Integer, T>> copy = new LinkedHashMap<Q, Map<Integer, T>>();
        for (Map.Entry<Q, Map<Integer, T>> e : rows.entrySet()) {
            if (e.getValue().isEmpty()) continue;
            copy.put(e.getKey(), Collections.unmodifiableMap(
                new LinkedHashMap<Integer, T>(e.getValue())));
            n += e.getValue().size();
        }
        this.rows = Collections.unmodifiableMap(copy);
        this.size = n;
    }

    /**
     * @return the image of <code>(state, symbol)</code>, <code>null</code> if
     *         there is no entry
     */
    public T get(Q state, int symbol) {
        Map<Integer, T> row = rows.get(state);
        return row == null ? null : row.get(symbol);
    }

    /**
     * @return the entries leaving <code>state</code>, keyed by symbol
     */
    public Map<Integer, T> row(Q state) {
        Map<Integer, T> row = rows.get(state);
        return row == null ? Collections.<Integer, T>emptyMap() : row;
    }

    /**
     * @return the states with at least one entry
     */
    public Set<Q> sources() {
        return rows.keySet();
    }

    /**
     * @return the number of entries
     */
    public int size() {
        return size;
    }

    public static <Q, T> Builder<Q, T> builder() {
        return new Builder<Q, T>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransitionTable)) return false;
        return rows.equals(((TransitionTable<?, ?>) o).rows);
    }

    @Override
    public int hashCode() {
        return rows.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('{');
        for (Map.Entry<Q, Map<Integer, T>> row : rows.entrySet()) {
            for (Map.Entry<Integer, T> e : row.getValue().entrySet()) {
                sb.append(sb.length() == 1 ? "" : ", ")
                    .append('(').append(row.getKey()).append(',')
                    .append(Alphabet.glyph(e.getKey())).append(")->")
                    .append(e.getValue());
            }
        }
        sb.append('}');
        return sb.toString();
    }

    /**
     * Mutable accumulator for a {@link TransitionTable}. The epsilon glyph
     * is normalized to {@link Alphabet#EPSILON} on the way in.
     */
    public static final class Builder<Q, T> {

        private final Map<Q, Map<Integer, T>> rows =
            new LinkedHashMap<Q, Map<Integer, T>>();

        public Builder() {
        }

        public Builder<Q, T> put(Q state, int symbol, T image) {
            if (state == null || image == null) {
                throw new IllegalArgumentException(
                    "null transition: (" + state + ',' + Alphabet.glyph(symbol)
                    + ")->" + image);
            }
            Map<Integer, T> row = rows.get(state);
            if (row == null) {
                row = new LinkedHashMap<Integer, T>();
                rows.put(state, row);
            }
            row.put(Alphabet.normalize(symbol), image);
            return this;
        }

        public T get(Q state, int symbol) {
            Map<Integer, T> row = rows.get(state);
            return row == null ? null : row.get(Alphabet.normalize(symbol));
        }

        public TransitionTable<Q, T> build() {
            return new TransitionTable<Q, T>(rows);
        }
    }
}
