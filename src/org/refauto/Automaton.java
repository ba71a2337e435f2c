/*
 * @LICENSE@
 */

package org.refauto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * State, alphabet and transition bookkeeping common to {@link Nfa} and
 * {@link Dfa}: the 5-tuple <code>(start, states, alphabet, transitions,
 * finals)</code>. The two kinds differ only in what a transition leads to
 * (the image type <code>T</code>) and in how they run input.
 * <p>
 * Automata are immutable values; every transformation returns a new
 * instance. {@link #equals(Object)} is structural: two automata are equal
 * when their tuples are equal, which is much stronger than accepting the same
 * language (see {@link EquivalenceChecker}).
 *
 * @param <Q>
 *            state identifier type
 * @param <T>
 *            transition image type
 */
public abstract class Automaton<Q, T> {

    /*
     * the tuple in transit between validation, completion or pruning and the
     * constructor.
     */
    static final class Parts<Q, T> {

        final Q start;
        final StateSet<Q> states;
        final Alphabet alphabet;
        final TransitionTable<Q, T> table;
        final StateSet<Q> finals;

        Parts(Q start, StateSet<Q> states, Alphabet alphabet,
                TransitionTable<Q, T> table, StateSet<Q> finals) {
            if (start == null || states == null || alphabet == null
                    || table == null || finals == null) {
                throw new IllegalArgumentException(
                    "incomplete automaton: start=" + start + ", states=" + states
                    + ", alphabet=" + alphabet + ", finals=" + finals);
            }
            this.start = start;
            this.states = states;
            this.alphabet = alphabet;
            this.table = table;
            this.finals = finals;
        }

        /*
         * checks shared by both kinds: start and finals are states, every
         * transition symbol belongs to the alphabet.
         */
        Parts<Q, T> checkStates(boolean epsilonAllowed) {
            if (!states.contains(start)) {
                throw new IllegalArgumentException(
                    "start state " + start + " is not in states " + states);
            }
            if (!states.containsAll(finals)) {
                throw new IllegalArgumentException(
                    "final states " + finals.difference(states)
                    + " are not in states " + states);
            }
            for (Q q : table.sources()) {
                for (int c : table.row(q).keySet()) {
                    if (c == Alphabet.EPSILON ? !epsilonAllowed : !alphabet.contains(c)) {
                        throw new IllegalArgumentException(
                            "transition (" + q + ',' + Alphabet.glyph(c)
                            + ") uses a symbol outside the alphabet " + alphabet);
                    }
                }
            }
            return this;
        }

        /*
         * the states appearing anywhere in the table, as sources or targets.
         */
        StateSet<Q> mentioned(Image<Q, T> image) {
            Set<Q> ret = new LinkedHashSet<Q>(table.sources());
            for (Q q : table.sources()) {
                for (T t : table.row(q).values()) {
                    for (Q target : image.targets(t)) ret.add(target);
                }
            }
            return StateSet.of(ret);
        }

        /*
         * the states reachable from start, breadth first, symbols in
         * alphabet order (epsilon first).
         */
        StateSet<Q> reachable(final Image<Q, T> image) {
            return StateSet.of(new Misc.BreadthFirstVisitor<Q>() {
                @Override
                protected Iterable<Q> visit(Q q) {
                    List<Q> ret = new ArrayList<Q>();
                    T eps = table.get(q, Alphabet.EPSILON);
                    if (eps != null) {
                        for (Q target : image.targets(eps)) ret.add(target);
                    }
                    for (char c : alphabet) {
                        T t = table.get(q, c);
                        if (t == null) continue;
                        for (Q target : image.targets(t)) ret.add(target);
                    }
                    return ret;
                }
            }.start(start).black);
        }

        /*
         * drops every state outside keep, with its table row; finals shrink
         * accordingly. keep is expected to contain start.
         */
        Parts<Q, T> restrictedTo(StateSet<Q> keep) {
            assert keep.contains(start);
            TransitionTable.Builder<Q, T> b = TransitionTable.builder();
            for (Q q : keep) {
                for (Map.Entry<Integer, T> e : table.row(q).entrySet()) {
                    b.put(q, e.getKey(), e.getValue());
                }
            }
            return new Parts<Q, T>(start, keep, alphabet, b.build(),
                finals.intersection(keep));
        }
    }

    /**
     * What a transition leads to: the successor set of an NFA transition, or
     * the one successor of a DFA transition.
     */
    interface Image<Q, T> {
        Iterable<Q> targets(T image);
    }

    private static final Image<?, ?> SET_IMAGE = new Image<Object, StateSet<Object>>() {
        public Iterable<Object> targets(StateSet<Object> image) {
            return image;
        }
    };

    private static final Image<?, ?> SINGLE_IMAGE = new Image<Object, Object>() {
        public Iterable<Object> targets(Object image) {
            return Collections.singletonList(image);
        }
    };

    @SuppressWarnings("unchecked")
    static <Q> Image<Q, StateSet<Q>> setImage() {
        return (Image<Q, StateSet<Q>>) SET_IMAGE;
    }

    @SuppressWarnings("unchecked")
    static <Q> Image<Q, Q> singleImage() {
        return (Image<Q, Q>) SINGLE_IMAGE;
    }

    final Q start;
    final StateSet<Q> states;
    final Alphabet alphabet;
    final TransitionTable<Q, T> table;
    final StateSet<Q> finals;
    final Image<Q, T> image;

    Automaton(Parts<Q, T> parts, Image<Q, T> image) {
        this.image = image;
        this.start = parts.start;
        this.states = parts.states;
        this.alphabet = parts.alphabet;
        this.table = parts.table;
        this.finals = parts.finals;
    }

    public final Q start() {
        return start;
    }

    public final StateSet<Q> states() {
        return states;
    }

    public final Alphabet alphabet() {
        return alphabet;
    }

    public final StateSet<Q> finals() {
        return finals;
    }

    public final TransitionTable<Q, T> transitions() {
        return table;
    }

    public final boolean isFinal(Q state) {
        return finals.contains(state);
    }

    /**
     * @return the number of states
     */
    public final int size() {
        return states.size();
    }

    /**
     * Runs the automaton over <code>input</code>, one symbol per char.
     * Symbols outside the alphabet never match.
     *
     * @return true iff the automaton ends in a final state
     */
    public abstract boolean accepts(CharSequence input);

    /**
     * @return the symbols rendered as table columns, in order
     */
    abstract int[] columns();

    /**
     * @return the rendering of the transition for one table cell
     */
    String cell(Q state, int symbol) {
        T t = table.get(state, symbol);
        return t == null ? "" : t.toString();
    }

    /**
     * @return the states reachable from the start state, breadth first
     */
    public StateSet<Q> reachable() {
        return new Parts<Q, T>(start, states, alphabet, table, finals)
            .reachable(image);
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        final Automaton<?, ?> a = (Automaton<?, ?>) o;
        return start.equals(a.start)
            && states.equals(a.states)
            && alphabet.equals(a.alphabet)
            && finals.equals(a.finals)
            && table.equals(a.table);
    }

    @Override
    public final int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + start.hashCode();
        result = prime * result + states.hashCode();
        result = prime * result + alphabet.hashCode();
        result = prime * result + finals.hashCode();
        result = prime * result + table.hashCode();
        return result;
    }

    /**
     * @return the transition table, one row per state; the start row is
     *         marked <code>-&gt;</code>, final rows <code>*</code>
     */
    @Override
    public String toString() {
        return new TablePrinter<Q>(this).print();
    }
}
