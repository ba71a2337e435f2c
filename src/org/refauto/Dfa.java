/*
 * @LICENSE@
 */

package org.refauto;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.refauto.Product.Mode;

/**
 * DFA: Deterministic Finite Automaton with a total transition function.
 * <p>
 * Construction checks that every <code>(state, symbol)</code> of
 * <code>states &times; alphabet</code> has exactly one successor, and that
 * successors are states. It then prunes: states unreachable from the start
 * state are dropped together with their transitions and final status. Every
 * state of a <code>Dfa</code> is therefore reachable, which minimization and
 * equivalence rely on. After pruning, states are in breadth first order from
 * the start state.
 *
 * @param <Q>
 *            state identifier type
 */
public final class Dfa<Q> extends Automaton<Q, Q> {

    private static final Logger logger = Logger.getLogger("org.refauto");
    private static final Level level = Level.FINEST;

    /**
     * @throws IllegalArgumentException
     *             if <code>start</code> or some final state is not a state, a
     *             transition uses a symbol outside the alphabet or leaves or
     *             enters an unknown state, or some <code>(state,
     *             symbol)</code> has no transition
     */
    public Dfa(Q start, StateSet<Q> states, Alphabet alphabet,
            TransitionTable<Q, Q> transitions, StateSet<Q> finals) {
        super(prune(checkTotal(new Parts<Q, Q>(
                start, states, alphabet, transitions, finals).checkStates(false))),
            Automaton.<Q>singleImage());
    }

    private static <Q> Parts<Q, Q> checkTotal(Parts<Q, Q> parts) {
        for (Q q : parts.table.sources()) {
            if (!parts.states.contains(q)) {
                throw new IllegalArgumentException(
                    "transition from unknown state " + q);
            }
            for (Map.Entry<Integer, Q> e : parts.table.row(q).entrySet()) {
                if (!parts.states.contains(e.getValue())) {
                    throw new IllegalArgumentException("transition ("
                        + q + ',' + Alphabet.glyph(e.getKey())
                        + ") to unknown state " + e.getValue());
                }
            }
        }
        for (Q q : parts.states) {
            for (char c : parts.alphabet) {
                if (parts.table.get(q, c) == null) {
                    throw new IllegalArgumentException(
                        "transition function is not total: no transition for ("
                        + q + ',' + c + ')');
                }
            }
        }
        return parts;
    }

    private static <Q> Parts<Q, Q> prune(Parts<Q, Q> parts) {
        StateSet<Q> reachable = parts.reachable(Automaton.<Q>singleImage());
        if (logger.isLoggable(level) && reachable.size() < parts.states.size()) {
            logger.log(level, "dfa: pruned unreachable states: "
                + parts.states.difference(reachable));
        }
        return parts.restrictedTo(reachable);
    }

    /**
     * @return the successor of <code>state</code> on <code>symbol</code>,
     *         <code>null</code> if the symbol is not in the alphabet or the
     *         state is unknown
     */
    public Q step(Q state, int symbol) {
        return table.get(state, symbol);
    }

    @Override
    public boolean accepts(CharSequence input) {
        Q q = start;
        for (int i = 0; i < input.length(); ++i) {
            char c = input.charAt(i);
            if (!alphabet.contains(c)) return false;
            q = table.get(q, c);
            assert q != null : "not total at " + c;
        }
        return finals.contains(q);
    }

    /**
     * @return the minimal DFA for the same language
     * @see Minimizer
     */
    public Dfa<Q> minimize() {
        return Minimizer.minimize(this);
    }

    /**
     * @return the DFA for the complement language (over the same alphabet)
     */
    public Dfa<Q> negate() {
        return new Dfa<Q>(start, states, alphabet, table, states.difference(finals));
    }

    /**
     * Renames the states <code>0..n-1</code> in breadth first order from the
     * start state (symbols in alphabet order). Cosmetic only: the language
     * and the shape are unchanged, only the labels are stable and small.
     */
    public Dfa<Integer> reindex() {
        final Map<Q, Integer> index = new LinkedHashMap<Q, Integer>();
        for (Q q : states) {
            index.put(q, index.size());     // states are already breadth first
        }
        TransitionTable.Builder<Integer, Integer> b = TransitionTable.builder();
        for (Q q : states) {
            for (char c : alphabet) {
                b.put(index.get(q), c, index.get(table.get(q, c)));
            }
        }
        Set<Integer> f = new LinkedHashSet<Integer>();
        for (Q q : finals) f.add(index.get(q));
        List<Integer> all = new ArrayList<Integer>(index.values());
        return new Dfa<Integer>(index.get(start), StateSet.of(all), alphabet,
            b.build(), StateSet.of(f));
    }

    /**
     * @return true iff this DFA accepts no string at all
     */
    public boolean isEmpty() {
        return finals.isEmpty();    // every state is reachable
    }

    /**
     * @return true iff both DFAs accept the same language
     * @see EquivalenceChecker#equivalent(Dfa, Dfa)
     */
    public <R> boolean isEquivalentTo(Dfa<R> other) {
        return EquivalenceChecker.equivalent(this, other);
    }

    public <R> Dfa<StatePair<Q, R>> intersection(Dfa<R> other) {
        return Product.of(this, other, Mode.INTERSECTION);
    }

    public <R> Dfa<StatePair<Q, R>> union(Dfa<R> other) {
        return Product.of(this, other, Mode.UNION);
    }

    /**
     * @return the DFA accepting the strings this DFA accepts and
     *         <code>other</code> rejects
     */
    public <R> Dfa<StatePair<Q, R>> difference(Dfa<R> other) {
        return Product.of(this, other, Mode.DIFFERENCE);
    }

    @Override
    int[] columns() {
        int[] ret = new int[alphabet.size()];
        int i = 0;
        for (char c : alphabet) ret[i++] = c;
        return ret;
    }

    public static <Q> Builder<Q> builder(Alphabet alphabet) {
        return new Builder<Q>(alphabet);
    }

    /**
     * Accumulates states and transitions for a {@link Dfa}. The first state
     * mentioned becomes the start state unless {@link #start(Object)} says
     * otherwise.
     */
    public static final class Builder<Q> {

        private final Alphabet alphabet;
        private final TransitionTable.Builder<Q, Q> table = TransitionTable.builder();
        private final Set<Q> states = new LinkedHashSet<Q>();
        private final Set<Q> finals = new LinkedHashSet<Q>();
        private Q start;

        public Builder(Alphabet alphabet) {
            this.alphabet = alphabet;
        }

        public Builder<Q> start(Q q) {
            start = q;
            states.add(q);
            return this;
        }

        @SafeVarargs
        public final Builder<Q> finals(Q... qs) {
            for (Q q : qs) {
                states.add(q);
                finals.add(q);
            }
            return this;
        }

        public Builder<Q> transition(Q from, int symbol, Q to) {
            if (start == null) start = from;
            table.put(from, symbol, to);
            states.add(from);
            states.add(to);
            return this;
        }

        /**
         * Every symbol of the alphabet leads from <code>from</code> to
         * <code>to</code>.
         */
        public Builder<Q> otherwise(Q from, Q to) {
            for (char c : alphabet) {
                if (table.get(from, c) == null) transition(from, c, to);
            }
            return this;
        }

        public Dfa<Q> build() {
            return new Dfa<Q>(start, StateSet.of(states), alphabet, table.build(),
                StateSet.of(finals));
        }
    }
}
