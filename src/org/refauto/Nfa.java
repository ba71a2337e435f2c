/*
 * @LICENSE@
 */

package org.refauto;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * NFA: Nondeterministic Finite Automaton with epsilon transitions.
 * <p>
 * A transition maps <code>(state, symbol)</code> or <code>(state,
 * epsilon)</code> to a {@link StateSet} of successors. A missing transition
 * is the empty set - not an error, and never a placeholder state - so a run
 * that falls off the table simply ends up with no live states.
 * <p>
 * Construction validates (the start and final states must be states, every
 * symbol but epsilon must be in the alphabet) and completes: a state that
 * only appears in the transition table is added to the states.
 *
 * @param <Q>
 *            state identifier type
 */
public final class Nfa<Q> extends Automaton<Q, StateSet<Q>> {

    private static final Logger logger = Logger.getLogger("org.refauto");
    private static final Level level = Level.FINER;

    /**
     * @throws IllegalArgumentException
     *             if <code>start</code> or some final state is not a state,
     *             or a transition uses a symbol outside the alphabet
     */
    public Nfa(Q start, StateSet<Q> states, Alphabet alphabet,
            TransitionTable<Q, StateSet<Q>> transitions, StateSet<Q> finals) {
        super(complete(new Parts<Q, StateSet<Q>>(
                start, states, alphabet, withoutEmptyImages(transitions), finals)),
            Automaton.<Q>setImage());
    }

    private static <Q> TransitionTable<Q, StateSet<Q>> withoutEmptyImages(
            TransitionTable<Q, StateSet<Q>> table) {
        if (table == null) return null;
        TransitionTable.Builder<Q, StateSet<Q>> b = TransitionTable.builder();
        for (Q q : table.sources()) {
            for (Map.Entry<Integer, StateSet<Q>> e : table.row(q).entrySet()) {
                if (!e.getValue().isEmpty()) b.put(q, e.getKey(), e.getValue());
            }
        }
        return b.build();
    }

    private static <Q> Parts<Q, StateSet<Q>> complete(Parts<Q, StateSet<Q>> parts) {
        parts.checkStates(true);
        StateSet<Q> implicit =
            parts.mentioned(Automaton.<Q>setImage()).difference(parts.states);
        if (implicit.isEmpty()) {
            return parts;
        }
        if (logger.isLoggable(level)) {
            logger.log(level, "nfa: implicit states added: " + implicit);
        }
        return new Parts<Q, StateSet<Q>>(parts.start,
            parts.states.union(implicit), parts.alphabet, parts.table, parts.finals);
    }

    /**
     * @return the smallest superset of <code>seed</code> closed under
     *         epsilon transitions. States of <code>seed</code> which are not
     *         states of this automaton are left out.
     */
    public StateSet<Q> epsilonClosure(StateSet<Q> seed) {
        final Set<Q> visited = new LinkedHashSet<Q>();
        final LinkedList<Q> stack = new LinkedList<Q>();
        for (Q q : seed) stack.addFirst(q);
        while (!stack.isEmpty()) {
            Q q = stack.removeFirst();
            if (!states.contains(q) || !visited.add(q)) continue;
            for (Q next : transitions(q, Alphabet.EPSILON)) {
                if (!visited.contains(next)) stack.addFirst(next);
            }
        }
        return StateSet.of(visited);
    }

    /**
     * @return the raw image of <code>(state, symbol)</code>, without any
     *         epsilon closure; the empty set when there is no such transition
     */
    public StateSet<Q> transitions(Q state, int symbol) {
        StateSet<Q> ret = table.get(state, Alphabet.normalize(symbol));
        return ret == null ? StateSet.<Q>empty() : ret;
    }

    /**
     * @return the epsilon closure of the states reached on
     *         <code>symbol</code> from the epsilon closure of
     *         <code>state</code>. The epsilon glyph is read as
     *         {@link Alphabet#EPSILON}.
     */
    public StateSet<Q> delta(Q state, int symbol) {
        final int c = Alphabet.normalize(symbol);
        Set<Q> next = new LinkedHashSet<Q>();
        for (Q q : epsilonClosure(StateSet.of(state))) {
            next.addAll(transitions(q, c).asSet());
        }
        return epsilonClosure(StateSet.of(next));
    }

    /**
     * {@link #delta(Object, int)} applied to every member of
     * <code>current</code>, unioned and closed.
     */
    public StateSet<Q> deltaSets(StateSet<Q> current, int symbol) {
        Collection<StateSet<Q>> images = new LinkedList<StateSet<Q>>();
        for (Q q : current) {
            images.add(delta(q, symbol));
        }
        return epsilonClosure(StateSet.unionAll(images));
    }

    /**
     * @return the live states after reading all of <code>input</code>; the
     *         empty set as soon as a symbol outside the alphabet is read
     */
    public StateSet<Q> deltaStar(CharSequence input) {
        StateSet<Q> current = epsilonClosure(StateSet.of(start));
        for (int i = 0; i < input.length() && !current.isEmpty(); ++i) {
            char c = input.charAt(i);
            if (!alphabet.contains(c)) {
                return StateSet.empty();
            }
            current = deltaSets(current, c);
        }
        return epsilonClosure(current);
    }

    @Override
    public boolean accepts(CharSequence input) {
        return deltaStar(input).intersects(finals);
    }

    /**
     * Subset construction, bounded by the configured default state limit.
     *
     * @throws ConstructionException
     *             if the limit is exceeded
     * @see SubsetConstruction#MAX_STATE_COUNT
     */
    public Dfa<StateSet<Q>> toDfa() {
        return SubsetConstruction.determinize(this, SubsetConstruction.MAX_STATE_COUNT);
    }

    /**
     * Subset construction producing at most <code>maxStates</code> DFA states.
     *
     * @throws ConstructionException
     *             if more states would be needed
     */
    public Dfa<StateSet<Q>> toDfa(int maxStates) {
        return SubsetConstruction.determinize(this, maxStates);
    }

    @Override
    int[] columns() {
        int[] ret = new int[alphabet.size() + 1];
        ret[0] = Alphabet.EPSILON;
        int i = 1;
        for (char c : alphabet) ret[i++] = c;
        return ret;
    }

    @Override
    String cell(Q state, int symbol) {
        return transitions(state, symbol).toString();
    }

    public static <Q> Builder<Q> builder(Alphabet alphabet) {
        return new Builder<Q>(alphabet);
    }

    /**
     * Accumulates states and transitions for an {@link Nfa}. Transitions on
     * the same <code>(state, symbol)</code> add up.
     */
    public static final class Builder<Q> {

        private final Alphabet alphabet;
        private final TransitionTable.Builder<Q, StateSet<Q>> table =
            TransitionTable.builder();
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
        public final Builder<Q> states(Q... qs) {
            for (Q q : qs) states.add(q);
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

        @SafeVarargs
        public final Builder<Q> transition(Q from, int symbol, Q... to) {
            StateSet<Q> image = table.get(from, symbol);
            StateSet<Q> more = StateSet.of(to);
            table.put(from, symbol, image == null ? more : image.union(more));
            states.add(from);
            return this;
        }

        @SafeVarargs
        public final Builder<Q> epsilon(Q from, Q... to) {
            return transition(from, Alphabet.EPSILON, to);
        }

        public Nfa<Q> build() {
            return new Nfa<Q>(start, StateSet.of(states), alphabet, table.build(),
                StateSet.of(finals));
        }
    }
}
