/*
 * @LICENSE@
 */

package org.refauto;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.refauto.Misc.BreadthFirstVisitor;

/**
 * Determinization of an {@link Nfa} by the subset construction. Each DFA
 * state is the set of NFA states live after some input; the empty set is the
 * sink. Exploration is seeded with both the start closure and the sink, so
 * the result is total whatever transitions the NFA leaves out.
 * <p>
 * The number of DFA states is exponential in the number of NFA states in the
 * worst case, hence the state limit. The limit bounds the states of the
 * resulting DFA: the seeded sink counts only when some other state leads to
 * it.
 */
final class SubsetConstruction {

    private static final Logger logger = Logger.getLogger("org.refauto");
    private static final Level level = Level.FINEST;

    /**
     * Default DFA state limit, from the <code>org.refauto.maxDfaStates</code>
     * system property.
     */
    static final int MAX_STATE_COUNT =
        Integer.getInteger("org.refauto.maxDfaStates", 10 * 1000);

    static <Q> Dfa<StateSet<Q>> determinize(final Nfa<Q> nfa, final int maxStates) {

        if (maxStates < 1) {
            throw new IllegalArgumentException("bad DFA state limit: " + maxStates);
        }

        final TransitionTable.Builder<StateSet<Q>, StateSet<Q>> table =
            TransitionTable.builder();
        final Set<StateSet<Q>> finals = new LinkedHashSet<StateSet<Q>>();

        final StateSet<Q> init = nfa.epsilonClosure(StateSet.of(nfa.start()));
        final StateSet<Q> sink = StateSet.empty();

        /*
         * Subset construction as breadth first search
         */
        Set<StateSet<Q>> states = new BreadthFirstVisitor<StateSet<Q>>() {

            int watchdog = 0;
            boolean sinkReached = false;

            private void count() {
                if (++watchdog > maxStates) {
                    throw new ConstructionException(
                        "DFA state count exceeded: " + maxStates, maxStates);
                }
            }

            @Override
            protected Iterable<StateSet<Q>> visit(StateSet<Q> dstate) {

                boolean isSink = dstate.equals(sink);
                if (!isSink) {
                    count();
                }
                if (dstate.intersects(nfa.finals())) {
                    finals.add(dstate);
                }
                List<StateSet<Q>> next = new ArrayList<StateSet<Q>>();
                for (char c : nfa.alphabet()) {
                    StateSet<Q> ns = nfa.deltaSets(dstate, c);
                    table.put(dstate, c, ns);
                    next.add(ns);
                    if (!isSink && !sinkReached && ns.equals(sink)) {
                        sinkReached = true;
                        count();
                    }
                }
                return next;
            }
        }.start(Arrays.asList(init, sink)).black;

        Dfa<StateSet<Q>> dfa = new Dfa<StateSet<Q>>(init, StateSet.of(states),
            nfa.alphabet(), table.build(), StateSet.of(finals));

        if (logger.isLoggable(level)) {
            logger.log(level, "dfa unminimized: " + nfa.size() + " nfa states -> "
                + dfa.size() + " dfa states" + Misc.LS + dfa);
        }
        return dfa;
    }

    private SubsetConstruction() {}    // uninstantiable
}
