/*
 * @LICENSE@
 */

package org.refauto;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.refauto.Misc.BreadthFirstVisitor;

/**
 * Product construction: runs two DFAs over the same alphabet in lock step.
 * Only the pairs reachable from the pair of start states are built. Which
 * pairs are final is decided by the {@link Mode}.
 */
public final class Product {

    private static final Logger logger = Logger.getLogger("org.refauto");
    private static final Level level = Level.FINEST;

    /**
     * How acceptance of the two operands combines.
     */
    public enum Mode {

        INTERSECTION {
            @Override
            public boolean accept(boolean first, boolean second) {
                return first && second;
            }
        },

        UNION {
            @Override
            public boolean accept(boolean first, boolean second) {
                return first || second;
            }
        },

        /**
         * accepted by the first operand, rejected by the second.
         */
        DIFFERENCE {
            @Override
            public boolean accept(boolean first, boolean second) {
                return first && !second;
            }
        },

        /**
         * accepted by exactly one operand.
         */
        SYMMETRIC_DIFFERENCE {
            @Override
            public boolean accept(boolean first, boolean second) {
                return first != second;
            }
        };

        public abstract boolean accept(boolean first, boolean second);
    }

    /**
     * @throws IllegalArgumentException
     *             if the alphabets differ
     */
    public static <P, R> Dfa<StatePair<P, R>> of(final Dfa<P> a, final Dfa<R> b,
            final Mode mode) {

        if (!a.alphabet().equals(b.alphabet())) {
            throw new IllegalArgumentException("alphabet mismatch: "
                + a.alphabet() + " vs. " + b.alphabet());
        }
        if (mode == null) {
            throw new IllegalArgumentException("null product mode");
        }

        final TransitionTable.Builder<StatePair<P, R>, StatePair<P, R>> table =
            TransitionTable.builder();
        final Set<StatePair<P, R>> finals = new LinkedHashSet<StatePair<P, R>>();
        final StatePair<P, R> start = new StatePair<P, R>(a.start(), b.start());

        Set<StatePair<P, R>> states = new BreadthFirstVisitor<StatePair<P, R>>() {
            @Override
            protected Iterable<StatePair<P, R>> visit(StatePair<P, R> pair) {
                if (mode.accept(a.isFinal(pair.first), b.isFinal(pair.second))) {
                    finals.add(pair);
                }
                List<StatePair<P, R>> next = new ArrayList<StatePair<P, R>>();
                for (char c : a.alphabet()) {
                    StatePair<P, R> target = new StatePair<P, R>(
                        a.step(pair.first, c), b.step(pair.second, c));
                    table.put(pair, c, target);
                    next.add(target);
                }
                return next;
            }
        }.start(start).black;

        Dfa<StatePair<P, R>> ret = new Dfa<StatePair<P, R>>(start, StateSet.of(states),
            a.alphabet(), table.build(), StateSet.of(finals));

        if (logger.isLoggable(level)) {
            logger.log(level, mode + " product: " + a.size() + " x " + b.size()
                + " -> " + ret.size() + " states");
        }
        return ret;
    }

    private Product() {}    // uninstantiable
}
