/*
 * @LICENSE@
 */

package org.refauto;

import java.util.HashMap;
import java.util.LinkedList;
import java.util.Map;
import java.util.Queue;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.refauto.Product.Mode;

/**
 * Language equivalence of finite automata.
 * <p>
 * Two DFAs over the same alphabet accept the same language iff their
 * symmetric difference is empty, that is iff the minimized symmetric
 * difference product is the single non-final (reject everything) state.
 */
public final class EquivalenceChecker {

    private static final Logger logger = Logger.getLogger("org.refauto");
    private static final Level level = Level.FINER;

    /**
     * @return true iff <code>a</code> and <code>b</code> accept the same
     *         language; always false when their alphabets differ
     */
    public static <P, R> boolean equivalent(Dfa<P> a, Dfa<R> b) {
        if (!a.alphabet().equals(b.alphabet())) {
            if (logger.isLoggable(level)) {
                logger.log(level, "not equivalent: alphabets " + a.alphabet()
                    + " and " + b.alphabet() + " differ");
            }
            return false;
        }
        Dfa<StatePair<P, R>> diff =
            Product.of(a, b, Mode.SYMMETRIC_DIFFERENCE).minimize();
        boolean ret = diff.size() == 1 && diff.finals().isEmpty();
        if (logger.isLoggable(level)) {
            logger.log(level, (ret ? "equivalent: " : "not equivalent: ")
                + a.size() + " and " + b.size() + " states");
        }
        return ret;
    }

    /**
     * Determinizes both automata, then compares the DFAs.
     *
     * @throws ConstructionException
     *             if either subset construction exceeds the default limit
     */
    public static <P, R> boolean equivalent(Nfa<P> a, Nfa<R> b) {
        return equivalent(a.toDfa(), b.toDfa());
    }

    /**
     * @return the shortest string accepted by exactly one of <code>a</code>
     *         and <code>b</code>, the first in alphabet order among those of
     *         that length; <code>null</code> if they are equivalent
     * @throws IllegalArgumentException
     *             if the alphabets differ
     */
    public static <P, R> String counterexample(Dfa<P> a, Dfa<R> b) {

        Dfa<StatePair<P, R>> diff = Product.of(a, b, Mode.SYMMETRIC_DIFFERENCE);

        /*
         * breadth first from start, symbols in alphabet order: the first
         * final state found is reached by the wanted string.
         */
        final Map<StatePair<P, R>, StatePair<P, R>> parent =
            new HashMap<StatePair<P, R>, StatePair<P, R>>();
        final Map<StatePair<P, R>, Character> via = new HashMap<StatePair<P, R>, Character>();
        final Queue<StatePair<P, R>> queue = new LinkedList<StatePair<P, R>>();
        parent.put(diff.start(), null);
        queue.add(diff.start());

        while (!queue.isEmpty()) {
            StatePair<P, R> q = queue.remove();
            if (diff.isFinal(q)) {
                StringBuilder sb = new StringBuilder();
                for (StatePair<P, R> p = q; parent.get(p) != null; p = parent.get(p)) {
                    sb.append(via.get(p).charValue());
                }
                return sb.reverse().toString();
            }
            for (char c : diff.alphabet()) {
                StatePair<P, R> next = diff.step(q, c);
                if (parent.containsKey(next)) continue;
                parent.put(next, q);
                via.put(next, c);
                queue.add(next);
            }
        }
        return null;
    }

    private EquivalenceChecker() {}    // uninstantiable
}
