/*
 * @LICENSE@
 */

package org.refauto;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * DFA minimization by pairwise distinguishability (table filling).
 * <p>
 * Two states are distinguishable if exactly one of them is final, or if some
 * symbol takes them to a distinguishable pair. The table is refined with full
 * passes until a pass marks nothing new. The pairs left unmarked are merged;
 * each class of equivalent states is represented by its member which comes
 * first in breadth first order, so the start state represents its own class.
 */
final class Minimizer {

    private static final Logger logger = Logger.getLogger("org.refauto");
    private static final Level level = Level.FINER;

    static <Q> Dfa<Q> minimize(Dfa<Q> dfa) {

        final List<Q> order = new ArrayList<Q>(dfa.states().asSet());
        final Map<Q, Integer> index = new HashMap<Q, Integer>();
        for (Q q : order) index.put(q, index.size());
        final int n = order.size();

        /*
         * distinct[i][j] for i > j only
         */
        final boolean[][] distinct = new boolean[n][];
        for (int i = 0; i < n; ++i) {
            distinct[i] = new boolean[i];
            for (int j = 0; j < i; ++j) {
                distinct[i][j] = dfa.isFinal(order.get(i)) != dfa.isFinal(order.get(j));
            }
        }

        int passes = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            ++passes;
            for (int i = 0; i < n; ++i) {
                for (int j = 0; j < i; ++j) {
                    if (distinct[i][j]) continue;
                    for (char c : dfa.alphabet()) {
                        int p = index.get(dfa.step(order.get(i), c));
                        int q = index.get(dfa.step(order.get(j), c));
                        if (p != q && distinct[Math.max(p, q)][Math.min(p, q)]) {
                            distinct[i][j] = true;
                            changed = true;
                            break;
                        }
                    }
                }
            }
        }

        UnionFind classes = new UnionFind(n);
        for (int i = 0; i < n; ++i) {
            for (int j = 0; j < i; ++j) {
                if (!distinct[i][j]) classes.union(i, j);
            }
        }

        TransitionTable.Builder<Q, Q> table = TransitionTable.builder();
        Set<Q> states = new LinkedHashSet<Q>();
        Set<Q> finals = new LinkedHashSet<Q>();
        for (int i = 0; i < n; ++i) {
            if (classes.find(i) != i) continue;
            Q rep = order.get(i);
            states.add(rep);
            if (dfa.isFinal(rep)) finals.add(rep);
            for (char c : dfa.alphabet()) {
                int target = classes.find(index.get(dfa.step(rep, c)));
                table.put(rep, c, order.get(target));
            }
        }
        Q start = order.get(classes.find(index.get(dfa.start())));
        assert start.equals(dfa.start());

        Dfa<Q> ret = new Dfa<Q>(start, StateSet.of(states), dfa.alphabet(),
            table.build(), StateSet.of(finals));

        if (logger.isLoggable(level)) {
            logger.log(level, "dfa minimized: " + dfa.size() + " -> " + ret.size()
                + " states in " + passes + " passes");
        }
        return ret;
    }

    /*
     * Disjoint sets over 0..n-1 with path compression. The root of a set is
     * always its lowest member.
     */
    static final class UnionFind {

        private final int[] parent;

        UnionFind(int n) {
            parent = new int[n];
            for (int i = 0; i < n; ++i) parent[i] = i;
        }

        int find(int i) {
            int root = i;
            while (parent[root] != root) root = parent[root];
            while (parent[i] != root) {
                int next = parent[i];
                parent[i] = root;
                i = next;
            }
            return root;
        }

        void union(int i, int j) {
            int ri = find(i);
            int rj = find(j);
            if (ri < rj) {
                parent[rj] = ri;
            } else if (rj < ri) {
                parent[ri] = rj;
            }
        }
    }

    private Minimizer() {}    // uninstantiable
}
