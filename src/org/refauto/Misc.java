/*
 * @LICENSE@
 */

package org.refauto;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Queue;
import java.util.Set;


/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects, interfaces, classes, and methods.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    /*
     * idiom suppression for clearing StringBuilders
     */
    public static void clear(StringBuilder sb) {
        sb.delete(0, sb.length());
    }

    /**
     * Total order over opaque state identifiers: natural order when both
     * sides are mutually comparable, otherwise the string forms, then the
     * class names.
     */
    static final Comparator<Object> ORDER = new Comparator<Object>() {
        @SuppressWarnings("unchecked")
        public int compare(Object lhs, Object rhs) {
            if (lhs == rhs) return 0;
            if (lhs instanceof Comparable<?> && rhs != null
                    && lhs.getClass() == rhs.getClass()) {
                return ((Comparable<Object>) lhs).compareTo(rhs);
            }
            int ret = String.valueOf(lhs).compareTo(String.valueOf(rhs));
            if (ret != 0) return ret;
            return className(lhs).compareTo(className(rhs));
        }
        private String className(Object o) {
            return o == null ? "" : o.getClass().getName();
        }
    };

    static <T> List<T> sorted(Collection<T> c) {
        List<T> ret = new ArrayList<T>(c);
        Collections.sort(ret, ORDER);
        return ret;
    }

    /*
     * Breadth first search over a digraph given implicitly by its successor
     * function. Vertices are values: discovered vertices are tracked with
     * equals(), in discovery order.
     */
    static abstract class BreadthFirstVisitor<V> {

        final Set<V> black = new LinkedHashSet<V>();
        private final Queue<V> gray = new LinkedList<V>();
        private final Set<V> grayed = new HashSet<V>();

        final BreadthFirstVisitor<V> start(Iterable<? extends V> inits) {
            black.clear(); gray.clear(); grayed.clear();
            for (V init : inits) offer(init);
            drain();
            return this;
        }

        final BreadthFirstVisitor<V> start(V init) {
            black.clear(); gray.clear(); grayed.clear();
            offer(init);
            drain();
            return this;
        }

        private boolean offer(V v) {
            assert v != null;
            if (black.contains(v) || !grayed.add(v)) return false;
            return gray.offer(v);
        }

        private void drain() {
            while (!gray.isEmpty()) {
                V vertex = gray.remove();
                grayed.remove(vertex);
                black.add(vertex);
                for (V next : visit(vertex)) {
                    offer(next);
                }
            }
        }

        /**
         * Called once per discovered vertex, in breadth first order.
         *
         * @return the successors of <code>vertex</code>
         */
        protected abstract Iterable<? extends V> visit(V vertex);
    }
}
