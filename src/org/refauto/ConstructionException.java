/*
 * @LICENSE@
 */

package org.refauto;

/**
 * A runtime exception thrown when an automaton cannot be constructed within
 * its resource limit, e.g. when subset construction discovers more DFA
 * states than allowed. Distinct from a contract violation: the input was
 * legal, just too expensive. Callers can recover, typically by rejecting the
 * pattern.
 */
public final class ConstructionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int limit;

    public ConstructionException(String msg, int limit) {
        super(msg);
        this.limit = limit;
    }

    /**
     * @return the limit which was exceeded
     */
    public int limit() {
        return limit;
    }
}
