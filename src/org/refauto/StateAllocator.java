/*
 * @LICENSE@
 */

package org.refauto;

/**
 * Source of fresh integer state identifiers for NFA construction. Identifiers
 * are issued in increasing order and never reused, which keeps the state
 * spaces of independently compiled fragments disjoint.
 * <p>
 * Not thread safe: give each concurrent compilation its own allocator.
 */
public final class StateAllocator {

    private int next;
    private final int first;

    /**
     * Starts at 1; 0 is never issued.
     */
    public StateAllocator() {
        this(1);
    }

    public StateAllocator(int first) {
        if (first < 0) {
            throw new IllegalArgumentException("negative first state: " + first);
        }
        this.first = first;
        this.next = first;
    }

    /**
     * @return a state identifier never issued before by this allocator
     * @throws IllegalStateException
     *             when the identifier space is used up
     */
    public int fresh() {
        if (next == Integer.MAX_VALUE) {
            throw new IllegalStateException("state identifiers exhausted");
        }
        return next++;
    }

    /**
     * @return how many identifiers have been issued
     */
    public int issued() {
        return next - first;
    }

    @Override
    public String toString() {
        return "StateAllocator{next:" + next + '}';
    }
}
