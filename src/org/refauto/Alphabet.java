/*
 * @LICENSE@
 */

package org.refauto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A finite, ordered set of single character input symbols. Order is the
 * order of first appearance and only matters for rendering and for the
 * breadth first orderings the automata use; equality ignores it.
 * <p>
 * Symbols are carried around as <code>int</code>s so that the empty
 * (epsilon) symbol can be represented by {@link #EPSILON}, which is never a
 * member.
 */
public final class Alphabet implements Iterable<Character> {

    /**
     * The epsilon (empty) symbol used as a transition label.
     */
    public static final int EPSILON = -1;

    /**
     * The printable form of {@link #EPSILON}; also accepted in place of it
     * by every symbol lookup.
     */
    public static final char EPSILON_GLYPH = '\u03b5';

    private final Set<Character> symbols;
    private final String s;

    private Alphabet(Set<Character> symbols) {
        this.symbols = Collections.unmodifiableSet(symbols);
        StringBuilder sb = new StringBuilder();
        for (char c : symbols) sb.append(c);
        this.s = sb.toString();
    }

    /**
     * @param symbols
     *            one symbol per char; duplicates are ignored
     * @throws IllegalArgumentException
     *             if <code>symbols</code> contains the epsilon glyph
     */
    public static Alphabet of(CharSequence symbols) {
        Set<Character> set = new LinkedHashSet<Character>();
        for (int i = 0; i < symbols.length(); ++i) {
            char c = symbols.charAt(i);
            if (c == EPSILON_GLYPH) {
                throw new IllegalArgumentException(
                    "the epsilon glyph is reserved: " + symbols);
            }
            set.add(c);
        }
        return new Alphabet(set);
    }

    /**
     * Maps the epsilon glyph to {@link #EPSILON}; every other symbol is
     * returned unchanged.
     */
    public static int normalize(int symbol) {
        return symbol == EPSILON_GLYPH ? EPSILON : symbol;
    }

    static String glyph(int symbol) {
        return normalize(symbol) == EPSILON
                ? String.valueOf(EPSILON_GLYPH)
                : String.valueOf((char) symbol);
    }

    public boolean contains(int symbol) {
        return symbol >= 0 && symbol <= Character.MAX_VALUE
                && symbols.contains((char) symbol);
    }

    public int size() {
        return symbols.size();
    }

    /**
     * @return the symbols, in order
     */
    public List<Character> symbols() {
        return Collections.unmodifiableList(new ArrayList<Character>(symbols));
    }

    /**
     * @return this alphabet followed by the symbols of <code>other</code>
     *         which are not already members
     */
    public Alphabet union(Alphabet other) {
        Set<Character> set = new LinkedHashSet<Character>(symbols);
        set.addAll(other.symbols);
        return set.size() == symbols.size() ? this : new Alphabet(set);
    }

    public Iterator<Character> iterator() {
        return symbols.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Alphabet)) return false;
        return symbols.equals(((Alphabet) o).symbols);
    }

    @Override
    public int hashCode() {
        return symbols.hashCode();
    }

    @Override
    public String toString() {
        return s;
    }
}
