/*
 * @LICENSE@
 */

package org.refauto;

import static org.refauto.AutomataAssert.*;

public class DfaTestCase extends AbstractAutomataTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(DfaTestCase.class);
    }

    public DfaTestCase(String name) {
        super(name);
    }

    /*
     * even number of a's, over {a,b}
     */
    private static Dfa<String> evenA() {
        return Dfa.<String>builder(AB)
            .start("even")
            .transition("even", 'a', "odd")
            .transition("odd", 'a', "even")
            .transition("even", 'b', "even")
            .transition("odd", 'b', "odd")
            .finals("even")
            .build();
    }

    public void testAccepts() {
        Dfa<String> d = evenA();
        assertAccepts(d, "", "b", "aa", "abab", "babab", "bbaabb");
        assertRejects(d, "a", "ab", "aaa", "bab");
        assertRejects(d, "c", "aac", "ε");
        assertEquals("odd", d.step("even", 'a'));
        assertNull(d.step("even", 'c'));
    }

    public void testPruning() {
        Dfa<String> d = Dfa.<String>builder(AB)
            .start("p")
            .otherwise("p", "p")
            .otherwise("lost", "p")
            .finals("p", "lost")
            .build();
        assertEquals(StateSet.of("p"), d.states());
        assertEquals(StateSet.of("p"), d.finals());
        assertEquals(2, d.transitions().size());
        assertTotalAndReachable(d);
    }

    public void testNotTotal() {
        try {
            Dfa.<String>builder(AB)
                .start("p")
                .transition("p", 'a', "p")
                .finals("p")
                .build();
            fail("should throw");
        } catch (IllegalArgumentException e) {}
    }

    public void testValidation() {
        TransitionTable<Integer, Integer> t = TransitionTable.<Integer, Integer>builder()
            .put(0, 'a', 0).put(0, 'b', 1)
            .build();
        try {
            new Dfa<Integer>(0, StateSet.of(0), AB, t, StateSet.<Integer>empty());
            fail("unknown target");
        } catch (IllegalArgumentException e) {}
        try {
            new Dfa<Integer>(5, StateSet.of(0, 1), AB, t, StateSet.<Integer>empty());
            fail("start not a state");
        } catch (IllegalArgumentException e) {}

        TransitionTable<Integer, Integer> eps = TransitionTable.<Integer, Integer>builder()
            .put(0, 'a', 0).put(0, 'b', 0).put(0, Alphabet.EPSILON, 0)
            .build();
        try {
            new Dfa<Integer>(0, StateSet.of(0), AB, eps, StateSet.<Integer>empty());
            fail("epsilon transition");
        } catch (IllegalArgumentException e) {}

        TransitionTable<Integer, Integer> foreign = TransitionTable.<Integer, Integer>builder()
            .put(0, 'a', 0).put(0, 'b', 0).put(7, 'a', 0)
            .build();
        try {
            new Dfa<Integer>(0, StateSet.of(0), AB, foreign, StateSet.<Integer>empty());
            fail("unknown source");
        } catch (IllegalArgumentException e) {}
    }

    public void testNegate() {
        Dfa<String> d = evenA();
        Dfa<String> n = d.negate();
        assertEquals(StateSet.of("odd"), n.finals());
        for (String w : strings(AB, 5)) {
            assertTrue(w, d.accepts(w) != n.accepts(w));
        }
        assertEquals(d, n.negate());
        assertEquivalent(d, n.negate());
    }

    public void testNegateOutsideAlphabet() {
        // a foreign symbol is rejected both ways: the complement is over the alphabet
        Dfa<String> d = evenA();
        assertRejects(d, "c");
        assertRejects(d.negate(), "c");
    }

    public void testReindex() {
        Dfa<StateSet<Integer>> d = nfa("(0|a)b(aba)*").toDfa();
        Dfa<Integer> r = d.reindex();
        log(r);
        assertEquals(d.size(), r.size());
        assertEquals(Integer.valueOf(0), r.start());
        int i = 0;
        for (Integer q : r.states()) {
            assertEquals(i++, q.intValue());
        }
        assertEquals(d.finals().size(), r.finals().size());
        assertSameLanguage(d, r, 6);
        assertEquals(r, r.reindex());
    }

    public void testReindexBreadthFirst() {
        Dfa<String> d = Dfa.<String>builder(AB)
            .start("z")
            .transition("z", 'a', "y")
            .transition("z", 'b', "x")
            .transition("y", 'a', "w")
            .otherwise("y", "z")
            .otherwise("x", "x")
            .otherwise("w", "w")
            .finals("w")
            .build();
        Dfa<Integer> r = d.reindex();
        assertEquals(Integer.valueOf(1), r.step(0, 'a'));
        assertEquals(Integer.valueOf(2), r.step(0, 'b'));
        assertEquals(Integer.valueOf(3), r.step(1, 'a'));
        assertEquals(StateSet.of(3), r.finals());
    }

    public void testIsEmpty() {
        assertTrue(nfa("a", AB).toDfa().intersection(nfa("b", AB).toDfa()).isEmpty());
        assertFalse(evenA().isEmpty());
        Dfa<String> unreachableFinal = Dfa.<String>builder(AB)
            .start("p")
            .otherwise("p", "p")
            .otherwise("q", "q")
            .finals("q")
            .build();
        assertTrue(unreachableFinal.isEmpty());
    }

    public void testStructuralEquality() {
        assertEquals(evenA(), evenA());
        assertEquals(evenA().hashCode(), evenA().hashCode());
        assertFalse(evenA().equals(evenA().negate()));
        assertFalse(evenA().equals(nfa("a", AB)));
    }

    public void testTable() {
        String table = evenA().toString();
        log(table);
        String[] lines = table.split(Misc.LS);
        assertEquals(4, lines.length);
        assertTrue(lines[0], lines[0].matches(" *\\| +a \\| +b"));
        assertTrue(lines[2], lines[2].matches("->\\*even \\|  odd \\| even"));
        assertTrue(lines[3], lines[3].matches(" *odd \\| even \\|  odd"));
    }
}
