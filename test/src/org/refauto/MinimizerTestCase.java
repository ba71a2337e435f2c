/*
 * @LICENSE@
 */

package org.refauto;

import static org.refauto.AutomataAssert.*;

public class MinimizerTestCase extends AbstractAutomataTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(MinimizerTestCase.class);
    }

    public MinimizerTestCase(String name) {
        super(name);
    }

    /*
     * s -a-> p, s -b-> q; p, q and r are final and only lead to r.
     */
    private static Dfa<String> threeEquivalent() {
        return Dfa.<String>builder(AB)
            .start("s")
            .transition("s", 'a', "p")
            .transition("s", 'b', "q")
            .otherwise("p", "r")
            .otherwise("q", "r")
            .otherwise("r", "r")
            .finals("p", "q", "r")
            .build();
    }

    public void testThreeEquivalentStates() {
        Dfa<String> d = threeEquivalent();
        Dfa<String> min = d.minimize();
        log(min);
        assertEquals(2, min.size());
        // first in breadth first order represents the class
        assertEquals(StateSet.of("s", "p"), min.states());
        assertEquals("s", min.start());
        assertEquals("p", min.step("s", 'a'));
        assertEquals("p", min.step("s", 'b'));
        assertEquals("p", min.step("p", 'a'));
        assertEquals(StateSet.of("p"), min.finals());
        assertSameLanguage(d, min, 5);
    }

    public void testChainOfEquivalentStates() {
        // 0 -> 1 -> 2 -> 3 -> 3, all final except 0: 1, 2 and 3 collapse
        Dfa<Integer> d = Dfa.<Integer>builder(AB)
            .start(0)
            .otherwise(0, 1)
            .otherwise(1, 2)
            .otherwise(2, 3)
            .otherwise(3, 3)
            .finals(1, 2, 3)
            .build();
        Dfa<Integer> min = d.minimize();
        assertEquals(StateSet.of(0, 1), min.states());
        assertEquals(Integer.valueOf(1), min.step(1, 'b'));
    }

    public void testAlreadyMinimal() {
        Dfa<String> d = Dfa.<String>builder(AB)
            .start("even")
            .transition("even", 'a', "odd")
            .transition("odd", 'a', "even")
            .otherwise("even", "even")
            .otherwise("odd", "odd")
            .finals("even")
            .build();
        assertEquals(d, d.minimize());
    }

    public void testIdempotent() {
        String[] regexes = { "(0|a)b(aba)*", "a|a", "(a|b)*abb", "a*a*", "(0|a|b)*" };
        for (String regex : regexes) {
            Dfa<StateSet<Integer>> min = dfa(regex).minimize();
            assertEquals(regex, min, min.minimize());
        }
    }

    public void testSizes() {
        assertEquals(6, dfa("(0|a)b(aba)*").minimize().size());
        assertEquals(3, dfa("a|a").minimize().size());
        assertEquals(dfa("a").minimize().size(), dfa("a|a").minimize().size());
        assertEquals(1, dfa("(0|a|b)*").minimize().size());
        assertEquals(2, dfa("a*a*").minimize().size());
    }

    public void testSameLanguageNoBigger() {
        String[] regexes = {
            "ab", "a|b", "a*", "(0|a)b(aba)*", "(a|b)*abb", "((a|0)*b)*", "a(b|0)*a|b*"
        };
        for (String regex : regexes) {
            Dfa<StateSet<Integer>> d = dfa(regex);
            Dfa<StateSet<Integer>> min = d.minimize();
            assertTrue(regex, min.size() <= d.size());
            assertEquals(d.start(), min.start());
            assertTotalAndReachable(min);
            assertSameLanguage(d, min, 5);
        }
    }

    public void testUnionFind() {
        Minimizer.UnionFind uf = new Minimizer.UnionFind(6);
        uf.union(5, 3);
        uf.union(3, 4);
        uf.union(4, 1);
        assertEquals(1, uf.find(5));
        assertEquals(1, uf.find(3));
        assertEquals(0, uf.find(0));
        assertEquals(2, uf.find(2));
        uf.union(2, 5);
        assertEquals(1, uf.find(2));
    }
}
