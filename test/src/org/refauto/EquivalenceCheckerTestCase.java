/*
 * @LICENSE@
 */

package org.refauto;

import static org.refauto.AutomataAssert.*;

public class EquivalenceCheckerTestCase extends AbstractAutomataTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(EquivalenceCheckerTestCase.class);
    }

    public EquivalenceCheckerTestCase(String name) {
        super(name);
    }

    public void testEquivalent() {
        assertEquivalent(dfa("a|a"), dfa("a"));
        assertEquivalent(dfa("a*a*"), dfa("a*"));
        assertEquivalent(dfa("(a|b)*"), dfa("(a*b*)*"));
        assertEquivalent(dfa("a(ba)*"), dfa("(ab)*a"));
        assertEquivalent(dfa("(0|a)b(aba)*"), dfa("(0|a)b(aba)*").minimize());
        assertEquivalent(dfa("ab"), dfa("ab").reindex());
    }

    public void testNotEquivalent() {
        assertNotEquivalent(dfa("a"), dfa("b"));
        assertNotEquivalent(dfa("a*"), dfa("aa*"));
        assertNotEquivalent(dfa("(a|b)*"), dfa("(ab)*"));
    }

    public void testReflexiveAndSymmetric() {
        String[] regexes = { "ab", "a|b", "a*", "(0|a)b(aba)*", "(a|b)*abb" };
        for (String r1 : regexes) {
            assertTrue(r1, dfa(r1).isEquivalentTo(dfa(r1)));
            for (String r2 : regexes) {
                assertEquals(r1 + " vs " + r2,
                    dfa(r1).isEquivalentTo(dfa(r2)), dfa(r2).isEquivalentTo(dfa(r1)));
            }
        }
    }

    public void testConsistentWithAcceptance() {
        Dfa<StateSet<Integer>> a = dfa("(a|b)*abb");
        Dfa<StateSet<Integer>> b = dfa("(a|b)*bb");
        assertFalse(EquivalenceChecker.equivalent(a, b));
        String w = EquivalenceChecker.counterexample(a, b);
        assertNotNull(w);
        assertTrue(a.accepts(w) != b.accepts(w));
    }

    public void testCounterexample() {
        assertNull(EquivalenceChecker.counterexample(dfa("a|a"), dfa("a")));
        assertEquals("", EquivalenceChecker.counterexample(dfa("a*"), dfa("aa*")));
        assertEquals("a", EquivalenceChecker.counterexample(dfa("a"), dfa("b")));
        assertEquals("bb", EquivalenceChecker.counterexample(dfa("(a|b)*abb"), dfa("(a|b)*bb")));
        // "aa" and "ab" both tell them apart; 'a' comes first in ab0
        assertEquals("aa", EquivalenceChecker.counterexample(dfa("a(0|b)"), dfa("a(0|a)")));
    }

    public void testAlphabetMismatch() {
        assertFalse(EquivalenceChecker.equivalent(nfa("a", AB).toDfa(), nfa("a", AB0).toDfa()));
    }

    public void testNfas() {
        assertTrue(EquivalenceChecker.equivalent(nfa("a|a"), nfa("a")));
        assertFalse(EquivalenceChecker.equivalent(nfa("a|b"), nfa("a")));
    }

    public void testNegation() {
        Dfa<StateSet<Integer>> d = dfa("(0|a)b(aba)*");
        assertEquivalent(d, d.negate().negate());
        assertNotEquivalent(d, d.negate());
    }
}
