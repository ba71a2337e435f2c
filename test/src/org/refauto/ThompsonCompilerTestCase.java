/*
 * @LICENSE@
 */

package org.refauto;

import static org.refauto.AST.*;
import static org.refauto.AutomataAssert.*;

import org.refauto.AST.Node;

public class ThompsonCompilerTestCase extends AbstractAutomataTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(ThompsonCompilerTestCase.class);
    }

    public ThompsonCompilerTestCase(String name) {
        super(name);
    }

    public void testLiteral() {
        Nfa<Integer> nfa = ThompsonCompiler.compile(literal('a'), AB);
        assertEquals(Nfa.<Integer>builder(AB)
            .start(1)
            .transition(1, 'a', 2)
            .finals(2)
            .build(), nfa);
        assertAccepts(nfa, "a");
        assertRejects(nfa, "", "b", "aa");
    }

    public void testCat() {
        Nfa<Integer> nfa = ThompsonCompiler.compile(cat(literal('a'), literal('b')), AB);
        assertEquals(Nfa.<Integer>builder(AB)
            .start(5)
            .transition(1, 'a', 2)
            .transition(3, 'b', 4)
            .epsilon(5, 1)
            .epsilon(2, 3)
            .epsilon(4, 6)
            .finals(6)
            .build(), nfa);
    }

    public void testAlt() {
        Nfa<Integer> nfa = ThompsonCompiler.compile(alt(literal('a'), literal('b')), AB);
        assertEquals(Nfa.<Integer>builder(AB)
            .start(5)
            .transition(1, 'a', 2)
            .transition(3, 'b', 4)
            .epsilon(5, 1, 3)
            .epsilon(2, 6)
            .epsilon(4, 6)
            .finals(6)
            .build(), nfa);
    }

    public void testStar() {
        Nfa<Integer> nfa = ThompsonCompiler.compile(star(literal('a')), AB);
        assertEquals(Nfa.<Integer>builder(AB)
            .start(3)
            .transition(1, 'a', 2)
            .epsilon(3, 1, 4)
            .epsilon(2, 1, 4)
            .finals(4)
            .build(), nfa);
        assertAccepts(nfa, "", "a", "aaa");
        assertRejects(nfa, "b", "ab");
    }

    public void testShape() {
        Node root = new RegexParser().parse("(0|a)b(aba)*");
        Nfa<Integer> nfa = ThompsonCompiler.compile(root, AB0);
        // two states per node: 6 terminals, 4 cats, 1 alt, 1 star
        assertEquals(24, nfa.size());
        assertEquals(1, nfa.finals().size());
        assertEquals(nfa.states(), nfa.reachable());
    }

    public void testDerivedAlphabet() {
        Nfa<Integer> nfa = ThompsonCompiler.compileDerived(alt(literal("ba"), literal('0')));
        assertEquals(Alphabet.of("ba0"), nfa.alphabet());
    }

    public void testTallTree() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 20000; ++i) sb.append(i % 2 == 0 ? 'a' : 'b');
        String s = sb.toString();
        Nfa<Integer> nfa = ThompsonCompiler.compileDerived(literal(s));
        // two states per node: 20000 terminals, 19999 cats
        assertEquals(2 * (20000 + 19999), nfa.size());
        assertEquals(1, nfa.finals().size());
        assertEquals(Alphabet.of("ab"), nfa.alphabet());
    }

    public void testSymbolOutsideAlphabet() {
        try {
            ThompsonCompiler.compile(literal("abc"), AB);
            fail("should throw");
        } catch (IllegalArgumentException e) {}
    }

    public void testMalformedTrees() {
        try {
            new ThompsonCompiler(AB).compile(null);
            fail("null root");
        } catch (IllegalArgumentException e) {}
        try {
            cat();
            fail("no operands");
        } catch (IllegalArgumentException e) {}
        try {
            alt(literal('a'), null);
            fail("null operand");
        } catch (IllegalArgumentException e) {}
        try {
            star(null);
            fail("null child");
        } catch (IllegalArgumentException e) {}
        try {
            literal("");
            fail("empty literal");
        } catch (IllegalArgumentException e) {}
        try {
            literal(Alphabet.EPSILON_GLYPH);
            fail("epsilon literal");
        } catch (IllegalArgumentException e) {}
    }

    public void testLanguages() {
        assertJavaLanguage("ab", AB0, 4);
        assertJavaLanguage("a|b", AB0, 4);
        assertJavaLanguage("a*", AB0, 4);
        assertJavaLanguage("(0|a)b(aba)*", AB0, 7);
        assertJavaLanguage("(a|b)*abb", AB0, 6);
        assertJavaLanguage("((a*)*|b)*", AB, 6);
        assertJavaLanguage("a(b|0)*a|b*", AB0, 5);
    }
}
