/*
 * @LICENSE@
 */

package org.refauto;

import java.util.Stack;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.refauto.AST.Alt;
import org.refauto.AST.Cat;
import org.refauto.AST.Node;
import org.refauto.AST.Star;
import org.refauto.AST.Terminal;
import org.refauto.AST.Visitor.TraversalOrder;

/**
 * Compiles a syntax tree into an epsilon-NFA by structural recursion
 * (Thompson's construction). Every subtree becomes a fragment with one entry
 * and one exit state:
 *
 * <pre>
 *  c      s0 -c-&gt; s1
 *  LR     start -&gt; L -&gt; R -&gt; end
 *  L|R    start -&gt; {L, R} -&gt; end
 *  L*     start -&gt; {L, end}, L.exit -&gt; {L, end}
 * </pre>
 *
 * (all arrows but <code>-c-&gt;</code> are epsilon transitions). The
 * resulting NFA has exactly one final state, the exit of the root fragment.
 * <p>
 * States are drawn from a {@link StateAllocator}, children before parents,
 * so fragments never share states.
 */
public final class ThompsonCompiler {

    private static final Logger logger = Logger.getLogger("org.refauto");
    private static final Level level = Level.FINER;

    /*
     * a compiled subtree: entry and exit state
     */
    private static final class Fragment {

        final int start, end;

        Fragment(int start, int end) {
            this.start = start;
            this.end = end;
        }
    }

    private final Alphabet alphabet;
    private final StateAllocator allocator;

    /**
     * Compiles over <code>alphabet</code>, with states from a fresh
     * allocator.
     */
    public ThompsonCompiler(Alphabet alphabet) {
        this(alphabet, new StateAllocator());
    }

    /**
     * Compiles over <code>alphabet</code>, with states from
     * <code>allocator</code>; successive compilations with the same
     * allocator yield NFAs with disjoint state spaces.
     */
    public ThompsonCompiler(Alphabet alphabet, StateAllocator allocator) {
        if (alphabet == null || allocator == null) {
            throw new IllegalArgumentException(
                "alphabet: " + alphabet + ", allocator: " + allocator);
        }
        this.alphabet = alphabet;
        this.allocator = allocator;
    }

    /**
     * Compiles <code>root</code> over the symbols of its own terminals.
     */
    public static Nfa<Integer> compileDerived(Node root) {
        return compile(root, AST.alphabetOf(root));
    }

    public static Nfa<Integer> compile(Node root, Alphabet alphabet) {
        return new ThompsonCompiler(alphabet).compile(root);
    }

    /**
     * @throws IllegalArgumentException
     *             if <code>root</code> is null or a terminal symbol is not
     *             in the alphabet
     */
    public Nfa<Integer> compile(Node root) {

        if (root == null) {
            throw new IllegalArgumentException("null syntax tree");
        }

        final Nfa.Builder<Integer> b = Nfa.builder(alphabet);
        final Stack<Fragment> frags = new Stack<Fragment>();

        new AST.Visitor(TraversalOrder.BOTTOM_UP) {

            @Override
            protected void visit(Terminal node) {
                if (!alphabet.contains(node.symbol)) {
                    throw new IllegalArgumentException("symbol '" + node.symbol
                        + "' is not in the alphabet " + alphabet);
                }
                int s0 = allocator.fresh();
                int s1 = allocator.fresh();
                b.states(s0, s1).transition(s0, node.symbol, s1);
                frags.push(new Fragment(s0, s1));
            }

            @Override
            protected void visit(Cat node) {
                Fragment r = frags.pop();
                Fragment l = frags.pop();
                Fragment f = fresh();
                b.epsilon(f.start, l.start);
                b.epsilon(l.end, r.start);
                b.epsilon(r.end, f.end);
                frags.push(f);
            }

            @Override
            protected void visit(Alt node) {
                Fragment r = frags.pop();
                Fragment l = frags.pop();
                Fragment f = fresh();
                b.epsilon(f.start, l.start, r.start);
                b.epsilon(l.end, f.end);
                b.epsilon(r.end, f.end);
                frags.push(f);
            }

            @Override
            protected void visit(Star node) {
                Fragment inner = frags.pop();
                Fragment f = fresh();
                b.epsilon(f.start, inner.start, f.end);
                b.epsilon(inner.end, inner.start, f.end);
                frags.push(f);
            }

            private Fragment fresh() {
                Fragment f = new Fragment(allocator.fresh(), allocator.fresh());
                b.states(f.start, f.end);
                return f;
            }
        }.visit(root);

        assert frags.size() == 1 : frags.size();
        Fragment top = frags.pop();
        Nfa<Integer> nfa = b.start(top.start).finals(top.end).build();

        if (logger.isLoggable(level)) {
            logger.log(level, "compiled " + root + ": " + nfa.size() + " nfa states"
                + Misc.LS + nfa);
        }
        return nfa;
    }
}
