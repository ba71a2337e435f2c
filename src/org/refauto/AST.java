/*
 * @LICENSE@
 */

package org.refauto;

import static org.refauto.Misc.LS;
import static org.refauto.Misc.clear;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

import org.refauto.AST.Visitor.TraversalOrder;

/**
 * Uninstantiable class which serves as a source container for the static
 * classes and static methods used in the construction of Abstract Syntax
 * Trees.
 * <p>
 * There are four node shapes: {@link Terminal} (a single symbol),
 * {@link Cat} (juxtaposition), {@link Alt} (alternation) and {@link Star}
 * (Kleene closure). Grouping has no node of its own; parentheses only shape
 * the tree.
 * <p>
 * Compilation and {@link #alphabetOf(Node)} handle trees of any height.
 * {@link Node#toString()} and {@link Node#toTreeString()} recurse once per
 * level, so very tall trees (tens of thousands of levels) need a bigger
 * thread stack to be printed.
 */
public final class AST {

    public static abstract class Node {

        private Node() {}

        /**
         * @return an indented, one node per line rendering of the tree
         */
        public final String toTreeString() {
            final StringBuilder sb = new StringBuilder();
            new Visitor(TraversalOrder.SUBCLASS_DEFINED) {
                private int nspace = 0;
                private void indent() {
                    for (int i = 0; i < nspace; ++i) {
                        sb.append(' ');
                    }
                }
                @Override
                protected void visit(NonTerminal node) {
                    indent();
                    sb.append(node instanceof Cat ? '&' : node instanceof Alt ? '|' : '*');
                    sb.append(LS);
                    nspace += 4;
                    for (Node n : node.children()) {
                        visit(n);
                    }
                    nspace -= 4;
                }
                @Override
                protected void visit(Terminal node) {
                    indent();
                    sb.append(node.symbol).append(LS);
                }
            }.visit(Node.this);
            return sb.toString();
        }

        /**
         * The equals relation is always the identity relation for all Node
         * subclasses.
         */
        @Override
        public final boolean equals(Object o) {
            return super.equals(o);
        }
        @Override
        public final int hashCode() {
            return super.hashCode();
        }

        /**
         * @return the pattern, in the syntax {@link RegexParser} reads, with
         *         as few parentheses as the tree allows
         */
        @Override
        public final String toString() {

            return new Visitor(TraversalOrder.SUBCLASS_DEFINED) {

                private final StringBuilder sb = new StringBuilder();

                @Override
                public String toString() {
                    clear(sb);
                    visit(Node.this);
                    return sb.toString();
                }

                @Override
                protected void visit(Cat node) {
                    visitChild(node.first, node.first instanceof Alt);
                    visitChild(node.second, node.second instanceof Alt);
                }

                @Override
                protected void visit(Alt node) {
                    visit(node.first);
                    sb.append('|');
                    visit(node.second);
                }

                @Override
                protected void visit(Star node) {
                    visitChild(node.child, !(node.child instanceof Terminal));
                    sb.append('*');
                }

                @Override
                protected void visit(Terminal node) {
                    sb.append(node.symbol);
                }

                private void visitChild(Node child, boolean paren) {
                    if (paren) {
                        sb.append('(');
                    }
                    visit(child);
                    if (paren) {
                        sb.append(')');
                    }
                }
            }.toString();
        }
    }

    public static final class Terminal extends Node {

        final char symbol;

        private Terminal(char symbol) {
            this.symbol = symbol;
        }

        public char symbol() {
            return symbol;
        }
    }

    static abstract class NonTerminal extends Node {

        abstract Node[] children();
    }

    static abstract class Unary extends NonTerminal {

        final Node child;
        private Unary(Node child) {
            this.child = child;
        }

        public final Node child() {
            return child;
        }

        @Override
        final Node[] children() {
            return new Node[] {child};
        }
    }

    public static final class Star extends Unary {

        private Star(Node child) {
            super(child);
        }
    }

    static abstract class Binary extends NonTerminal {

        final Node first, second;

        private Binary(Node first, Node second) {
            this.first = first;
            this.second = second;
        }

        public final Node first() {
            return first;
        }

        public final Node second() {
            return second;
        }

        @Override
        final Node[] children() {
            return new Node[] {first, second};
        }
    }

    public static final class Cat extends Binary {

        private Cat(Node first, Node second) {
            super(first, second);
        }
    }

    public static final class Alt extends Binary {

        private Alt(Node first, Node second) {
            super(first, second);
        }
    }

    static abstract class Visitor {

        enum TraversalOrder {
            TOP_DOWN,
            BOTTOM_UP,
            SUBCLASS_DEFINED;
        }

        private final TraversalOrder order;

        protected Visitor(TraversalOrder order) {
            this.order = order;
        }

        /*
         * multi-dispatch:
         * - allows Visitor subclasses to deal with the exact granularity they want.
         * - "instanceof" dispatch is ugly but it's only in one place - here.
         *
         * TOP_DOWN and BOTTOM_UP walk the tree with an explicit stack, so
         * tree height is not bounded by the thread's stack. SUBCLASS_DEFINED
         * visitors recurse through visit(Node) themselves.
         */

        protected void visit(Node node) {
            switch (order) {
            case TOP_DOWN:
                Deque<Node> todo = new ArrayDeque<Node>();
                todo.push(node);
                while (!todo.isEmpty()) {
                    Node n = todo.pop();
                    dispatch(n);
                    if (n instanceof NonTerminal) {
                        Node[] children = ((NonTerminal) n).children();
                        for (int i = children.length - 1; i >= 0; --i) {
                            todo.push(children[i]);
                        }
                    }
                }
                break;
            case BOTTOM_UP:
                Deque<Node> pending = new ArrayDeque<Node>();
                Deque<Node> post = new ArrayDeque<Node>();
                pending.push(node);
                while (!pending.isEmpty()) {
                    Node n = pending.pop();
                    post.push(n);
                    if (n instanceof NonTerminal) {
                        for (Node child : ((NonTerminal) n).children()) {
                            pending.push(child);
                        }
                    }
                }
                while (!post.isEmpty()) {
                    dispatch(post.pop());
                }
                break;
            default:
                dispatch(node);
            }
        }

        private void dispatch(Node node) {
            if (node instanceof NonTerminal) {
                visit((NonTerminal) node);
            } else if (node instanceof Terminal) {
                visit((Terminal) node);
            } else {
                error(node);
            }
        }

        protected void visit(NonTerminal node) {
            if (node instanceof Binary) {
                visit((Binary) node);
            } else if (node instanceof Star) {
                visit((Star) node);
            } else {
                error(node);
            }
        }

        protected void visit(Binary node) {
            if (node instanceof Cat) {
                visit((Cat) node);
            } else if (node instanceof Alt) {
                visit((Alt) node);
            } else {
                error(node);
            }
        }

        protected void visit(Cat node) {}
        protected void visit(Alt node) {}
        protected void visit(Star node) {}

        protected void visit(Terminal node) {}

        private static void error(Node node) {
            assert false : "unknown node type " + node.getClass();
        }
    }

    /**
     * @return the symbols of the tree's terminals, in order of first
     *         appearance (left to right)
     */
    public static Alphabet alphabetOf(Node root) {
        final Set<Character> symbols = new LinkedHashSet<Character>();
        new Visitor(TraversalOrder.TOP_DOWN) {
            @Override
            protected void visit(Terminal node) {
                symbols.add(node.symbol);
            }
        }.visit(nonNull(root));
        StringBuilder sb = new StringBuilder();
        for (char c : symbols) sb.append(c);
        return Alphabet.of(sb);
    }

    /*
     * static factories of convenience for parser and testing. Malformed
     * trees are rejected here, so that the compiler never sees one.
     */

    /**
     * @throws IllegalArgumentException
     *             if <code>c</code> is the epsilon glyph
     */
    public static Terminal literal(char c) {
        if (c == Alphabet.EPSILON_GLYPH) {
            throw new IllegalArgumentException(
                "the epsilon glyph is not a literal symbol");
        }
        return new Terminal(c);
    }

    /**
     * @return the concatenation of the characters of <code>s</code>
     * @throws IllegalArgumentException
     *             if <code>s</code> is empty
     */
    public static Node literal(String s) {
        if (s == null || s.length() == 0) {
            throw new IllegalArgumentException("empty literal");
        }
        Node root = null;
        for (char c : s.toCharArray()) {
            Node lc = literal(c);
            if (root == null) {
                root = lc;
            } else {
                root = new Cat(root, lc);
            }
        }
        return root;
    }

    /**
     * @throws IllegalArgumentException
     *             if there are no operands or an operand is null
     */
    public static Node cat(Node... nodes) {
        Node root = null;
        for (Node node : operands("cat", nodes)) {
            if (root == null) {
                root = node;
            } else {
                root = new Cat(root, node);
            }
        }
        return root;
    }

    /**
     * @throws IllegalArgumentException
     *             if there are no operands or an operand is null
     */
    public static Node alt(Node... nodes) {
        Node root = null;
        for (Node node : operands("alt", nodes)) {
            if (root == null) {
                root = node;
            } else {
                root = new Alt(root, node);
            }
        }
        return root;
    }

    public static Star star(Node child) {
        return new Star(nonNull(child));
    }

    /*
     * package private: right associative trees for the parser
     */
    static Cat cat(Node first, Node second) {
        return new Cat(nonNull(first), nonNull(second));
    }

    static Alt alt(Node first, Node second) {
        return new Alt(nonNull(first), nonNull(second));
    }

    private static Node[] operands(String op, Node[] nodes) {
        if (nodes == null || nodes.length == 0) {
            throw new IllegalArgumentException(op + "() needs at least one operand");
        }
        for (Node node : nodes) nonNull(node);
        return nodes;
    }

    private static Node nonNull(Node node) {
        if (node == null) {
            throw new IllegalArgumentException("null syntax tree node");
        }
        return node;
    }

    private AST() {}    // uninstantiable
}
