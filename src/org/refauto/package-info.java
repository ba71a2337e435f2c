/*
 * @LICENSE@
 */

/**
 * <h3><b>refauto</b> - A reference finite automata engine.</h3>
 * <p>
 * <h4>Motivation.</h4>
 * <p>
 * <b>refauto</b> turns a regular expression syntax tree into an executable
 * recognizer, and implements the classical operations on finite automata on
 * top of it. It is meant to be obviously correct rather than fast: every
 * automaton is an immutable value, every construction is spelled out, and
 * every intermediate stage can be printed as a transition table. Use it for
 * teaching, as an oracle when testing a faster matcher, or as a component
 * where the language of a pattern has to be reasoned about (is it empty? do
 * two patterns match the same strings? which string tells them apart?).
 * <p>
 * <h4>The pipeline.</h4>
 * <p>
 * <pre>
 *   text --RegexParser--&gt; AST --ThompsonCompiler--&gt; Nfa
 *        --SubsetConstruction--&gt; Dfa --Minimizer--&gt; minimal Dfa
 * </pre>
 * <ul>
 * <li>{@link org.refauto.AST}: four node shapes, literal, concatenation,
 * alternation and Kleene star, built with static factories or by the
 * {@link org.refauto.RegexParser}.</li>
 * <li>{@link org.refauto.ThompsonCompiler}: structural, bottom up
 * compilation into an epsilon-NFA with exactly one final state. States are
 * integers from a {@link org.refauto.StateAllocator}.</li>
 * <li>{@link org.refauto.Nfa}: epsilon closure and simulation. A missing
 * transition is the empty set of states.</li>
 * <li>{@link org.refauto.Nfa#toDfa()}: subset construction; DFA states are
 * {@link org.refauto.StateSet}s of NFA states. The empty set is the reject
 * ("sink") state, so the DFA is always total. The number of states is bounded
 * (system property <code>org.refauto.maxDfaStates</code>); exceeding the
 * bound throws {@link org.refauto.ConstructionException}.</li>
 * <li>{@link org.refauto.Dfa}: total, deterministic, and always pruned of
 * unreachable states. {@link org.refauto.Dfa#minimize()} merges
 * indistinguishable states, {@link org.refauto.Dfa#reindex()} relabels the
 * states <code>0..n-1</code>.</li>
 * </ul>
 * <p>
 * <h4>Language operations.</h4>
 * <p>
 * Since a DFA is total, its complement is just a matter of swapping final and
 * non final states ({@link org.refauto.Dfa#negate()}). Intersection, union,
 * difference and symmetric difference are {@linkplain org.refauto.Product
 * product constructions}. Two DFAs accept the same language iff their
 * minimized symmetric difference is the one state automaton which rejects
 * everything ({@link org.refauto.EquivalenceChecker}).
 * <p>
 * <h4>State identifiers.</h4>
 * <p>
 * All automata are generic in the state type. Compiled NFAs use
 * <code>Integer</code>s, determinized automata use <code>StateSet</code>s,
 * products use {@link org.refauto.StatePair}s. Any type with value
 * semantics (<code>equals</code> and <code>hashCode</code>) will do;
 * comparable types print in their natural order.
 * <p>
 * <h4>Logging.</h4>
 * <p>
 * The package logs to the <code>java.util.logging</code> logger
 * <code>"org.refauto"</code>, at <code>FINER</code> (compilation, minimization,
 * equivalence) and <code>FINEST</code> (complete transition tables). Nothing
 * is logged at the default levels.
 */
package org.refauto;
