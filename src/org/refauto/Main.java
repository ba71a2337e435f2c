/*
 * @LICENSE@
 */

package org.refauto;

import java.io.PrintStream;
import java.util.regex.PatternSyntaxException;

import org.refauto.AST.Node;

/**
 * Command line driver: compiles a pattern and shows every stage of the
 * pipeline.
 *
 * <pre>
 * java -jar refauto.jar [regex [test-string]]
 * </pre>
 *
 * The automata are built over the base alphabet (system property
 * <code>org.refauto.alphabet</code>, default <code>ab0</code>) extended with
 * the symbols of the pattern. Exit status: 0 on success, 1 on a syntax
 * error, 2 if the DFA gets too big.
 */
public final class Main {

    static final String DEFAULT_REGEX = "(0|a)b(aba)*";
    static final String DEFAULT_TEST = "0baba";

    static final String BASE_ALPHABET = System.getProperty("org.refauto.alphabet", "ab0");

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {

        String regex = DEFAULT_REGEX;
        String test = DEFAULT_TEST;
        if (args.length > 0) {
            regex = args[0];
        } else {
            out.println("No regex given, defaulting to '" + regex + "'");
            out.println();
        }
        if (args.length > 1) {
            test = args[1];
        } else {
            out.println("No test string given, defaulting to '" + test + "'");
            out.println();
        }

        Node root;
        try {
            root = new RegexParser().parse(regex);
        } catch (PatternSyntaxException e) {
            err.println(e.getMessage());
            return 1;
        }
        Alphabet alphabet = Alphabet.of(BASE_ALPHABET).union(AST.alphabetOf(root));

        Nfa<Integer> nfa = new ThompsonCompiler(alphabet).compile(root);
        section(out, Alphabet.EPSILON_GLYPH + "-NFA", nfa.toString());
        verdict(out, nfa.accepts(test), "NFA");

        Dfa<Integer> dfa;
        try {
            dfa = nfa.toDfa().reindex();
        } catch (ConstructionException e) {
            err.println(e.getMessage());
            return 2;
        }
        section(out, "DFA", dfa.toString());
        verdict(out, dfa.accepts(test), "DFA");

        Dfa<Integer> min = dfa.minimize().reindex();
        section(out, "Minimal DFA", min.toString());
        verdict(out, min.accepts(test), "minimal DFA");
        return 0;
    }

    private static void section(PrintStream out, String title, String body) {
        out.println(title);
        for (int i = 0; i < title.length(); ++i) out.print('=');
        out.println();
        out.print(body);
        out.println();
    }

    private static void verdict(PrintStream out, boolean match, String what) {
        out.println(match
            ? "The test string matches (" + what + ")"
            : "The test string doesn't match (" + what + ")");
        out.println();
    }

    private Main() {}    // uninstantiable
}
