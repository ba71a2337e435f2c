/*
 * @LICENSE@
 */

package org.refauto;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import junit.framework.TestCase;

public abstract class AbstractAutomataTestCase extends TestCase {

    protected static final Logger logger = Logger.getLogger("org.refauto.test");
    protected static final Level level = Level.FINEST;

    static {
        boolean assertsEnabled = false;
        assert assertsEnabled = true; // Intentional side effect!!!
        if (!assertsEnabled){
            throw new RuntimeException("Asserts must be enabled!!!");
        }
    }

    protected static final Alphabet AB0 = Alphabet.of("ab0");
    protected static final Alphabet AB = Alphabet.of("ab");

    public AbstractAutomataTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
        logger.entering(this.getClass().getSimpleName(), this.getName());
    }

    protected void tearDown() throws Exception {
        logger.exiting(this.getClass().getSimpleName(), this.getName());
        super.tearDown();
    }

    /**
     * @return every string over <code>alphabet</code> of length at most
     *         <code>maxLength</code>, shortest first, then in alphabet order
     */
    public static List<String> strings(Alphabet alphabet, int maxLength) {
        List<String> ret = new ArrayList<String>();
        ret.add("");
        int from = 0;
        for (int len = 1; len <= maxLength; ++len) {
            int to = ret.size();
            for (int i = from; i < to; ++i) {
                for (char c : alphabet) {
                    ret.add(ret.get(i) + c);
                }
            }
            from = to;
        }
        return ret;
    }

    /*
     * wrappers of convenience for subclasses outside the package
     */
    protected static Nfa<Integer> nfa(String regex, Alphabet alphabet) {
        return ThompsonCompiler.compile(new RegexParser().parse(regex), alphabet);
    }

    protected static Nfa<Integer> nfa(String regex) {
        return nfa(regex, AB0);
    }

    protected static Dfa<StateSet<Integer>> dfa(String regex) {
        return nfa(regex).toDfa();
    }

    protected static void log(Object o) {
        if (logger.isLoggable(level)) {
            logger.log(level, String.valueOf(o));
        }
    }
}
