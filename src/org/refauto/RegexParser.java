/*
 * @LICENSE@
 */

package org.refauto;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;

import org.refauto.AST.Node;

/**
 * Recursive descent parser for the pattern syntax:
 *
 * <pre>
 * exp    := term ('|' exp)?
 * term   := factor term?
 * factor := (letter-or-digit | '(' exp ')') '*'*
 * </pre>
 *
 * Whitespace between tokens is ignored. Alternation and concatenation
 * associate to the right. Any other character is a syntax error. Only
 * parenthesis nesting recurses; long sequences and alternations do not.
 * <p>
 * Not thread safe; a parser is cheap, make one per thread.
 */
public final class RegexParser {

    private static final int EOX = -1;  // end of expression

    private String regex;
    private int iNext;      // index of the next char to scan
    private int iToken;     // index of the current token
    private int token;

    /**
     * @throws PatternSyntaxException
     *             on an empty pattern, a missing operand, unbalanced
     *             parentheses or an unsupported symbol
     */
    public Node parse(String regex) {
        if (regex == null) {
            throw new IllegalArgumentException("null pattern");
        }
        this.regex = regex;
        iNext = 0;
        nextToken();
        Node ret = exp();
        if (token != EOX) {
            assert token == ')';
            throw error("unbalanced ')'");
        }
        return ret;
    }

    private Node exp() {
        List<Node> operands = new ArrayList<Node>();
        operands.add(term());
        while (token == '|') {
            nextToken();
            operands.add(term());
        }
        Node ret = operands.get(operands.size() - 1);
        for (int i = operands.size() - 2; i >= 0; --i) {
            ret = AST.alt(operands.get(i), ret);
        }
        return ret;
    }

    private Node term() {
        List<Node> factors = new ArrayList<Node>();
        factors.add(factor());
        while (token != EOX && token != ')' && token != '|') {
            factors.add(factor());
        }
        Node ret = factors.get(factors.size() - 1);
        for (int i = factors.size() - 2; i >= 0; --i) {
            ret = AST.cat(factors.get(i), ret);
        }
        return ret;
    }

    private Node factor() {
        Node ret;
        switch (token) {
        case EOX:
            throw error(regex.trim().length() == 0 ? "empty pattern" : "missing operand");
        case ')':
        case '|':
        case '*':
            throw error("missing operand before '" + (char) token + "'");
        case '(':
            int open = iToken;
            nextToken();
            ret = exp();
            if (token != ')') {
                iToken = open;
                throw error("unclosed '('");
            }
            nextToken();
            break;
        default:
            if (!Character.isLetterOrDigit(token) || token == Alphabet.EPSILON_GLYPH) {
                throw error("unsupported symbol '" + (char) token + "'");
            }
            ret = AST.literal((char) token);
            nextToken();
        }
        while (token == '*') {
            ret = AST.star(ret);
            nextToken();
        }
        return ret;
    }

    private void nextToken() {
        while (iNext < regex.length() && Character.isWhitespace(regex.charAt(iNext))) {
            ++iNext;
        }
        iToken = iNext;
        token = iNext < regex.length() ? regex.charAt(iNext++) : EOX;
    }

    private PatternSyntaxException error(String desc) {
        return new PatternSyntaxException(desc, regex, iToken);
    }
}
