/*
 * @LICENSE@
 */

package org.refauto;

import static org.refauto.Misc.LS;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders an automaton as a fixed width table:
 *
 * <pre>
 *       |   ε |   a |   b
 * ------+-----+-----+-----
 *   -&gt;1 | {3} |  {} |  {}
 *     2 |  {} |  {} |  {}
 *    *3 |  {} |  {} |  {}
 * </pre>
 *
 * Start state first, then the other states in sorted order. Cells are right
 * aligned.
 */
final class TablePrinter<Q> {

    private final Automaton<Q, ?> automaton;

    TablePrinter(Automaton<Q, ?> automaton) {
        this.automaton = automaton;
    }

    String print() {

        final int[] columns = automaton.columns();
        final List<String[]> rows = new ArrayList<String[]>();

        String[] header = new String[columns.length + 1];
        header[0] = "";
        for (int i = 0; i < columns.length; ++i) {
            header[i + 1] = Alphabet.glyph(columns[i]);
        }
        rows.add(header);

        for (Q q : rowOrder()) {
            String[] row = new String[columns.length + 1];
            row[0] = label(q);
            for (int i = 0; i < columns.length; ++i) {
                row[i + 1] = automaton.cell(q, columns[i]);
            }
            rows.add(row);
        }

        int[] widths = new int[columns.length + 1];
        for (String[] row : rows) {
            for (int i = 0; i < row.length; ++i) {
                widths[i] = Math.max(widths[i], row[i].length());
            }
        }

        StringBuilder sb = new StringBuilder();
        for (int r = 0; r < rows.size(); ++r) {
            String line = line(rows.get(r), widths);
            sb.append(line).append(LS);
            if (r == 0) {
                sb.append(rule(line)).append(LS);
            }
        }
        return sb.toString();
    }

    private List<Q> rowOrder() {
        List<Q> ret = new ArrayList<Q>();
        ret.add(automaton.start);
        for (Q q : Misc.sorted(automaton.states.asSet())) {
            if (!q.equals(automaton.start)) ret.add(q);
        }
        return ret;
    }

    private String label(Q q) {
        StringBuilder sb = new StringBuilder();
        if (q.equals(automaton.start)) sb.append("->");
        if (automaton.isFinal(q)) sb.append('*');
        return sb.append(q).toString();
    }

    private static String line(String[] row, int[] widths) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < row.length; ++i) {
            if (i > 0) sb.append(" | ");
            for (int pad = widths[i] - row[i].length(); pad > 0; --pad) {
                sb.append(' ');
            }
            sb.append(row[i]);
        }
        return sb.toString();
    }

    /*
     * same shape as the header: dashes, with '+' where the header has '|'.
     */
    private static String rule(String header) {
        StringBuilder sb = new StringBuilder(header.length());
        for (int i = 0; i < header.length(); ++i) {
            sb.append(header.charAt(i) == '|' ? '+' : '-');
        }
        return sb.toString();
    }
}
