package domain.annotate;

import domain.order.StepOrder;

/**
 * Splices the {@code Pid} and {@code Ord} columns into plan table lines, right after the
 * {@code Id} column (after the second delimiter).
 *
 * <pre>
 * | Id  | Operation          |   =&gt;   | Id  | Pid | Ord | Operation          |
 * |   1 |  MERGE JOIN        |         |   1 |   0 |   5 |  MERGE JOIN        |
 * </pre>
 */
final class ColumnInjector {

    static final String PARENT_TITLE = "Pid";
    static final String ORDER_TITLE = "Ord";

    static final int MIN_WIDTH = 6;
    static final int WIDTH_PADDING = 3;

    private final int width;

    ColumnInjector(int width) {
        this.width = width;
    }

    /** Width of each injected cell, delimiter included. */
    static int columnWidth(int maxOrderId) {
        int digits = String.valueOf(Math.max(0, maxOrderId)).length();
        return Math.max(digits + WIDTH_PADDING, MIN_WIDTH);
    }

    int width() {
        return width;
    }

    /** Border lines grow by both cells plus any extra width added further right. */
    String separator(String line, int extra) {
        return repeat(PlanLineClassifier.RULE, width * 2 + Math.max(0, extra)) + line;
    }

    String header(String line) {
        return insertAfterIdColumn(line, cell(PARENT_TITLE) + cell(ORDER_TITLE));
    }

    String data(String line, StepOrder order) {
        String pid = order.getParentId() == null ? "" : String.valueOf(order.getParentId());
        return insertAfterIdColumn(line, cell(pid) + cell(String.valueOf(order.getOrderId())));
    }

    /** Wrapped lines get blank cells so that the borders below stay in place. */
    String continuation(String line) {
        return insertAfterIdColumn(line, cell("") + cell(""));
    }

    private String cell(String value) {
        return lpad(value + " " + PlanLineClassifier.DELIMITER, width);
    }

    static String insertAfterIdColumn(String line, String cells) {
        int second = nthIndexOf(line, PlanLineClassifier.DELIMITER, 2);
        if (second < 0) return line;
        return line.substring(0, second + 1) + cells + line.substring(second + 1);
    }

    /** Index of the {@code n}-th (1-based) occurrence of {@code c}, or -1. */
    static int nthIndexOf(String s, char c, int n) {
        if (s == null || n <= 0) return -1;
        int from = 0;
        int idx = -1;
        for (int k = 0; k < n; k++) {
            idx = s.indexOf(c, from);
            if (idx < 0) return -1;
            from = idx + 1;
        }
        return idx;
    }

    static String lpad(String s, int len) {
        String v = (s == null) ? "" : s;
        if (v.length() >= len) return v;
        return repeat(' ', len - v.length()) + v;
    }

    static String repeat(char c, int n) {
        if (n <= 0) return "";
        StringBuilder sb = new StringBuilder(n);
        for (int i = 0; i < n; i++) sb.append(c);
        return sb.toString();
    }
}
