package domain.annotate;

import domain.order.ExecutionOrderTable;
import domain.order.StepOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * Widens the {@code Name} column so that it can hold {@code OWNER.NAME}.
 *
 * <p>Sizing happens once per group ({@link #sizeFor(ExecutionOrderTable)}), before any line is
 * rewritten: the column grows by {@code namePad = longest OWNER.NAME - longest NAME}, and every
 * table line (borders included) grows by exactly that much.</p>
 */
final class NameQualifier {

    static final String NAME_TITLE = "Name";

    private final int namePad;

    NameQualifier(int namePad) {
        this.namePad = Math.max(0, namePad);
    }

    static NameQualifier disabled() {
        return new NameQualifier(0);
    }

    /** Pass 1: longest qualified name minus longest bare name over all steps of the group. */
    static NameQualifier sizeFor(ExecutionOrderTable table) {
        int maxQualified = 0;
        int maxBare = 0;
        for (StepOrder s : table.asMap().values()) {
            if (s.getObjectName() == null) continue;
            maxBare = Math.max(maxBare, s.getObjectName().length());
            maxQualified = Math.max(maxQualified, s.qualifiedName().length());
        }
        return new NameQualifier(maxQualified - maxBare);
    }

    int namePad() {
        return namePad;
    }

    /**
     * Index of the {@code Name} field in a header line, counted from 0 (the text before the first
     * delimiter), or -1 when there is none.
     */
    static int nameFieldIndex(String header) {
        List<Integer> d = delimiters(header);
        for (int f = 0; f + 1 < d.size(); f++) {
            String title = header.substring(d.get(f) + 1, d.get(f + 1)).trim();
            if (NAME_TITLE.equals(title)) return f + 1;
        }
        return -1;
    }

    /** Header and wrapped lines: pad the field on the right. */
    String widen(String line, int field) {
        return rewriteField(line, field, null);
    }

    /** Plan rows: {@code OWNER.NAME} when the step has an owner, otherwise the field is padded. */
    String qualify(String line, int field, StepOrder order) {
        String replacement = null;
        if (order != null && order.getObjectOwner() != null && order.getObjectName() != null) {
            replacement = order.qualifiedName();
        }
        return rewriteField(line, field, replacement);
    }

    private String rewriteField(String line, int field, String replacement) {
        if (field <= 0 || (namePad == 0 && replacement == null)) return line;
        List<Integer> d = delimiters(line);
        if (field >= d.size()) return line;

        int start = d.get(field - 1) + 1;
        int end = d.get(field);
        String current = line.substring(start, end);
        int target = current.length() + namePad;

        String content = (replacement == null) ? current : " " + replacement;
        StringBuilder sb = new StringBuilder(content);
        while (sb.length() < target) sb.append(' ');
        if (sb.length() > target && sb.charAt(sb.length() - 1) != ' ') {
            // longer than the rendered column: keep one blank before the delimiter
            sb.append(' ');
        }
        return line.substring(0, start) + sb + line.substring(end);
    }

    private static List<Integer> delimiters(String line) {
        List<Integer> out = new ArrayList<>();
        if (line == null) return out;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == PlanLineClassifier.DELIMITER) out.add(i);
        }
        return out;
    }
}
