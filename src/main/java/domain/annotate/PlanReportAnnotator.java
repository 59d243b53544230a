package domain.annotate;

import domain.error.RenderMismatchException;
import domain.model.AnnotationWarning;
import domain.model.AnnotationWarningSink;
import domain.model.MismatchSeverity;
import domain.model.WarningCode;
import domain.order.ExecutionOrderTable;
import domain.order.StepOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Annotates the report block of a single plan.
 *
 * <p>Two passes: the sizing pass classifies every line and fixes the column width, the name
 * padding and the {@code Name} field position; the render pass rewrites the lines. Nothing is
 * produced before the sizing pass has seen the whole block.</p>
 */
public final class PlanReportAnnotator {

    private final AnnotationOptions options;
    private final AnnotationWarningSink warningSink;
    private final PlanLineClassifier classifier = new PlanLineClassifier();

    public PlanReportAnnotator(AnnotationOptions options, AnnotationWarningSink warningSink) {
        this.options = options == null ? AnnotationOptions.defaults() : options;
        this.warningSink = warningSink == null ? AnnotationWarningSink.none() : warningSink;
    }

    /** Annotated lines of one block, without footer. */
    public List<String> annotate(ExecutionOrderTable table, List<String> lines) {
        return annotateBlock(table, lines).lines;
    }

    Block annotateBlock(ExecutionOrderTable table, List<String> lines) {
        if (lines == null || lines.isEmpty()) return new Block(Collections.emptyList(), 0);

        // ---- pass 1: size
        List<PlanLine> classified = classifier.classify(lines);
        ColumnInjector injector = new ColumnInjector(ColumnInjector.columnWidth(table.maxOrderId()));
        NameQualifier qualifier = NameQualifier.disabled();
        int nameField = -1;

        if (options.isQualifyNames()) {
            nameField = annotatedNameField(classified);
            if (nameField > 0) {
                qualifier = NameQualifier.sizeFor(table);
            } else if (hasHeader(classified)) {
                warningSink.warn(AnnotationWarning.of(WarningCode.NAME_COLUMN_NOT_FOUND,
                        table.getGroupKey(), null, "report has no Name column; names left as rendered"));
            }
        }

        checkMismatches(table, classified);

        // ---- pass 2: render
        List<String> out = new ArrayList<>(classified.size());
        int annotated = 0;

        for (PlanLine pl : classified) {
            String text = pl.getText();
            switch (pl.getKind()) {
                case SEPARATOR:
                    out.add(pl.isInPlanTable() ? injector.separator(text, qualifier.namePad()) : text);
                    break;
                case HEADER:
                    out.add(qualifier.widen(injector.header(text), nameField));
                    break;
                case DATA:
                    StepOrder order = pl.getStepId() == null ? null : table.find(pl.getStepId());
                    if (order == null) {
                        out.add(text);
                    } else {
                        out.add(qualifier.qualify(injector.data(text, order), nameField, order));
                        annotated++;
                    }
                    break;
                case CONTINUATION:
                    out.add(pl.isInPlanTable() ? qualifier.widen(injector.continuation(text), nameField) : text);
                    break;
                default:
                    out.add(text);
                    break;
            }
        }
        return new Block(out, annotated);
    }

    private void checkMismatches(ExecutionOrderTable table, List<PlanLine> classified) {
        MismatchSeverity severity = options.getMismatchSeverity();
        for (PlanLine pl : classified) {
            if (pl.getKind() != LineKind.DATA) continue;
            Integer id = pl.getStepId();
            if (id != null && table.find(id) != null) continue;

            String where = table.getGroupKey() == null ? "" : " (group " + table.getGroupKey() + ")";
            if (severity == MismatchSeverity.FAIL) {
                throw new RenderMismatchException(id == null ? -1 : id,
                        "plan row has no catalog entry" + where + ": " + pl.getText().trim());
            }
            if (severity == MismatchSeverity.WARN) {
                warningSink.warn(new AnnotationWarning(WarningCode.RENDER_MISMATCH,
                        table.getGroupKey(), id, "plan row left unannotated", pl.getText().trim()));
            }
        }
    }

    /** Name field position after injection (the two new cells sit left of it). */
    private static int annotatedNameField(List<PlanLine> classified) {
        for (PlanLine pl : classified) {
            if (pl.getKind() != LineKind.HEADER) continue;
            int raw = NameQualifier.nameFieldIndex(pl.getText());
            return raw > 1 ? raw + 2 : -1;
        }
        return -1;
    }

    private static boolean hasHeader(List<PlanLine> classified) {
        for (PlanLine pl : classified) {
            if (pl.getKind() == LineKind.HEADER) return true;
        }
        return false;
    }

    static final class Block {
        final List<String> lines;
        final int annotatedRows;

        Block(List<String> lines, int annotatedRows) {
            this.lines = lines;
            this.annotatedRows = annotatedRows;
        }
    }
}
