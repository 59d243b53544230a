package domain.annotate;

import domain.model.AnnotationWarning;
import domain.model.AnnotationWarningSink;
import domain.model.FooterMode;
import domain.model.ListAnnotationWarningSink;
import domain.model.WarningCode;
import domain.order.ExecutionOrderBuilder;
import domain.order.ExecutionOrderTable;
import domain.plan.GroupKeys;
import domain.plan.PlanReportRenderer;
import domain.plan.PlanStep;
import domain.plan.PlanStepCatalog;
import domain.plan.PlanTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Runs the annotation pipeline once per plan group and concatenates the blocks.
 *
 * <p>Order of work:</p>
 * <ol>
 *   <li>fetch all catalog rows once</li>
 *   <li>partition them by group key (ascending) and build every group's order table; any
 *       integrity failure aborts here, before a single report line is read</li>
 *   <li>per group: render, annotate with the group's own width and padding</li>
 *   <li>append the footer per {@link FooterMode}</li>
 * </ol>
 */
public final class PlanGroupRouter {

    private static final Logger log = LoggerFactory.getLogger(PlanGroupRouter.class);

    private final PlanStepCatalog catalog;
    private final PlanReportRenderer renderer;
    private final ExecutionOrderBuilder orderBuilder;
    private final AnnotationOptions options;

    public PlanGroupRouter(PlanStepCatalog catalog,
                           PlanReportRenderer renderer,
                           ExecutionOrderBuilder orderBuilder,
                           AnnotationOptions options) {
        this.catalog = catalog;
        this.renderer = renderer;
        this.orderBuilder = orderBuilder == null ? new ExecutionOrderBuilder() : orderBuilder;
        this.options = options == null ? AnnotationOptions.defaults() : options;
    }

    public AnnotatedReport annotate(PlanTarget target, AnnotationWarningSink sink) {
        List<AnnotationWarning> collected = new ArrayList<>();
        AnnotationWarningSink warnings = teeSink(sink, collected);

        List<PlanStep> rows = catalog.fetch(target);
        log.debug("catalog rows={} target={}", rows.size(), target);

        List<String> out = new ArrayList<>();

        if (rows.isEmpty()) {
            warnings.warn(AnnotationWarning.of(WarningCode.EMPTY_CATALOG, null, null,
                    "no plan rows for " + target));
            out.addAll(renderer.render(target, null));
            out.addAll(ReportFooter.lines());
            return new AnnotatedReport(out, 0, 0, collected);
        }

        Map<String, ExecutionOrderTable> tables = buildTables(partition(rows));

        PlanReportAnnotator annotator = new PlanReportAnnotator(options, warnings);
        int annotatedRows = 0;

        for (Map.Entry<String, ExecutionOrderTable> e : tables.entrySet()) {
            String groupKey = e.getKey();
            long t0 = System.nanoTime();

            List<String> lines = renderer.render(target, groupKey);
            PlanReportAnnotator.Block block = annotator.annotateBlock(e.getValue(), lines);
            out.addAll(block.lines);
            annotatedRows += block.annotatedRows;

            if (options.getFooterMode() == FooterMode.BLOCK) {
                out.addAll(ReportFooter.lines());
            }

            long ms = (System.nanoTime() - t0) / 1_000_000L;
            log.debug("group={} steps={} lines={} annotated={} elapsed={}ms",
                    groupKey, e.getValue().size(), lines.size(), block.annotatedRows, ms);
            if (ms >= options.getSlowMs()) {
                warnings.warn(new AnnotationWarning(WarningCode.SLOW_STEP, groupKey, null,
                        "slowMs=" + options.getSlowMs() + ", actualMs=" + ms, ""));
            }
        }

        if (options.getFooterMode() == FooterMode.REPORT) {
            out.addAll(ReportFooter.lines());
        }
        return new AnnotatedReport(out, tables.size(), annotatedRows, collected);
    }

    /** Rows per group key, groups in ascending key order, rows in catalog order. */
    static Map<String, List<PlanStep>> partition(List<PlanStep> rows) {
        Map<String, List<PlanStep>> groups = new TreeMap<>(GroupKeys.ORDER);
        for (PlanStep s : rows) {
            if (s == null) continue;
            groups.computeIfAbsent(s.getGroupKey(), k -> new ArrayList<>()).add(s);
        }
        return groups;
    }

    private Map<String, ExecutionOrderTable> buildTables(Map<String, List<PlanStep>> groups) {
        Map<String, ExecutionOrderTable> tables = new LinkedHashMap<>();
        for (Map.Entry<String, List<PlanStep>> g : groups.entrySet()) {
            tables.put(g.getKey(), orderBuilder.build(g.getKey(), g.getValue()));
        }
        return tables;
    }

    private static AnnotationWarningSink teeSink(AnnotationWarningSink sink, List<AnnotationWarning> collected) {
        AnnotationWarningSink local = new ListAnnotationWarningSink(collected);
        return w -> {
            if (w == null) return;
            local.warn(w);
            if (sink != null) sink.warn(w);
        };
    }
}
