package app;

import domain.output.ReportWriter;
import domain.plan.PlanReportRenderer;
import domain.plan.PlanStepCatalog;
import domain.plan.PlanTargetResolver;

/**
 * Collaborators of one invocation. Closing releases the database session, if any.
 */
final class XplanComponents implements AutoCloseable {

    private final PlanTargetResolver resolver;
    private final PlanStepCatalog catalog;
    private final PlanReportRenderer renderer;
    private final ReportWriter writer;
    private final AutoCloseable session;
    private final String description;

    XplanComponents(PlanTargetResolver resolver,
                    PlanStepCatalog catalog,
                    PlanReportRenderer renderer,
                    ReportWriter writer,
                    AutoCloseable session,
                    String description) {
        this.resolver = resolver;
        this.catalog = catalog;
        this.renderer = renderer;
        this.writer = writer;
        this.session = session;
        this.description = description;
    }

    PlanTargetResolver resolver() {
        return resolver;
    }

    PlanStepCatalog catalog() {
        return catalog;
    }

    PlanReportRenderer renderer() {
        return renderer;
    }

    ReportWriter writer() {
        return writer;
    }

    String description() {
        return description;
    }

    @Override
    public void close() throws Exception {
        if (session != null) session.close();
    }
}
