package domain.plan;

import java.util.List;

/**
 * Produces the unannotated, fixed-width plan report.
 */
public interface PlanReportRenderer {

    /**
     * @param target   resolved target
     * @param groupKey the plan to render when the catalog holds several, otherwise {@code null}
     * @return report lines in order, without line terminators
     * @throws domain.error.CatalogAccessException when the report cannot be produced
     */
    List<String> render(PlanTarget target, String groupKey);
}
