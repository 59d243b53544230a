package domain.plan;

import java.util.List;

/**
 * Supplies the flat plan rows for a target.
 *
 * <p>Rows of several plans are told apart by {@link PlanStep#getGroupKey()}. An empty list means
 * "no matching plan" and is not an error.</p>
 */
public interface PlanStepCatalog {

    /**
     * @throws domain.error.CatalogAccessException when the rows cannot be read
     */
    List<PlanStep> fetch(PlanTarget target);
}
