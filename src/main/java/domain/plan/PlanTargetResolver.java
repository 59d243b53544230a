package domain.plan;

/**
 * Fills in the defaults of a target (latest explained plan, previous cursor, current database).
 */
public interface PlanTargetResolver {

    static PlanTargetResolver identity() {
        return target -> target;
    }

    PlanTarget resolve(PlanTarget target);
}
