package domain.order;

import java.util.Collections;
import java.util.Map;

/**
 * Immutable per-group lookup {@code step id -> StepOrder}.
 */
public final class ExecutionOrderTable {

    private final String groupKey;
    private final Map<Integer, StepOrder> byId;

    ExecutionOrderTable(String groupKey, Map<Integer, StepOrder> byId) {
        this.groupKey = groupKey;
        this.byId = Collections.unmodifiableMap(byId);
    }

    public String getGroupKey() {
        return groupKey;
    }

    /** @return the order of {@code id}, or {@code null} when the group has no such step */
    public StepOrder find(int id) {
        return byId.get(id);
    }

    public int size() {
        return byId.size();
    }

    /** Largest order id in the group; equals {@link #size()} (the root's rank). */
    public int maxOrderId() {
        return byId.size();
    }

    public Map<Integer, StepOrder> asMap() {
        return byId;
    }
}
