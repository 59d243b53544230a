package domain.plan;

import java.util.Objects;

/**
 * One row of a plan catalog: a single operation of an execution plan.
 *
 * <p>{@code parentId} is {@code null} for the root (id 0). {@code groupKey} is {@code null}
 * when the catalog holds a single plan.</p>
 */
public final class PlanStep {

    private final int id;
    private final Integer parentId;
    private final String objectOwner;
    private final String objectName;
    private final String groupKey;

    public PlanStep(int id, Integer parentId) {
        this(id, parentId, null, null, null);
    }

    public PlanStep(int id, Integer parentId, String objectOwner, String objectName) {
        this(id, parentId, objectOwner, objectName, null);
    }

    public PlanStep(int id, Integer parentId, String objectOwner, String objectName, String groupKey) {
        this.id = id;
        this.parentId = parentId;
        this.objectOwner = blankToNull(objectOwner);
        this.objectName = blankToNull(objectName);
        this.groupKey = blankToNull(groupKey);
    }

    private static String blankToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    public int getId() {
        return id;
    }

    public Integer getParentId() {
        return parentId;
    }

    public String getObjectOwner() {
        return objectOwner;
    }

    public String getObjectName() {
        return objectName;
    }

    public String getGroupKey() {
        return groupKey;
    }

    public boolean isRoot() {
        return id == 0 && parentId == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PlanStep)) return false;
        PlanStep that = (PlanStep) o;
        return id == that.id
                && Objects.equals(parentId, that.parentId)
                && Objects.equals(objectOwner, that.objectOwner)
                && Objects.equals(objectName, that.objectName)
                && Objects.equals(groupKey, that.groupKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, parentId, objectOwner, objectName, groupKey);
    }

    @Override
    public String toString() {
        return "PlanStep{id=" + id + ", parentId=" + parentId
                + (objectName == null ? "" : ", name=" + (objectOwner == null ? "" : objectOwner + ".") + objectName)
                + (groupKey == null ? "" : ", group=" + groupKey)
                + '}';
    }
}
