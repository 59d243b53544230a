package domain.order;

/**
 * Derived execution order of one plan step.
 *
 * <p>{@code orderId} 1 is the first operation to complete, {@code N} (the root) the last.</p>
 */
public final class StepOrder {

    private final int id;
    private final Integer parentId;
    private final int orderId;
    private final String objectOwner;
    private final String objectName;

    StepOrder(int id, Integer parentId, int orderId, String objectOwner, String objectName) {
        this.id = id;
        this.parentId = parentId;
        this.orderId = orderId;
        this.objectOwner = objectOwner;
        this.objectName = objectName;
    }

    public int getId() {
        return id;
    }

    public Integer getParentId() {
        return parentId;
    }

    public int getOrderId() {
        return orderId;
    }

    public String getObjectOwner() {
        return objectOwner;
    }

    public String getObjectName() {
        return objectName;
    }

    /** {@code OWNER.NAME}, the bare name when there is no owner, or {@code null} without a name. */
    public String qualifiedName() {
        if (objectName == null) return null;
        return objectOwner == null ? objectName : objectOwner + "." + objectName;
    }

    @Override
    public String toString() {
        return "StepOrder{id=" + id + ", pid=" + parentId + ", ord=" + orderId + '}';
    }
}
