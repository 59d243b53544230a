package domain.error;

/**
 * A data line refers to a step id that the catalog does not know.
 * Only thrown when the mismatch severity is {@code FAIL}.
 */
public final class RenderMismatchException extends XplanException {

    public static final int EXIT_CODE = 5;

    private final int stepId;

    public RenderMismatchException(int stepId, String message) {
        super(message);
        this.stepId = stepId;
    }

    public int getStepId() {
        return stepId;
    }

    @Override
    public int exitCode() {
        return EXIT_CODE;
    }
}
