package domain.error;

/** Malformed identifier, sub-selector or option. Raised before any catalog/report access. */
public final class ParameterException extends XplanException {

    public static final int EXIT_CODE = 2;

    public ParameterException(String message) {
        super(message);
    }

    @Override
    public int exitCode() {
        return EXIT_CODE;
    }
}
