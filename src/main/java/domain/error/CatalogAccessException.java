package domain.error;

/**
 * Plan rows or report lines could not be read (SQL error, missing privileges,
 * unreadable file).
 */
public final class CatalogAccessException extends XplanException {

    public static final int EXIT_CODE = 3;

    public CatalogAccessException(String message) {
        super(message);
    }

    public CatalogAccessException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int exitCode() {
        return EXIT_CODE;
    }
}
