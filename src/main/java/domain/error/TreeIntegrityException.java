package domain.error;

import java.util.Collections;
import java.util.List;

/**
 * Parent/child rows do not form a single tree rooted at id 0.
 *
 * <p>The offending ids are kept so that callers (and tests) do not need to parse the message.</p>
 */
public final class TreeIntegrityException extends XplanException {

    public static final int EXIT_CODE = 4;

    private final String groupKey;
    private final List<Integer> offendingIds;

    public TreeIntegrityException(String groupKey, List<Integer> offendingIds, String message) {
        super(message);
        this.groupKey = groupKey;
        this.offendingIds = offendingIds == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(offendingIds);
    }

    public String getGroupKey() {
        return groupKey;
    }

    public List<Integer> getOffendingIds() {
        return offendingIds;
    }

    @Override
    public int exitCode() {
        return EXIT_CODE;
    }
}
