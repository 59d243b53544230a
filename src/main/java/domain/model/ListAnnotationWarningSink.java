package domain.model;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects warnings for the end-of-run summary, keeping one per (code, plan group, step id).
 *
 * <p>Adaptive plans render inactive steps too, so one unmatched step id can show up on several
 * report lines; group-level warnings (no step id) are kept once per group.</p>
 */
public final class ListAnnotationWarningSink implements AnnotationWarningSink {

    private final List<AnnotationWarning> target;
    private final Set<List<Object>> reported = new HashSet<>();

    public ListAnnotationWarningSink(List<AnnotationWarning> target) {
        this.target = target;
    }

    @Override
    public void warn(AnnotationWarning warning) {
        if (warning == null || target == null) return;
        if (reported.add(Arrays.asList(warning.getCode(), warning.getGroupKey(), warning.getStepId()))) {
            target.add(warning);
        }
    }
}
