package domain.annotate;

import domain.model.FooterMode;
import domain.model.MismatchSeverity;

/**
 * Switches of the annotation pipeline. Immutable; use the {@code with*} methods.
 */
public final class AnnotationOptions {

    public static final long DEFAULT_SLOW_MS = 500L;

    private final boolean qualifyNames;
    private final MismatchSeverity mismatchSeverity;
    private final FooterMode footerMode;
    private final long slowMs;

    private AnnotationOptions(boolean qualifyNames, MismatchSeverity mismatchSeverity,
                              FooterMode footerMode, long slowMs) {
        this.qualifyNames = qualifyNames;
        this.mismatchSeverity = mismatchSeverity == null ? MismatchSeverity.WARN : mismatchSeverity;
        this.footerMode = footerMode == null ? FooterMode.REPORT : footerMode;
        this.slowMs = slowMs;
    }

    /** No name qualification, mismatches warned, one footer per report. */
    public static AnnotationOptions defaults() {
        return new AnnotationOptions(false, MismatchSeverity.WARN, FooterMode.REPORT, DEFAULT_SLOW_MS);
    }

    public AnnotationOptions withQualifyNames(boolean qualify) {
        return new AnnotationOptions(qualify, mismatchSeverity, footerMode, slowMs);
    }

    public AnnotationOptions withMismatchSeverity(MismatchSeverity severity) {
        return new AnnotationOptions(qualifyNames, severity, footerMode, slowMs);
    }

    public AnnotationOptions withFooterMode(FooterMode mode) {
        return new AnnotationOptions(qualifyNames, mismatchSeverity, mode, slowMs);
    }

    public AnnotationOptions withSlowMs(long ms) {
        return new AnnotationOptions(qualifyNames, mismatchSeverity, footerMode, ms);
    }

    public boolean isQualifyNames() {
        return qualifyNames;
    }

    public MismatchSeverity getMismatchSeverity() {
        return mismatchSeverity;
    }

    public FooterMode getFooterMode() {
        return footerMode;
    }

    public long getSlowMs() {
        return slowMs;
    }

    @Override
    public String toString() {
        return "qualifyNames=" + qualifyNames
                + ", onMismatch=" + mismatchSeverity
                + ", footer=" + footerMode
                + ", slowMs=" + slowMs;
    }
}
