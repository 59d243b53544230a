package domain.model;

/** Drops every warning; used when the caller passes no sink to the annotator. */
final class NullAnnotationWarningSink implements AnnotationWarningSink {

    static final NullAnnotationWarningSink INSTANCE = new NullAnnotationWarningSink();

    private NullAnnotationWarningSink() {
    }

    @Override
    public void warn(AnnotationWarning warning) {
    }
}
