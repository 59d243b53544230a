package domain.model;

/**
 * Sink for annotation warnings.
 *
 * <p>Warnings are produced by the annotator for every group; the sink lets the CLI
 * collect them without coupling the core to logging.</p>
 */
public interface AnnotationWarningSink {

    static AnnotationWarningSink none() {
        return NullAnnotationWarningSink.INSTANCE;
    }

    void warn(AnnotationWarning warning);
}
