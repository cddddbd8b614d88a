package work.stepweave.engine.model;

/**
 * One unit of work in a workflow. Implementations form a closed set: {@link GenerativeCallStep},
 * {@link TextTransformStep}, {@link CollectionStep} and {@link ConditionalStep}.
 */
public interface Step {
    String id();

    String description();

    OnError onError();

    /**
     * Workflow-document type tag ({@code ai_call}, {@code text_process}, {@code collection}, {@code conditional}).
     */
    String type();
}
