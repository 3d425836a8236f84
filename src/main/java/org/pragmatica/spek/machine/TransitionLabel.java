package org.pragmatica.spek.machine;

/**
 * Observable effect of a machine step. Only non-{@link Private} labels distinguish behaviours.
 */
public sealed interface TransitionLabel {

    TransitionLabel PRIVATE = new Private();

    default boolean isObservable() {
        return !(this instanceof Private);
    }

    /**
     * Internal progress of a task.
     */
    record Private() implements TransitionLabel {}

    record Event(String label) implements TransitionLabel {}

    record TimeAdvance(double delta) implements TransitionLabel {}

    record TaskCompleted(int taskId) implements TransitionLabel {}

    record TaskFailed(int taskId, String reason) implements TransitionLabel {}
}
