package org.pragmatica.spek.machine;

import org.pragmatica.spek.error.RuntimeFailure;

/**
 * Lifecycle of a task: Runnable and Waiting alternate until the task ends Completed or Failed.
 */
public sealed interface TaskStatus {

    TaskStatus RUNNABLE = new Runnable();

    default boolean isTerminal() {
        return this instanceof Completed || this instanceof Failed;
    }

    record Runnable() implements TaskStatus {}

    /**
     * @param condition Wake-up condition
     * @param sequence  Registration order among all waits of the machine; earlier waiters wake first
     */
    record Waiting(WaitCondition condition, long sequence) implements TaskStatus {}

    record Completed(Value result) implements TaskStatus {}

    record Failed(RuntimeFailure failure) implements TaskStatus {}
}
