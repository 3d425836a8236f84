package org.pragmatica.spek.error;

import org.pragmatica.spek.tree.SourceSpan;

/**
 * Unrecoverable error raised while a task was executing. It is confined to that task, which becomes Failed.
 *
 * @param taskId    Id of the failed task
 * @param operation Operation that failed (e.g. "attribute 'x'", "division")
 * @param reason    Human-readable reason
 * @param span      Source span of the failing instruction
 */
public record RuntimeFailure(
    int taskId,
    String operation,
    String reason,
    SourceSpan span
) implements SpekError {
    @Override
    public String message() {
        return operation + ": " + reason + " at " + span.start();
    }
}
