package org.pragmatica.spek.machine;

/**
 * Machine limits and retention policy.
 *
 * @param maxCallDepth          Frames a task may hold at once, its root frame included
 * @param maxFragmentsPerStep   Fragments a task may execute between two suspensions before it fails
 * @param retainTerminatedTasks Keep Completed and Failed tasks observable instead of draining them
 */
public record MachineConfig(
    int maxCallDepth,
    int maxFragmentsPerStep,
    boolean retainTerminatedTasks
) {
    public static final MachineConfig DEFAULT = new MachineConfig(
        200,
        100_000,
        true
    );

    public MachineConfig {
        if (maxCallDepth < 1) {
            throw new IllegalArgumentException("maxCallDepth must be positive: " + maxCallDepth);
        }
        if (maxFragmentsPerStep < 1) {
            throw new IllegalArgumentException("maxFragmentsPerStep must be positive: " + maxFragmentsPerStep);
        }
    }
}
