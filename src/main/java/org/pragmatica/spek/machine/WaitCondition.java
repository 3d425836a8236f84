package org.pragmatica.spek.machine;

/**
 * What a waiting task needs before it can run again.
 */
public sealed interface WaitCondition {

    /**
     * Delivery of the interaction event with exactly this label.
     */
    record OnEvent(String label) implements WaitCondition {}

    /**
     * The virtual clock reaching an absolute deadline.
     */
    record Until(double deadline) implements WaitCondition {}
}
