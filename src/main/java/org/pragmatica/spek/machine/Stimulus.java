package org.pragmatica.spek.machine;

import io.vavr.control.Option;

/**
 * External input to the machine. Stimuli are queued and delivered only when no task is runnable.
 */
public sealed interface Stimulus {

    static Stimulus event(String label) {
        return new Event(label);
    }

    /**
     * Advance to the earliest outstanding deadline.
     */
    static Stimulus advance() {
        return new AdvanceClock(Option.none());
    }

    static Stimulus advanceTo(double deadline) {
        return new AdvanceClock(Option.some(deadline));
    }

    record Event(String label) implements Stimulus {
        public Event {
            if (label == null) {
                throw new IllegalArgumentException("Event label must not be null");
            }
        }
    }

    record AdvanceClock(Option<Double> deadline) implements Stimulus {
        public AdvanceClock {
            if (deadline == null || deadline.exists(d -> d.isNaN() || d.isInfinite())) {
                throw new IllegalArgumentException("Deadline must be a finite number");
            }
        }
    }
}
