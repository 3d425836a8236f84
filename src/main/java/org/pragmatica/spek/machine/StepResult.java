package org.pragmatica.spek.machine;

import java.util.List;

/**
 * New machine state and the labels of the transitions that led to it, in order.
 */
public record StepResult(MachineState state, List<TransitionLabel> labels) {
    public StepResult {
        labels = List.copyOf(labels);
    }

    public List<TransitionLabel> observableLabels() {
        return labels.stream()
                     .filter(TransitionLabel::isObservable)
                     .toList();
    }
}
