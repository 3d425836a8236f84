package org.pragmatica.spek.equivalence;

import org.pragmatica.spek.machine.TransitionLabel;
import org.pragmatica.spek.printer.Printer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Labelled transition system. States are numbered from 0; each carries the content it is observed by
 * (empty when content is not observed) and its outgoing transitions in discovery order.
 */
public final class Lts {
    private final int initial;
    private final List<String> contents;
    private final List<List<Transition>> transitions;

    public record Transition(TransitionLabel label, int target) {}

    private Lts(int initial, List<String> contents, List<List<Transition>> transitions) {
        this.initial = initial;
        this.contents = List.copyOf(contents);
        var sealed = new ArrayList<List<Transition>>(transitions.size());
        transitions.forEach(outgoing -> sealed.add(List.copyOf(outgoing)));
        this.transitions = List.copyOf(sealed);
    }

    public int initial() {
        return initial;
    }

    public int size() {
        return contents.size();
    }

    public String content(int state) {
        return contents.get(state);
    }

    public List<Transition> transitions(int state) {
        return transitions.get(state);
    }

    public int transitionCount() {
        return transitions.stream()
                          .mapToInt(List::size)
                          .sum();
    }

    /**
     * Every label on some transition, in discovery order.
     */
    public Set<TransitionLabel> labels() {
        var result = new LinkedHashSet<TransitionLabel>();
        transitions.forEach(outgoing -> outgoing.forEach(transition -> result.add(transition.label())));
        return result;
    }

    /**
     * Disjoint union: the states of {@code right} follow those of {@code left}. The initial state is the left one.
     */
    static Lts union(Lts left, Lts right) {
        var builder = new Builder();
        for (int state = 0; state < left.size(); state++) {
            builder.addState(left.content(state));
        }
        for (int state = 0; state < right.size(); state++) {
            builder.addState(right.content(state));
        }
        var offset = left.size();
        for (int state = 0; state < left.size(); state++) {
            for (var transition : left.transitions(state)) {
                builder.addTransition(state, transition.label(), transition.target());
            }
        }
        for (int state = 0; state < right.size(); state++) {
            for (var transition : right.transitions(state)) {
                builder.addTransition(state + offset, transition.label(), transition.target() + offset);
            }
        }
        return builder.build(left.initial());
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        sb.append("initial s").append(initial).append('\n');
        for (int state = 0; state < size(); state++) {
            for (var transition : transitions(state)) {
                sb.append('s')
                  .append(state)
                  .append(" --")
                  .append(Printer.print(transition.label()))
                  .append("--> s")
                  .append(transition.target())
                  .append('\n');
            }
        }
        return sb.toString();
    }

    static final class Builder {
        private final List<String> contents = new ArrayList<>();
        private final List<List<Transition>> transitions = new ArrayList<>();

        int addState(String content) {
            contents.add(content);
            transitions.add(new ArrayList<>());
            return contents.size() - 1;
        }

        int size() {
            return contents.size();
        }

        String content(int state) {
            return contents.get(state);
        }

        boolean hasTransition(int source, TransitionLabel label) {
            return transitions.get(source)
                              .stream()
                              .anyMatch(transition -> transition.label().equals(label));
        }

        void addTransition(int source, TransitionLabel label, int target) {
            var transition = new Transition(label, target);
            var outgoing = transitions.get(source);
            if (!outgoing.contains(transition)) {
                outgoing.add(transition);
            }
        }

        Lts build(int initial) {
            return new Lts(initial, contents, transitions);
        }
    }
}
