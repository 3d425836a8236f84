package org.pragmatica.spek.machine;

import io.vavr.control.Option;

import java.util.ArrayList;
import java.util.List;

/**
 * One cooperative thread of control. Between steps a task holds exactly its root frame; synchronous calls
 * push further frames only while the task is executing.
 */
public final class Task {
    private final int id;
    private final String entry;
    private final List<Frame> frames;
    private int fragment;
    private TaskStatus status;
    private int fuelUsed;

    Task(int id, Frame root) {
        this.id = id;
        this.entry = root.unit();
        this.frames = new ArrayList<>();
        this.frames.add(root);
        this.fragment = 0;
        this.status = TaskStatus.RUNNABLE;
    }

    private Task(Task other) {
        this.id = other.id;
        this.entry = other.entry;
        this.frames = new ArrayList<>(other.frames.size());
        other.frames.forEach(frame -> frames.add(frame.copy()));
        this.fragment = other.fragment;
        this.status = other.status;
        this.fuelUsed = other.fuelUsed;
    }

    public int id() {
        return id;
    }

    /**
     * Code unit the task was started with.
     */
    public String entry() {
        return entry;
    }

    /**
     * Fragment of the entry unit the task resumes at.
     */
    public int fragment() {
        return fragment;
    }

    public TaskStatus status() {
        return status;
    }

    /**
     * Root frame; empty once the task has terminated.
     */
    public Option<Frame> root() {
        return frames.isEmpty() ? Option.none() : Option.some(frames.get(0));
    }

    public List<Frame> frames() {
        return List.copyOf(frames);
    }

    int depth() {
        return frames.size();
    }

    void push(Frame frame) {
        frames.add(frame);
    }

    void pop() {
        frames.remove(frames.size() - 1);
    }

    void moveTo(int fragment) {
        this.fragment = fragment;
    }

    void status(TaskStatus status) {
        this.status = status;
        if (status.isTerminal()) {
            frames.clear();
        }
        if (status instanceof TaskStatus.Runnable) {
            fuelUsed = 0;
        }
    }

    int consumeFuel() {
        return ++fuelUsed;
    }

    Task copy() {
        return new Task(this);
    }
}
