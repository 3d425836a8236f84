package org.pragmatica.spek.machine;

import io.vavr.control.Option;
import org.pragmatica.spek.program.MachineProgram;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Complete configuration of a running program: heap, tasks, run queue, virtual clock and undelivered stimuli.
 *
 * <p>States are mutable and not thread-safe. The {@link Machine} never mutates a state it was given; every
 * driver operation works on a copy and returns it.
 */
public final class MachineState {
    private final MachineProgram program;
    private final Heap heap;
    private final LinkedHashMap<Integer, Task> tasks;
    private final ArrayDeque<Integer> runQueue;
    private final ArrayDeque<Stimulus> pending;
    private final Value[] globals;
    private double clock;
    private int nextTaskId;
    private long nextWaitSequence;

    MachineState(MachineProgram program) {
        this.program = program;
        this.heap = new Heap();
        this.tasks = new LinkedHashMap<>();
        this.runQueue = new ArrayDeque<>();
        this.pending = new ArrayDeque<>();
        this.globals = new Value[program.globals().size()];
        Arrays.fill(globals, Value.NONE);
        this.clock = 0.0;
        this.nextTaskId = 1;
        this.nextWaitSequence = 0;
    }

    private MachineState(MachineState other) {
        this.program = other.program;
        this.heap = other.heap.copy();
        this.tasks = new LinkedHashMap<>();
        other.tasks.forEach((id, task) -> tasks.put(id, task.copy()));
        this.runQueue = new ArrayDeque<>(other.runQueue);
        this.pending = new ArrayDeque<>(other.pending);
        this.globals = other.globals.clone();
        this.clock = other.clock;
        this.nextTaskId = other.nextTaskId;
        this.nextWaitSequence = other.nextWaitSequence;
    }

    /**
     * Independent deep copy sharing only the immutable program.
     */
    public MachineState copy() {
        return new MachineState(this);
    }

    public MachineProgram program() {
        return program;
    }

    public Heap heap() {
        return heap;
    }

    public double clock() {
        return clock;
    }

    /**
     * Tasks in creation order.
     */
    public Collection<Task> tasks() {
        return Collections.unmodifiableCollection(tasks.values());
    }

    public Option<Task> task(int id) {
        return Option.of(tasks.get(id));
    }

    /**
     * Ids of runnable tasks in the order they will run.
     */
    public List<Integer> runQueue() {
        return List.copyOf(runQueue);
    }

    public List<Stimulus> pending() {
        return List.copyOf(pending);
    }

    public List<Value> globals() {
        return List.of(globals);
    }

    public Option<Value> global(String name) {
        var slot = program.globalSlot(name);
        return slot < 0 ? Option.none() : Option.some(globals[slot]);
    }

    public int nextTaskId() {
        return nextTaskId;
    }

    public boolean hasRunnable() {
        return !runQueue.isEmpty();
    }

    /**
     * No runnable task and nothing left to deliver.
     */
    public boolean isQuiescent() {
        return runQueue.isEmpty() && pending.isEmpty();
    }

    /**
     * Earliest deadline any waiting task is waiting for.
     */
    public Option<Double> nextDeadline() {
        var result = Option.<Double>none();
        for (var task : tasks.values()) {
            if (task.status() instanceof TaskStatus.Waiting waiting
                && waiting.condition() instanceof WaitCondition.Until until
                && (result.isEmpty() || until.deadline() < result.get())) {
                result = Option.some(until.deadline());
            }
        }
        return result;
    }

    /**
     * Event labels some task is currently waiting for, in waiting order.
     */
    public Set<String> waitedEvents() {
        var result = new LinkedHashSet<String>();
        for (var task : waitingTasks()) {
            if (((TaskStatus.Waiting) task.status()).condition() instanceof WaitCondition.OnEvent event) {
                result.add(event.label());
            }
        }
        return result;
    }

    /**
     * Waiting tasks ordered by when they started waiting.
     */
    List<Task> waitingTasks() {
        var result = new ArrayList<Task>();
        for (var task : tasks.values()) {
            if (task.status() instanceof TaskStatus.Waiting) {
                result.add(task);
            }
        }
        result.sort(Comparator.comparingLong(task -> ((TaskStatus.Waiting) task.status()).sequence()));
        return result;
    }

    // === Mutation, used by the machine ===

    Task spawn(Frame root) {
        var task = new Task(nextTaskId++, root);
        tasks.put(task.id(), task);
        runQueue.addLast(task.id());
        return task;
    }

    Option<Task> head() {
        var id = runQueue.peekFirst();
        return id == null ? Option.none() : Option.some(tasks.get(id));
    }

    void dequeueHead() {
        runQueue.pollFirst();
    }

    void wake(Task task) {
        task.status(TaskStatus.RUNNABLE);
        runQueue.addLast(task.id());
    }

    long nextWaitSequence() {
        return nextWaitSequence++;
    }

    void enqueue(Stimulus stimulus) {
        pending.addLast(stimulus);
    }

    Option<Stimulus> pollPending() {
        return Option.of(pending.pollFirst());
    }

    Value global(int slot) {
        return globals[slot];
    }

    void global(int slot, Value value) {
        globals[slot] = value;
    }

    void clock(double clock) {
        this.clock = clock;
    }

    void removeTerminated() {
        tasks.values().removeIf(task -> task.status().isTerminal());
    }

    /**
     * Values the running program can still reach: globals, live frames and task results.
     */
    List<Value> roots() {
        var roots = new ArrayList<Value>(Arrays.asList(globals));
        for (var task : tasks.values()) {
            for (var frame : task.frames()) {
                roots.addAll(frame.slots());
            }
            if (task.status() instanceof TaskStatus.Completed completed) {
                roots.add(completed.result());
            }
        }
        return roots;
    }
}
