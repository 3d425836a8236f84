package org.pragmatica.spek.machine;

import io.vavr.control.Option;
import org.apache.log4j.Logger;
import org.pragmatica.spek.error.RuntimeFailure;
import org.pragmatica.spek.program.MachineProgram;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic cooperative machine. Holds no state of its own: every operation takes a {@link MachineState},
 * works on a copy and returns the new state with the labels of the transitions taken.
 *
 * <p>Scheduling is FIFO. The task at the head of the run queue runs until it suspends, completes or fails;
 * spawned and woken tasks join at the tail. Stimuli are delivered only while no task is runnable, so the
 * clock never moves while work is pending.
 *
 * <pre>{@code
 * var machine = Machine.create(MachineConfig.DEFAULT);
 * var result = machine.runUntilQuiescent(machine.load(program));
 * result = machine.deliverEvent(result.state(), "advance");
 * var snapshot = machine.observe(result.state());
 * }</pre>
 */
public final class Machine {
    private static final Logger logger = Logger.getLogger(Machine.class);

    private final MachineConfig config;

    private Machine(MachineConfig config) {
        this.config = config;
    }

    public static Machine create(MachineConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Machine configuration must not be null");
        }
        return new Machine(config);
    }

    public static Machine create() {
        return create(MachineConfig.DEFAULT);
    }

    public MachineConfig config() {
        return config;
    }

    /**
     * Fresh state with the top-level script as task 1, runnable and not yet started.
     */
    public MachineState load(MachineProgram program) {
        if (program == null) {
            throw new IllegalArgumentException("Program must not be null");
        }
        var state = new MachineState(program);
        var entry = program.unit(program.entry());
        state.spawn(Frame.of(entry, Option.none(), List.of()));
        logger.debug("Loaded program with " + program.units().size() + " code unit(s)");
        return state;
    }

    /**
     * Single micro-step. The stimulus, if any, is queued first. Then one fragment of the head task runs; when no
     * task is runnable, the oldest pending stimulus is delivered first and one fragment of the woken head runs.
     */
    public StepResult step(MachineState state, Option<Stimulus> stimulus) {
        var next = state.copy();
        var labels = new ArrayList<TransitionLabel>();
        stimulus.forEach(next::enqueue);
        if (!next.hasRunnable()) {
            next.pollPending().forEach(pending -> deliver(next, pending, labels));
        }
        if (next.hasRunnable()) {
            runFragment(next, labels);
        }
        return new StepResult(next, labels);
    }

    /**
     * Runs until no task is runnable and every pending stimulus is delivered, then releases unreachable objects.
     */
    public StepResult runUntilQuiescent(MachineState state) {
        var next = state.copy();
        var labels = new ArrayList<TransitionLabel>();
        drain(next, labels);
        return new StepResult(next, labels);
    }

    /**
     * Delivers an interaction event, waking every task waiting for {@code label} in waiting order, and runs to
     * quiescence.
     */
    public StepResult deliverEvent(MachineState state, String label) {
        return deliver(state, Stimulus.event(label));
    }

    /**
     * Moves the clock to {@code deadline}, or to the earliest outstanding deadline when none is given, wakes the
     * tasks whose deadline is reached and runs to quiescence. The clock never moves backwards.
     */
    public StepResult advanceClock(MachineState state, Option<Double> deadline) {
        return deliver(state, new Stimulus.AdvanceClock(deadline));
    }

    public HeapSnapshot observe(MachineState state) {
        return HeapSnapshot.of(state);
    }

    private StepResult deliver(MachineState state, Stimulus stimulus) {
        var next = state.copy();
        var labels = new ArrayList<TransitionLabel>();
        next.enqueue(stimulus);
        drain(next, labels);
        return new StepResult(next, labels);
    }

    // === Scheduling ===

    private void drain(MachineState state, List<TransitionLabel> labels) {
        while (true) {
            if (state.hasRunnable()) {
                runFragment(state, labels);
                continue;
            }
            var pending = state.pollPending();
            if (pending.isEmpty()) {
                break;
            }
            deliver(state, pending.get(), labels);
        }
        var released = state.heap().collect(state.roots());
        if (released > 0) {
            logger.debug("Released " + released + " unreachable object(s)");
        }
        if (!config.retainTerminatedTasks()) {
            state.removeTerminated();
        }
    }

    private void runFragment(MachineState state, List<TransitionLabel> labels) {
        var task = state.head()
                        .getOrElseThrow(() -> new IllegalStateException("Run queue is empty"));
        var interpreter = new Interpreter(state, config, task);
        try {
            interpreter.runFragment();
        } catch (ExecutionFault fault) {
            fail(task, new RuntimeFailure(task.id(), fault.operation(), fault.reason(), interpreter.span()));
        } catch (StackOverflowError error) {
            fail(task, new RuntimeFailure(task.id(), "execution", "stack overflow", interpreter.span()));
        }
        labels.add(TransitionLabel.PRIVATE);

        var status = task.status();
        if (status instanceof TaskStatus.Runnable) {
            return;
        }
        state.dequeueHead();
        if (status instanceof TaskStatus.Completed) {
            logger.debug("Task " + task.id() + " completed");
            labels.add(new TransitionLabel.TaskCompleted(task.id()));
        } else if (status instanceof TaskStatus.Failed failed) {
            labels.add(new TransitionLabel.TaskFailed(task.id(), failed.failure().reason()));
        } else if (status instanceof TaskStatus.Waiting waiting) {
            logger.debug("Task " + task.id() + " waiting for " + waiting.condition());
        }
    }

    private static void fail(Task task, RuntimeFailure failure) {
        logger.warn("Task " + task.id() + " failed: " + failure.message());
        task.status(new TaskStatus.Failed(failure));
    }

    private void deliver(MachineState state, Stimulus stimulus, List<TransitionLabel> labels) {
        if (stimulus instanceof Stimulus.Event event) {
            labels.add(new TransitionLabel.Event(event.label()));
            for (var task : state.waitingTasks()) {
                var condition = ((TaskStatus.Waiting) task.status()).condition();
                if (condition instanceof WaitCondition.OnEvent onEvent && onEvent.label().equals(event.label())) {
                    wake(state, task);
                }
            }
            return;
        }
        var advance = (Stimulus.AdvanceClock) stimulus;
        var target = advance.deadline().orElse(state::nextDeadline);
        if (target.isEmpty()) {
            logger.debug("Clock advance without deadline and nothing waiting for time");
            return;
        }
        var now = state.clock();
        var reached = Math.max(now, target.get());
        if (reached > now) {
            state.clock(reached);
            labels.add(new TransitionLabel.TimeAdvance(reached - now));
        }
        for (var task : state.waitingTasks()) {
            var condition = ((TaskStatus.Waiting) task.status()).condition();
            if (condition instanceof WaitCondition.Until until && until.deadline() <= reached) {
                wake(state, task);
            }
        }
    }

    private static void wake(MachineState state, Task task) {
        logger.debug("Waking task " + task.id());
        state.wake(task);
    }
}
