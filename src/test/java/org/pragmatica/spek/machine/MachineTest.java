package org.pragmatica.spek.machine;

import io.vavr.control.Option;
import org.junit.jupiter.api.Test;
import org.pragmatica.spek.Spek;
import org.pragmatica.spek.printer.Printer;
import org.pragmatica.spek.program.MachineProgram;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class MachineTest {

    private final Machine machine = Machine.create();

    private static MachineProgram compile(String source) {
        var result = Spek.compile(source);
        assertTrue(result.isRight(), () -> "Unexpected error: " + result.getLeft().message());
        return result.get();
    }

    private MachineState settle(String source) {
        return machine.runUntilQuiescent(machine.load(compile(source))).state();
    }

    private Value global(MachineState state, String name) {
        return machine.observe(state)
                      .global(name)
                      .getOrElseThrow(() -> new AssertionError("no global " + name));
    }

    @Test
    void load_startsScriptAsFirstRunnableTask() {
        var state = machine.load(compile("var x = 1\n"));

        assertThat(state.runQueue()).containsExactly(1);
        assertTrue(state.hasRunnable());
        assertEquals(0.0, state.clock());
        assertEquals(Value.NONE, global(state, "x"));
    }

    @Test
    void advanceClock_withoutDeadline_wakesEarliestDeadlineFirst() {
        var state = settle("""
            var trace = ""
            def sleeper(d, tag):
                await delay d
                trace = trace + tag
            async sleeper(1, "a")
            async sleeper(2, "b")
            """);

        assertEquals(Value.string(""), global(state, "trace"));
        assertTrue(state.isQuiescent());
        assertEquals(Option.some(1.0), state.nextDeadline());

        var first = machine.advanceClock(state, Option.none());
        assertEquals(Value.string("a"), global(first.state(), "trace"));
        assertEquals(1.0, first.state().clock());
        assertThat(first.observableLabels()).containsExactly(new TransitionLabel.TimeAdvance(1.0),
                                                              new TransitionLabel.TaskCompleted(2));

        var second = machine.advanceClock(first.state(), Option.none());
        assertEquals(Value.string("ab"), global(second.state(), "trace"));
        assertEquals(2.0, second.state().clock());
        assertThat(second.observableLabels()).containsExactly(new TransitionLabel.TimeAdvance(1.0),
                                                               new TransitionLabel.TaskCompleted(3));
        assertTrue(second.state().nextDeadline().isEmpty());
    }

    @Test
    void advanceClock_neverMovesBackwards() {
        var state = settle("""
            var woke = False
            await delay 3
            woke = True
            """);

        var partial = machine.advanceClock(state, Option.some(1.5));
        assertEquals(1.5, partial.state().clock());
        assertEquals(Value.FALSE, global(partial.state(), "woke"));

        var backwards = machine.advanceClock(partial.state(), Option.some(0.5));
        assertEquals(1.5, backwards.state().clock());
        assertThat(backwards.observableLabels()).isEmpty();

        var rest = machine.advanceClock(backwards.state(), Option.none());
        assertEquals(3.0, rest.state().clock());
        assertEquals(Value.TRUE, global(rest.state(), "woke"));
        assertThat(rest.observableLabels()).startsWith(new TransitionLabel.TimeAdvance(1.5));
    }

    @Test
    void advanceClock_withNothingWaiting_leavesStateUnchanged() {
        var state = settle("var x = 1\n");

        var result = machine.advanceClock(state, Option.none());

        assertEquals(0.0, result.state().clock());
        assertThat(result.labels()).isEmpty();
        assertEquals(Printer.print(state), Printer.print(result.state()));
    }

    @Test
    void deliverEvent_resumesOnlyMatchingWaiter() {
        var state = settle("""
            var moves = 0
            await event "advance"
            moves = moves + 1
            """);

        assertThat(state.waitedEvents()).containsExactly("advance");

        var ignored = machine.deliverEvent(state, "click");
        assertEquals(Value.integer(0), global(ignored.state(), "moves"));
        assertThat(ignored.observableLabels()).containsExactly(new TransitionLabel.Event("click"));

        var delivered = machine.deliverEvent(ignored.state(), "advance");
        assertEquals(Value.integer(1), global(delivered.state(), "moves"));
        assertThat(delivered.observableLabels()).containsExactly(new TransitionLabel.Event("advance"),
                                                                  new TransitionLabel.TaskCompleted(1));
        assertThat(delivered.state().waitedEvents()).isEmpty();
    }

    @Test
    void deliverEvent_wakesWaitersInWaitingOrder() {
        var state = settle("""
            var trace = ""
            def listen(tag):
                await event "go"
                trace = trace + tag
            async listen("x")
            async listen("y")
            async listen("z")
            """);

        var result = machine.deliverEvent(state, "go");

        assertEquals(Value.string("xyz"), global(result.state(), "trace"));
        assertThat(result.observableLabels()).containsExactly(new TransitionLabel.Event("go"),
                                                               new TransitionLabel.TaskCompleted(2),
                                                               new TransitionLabel.TaskCompleted(3),
                                                               new TransitionLabel.TaskCompleted(4));
    }

    @Test
    void runUntilQuiescent_runsSpawnedTasksInSpawnOrder() {
        var state = settle("""
            var trace = ""
            def mark(tag):
                trace = trace + tag
            async mark("1")
            async mark("2")
            trace = trace + "0"
            """);

        assertEquals(Value.string("012"), global(state, "trace"));
    }

    @Test
    void step_runsOneFragmentOfHeadTask() {
        var loaded = machine.load(compile("""
            var phase = 0
            await delay 1
            phase = 1
            """));

        var first = machine.step(loaded, Option.none());
        assertThat(first.labels()).containsExactly(TransitionLabel.PRIVATE);
        assertFalse(first.state().hasRunnable());
        assertEquals(Value.integer(0), global(first.state(), "phase"));

        var idle = machine.step(first.state(), Option.none());
        assertThat(idle.labels()).isEmpty();

        var woken = machine.step(first.state(), Option.some(Stimulus.advance()));
        assertThat(woken.observableLabels()).containsExactly(new TransitionLabel.TimeAdvance(1.0),
                                                              new TransitionLabel.TaskCompleted(1));
        assertEquals(Value.integer(1), global(woken.state(), "phase"));
    }

    @Test
    void step_withEventOnQuiescentState_runsWokenTaskInSameStep() {
        var state = settle("""
            var seen = False
            await event "advance"
            seen = True
            """);

        var result = machine.step(state, Option.some(Stimulus.event("advance")));

        assertThat(result.observableLabels()).containsExactly(new TransitionLabel.Event("advance"),
                                                               new TransitionLabel.TaskCompleted(1));
        assertEquals(Value.TRUE, global(result.state(), "seen"));
        assertFalse(result.state().hasRunnable());
        assertThat(result.state().pending()).isEmpty();
    }

    @Test
    void step_queuesStimulusWhileTasksAreRunnable() {
        var loaded = machine.load(compile("""
            var hits = 0
            def spin():
                await event "tick"
                hits = hits + 1
            async spin()
            """));

        var result = machine.step(loaded, Option.some(Stimulus.event("tick")));

        assertThat(result.observableLabels()).containsExactly(new TransitionLabel.TaskCompleted(1));
        assertThat(result.state().pending()).containsExactly(Stimulus.event("tick"));

        var settled = machine.runUntilQuiescent(result.state());
        assertEquals(Value.integer(1), global(settled.state(), "hits"));
        assertThat(settled.state().pending()).isEmpty();
    }

    @Test
    void step_doesNotChangeGivenState() {
        var loaded = machine.load(compile("var x = 5\n"));
        var before = Printer.print(loaded);

        machine.runUntilQuiescent(loaded);

        assertEquals(before, Printer.print(loaded));
    }

    @Test
    void execution_isDeterministic() {
        var source = """
            var log = []
            def worker(n):
                var i = 0
                while i < n:
                    await delay 1
                    log.append(n * 10 + i)
                    i += 1
            async worker(2)
            async worker(3)
            """;

        var first = settle(source);
        var second = settle(source);
        for (int i = 0; i < 3; i++) {
            first = machine.advanceClock(first, Option.none()).state();
            second = machine.advanceClock(second, Option.none()).state();
        }

        assertEquals(Printer.print(first), Printer.print(second));
        var log = machine.observe(first).object(global(first, "log")).get();
        assertThat(log.contents().values()).containsExactly(Value.integer(20), Value.integer(30),
                                                            Value.integer(21), Value.integer(31),
                                                            Value.integer(32));
    }

    @Test
    void failure_isConfinedToFailingTask() {
        var state = settle("""
            var done = False
            def crash():
                var xs = [1]
                return xs[5]
            def finish():
                done = True
            async crash()
            async finish()
            """);

        assertEquals(Value.TRUE, global(state, "done"));
        var crashed = state.task(2).get();
        var failed = assertInstanceOf(TaskStatus.Failed.class, crashed.status());
        assertEquals("index 5 out of range for length 1", failed.failure().reason());
        assertEquals(2, failed.failure().taskId());
        assertEquals(4, failed.failure().span().start().line());
    }

    @Test
    void failure_isReportedAsLabel() {
        var result = machine.runUntilQuiescent(machine.load(compile("""
            var d = {"a": 1}
            var missing = d["b"]
            """)));

        assertThat(result.observableLabels()).containsExactly(new TransitionLabel.TaskFailed(1, "key \"b\" not found"));
    }

    @Test
    void assignment_toGetterOnlyPropertyAtRuntime_failsTask() {
        var state = settle("""
            class Box:
                prop width:
                    get:
                        return 1
            class Panel:
                var w = 0
                prop width:
                    get:
                        return self.w
                    set value:
                        self.w = value
            var b = Box()
            b.width = 2
            """);

        var failed = assertInstanceOf(TaskStatus.Failed.class, state.task(1).get().status());
        assertEquals("assignment to 'width'", failed.failure().operation());
        assertEquals("property has no setter", failed.failure().reason());
    }

    @Test
    void assignment_toGetterOnlyProperty_isRejectedBeforeExecution() {
        var result = Spek.compile("""
            class Box:
                prop width:
                    get:
                        return 1
            var b = Box()
            b.width = 2
            """);

        assertTrue(result.isLeft());
        assertThat(result.getLeft().diagnostics()).anyMatch(diagnostic -> diagnostic.code().equals("E0302"));
    }

    @Test
    void attributeLookup_followsDelegationChain() {
        var state = settle("""
            class Engine:
                var power = 5
                def describe():
                    return "engine " + str(self.power)
            class Car:
                var engine = Engine()
                delegate engine
            var car = Car()
            var text = car.describe()
            var power = car.power
            car.power = 7
            var changed = car.engine.power
            """);

        assertEquals(Value.string("engine 5"), global(state, "text"));
        assertEquals(Value.integer(5), global(state, "power"));
        assertEquals(Value.integer(7), global(state, "changed"));
    }

    @Test
    void classes_runInitialisersThenConstructor() {
        var state = settle("""
            class Base:
                var x = 1
                def init(start):
                    self.x = self.x + start
            class Derived(Base):
                var y = 10
                prop sum:
                    get:
                        return self.x + self.y
            var d = Derived(4)
            var total = d.sum
            """);

        assertEquals(Value.integer(15), global(state, "total"));
    }

    @Test
    void moduleProperty_routesThroughAccessors() {
        var state = settle("""
            var backing = 0
            prop level:
                get:
                    return backing * 2
                set value:
                    backing = value + 1
            level = 3
            var seen = level
            """);

        assertEquals(Value.integer(4), global(state, "backing"));
        assertEquals(Value.integer(8), global(state, "seen"));
    }

    @Test
    void builtins_computeExpectedValues() {
        var state = settle("""
            var a = len("hello")
            var b = str([1, "x", None])
            var c = max(3, 7, 5)
            var d = min(4, 2)
            var e = int("42") + abs(-3)
            var f = 0
            for i in range(4):
                f += i
            var g = float(1) / 4
            """);

        assertEquals(Value.integer(5), global(state, "a"));
        assertEquals(Value.string("[1, \"x\", None]"), global(state, "b"));
        assertEquals(Value.integer(7), global(state, "c"));
        assertEquals(Value.integer(2), global(state, "d"));
        assertEquals(Value.integer(45), global(state, "e"));
        assertEquals(Value.integer(6), global(state, "f"));
        assertEquals(Value.real(0.25), global(state, "g"));
    }

    @Test
    void now_readsVirtualClock() {
        var state = settle("""
            var stamp = 0
            await delay 2.5
            stamp = now()
            """);

        var result = machine.advanceClock(state, Option.none());

        assertEquals(Value.real(2.5), global(result.state(), "stamp"));
    }

    @Test
    void negativeDelay_failsTask() {
        var state = settle("""
            var d = 0 - 1
            await delay d
            """);

        var failed = assertInstanceOf(TaskStatus.Failed.class, state.task(1).get().status());
        assertEquals("await delay", failed.failure().operation());
    }

    @Test
    void callDepth_isLimited() {
        var limited = Machine.create(new MachineConfig(10, 100_000, true));
        var state = limited.runUntilQuiescent(limited.load(compile("""
            def down(n):
                return down(n + 1)
            down(0)
            """))).state();

        var failed = assertInstanceOf(TaskStatus.Failed.class, state.task(1).get().status());
        assertEquals("call depth limit of 10 exceeded", failed.failure().reason());
    }

    @Test
    void stringRepetition_pastLengthLimit_failsTask() {
        var state = settle("var s = \"ab\" * 9223372036854775807\n");

        var failed = assertInstanceOf(TaskStatus.Failed.class, state.task(1).get().status());
        assertEquals("'*'", failed.failure().operation());
        assertThat(failed.failure().reason()).startsWith("cannot repeat a str of length 2");
    }

    @Test
    void str_ofDeeplyNestedList_failsTaskInsteadOfOverflowingStack() {
        var source = """
            var l = []
            var i = 0
            while i < 30000:
                l = [l]
                i += 1
            var caught = False
            try:
                str(l)
            except RecursionError:
                caught = True
            var s = str(l)
            """;

        var state = settle(source);

        assertEquals(Value.TRUE, global(state, "caught"));
        var failed = assertInstanceOf(TaskStatus.Failed.class, state.task(1).get().status());
        assertEquals("str", failed.failure().operation());
        assertEquals("nested too deeply, the limit is 1000 levels", failed.failure().reason());
    }

    @Test
    void attributeLookup_throughOverlongDelegationChain_failsTask() {
        var state = settle("""
            class Link:
                var next = None
                delegate next
                def init(n):
                    self.next = n
            var chain = Link(None)
            var i = 0
            while i < 3000:
                chain = Link(chain)
                i += 1
            var found = chain.missing
            """);

        var failed = assertInstanceOf(TaskStatus.Failed.class, state.task(1).get().status());
        assertEquals("attribute 'missing'", failed.failure().operation());
        assertEquals("delegation chain longer than 1000 objects", failed.failure().reason());
    }

    @Test
    void deeplyNestedTuple_failsTask() {
        var state = settle("""
            var t = ()
            var i = 0
            while i < 500:
                t = (t,)
                i += 1
            """);

        var failed = assertInstanceOf(TaskStatus.Failed.class, state.task(1).get().status());
        assertEquals("nested too deeply, the limit is 100 levels", failed.failure().reason());
    }

    @Test
    void dictionaryKeys_thatCompareEqual_selectSameEntry() {
        var state = settle("""
            var d = {1: "a", 1.5: "half"}
            var x = d[1.0]
            d[2.0] = "b"
            var y = d[2]
            var n = len(d)
            var hit = 1.0 in d
            var half = d[1.5]
            var pairs = {(1, 2.0): "p"}
            var z = pairs[(1.0, 2)]
            """);

        assertEquals(Value.string("a"), global(state, "x"));
        assertEquals(Value.string("b"), global(state, "y"));
        assertEquals(Value.integer(3), global(state, "n"));
        assertEquals(Value.TRUE, global(state, "hit"));
        assertEquals(Value.string("half"), global(state, "half"));
        assertEquals(Value.string("p"), global(state, "z"));
    }

    @Test
    void tuples_behaveAsImmutableSequences() {
        var state = settle("""
            var t = (1, "two", 3.0)
            var n = len(t)
            var second = t[1]
            var last = t[-1]
            var joined = (1,) + (2, 3)
            var doubled = (0, 1) * 2
            var same = (1, 2) == (1.0, 2)
            var less = (1, 2) < (1, 3)
            var total = 0
            for x in (4, 5, 6):
                total += x
            var text = str((1, "a"))
            var single = str((1,))
            var empty = not ()
            var built = tuple([1, 2])
            var largest = max((3, 9, 4))
            """);

        assertEquals(Value.integer(3), global(state, "n"));
        assertEquals(Value.string("two"), global(state, "second"));
        assertEquals(Value.real(3.0), global(state, "last"));
        assertEquals(new Value.Tuple(List.of(Value.integer(1), Value.integer(2), Value.integer(3))),
                     global(state, "joined"));
        assertEquals(new Value.Tuple(List.of(Value.integer(0), Value.integer(1), Value.integer(0), Value.integer(1))),
                     global(state, "doubled"));
        assertEquals(Value.TRUE, global(state, "same"));
        assertEquals(Value.TRUE, global(state, "less"));
        assertEquals(Value.integer(15), global(state, "total"));
        assertEquals(Value.string("(1, \"a\")"), global(state, "text"));
        assertEquals(Value.string("(1,)"), global(state, "single"));
        assertEquals(Value.TRUE, global(state, "empty"));
        assertEquals(new Value.Tuple(List.of(Value.integer(1), Value.integer(2))), global(state, "built"));
        assertEquals(Value.integer(9), global(state, "largest"));
    }

    @Test
    void tupleItemAssignment_failsTask() {
        var state = settle("""
            var t = (1, 2)
            t[0] = 5
            """);

        var failed = assertInstanceOf(TaskStatus.Failed.class, state.task(1).get().status());
        assertEquals("'tuple' does not support item assignment", failed.failure().reason());
    }

    @Test
    void membershipAndIdentity_followOperands() {
        var state = settle("""
            var xs = [1, 2, 3]
            var a = 2 in xs
            var b = 5 not in xs
            var c = "ell" in "hello"
            var d = "k" in {"k": 1}
            var e = 2.0 in (1, 2)
            var f = xs is xs
            var g = xs is [1, 2, 3]
            var h = None is None
            var i = xs is not None
            var k = not 1 == 2
            """);

        for (var name : List.of("a", "b", "c", "d", "e", "f", "h", "i", "k")) {
            assertEquals(Value.TRUE, global(state, name), name);
        }
        assertEquals(Value.FALSE, global(state, "g"));
    }

    @Test
    void runawayLoop_failsInsteadOfHanging() {
        var limited = Machine.create(new MachineConfig(200, 50, true));
        var state = limited.runUntilQuiescent(limited.load(compile("""
            while True:
                pass
            """))).state();

        var failed = assertInstanceOf(TaskStatus.Failed.class, state.task(1).get().status());
        assertEquals("more than 50 fragments without suspending", failed.failure().reason());
    }

    @Test
    void unreachableObjects_areReleasedAtQuiescence() {
        var state = settle("""
            var xs = [1, 2]
            xs = [3]
            var d = {"k": [4, 5]}
            d = None
            """);

        assertEquals(1, state.heap().size());
        var snapshot = machine.observe(state);
        assertThat(snapshot.objects()).hasSize(1);
        assertThat(snapshot.object(global(state, "xs")).get().contents().values()).containsExactly(Value.integer(3));
    }

    @Test
    void terminatedTasks_areDroppedWhenNotRetained() {
        var draining = Machine.create(new MachineConfig(200, 100_000, false));
        var state = draining.runUntilQuiescent(draining.load(compile("""
            def tick():
                await delay 1
            async tick()
            """))).state();

        assertThat(state.tasks().stream().map(Task::id).toList()).containsExactly(2);

        var retained = settle("""
            def tick():
                await delay 1
            async tick()
            """);
        assertThat(retained.tasks().stream().map(Task::id).toList()).containsExactly(1, 2);
        assertInstanceOf(TaskStatus.Completed.class, retained.task(1).get().status());
    }

    @Test
    void observe_reportsTasksAndObjects() {
        var state = settle("""
            class Dot:
                var x = 3
            var dot = Dot()
            await event "never"
            """);

        var snapshot = machine.observe(state);

        var dot = snapshot.object(global(state, "dot")).get();
        assertEquals("Dot", dot.kind());
        assertEquals(Option.some(Value.integer(3)), dot.get("x"));
        var task = snapshot.task(1).get();
        assertTrue(snapshot.task(9).isEmpty());
        assertInstanceOf(TaskStatus.Waiting.class, task.status());
    }
}
