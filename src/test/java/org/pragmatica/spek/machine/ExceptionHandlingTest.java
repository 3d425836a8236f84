package org.pragmatica.spek.machine;

import org.junit.jupiter.api.Test;
import org.pragmatica.spek.Spek;
import org.pragmatica.spek.program.MachineProgram;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ExceptionHandlingTest {

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

    private Iterable<Value> elements(MachineState state, String name) {
        return machine.observe(state).object(global(state, name)).get().contents().values();
    }

    @Test
    void typedClause_catchesRuntimeFaultAndBindsException() {
        var state = settle("""
            var caught = ""
            var message = ""
            try:
                var xs = [1]
                var v = xs[3]
                caught = "unreached"
            except IndexError as e:
                caught = "index"
                message = e.message
            """);

        assertInstanceOf(TaskStatus.Completed.class, state.task(1).get().status());
        assertEquals(Value.string("index"), global(state, "caught"));
        assertEquals(Value.string("index 3 out of range for length 1"), global(state, "message"));
    }

    @Test
    void clauses_areTriedInOrder() {
        var state = settle("""
            var order = ""
            try:
                var z = 1 // 0
            except KeyError:
                order = "key"
            except Exception as e:
                order = "any " + str(e)
            except:
                order = "bare"
            """);

        assertEquals(Value.string("any division by zero"), global(state, "order"));
    }

    @Test
    void uncaughtRaise_failsTaskWithExceptionType() {
        var result = machine.runUntilQuiescent(machine.load(compile("""
            def check(n):
                if n < 0:
                    raise ValueError("negative")
                return n
            var ok = check(1)
            var bad = check(-1)
            """)));

        assertEquals(Value.integer(1), global(result.state(), "ok"));
        var failed = assertInstanceOf(TaskStatus.Failed.class, result.state().task(1).get().status());
        assertEquals("ValueError", failed.failure().operation());
        assertEquals("negative", failed.failure().reason());
        assertEquals(3, failed.failure().span().start().line());
        assertThat(result.observableLabels()).containsExactly(new TransitionLabel.TaskFailed(1, "negative"));
    }

    @Test
    void unmatchedException_propagatesPastClauses() {
        var state = settle("""
            var reached = False
            try:
                raise KeyError("k")
            except ValueError:
                reached = True
            """);

        assertEquals(Value.FALSE, global(state, "reached"));
        var failed = assertInstanceOf(TaskStatus.Failed.class, state.task(1).get().status());
        assertEquals("KeyError", failed.failure().operation());
    }

    @Test
    void finallyBody_runsOnEveryExitPath() {
        var state = settle("""
            var log = []
            def guarded(mode):
                var i = 0
                while i < 3:
                    i += 1
                    try:
                        if mode == "break":
                            break
                        if mode == "continue":
                            continue
                        if mode == "return":
                            return "returned"
                        if mode == "raise":
                            raise RuntimeError("boom")
                    finally:
                        log.append(mode)
                return "done"
            var a = guarded("normal")
            var b = guarded("break")
            var c = guarded("continue")
            var d = guarded("return")
            var e = ""
            try:
                guarded("raise")
            except RuntimeError as err:
                e = err.message
            """);

        assertEquals(Value.string("done"), global(state, "a"));
        assertEquals(Value.string("done"), global(state, "b"));
        assertEquals(Value.string("done"), global(state, "c"));
        assertEquals(Value.string("returned"), global(state, "d"));
        assertEquals(Value.string("boom"), global(state, "e"));
        assertThat(elements(state, "log")).containsExactly(
            Value.string("normal"), Value.string("normal"), Value.string("normal"),
            Value.string("break"),
            Value.string("continue"), Value.string("continue"), Value.string("continue"),
            Value.string("return"),
            Value.string("raise"));
    }

    @Test
    void returnedValue_isFixedBeforeFinallyRuns() {
        var state = settle("""
            var counter = 1
            def read():
                try:
                    return counter
                finally:
                    counter = 99
            var seen = read()
            """);

        assertEquals(Value.integer(1), global(state, "seen"));
        assertEquals(Value.integer(99), global(state, "counter"));
    }

    @Test
    void bareRaise_rethrowsHandledException() {
        var state = settle("""
            var seen = ""
            var outer = ""
            var kind = False
            def inner():
                try:
                    raise KeyError("k")
                except KeyError:
                    seen = "inner"
                    raise
            try:
                inner()
            except Exception as e:
                outer = e.message
                kind = isinstance(e, KeyError)
            """);

        assertEquals(Value.string("inner"), global(state, "seen"));
        assertEquals(Value.string("k"), global(state, "outer"));
        assertEquals(Value.TRUE, global(state, "kind"));
    }

    @Test
    void exceptionInClause_runsFinallyThenReachesOuterHandler() {
        var state = settle("""
            var log = []
            try:
                try:
                    raise ValueError("first")
                except ValueError:
                    raise KeyError("second")
                finally:
                    log.append("cleanup")
            except KeyError as e:
                log.append(e.message)
            """);

        assertThat(elements(state, "log")).containsExactly(Value.string("cleanup"), Value.string("second"));
    }

    @Test
    void raisingNonException_isTypeError() {
        var state = settle("""
            var message = ""
            var bare = ""
            try:
                raise 5
            except TypeError as e:
                message = e.message
            try:
                raise ValueError
            except ValueError as e:
                bare = str(isinstance(e, (KeyError, ValueError)))
            """);

        assertEquals(Value.string("exceptions must derive from Exception, not int"), global(state, "message"));
        assertEquals(Value.string("True"), global(state, "bare"));
    }

    @Test
    void exhaustedFuel_cannotBeCaught() {
        var limited = Machine.create(new MachineConfig(200, 50, true));
        var state = limited.runUntilQuiescent(limited.load(compile("""
            var caught = False
            try:
                while True:
                    pass
            except Exception:
                caught = True
            """))).state();

        var failed = assertInstanceOf(TaskStatus.Failed.class, state.task(1).get().status());
        assertEquals("more than 50 fragments without suspending", failed.failure().reason());
        assertEquals(Value.FALSE, limited.observe(state).global("caught").get());
    }

    @Test
    void callDepthLimit_isCatchableAsRecursionError() {
        var limited = Machine.create(new MachineConfig(10, 100_000, true));
        var state = limited.runUntilQuiescent(limited.load(compile("""
            var caught = ""
            def down(n):
                return down(n + 1)
            try:
                down(0)
            except RecursionError as e:
                caught = e.message
            """))).state();

        assertInstanceOf(TaskStatus.Completed.class, state.task(1).get().status());
        assertEquals(Value.string("call depth limit of 10 exceeded"), limited.observe(state).global("caught").get());
    }

    @Test
    void handlerInsideSuspendingTask_survivesResumption() {
        var state = settle("""
            var outcome = ""
            def worker():
                try:
                    await event "go"
                    raise ValueError("late")
                except ValueError as e:
                    outcome = e.message
            async worker()
            """);

        var result = machine.deliverEvent(state, "go");

        assertEquals(Value.string("late"), global(result.state(), "outcome"));
        assertInstanceOf(TaskStatus.Completed.class, result.state().task(2).get().status());
    }
}
