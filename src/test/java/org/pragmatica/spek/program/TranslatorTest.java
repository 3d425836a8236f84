package org.pragmatica.spek.program;

import org.junit.jupiter.api.Test;
import org.pragmatica.spek.syntax.Parser;
import org.pragmatica.spek.syntax.Statement.WaitKind;
import org.pragmatica.spek.validation.Validator;

import java.util.ArrayDeque;
import java.util.HashSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TranslatorTest {

    private static MachineProgram translate(String source) {
        var result = Parser.parse(source)
                           .flatMap(Validator::validate)
                           .flatMap(Translator::translate);
        assertTrue(result.isRight(), () -> "Unexpected error: " + result.getLeft().message());
        return result.get();
    }

    /**
     * Every fragment has a terminator, every successor and handler exists and every fragment is reachable from
     * fragment 0.
     */
    private static void assertWellFormed(CodeUnit unit) {
        var fragments = unit.fragments();
        for (int i = 0; i < fragments.size(); i++) {
            assertEquals(i, fragments.get(i).index(), "fragment index in " + unit.name());
            assertNotNull(fragments.get(i).terminator());
            for (var successor : fragments.get(i).terminator().successors()) {
                assertThat(successor).isBetween(0, fragments.size() - 1);
            }
            fragments.get(i).handler().forEach(handler -> assertThat(handler.target()).isBetween(0, fragments.size() - 1));
        }
        var reached = new HashSet<Integer>();
        var work = new ArrayDeque<Integer>();
        work.push(0);
        while (!work.isEmpty()) {
            var index = work.pop();
            if (reached.add(index)) {
                unit.fragment(index).terminator().successors().forEach(work::push);
                unit.fragment(index).handler().forEach(handler -> work.push(handler.target()));
            }
        }
        assertEquals(fragments.size(), reached.size(), "unreachable fragment in " + unit.name());
    }

    @Test
    void translate_straightLineScript_isSingleFragment() {
        var program = translate("""
            var x = 1
            x = x + 1
            """);

        var script = program.unit(Translator.SCRIPT);
        assertEquals(UnitKind.SCRIPT, script.kind());
        assertThat(script.fragments()).hasSize(1);
        assertThat(script.fragment(0).instructions()).hasSize(2)
                                                     .allMatch(Instruction.StoreGlobal.class::isInstance);
        assertInstanceOf(Terminator.Return.class, script.fragment(0).terminator());
        assertEquals(0, program.globalSlot("x"));
    }

    @Test
    void translate_await_splitsFragmentAndNamesResumePoint() {
        var program = translate("""
            var x = 0
            await delay 1
            x = 1
            await event "advance"
            x = 2
            """);

        var script = program.unit(Translator.SCRIPT);
        assertThat(script.fragments()).hasSize(3);
        var first = assertInstanceOf(Terminator.Suspend.class, script.fragment(0).terminator());
        assertEquals(WaitKind.DELAY, first.kind());
        assertEquals(1, first.resume());
        var second = assertInstanceOf(Terminator.Suspend.class, script.fragment(1).terminator());
        assertEquals(WaitKind.EVENT, second.kind());
        assertEquals(new Term.StrConstant("advance"), second.operand());
        assertEquals(2, second.resume());
        assertTrue(script.suspends());
        assertWellFormed(script);
    }

    @Test
    void translate_whileLoop_producesHeaderBodyAndExit() {
        var program = translate("""
            var i = 0
            while i < 3:
                i = i + 1
            """);

        var script = program.unit(Translator.SCRIPT);
        assertThat(script.fragments()).hasSize(4);
        assertThat(script.fragment(0).terminator().successors()).containsExactly(1);
        var header = assertInstanceOf(Terminator.Branch.class, script.fragment(1).terminator());
        assertEquals(2, header.ifTrue());
        assertEquals(3, header.ifFalse());
        assertThat(script.fragment(2).terminator().successors()).containsExactly(1);
        assertWellFormed(script);
    }

    @Test
    void translate_breakAndContinue_targetExitAndHeader() {
        var program = translate("""
            var i = 0
            while True:
                i = i + 1
                if i == 2:
                    continue
                if i > 5:
                    break
            """);

        var script = program.unit(Translator.SCRIPT);
        assertWellFormed(script);
        var header = (Terminator.Branch) script.fragment(1).terminator();
        var jumps = script.fragments()
                          .stream()
                          .map(Fragment::terminator)
                          .filter(Terminator.Jump.class::isInstance)
                          .map(terminator -> ((Terminator.Jump) terminator).target())
                          .toList();
        assertThat(jumps).contains(1, header.ifFalse());
    }

    @Test
    void translate_tryBody_runsUnderHandlerThatDispatchesOnType() {
        var program = translate("""
            var caught = False
            try:
                var x = 1 // 0
            except ZeroDivisionError as e:
                caught = True
            """);

        var script = program.unit(Translator.SCRIPT);
        assertWellFormed(script);
        var guarded = script.fragments().stream().filter(fragment -> fragment.handler().isDefined()).toList();
        assertThat(guarded).isNotEmpty();
        var handler = guarded.get(0).handler().get();
        var dispatch = assertInstanceOf(Terminator.Branch.class, script.fragment(handler.target()).terminator());
        var test = assertInstanceOf(Term.Call.class, dispatch.condition());
        assertEquals(new Term.BuiltinRef(Translator.ISINSTANCE), test.callee());
        assertEquals(new Term.Local(handler.slot(), script.slots().get(handler.slot())), test.arguments().get(0));
        assertTrue(script.fragments().stream().anyMatch(fragment -> fragment.terminator() instanceof Terminator.Raise));
    }

    @Test
    void translate_finally_isCopiedOntoEachExit() {
        var program = translate("""
            var log = []
            def f(n):
                while True:
                    try:
                        if n:
                            break
                        if n == 2:
                            return 1
                    finally:
                        log.append(n)
            """);

        var unit = program.unit("f");
        assertWellFormed(unit);
        var copies = unit.fragments()
                         .stream()
                         .flatMap(fragment -> fragment.instructions().stream())
                         .filter(Instruction.Evaluate.class::isInstance)
                         .count();
        assertEquals(4, copies);
    }

    @Test
    void translate_unreachableCode_isPruned() {
        var program = translate("""
            def sign(n):
                if n < 0:
                    return -1
                else:
                    return 1

            def first(a):
                return a
                a = 2
            """);

        var sign = program.unit("sign");
        assertThat(sign.fragments()).hasSize(3);
        assertWellFormed(sign);
        assertThat(program.unit("first").fragments()).hasSize(1);
    }

    @Test
    void translate_forLoop_usesHiddenSlots() {
        var program = translate("""
            def total(xs):
                var sum = 0
                for x in xs:
                    sum = sum + x
                return sum
            """);

        var unit = program.unit("total");
        assertEquals(1, unit.arity());
        assertFalse(unit.receiver());
        assertThat(unit.slots()).startsWith("xs", "sum");
        assertThat(unit.slots()).anyMatch(slot -> slot.startsWith("$seq"))
                                .anyMatch(slot -> slot.startsWith("$index"))
                                .contains("x");
        assertWellFormed(unit);
    }

    @Test
    void translate_async_becomesSpawnInstruction() {
        var program = translate("""
            def tick(n):
                await delay n
            async tick(2)
            """);

        var spawn = assertInstanceOf(Instruction.Spawn.class, program.unit(Translator.SCRIPT).fragment(0).instructions().get(0));
        assertEquals(new Term.FunctionRef("tick"), spawn.callee());
        assertEquals(1, spawn.arguments().size());
        assertEquals(UnitKind.FUNCTION, program.unit("tick").kind());
    }

    @Test
    void translate_classes_flattenInheritance() {
        var program = translate("""
            class Base:
                var x = 1
                def show():
                    return self.x
                def init():
                    pass
            class Derived(Base):
                var y = 2
                def show():
                    return self.y
                prop total:
                    get:
                        return self.x + self.y
            """);

        var base = program.classLayout("Base").get();
        var derived = program.classLayout("Derived").get();
        assertThat(derived.fields()).containsExactly("x", "y");
        assertEquals("Derived.show", derived.methods().get("show"));
        assertEquals("Base.init", derived.methods().get("init"));
        assertThat(derived.fieldInitialisers()).containsExactly("Base.<fields>", "Derived.<fields>");
        assertEquals("Base.init", derived.constructor().get());
        assertEquals("Base.init", base.constructor().get());
        assertEquals("Derived.total.get", derived.properties().get("total").getter());
        assertTrue(derived.properties().get("total").setter().isEmpty());

        var method = program.unit("Derived.show");
        assertEquals(UnitKind.METHOD, method.kind());
        assertTrue(method.receiver());
        assertEquals("self", method.slots().get(0));
        assertEquals(UnitKind.FIELDS, program.unit("Derived.<fields>").kind());
        assertEquals(UnitKind.GETTER, program.unit("Derived.total.get").kind());
    }

    @Test
    void translate_moduleProperty_compilesAccessors() {
        var program = translate("""
            var backing = 0
            prop level:
                get:
                    return backing
                set value:
                    backing = value
            level = 3
            """);

        var property = program.properties().get("level");
        assertEquals("level.get", property.getter());
        assertEquals("level.set", property.setter().get());
        assertEquals(1, program.unit("level.set").arity());
        assertInstanceOf(Instruction.StoreProperty.class, program.unit(Translator.SCRIPT).fragment(0).instructions().get(1));
    }

    @Test
    void translate_globals_areNumberedInEncounterOrder() {
        var program = translate("""
            var b = 1
            var a = 2
            def f():
                return a + b
            """);

        assertThat(program.globals()).containsExactly("b", "a");
        assertThat(program.units().values()).allSatisfy(TranslatorTest::assertWellFormed);
    }
}
