package org.pragmatica.spek.validation;

import org.junit.jupiter.api.Test;
import org.pragmatica.spek.error.CompileError;
import org.pragmatica.spek.error.Diagnostic;
import org.pragmatica.spek.syntax.Expression;
import org.pragmatica.spek.syntax.Parser;
import org.pragmatica.spek.syntax.Statement;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ValidatorTest {

    private static ValidatedModule valid(String source) {
        var result = Parser.parse(source).flatMap(Validator::validate);
        assertTrue(result.isRight(), () -> "Unexpected error: " + result.getLeft().message());
        return result.get();
    }

    private static List<Diagnostic> diagnostics(String source) {
        var result = Parser.parse(source).flatMap(Validator::validate);
        assertTrue(result.isLeft(), "Expected validation to fail");
        var failure = assertInstanceOf(CompileError.ValidationFailure.class, result.getLeft());
        return failure.diagnostics();
    }

    private static List<String> codes(String source) {
        return diagnostics(source).stream()
                                  .map(Diagnostic::code)
                                  .toList();
    }

    @Test
    void validate_wellFormedModule_succeeds() {
        var module = valid("""
            var count = 0

            def bump(step):
                count = count + step
                return count

            class Counter:
                var value = 0
                def inc():
                    self.value = self.value + 1

            bump(2)
            var c = Counter()
            c.inc()
            """);

        assertThat(module.classes()).containsKey("Counter");
    }

    @Test
    void validate_undeclaredName_isReported() {
        var diagnostics = diagnostics("var x = y + 1\n");

        assertThat(diagnostics).hasSize(1);
        assertEquals(DiagnosticCode.UNDECLARED_NAME.code(), diagnostics.get(0).code());
        assertEquals("undeclared name 'y'", diagnostics.get(0).message());
        assertEquals(9, diagnostics.get(0).span().start().column());
    }

    @Test
    void validate_everyUndeclaredName_isReportedInSourceOrder() {
        var diagnostics = diagnostics("""
            a = 1
            var b = c
            d()
            """);

        assertThat(diagnostics).extracting(Diagnostic::message)
                               .containsExactly("undeclared name 'a'", "undeclared name 'c'", "undeclared name 'd'");
    }

    @Test
    void validate_variableUsedBeforeDeclaration_isUndeclared() {
        assertThat(codes("""
            var a = b
            var b = 1
            """)).containsExactly(DiagnosticCode.UNDECLARED_NAME.code());
    }

    @Test
    void validate_functionsAndClasses_areVisibleBeforeDeclaration() {
        valid("""
            var shape = Square()
            var area = compute(shape)

            def compute(s):
                return s.side * s.side

            class Square:
                var side = 2
            """);
    }

    @Test
    void validate_bindsNamesToSymbols() {
        var module = valid("""
            var total = 0
            def add(n):
                var doubled = n * 2
                total = total + doubled
            """);

        var function = (Statement.FunctionDeclaration) module.module().statements().get(1);
        var local = (Statement.VarDeclaration) function.body().get(0);
        var assignment = (Statement.Assignment) function.body().get(1);
        var target = (Expression.Name) assignment.target();

        assertEquals(Symbol.Kind.LOCAL, module.symbol(local).get().kind());
        assertEquals(Symbol.Kind.GLOBAL, module.symbol(target).get().kind());
        assertEquals(Symbol.Kind.PARAMETER, module.symbol(function.parameters().get(0)).get().kind());
    }

    @Test
    void validate_assignmentToGetterOnlyProperty_isReported() {
        var diagnostics = diagnostics("""
            class Box:
                var w = 1
                prop width:
                    get:
                        return self.w
                def shrink():
                    self.width = 0
            """);

        assertThat(diagnostics).hasSize(1);
        var diagnostic = diagnostics.get(0);
        assertEquals(DiagnosticCode.GETTER_ONLY_ASSIGNMENT.code(), diagnostic.code());
        assertEquals("property 'width' has no setter", diagnostic.message());
        assertThat(diagnostic.notes()).anyMatch(note -> note.contains("declare a 'set' clause"));
    }

    @Test
    void validate_assignmentToGetterOnlyModuleProperty_isReported() {
        assertThat(codes("""
            prop now_ms:
                get:
                    return now() * 1000
            now_ms = 5
            """)).containsExactly(DiagnosticCode.GETTER_ONLY_ASSIGNMENT.code());
    }

    @Test
    void validate_assignmentThroughInstance_whenEveryDeclarationIsGetterOnly() {
        assertThat(codes("""
            class Box:
                prop width:
                    get:
                        return 1
            var b = Box()
            b.width = 2
            """)).containsExactly(DiagnosticCode.GETTER_ONLY_ASSIGNMENT.code());
    }

    @Test
    void validate_assignmentThroughInstance_allowedWhenSomeClassHasSetter() {
        valid("""
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
    }

    @Test
    void validate_awaitInAccessorOrConstructor_isReported() {
        assertThat(codes("""
            class Clip:
                def init():
                    await delay 1
                prop ready:
                    get:
                        await event "go"
                        return True
            """)).containsExactly(DiagnosticCode.SUSPENSION_NOT_ALLOWED.code(),
                                  DiagnosticCode.SUSPENSION_NOT_ALLOWED.code());
    }

    @Test
    void validate_plainCallOfSuspendingFunction_isReported() {
        var diagnostics = diagnostics("""
            def blink():
                await delay 1
            async blink()
            blink()
            """);

        assertThat(diagnostics).hasSize(1);
        assertEquals(DiagnosticCode.SYNCHRONOUS_CALL_OF_SUSPENDING.code(), diagnostics.get(0).code());
        assertEquals("function 'blink' suspends and can only be started with 'async'", diagnostics.get(0).message());
        assertEquals(4, diagnostics.get(0).span().start().line());
    }

    @Test
    void validate_plainCallOfSuspendingMethod_isReported() {
        assertThat(codes("""
            class Light:
                def pulse():
                    await delay 1
                def run():
                    self.pulse()
            var l = Light()
            l.pulse()
            """)).containsExactly(DiagnosticCode.SYNCHRONOUS_CALL_OF_SUSPENDING.code(),
                                  DiagnosticCode.SYNCHRONOUS_CALL_OF_SUSPENDING.code());
    }

    @Test
    void validate_awaitInScript_isAllowed() {
        var module = valid("""
            await delay 1
            await event "advance"
            """);

        assertThat(module.module().statements()).hasSize(2);
    }

    @Test
    void validate_suspensionFacts_areRecorded() {
        var module = valid("""
            def quick():
                return 1
            def slow():
                await delay 2
            class Anim:
                def play():
                    await event "go"
            """);

        assertTrue(module.suspends("slow"));
        assertFalse(module.suspends("quick"));
        assertTrue(module.suspends("Anim", "play"));
    }

    @Test
    void validate_delegateMustNameField() {
        var diagnostics = diagnostics("""
            class Proxy:
                var target = None
                delegate target
                delegate missing
                delegate target
            """);

        assertThat(diagnostics).extracting(Diagnostic::code)
                               .containsExactly(DiagnosticCode.INVALID_DELEGATE.code(),
                                                DiagnosticCode.INVALID_DELEGATE.code());
        assertThat(diagnostics.get(0).message()).contains("'missing'");
        assertThat(diagnostics.get(1).message()).contains("more than once");
    }

    @Test
    void validate_duplicateDeclarations_areReported() {
        assertThat(codes("""
            var a = 1
            var a = 2
            def f(x, x):
                return x
            def f():
                pass
            """)).containsExactly(DiagnosticCode.DUPLICATE_DECLARATION.code(),
                                  DiagnosticCode.DUPLICATE_DECLARATION.code(),
                                  DiagnosticCode.DUPLICATE_DECLARATION.code());
    }

    @Test
    void validate_misplacedControlFlow_isReported() {
        assertThat(codes("""
            return 1
            break
            def f():
                continue
            """)).containsExactly(DiagnosticCode.RETURN_OUTSIDE_FUNCTION.code(),
                                  DiagnosticCode.LOOP_CONTROL_OUTSIDE_LOOP.code(),
                                  DiagnosticCode.LOOP_CONTROL_OUTSIDE_LOOP.code());
    }

    @Test
    void validate_bareRaiseOutsideHandler_isReported() {
        assertThat(codes("""
            raise
            def f():
                try:
                    pass
                finally:
                    raise
            """)).containsExactly(DiagnosticCode.RERAISE_OUTSIDE_HANDLER.code(),
                                  DiagnosticCode.RERAISE_OUTSIDE_HANDLER.code());
    }

    @Test
    void validate_untypedExceptBeforeTypedOne_isReported() {
        assertThat(codes("""
            try:
                pass
            except:
                pass
            except KeyError:
                pass
            """)).containsExactly(DiagnosticCode.MISPLACED_CATCH_ALL.code());
    }

    @Test
    void validate_exceptionHandling_bindsVariableAndAcceptsReraise() {
        var module = valid("""
            var last = ""
            try:
                raise ValueError("bad")
            except (KeyError, ValueError) as problem:
                last = problem.message
                raise
            finally:
                last = last + "!"
            """);

        var attempt = (Statement.Try) module.module().statements().get(1);
        var name = attempt.handlers().get(0).name().get();
        assertEquals(Symbol.Kind.GLOBAL, module.symbol(name).get().kind());
    }

    @Test
    void validate_selfOutsideMethod_isReported() {
        assertThat(codes("""
            def f():
                return self
            """)).containsExactly(DiagnosticCode.SELF_OUTSIDE_METHOD.code());
    }

    @Test
    void validate_nestedDeclarations_areReported() {
        assertThat(codes("""
            def outer():
                def inner():
                    pass
            """)).containsExactly(DiagnosticCode.NESTED_DECLARATION.code());
    }

    @Test
    void validate_classHierarchyProblems_areReported() {
        assertThat(codes("""
            class A(Missing):
                pass
            class B(C):
                pass
            class C(B):
                pass
            """)).containsExactly(DiagnosticCode.UNKNOWN_SUPERCLASS.code(),
                                  DiagnosticCode.INHERITANCE_CYCLE.code(),
                                  DiagnosticCode.INHERITANCE_CYCLE.code());
    }

    @Test
    void validate_unknownSelfMember_isReported() {
        var diagnostics = diagnostics("""
            class Dot:
                var x = 0
                def move():
                    self.y = 1
            """);

        assertEquals(DiagnosticCode.UNKNOWN_MEMBER.code(), diagnostics.get(0).code());
        assertEquals("class 'Dot' has no member 'y'", diagnostics.get(0).message());
    }

    @Test
    void validate_inheritedMembers_areKnown() {
        valid("""
            class Base:
                var x = 0
                def show():
                    return self.x
            class Derived(Base):
                def move():
                    self.x = self.show() + 1
            """);
    }

    @Test
    void validate_fieldInitialiserReadingLaterField_isReported() {
        assertThat(codes("""
            class Pair:
                var first = self.second
                var second = 2
            """)).containsExactly(DiagnosticCode.FORWARD_FIELD_REFERENCE.code());
    }

    @Test
    void validate_arityMismatch_isReported() {
        var diagnostics = diagnostics("""
            def two(a, b):
                return a
            class Point:
                def init(x, y):
                    pass
            two(1)
            var p = Point(1, 2, 3)
            """);

        assertThat(diagnostics).extracting(Diagnostic::code)
                               .containsExactly(DiagnosticCode.ARITY_MISMATCH.code(),
                                                DiagnosticCode.ARITY_MISMATCH.code());
        assertEquals("'two' takes 2 argument(s) but 1 were given", diagnostics.get(0).message());
    }

    @Test
    void validate_assignmentToFunctionOrBuiltin_isReported() {
        assertThat(codes("""
            def f():
                pass
            f = 1
            len = 2
            """)).containsExactly(DiagnosticCode.INVALID_ASSIGNMENT_TARGET.code(),
                                  DiagnosticCode.INVALID_ASSIGNMENT_TARGET.code());
    }
}
