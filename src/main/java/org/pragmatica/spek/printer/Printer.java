package org.pragmatica.spek.printer;

import org.pragmatica.spek.machine.HeapObject;
import org.pragmatica.spek.machine.MachineState;
import org.pragmatica.spek.machine.Stimulus;
import org.pragmatica.spek.machine.Task;
import org.pragmatica.spek.machine.TaskStatus;
import org.pragmatica.spek.machine.TransitionLabel;
import org.pragmatica.spek.machine.Value;
import org.pragmatica.spek.machine.Values;
import org.pragmatica.spek.machine.WaitCondition;
import org.pragmatica.spek.program.ClassLayout;
import org.pragmatica.spek.program.CodeUnit;
import org.pragmatica.spek.program.Fragment;
import org.pragmatica.spek.program.Instruction;
import org.pragmatica.spek.program.MachineProgram;
import org.pragmatica.spek.program.Term;
import org.pragmatica.spek.program.Terminator;
import org.pragmatica.spek.syntax.Expression;
import org.pragmatica.spek.syntax.SourceModule;
import org.pragmatica.spek.syntax.Statement;
import org.pragmatica.spek.syntax.UnaryOperator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical text of syntax trees, machine programs, machine states and transition labels.
 *
 * <p>All output is a pure function of the input. Heap objects are numbered by creation order, so two states
 * that differ only in absolute object ids print the same. Printed syntax trees are valid source: parsing the
 * output and printing again yields the same text.
 */
public final class Printer {
    private static final String INDENT = "    ";
    private static final int POSTFIX_PRECEDENCE = UnaryOperator.NEGATE.precedence() + 1;

    private Printer() {}

    // === Syntax ===

    public static String print(SourceModule module) {
        var sb = new StringBuilder();
        for (var statement : module.statements()) {
            statement(sb, statement, 0);
        }
        return sb.toString();
    }

    public static String print(Expression expression) {
        return expression(expression, 0);
    }

    private static void statement(StringBuilder sb, Statement statement, int depth) {
        var indent = INDENT.repeat(depth);
        if (statement instanceof Statement.VarDeclaration declaration) {
            sb.append(indent).append("var ").append(declaration.name());
            declaration.initializer().forEach(init -> sb.append(" = ").append(expression(init, 0)));
            sb.append('\n');
        } else if (statement instanceof Statement.FunctionDeclaration function) {
            sb.append(indent).append("def ").append(function.name()).append('(');
            sb.append(String.join(", ", function.parameters().stream().map(Statement.Parameter::name).toList()));
            sb.append("):\n");
            block(sb, function.body(), depth + 1);
        } else if (statement instanceof Statement.ClassDeclaration declaration) {
            sb.append(indent).append("class ").append(declaration.name());
            declaration.superclass().forEach(parent -> sb.append('(').append(parent).append(')'));
            sb.append(":\n");
            block(sb, declaration.members(), depth + 1);
        } else if (statement instanceof Statement.PropertyDeclaration property) {
            var inner = INDENT.repeat(depth + 1);
            sb.append(indent).append("prop ").append(property.name()).append(":\n");
            sb.append(inner).append("get:\n");
            block(sb, property.getter(), depth + 2);
            property.setter().forEach(setter -> {
                sb.append(inner).append("set ").append(setter.parameter().name()).append(":\n");
                block(sb, setter.body(), depth + 2);
            });
        } else if (statement instanceof Statement.DelegateDeclaration delegate) {
            sb.append(indent).append("delegate ").append(delegate.field()).append('\n');
        } else if (statement instanceof Statement.Assignment assignment) {
            sb.append(indent)
              .append(expression(assignment.target(), 0))
              .append(" = ")
              .append(expression(assignment.value(), 0))
              .append('\n');
        } else if (statement instanceof Statement.ExpressionStatement expression) {
            sb.append(indent).append(expression(expression.expression(), 0)).append('\n');
        } else if (statement instanceof Statement.Return ret) {
            sb.append(indent).append("return");
            ret.value().forEach(value -> sb.append(' ').append(expression(value, 0)));
            sb.append('\n');
        } else if (statement instanceof Statement.Break) {
            sb.append(indent).append("break\n");
        } else if (statement instanceof Statement.Continue) {
            sb.append(indent).append("continue\n");
        } else if (statement instanceof Statement.Pass) {
            sb.append(indent).append("pass\n");
        } else if (statement instanceof Statement.If conditional) {
            conditional(sb, conditional, depth, "if");
        } else if (statement instanceof Statement.While loop) {
            sb.append(indent).append("while ").append(expression(loop.condition(), 0)).append(":\n");
            block(sb, loop.body(), depth + 1);
        } else if (statement instanceof Statement.For loop) {
            sb.append(indent)
              .append("for ")
              .append(loop.variable().name())
              .append(" in ")
              .append(expression(loop.iterable(), 0))
              .append(":\n");
            block(sb, loop.body(), depth + 1);
        } else if (statement instanceof Statement.Await await) {
            sb.append(indent)
              .append("await ")
              .append(await.kind().keyword())
              .append(' ')
              .append(expression(await.operand(), 0))
              .append('\n');
        } else if (statement instanceof Statement.Async spawn) {
            sb.append(indent).append("async ").append(expression(spawn.call(), 0)).append('\n');
        } else if (statement instanceof Statement.Try attempt) {
            attempt(sb, attempt, depth);
        } else if (statement instanceof Statement.Raise raise) {
            sb.append(indent).append("raise");
            raise.exception().forEach(exception -> sb.append(' ').append(expression(exception, 0)));
            sb.append('\n');
        }
    }

    private static void attempt(StringBuilder sb, Statement.Try attempt, int depth) {
        var indent = INDENT.repeat(depth);
        sb.append(indent).append("try:\n");
        block(sb, attempt.body(), depth + 1);
        for (var handler : attempt.handlers()) {
            sb.append(indent).append("except");
            handler.type().forEach(type -> sb.append(' ').append(expression(type, 0)));
            handler.name().forEach(name -> sb.append(" as ").append(name.name()));
            sb.append(":\n");
            block(sb, handler.body(), depth + 1);
        }
        attempt.finallyBody().forEach(body -> {
            sb.append(indent).append("finally:\n");
            block(sb, body, depth + 1);
        });
    }

    private static void conditional(StringBuilder sb, Statement.If conditional, int depth, String keyword) {
        var indent = INDENT.repeat(depth);
        sb.append(indent).append(keyword).append(' ').append(expression(conditional.condition(), 0)).append(":\n");
        block(sb, conditional.thenBranch(), depth + 1);
        var elseBranch = conditional.elseBranch();
        if (elseBranch.size() == 1 && elseBranch.get(0) instanceof Statement.If chained) {
            conditional(sb, chained, depth, "elif");
        } else if (!elseBranch.isEmpty()) {
            sb.append(indent).append("else:\n");
            block(sb, elseBranch, depth + 1);
        }
    }

    private static void block(StringBuilder sb, List<Statement> statements, int depth) {
        if (statements.isEmpty()) {
            sb.append(INDENT.repeat(depth)).append("pass\n");
            return;
        }
        for (var statement : statements) {
            statement(sb, statement, depth);
        }
    }

    /**
     * Expression text, parenthesised only where the context binds tighter than the expression.
     */
    private static String expression(Expression expression, int context) {
        var text = bare(expression);
        return precedence(expression) < context ? "(" + text + ")" : text;
    }

    private static int precedence(Expression expression) {
        if (expression instanceof Expression.Binary binary) {
            return binary.operator().precedence();
        }
        if (expression instanceof Expression.Unary unary) {
            return unary.operator().precedence();
        }
        return POSTFIX_PRECEDENCE;
    }

    private static String bare(Expression expression) {
        if (expression instanceof Expression.NoneLiteral) {
            return "None";
        }
        if (expression instanceof Expression.BooleanLiteral literal) {
            return literal.value() ? "True" : "False";
        }
        if (expression instanceof Expression.IntegerLiteral literal) {
            return Long.toString(literal.value());
        }
        if (expression instanceof Expression.FloatLiteral literal) {
            return real(literal.value());
        }
        if (expression instanceof Expression.StringLiteral literal) {
            return Values.quote(literal.value());
        }
        if (expression instanceof Expression.Name name) {
            return name.name();
        }
        if (expression instanceof Expression.Attribute attribute) {
            return expression(attribute.target(), POSTFIX_PRECEDENCE) + "." + attribute.name();
        }
        if (expression instanceof Expression.Index index) {
            return expression(index.target(), POSTFIX_PRECEDENCE) + "[" + expression(index.index(), 0) + "]";
        }
        if (expression instanceof Expression.Call call) {
            return expression(call.callee(), POSTFIX_PRECEDENCE) + "(" + expressions(call.arguments()) + ")";
        }
        if (expression instanceof Expression.Unary unary) {
            var operand = expression(unary.operand(), unary.operator().precedence());
            return unary.operator() == UnaryOperator.NOT ? "not " + operand : "-" + operand;
        }
        if (expression instanceof Expression.Binary binary) {
            var level = binary.operator().precedence();
            return expression(binary.left(), level) + " " + binary.operator().symbol() + " "
                   + expression(binary.right(), level + 1);
        }
        if (expression instanceof Expression.ListDisplay list) {
            return "[" + expressions(list.elements()) + "]";
        }
        if (expression instanceof Expression.TupleDisplay tuple) {
            return tuple.elements().size() == 1
                   ? "(" + expression(tuple.elements().get(0), 0) + ",)"
                   : "(" + expressions(tuple.elements()) + ")";
        }
        var dict = (Expression.DictDisplay) expression;
        var entries = new ArrayList<String>();
        for (var entry : dict.entries()) {
            entries.add(expression(entry.key(), 0) + ": " + expression(entry.value(), 0));
        }
        return "{" + String.join(", ", entries) + "}";
    }

    private static String expressions(List<Expression> expressions) {
        var parts = new ArrayList<String>(expressions.size());
        expressions.forEach(expression -> parts.add(expression(expression, 0)));
        return String.join(", ", parts);
    }

    /**
     * Float text the lexer reads back as the same value.
     */
    private static String real(double value) {
        if (Double.isInfinite(value)) {
            return "1e999";
        }
        return Double.toString(value);
    }

    // === Machine programs ===

    public static String print(MachineProgram program) {
        var sb = new StringBuilder();
        sb.append("program entry ").append(program.entry()).append('\n');
        var globals = program.globals();
        for (int i = 0; i < globals.size(); i++) {
            sb.append("global ").append(i).append(' ').append(globals.get(i)).append('\n');
        }
        program.properties()
               .values()
               .forEach(property -> sb.append("prop ")
                                      .append(property.name())
                                      .append(" get ")
                                      .append(property.getter())
                                      .append(property.setter().map(s -> " set " + s).getOrElse(""))
                                      .append('\n'));
        program.classes().values().forEach(layout -> classLayout(sb, layout));
        program.units().values().forEach(unit -> unit(sb, unit));
        return sb.toString();
    }

    private static void classLayout(StringBuilder sb, ClassLayout layout) {
        sb.append("class ").append(layout.name());
        layout.superclass().forEach(parent -> sb.append('(').append(parent).append(')'));
        sb.append('\n');
        sb.append(INDENT).append("fields [").append(String.join(", ", layout.fields())).append("]\n");
        layout.methods().forEach((name, unit) -> sb.append(INDENT).append("method ").append(name).append(" -> ").append(unit).append('\n'));
        layout.properties()
              .values()
              .forEach(property -> sb.append(INDENT)
                                     .append("prop ")
                                     .append(property.name())
                                     .append(" get ")
                                     .append(property.getter())
                                     .append(property.setter().map(s -> " set " + s).getOrElse(""))
                                     .append('\n'));
        if (!layout.delegates().isEmpty()) {
            sb.append(INDENT).append("delegates [").append(String.join(", ", layout.delegates())).append("]\n");
        }
        if (!layout.fieldInitialisers().isEmpty()) {
            sb.append(INDENT).append("initialisers [").append(String.join(", ", layout.fieldInitialisers())).append("]\n");
        }
        layout.constructor().forEach(init -> sb.append(INDENT).append("constructor ").append(init).append('\n'));
    }

    private static void unit(StringBuilder sb, CodeUnit unit) {
        sb.append("unit ")
          .append(unit.name())
          .append(' ')
          .append(unit.kind().name().toLowerCase())
          .append(" arity ")
          .append(unit.arity())
          .append(" slots [")
          .append(String.join(", ", unit.slots()))
          .append("]\n");
        unit.fragments().forEach(fragment -> fragment(sb, fragment));
    }

    private static void fragment(StringBuilder sb, Fragment fragment) {
        sb.append(INDENT).append('#').append(fragment.index());
        fragment.handler().forEach(handler -> sb.append(" except #").append(handler.target()).append(" @").append(handler.slot()));
        sb.append('\n');
        var inner = INDENT.repeat(2);
        for (var instruction : fragment.instructions()) {
            sb.append(inner).append(instruction(instruction)).append('\n');
        }
        sb.append(inner).append(terminator(fragment.terminator())).append('\n');
    }

    private static String instruction(Instruction instruction) {
        if (instruction instanceof Instruction.StoreLocal store) {
            return "local " + store.slot() + " = " + term(store.value());
        }
        if (instruction instanceof Instruction.StoreGlobal store) {
            return "global " + store.slot() + " = " + term(store.value());
        }
        if (instruction instanceof Instruction.StoreProperty store) {
            return "prop " + store.name() + " = " + term(store.value());
        }
        if (instruction instanceof Instruction.StoreAttribute store) {
            return term(store.target()) + "." + store.name() + " = " + term(store.value());
        }
        if (instruction instanceof Instruction.StoreIndex store) {
            return term(store.target()) + "[" + term(store.index()) + "] = " + term(store.value());
        }
        if (instruction instanceof Instruction.Evaluate evaluate) {
            return "eval " + term(evaluate.term());
        }
        var spawn = (Instruction.Spawn) instruction;
        return "spawn " + term(spawn.callee()) + "(" + terms(spawn.arguments()) + ")";
    }

    private static String terminator(Terminator terminator) {
        if (terminator instanceof Terminator.Jump jump) {
            return "jump #" + jump.target();
        }
        if (terminator instanceof Terminator.Branch branch) {
            return "branch " + term(branch.condition()) + " ? #" + branch.ifTrue() + " : #" + branch.ifFalse();
        }
        if (terminator instanceof Terminator.Suspend suspend) {
            return "suspend " + suspend.kind().keyword() + " " + term(suspend.operand()) + " resume #" + suspend.resume();
        }
        if (terminator instanceof Terminator.Raise raise) {
            return "raise " + term(raise.exception());
        }
        var ret = (Terminator.Return) terminator;
        return "return" + ret.value().map(value -> " " + term(value)).getOrElse("");
    }

    /**
     * Fully parenthesised term text; slots are shown as {@code name@slot}.
     */
    public static String term(Term term) {
        if (term instanceof Term.NoneConstant) {
            return "None";
        }
        if (term instanceof Term.BoolConstant constant) {
            return constant.value() ? "True" : "False";
        }
        if (term instanceof Term.IntConstant constant) {
            return Long.toString(constant.value());
        }
        if (term instanceof Term.RealConstant constant) {
            return real(constant.value());
        }
        if (term instanceof Term.StrConstant constant) {
            return Values.quote(constant.value());
        }
        if (term instanceof Term.Local local) {
            return local.name() + "@" + local.slot();
        }
        if (term instanceof Term.Global global) {
            return "global:" + global.name();
        }
        if (term instanceof Term.FunctionRef function) {
            return "function:" + function.unit();
        }
        if (term instanceof Term.ClassRef type) {
            return "class:" + type.name();
        }
        if (term instanceof Term.BuiltinRef builtin) {
            return "builtin:" + builtin.name();
        }
        if (term instanceof Term.PropertyRead read) {
            return "prop:" + read.name();
        }
        if (term instanceof Term.Attribute attribute) {
            return term(attribute.target()) + "." + attribute.name();
        }
        if (term instanceof Term.Index index) {
            return term(index.target()) + "[" + term(index.index()) + "]";
        }
        if (term instanceof Term.Call call) {
            return term(call.callee()) + "(" + terms(call.arguments()) + ")";
        }
        if (term instanceof Term.Unary unary) {
            return "(" + (unary.operator() == UnaryOperator.NOT ? "not " : "-") + term(unary.operand()) + ")";
        }
        if (term instanceof Term.Binary binary) {
            return "(" + term(binary.left()) + " " + binary.operator().symbol() + " " + term(binary.right()) + ")";
        }
        if (term instanceof Term.MakeList list) {
            return "[" + terms(list.elements()) + "]";
        }
        if (term instanceof Term.MakeTuple tuple) {
            return "(" + terms(tuple.elements()) + (tuple.elements().size() == 1 ? ",)" : ")");
        }
        if (term instanceof Term.MakeDict dict) {
            var entries = new ArrayList<String>();
            for (int i = 0; i < dict.keys().size(); i++) {
                entries.add(term(dict.keys().get(i)) + ": " + term(dict.values().get(i)));
            }
            return "{" + String.join(", ", entries) + "}";
        }
        var sequence = (Term.Sequence) term;
        return "seq(" + term(sequence.iterable()) + ")";
    }

    private static String terms(List<Term> terms) {
        var parts = new ArrayList<String>(terms.size());
        terms.forEach(term -> parts.add(term(term)));
        return String.join(", ", parts);
    }

    // === Machine states ===

    public static String print(MachineState state) {
        return new StatePrinter(state, false).print();
    }

    /**
     * Globals and live objects only: what a renderer can observe of the state.
     */
    public static String printContent(MachineState state) {
        return new StatePrinter(state, true).content().toString();
    }

    /**
     * State text without the absolute clock: deadlines are shown relative to the current time. Two states
     * that behave the same from now on print the same even when reached at different times.
     */
    public static String printRelative(MachineState state) {
        return new StatePrinter(state, true).print();
    }

    public static String print(TransitionLabel label) {
        if (label instanceof TransitionLabel.Private) {
            return "tau";
        }
        if (label instanceof TransitionLabel.Event event) {
            return "event " + Values.quote(event.label());
        }
        if (label instanceof TransitionLabel.TimeAdvance advance) {
            return "time +" + advance.delta();
        }
        if (label instanceof TransitionLabel.TaskCompleted completed) {
            return "completed task " + completed.taskId();
        }
        var failed = (TransitionLabel.TaskFailed) label;
        return "failed task " + failed.taskId() + ": " + failed.reason();
    }

    private static final class StatePrinter {
        private final MachineState state;
        private final boolean relative;
        private final Map<Integer, Integer> ordinals = new HashMap<>();
        private final StringBuilder sb = new StringBuilder();

        private StatePrinter(MachineState state, boolean relative) {
            this.state = state;
            this.relative = relative;
            var next = 1;
            for (var object : state.heap().objects()) {
                ordinals.put(object.id(), next++);
            }
        }

        private String print() {
            if (!relative) {
                sb.append("clock ").append(state.clock()).append('\n');
            }
            sb.append("next task ").append(state.nextTaskId()).append('\n');
            content();
            for (var task : state.tasks()) {
                task(task);
            }
            sb.append("run queue ").append(state.runQueue()).append('\n');
            sb.append("wait order ").append(waitOrder()).append('\n');
            for (var stimulus : state.pending()) {
                sb.append("pending ").append(stimulus(stimulus)).append('\n');
            }
            return sb.toString();
        }

        private StringBuilder content() {
            var names = state.program().globals();
            var globals = state.globals();
            for (int i = 0; i < names.size(); i++) {
                sb.append("global ").append(names.get(i)).append(" = ").append(value(globals.get(i))).append('\n');
            }
            for (var object : state.heap().objects()) {
                object(object);
            }
            return sb;
        }

        private List<Integer> waitOrder() {
            return state.tasks()
                        .stream()
                        .filter(task -> task.status() instanceof TaskStatus.Waiting)
                        .sorted(Comparator.comparingLong(task -> ((TaskStatus.Waiting) task.status()).sequence()))
                        .map(Task::id)
                        .toList();
        }

        private void object(HeapObject object) {
            sb.append('@').append(ordinals.get(object.id())).append(' ').append(object.kind());
            if (object instanceof HeapObject.Instance instance) {
                var fields = new ArrayList<String>();
                instance.fields().forEach((name, value) -> fields.add(name + ": " + value(value)));
                sb.append(" {").append(String.join(", ", fields)).append('}');
                if (!instance.delegationChain().isEmpty()) {
                    var chain = new ArrayList<String>();
                    instance.delegationChain().forEach(value -> chain.add(value(value)));
                    sb.append(" delegates [").append(String.join(", ", chain)).append(']');
                }
            } else if (object instanceof HeapObject.ListObject list) {
                var elements = new ArrayList<String>();
                list.elements().forEach(value -> elements.add(value(value)));
                sb.append(" [").append(String.join(", ", elements)).append(']');
            } else if (object instanceof HeapObject.DictObject dict) {
                var entries = new ArrayList<String>();
                dict.entries().forEach((key, value) -> entries.add(value(key) + ": " + value(value)));
                sb.append(" {").append(String.join(", ", entries)).append('}');
            }
            sb.append('\n');
        }

        private void task(Task task) {
            sb.append("task ").append(task.id()).append(' ').append(task.entry());
            var status = task.status();
            if (status instanceof TaskStatus.Completed completed) {
                sb.append(" completed ").append(value(completed.result())).append('\n');
                return;
            }
            if (status instanceof TaskStatus.Failed failed) {
                sb.append(" failed ").append(failed.failure().message()).append('\n');
                return;
            }
            sb.append('#').append(task.fragment());
            if (status instanceof TaskStatus.Waiting waiting) {
                sb.append(" waiting ").append(condition(waiting.condition()));
            } else {
                sb.append(" runnable");
            }
            task.root().forEach(frame -> {
                var slots = new ArrayList<String>();
                frame.slots().forEach(value -> slots.add(value(value)));
                sb.append(" [").append(String.join(", ", slots)).append(']');
            });
            sb.append('\n');
        }

        private String condition(WaitCondition condition) {
            if (condition instanceof WaitCondition.OnEvent event) {
                return "event " + Values.quote(event.label());
            }
            var until = (WaitCondition.Until) condition;
            return relative ? "delay " + (until.deadline() - state.clock()) : "until " + until.deadline();
        }

        private String stimulus(Stimulus stimulus) {
            if (stimulus instanceof Stimulus.Event event) {
                return "event " + Values.quote(event.label());
            }
            var advance = (Stimulus.AdvanceClock) stimulus;
            return "advance" + advance.deadline().map(deadline -> " to " + deadline).getOrElse("");
        }

        private String value(Value value) {
            if (value instanceof Value.Tuple tuple) {
                var parts = tuple.elements().stream().map(this::value).toList();
                return parts.size() == 1 ? "(" + parts.get(0) + ",)" : "(" + String.join(", ", parts) + ")";
            }
            if (value instanceof Value.Ref ref) {
                return "@" + ordinal(ref.id());
            }
            if (value instanceof Value.BoundMethod method) {
                return "<method " + method.unit() + " of @" + ordinal(method.receiver()) + ">";
            }
            if (value instanceof Value.NativeMethod method) {
                return "<method " + method.name() + " of @" + ordinal(method.receiver()) + ">";
            }
            return Values.format(value);
        }

        private String ordinal(int id) {
            var ordinal = ordinals.get(id);
            return ordinal == null ? "released" : ordinal.toString();
        }
    }
}
