package org.pragmatica.spek.machine;

import io.vavr.control.Option;
import org.apache.log4j.Logger;
import org.pragmatica.spek.program.CodeUnit;
import org.pragmatica.spek.program.Fragment;
import org.pragmatica.spek.program.Instruction;
import org.pragmatica.spek.program.Term;
import org.pragmatica.spek.program.Terminator;
import org.pragmatica.spek.syntax.BinaryOperator;
import org.pragmatica.spek.syntax.Statement.WaitKind;
import org.pragmatica.spek.syntax.UnaryOperator;
import org.pragmatica.spek.tree.SourceSpan;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

import static org.pragmatica.spek.machine.ExecutionFault.ATTRIBUTE_ERROR;
import static org.pragmatica.spek.machine.ExecutionFault.INDEX_ERROR;
import static org.pragmatica.spek.machine.ExecutionFault.KEY_ERROR;
import static org.pragmatica.spek.machine.ExecutionFault.RECURSION_ERROR;
import static org.pragmatica.spek.machine.ExecutionFault.TYPE_ERROR;
import static org.pragmatica.spek.machine.ExecutionFault.VALUE_ERROR;

/**
 * Executes code on behalf of one task. Synchronous calls run to completion on nested frames; only the task's
 * root frame can suspend.
 */
final class Interpreter {
    private static final Logger logger = Logger.getLogger(Interpreter.class);

    /**
     * Longest delegation chain an attribute lookup follows.
     */
    static final int MAX_DELEGATION_DEPTH = 1_000;

    /**
     * Deepest tuple nesting a program may build.
     */
    static final int MAX_TUPLE_DEPTH = 100;

    private final MachineState state;
    private final MachineConfig config;
    private final Task task;
    private final Builtins builtins;
    private SourceSpan span = SourceSpan.NONE;

    Interpreter(MachineState state, MachineConfig config, Task task) {
        this.state = state;
        this.config = config;
        this.task = task;
        this.builtins = new Builtins(state, this);
    }

    /**
     * Span of the instruction or terminator executed last.
     */
    SourceSpan span() {
        return span;
    }

    /**
     * Runs one fragment of the task's root frame and applies its terminator to the task.
     */
    void runFragment() {
        var frame = task.root()
                        .getOrElseThrow(() -> new IllegalStateException("Task " + task.id() + " has terminated"));
        var unit = state.program().unit(frame.unit());
        var fragment = unit.fragment(task.fragment());
        consumeFuel();
        try {
            execute(fragment.instructions(), frame);

            var terminator = fragment.terminator();
            at(terminator.span());
            if (terminator instanceof Terminator.Jump jump) {
                task.moveTo(jump.target());
            } else if (terminator instanceof Terminator.Branch branch) {
                task.moveTo(truthy(evaluate(branch.condition(), frame)) ? branch.ifTrue() : branch.ifFalse());
            } else if (terminator instanceof Terminator.Suspend suspend) {
                var condition = waitCondition(suspend.kind(), evaluate(suspend.operand(), frame));
                task.moveTo(suspend.resume());
                task.status(new TaskStatus.Waiting(condition, state.nextWaitSequence()));
            } else if (terminator instanceof Terminator.Raise raise) {
                throw raise(evaluate(raise.exception(), frame));
            } else if (terminator instanceof Terminator.Return ret) {
                var result = ret.value().map(term -> evaluate(term, frame)).getOrElse(Value.NONE);
                task.status(new TaskStatus.Completed(result));
            }
        } catch (ExecutionFault fault) {
            task.moveTo(handle(fault, fragment, frame));
        }
    }

    /**
     * Stores the exception of {@code fault} for the fragment's handler and returns the fragment to continue
     * with; rethrows when the fragment has no handler or the fault is fatal.
     */
    private int handle(ExecutionFault fault, Fragment fragment, Frame frame) {
        if (fault.fatal() || fragment.handler().isEmpty()) {
            throw fault;
        }
        var handler = fragment.handler().get();
        logger.debug("Task " + task.id() + " handling " + fault.type() + " in fragment " + fragment.index());
        frame.set(handler.slot(), fault.exception());
        return handler.target();
    }

    private static ExecutionFault raise(Value exception) {
        if (exception instanceof Value.ExceptionValue value) {
            return ExecutionFault.raised(value);
        }
        if (exception instanceof Value.Builtin type && Builtins.isExceptionType(type.name())) {
            return ExecutionFault.raised(new Value.ExceptionValue(type.name(), ""));
        }
        return new ExecutionFault(TYPE_ERROR, "raise", "exceptions must derive from Exception, not " + exception.typeName());
    }

    private WaitCondition waitCondition(WaitKind kind, Value operand) {
        if (kind == WaitKind.EVENT) {
            if (!(operand instanceof Value.Str label)) {
                throw new ExecutionFault(TYPE_ERROR, "await event", "event label must be a string, not " + operand.typeName());
            }
            return new WaitCondition.OnEvent(label.value());
        }
        if (!Values.isNumeric(operand)) {
            throw new ExecutionFault(TYPE_ERROR, "await delay", "delay must be a number, not " + operand.typeName());
        }
        var delay = Values.asDouble(operand);
        if (!(delay >= 0.0) || Double.isInfinite(delay)) {
            throw new ExecutionFault(VALUE_ERROR, "await delay", "delay must be finite and non-negative, got " + delay);
        }
        return new WaitCondition.Until(state.clock() + delay);
    }

    private void consumeFuel() {
        if (task.consumeFuel() > config.maxFragmentsPerStep()) {
            throw ExecutionFault.fatal("execution",
                                       "more than " + config.maxFragmentsPerStep() + " fragments without suspending");
        }
    }

    private void at(SourceSpan next) {
        if (next != SourceSpan.NONE) {
            span = next;
        }
    }

    // === Calls ===

    /**
     * Runs a code unit to completion on a new frame.
     */
    Value invoke(CodeUnit unit, Option<Value> receiver, List<Value> arguments) {
        if (arguments.size() != unit.arity()) {
            throw new ExecutionFault(TYPE_ERROR, "call of " + unit.name(),
                                     "expected " + unit.arity() + " argument(s), got " + arguments.size());
        }
        if (task.depth() >= config.maxCallDepth()) {
            throw new ExecutionFault(RECURSION_ERROR, "call of " + unit.name(),
                                     "call depth limit of " + config.maxCallDepth() + " exceeded");
        }
        var frame = Frame.of(unit, receiver, arguments);
        task.push(frame);
        try {
            var index = 0;
            while (true) {
                consumeFuel();
                var fragment = unit.fragment(index);
                try {
                    execute(fragment.instructions(), frame);
                    var terminator = fragment.terminator();
                    at(terminator.span());
                    if (terminator instanceof Terminator.Jump jump) {
                        index = jump.target();
                    } else if (terminator instanceof Terminator.Branch branch) {
                        index = truthy(evaluate(branch.condition(), frame)) ? branch.ifTrue() : branch.ifFalse();
                    } else if (terminator instanceof Terminator.Suspend) {
                        throw new ExecutionFault("await", "cannot suspend inside a synchronous call of " + unit.name());
                    } else if (terminator instanceof Terminator.Raise raise) {
                        throw raise(evaluate(raise.exception(), frame));
                    } else {
                        var ret = (Terminator.Return) terminator;
                        return ret.value().map(term -> evaluate(term, frame)).getOrElse(Value.NONE);
                    }
                } catch (ExecutionFault fault) {
                    index = handle(fault, fragment, frame);
                }
            }
        } finally {
            task.pop();
        }
    }

    Value call(Value callee, List<Value> arguments) {
        if (callee instanceof Value.Function function) {
            return invoke(state.program().unit(function.unit()), Option.none(), arguments);
        }
        if (callee instanceof Value.BoundMethod method) {
            return invoke(state.program().unit(method.unit()), Option.some(new Value.Ref(method.receiver())), arguments);
        }
        if (callee instanceof Value.ClassValue type) {
            return construct(type.name(), arguments);
        }
        if (callee instanceof Value.Builtin builtin) {
            return builtins.call(builtin.name(), arguments);
        }
        if (callee instanceof Value.NativeMethod method) {
            return builtins.callMethod(method, arguments);
        }
        throw new ExecutionFault(TYPE_ERROR, "call", "'" + callee.typeName() + "' object is not callable");
    }

    private void spawn(Value callee, List<Value> arguments) {
        CodeUnit unit;
        Option<Value> receiver;
        if (callee instanceof Value.Function function) {
            unit = state.program().unit(function.unit());
            receiver = Option.none();
        } else if (callee instanceof Value.BoundMethod method) {
            unit = state.program().unit(method.unit());
            receiver = Option.some(new Value.Ref(method.receiver()));
        } else {
            throw new ExecutionFault(TYPE_ERROR, "async", "cannot start a task from a " + callee.typeName());
        }
        if (arguments.size() != unit.arity()) {
            throw new ExecutionFault(TYPE_ERROR, "async " + unit.name(),
                                     "expected " + unit.arity() + " argument(s), got " + arguments.size());
        }
        var spawned = state.spawn(Frame.of(unit, receiver, arguments));
        logger.debug("Task " + task.id() + " spawned task " + spawned.id() + " running " + unit.name());
    }

    private Value construct(String className, List<Value> arguments) {
        var layout = state.program()
                          .classLayout(className)
                          .getOrElseThrow(() -> new ExecutionFault("construction", "unknown class " + className));
        var instance = state.heap().newInstance(className, layout.fields());
        var self = Option.<Value>some(new Value.Ref(instance.id()));
        for (var initialiser : layout.fieldInitialisers()) {
            invoke(state.program().unit(initialiser), self, List.of());
        }
        if (layout.constructor().isDefined()) {
            invoke(state.program().unit(layout.constructor().get()), self, arguments);
        } else if (!arguments.isEmpty()) {
            throw new ExecutionFault(TYPE_ERROR, "construction of " + className,
                                     "expected 0 argument(s), got " + arguments.size());
        }
        var chain = new ArrayList<Value>();
        for (var delegate : layout.delegates()) {
            var target = instance.field(delegate).getOrElse(Value.NONE);
            if (target instanceof Value.Ref) {
                chain.add(target);
            } else if (!(target instanceof Value.None)) {
                throw new ExecutionFault(TYPE_ERROR, "delegate '" + delegate + "'",
                                         "must hold an object, found " + target.typeName());
            }
        }
        instance.fixDelegationChain(chain);
        return self.get();
    }

    // === Instructions ===

    private void execute(List<Instruction> instructions, Frame frame) {
        for (var instruction : instructions) {
            at(instruction.span());
            if (instruction instanceof Instruction.StoreLocal store) {
                frame.set(store.slot(), evaluate(store.value(), frame));
            } else if (instruction instanceof Instruction.StoreGlobal store) {
                state.global(store.slot(), evaluate(store.value(), frame));
            } else if (instruction instanceof Instruction.StoreProperty store) {
                var value = evaluate(store.value(), frame);
                var property = state.program().properties().get(store.name());
                if (property == null || property.setter().isEmpty()) {
                    throw new ExecutionFault(ATTRIBUTE_ERROR, "assignment to '" + store.name() + "'", "property has no setter");
                }
                invoke(state.program().unit(property.setter().get()), Option.none(), List.of(value));
            } else if (instruction instanceof Instruction.StoreAttribute store) {
                var value = evaluate(store.value(), frame);
                var target = evaluate(store.target(), frame);
                storeAttribute(target, store.name(), value);
            } else if (instruction instanceof Instruction.StoreIndex store) {
                var value = evaluate(store.value(), frame);
                var target = evaluate(store.target(), frame);
                var index = evaluate(store.index(), frame);
                storeIndex(target, index, value);
            } else if (instruction instanceof Instruction.Evaluate evaluate) {
                evaluate(evaluate.term(), frame);
            } else if (instruction instanceof Instruction.Spawn spawn) {
                var callee = evaluate(spawn.callee(), frame);
                spawn(callee, evaluateAll(spawn.arguments(), frame));
            }
        }
    }

    // === Terms ===

    Value evaluate(Term term, Frame frame) {
        if (term instanceof Term.NoneConstant) {
            return Value.NONE;
        }
        if (term instanceof Term.BoolConstant constant) {
            return Value.bool(constant.value());
        }
        if (term instanceof Term.IntConstant constant) {
            return Value.integer(constant.value());
        }
        if (term instanceof Term.RealConstant constant) {
            return Value.real(constant.value());
        }
        if (term instanceof Term.StrConstant constant) {
            return Value.string(constant.value());
        }
        if (term instanceof Term.Local local) {
            return frame.slot(local.slot());
        }
        if (term instanceof Term.Global global) {
            return state.global(global.slot());
        }
        if (term instanceof Term.FunctionRef function) {
            return new Value.Function(function.unit());
        }
        if (term instanceof Term.ClassRef type) {
            return new Value.ClassValue(type.name());
        }
        if (term instanceof Term.BuiltinRef builtin) {
            return new Value.Builtin(builtin.name());
        }
        if (term instanceof Term.PropertyRead read) {
            var property = state.program().properties().get(read.name());
            if (property == null) {
                throw new ExecutionFault("property '" + read.name() + "'", "no such property");
            }
            return invoke(state.program().unit(property.getter()), Option.none(), List.of());
        }
        if (term instanceof Term.Attribute attribute) {
            return attribute(evaluate(attribute.target(), frame), attribute.name());
        }
        if (term instanceof Term.Index index) {
            var target = evaluate(index.target(), frame);
            return index(target, evaluate(index.index(), frame));
        }
        if (term instanceof Term.Call call) {
            var callee = evaluate(call.callee(), frame);
            return call(callee, evaluateAll(call.arguments(), frame));
        }
        if (term instanceof Term.Unary unary) {
            var operand = evaluate(unary.operand(), frame);
            return unary.operator() == UnaryOperator.NOT ? Value.bool(!truthy(operand)) : Operators.negate(operand);
        }
        if (term instanceof Term.Binary binary) {
            return binary(binary, frame);
        }
        if (term instanceof Term.MakeList list) {
            return new Value.Ref(state.heap().newList(evaluateAll(list.elements(), frame)).id());
        }
        if (term instanceof Term.MakeTuple tuple) {
            return tuple(evaluateAll(tuple.elements(), frame));
        }
        if (term instanceof Term.MakeDict dict) {
            var entries = new LinkedHashMap<Value, Value>();
            for (int i = 0; i < dict.keys().size(); i++) {
                var key = evaluate(dict.keys().get(i), frame);
                entries.put(checkKey(key), evaluate(dict.values().get(i), frame));
            }
            return new Value.Ref(state.heap().newDict(entries).id());
        }
        if (term instanceof Term.Sequence sequence) {
            return sequence(evaluate(sequence.iterable(), frame));
        }
        throw new IllegalStateException("Unknown term " + term);
    }

    private List<Value> evaluateAll(List<Term> terms, Frame frame) {
        var values = new ArrayList<Value>(terms.size());
        for (var term : terms) {
            values.add(evaluate(term, frame));
        }
        return values;
    }

    /**
     * Tuple of {@code elements}, refused when it would nest deeper than {@link #MAX_TUPLE_DEPTH}.
     */
    Value.Tuple tuple(List<Value> elements) {
        var tuple = new Value.Tuple(elements);
        if (tuple.depth() > MAX_TUPLE_DEPTH) {
            throw new ExecutionFault(RECURSION_ERROR, "tuple", "nested too deeply, the limit is " + MAX_TUPLE_DEPTH + " levels");
        }
        return tuple;
    }

    private Value binary(Term.Binary binary, Frame frame) {
        var operator = binary.operator();
        var left = evaluate(binary.left(), frame);
        if (operator == BinaryOperator.AND) {
            return truthy(left) ? evaluate(binary.right(), frame) : left;
        }
        if (operator == BinaryOperator.OR) {
            return truthy(left) ? left : evaluate(binary.right(), frame);
        }
        var right = evaluate(binary.right(), frame);
        return switch (operator) {
            case EQ -> Value.bool(Operators.equal(left, right));
            case NE -> Value.bool(!Operators.equal(left, right));
            case LT, LE, GT, GE -> Value.bool(Operators.compare(operator, left, right));
            case IN -> Value.bool(contains(right, left));
            case NOT_IN -> Value.bool(!contains(right, left));
            case IS -> Value.bool(Operators.identical(left, right));
            case IS_NOT -> Value.bool(!Operators.identical(left, right));
            case ADD -> {
                if (list(left).isDefined() && list(right).isDefined()) {
                    var elements = new ArrayList<Value>(list(left).get().elements());
                    elements.addAll(list(right).get().elements());
                    yield new Value.Ref(state.heap().newList(elements).id());
                }
                yield Operators.arithmetic(operator, left, right);
            }
            default -> Operators.arithmetic(operator, left, right);
        };
    }

    /**
     * Membership as {@code in} tests it: list and tuple elements, dictionary keys, substrings.
     */
    private boolean contains(Value container, Value element) {
        if (container instanceof Value.Str text) {
            return Operators.containsText(text, element);
        }
        if (container instanceof Value.Tuple tuple) {
            return tuple.elements().stream().anyMatch(candidate -> Operators.equal(candidate, element));
        }
        var listObject = list(container);
        if (listObject.isDefined()) {
            return listObject.get().elements().stream().anyMatch(candidate -> Operators.equal(candidate, element));
        }
        var dictObject = dict(container);
        if (dictObject.isDefined()) {
            return isKey(element) && dictObject.get().entries().containsKey(normaliseKey(element));
        }
        throw new ExecutionFault(TYPE_ERROR, "'in'", "argument of type '" + container.typeName() + "' is not iterable");
    }

    boolean truthy(Value value) {
        if (value instanceof Value.None) {
            return false;
        }
        if (value instanceof Value.Bool bool) {
            return bool.value();
        }
        if (value instanceof Value.Int number) {
            return number.value() != 0;
        }
        if (value instanceof Value.Real number) {
            return number.value() != 0.0;
        }
        if (value instanceof Value.Str str) {
            return !str.value().isEmpty();
        }
        if (value instanceof Value.Tuple tuple) {
            return !tuple.elements().isEmpty();
        }
        if (value instanceof Value.Ref ref) {
            var object = state.heap().get(ref.id()).getOrNull();
            if (object instanceof HeapObject.ListObject list) {
                return !list.elements().isEmpty();
            }
            if (object instanceof HeapObject.DictObject dict) {
                return !dict.entries().isEmpty();
            }
        }
        return true;
    }

    /**
     * Key as stored in a dictionary. Keys that compare equal with {@code ==} map to the same entry, so a float
     * with an integral value is stored as the int.
     */
    static Value checkKey(Value key) {
        if (!isKey(key)) {
            throw new ExecutionFault(TYPE_ERROR, "dictionary key", "'" + key.typeName() + "' cannot be used as a key");
        }
        return normaliseKey(key);
    }

    private static boolean isKey(Value key) {
        if (key instanceof Value.Tuple tuple) {
            return tuple.elements().stream().allMatch(Interpreter::isKey);
        }
        return key instanceof Value.None
               || key instanceof Value.Bool
               || key instanceof Value.Int
               || key instanceof Value.Real
               || key instanceof Value.Str
               || key instanceof Value.Ref;
    }

    private static Value normaliseKey(Value key) {
        if (key instanceof Value.Real real) {
            var number = real.value();
            if (number == Math.rint(number) && Math.abs(number) < 0x1p63) {
                return Value.integer((long) number);
            }
            return real;
        }
        if (key instanceof Value.Tuple tuple) {
            return new Value.Tuple(tuple.elements().stream().map(Interpreter::normaliseKey).toList());
        }
        return key;
    }

    private Value sequence(Value iterable) {
        var listObject = list(iterable);
        if (listObject.isDefined()) {
            return iterable;
        }
        if (iterable instanceof Value.Tuple tuple) {
            return new Value.Ref(state.heap().newList(new ArrayList<>(tuple.elements())).id());
        }
        var dictObject = dict(iterable);
        if (dictObject.isDefined()) {
            return new Value.Ref(state.heap().newList(new ArrayList<>(dictObject.get().entries().keySet())).id());
        }
        if (iterable instanceof Value.Str str) {
            var characters = new ArrayList<Value>();
            str.value().codePoints().forEach(cp -> characters.add(Value.string(new String(Character.toChars(cp)))));
            return new Value.Ref(state.heap().newList(characters).id());
        }
        throw new ExecutionFault(TYPE_ERROR, "for", "'" + iterable.typeName() + "' is not iterable");
    }

    Option<HeapObject.ListObject> list(Value value) {
        if (value instanceof Value.Ref ref && state.heap().get(ref.id()).getOrNull() instanceof HeapObject.ListObject list) {
            return Option.some(list);
        }
        return Option.none();
    }

    Option<HeapObject.DictObject> dict(Value value) {
        if (value instanceof Value.Ref ref && state.heap().get(ref.id()).getOrNull() instanceof HeapObject.DictObject dict) {
            return Option.some(dict);
        }
        return Option.none();
    }

    // === Attributes and indexing ===

    private Value attribute(Value target, String name) {
        if (target instanceof Value.ExceptionValue exception && name.equals("message")) {
            return Value.string(exception.message());
        }
        return lookup(target, name, new HashSet<>())
            .getOrElseThrow(() -> new ExecutionFault(ATTRIBUTE_ERROR, "attribute '" + name + "'",
                                                     describe(target) + " has no attribute '" + name + "'"));
    }

    /**
     * Own field, then property getter, then method, then each delegate in chain order.
     */
    private Option<Value> lookup(Value target, String name, Set<Integer> visited) {
        if (!(target instanceof Value.Ref ref) || !visited.add(ref.id())) {
            return Option.none();
        }
        checkDelegation("attribute '" + name + "'", visited);
        var object = state.heap().get(ref.id()).getOrNull();
        if (object instanceof HeapObject.ListObject || object instanceof HeapObject.DictObject) {
            return Builtins.nativeMethod(object, name).map(method -> (Value) new Value.NativeMethod(ref.id(), method));
        }
        if (!(object instanceof HeapObject.Instance instance)) {
            return Option.none();
        }
        var field = instance.field(name);
        if (field.isDefined()) {
            return field;
        }
        var layout = state.program().classLayout(instance.className());
        if (layout.isDefined()) {
            var property = layout.get().properties().get(name);
            if (property != null) {
                return Option.some(invoke(state.program().unit(property.getter()), Option.some(target), List.of()));
            }
            var method = layout.get().methods().get(name);
            if (method != null) {
                return Option.some(new Value.BoundMethod(ref.id(), method));
            }
        }
        for (var delegate : instance.delegationChain()) {
            var found = lookup(delegate, name, visited);
            if (found.isDefined()) {
                return found;
            }
        }
        return Option.none();
    }

    private void storeAttribute(Value target, String name, Value value) {
        if (!store(target, name, value, new HashSet<>())) {
            throw new ExecutionFault(ATTRIBUTE_ERROR, "assignment to '" + name + "'",
                                     describe(target) + " has no attribute '" + name + "'");
        }
    }

    private boolean store(Value target, String name, Value value, Set<Integer> visited) {
        if (!(target instanceof Value.Ref ref) || !visited.add(ref.id())) {
            return false;
        }
        checkDelegation("assignment to '" + name + "'", visited);
        if (!(state.heap().get(ref.id()).getOrNull() instanceof HeapObject.Instance instance)) {
            return false;
        }
        if (instance.hasField(name)) {
            instance.setField(name, value);
            return true;
        }
        var layout = state.program().classLayout(instance.className());
        if (layout.isDefined() && layout.get().properties().containsKey(name)) {
            var property = layout.get().properties().get(name);
            if (property.setter().isEmpty()) {
                throw new ExecutionFault(ATTRIBUTE_ERROR, "assignment to '" + name + "'", "property has no setter");
            }
            invoke(state.program().unit(property.setter().get()), Option.some(target), List.of(value));
            return true;
        }
        for (var delegate : instance.delegationChain()) {
            if (store(delegate, name, value, visited)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Each object a lookup visits is one level deeper in the delegation chain.
     */
    private static void checkDelegation(String operation, Set<Integer> visited) {
        if (visited.size() > MAX_DELEGATION_DEPTH) {
            throw new ExecutionFault(RECURSION_ERROR, operation,
                                     "delegation chain longer than " + MAX_DELEGATION_DEPTH + " objects");
        }
    }

    private Value index(Value target, Value index) {
        var listObject = list(target);
        if (listObject.isDefined()) {
            var elements = listObject.get().elements();
            return elements.get(position(index, elements.size()));
        }
        var dictObject = dict(target);
        if (dictObject.isDefined()) {
            var value = dictObject.get().entries().get(checkKey(index));
            if (value == null) {
                throw new ExecutionFault(KEY_ERROR, "index", "key " + Values.format(index) + " not found");
            }
            return value;
        }
        if (target instanceof Value.Tuple tuple) {
            var elements = tuple.elements();
            return elements.get(position(index, elements.size()));
        }
        if (target instanceof Value.Str str) {
            var text = str.value();
            var at = position(index, text.length());
            return Value.string(text.substring(at, at + 1));
        }
        throw new ExecutionFault(TYPE_ERROR, "index", "'" + target.typeName() + "' is not indexable");
    }

    private void storeIndex(Value target, Value index, Value value) {
        var listObject = list(target);
        if (listObject.isDefined()) {
            var elements = listObject.get().elements();
            elements.set(position(index, elements.size()), value);
            return;
        }
        var dictObject = dict(target);
        if (dictObject.isDefined()) {
            dictObject.get().entries().put(checkKey(index), value);
            return;
        }
        throw new ExecutionFault(TYPE_ERROR, "index assignment",
                                 "'" + target.typeName() + "' does not support item assignment");
    }

    /**
     * Element position for an index; negative indices count from the end.
     */
    private static int position(Value index, int size) {
        if (!(index instanceof Value.Int number)) {
            throw new ExecutionFault(TYPE_ERROR, "index", "index must be an int, not " + index.typeName());
        }
        var at = number.value() < 0 ? number.value() + size : number.value();
        if (at < 0 || at >= size) {
            throw new ExecutionFault(INDEX_ERROR, "index", "index " + number.value() + " out of range for length " + size);
        }
        return (int) at;
    }

    private String describe(Value value) {
        if (value instanceof Value.Ref ref) {
            return state.heap()
                        .get(ref.id())
                        .map(object -> "'" + object.kind() + "' object")
                        .getOrElse("released object");
        }
        return "'" + value.typeName() + "'";
    }
}
