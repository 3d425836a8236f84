package org.pragmatica.spek.machine;

import io.vavr.control.Option;
import org.pragmatica.spek.program.ClassLayout;
import org.pragmatica.spek.syntax.BinaryOperator;
import org.pragmatica.spek.validation.Validator;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.pragmatica.spek.machine.ExecutionFault.INDEX_ERROR;
import static org.pragmatica.spek.machine.ExecutionFault.OVERFLOW_ERROR;
import static org.pragmatica.spek.machine.ExecutionFault.RECURSION_ERROR;
import static org.pragmatica.spek.machine.ExecutionFault.TYPE_ERROR;
import static org.pragmatica.spek.machine.ExecutionFault.VALUE_ERROR;

/**
 * Builtin functions, exception types and the methods of lists and dictionaries.
 */
final class Builtins {
    private static final Set<String> LIST_METHODS = Set.of("append", "pop");
    private static final Set<String> DICT_METHODS = Set.of("keys");
    private static final String BASE_EXCEPTION = "Exception";
    private static final int MAX_RANGE = 10_000_000;

    /**
     * Deepest nesting of collections {@code str} renders.
     */
    static final int MAX_RENDER_DEPTH = 1_000;

    private final MachineState state;
    private final Interpreter interpreter;

    Builtins(MachineState state, Interpreter interpreter) {
        this.state = state;
        this.interpreter = interpreter;
    }

    static Option<String> nativeMethod(HeapObject object, String name) {
        if (object instanceof HeapObject.ListObject && LIST_METHODS.contains(name)) {
            return Option.some(name);
        }
        if (object instanceof HeapObject.DictObject && DICT_METHODS.contains(name)) {
            return Option.some(name);
        }
        return Option.none();
    }

    static boolean isExceptionType(String name) {
        return Validator.EXCEPTION_TYPES.contains(name);
    }

    Value call(String name, List<Value> arguments) {
        if (isExceptionType(name)) {
            return exception(name, arguments);
        }
        return switch (name) {
            case "len" -> len(single(name, arguments));
            case "str" -> Value.string(text(single(name, arguments)));
            case "int" -> toInt(single(name, arguments));
            case "float" -> toFloat(single(name, arguments));
            case "abs" -> abs(single(name, arguments));
            case "min" -> extreme(name, arguments, true);
            case "max" -> extreme(name, arguments, false);
            case "range" -> range(arguments);
            case "tuple" -> toTuple(arguments);
            case "isinstance" -> {
                expectArity(name, arguments, 2);
                yield Value.bool(isInstance(arguments.get(0), arguments.get(1)));
            }
            case "now" -> {
                expectArity(name, arguments, 0);
                yield Value.real(state.clock());
            }
            default -> throw new ExecutionFault("call of " + name, "unknown builtin");
        };
    }

    private Value exception(String type, List<Value> arguments) {
        if (arguments.size() > 1) {
            throw arity(type, "at most 1", arguments.size());
        }
        var message = arguments.isEmpty() ? "" : text(arguments.get(0));
        return new Value.ExceptionValue(type, message);
    }

    private Value toTuple(List<Value> arguments) {
        if (arguments.size() > 1) {
            throw arity("tuple", "at most 1", arguments.size());
        }
        if (arguments.isEmpty()) {
            return new Value.Tuple(List.of());
        }
        var source = arguments.get(0);
        if (source instanceof Value.Tuple) {
            return source;
        }
        if (source instanceof Value.Str str) {
            var characters = new ArrayList<Value>();
            str.value().codePoints().forEach(cp -> characters.add(Value.string(new String(Character.toChars(cp)))));
            return new Value.Tuple(characters);
        }
        var list = interpreter.list(source);
        if (list.isDefined()) {
            return interpreter.tuple(list.get().elements());
        }
        var dict = interpreter.dict(source);
        if (dict.isDefined()) {
            return interpreter.tuple(new ArrayList<>(dict.get().entries().keySet()));
        }
        throw new ExecutionFault(TYPE_ERROR, "tuple", "'" + source.typeName() + "' is not iterable");
    }

    /**
     * Exception types all derive from {@code Exception}; classes follow their superclass chain. A tuple of types
     * matches when any of them does.
     */
    private boolean isInstance(Value value, Value type) {
        if (type instanceof Value.Tuple types) {
            return types.elements().stream().anyMatch(candidate -> isInstance(value, candidate));
        }
        if (type instanceof Value.ClassValue classValue) {
            return instanceClass(value).map(name -> derives(name, classValue.name())).getOrElse(false);
        }
        if (!(type instanceof Value.Builtin builtin)) {
            throw new ExecutionFault(TYPE_ERROR, "isinstance", "second argument must be a type, not " + type.typeName());
        }
        var name = builtin.name();
        if (isExceptionType(name)) {
            return value instanceof Value.ExceptionValue exception
                   && (name.equals(BASE_EXCEPTION) || name.equals(exception.type()));
        }
        return switch (name) {
            case "int" -> value instanceof Value.Int || value instanceof Value.Bool;
            case "float" -> value instanceof Value.Real;
            case "str" -> value instanceof Value.Str;
            case "tuple" -> value instanceof Value.Tuple;
            default -> throw new ExecutionFault(TYPE_ERROR, "isinstance", "'" + name + "' is not a type");
        };
    }

    private Option<String> instanceClass(Value value) {
        if (value instanceof Value.Ref ref && state.heap().get(ref.id()).getOrNull() instanceof HeapObject.Instance instance) {
            return Option.some(instance.className());
        }
        return Option.none();
    }

    private boolean derives(String className, String ancestor) {
        var current = Option.some(className);
        while (current.isDefined()) {
            if (current.get().equals(ancestor)) {
                return true;
            }
            current = state.program().classLayout(current.get()).flatMap(ClassLayout::superclass);
        }
        return false;
    }

    Value callMethod(Value.NativeMethod method, List<Value> arguments) {
        var object = state.heap()
                          .get(method.receiver())
                          .getOrElseThrow(() -> new ExecutionFault(method.name(), "receiver was released"));
        if (object instanceof HeapObject.ListObject list) {
            var elements = list.elements();
            if (method.name().equals("append")) {
                elements.add(single("append", arguments));
                return Value.NONE;
            }
            if (arguments.size() > 1) {
                throw arity("pop", "at most 1", arguments.size());
            }
            if (elements.isEmpty()) {
                throw new ExecutionFault(INDEX_ERROR, "pop", "pop from empty list");
            }
            var at = elements.size() - 1;
            if (arguments.size() == 1) {
                if (!(arguments.get(0) instanceof Value.Int index)) {
                    throw new ExecutionFault(TYPE_ERROR, "pop", "index must be an int, not " + arguments.get(0).typeName());
                }
                var position = index.value() < 0 ? index.value() + elements.size() : index.value();
                if (position < 0 || position >= elements.size()) {
                    throw new ExecutionFault(INDEX_ERROR, "pop", "index " + index.value() + " out of range");
                }
                at = (int) position;
            }
            return elements.remove(at);
        }
        var dict = (HeapObject.DictObject) object;
        expectArity("keys", arguments, 0);
        return new Value.Ref(state.heap().newList(new ArrayList<>(dict.entries().keySet())).id());
    }

    private Value len(Value value) {
        if (value instanceof Value.Str str) {
            return Value.integer(str.value().codePointCount(0, str.value().length()));
        }
        if (value instanceof Value.Tuple tuple) {
            return Value.integer(tuple.elements().size());
        }
        var list = interpreter.list(value);
        if (list.isDefined()) {
            return Value.integer(list.get().elements().size());
        }
        var dict = interpreter.dict(value);
        if (dict.isDefined()) {
            return Value.integer(dict.get().entries().size());
        }
        throw new ExecutionFault(TYPE_ERROR, "len", "'" + value.typeName() + "' has no length");
    }

    /**
     * Display text: strings and exception messages unquoted at top level, quoted inside collections.
     */
    String text(Value value) {
        if (value instanceof Value.Str str) {
            return str.value();
        }
        if (value instanceof Value.ExceptionValue exception) {
            return exception.message();
        }
        return repr(value, new HashSet<>(), 0);
    }

    private String repr(Value value, Set<Integer> visiting, int depth) {
        if (depth > MAX_RENDER_DEPTH) {
            throw new ExecutionFault(RECURSION_ERROR, "str", "nested too deeply, the limit is " + MAX_RENDER_DEPTH + " levels");
        }
        if (value instanceof Value.Tuple tuple) {
            var parts = new ArrayList<String>();
            tuple.elements().forEach(element -> parts.add(repr(element, visiting, depth + 1)));
            return parts.size() == 1 ? "(" + parts.get(0) + ",)" : "(" + String.join(", ", parts) + ")";
        }
        if (!(value instanceof Value.Ref ref)) {
            return Values.format(value);
        }
        var object = state.heap().get(ref.id()).getOrNull();
        if (object == null) {
            return "<released>";
        }
        if (!visiting.add(ref.id())) {
            return "...";
        }
        try {
            if (object instanceof HeapObject.ListObject list) {
                var parts = new ArrayList<String>();
                list.elements().forEach(element -> parts.add(repr(element, visiting, depth + 1)));
                return "[" + String.join(", ", parts) + "]";
            }
            if (object instanceof HeapObject.DictObject dict) {
                var parts = new ArrayList<String>();
                dict.entries().forEach((k, v) -> parts.add(repr(k, visiting, depth + 1) + ": " + repr(v, visiting, depth + 1)));
                return "{" + String.join(", ", parts) + "}";
            }
            return "<" + object.kind() + " object>";
        } finally {
            visiting.remove(ref.id());
        }
    }

    private static Value toInt(Value value) {
        if (value instanceof Value.Int) {
            return value;
        }
        if (value instanceof Value.Bool bool) {
            return Value.integer(bool.value() ? 1 : 0);
        }
        if (value instanceof Value.Real real) {
            var number = real.value();
            if (Double.isNaN(number) || Double.isInfinite(number) || Math.abs(number) >= 0x1p63) {
                throw new ExecutionFault(OVERFLOW_ERROR, "int", "cannot convert " + number + " to int");
            }
            return Value.integer((long) number);
        }
        if (value instanceof Value.Str str) {
            try {
                return Value.integer(Long.parseLong(str.value().trim()));
            } catch (NumberFormatException e) {
                throw new ExecutionFault(VALUE_ERROR, "int", "invalid literal for int: " + Values.quote(str.value()));
            }
        }
        throw new ExecutionFault(TYPE_ERROR, "int", "cannot convert " + value.typeName() + " to int");
    }

    private static Value toFloat(Value value) {
        if (Values.isNumeric(value)) {
            return Value.real(Values.asDouble(value));
        }
        if (value instanceof Value.Bool bool) {
            return Value.real(bool.value() ? 1.0 : 0.0);
        }
        if (value instanceof Value.Str str) {
            try {
                return Value.real(Double.parseDouble(str.value().trim()));
            } catch (NumberFormatException e) {
                throw new ExecutionFault(VALUE_ERROR, "float", "invalid literal for float: " + Values.quote(str.value()));
            }
        }
        throw new ExecutionFault(TYPE_ERROR, "float", "cannot convert " + value.typeName() + " to float");
    }

    private static Value abs(Value value) {
        if (value instanceof Value.Int number) {
            if (number.value() == Long.MIN_VALUE) {
                throw new ExecutionFault(OVERFLOW_ERROR, "abs", "integer overflow");
            }
            return Value.integer(Math.abs(number.value()));
        }
        if (value instanceof Value.Real number) {
            return Value.real(Math.abs(number.value()));
        }
        throw new ExecutionFault(TYPE_ERROR, "abs", "bad operand type " + value.typeName());
    }

    /**
     * {@code min}/{@code max} over the arguments, or over the elements of a single list or tuple argument.
     */
    private Value extreme(String name, List<Value> arguments, boolean minimum) {
        var candidates = arguments;
        if (arguments.size() == 1 && arguments.get(0) instanceof Value.Tuple tuple) {
            candidates = tuple.elements();
        } else if (arguments.size() == 1) {
            candidates = interpreter.list(arguments.get(0))
                                    .map(list -> (List<Value>) new ArrayList<>(list.elements()))
                                    .getOrElseThrow(() -> new ExecutionFault(name, "expected a list or several values"));
        }
        if (candidates.isEmpty()) {
            throw new ExecutionFault(name, "no values to compare");
        }
        var best = candidates.get(0);
        for (var candidate : candidates.subList(1, candidates.size())) {
            if (Operators.compare(minimum ? BinaryOperator.LT : BinaryOperator.GT, candidate, best)) {
                best = candidate;
            }
        }
        return best;
    }

    private Value range(List<Value> arguments) {
        if (arguments.isEmpty() || arguments.size() > 3) {
            throw arity("range", "1 to 3", arguments.size());
        }
        var bounds = new long[arguments.size()];
        for (int i = 0; i < bounds.length; i++) {
            if (!(arguments.get(i) instanceof Value.Int number)) {
                throw new ExecutionFault(TYPE_ERROR, "range", "arguments must be ints, not " + arguments.get(i).typeName());
            }
            bounds[i] = number.value();
        }
        var start = bounds.length == 1 ? 0 : bounds[0];
        var stop = bounds.length == 1 ? bounds[0] : bounds[1];
        var step = bounds.length == 3 ? bounds[2] : 1;
        if (step == 0) {
            throw new ExecutionFault(VALUE_ERROR, "range", "step must not be zero");
        }
        var elements = new ArrayList<Value>();
        for (var i = start; step > 0 ? i < stop : i > stop; i += step) {
            if (elements.size() >= MAX_RANGE) {
                throw new ExecutionFault("range", "more than " + MAX_RANGE + " elements");
            }
            elements.add(Value.integer(i));
        }
        return new Value.Ref(state.heap().newList(elements).id());
    }

    private static Value single(String name, List<Value> arguments) {
        expectArity(name, arguments, 1);
        return arguments.get(0);
    }

    private static void expectArity(String name, List<Value> arguments, int expected) {
        if (arguments.size() != expected) {
            throw arity(name, Integer.toString(expected), arguments.size());
        }
    }

    private static ExecutionFault arity(String name, String expected, int actual) {
        return new ExecutionFault(TYPE_ERROR, "call of " + name, "expected " + expected + " argument(s), got " + actual);
    }
}
