package org.pragmatica.spek.machine;

import org.pragmatica.spek.syntax.BinaryOperator;

import java.util.ArrayList;
import java.util.List;

import static org.pragmatica.spek.machine.ExecutionFault.OVERFLOW_ERROR;
import static org.pragmatica.spek.machine.ExecutionFault.TYPE_ERROR;
import static org.pragmatica.spek.machine.ExecutionFault.ZERO_DIVISION_ERROR;

/**
 * Arithmetic and comparison on values that do not live on the heap. Integer arithmetic is exact: overflow is a
 * fault, as is division by zero. Mixing integers and floats yields a float.
 */
final class Operators {
    /**
     * Longest string or tuple concatenation and repetition may produce.
     */
    static final int MAX_SEQUENCE_LENGTH = 10_000_000;

    private Operators() {}

    static Value negate(Value operand) {
        if (operand instanceof Value.Int number) {
            if (number.value() == Long.MIN_VALUE) {
                throw new ExecutionFault(OVERFLOW_ERROR, "'-'", "integer overflow");
            }
            return Value.integer(-number.value());
        }
        if (operand instanceof Value.Real number) {
            return Value.real(-number.value());
        }
        throw new ExecutionFault(TYPE_ERROR, "'-'", "bad operand type " + operand.typeName());
    }

    static boolean equal(Value left, Value right) {
        if (Values.isNumeric(left) && Values.isNumeric(right)) {
            if (left instanceof Value.Int a && right instanceof Value.Int b) {
                return a.value() == b.value();
            }
            return Values.asDouble(left) == Values.asDouble(right);
        }
        if (left instanceof Value.Tuple a && right instanceof Value.Tuple b) {
            return equalElements(a.elements(), b.elements());
        }
        return left.equals(right);
    }

    static boolean equalElements(List<Value> left, List<Value> right) {
        if (left.size() != right.size()) {
            return false;
        }
        for (int i = 0; i < left.size(); i++) {
            if (!equal(left.get(i), right.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * {@code is}: the same heap object, or the same immediate value.
     */
    static boolean identical(Value left, Value right) {
        return left.equals(right);
    }

    static Value arithmetic(BinaryOperator operator, Value left, Value right) {
        if (left instanceof Value.Str a && right instanceof Value.Str b && operator == BinaryOperator.ADD) {
            if ((long) a.value().length() + b.value().length() > MAX_SEQUENCE_LENGTH) {
                throw new ExecutionFault(OVERFLOW_ERROR, "'+'", "string too long");
            }
            return Value.string(a.value() + b.value());
        }
        if (left instanceof Value.Tuple a && right instanceof Value.Tuple b && operator == BinaryOperator.ADD) {
            if ((long) a.elements().size() + b.elements().size() > MAX_SEQUENCE_LENGTH) {
                throw new ExecutionFault(OVERFLOW_ERROR, "'+'", "tuple too long");
            }
            var elements = new ArrayList<>(a.elements());
            elements.addAll(b.elements());
            return new Value.Tuple(elements);
        }
        if (operator == BinaryOperator.MUL) {
            if (left instanceof Value.Int count && isRepeatable(right)) {
                return repeat(right, count.value());
            }
            if (right instanceof Value.Int count && isRepeatable(left)) {
                return repeat(left, count.value());
            }
        }
        if (!Values.isNumeric(left) || !Values.isNumeric(right)) {
            throw unsupported(operator, left, right);
        }
        if (left instanceof Value.Int a && right instanceof Value.Int b) {
            return integerArithmetic(operator, a.value(), b.value());
        }
        return realArithmetic(operator, Values.asDouble(left), Values.asDouble(right));
    }

    private static boolean isRepeatable(Value value) {
        return value instanceof Value.Str || value instanceof Value.Tuple;
    }

    /**
     * String or tuple repeated {@code count} times; a negative count yields an empty result.
     */
    private static Value repeat(Value value, long count) {
        var times = Math.max(0, count);
        var length = value instanceof Value.Str str ? str.value().length() : ((Value.Tuple) value).elements().size();
        if (length > 0 && times > MAX_SEQUENCE_LENGTH / length) {
            throw new ExecutionFault(OVERFLOW_ERROR, "'*'", "cannot repeat a " + value.typeName() + " of length "
                                                            + length + " " + count + " times");
        }
        if (value instanceof Value.Str str) {
            return Value.string(str.value().repeat((int) times));
        }
        var elements = ((Value.Tuple) value).elements();
        var repeated = new ArrayList<Value>((int) (times * elements.size()));
        for (int i = 0; i < times; i++) {
            repeated.addAll(elements);
        }
        return new Value.Tuple(repeated);
    }

    private static Value integerArithmetic(BinaryOperator operator, long a, long b) {
        try {
            return switch (operator) {
                case ADD -> Value.integer(Math.addExact(a, b));
                case SUB -> Value.integer(Math.subtractExact(a, b));
                case MUL -> Value.integer(Math.multiplyExact(a, b));
                case DIV -> {
                    checkDivisor(operator, b == 0);
                    yield Value.real((double) a / b);
                }
                case FLOOR_DIV -> {
                    checkDivisor(operator, b == 0);
                    if (a == Long.MIN_VALUE && b == -1) {
                        throw new ArithmeticException("overflow");
                    }
                    yield Value.integer(Math.floorDiv(a, b));
                }
                case MOD -> {
                    checkDivisor(operator, b == 0);
                    yield Value.integer(Math.floorMod(a, b));
                }
                default -> throw new IllegalArgumentException("Not an arithmetic operator: " + operator);
            };
        } catch (ArithmeticException e) {
            throw new ExecutionFault(OVERFLOW_ERROR, "'" + operator.symbol() + "'", "integer overflow");
        }
    }

    private static Value realArithmetic(BinaryOperator operator, double a, double b) {
        return switch (operator) {
            case ADD -> Value.real(a + b);
            case SUB -> Value.real(a - b);
            case MUL -> Value.real(a * b);
            case DIV -> {
                checkDivisor(operator, b == 0.0);
                yield Value.real(a / b);
            }
            case FLOOR_DIV -> {
                checkDivisor(operator, b == 0.0);
                yield Value.real(Math.floor(a / b));
            }
            case MOD -> {
                checkDivisor(operator, b == 0.0);
                yield Value.real(a - b * Math.floor(a / b));
            }
            default -> throw new IllegalArgumentException("Not an arithmetic operator: " + operator);
        };
    }

    static boolean compare(BinaryOperator operator, Value left, Value right) {
        int order;
        if (left instanceof Value.Int a && right instanceof Value.Int b) {
            order = Long.compare(a.value(), b.value());
        } else if (Values.isNumeric(left) && Values.isNumeric(right)) {
            order = Double.compare(Values.asDouble(left), Values.asDouble(right));
        } else if (left instanceof Value.Str a && right instanceof Value.Str b) {
            order = a.value().compareTo(b.value());
        } else if (left instanceof Value.Tuple a && right instanceof Value.Tuple b) {
            return compareElements(operator, a.elements(), b.elements());
        } else {
            throw unsupported(operator, left, right);
        }
        return ordered(operator, order);
    }

    /**
     * Lexicographic order: the first unequal pair decides, otherwise the shorter tuple is smaller.
     */
    private static boolean compareElements(BinaryOperator operator, List<Value> left, List<Value> right) {
        var common = Math.min(left.size(), right.size());
        for (int i = 0; i < common; i++) {
            if (!equal(left.get(i), right.get(i))) {
                return compare(operator, left.get(i), right.get(i));
            }
        }
        return ordered(operator, Integer.compare(left.size(), right.size()));
    }

    private static boolean ordered(BinaryOperator operator, int order) {
        return switch (operator) {
            case LT -> order < 0;
            case LE -> order <= 0;
            case GT -> order > 0;
            case GE -> order >= 0;
            default -> throw new IllegalArgumentException("Not an ordering operator: " + operator);
        };
    }

    /**
     * Substring test of {@code in} on strings.
     */
    static boolean containsText(Value.Str text, Value needle) {
        if (!(needle instanceof Value.Str part)) {
            throw new ExecutionFault(TYPE_ERROR, "'in'", "'in <str>' requires a string as left operand, not "
                                                         + needle.typeName());
        }
        return text.value().contains(part.value());
    }

    private static void checkDivisor(BinaryOperator operator, boolean zero) {
        if (zero) {
            throw new ExecutionFault(ZERO_DIVISION_ERROR, "'" + operator.symbol() + "'", "division by zero");
        }
    }

    static ExecutionFault unsupported(BinaryOperator operator, Value left, Value right) {
        return new ExecutionFault(TYPE_ERROR, "'" + operator.symbol() + "'",
                                  "unsupported operand types " + left.typeName() + " and " + right.typeName());
    }
}
