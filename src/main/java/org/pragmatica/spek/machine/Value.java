package org.pragmatica.spek.machine;

import java.util.List;

/**
 * Runtime value. Values are immutable; heap objects are reached through {@link Ref}, which compares by object id.
 */
public sealed interface Value {

    Value NONE = new None();
    Value TRUE = new Bool(true);
    Value FALSE = new Bool(false);

    /**
     * Short type name used in runtime failure messages.
     */
    String typeName();

    static Value bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    static Value integer(long value) {
        return new Int(value);
    }

    static Value real(double value) {
        return new Real(value);
    }

    static Value string(String value) {
        return new Str(value);
    }

    record None() implements Value {
        @Override
        public String typeName() {
            return "None";
        }
    }

    record Bool(boolean value) implements Value {
        @Override
        public String typeName() {
            return "bool";
        }
    }

    record Int(long value) implements Value {
        @Override
        public String typeName() {
            return "int";
        }
    }

    record Real(double value) implements Value {
        @Override
        public String typeName() {
            return "float";
        }
    }

    record Str(String value) implements Value {
        @Override
        public String typeName() {
            return "str";
        }
    }

    /**
     * Reference to a heap object by creation id.
     */
    record Ref(int id) implements Value {
        @Override
        public String typeName() {
            return "object";
        }
    }

    record Function(String unit) implements Value {
        @Override
        public String typeName() {
            return "function";
        }
    }

    /**
     * Method already bound to its receiver.
     */
    record BoundMethod(int receiver, String unit) implements Value {
        @Override
        public String typeName() {
            return "method";
        }
    }

    record ClassValue(String name) implements Value {
        @Override
        public String typeName() {
            return "class";
        }
    }

    record Builtin(String name) implements Value {
        @Override
        public String typeName() {
            return "builtin";
        }
    }

    /**
     * Immutable sequence. Equality and hashing follow the elements; the nesting depth is kept so operations on
     * deeply nested tuples can be refused up front.
     */
    final class Tuple implements Value {
        private final List<Value> elements;
        private final int depth;
        private final int hash;

        public Tuple(List<Value> elements) {
            this.elements = List.copyOf(elements);
            var deepest = 0;
            for (var element : this.elements) {
                if (element instanceof Tuple nested) {
                    deepest = Math.max(deepest, nested.depth);
                }
            }
            this.depth = deepest + 1;
            this.hash = this.elements.hashCode();
        }

        public List<Value> elements() {
            return elements;
        }

        /**
         * One for a tuple without tuple elements.
         */
        public int depth() {
            return depth;
        }

        @Override
        public String typeName() {
            return "tuple";
        }

        @Override
        public boolean equals(Object other) {
            return this == other || other instanceof Tuple tuple && hash == tuple.hash && elements.equals(tuple.elements);
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public String toString() {
            return "Tuple" + elements;
        }
    }

    /**
     * Raised or constructed exception; {@code type} is the name of its exception class.
     */
    record ExceptionValue(String type, String message) implements Value {
        @Override
        public String typeName() {
            return type;
        }
    }

    /**
     * Method of a list or dictionary bound to its receiver.
     */
    record NativeMethod(int receiver, String name) implements Value {
        @Override
        public String typeName() {
            return "method";
        }
    }
}
