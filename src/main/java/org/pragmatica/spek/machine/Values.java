package org.pragmatica.spek.machine;

/**
 * Formatting and classification of primitive values.
 */
public final class Values {
    private Values() {}

    public static boolean isNumeric(Value value) {
        return value instanceof Value.Int || value instanceof Value.Real;
    }

    public static double asDouble(Value value) {
        if (value instanceof Value.Int number) {
            return number.value();
        }
        if (value instanceof Value.Real number) {
            return number.value();
        }
        throw new IllegalArgumentException("Not a number: " + value);
    }

    /**
     * Text of a value that does not live on the heap. References, also inside tuples, are rendered by their
     * creation id.
     */
    public static String format(Value value) {
        if (value instanceof Value.None) {
            return "None";
        }
        if (value instanceof Value.Bool bool) {
            return bool.value() ? "True" : "False";
        }
        if (value instanceof Value.Int number) {
            return Long.toString(number.value());
        }
        if (value instanceof Value.Real number) {
            return Double.toString(number.value());
        }
        if (value instanceof Value.Str str) {
            return quote(str.value());
        }
        if (value instanceof Value.Ref ref) {
            return "@" + ref.id();
        }
        if (value instanceof Value.Tuple tuple) {
            var parts = tuple.elements().stream().map(Values::format).toList();
            return parts.size() == 1 ? "(" + parts.get(0) + ",)" : "(" + String.join(", ", parts) + ")";
        }
        if (value instanceof Value.ExceptionValue exception) {
            return exception.type() + "(" + quote(exception.message()) + ")";
        }
        if (value instanceof Value.Function function) {
            return "<function " + function.unit() + ">";
        }
        if (value instanceof Value.BoundMethod method) {
            return "<method " + method.unit() + " of @" + method.receiver() + ">";
        }
        if (value instanceof Value.ClassValue type) {
            return "<class " + type.name() + ">";
        }
        if (value instanceof Value.Builtin builtin) {
            return "<builtin " + builtin.name() + ">";
        }
        var method = (Value.NativeMethod) value;
        return "<method " + method.name() + " of @" + method.receiver() + ">";
    }

    /**
     * Double-quoted string literal with escapes, as the lexer reads it back.
     */
    public static String quote(String text) {
        var sb = new StringBuilder(text.length() + 2);
        sb.append('"');
        for (int i = 0; i < text.length(); i++) {
            var c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\0' -> sb.append("\\0");
                default -> sb.append(c);
            }
        }
        sb.append('"');
        return sb.toString();
    }
}
