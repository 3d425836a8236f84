package org.pragmatica.spek.machine;

/**
 * Raised while a task executes. Inside a {@code try} the fault is handed to the handler as an exception value;
 * otherwise the machine turns it into a {@link org.pragmatica.spek.error.RuntimeFailure} of that task. Fatal
 * faults skip every handler.
 */
final class ExecutionFault extends RuntimeException {
    static final String RUNTIME_ERROR = "RuntimeError";
    static final String TYPE_ERROR = "TypeError";
    static final String VALUE_ERROR = "ValueError";
    static final String INDEX_ERROR = "IndexError";
    static final String KEY_ERROR = "KeyError";
    static final String ATTRIBUTE_ERROR = "AttributeError";
    static final String ZERO_DIVISION_ERROR = "ZeroDivisionError";
    static final String OVERFLOW_ERROR = "OverflowError";
    static final String RECURSION_ERROR = "RecursionError";

    private final String type;
    private final String operation;
    private final String reason;
    private final boolean fatal;

    ExecutionFault(String operation, String reason) {
        this(RUNTIME_ERROR, operation, reason, false);
    }

    ExecutionFault(String type, String operation, String reason) {
        this(type, operation, reason, false);
    }

    private ExecutionFault(String type, String operation, String reason, boolean fatal) {
        super(operation + ": " + reason, null, false, false);
        this.type = type;
        this.operation = operation;
        this.reason = reason;
        this.fatal = fatal;
    }

    /**
     * Fault no {@code except} clause can handle.
     */
    static ExecutionFault fatal(String operation, String reason) {
        return new ExecutionFault(RUNTIME_ERROR, operation, reason, true);
    }

    /**
     * Fault for an exception raised by a {@code raise} statement.
     */
    static ExecutionFault raised(Value.ExceptionValue exception) {
        return new ExecutionFault(exception.type(), exception.type(), exception.message(), false);
    }

    String type() {
        return type;
    }

    String operation() {
        return operation;
    }

    String reason() {
        return reason;
    }

    boolean fatal() {
        return fatal;
    }

    /**
     * Value an {@code except} clause receives.
     */
    Value.ExceptionValue exception() {
        return new Value.ExceptionValue(type, reason);
    }
}
