package org.pragmatica.spek.validation;

/**
 * Codes of the diagnostics reported by the {@link Validator}.
 */
public enum DiagnosticCode {
    UNDECLARED_NAME("E0301"),
    GETTER_ONLY_ASSIGNMENT("E0302"),
    SUSPENSION_NOT_ALLOWED("E0303"),
    SYNCHRONOUS_CALL_OF_SUSPENDING("E0304"),
    INVALID_DELEGATE("E0305"),
    DUPLICATE_DECLARATION("E0306"),
    RETURN_OUTSIDE_FUNCTION("E0307"),
    LOOP_CONTROL_OUTSIDE_LOOP("E0308"),
    SELF_OUTSIDE_METHOD("E0309"),
    NESTED_DECLARATION("E0310"),
    UNKNOWN_SUPERCLASS("E0311"),
    INHERITANCE_CYCLE("E0312"),
    UNKNOWN_MEMBER("E0313"),
    FORWARD_FIELD_REFERENCE("E0314"),
    ARITY_MISMATCH("E0315"),
    INVALID_ASSIGNMENT_TARGET("E0316"),
    RERAISE_OUTSIDE_HANDLER("E0317"),
    MISPLACED_CATCH_ALL("E0318");

    private final String code;

    DiagnosticCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
