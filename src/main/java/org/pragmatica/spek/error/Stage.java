package org.pragmatica.spek.error;

/**
 * Pipeline stage that produced a diagnostic.
 */
public enum Stage {
    LEX("lex"),
    PARSE("parse"),
    VALIDATION("validation"),
    TRANSLATION("translation");

    private final String display;

    Stage(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }
}
