package org.pragmatica.spek.program;

public enum UnitKind {
    SCRIPT,
    FUNCTION,
    METHOD,
    GETTER,
    SETTER,
    FIELDS
}
