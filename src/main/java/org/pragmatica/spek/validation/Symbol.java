package org.pragmatica.spek.validation;

import org.pragmatica.spek.tree.SourceSpan;

/**
 * What a name refers to after resolution.
 *
 * @param kind        Declaration kind
 * @param name        Declared name
 * @param declaration Span of the declaring node, {@link SourceSpan#NONE} for builtins
 */
public record Symbol(Kind kind, String name, SourceSpan declaration) {

    public enum Kind {
        GLOBAL,
        LOCAL,
        PARAMETER,
        SELF,
        FUNCTION,
        CLASS,
        PROPERTY,
        BUILTIN
    }

    public static Symbol builtin(String name) {
        return new Symbol(Kind.BUILTIN, name, SourceSpan.NONE);
    }

    /**
     * Whether assignment through a plain name is meaningful for this symbol.
     */
    public boolean isAssignable() {
        return kind == Kind.GLOBAL || kind == Kind.LOCAL || kind == Kind.PARAMETER || kind == Kind.PROPERTY;
    }

    /**
     * Whether the value lives in a frame slot of the current code unit.
     */
    public boolean isFrameSlot() {
        return kind == Kind.LOCAL || kind == Kind.PARAMETER;
    }
}
