package org.pragmatica.spek.validation;

import io.vavr.control.Option;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One level of name bindings. Blocks do not open scopes; functions, methods and accessors do.
 */
final class Scope {
    private final Option<Scope> parent;
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();
    private final boolean function;

    private Scope(Option<Scope> parent, boolean function) {
        this.parent = parent;
        this.function = function;
    }

    static Scope root() {
        return new Scope(Option.none(), false);
    }

    /**
     * Nested scope; function scopes hold locals, the module scope holds globals.
     */
    Scope child(boolean function) {
        return new Scope(Option.some(this), function);
    }

    boolean isFunction() {
        return function;
    }

    Option<Symbol> declared(String name) {
        return Option.of(symbols.get(name));
    }

    void declare(Symbol symbol) {
        symbols.put(symbol.name(), symbol);
    }

    Option<Symbol> lookup(String name) {
        var local = symbols.get(name);
        if (local != null) {
            return Option.some(local);
        }
        return parent.flatMap(p -> p.lookup(name));
    }
}
