package org.pragmatica.spek.validation;

import io.vavr.control.Option;
import org.pragmatica.spek.syntax.Expression;
import org.pragmatica.spek.syntax.SourceModule;
import org.pragmatica.spek.syntax.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A syntax tree that passed validation, together with what the validator learned about it.
 *
 * <p>Bindings are keyed by node identity: two equal-looking name references at different places
 * are different keys.
 */
public final class ValidatedModule {
    private final SourceModule module;
    private final Map<Object, Symbol> bindings;
    private final Map<String, ClassShape> classes;
    private final Set<String> suspendingFunctions;
    private final Set<String> suspendingMethods;

    ValidatedModule(SourceModule module,
                    IdentityHashMap<Object, Symbol> bindings,
                    Map<String, ClassShape> classes,
                    Set<String> suspendingFunctions,
                    Set<String> suspendingMethods) {
        this.module = module;
        this.bindings = Collections.unmodifiableMap(new IdentityHashMap<>(bindings));
        this.classes = Collections.unmodifiableMap(new LinkedHashMap<>(classes));
        this.suspendingFunctions = Set.copyOf(suspendingFunctions);
        this.suspendingMethods = Set.copyOf(suspendingMethods);
    }

    public SourceModule module() {
        return module;
    }

    public Option<Symbol> symbol(Expression.Name reference) {
        return Option.of(bindings.get(reference));
    }

    public Option<Symbol> symbol(Statement.VarDeclaration declaration) {
        return Option.of(bindings.get(declaration));
    }

    public Option<Symbol> symbol(Statement.Parameter parameter) {
        return Option.of(bindings.get(parameter));
    }

    /**
     * Symbol the loop variable of {@code loop} is stored to.
     */
    public Option<Symbol> symbol(Statement.For loop) {
        return Option.of(bindings.get(loop));
    }

    /**
     * Classes by name, in declaration order.
     */
    public Map<String, ClassShape> classes() {
        return classes;
    }

    /**
     * Class followed by its ancestors, nearest first.
     */
    public List<ClassShape> lineage(String className) {
        var result = new ArrayList<ClassShape>();
        var seen = new HashSet<String>();
        var current = Option.of(classes.get(className));
        while (current.isDefined() && seen.add(current.get().name())) {
            result.add(current.get());
            current = current.get()
                             .superclass()
                             .flatMap(name -> Option.of(classes.get(name)));
        }
        return result;
    }

    /**
     * Whether the module-level function contains a suspension statement.
     */
    public boolean suspends(String function) {
        return suspendingFunctions.contains(function);
    }

    /**
     * Whether the method, as declared by the given class itself, contains a suspension statement.
     */
    public boolean suspends(String className, String method) {
        return suspendingMethods.contains(className + "." + method);
    }
}
