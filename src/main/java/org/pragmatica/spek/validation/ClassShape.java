package org.pragmatica.spek.validation;

import io.vavr.control.Option;
import org.pragmatica.spek.syntax.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Members a class declares itself, in declaration order. Inherited members are not included.
 * When a name is declared twice, the first declaration wins; the duplicate is reported by the validator.
 */
public record ClassShape(
    Statement.ClassDeclaration declaration,
    Map<String, Statement.VarDeclaration> fields,
    Map<String, Statement.FunctionDeclaration> methods,
    Map<String, Statement.PropertyDeclaration> properties,
    List<String> delegates
) {
    public static final String CONSTRUCTOR = "init";

    public ClassShape {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        methods = Collections.unmodifiableMap(new LinkedHashMap<>(methods));
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        delegates = List.copyOf(delegates);
    }

    static ClassShape of(Statement.ClassDeclaration declaration) {
        var fields = new LinkedHashMap<String, Statement.VarDeclaration>();
        var methods = new LinkedHashMap<String, Statement.FunctionDeclaration>();
        var properties = new LinkedHashMap<String, Statement.PropertyDeclaration>();
        var delegates = new ArrayList<String>();
        for (var member : declaration.members()) {
            if (member instanceof Statement.VarDeclaration field && !declaresMember(fields, methods, properties, field.name())) {
                fields.put(field.name(), field);
            } else if (member instanceof Statement.FunctionDeclaration method
                       && !declaresMember(fields, methods, properties, method.name())) {
                methods.put(method.name(), method);
            } else if (member instanceof Statement.PropertyDeclaration property
                       && !declaresMember(fields, methods, properties, property.name())) {
                properties.put(property.name(), property);
            } else if (member instanceof Statement.DelegateDeclaration delegate && !delegates.contains(delegate.field())) {
                delegates.add(delegate.field());
            }
        }
        return new ClassShape(declaration, fields, methods, properties, delegates);
    }

    private static boolean declaresMember(Map<String, ?> fields, Map<String, ?> methods, Map<String, ?> properties, String name) {
        return fields.containsKey(name) || methods.containsKey(name) || properties.containsKey(name);
    }

    public String name() {
        return declaration.name();
    }

    public Option<String> superclass() {
        return declaration.superclass();
    }

    public boolean declares(String member) {
        return declaresMember(fields, methods, properties, member);
    }

    public Option<Statement.FunctionDeclaration> constructor() {
        return Option.of(methods.get(CONSTRUCTOR));
    }
}
