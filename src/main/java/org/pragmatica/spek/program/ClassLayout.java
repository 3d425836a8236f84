package org.pragmatica.spek.program;

import io.vavr.control.Option;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime shape of a class with inheritance already flattened: inherited members come first and
 * overriding declarations replace the inherited unit.
 *
 * @param name              Class name
 * @param superclass        Direct superclass, if any
 * @param fields            Field names in initialisation order
 * @param methods           Method name to code unit
 * @param properties        Property name to accessor units
 * @param delegates         Fields whose values receive unresolved attribute lookups, in lookup order
 * @param fieldInitialisers Field-initialiser units to run on construction, ancestors first
 * @param constructor       {@code init} unit run after the field initialisers
 */
public record ClassLayout(
    String name,
    Option<String> superclass,
    List<String> fields,
    Map<String, String> methods,
    Map<String, PropertyLayout> properties,
    List<String> delegates,
    List<String> fieldInitialisers,
    Option<String> constructor
) {
    public ClassLayout {
        fields = List.copyOf(fields);
        methods = Collections.unmodifiableMap(new LinkedHashMap<>(methods));
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        delegates = List.copyOf(delegates);
        fieldInitialisers = List.copyOf(fieldInitialisers);
    }
}
