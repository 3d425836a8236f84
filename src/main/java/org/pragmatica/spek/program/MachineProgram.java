package org.pragmatica.spek.program;

import io.vavr.control.Option;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of the translator and input of the machine: every code unit, every class layout and the
 * module-level slots. Immutable and shareable between machine states.
 */
public record MachineProgram(
    String entry,
    Map<String, CodeUnit> units,
    Map<String, ClassLayout> classes,
    List<String> globals,
    Map<String, PropertyLayout> properties
) {
    public MachineProgram {
        units = Collections.unmodifiableMap(new LinkedHashMap<>(units));
        classes = Collections.unmodifiableMap(new LinkedHashMap<>(classes));
        globals = List.copyOf(globals);
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        if (!units.containsKey(entry)) {
            throw new IllegalArgumentException("Entry unit " + entry + " is not part of the program");
        }
    }

    public CodeUnit unit(String name) {
        var unit = units.get(name);
        if (unit == null) {
            throw new IllegalArgumentException("Unknown code unit: " + name);
        }
        return unit;
    }

    public Option<ClassLayout> classLayout(String name) {
        return Option.of(classes.get(name));
    }

    public int globalSlot(String name) {
        return globals.indexOf(name);
    }
}
