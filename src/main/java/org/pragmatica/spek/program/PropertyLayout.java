package org.pragmatica.spek.program;

import io.vavr.control.Option;

/**
 * Accessor units of a property.
 */
public record PropertyLayout(String name, String getter, Option<String> setter) {}
