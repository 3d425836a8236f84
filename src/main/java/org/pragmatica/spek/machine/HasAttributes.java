package org.pragmatica.spek.machine;

import io.vavr.control.Option;

import java.util.List;

/**
 * Heap object that owns named fields and may forward unresolved lookups along a delegation chain.
 * The chain is fixed once the object is constructed.
 */
public interface HasAttributes {

    String className();

    Option<Value> field(String name);

    boolean hasField(String name);

    void setField(String name, Value value);

    /**
     * Lookup targets tried, in order, after the object's own class has no such attribute.
     */
    List<Value> delegationChain();
}
