package org.pragmatica.spek.machine;

import io.vavr.control.Option;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable object living on the machine heap. Copies are deep with respect to the object itself; values are
 * immutable so they are shared.
 */
public sealed interface HeapObject {

    int id();

    String kind();

    HeapObject copy();

    /**
     * Values this object refers to, for reachability.
     */
    List<Value> references();

    /**
     * Instance of a script class.
     */
    final class Instance implements HeapObject, HasAttributes {
        private final int id;
        private final String className;
        private final LinkedHashMap<String, Value> fields;
        private List<Value> delegationChain;

        Instance(int id, String className, List<String> fieldNames) {
            this.id = id;
            this.className = className;
            this.fields = new LinkedHashMap<>();
            fieldNames.forEach(name -> fields.put(name, Value.NONE));
            this.delegationChain = List.of();
        }

        private Instance(Instance other) {
            this.id = other.id;
            this.className = other.className;
            this.fields = new LinkedHashMap<>(other.fields);
            this.delegationChain = other.delegationChain;
        }

        @Override
        public int id() {
            return id;
        }

        @Override
        public String kind() {
            return className;
        }

        @Override
        public String className() {
            return className;
        }

        @Override
        public Option<Value> field(String name) {
            return Option.of(fields.get(name));
        }

        @Override
        public boolean hasField(String name) {
            return fields.containsKey(name);
        }

        @Override
        public void setField(String name, Value value) {
            if (!fields.containsKey(name)) {
                throw new IllegalArgumentException("Instance of " + className + " has no field " + name);
            }
            fields.put(name, value);
        }

        @Override
        public List<Value> delegationChain() {
            return delegationChain;
        }

        void fixDelegationChain(List<Value> chain) {
            this.delegationChain = List.copyOf(chain);
        }

        public Map<String, Value> fields() {
            return Collections.unmodifiableMap(fields);
        }

        @Override
        public Instance copy() {
            return new Instance(this);
        }

        @Override
        public List<Value> references() {
            var result = new ArrayList<Value>(fields.values());
            result.addAll(delegationChain);
            return result;
        }
    }

    final class ListObject implements HeapObject {
        private final int id;
        private final List<Value> elements;

        ListObject(int id, List<Value> elements) {
            this.id = id;
            this.elements = new ArrayList<>(elements);
        }

        @Override
        public int id() {
            return id;
        }

        @Override
        public String kind() {
            return "list";
        }

        public List<Value> elements() {
            return elements;
        }

        @Override
        public ListObject copy() {
            return new ListObject(id, elements);
        }

        @Override
        public List<Value> references() {
            return elements;
        }
    }

    final class DictObject implements HeapObject {
        private final int id;
        private final LinkedHashMap<Value, Value> entries;

        DictObject(int id, Map<Value, Value> entries) {
            this.id = id;
            this.entries = new LinkedHashMap<>(entries);
        }

        @Override
        public int id() {
            return id;
        }

        @Override
        public String kind() {
            return "dict";
        }

        public Map<Value, Value> entries() {
            return entries;
        }

        @Override
        public DictObject copy() {
            return new DictObject(id, entries);
        }

        @Override
        public List<Value> references() {
            var result = new ArrayList<Value>(entries.keySet());
            result.addAll(entries.values());
            return result;
        }
    }
}
