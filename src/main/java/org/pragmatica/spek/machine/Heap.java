package org.pragmatica.spek.machine;

import io.vavr.control.Option;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Object store of a machine state. Objects are kept in creation order and identified by creation id.
 */
public final class Heap {
    private final LinkedHashMap<Integer, HeapObject> objects;
    private int nextId;

    Heap() {
        this.objects = new LinkedHashMap<>();
        this.nextId = 1;
    }

    private Heap(Heap other) {
        this.objects = new LinkedHashMap<>();
        other.objects.forEach((id, object) -> objects.put(id, object.copy()));
        this.nextId = other.nextId;
    }

    public Option<HeapObject> get(int id) {
        return Option.of(objects.get(id));
    }

    /**
     * Live objects in creation order.
     */
    public Collection<HeapObject> objects() {
        return Collections.unmodifiableCollection(objects.values());
    }

    public int size() {
        return objects.size();
    }

    HeapObject.Instance newInstance(String className, List<String> fields) {
        var instance = new HeapObject.Instance(nextId++, className, fields);
        objects.put(instance.id(), instance);
        return instance;
    }

    HeapObject.ListObject newList(List<Value> elements) {
        var list = new HeapObject.ListObject(nextId++, elements);
        objects.put(list.id(), list);
        return list;
    }

    HeapObject.DictObject newDict(Map<Value, Value> entries) {
        var dict = new HeapObject.DictObject(nextId++, entries);
        objects.put(dict.id(), dict);
        return dict;
    }

    /**
     * Removes every object not reachable from {@code roots}.
     *
     * @return number of objects removed
     */
    int collect(Collection<Value> roots) {
        var marked = new HashSet<Integer>();
        var work = new ArrayDeque<Value>(roots);
        while (!work.isEmpty()) {
            var value = work.pop();
            if (value instanceof Value.Tuple tuple) {
                work.addAll(tuple.elements());
                continue;
            }
            var id = referencedId(value);
            if (id < 0 || !marked.add(id)) {
                continue;
            }
            var object = objects.get(id);
            if (object != null) {
                work.addAll(object.references());
            }
        }
        var before = objects.size();
        objects.keySet().retainAll(marked);
        return before - objects.size();
    }

    static int referencedId(Value value) {
        if (value instanceof Value.Ref ref) {
            return ref.id();
        }
        if (value instanceof Value.BoundMethod method) {
            return method.receiver();
        }
        if (value instanceof Value.NativeMethod method) {
            return method.receiver();
        }
        return -1;
    }

    Heap copy() {
        return new Heap(this);
    }
}
