package org.pragmatica.spek.machine;

import io.vavr.control.Option;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of a machine state for renderers: clock, globals, live objects and task statuses.
 * Changing the state afterwards does not change the snapshot.
 */
public record HeapSnapshot(
    double clock,
    Map<String, Value> globals,
    List<ObjectView> objects,
    List<TaskView> tasks
) {
    public HeapSnapshot {
        globals = Collections.unmodifiableMap(new LinkedHashMap<>(globals));
        objects = List.copyOf(objects);
        tasks = List.copyOf(tasks);
    }

    /**
     * @param id       Creation id of the object
     * @param kind     Class name, {@code list} or {@code dict}
     * @param contents Field values; list elements keyed by index; dictionary values keyed by their key
     */
    public record ObjectView(int id, String kind, Map<Value, Value> contents) {
        public ObjectView {
            contents = Collections.unmodifiableMap(new LinkedHashMap<>(contents));
        }

        public Option<Value> get(String field) {
            return Option.of(contents.get(Value.string(field)));
        }
    }

    public record TaskView(int id, String entry, TaskStatus status) {}

    static HeapSnapshot of(MachineState state) {
        var globals = new LinkedHashMap<String, Value>();
        var names = state.program().globals();
        for (int i = 0; i < names.size(); i++) {
            globals.put(names.get(i), state.global(i));
        }
        var objects = new ArrayList<ObjectView>();
        for (var object : state.heap().objects()) {
            objects.add(view(object));
        }
        var tasks = new ArrayList<TaskView>();
        for (var task : state.tasks()) {
            tasks.add(new TaskView(task.id(), task.entry(), task.status()));
        }
        return new HeapSnapshot(state.clock(), globals, objects, tasks);
    }

    private static ObjectView view(HeapObject object) {
        var contents = new LinkedHashMap<Value, Value>();
        if (object instanceof HeapObject.Instance instance) {
            instance.fields().forEach((name, value) -> contents.put(Value.string(name), value));
        } else if (object instanceof HeapObject.ListObject list) {
            for (int i = 0; i < list.elements().size(); i++) {
                contents.put(Value.integer(i), list.elements().get(i));
            }
        } else if (object instanceof HeapObject.DictObject dict) {
            contents.putAll(dict.entries());
        }
        return new ObjectView(object.id(), object.kind(), contents);
    }

    public Option<Value> global(String name) {
        return Option.of(globals.get(name));
    }

    /**
     * Object a reference points to, if it is still alive.
     */
    public Option<ObjectView> object(Value reference) {
        if (!(reference instanceof Value.Ref ref)) {
            return Option.none();
        }
        return Option.ofOptional(objects.stream()
                                        .filter(view -> view.id() == ref.id())
                                        .findFirst());
    }

    public Option<TaskView> task(int id) {
        return Option.ofOptional(tasks.stream()
                                      .filter(view -> view.id() == id)
                                      .findFirst());
    }
}
