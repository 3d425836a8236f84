package org.pragmatica.spek.machine;

import io.vavr.control.Option;
import org.pragmatica.spek.program.CodeUnit;

import java.util.Arrays;
import java.util.List;

/**
 * Slot values of one activation of a code unit.
 */
public final class Frame {
    private final String unit;
    private final Value[] slots;

    private Frame(String unit, Value[] slots) {
        this.unit = unit;
        this.slots = slots;
    }

    static Frame of(CodeUnit unit, Option<Value> receiver, List<Value> arguments) {
        var slots = new Value[unit.slots().size()];
        Arrays.fill(slots, Value.NONE);
        receiver.forEach(value -> slots[0] = value);
        var first = unit.firstParameter();
        for (int i = 0; i < arguments.size(); i++) {
            slots[first + i] = arguments.get(i);
        }
        return new Frame(unit.name(), slots);
    }

    public String unit() {
        return unit;
    }

    public Value slot(int index) {
        return slots[index];
    }

    public List<Value> slots() {
        return List.of(slots);
    }

    void set(int index, Value value) {
        slots[index] = value;
    }

    Frame copy() {
        return new Frame(unit, slots.clone());
    }
}
