package org.pragmatica.spek.program;

import java.util.List;

/**
 * Compiled body of one function, method, accessor, field-initialiser block or of the top-level script.
 * Execution always starts at fragment 0.
 *
 * @param name      Qualified unit name, e.g. {@code "f"}, {@code "Box.move"}, {@code "Box.width.get"}
 * @param kind      What the unit was compiled from
 * @param arity     Number of explicit parameters
 * @param receiver  Whether slot 0 holds {@code self}
 * @param slots     Slot names; parameters follow the receiver, locals and loop bookkeeping follow parameters
 * @param fragments Fragments, indexed by position
 */
public record CodeUnit(
    String name,
    UnitKind kind,
    int arity,
    boolean receiver,
    List<String> slots,
    List<Fragment> fragments
) {
    public CodeUnit {
        slots = List.copyOf(slots);
        fragments = List.copyOf(fragments);
        if (fragments.isEmpty()) {
            throw new IllegalArgumentException("Code unit " + name + " has no fragments");
        }
    }

    public Fragment fragment(int index) {
        return fragments.get(index);
    }

    /**
     * Index of the first parameter slot.
     */
    public int firstParameter() {
        return receiver ? 1 : 0;
    }

    public boolean suspends() {
        return fragments.stream()
                        .anyMatch(fragment -> fragment.terminator() instanceof Terminator.Suspend);
    }
}
