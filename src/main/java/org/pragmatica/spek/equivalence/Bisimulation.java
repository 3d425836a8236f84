package org.pragmatica.spek.equivalence;

import org.pragmatica.spek.machine.TransitionLabel;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Coarsest bisimulation of a transition system, computed by signature-based partition refinement.
 *
 * <p>Blocks start out as the classes of equal state content and are split until every two states in a block
 * can match each other's moves into the same blocks. In {@link EquivalenceMode#WEAK} mode the moves are those
 * of the saturated system: a label surrounded by any number of private steps, or any number of private steps
 * alone.
 */
public final class Bisimulation {
    private final Lts lts;
    private final int[] blocks;
    private final int blockCount;

    private record Move(TransitionLabel label, int block) {}

    private record Signature(int block, Set<Move> moves) {}

    private Bisimulation(Lts lts, int[] blocks, int blockCount) {
        this.lts = lts;
        this.blocks = blocks;
        this.blockCount = blockCount;
    }

    public static Bisimulation of(Lts lts, EquivalenceMode mode) {
        var moves = mode == EquivalenceMode.WEAK ? saturate(lts) : direct(lts);
        var blocks = new int[lts.size()];
        var count = initialBlocks(lts, blocks);
        while (true) {
            var signatures = new HashMap<Signature, Integer>();
            var next = new int[blocks.length];
            for (int state = 0; state < blocks.length; state++) {
                var signature = new HashSet<Move>();
                for (var transition : moves.get(state)) {
                    signature.add(new Move(transition.label(), blocks[transition.target()]));
                }
                var key = new Signature(blocks[state], signature);
                var block = signatures.get(key);
                if (block == null) {
                    block = signatures.size();
                    signatures.put(key, block);
                }
                next[state] = block;
            }
            System.arraycopy(next, 0, blocks, 0, blocks.length);
            if (signatures.size() == count) {
                return new Bisimulation(lts, blocks, count);
            }
            count = signatures.size();
        }
    }

    public Lts lts() {
        return lts;
    }

    public int blockCount() {
        return blockCount;
    }

    public int block(int state) {
        return blocks[state];
    }

    public boolean equivalent(int left, int right) {
        return blocks[left] == blocks[right];
    }

    /**
     * Quotient system: one state per block, carrying the transitions of all its members. In weak mode private
     * self-loops are dropped, as they are unobservable.
     */
    public Lts quotient(EquivalenceMode mode) {
        var builder = new Lts.Builder();
        var representatives = new int[blockCount];
        var order = new ArrayList<Integer>();
        var seen = new BitSet(blockCount);
        // Blocks are numbered in order of first appearance, so a block's number equals its position here.
        for (int state = 0; state < lts.size(); state++) {
            if (!seen.get(blocks[state])) {
                seen.set(blocks[state]);
                representatives[blocks[state]] = state;
                order.add(blocks[state]);
            }
        }
        order.forEach(block -> builder.addState(lts.content(representatives[block])));
        for (int state = 0; state < lts.size(); state++) {
            var source = blocks[state];
            for (var transition : lts.transitions(state)) {
                var target = blocks[transition.target()];
                if (mode == EquivalenceMode.WEAK
                    && !transition.label().isObservable()
                    && source == target) {
                    continue;
                }
                builder.addTransition(source, transition.label(), target);
            }
        }
        return builder.build(blocks[lts.initial()]);
    }

    private static int initialBlocks(Lts lts, int[] blocks) {
        var byContent = new HashMap<String, Integer>();
        for (int state = 0; state < lts.size(); state++) {
            blocks[state] = byContent.computeIfAbsent(lts.content(state), content -> byContent.size());
        }
        return byContent.size();
    }

    private static List<Set<Lts.Transition>> direct(Lts lts) {
        var result = new ArrayList<Set<Lts.Transition>>(lts.size());
        for (int state = 0; state < lts.size(); state++) {
            result.add(new LinkedHashSet<>(lts.transitions(state)));
        }
        return result;
    }

    /**
     * Weak moves of every state: {@code tau* a tau*} for each observable label {@code a}, and {@code tau*} as a
     * private move, which always includes staying put.
     */
    private static List<Set<Lts.Transition>> saturate(Lts lts) {
        var closures = new ArrayList<BitSet>(lts.size());
        for (int state = 0; state < lts.size(); state++) {
            closures.add(privateClosure(lts, state));
        }
        var result = new ArrayList<Set<Lts.Transition>>(lts.size());
        for (int state = 0; state < lts.size(); state++) {
            var moves = new LinkedHashSet<Lts.Transition>();
            var before = closures.get(state);
            for (int reached = before.nextSetBit(0); reached >= 0; reached = before.nextSetBit(reached + 1)) {
                moves.add(new Lts.Transition(TransitionLabel.PRIVATE, reached));
                for (var transition : lts.transitions(reached)) {
                    if (!transition.label().isObservable()) {
                        continue;
                    }
                    var after = closures.get(transition.target());
                    for (int target = after.nextSetBit(0); target >= 0; target = after.nextSetBit(target + 1)) {
                        moves.add(new Lts.Transition(transition.label(), target));
                    }
                }
            }
            result.add(moves);
        }
        return result;
    }

    private static BitSet privateClosure(Lts lts, int state) {
        var reached = new BitSet(lts.size());
        var agenda = new ArrayDeque<Integer>();
        reached.set(state);
        agenda.add(state);
        while (!agenda.isEmpty()) {
            var current = agenda.poll();
            for (var transition : lts.transitions(current)) {
                if (!transition.label().isObservable() && !reached.get(transition.target())) {
                    reached.set(transition.target());
                    agenda.add(transition.target());
                }
            }
        }
        return reached;
    }
}
