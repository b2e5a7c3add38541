package com.helios.sketchbook.engine.explicit;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.Arrays;
import java.util.function.IntPredicate;

/**
 * Asynchronous state space of one fully specified network (one colour).
 *
 * <p>A state is an int whose bit {@code i} holds variable {@code i}. Attractor data is computed on
 * first use and kept for the lifetime of the instance.
 */
final class ColorDynamics {

    private final int numVars;
    private final int numStates;
    private final long[] tables;
    private final int[][] inputs;

    private int[] sccOf;
    private boolean[] terminalScc;
    private int attractorCount = -1;

    ColorDynamics(int numVars, long[] tables, int[][] inputs) {
        this.numVars = numVars;
        this.numStates = 1 << numVars;
        this.tables = tables;
        this.inputs = inputs;
    }

    boolean update(int var, int state) {
        int[] in = inputs[var];
        int row = 0;
        for (int j = 0; j < in.length; j++) {
            row |= ((state >>> in[j]) & 1) << j;
        }
        return FunctionTables.value(tables[var], row);
    }

    boolean canFlip(int var, int state) {
        return update(var, state) != isSet(state, var);
    }

    boolean isFixedPoint(int state) {
        for (int v = 0; v < numVars; v++) {
            if (canFlip(v, state)) {
                return false;
            }
        }
        return true;
    }

    // ==================== Attractors ====================

    boolean inAttractor(int state) {
        ensureAttractors();
        return terminalScc[sccOf[state]];
    }

    int attractorCount() {
        ensureAttractors();
        return attractorCount;
    }

    /**
     * Iterative Tarjan over the whole state space, followed by marking the SCCs without outgoing edges.
     */
    private void ensureAttractors() {
        if (sccOf != null) {
            return;
        }
        int[] index = new int[numStates];
        int[] low = new int[numStates];
        int[] scc = new int[numStates];
        boolean[] onStack = new boolean[numStates];
        Arrays.fill(index, -1);

        IntArrayList stack = new IntArrayList();
        IntArrayList frameState = new IntArrayList();
        IntArrayList frameNextVar = new IntArrayList();
        int counter = 0;
        int sccCount = 0;

        for (int root = 0; root < numStates; root++) {
            if (index[root] != -1) {
                continue;
            }
            index[root] = low[root] = counter++;
            stack.add(root);
            onStack[root] = true;
            frameState.add(root);
            frameNextVar.add(0);

            while (!frameState.isEmpty()) {
                int top = frameState.size() - 1;
                int s = frameState.getInt(top);
                int var = frameNextVar.getInt(top);
                if (var < numVars) {
                    frameNextVar.set(top, var + 1);
                    if (!canFlip(var, s)) {
                        continue;
                    }
                    int t = s ^ (1 << var);
                    if (index[t] == -1) {
                        index[t] = low[t] = counter++;
                        stack.add(t);
                        onStack[t] = true;
                        frameState.add(t);
                        frameNextVar.add(0);
                    } else if (onStack[t]) {
                        low[s] = Math.min(low[s], index[t]);
                    }
                    continue;
                }

                frameState.removeInt(top);
                frameNextVar.removeInt(top);
                if (low[s] == index[s]) {
                    int member;
                    do {
                        member = stack.removeInt(stack.size() - 1);
                        onStack[member] = false;
                        scc[member] = sccCount;
                    } while (member != s);
                    sccCount++;
                }
                if (!frameState.isEmpty()) {
                    int parent = frameState.getInt(frameState.size() - 1);
                    low[parent] = Math.min(low[parent], low[s]);
                }
            }
        }

        boolean[] terminal = new boolean[sccCount];
        Arrays.fill(terminal, true);
        for (int s = 0; s < numStates; s++) {
            for (int v = 0; v < numVars; v++) {
                if (canFlip(v, s) && scc[s ^ (1 << v)] != scc[s]) {
                    terminal[scc[s]] = false;
                    break;
                }
            }
        }
        int count = 0;
        for (boolean t : terminal) {
            if (t) count++;
        }
        this.sccOf = scc;
        this.terminalScc = terminal;
        this.attractorCount = count;
    }

    // ==================== Sub-spaces ====================

    boolean anyMatching(int mask, int values, IntPredicate test) {
        int free = ~mask & (numStates - 1);
        int sub = free;
        while (true) {
            if (test.test(values | sub)) {
                return true;
            }
            if (sub == 0) {
                return false;
            }
            sub = (sub - 1) & free;
        }
    }

    /** No transition leaves the sub-space: every fixed variable keeps its value. */
    boolean isTrapSpace(int mask, int values) {
        return !anyMatching(mask, values, s -> {
            for (int v = 0; v < numVars; v++) {
                if ((mask & (1 << v)) != 0 && update(v, s) != isSet(values, v)) {
                    return true;
                }
            }
            return false;
        });
    }

    /** A trap space without any trap space strictly inside it. */
    boolean isMinimalTrapSpace(int mask, int values) {
        if (!isTrapSpace(mask, values)) {
            return false;
        }
        int free = ~mask & (numStates - 1);
        // Every non-empty set of extra fixed variables, with every assignment of them.
        for (int extra = free; extra != 0; extra = (extra - 1) & free) {
            for (int assignment = extra; ; assignment = (assignment - 1) & extra) {
                if (isTrapSpace(mask | extra, values | assignment)) {
                    return false;
                }
                if (assignment == 0) {
                    break;
                }
            }
        }
        return true;
    }

    /** No free variable has a constant update function on the sub-space. */
    boolean isNonPercolable(int mask, int values) {
        for (int v = 0; v < numVars; v++) {
            if ((mask & (1 << v)) != 0) {
                continue;
            }
            final int var = v;
            boolean canBeTrue = anyMatching(mask, values, s -> update(var, s));
            boolean canBeFalse = anyMatching(mask, values, s -> !update(var, s));
            if (!(canBeTrue && canBeFalse)) {
                return false;
            }
        }
        return true;
    }

    // ==================== Reachability ====================

    /**
     * Checks for a path visiting the sub-spaces in order. Works backwards: the states of sub-space
     * {@code k} that can reach a valid continuation are kept, down to the first one.
     */
    boolean hasTrajectory(int[] masks, int[] values) {
        boolean[] current = matching(masks[masks.length - 1], values[values.length - 1]);
        for (int k = masks.length - 2; k >= 0; k--) {
            boolean[] reach = backwardReach(current);
            boolean[] next = matching(masks[k], values[k]);
            boolean any = false;
            for (int s = 0; s < numStates; s++) {
                next[s] &= reach[s];
                any |= next[s];
            }
            if (!any) {
                return false;
            }
            current = next;
        }
        for (boolean b : current) {
            if (b) return true;
        }
        return false;
    }

    private boolean[] matching(int mask, int values) {
        boolean[] result = new boolean[numStates];
        for (int s = 0; s < numStates; s++) {
            result[s] = (s & mask) == values;
        }
        return result;
    }

    private boolean[] backwardReach(boolean[] targets) {
        boolean[] visited = targets.clone();
        IntArrayList queue = new IntArrayList();
        for (int s = 0; s < numStates; s++) {
            if (visited[s]) queue.add(s);
        }
        for (int head = 0; head < queue.size(); head++) {
            int t = queue.getInt(head);
            for (int v = 0; v < numVars; v++) {
                int p = t ^ (1 << v);
                // p -> t exists iff updating v in p yields t's value
                if (!visited[p] && update(v, p) == isSet(t, v)) {
                    visited[p] = true;
                    queue.add(p);
                }
            }
        }
        return visited;
    }

    private static boolean isSet(int state, int var) {
        return ((state >>> var) & 1) != 0;
    }
}
