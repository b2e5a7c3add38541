package com.helios.sketchbook.engine.explicit;

import com.helios.sketchbook.core.error.ExternalEngineException;
import com.helios.sketchbook.model.ids.VarId;
import com.helios.sketchbook.model.network.BooleanNetwork;
import com.helios.sketchbook.model.network.Essentiality;
import com.helios.sketchbook.model.network.Regulation;
import com.helios.sketchbook.model.network.expr.FnExpr;
import it.unimi.dsi.fastutil.longs.LongArrayList;

import java.util.List;
import java.util.logging.Logger;

/**
 * Enumerated parameter space of a network.
 *
 * <p>Every variable gets the list of truth tables admitted by its regulations: all such tables for an
 * implicit variable, the single table of an explicit one (or none if it breaks a regulation).
 * A colour is a mixed-radix number with one digit per variable selecting its table.
 */
final class ParameterSpace {
    private static final Logger logger = Logger.getLogger(ParameterSpace.class.getName());

    /** Implicit functions of more inputs cannot be enumerated. */
    static final int MAX_IMPLICIT_INPUTS = 4;

    private final int[][] inputIndices;
    private final long[][] admissible;
    private final long[] strides;
    private final int colorCount;

    private ParameterSpace(int[][] inputIndices, long[][] admissible, long[] strides, int colorCount) {
        this.inputIndices = inputIndices;
        this.admissible = admissible;
        this.strides = strides;
        this.colorCount = colorCount;
    }

    static ParameterSpace build(BooleanNetwork network, long maxColors) {
        int n = network.numVars();
        int[][] inputIndices = new int[n][];
        long[][] admissible = new long[n][];
        long[] strides = new long[n];

        long total = 1;
        for (int v = 0; v < n; v++) {
            VarId target = network.variables().get(v);
            List<VarId> inputs = network.regulators(target);
            inputIndices[v] = inputs.stream().mapToInt(network::indexOf).toArray();
            admissible[v] = network.explicitFunction(target)
                    .map(fn -> explicitTable(network, target, inputs, fn))
                    .orElseGet(() -> implicitTables(network, target, inputs));

            strides[v] = total;
            if (admissible[v].length == 0) {
                total = 0;
            } else if (total > 0) {
                total *= admissible[v].length;
                if (total > maxColors) {
                    throw new ExternalEngineException("Parameter space exceeds the limit of " + maxColors
                            + " colours (reached at variable '" + target + "')");
                }
            }
        }
        logger.fine("Enumerated parameter space with " + total + " colours over " + n + " variables");
        return new ParameterSpace(inputIndices, admissible, strides, (int) total);
    }

    private static long[] explicitTable(BooleanNetwork network, VarId target, List<VarId> inputs, FnExpr fn) {
        if (inputs.size() > FunctionTables.MAX_TABLE_INPUTS) {
            throw new ExternalEngineException("Variable '" + target + "' has " + inputs.size()
                    + " regulators; at most " + FunctionTables.MAX_TABLE_INPUTS + " are supported");
        }
        long table = 0;
        for (int row = 0; row < FunctionTables.rows(inputs.size()); row++) {
            final int r = row;
            boolean value = fn.evaluate(var -> {
                int j = inputs.indexOf(var);
                return j >= 0 && ((r >>> j) & 1) != 0;
            });
            if (value) {
                table |= 1L << row;
            }
        }
        if (!satisfiesRegulations(network, target, inputs, table)) {
            logger.warning("Explicit update function of '" + target + "' violates its regulations");
            return new long[0];
        }
        return new long[]{table};
    }

    private static long[] implicitTables(BooleanNetwork network, VarId target, List<VarId> inputs) {
        if (inputs.size() > MAX_IMPLICIT_INPUTS) {
            throw new ExternalEngineException("Implicit variable '" + target + "' has " + inputs.size()
                    + " regulators; at most " + MAX_IMPLICIT_INPUTS + " are supported");
        }
        long candidates = 1L << FunctionTables.rows(inputs.size());
        LongArrayList result = new LongArrayList();
        for (long table = 0; table < candidates; table++) {
            if (satisfiesRegulations(network, target, inputs, table)) {
                result.add(table);
            }
        }
        return result.toLongArray();
    }

    private static boolean satisfiesRegulations(BooleanNetwork network, VarId target, List<VarId> inputs, long table) {
        int arity = inputs.size();
        for (int j = 0; j < arity; j++) {
            Regulation regulation = network.regulation(inputs.get(j), target).orElseThrow();
            boolean ok = switch (regulation.monotonicity()) {
                case ACTIVATION -> FunctionTables.nonDecreasing(table, arity, j);
                case INHIBITION -> FunctionTables.nonIncreasing(table, arity, j);
                case DUAL -> !FunctionTables.nonDecreasing(table, arity, j)
                        && !FunctionTables.nonIncreasing(table, arity, j);
                case UNKNOWN -> true;
            };
            if (!ok) {
                return false;
            }
            // FALSE and UNKNOWN essentiality do not restrict the table.
            if (regulation.essentiality() == Essentiality.TRUE && !FunctionTables.observable(table, arity, j)) {
                return false;
            }
        }
        return true;
    }

    int colorCount() {
        return colorCount;
    }

    int[] inputIndices(int var) {
        return inputIndices[var];
    }

    int tableIndex(int var, int color) {
        return (int) ((color / strides[var]) % admissible[var].length);
    }

    long table(int var, int color) {
        return admissible[var][tableIndex(var, color)];
    }

    long[] tables(int color) {
        long[] result = new long[admissible.length];
        for (int v = 0; v < admissible.length; v++) {
            result[v] = table(v, color);
        }
        return result;
    }

    int[][] inputIndices() {
        return inputIndices;
    }
}
