package com.helios.sketchbook.engine.explicit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.helios.sketchbook.core.error.ExternalEngineException;
import com.helios.sketchbook.core.error.ReferenceException;
import com.helios.sketchbook.core.error.SketchException;
import com.helios.sketchbook.engine.ColorSet;
import com.helios.sketchbook.engine.HctlModelChecker;
import com.helios.sketchbook.engine.PartialState;
import com.helios.sketchbook.engine.TransitionGraph;
import com.helios.sketchbook.engine.UpdatePredicate;
import com.helios.sketchbook.model.ids.VarId;
import com.helios.sketchbook.model.network.BooleanNetwork;
import com.helios.sketchbook.model.network.expr.FnExpr;
import com.helios.sketchbook.model.properties.wildcard.WildCardProposition;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.roaringbitmap.IntIterator;
import org.roaringbitmap.RoaringBitmap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.IntPredicate;
import java.util.function.LongPredicate;
import java.util.logging.Logger;

/**
 * Transition graph that enumerates colours and explores each colour's state space explicitly.
 *
 * <p>Template evaluators filter the unit colour set with a per-colour predicate over
 * {@link ColorDynamics}, which are cached so that several properties share one attractor search.
 */
final class ExplicitTransitionGraph implements TransitionGraph {
    private static final Logger logger = Logger.getLogger(ExplicitTransitionGraph.class.getName());

    private static final long DYNAMICS_CACHE_SIZE = 4_096;

    private final BooleanNetwork network;
    private final ParameterSpace space;
    private final HctlModelChecker modelChecker;
    private final ExplicitColorSet unit;
    private final Cache<Integer, ColorDynamics> dynamicsCache;

    ExplicitTransitionGraph(BooleanNetwork network, ParameterSpace space, HctlModelChecker modelChecker) {
        this.network = network;
        this.space = space;
        this.modelChecker = modelChecker;
        this.unit = ExplicitColorSet.full(space);
        this.dynamicsCache = Caffeine.newBuilder()
                .maximumSize(DYNAMICS_CACHE_SIZE)
                .build();
    }

    BooleanNetwork network() {
        return network;
    }

    // ==================== Colour sets ====================

    @Override
    public ColorSet mkUnitColors() {
        return unit;
    }

    @Override
    public ColorSet mkConstant(boolean value) {
        return value ? unit : ExplicitColorSet.empty(space);
    }

    @Override
    public UpdatePredicate mkUpdateFunctionTrue(VarId var) {
        if (!network.hasVariable(var)) {
            throw new ReferenceException("Variable '" + var + "' is not part of the network");
        }
        return new ExplicitUpdatePredicate(var, network.indexOf(var), network.regulators(var));
    }

    @Override
    public ColorSet mkObservability(UpdatePredicate predicate, VarId regulator) {
        return filterTables(predicate, regulator, FunctionTables::observable);
    }

    @Override
    public ColorSet mkActivation(UpdatePredicate predicate, VarId regulator) {
        return filterTables(predicate, regulator, FunctionTables::nonDecreasing);
    }

    @Override
    public ColorSet mkInhibition(UpdatePredicate predicate, VarId regulator) {
        return filterTables(predicate, regulator, FunctionTables::nonIncreasing);
    }

    private ColorSet filterTables(UpdatePredicate predicate, VarId regulator, TableTest test) {
        ExplicitUpdatePredicate fn = cast(predicate);
        int j = fn.inputs().indexOf(regulator);
        if (j < 0) {
            // The function cannot depend on a variable that does not regulate it.
            return mkConstant(false);
        }
        int arity = fn.inputs().size();
        LongPredicate accepts = table -> test.test(table, arity, j);
        return filter(color -> accepts.test(space.table(fn.varIndex(), color)));
    }

    // ==================== Temporal properties ====================

    @Override
    public ColorSet evalHctl(String formula, List<WildCardProposition> wildCards) {
        if (modelChecker == null) {
            throw new ExternalEngineException("No HCTL model checker is configured; cannot evaluate '" + formula + "'");
        }
        try {
            ColorSet result = modelChecker.check(this, formula, wildCards);
            return unit.intersect(result);
        } catch (SketchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExternalEngineException("Model checking of '" + formula + "' failed: " + e.getMessage(), e);
        }
    }

    @Override
    public ColorSet fixedPointColors(List<PartialState> observations) {
        int[][] subspaces = encode(observations);
        return filter(color -> {
            ColorDynamics dynamics = dynamics(color);
            for (int[] sub : subspaces) {
                if (!dynamics.anyMatching(sub[0], sub[1], dynamics::isFixedPoint)) {
                    return false;
                }
            }
            return true;
        });
    }

    @Override
    public ColorSet attractorColors(List<PartialState> observations) {
        int[][] subspaces = encode(observations);
        return filter(color -> {
            ColorDynamics dynamics = dynamics(color);
            for (int[] sub : subspaces) {
                if (!dynamics.anyMatching(sub[0], sub[1], dynamics::inAttractor)) {
                    return false;
                }
            }
            return true;
        });
    }

    @Override
    public ColorSet trapSpaceColors(List<PartialState> observations, boolean minimal, boolean nonpercolable) {
        int[][] subspaces = encode(observations);
        return filter(color -> {
            ColorDynamics dynamics = dynamics(color);
            for (int[] sub : subspaces) {
                boolean ok = minimal
                        ? dynamics.isMinimalTrapSpace(sub[0], sub[1])
                        : dynamics.isTrapSpace(sub[0], sub[1]);
                if (!ok || (nonpercolable && !dynamics.isNonPercolable(sub[0], sub[1]))) {
                    return false;
                }
            }
            return true;
        });
    }

    @Override
    public ColorSet trajectoryColors(List<PartialState> observations) {
        if (observations.isEmpty()) {
            return unit;
        }
        int[][] subspaces = encode(observations);
        int[] masks = new int[subspaces.length];
        int[] values = new int[subspaces.length];
        for (int k = 0; k < subspaces.length; k++) {
            masks[k] = subspaces[k][0];
            values[k] = subspaces[k][1];
        }
        return filter(color -> dynamics(color).hasTrajectory(masks, values));
    }

    @Override
    public ColorSet attractorCountColors(int minimal, int maximal) {
        return filter(color -> {
            int count = dynamics(color).attractorCount();
            return count >= minimal && count <= maximal;
        });
    }

    @Override
    public long countUpdateFunctions(VarId var, ColorSet colors) {
        int v = network.indexOf(var);
        IntSet seen = new IntOpenHashSet();
        IntIterator it = unit.cast(colors).bitmap().getIntIterator();
        while (it.hasNext()) {
            seen.add(space.tableIndex(v, it.next()));
        }
        return seen.size();
    }

    // ==================== Witnesses ====================

    @Override
    public ColorSet pickRandomColor(ColorSet colors, Random random) {
        RoaringBitmap bitmap = unit.cast(colors).bitmap();
        long cardinality = bitmap.getLongCardinality();
        if (cardinality == 0) {
            throw new ExternalEngineException("Cannot pick a colour from an empty set");
        }
        int color = bitmap.select(random.nextInt((int) cardinality));
        return new ExplicitColorSet(space, RoaringBitmap.bitmapOf(color));
    }

    @Override
    public Map<VarId, FnExpr> witnessFunctions(ColorSet color) {
        RoaringBitmap bitmap = unit.cast(color).bitmap();
        if (bitmap.getLongCardinality() != 1) {
            throw new ExternalEngineException("A witness needs exactly one colour, got "
                    + bitmap.getLongCardinality());
        }
        int c = bitmap.first();
        Map<VarId, FnExpr> functions = new LinkedHashMap<>();
        for (int v = 0; v < network.numVars(); v++) {
            VarId var = network.variables().get(v);
            functions.put(var, FunctionTables.toExpr(space.table(v, c), network.regulators(var)));
        }
        return functions;
    }

    // ==================== Helpers ====================

    private ExplicitColorSet filter(IntPredicate colorTest) {
        RoaringBitmap result = new RoaringBitmap();
        IntIterator it = unit.bitmap().getIntIterator();
        while (it.hasNext()) {
            int color = it.next();
            if (colorTest.test(color)) {
                result.add(color);
            }
        }
        return new ExplicitColorSet(space, result);
    }

    private ColorDynamics dynamics(int color) {
        return dynamicsCache.get(color,
                c -> new ColorDynamics(network.numVars(), space.tables(c), space.inputIndices()));
    }

    /**
     * Encodes sub-spaces as {mask, values} pairs over the network's variable indices.
     */
    private int[][] encode(List<PartialState> observations) {
        int[][] result = new int[observations.size()][];
        for (int k = 0; k < observations.size(); k++) {
            int mask = 0;
            int values = 0;
            for (Map.Entry<VarId, Boolean> entry : observations.get(k).values().entrySet()) {
                int bit = 1 << network.indexOf(entry.getKey());
                mask |= bit;
                if (entry.getValue()) {
                    values |= bit;
                }
            }
            result[k] = new int[]{mask, values};
        }
        logger.finest(() -> "Encoded " + observations.size() + " sub-spaces");
        return result;
    }

    private static ExplicitUpdatePredicate cast(UpdatePredicate predicate) {
        if (!(predicate instanceof ExplicitUpdatePredicate fn)) {
            throw new ExternalEngineException("Update predicate was not created by this engine");
        }
        return fn;
    }

    @FunctionalInterface
    private interface TableTest {
        boolean test(long table, int arity, int input);
    }
}
