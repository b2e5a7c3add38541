package com.helios.sketchbook.core.inference;

import com.helios.sketchbook.api.IInferenceSolver;
import com.helios.sketchbook.core.compiler.CompiledDynamicProperty;
import com.helios.sketchbook.core.compiler.DynamicPropertyProcessor;
import com.helios.sketchbook.core.compiler.StaticConstraint;
import com.helios.sketchbook.core.compiler.StaticConstraintCompiler;
import com.helios.sketchbook.core.error.InferenceCancelledException;
import com.helios.sketchbook.core.error.InvalidStateException;
import com.helios.sketchbook.core.error.ValidationException;
import com.helios.sketchbook.engine.ColorSet;
import com.helios.sketchbook.engine.SymbolicEngine;
import com.helios.sketchbook.engine.TransitionGraph;
import com.helios.sketchbook.infra.config.InferenceConfig;
import com.helios.sketchbook.infrastructure.telemetry.TracingService;
import com.helios.sketchbook.model.Sketch;
import com.helios.sketchbook.model.ids.DynPropertyId;
import com.helios.sketchbook.model.ids.StatPropertyId;
import com.helios.sketchbook.model.ids.VarId;
import com.helios.sketchbook.model.network.BooleanNetwork;
import com.helios.sketchbook.model.properties.DynProperty;
import com.helios.sketchbook.model.properties.StatProperty;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-use staged inference over a sketch.
 *
 * <p>The pipeline consists of the following stages, each recorded in the status log:
 * 1. PROCESSED_INPUTS: build the Boolean network and resolve all static and dynamic properties
 *    (sorted by id) against the model and datasets.
 * 2. GENERATED_GRAPH: build the coloured transition graph; candidates start as the unit colour set.
 * 3. EVALUATED_STATIC: intersect the candidates with each static property's colour set.
 * 4. EVALUATED_DYNAMIC: intersect the candidates with each dynamic property's colour set.
 * 5. FINISHED: publish the remaining candidates and a summary.
 *
 * <p>Any failure moves the solver to ERROR and is rethrown; artifacts computed up to that point stay
 * available. {@link #cancel()} may be called from another thread and is honoured between stages and
 * between properties.
 */
public class InferenceSolver implements IInferenceSolver {
    private static final Logger logger = Logger.getLogger(InferenceSolver.class.getName());

    private final SymbolicEngine engine;
    private final InferenceConfig config;
    private final Tracer tracer;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<InferenceStatusReport> statusLog = new CopyOnWriteArrayList<>();
    private long startNanos;

    // Artifacts, filled in as the stages complete.
    private BooleanNetwork network;
    private List<Map.Entry<StatPropertyId, StaticConstraint>> staticConstraints;
    private List<Map.Entry<DynPropertyId, CompiledDynamicProperty>> dynamicProperties;
    private TransitionGraph graph;
    private ColorSet candidates;
    private ColorSet resultColors;
    private InferenceResults results;

    public InferenceSolver(SymbolicEngine engine, InferenceConfig config) {
        this(engine, config, TracingService.getInstance().getTracer());
    }

    public InferenceSolver(SymbolicEngine engine, InferenceConfig config, Tracer tracer) {
        this.engine = engine;
        this.config = config;
        this.tracer = tracer;
        this.startNanos = System.nanoTime();
        statusLog.add(new InferenceStatusReport(InferenceStatus.CREATED, Instant.now(), 0, null, "Solver created"));
    }

    // ==================== Pipeline ====================

    @Override
    public InferenceResults run(Sketch sketch) {
        if (currentStatus() != InferenceStatus.CREATED) {
            throw new InvalidStateException("Inference solver can only be used once (current status: "
                    + currentStatus() + ")");
        }
        Span span = tracer.spanBuilder("inference-run").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("inferenceType", config.getInferenceType().name());
            startNanos = System.nanoTime();
            transition(InferenceStatus.STARTED, "Started inference (" + config.getInferenceType() + ")");

            processInputs(sketch);
            generateGraph();
            evaluateStatic();
            evaluateDynamic();
            finish();

            span.setAttribute("numSatNetworks", results.numSatNetworks().longValue());
            return results;
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            fail(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private void processInputs(Sketch sketch) {
        checkCancellation();
        Span span = tracer.spanBuilder("process-inputs").startSpan();
        try (Scope scope = span.makeCurrent()) {
            network = sketch.model().toBooleanNetwork();

            List<Map.Entry<StatPropertyId, StaticConstraint>> statics = new ArrayList<>();
            for (Map.Entry<StatPropertyId, StatProperty> entry : sketch.properties().sortedStatProps()) {
                statics.add(Map.entry(entry.getKey(), StaticConstraintCompiler.resolve(entry.getValue(), network)));
            }
            staticConstraints = statics;

            DynamicPropertyProcessor processor = new DynamicPropertyProcessor(sketch.observations(), network);
            List<Map.Entry<DynPropertyId, CompiledDynamicProperty>> dynamics = new ArrayList<>();
            for (Map.Entry<DynPropertyId, DynProperty> entry : sketch.properties().sortedDynProps()) {
                dynamics.add(Map.entry(entry.getKey(), processor.process(entry.getValue())));
            }
            dynamicProperties = dynamics;

            span.setAttribute("numVariables", network.numVars());
            span.setAttribute("numStaticProperties", statics.size());
            span.setAttribute("numDynamicProperties", dynamics.size());
            transition(InferenceStatus.PROCESSED_INPUTS, "Processed " + network.numVars() + " variables, "
                    + statics.size() + " static and " + dynamics.size() + " dynamic properties");
        } finally {
            span.end();
        }
    }

    private void generateGraph() {
        checkCancellation();
        Span span = tracer.spanBuilder("generate-graph").startSpan();
        try (Scope scope = span.makeCurrent()) {
            graph = engine.buildGraph(network);
            candidates = graph.mkUnitColors();
            transition(InferenceStatus.GENERATED_GRAPH, "Generated transition graph");
        } finally {
            span.end();
        }
    }

    private void evaluateStatic() {
        checkCancellation();
        if (!config.getInferenceType().includesStatic()) {
            transition(InferenceStatus.EVALUATED_STATIC, "Skipped static properties");
            return;
        }
        Span span = tracer.spanBuilder("evaluate-static").startSpan();
        try (Scope scope = span.makeCurrent()) {
            StaticConstraintCompiler compiler = new StaticConstraintCompiler(network, graph, config);
            int evaluated = 0;
            for (Map.Entry<StatPropertyId, StaticConstraint> entry : staticConstraints) {
                if (stopEarly()) {
                    break;
                }
                checkCancellation();
                candidates = candidates.intersect(compiler.compile(entry.getValue()));
                evaluated++;
                span.addEvent("evaluated-static:" + entry.getKey());
                logger.fine(() -> "Evaluated static property " + entry.getKey() + ": "
                        + candidates.exactCardinality() + " candidates");
            }
            transition(InferenceStatus.EVALUATED_STATIC, "Evaluated " + evaluated + " static properties");
        } finally {
            span.end();
        }
    }

    private void evaluateDynamic() {
        checkCancellation();
        if (!config.getInferenceType().includesDynamic()) {
            transition(InferenceStatus.EVALUATED_DYNAMIC, "Skipped dynamic properties");
            return;
        }
        Span span = tracer.spanBuilder("evaluate-dynamic").startSpan();
        try (Scope scope = span.makeCurrent()) {
            int evaluated = 0;
            for (Map.Entry<DynPropertyId, CompiledDynamicProperty> entry : dynamicProperties) {
                if (stopEarly()) {
                    break;
                }
                checkCancellation();
                candidates = candidates.intersect(entry.getValue().evaluate(graph));
                evaluated++;
                span.addEvent("evaluated-dynamic:" + entry.getKey());
                logger.fine(() -> "Evaluated dynamic property " + entry.getKey() + ": "
                        + candidates.exactCardinality() + " candidates");
            }
            transition(InferenceStatus.EVALUATED_DYNAMIC, "Evaluated " + evaluated + " dynamic properties");
        } finally {
            span.end();
        }
    }

    private void finish() {
        checkCancellation();
        Map<VarId, Long> functionCounts = new TreeMap<>();
        for (VarId var : network.variables()) {
            functionCounts.put(var, graph.countUpdateFunctions(var, candidates));
        }
        resultColors = candidates;
        transition(InferenceStatus.FINISHED, "Inference finished");

        long totalMs = elapsedMs();
        results = new InferenceResults(
                config.getInferenceType(),
                resultColors.exactCardinality(),
                resultColors.approxCardinality(),
                totalMs,
                summarize(totalMs, functionCounts),
                getStatusLog(),
                functionCounts);
        logger.info("Inference finished in " + totalMs + "ms with " + results.numSatNetworks() + " satisfying networks");
    }

    private String summarize(long totalMs, Map<VarId, Long> functionCounts) {
        StringBuilder sb = new StringBuilder();
        sb.append("Inference type: ").append(config.getInferenceType()).append('\n');
        sb.append("Satisfying networks: ").append(resultColors.exactCardinality()).append('\n');
        sb.append("Total time: ").append(totalMs).append("ms\n");
        sb.append("Progress:\n");
        for (InferenceStatusReport report : statusLog) {
            sb.append(report.format()).append('\n');
        }
        sb.append("Admissible update functions:\n");
        functionCounts.forEach((var, count) -> sb.append("  ").append(var).append(": ").append(count).append('\n'));
        return sb.toString();
    }

    // ==================== Status handling ====================

    private void transition(InferenceStatus next, String message) {
        InferenceStatus current = currentStatus();
        if (!current.canTransitionTo(next)) {
            throw new InvalidStateException("Illegal status transition " + current + " -> " + next);
        }
        InferenceStatusReport report = new InferenceStatusReport(next, Instant.now(), elapsedMs(),
                candidates != null ? candidates.exactCardinality() : null, message);
        statusLog.add(report);
        logger.info(report.format());
    }

    private void fail(Exception e) {
        if (currentStatus().isTerminal()) {
            return;
        }
        statusLog.add(new InferenceStatusReport(InferenceStatus.ERROR, Instant.now(), elapsedMs(),
                candidates != null ? candidates.exactCardinality() : null, String.valueOf(e.getMessage())));
        logger.log(Level.WARNING, "Inference failed: " + e.getMessage(), e);
    }

    private boolean stopEarly() {
        if (config.isStopWhenEmpty() && candidates.isEmpty()) {
            logger.info("No candidates left, skipping remaining properties");
            return true;
        }
        return false;
    }

    private void checkCancellation() {
        if (cancelled.get()) {
            throw new InferenceCancelledException("Computation was cancelled.");
        }
    }

    private long elapsedMs() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    // ==================== Public API ====================

    @Override
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public InferenceStatus currentStatus() {
        return statusLog.get(statusLog.size() - 1).status();
    }

    public List<InferenceStatusReport> getStatusLog() {
        return List.copyOf(statusLog);
    }

    public BooleanNetwork getNetwork() {
        if (network == null) {
            throw new InvalidStateException("Boolean network not yet processed.");
        }
        return network;
    }

    public TransitionGraph getGraph() {
        if (graph == null) {
            throw new InvalidStateException("Transition graph and symbolic context not yet computed.");
        }
        return graph;
    }

    public List<Map.Entry<StatPropertyId, StaticConstraint>> getStaticConstraints() {
        if (staticConstraints == null) {
            throw new InvalidStateException("Static properties not yet processed.");
        }
        return List.copyOf(staticConstraints);
    }

    public List<Map.Entry<DynPropertyId, CompiledDynamicProperty>> getDynamicProperties() {
        if (dynamicProperties == null) {
            throw new InvalidStateException("Dynamic properties not yet processed.");
        }
        return List.copyOf(dynamicProperties);
    }

    public ColorSet getCandidateColors() {
        if (candidates == null) {
            throw new InvalidStateException("Candidate colours not yet computed.");
        }
        return candidates;
    }

    public ColorSet getResultColors() {
        if (resultColors == null) {
            throw new InvalidStateException("Inference results not yet computed.");
        }
        return resultColors;
    }

    public InferenceResults getResults() {
        if (results == null) {
            throw new InvalidStateException("Inference results not yet computed.");
        }
        return results;
    }

    public BigInteger numSatNetworks() {
        return getResultColors().exactCardinality();
    }

    // ==================== Witnesses ====================

    /**
     * Samples distinct satisfying networks, each rendered as one update function per variable.
     *
     * <p>Colours are drawn uniformly without replacement from the result set; the same seed yields the
     * same witnesses in the same order. At most {@code count} witnesses are returned, fewer when the
     * result set is smaller.
     *
     * @throws ValidationException if {@code count} is negative
     * @throws InvalidStateException if the inference has not finished
     */
    public List<Map<VarId, String>> sampleWitnesses(int count, long seed) {
        if (count < 0) {
            throw new ValidationException("Witness count must be non-negative, got " + count);
        }
        TransitionGraph g = getGraph();
        ColorSet remaining = getResultColors();
        Random random = new Random(seed);
        List<Map<VarId, String>> witnesses = new ArrayList<>();
        while (witnesses.size() < count && !remaining.isEmpty()) {
            ColorSet witness = g.pickRandomColor(remaining, random);
            remaining = remaining.minus(witness);
            Map<VarId, String> rendered = new LinkedHashMap<>();
            g.witnessFunctions(witness).forEach((var, fn) -> rendered.put(var, fn.render()));
            witnesses.add(rendered);
        }
        logger.fine("Sampled " + witnesses.size() + " witness networks with seed " + seed);
        return witnesses;
    }
}
