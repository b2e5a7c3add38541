package com.helios.sketchbook.model.network;

import com.helios.sketchbook.core.error.ReferenceException;
import com.helios.sketchbook.core.error.ValidationException;
import com.helios.sketchbook.model.ids.VarId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Editable description of a partially specified Boolean network.
 *
 * <p>Holds the variables (ordered by id), the regulations (ordered by target, then regulator),
 * explicit update functions and node layout. A variable without an explicit update function
 * is implicit: its function is an unknown to be inferred.
 */
public class ModelState {
    private static final Logger logger = Logger.getLogger(ModelState.class.getName());

    private final Map<VarId, Variable> variables = new TreeMap<>();
    private final List<Regulation> regulations = new ArrayList<>();
    private final Map<VarId, UpdateFunction> updateFunctions = new TreeMap<>();
    private final Map<VarId, NodePosition> layout = new TreeMap<>();

    // ==================== Variables ====================

    public void addVariable(VarId id, String name) {
        if (variables.containsKey(id)) {
            throw new ValidationException("Variable '" + id + "' already exists");
        }
        variables.put(id, new Variable(id, name, ""));
    }

    public void addVariableByStr(String id) {
        addVariable(VarId.of(id), id);
    }

    public void setVariableAnnotation(VarId id, String annotation) {
        Variable variable = getVariable(id);
        variables.put(id, new Variable(id, variable.name(), annotation));
    }

    public void setVariableName(VarId id, String name) {
        Variable variable = getVariable(id);
        variables.put(id, new Variable(id, name, variable.annotation()));
    }

    public Variable getVariable(VarId id) {
        Variable variable = variables.get(id);
        if (variable == null) {
            throw new ReferenceException("Variable '" + id + "' does not exist");
        }
        return variable;
    }

    public boolean isValidVar(VarId id) {
        return variables.containsKey(id);
    }

    public boolean isValidVarStr(String id) {
        return variables.keySet().stream().anyMatch(v -> v.asStr().equals(id));
    }

    public List<Variable> variables() {
        return List.copyOf(variables.values());
    }

    public List<VarId> variableIds() {
        return List.copyOf(variables.keySet());
    }

    public int numVars() {
        return variables.size();
    }

    public boolean isEmpty() {
        return variables.isEmpty();
    }

    // ==================== Regulations ====================

    public void addRegulation(VarId regulator, VarId target, Monotonicity monotonicity, Essentiality essentiality) {
        requireVariable(regulator);
        requireVariable(target);
        if (getRegulation(regulator, target).isPresent()) {
            throw new ValidationException("Regulation '" + regulator + "' -> '" + target + "' already exists");
        }
        regulations.add(new Regulation(regulator, target, monotonicity, essentiality));
        regulations.sort(Regulation.ORDER);
    }

    public Optional<Regulation> getRegulation(VarId regulator, VarId target) {
        return regulations.stream()
                .filter(r -> r.regulator().equals(regulator) && r.target().equals(target))
                .findFirst();
    }

    public List<Regulation> regulations() {
        return Collections.unmodifiableList(regulations);
    }

    /**
     * Regulators of {@code target}, sorted by id.
     */
    public List<VarId> regulators(VarId target) {
        return regulations.stream()
                .filter(r -> r.target().equals(target))
                .map(Regulation::regulator)
                .sorted()
                .collect(Collectors.toList());
    }

    // ==================== Update functions ====================

    /**
     * Sets an explicit update function, or makes the variable implicit when {@code expression} is blank.
     */
    public void setUpdateFunction(VarId target, String expression) {
        requireVariable(target);
        if (expression == null || expression.isBlank()) {
            updateFunctions.remove(target);
            return;
        }
        UpdateFunction function = UpdateFunction.parse(expression);
        Set<VarId> inputs = function.expression().variables();
        List<VarId> regulators = regulators(target);
        for (VarId input : inputs) {
            if (!regulators.contains(input)) {
                throw new ValidationException("Update function of '" + target + "' uses '" + input
                        + "' which does not regulate it");
            }
        }
        updateFunctions.put(target, function);
        logger.fine("Set update function of " + target + ": " + function.asText());
    }

    public Optional<UpdateFunction> updateFunction(VarId target) {
        return Optional.ofNullable(updateFunctions.get(target));
    }

    public boolean hasExplicitFunction(VarId target) {
        return updateFunctions.containsKey(target);
    }

    // ==================== Layout ====================

    public void setPosition(VarId id, double x, double y) {
        requireVariable(id);
        layout.put(id, new NodePosition(x, y));
    }

    public Optional<NodePosition> position(VarId id) {
        return Optional.ofNullable(layout.get(id));
    }

    // ==================== Conversion ====================

    /**
     * Compiles the current state into the immutable network consumed by the symbolic engine.
     */
    public BooleanNetwork toBooleanNetwork() {
        if (variables.isEmpty()) {
            throw new ValidationException("Cannot build a Boolean network with no variables");
        }
        return BooleanNetwork.from(this);
    }

    private void requireVariable(VarId id) {
        if (!variables.containsKey(id)) {
            throw new ReferenceException("Variable '" + id + "' does not exist");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModelState other)) return false;
        return variables.equals(other.variables)
                && regulations.equals(other.regulations)
                && updateFunctions.equals(other.updateFunctions)
                && layout.equals(other.layout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variables, regulations, updateFunctions, layout);
    }
}
