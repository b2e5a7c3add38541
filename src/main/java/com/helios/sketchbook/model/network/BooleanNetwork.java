package com.helios.sketchbook.model.network;

import com.helios.sketchbook.core.error.ReferenceException;
import com.helios.sketchbook.model.ids.VarId;
import com.helios.sketchbook.model.network.expr.FnExpr;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of a {@link ModelState} handed to the symbolic engine.
 *
 * Variables are indexed by their position in id order.
 */
public final class BooleanNetwork {

    private final List<VarId> variables;
    private final Map<VarId, Integer> indexByVar;
    private final Map<VarId, List<VarId>> regulators;
    private final List<Regulation> regulations;
    private final Map<VarId, FnExpr> explicitFunctions;

    private BooleanNetwork(List<VarId> variables, Map<VarId, List<VarId>> regulators,
                           List<Regulation> regulations, Map<VarId, FnExpr> explicitFunctions) {
        this.variables = List.copyOf(variables);
        this.regulators = Map.copyOf(regulators);
        this.regulations = List.copyOf(regulations);
        this.explicitFunctions = Map.copyOf(explicitFunctions);
        this.indexByVar = new HashMap<>();
        for (int i = 0; i < this.variables.size(); i++) {
            indexByVar.put(this.variables.get(i), i);
        }
    }

    static BooleanNetwork from(ModelState model) {
        List<VarId> variables = model.variableIds();
        Map<VarId, List<VarId>> regulators = new LinkedHashMap<>();
        Map<VarId, FnExpr> functions = new LinkedHashMap<>();
        for (VarId var : variables) {
            regulators.put(var, model.regulators(var));
            model.updateFunction(var).ifPresent(fn -> functions.put(var, fn.expression()));
        }
        return new BooleanNetwork(variables, regulators, model.regulations(), functions);
    }

    public List<VarId> variables() {
        return variables;
    }

    public int numVars() {
        return variables.size();
    }

    public int indexOf(VarId var) {
        Integer index = indexByVar.get(var);
        if (index == null) {
            throw new ReferenceException("Variable '" + var + "' is not part of the network");
        }
        return index;
    }

    public boolean hasVariable(VarId var) {
        return indexByVar.containsKey(var);
    }

    public List<VarId> regulators(VarId target) {
        indexOf(target);
        return regulators.get(target);
    }

    public List<Regulation> regulations() {
        return regulations;
    }

    public Optional<Regulation> regulation(VarId regulator, VarId target) {
        return regulations.stream()
                .filter(r -> r.regulator().equals(regulator) && r.target().equals(target))
                .findFirst();
    }

    public Optional<FnExpr> explicitFunction(VarId target) {
        return Optional.ofNullable(explicitFunctions.get(target));
    }

    public boolean isImplicit(VarId target) {
        return !explicitFunctions.containsKey(target);
    }
}
