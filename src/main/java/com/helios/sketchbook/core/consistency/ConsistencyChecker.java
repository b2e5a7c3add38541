package com.helios.sketchbook.core.consistency;

import com.helios.sketchbook.core.consistency.ConsistencyReport.CheckResult;
import com.helios.sketchbook.core.error.ValidationException;
import com.helios.sketchbook.model.Sketch;
import com.helios.sketchbook.model.ids.DatasetId;
import com.helios.sketchbook.model.ids.DynPropertyId;
import com.helios.sketchbook.model.ids.ObservationId;
import com.helios.sketchbook.model.ids.StatPropertyId;
import com.helios.sketchbook.model.ids.VarId;
import com.helios.sketchbook.model.network.ModelState;
import com.helios.sketchbook.model.observations.Dataset;
import com.helios.sketchbook.model.observations.ObservationManager;
import com.helios.sketchbook.model.properties.DynProperty;
import com.helios.sketchbook.model.properties.DynPropertyType;
import com.helios.sketchbook.model.properties.StatProperty;
import com.helios.sketchbook.model.properties.StatPropertyType;
import com.helios.sketchbook.model.properties.wildcard.WildCardProposition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Cross-checks the components of a sketch against each other.
 *
 * <p>Sub-checks, all of which always run:
 * 1. Model: the network has at least one variable.
 * 2. Datasets: every dataset variable exists in the model.
 * 3. Static properties: generic formulas only use model variables and {@code f_<Var>} function symbols;
 *    regulation templates name an existing regulation. Other templates are not checked.
 * 4. Dynamic properties: generic formulas only use model variables and valid wildcards; templates
 *    reference existing datasets and observations.
 */
public class ConsistencyChecker {
    private static final Logger logger = Logger.getLogger(ConsistencyChecker.class.getName());

    private static final String UPDATE_FN_PREFIX = "f_";

    private final Sketch sketch;

    public ConsistencyChecker(Sketch sketch) {
        this.sketch = sketch;
    }

    public ConsistencyReport checkConsistency() {
        List<CheckResult> sections = List.of(
                checkModel(),
                checkDatasets(),
                checkStaticProperties(),
                checkDynamicProperties());
        ConsistencyReport report = ConsistencyReport.of(sections);
        logger.fine(() -> "Consistency check " + (report.passed() ? "passed" : "failed") + ":\n" + report.message());
        return report;
    }

    /**
     * @throws ValidationException carrying the full report if any sub-check fails.
     */
    public void assertConsistency() {
        ConsistencyReport report = checkConsistency();
        if (!report.passed()) {
            throw new ValidationException("Sketch is inconsistent:\n" + report.message());
        }
    }

    // ==================== Sub-checks ====================

    CheckResult checkModel() {
        List<String> issues = new ArrayList<>();
        if (sketch.model().isEmpty()) {
            issues.add("The Boolean network has no variables.");
        }
        return CheckResult.of("MODEL", issues);
    }

    CheckResult checkDatasets() {
        List<String> issues = new ArrayList<>();
        ModelState model = sketch.model();
        for (Dataset dataset : sketch.observations().datasets()) {
            for (VarId var : dataset.variables()) {
                if (!model.isValidVar(var)) {
                    issues.add("Dataset '" + dataset.id() + "' references variable '" + var
                            + "' which is not in the model.");
                }
            }
        }
        return CheckResult.of("DATASETS", issues);
    }

    CheckResult checkStaticProperties() {
        List<String> issues = new ArrayList<>();
        ModelState model = sketch.model();
        for (Map.Entry<StatPropertyId, StatProperty> entry : sketch.properties().sortedStatProps()) {
            String id = entry.getKey().asStr();
            StatPropertyType variant = entry.getValue().getVariant();
            if (variant instanceof StatPropertyType.GenericStatProp v) {
                checkFormula(id, v.processedFormula(), Set.of(), issues);
            } else if (variant instanceof StatPropertyType.RegulationTemplate v) {
                checkRegulationTemplate(id, v.input(), v.target(), model, issues);
            }
        }
        return CheckResult.of("STATIC PROPERTIES", issues);
    }

    CheckResult checkDynamicProperties() {
        List<String> issues = new ArrayList<>();
        ObservationManager observations = sketch.observations();
        for (Map.Entry<DynPropertyId, DynProperty> entry : sketch.properties().sortedDynProps()) {
            String id = entry.getKey().asStr();
            DynPropertyType variant = entry.getValue().getVariant();
            if (variant instanceof DynPropertyType.GenericDynProp v) {
                checkFormula(id, v.processedFormula(), Set.of(), issues);
                for (WildCardProposition wildCard : v.wildCards()) {
                    wildCard.reference().dataset().ifPresent(d -> checkDataReference(id, d,
                            wildCard.reference().observation().orElse(null), observations, issues));
                }
            } else if (variant instanceof DynPropertyType.ExistsFixedPoint v) {
                requireDataset(id, v.dataset(), v.observation(), observations, issues);
            } else if (variant instanceof DynPropertyType.HasAttractor v) {
                requireDataset(id, v.dataset(), v.observation(), observations, issues);
            } else if (variant instanceof DynPropertyType.ExistsTrapSpace v) {
                requireDataset(id, v.dataset(), v.observation(), observations, issues);
            } else if (variant instanceof DynPropertyType.ExistsTrajectory v) {
                requireDataset(id, v.dataset(), null, observations, issues);
                if (v.dataset() != null && observations.isValidDataset(v.dataset())
                        && observations.getDataset(v.dataset()).isEmpty()) {
                    issues.add("Property '" + id + "': trajectory dataset '" + v.dataset() + "' has no observations.");
                }
            }
        }
        return CheckResult.of("DYNAMIC PROPERTIES", issues);
    }

    // ==================== Helpers ====================

    private void checkFormula(String propertyId, String formula, Set<String> ignored, List<String> issues) {
        ModelState model = sketch.model();
        FormulaReferenceScanner.Scan scan = FormulaReferenceScanner.scan(formula, ignored);
        for (String name : scan.variables()) {
            if (!model.isValidVarStr(name)) {
                issues.add("Property '" + propertyId + "': variable '" + name + "' is not in the model.");
            }
        }
        for (String name : scan.functions()) {
            String variable = name.startsWith(UPDATE_FN_PREFIX) ? name.substring(UPDATE_FN_PREFIX.length()) : null;
            if (variable == null || !model.isValidVarStr(variable)) {
                issues.add("Property '" + propertyId + "': function symbol '" + name
                        + "' does not name an update function of the model.");
            }
        }
    }

    private static void checkRegulationTemplate(String propertyId, VarId input, VarId target, ModelState model,
                                                List<String> issues) {
        if (input == null || target == null) {
            issues.add("Property '" + propertyId + "': regulation input and target must both be set.");
            return;
        }
        boolean valid = true;
        for (VarId var : List.of(input, target)) {
            if (!model.isValidVar(var)) {
                issues.add("Property '" + propertyId + "': variable '" + var + "' is not in the model.");
                valid = false;
            }
        }
        if (valid && model.getRegulation(input, target).isEmpty()) {
            issues.add("Property '" + propertyId + "': regulation '" + input + "' -> '" + target
                    + "' is not in the model.");
        }
    }

    private static void requireDataset(String propertyId, DatasetId dataset, ObservationId observation,
                                       ObservationManager observations, List<String> issues) {
        if (dataset == null) {
            issues.add("Property '" + propertyId + "': no dataset selected.");
            return;
        }
        checkDataReference(propertyId, dataset, observation, observations, issues);
    }

    private static void checkDataReference(String propertyId, DatasetId dataset, ObservationId observation,
                                           ObservationManager observations, List<String> issues) {
        if (!observations.isValidDataset(dataset)) {
            issues.add("Property '" + propertyId + "': dataset '" + dataset + "' does not exist.");
        } else if (observation != null && !observations.isValidObservation(dataset, observation)) {
            issues.add("Property '" + propertyId + "': observation '" + observation + "' does not exist in dataset '"
                    + dataset + "'.");
        }
    }
}
