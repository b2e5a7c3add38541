package com.helios.sketchbook.io;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON representation of a sketch for import and export.
 * This is a plain Data Transfer Object; {@link SketchDataMapper} converts it to the model.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SketchData(
        @JsonProperty("model") ModelData model,
        @JsonProperty("datasets") List<DatasetData> datasets,
        @JsonProperty("dyn_properties") List<DynPropertyData> dynProperties,
        @JsonProperty("stat_properties") List<StatPropertyData> statProperties,
        @JsonProperty("annotation") String annotation
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ModelData(
            @JsonProperty("variables") List<VariableData> variables,
            @JsonProperty("regulations") List<RegulationData> regulations,
            @JsonProperty("update_functions") List<UpdateFnData> updateFunctions,
            @JsonProperty("layout") List<LayoutNodeData> layout
    ) {
        public List<VariableData> variables() {
            return variables != null ? variables : List.of();
        }

        public List<RegulationData> regulations() {
            return regulations != null ? regulations : List.of();
        }

        public List<UpdateFnData> updateFunctions() {
            return updateFunctions != null ? updateFunctions : List.of();
        }

        public List<LayoutNodeData> layout() {
            return layout != null ? layout : List.of();
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record VariableData(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("annotation") String annotation
    ) {}

    /**
     * {@code sign} is a monotonicity name, {@code essential} an essentiality name.
     */
    public record RegulationData(
            @JsonProperty("regulator") String regulator,
            @JsonProperty("target") String target,
            @JsonProperty("sign") String sign,
            @JsonProperty("essential") String essential
    ) {}

    public record UpdateFnData(
            @JsonProperty("variable") String variable,
            @JsonProperty("expression") String expression
    ) {}

    public record LayoutNodeData(
            @JsonProperty("variable") String variable,
            @JsonProperty("px") double px,
            @JsonProperty("py") double py
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DatasetData(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("variables") List<String> variables,
            @JsonProperty("observations") List<ObservationData> observations
    ) {
        public List<String> variables() {
            return variables != null ? variables : List.of();
        }

        public List<ObservationData> observations() {
            return observations != null ? observations : List.of();
        }
    }

    /**
     * {@code values} is a string over {@code 0}, {@code 1} and {@code *}, one character per dataset variable.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ObservationData(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("values") String values
    ) {}

    /**
     * Flat payload of every dynamic variant; {@code variant} selects which fields are read.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DynPropertyData(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("annotation") String annotation,
            @JsonProperty("variant") String variant,
            @JsonProperty("formula") String formula,
            @JsonProperty("dataset") String dataset,
            @JsonProperty("observation") String observation,
            @JsonProperty("minimal") Boolean minimal,
            @JsonProperty("nonpercolable") Boolean nonpercolable,
            @JsonProperty("minimal_count") Integer minimalCount,
            @JsonProperty("maximal_count") Integer maximalCount
    ) {}

    /**
     * Flat payload of every static variant; {@code value} is an essentiality or monotonicity name.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record StatPropertyData(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("annotation") String annotation,
            @JsonProperty("variant") String variant,
            @JsonProperty("formula") String formula,
            @JsonProperty("input") String input,
            @JsonProperty("input_index") Integer inputIndex,
            @JsonProperty("target") String target,
            @JsonProperty("value") String value,
            @JsonProperty("context") String context
    ) {}

    public List<DatasetData> datasets() {
        return datasets != null ? datasets : List.of();
    }

    public List<DynPropertyData> dynProperties() {
        return dynProperties != null ? dynProperties : List.of();
    }

    public List<StatPropertyData> statProperties() {
        return statProperties != null ? statProperties : List.of();
    }

    public String annotation() {
        return annotation != null ? annotation : "";
    }
}
