package com.helios.sketchbook.model;

import com.helios.sketchbook.model.network.ModelState;
import com.helios.sketchbook.model.observations.ObservationManager;
import com.helios.sketchbook.model.properties.PropertyManager;

import java.util.Objects;

/**
 * A Boolean network sketch: the partially specified model, experimental data and the properties
 * every admissible network must satisfy.
 */
public class Sketch {

    private final ModelState model;
    private final ObservationManager observations;
    private final PropertyManager properties;
    private String annotation;

    public Sketch() {
        this(new ModelState(), new ObservationManager(), new PropertyManager(), "");
    }

    public Sketch(ModelState model, ObservationManager observations, PropertyManager properties, String annotation) {
        this.model = Objects.requireNonNull(model, "Model cannot be null");
        this.observations = Objects.requireNonNull(observations, "Observations cannot be null");
        this.properties = Objects.requireNonNull(properties, "Properties cannot be null");
        this.annotation = annotation != null ? annotation : "";
    }

    public ModelState model() {
        return model;
    }

    public ObservationManager observations() {
        return observations;
    }

    public PropertyManager properties() {
        return properties;
    }

    public String annotation() {
        return annotation;
    }

    public void setAnnotation(String annotation) {
        this.annotation = annotation != null ? annotation : "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Sketch other)) return false;
        return model.equals(other.model)
                && observations.equals(other.observations)
                && properties.equals(other.properties)
                && annotation.equals(other.annotation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(model, observations, properties, annotation);
    }
}
