package com.helios.sketchbook.model.properties.wildcard;

import java.util.Objects;

/**
 * A wildcard found in a formula: the text between the {@code %} delimiters and what it refers to.
 */
public record WildCardProposition(String origStr, WildCardReference reference) {

    public WildCardProposition {
        Objects.requireNonNull(origStr, "Original text cannot be null");
        Objects.requireNonNull(reference, "Reference cannot be null");
    }

    public String canonical() {
        return reference.canonical();
    }

    /**
     * The canonical token as it appears in a processed formula, e.g. {@code %observation_d_o%}.
     */
    public String delimited() {
        return WildCardProcessor.DELIMITER + canonical() + WildCardProcessor.DELIMITER;
    }
}
