package com.helios.sketchbook.model.properties.wildcard;

import java.util.List;
import java.util.Optional;

/**
 * Result of wildcard processing: the canonical formula and one wildcard per occurrence,
 * in order of appearance.
 */
public record ProcessedFormula(String canonical, List<WildCardProposition> wildCards) {

    public ProcessedFormula {
        wildCards = List.copyOf(wildCards);
    }

    /**
     * Maps a canonical token back to its wildcard.
     */
    public Optional<WildCardProposition> resolve(String token) {
        return WildCardProcessor.resolve(token, wildCards);
    }
}
