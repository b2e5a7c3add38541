package com.helios.sketchbook.model.properties.wildcard;

import com.helios.sketchbook.core.error.ValidationException;
import com.helios.sketchbook.model.ids.DatasetId;
import com.helios.sketchbook.model.ids.ObservationId;
import com.helios.sketchbook.model.properties.wildcard.WildCardReference.StateSetKind;

import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered registry of wildcard forms. The first entry whose pattern matches the
 * text between the delimiters wins.
 */
public enum WildCardGrammar {

    TRAJECTORY("trajectory\\s*\\(\\s*(" + Patterns.ID + ")\\s*\\)",
            m -> new WildCardReference.TrajectoryReference(DatasetId.of(m.group(1)))),

    ATTRACTORS(Patterns.stateSet(StateSetKind.ATTRACTORS), m -> stateSet(StateSetKind.ATTRACTORS, m)),

    FIXED_POINTS(Patterns.stateSet(StateSetKind.FIXED_POINTS), m -> stateSet(StateSetKind.FIXED_POINTS, m)),

    TRAP_SPACES(Patterns.stateSet(StateSetKind.TRAP_SPACES), m -> stateSet(StateSetKind.TRAP_SPACES, m)),

    ATTRACTOR_COUNT("attractor_count\\s*\\(\\s*(\\d+)\\s*,\\s*(\\d+)\\s*\\)",
            m -> new WildCardReference.AttractorCountReference(count(m.group(1)), count(m.group(2)))),

    OBSERVATION("(" + Patterns.ID + ")\\s*/\\s*(" + Patterns.ID + ")",
            m -> new WildCardReference.ObservationReference(
                    DatasetId.of(m.group(1)), ObservationId.of(m.group(2))));

    private final Pattern pattern;
    private final Function<Matcher, WildCardReference> factory;

    WildCardGrammar(String regex, Function<Matcher, WildCardReference> factory) {
        this.pattern = Pattern.compile("^\\s*" + regex + "\\s*$");
        this.factory = factory;
    }

    /**
     * Tries to read {@code body} as this form.
     * @throws ValidationException if the form matches but its arguments are invalid.
     */
    public Optional<WildCardReference> tryMatch(String body) {
        Matcher matcher = pattern.matcher(body);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(factory.apply(matcher));
    }

    private static int count(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new ValidationException("Attractor count '" + digits + "' is out of range.", e);
        }
    }

    private static WildCardReference stateSet(StateSetKind kind, Matcher m) {
        ObservationId observation = m.group(2) != null ? ObservationId.of(m.group(2)) : null;
        return new WildCardReference.StateSetReference(kind, DatasetId.of(m.group(1)), observation);
    }

    private static final class Patterns {
        static final String ID = "[a-zA-Z_][a-zA-Z0-9_]*";

        static String stateSet(StateSetKind kind) {
            return kind.keyword() + "\\s*\\(\\s*(" + ID + ")\\s*(?:,\\s*(" + ID + ")\\s*)?\\)";
        }
    }
}
