package com.helios.sketchbook.model.ids;

import com.helios.sketchbook.core.error.ValidationException;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Validated name of a sketch entity.
 *
 * <p>Identifiers follow {@code [a-zA-Z_][a-zA-Z0-9_]*}, compare by their raw string and
 * are immutable, which makes them safe map keys. Identifiers of different entity kinds
 * never compare equal even when their strings match.
 */
public abstract class Identifier implements Comparable<Identifier> {

    private static final Pattern ID_PATTERN = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

    private final String id;

    protected Identifier(String id) {
        if (!isValid(id)) {
            throw new ValidationException("Invalid identifier: " + id);
        }
        this.id = id;
    }

    public static boolean isValid(String candidate) {
        return candidate != null && ID_PATTERN.matcher(candidate).matches();
    }

    public String asStr() {
        return id;
    }

    @Override
    public int compareTo(Identifier other) {
        return id.compareTo(other.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((Identifier) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), id);
    }

    @Override
    public String toString() {
        return id;
    }
}
