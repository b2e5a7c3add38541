package com.helios.sketchbook.model.observations;

import com.fasterxml.jackson.annotation.JsonValue;
import com.helios.sketchbook.core.error.ValidationException;

/**
 * Observed value of one variable: {@code 1}, {@code 0} or unspecified ({@code *}).
 */
public enum VarValue {
    TRUE('1'),
    FALSE('0'),
    ANY('*');

    private final char symbol;

    VarValue(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    public static VarValue fromChar(char c) {
        return switch (c) {
            case '1' -> TRUE;
            case '0' -> FALSE;
            case '*', '-' -> ANY;
            default -> throw new ValidationException("Invalid observation value '" + c + "'");
        };
    }

    /**
     * Checks if a concrete Boolean value is compatible with this observed value.
     */
    public boolean matches(boolean value) {
        return this == ANY || (this == TRUE) == value;
    }

    @JsonValue
    public String getValue() {
        return String.valueOf(symbol);
    }
}
