package com.helios.sketchbook.engine;

import com.helios.sketchbook.core.error.ValidationException;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Syntax check for temporal and first-order formulas.
 *
 * The logics themselves are owned by the model checker; the default implementation only
 * verifies what every formula needs: non-blank text with balanced brackets.
 */
@FunctionalInterface
public interface FormulaSyntax {

    /**
     * @throws ValidationException if the formula is not syntactically valid.
     */
    void validate(String formula);

    static FormulaSyntax structural() {
        return StructuralSyntax.INSTANCE;
    }

    enum StructuralSyntax implements FormulaSyntax {
        INSTANCE;

        @Override
        public void validate(String formula) {
            if (formula == null || formula.isBlank()) {
                throw new ValidationException("Formula cannot be empty");
            }
            Deque<Character> open = new ArrayDeque<>();
            for (int i = 0; i < formula.length(); i++) {
                char c = formula.charAt(i);
                switch (c) {
                    case '(', '{', '[' -> open.push(c);
                    case ')', '}', ']' -> {
                        if (open.isEmpty() || open.pop() != matching(c)) {
                            throw new ValidationException("Unbalanced '" + c + "' at position " + i
                                    + " in formula '" + formula + "'");
                        }
                    }
                    default -> {
                    }
                }
            }
            if (!open.isEmpty()) {
                throw new ValidationException("Unclosed '" + open.peek() + "' in formula '" + formula + "'");
            }
        }

        private static char matching(char closing) {
            return switch (closing) {
                case ')' -> '(';
                case '}' -> '{';
                default -> '[';
            };
        }
    }
}
