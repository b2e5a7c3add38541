package com.helios.sketchbook.model.properties.wildcard;

import com.helios.sketchbook.core.error.ReferenceException;
import com.helios.sketchbook.core.error.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rewrites the {@code %...%} wildcard propositions of a formula into their canonical form.
 *
 * <p>Processing steps:
 * <ol>
 *   <li>Scan the formula left to right for a {@code %} and its closing partner.</li>
 *   <li>Match the enclosed text against {@link WildCardGrammar} in declaration order.</li>
 *   <li>Replace the enclosed text with the canonical token; the delimiters stay, so the result is
 *       {@code %token%}.</li>
 * </ol>
 * Every occurrence is listed, repeated ones included. The input string is never modified; a failure
 * yields no partial result.
 */
public final class WildCardProcessor {

    static final String DELIMITER = "%";

    private WildCardProcessor() {
    }

    /**
     * @throws ValidationException if a {@code %} is unmatched or a wildcard has invalid arguments.
     * @throws ReferenceException if the enclosed text matches no known wildcard form.
     */
    public static ProcessedFormula process(String formula) {
        StringBuilder canonical = new StringBuilder(formula.length());
        List<WildCardProposition> found = new ArrayList<>();

        int cursor = 0;
        while (cursor < formula.length()) {
            int open = formula.indexOf('%', cursor);
            if (open < 0) {
                canonical.append(formula, cursor, formula.length());
                break;
            }
            int close = formula.indexOf('%', open + 1);
            if (close < 0) {
                throw new ValidationException("Unmatched '%' in the formula");
            }
            String body = formula.substring(open + 1, close);
            WildCardProposition proposition = new WildCardProposition(body, parseReference(body));

            canonical.append(formula, cursor, open).append(proposition.delimited());
            found.add(proposition);
            cursor = close + 1;
        }
        return new ProcessedFormula(canonical.toString(), found);
    }

    /**
     * Finds the wildcard of a token, written either bare or with its {@code %} delimiters.
     */
    public static Optional<WildCardProposition> resolve(String token, List<WildCardProposition> wildCards) {
        String bare = token.length() >= 2 && token.startsWith(DELIMITER) && token.endsWith(DELIMITER)
                ? token.substring(1, token.length() - 1)
                : token;
        return wildCards.stream().filter(w -> w.canonical().equals(bare)).findFirst();
    }

    private static WildCardReference parseReference(String body) {
        for (WildCardGrammar grammar : WildCardGrammar.values()) {
            Optional<WildCardReference> reference = grammar.tryMatch(body);
            if (reference.isPresent()) {
                return reference.get();
            }
        }
        throw new ReferenceException("Invalid wild-card proposition: %" + body + "%");
    }
}
