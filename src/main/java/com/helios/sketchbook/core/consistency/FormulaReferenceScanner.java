package com.helios.sketchbook.core.consistency;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the names a temporal or first-order formula uses as variables and as function symbols.
 *
 * <p>Skipped: operator keywords, names inside {@code {...}} (HCTL state variables) or {@code %...%}
 * (wildcard propositions), names directly after a backslash (FOL quantifier keywords) and names bound
 * by {@code \exists}/{@code \forall}. The single-letter operators {@code A} and {@code E} count as
 * keywords only before {@code (}, and {@code V} only before {@code {}; elsewhere they are variables.
 */
final class FormulaReferenceScanner {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");
    private static final Pattern QUANTIFIER = Pattern.compile(
            "\\\\(?:exists|forall)\\s+([a-zA-Z_][a-zA-Z0-9_]*(?:\\s*,\\s*[a-zA-Z_][a-zA-Z0-9_]*)*)");
    private static final Set<String> KEYWORDS = Set.of(
            "AX", "EX", "AF", "EF", "AG", "EG", "AU", "EU", "AW", "EW",
            "true", "false", "True", "False");
    private static final Set<String> PATH_QUANTIFIERS = Set.of("A", "E");
    private static final String STATE_BINDER = "V";

    record Scan(List<String> variables, List<String> functions) {
    }

    private FormulaReferenceScanner() {
    }

    static Scan scan(String formula, Set<String> ignored) {
        Set<String> bound = new HashSet<>(ignored);
        Matcher quantifier = QUANTIFIER.matcher(formula);
        while (quantifier.find()) {
            for (String name : quantifier.group(1).split(",")) {
                bound.add(name.trim());
            }
        }

        List<String> variables = new ArrayList<>();
        List<String> functions = new ArrayList<>();
        Matcher matcher = IDENTIFIER.matcher(formula);
        while (matcher.find()) {
            String name = matcher.group();
            int start = matcher.start();
            if (start > 0 && (formula.charAt(start - 1) == '\\' || Character.isDigit(formula.charAt(start - 1)))) {
                continue;
            }
            if (insideDelimiters(formula, start) || KEYWORDS.contains(name) || bound.contains(name)) {
                continue;
            }
            char next = nextNonWhitespace(formula, matcher.end());
            if ((PATH_QUANTIFIERS.contains(name) && next == '(') || (STATE_BINDER.equals(name) && next == '{')) {
                continue;
            }
            if (next == '(') {
                functions.add(name);
            } else {
                variables.add(name);
            }
        }
        return new Scan(variables, functions);
    }

    private static boolean insideDelimiters(String formula, int position) {
        int depth = 0;
        boolean wildCard = false;
        for (int i = 0; i < position; i++) {
            char c = formula.charAt(i);
            if (c == '%') wildCard = !wildCard;
            else if (c == '{') depth++;
            else if (c == '}') depth--;
        }
        return depth > 0 || wildCard;
    }

    private static char nextNonWhitespace(String formula, int from) {
        for (int i = from; i < formula.length(); i++) {
            if (!Character.isWhitespace(formula.charAt(i))) {
                return formula.charAt(i);
            }
        }
        return 0;
    }
}
