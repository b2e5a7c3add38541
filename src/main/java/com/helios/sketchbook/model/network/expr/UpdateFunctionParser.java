package com.helios.sketchbook.model.network.expr;

import com.helios.sketchbook.core.error.ValidationException;
import com.helios.sketchbook.model.ids.Identifier;
import com.helios.sketchbook.model.ids.VarId;

/**
 * Recursive descent parser for update function expressions.
 *
 * <p>Grammar, loosest binding first:
 * <pre>
 * iff  := imp ("&lt;=&gt;" imp)*
 * imp  := or ("=&gt;" imp)?          right associative
 * or   := xor ("|" xor)*
 * xor  := and ("^" and)*
 * and  := unary ("&amp;" unary)*
 * unary := "!" unary | "(" iff ")" | "true" | "false" | identifier
 * </pre>
 */
public final class UpdateFunctionParser {

    private final String input;
    private int pos;

    private UpdateFunctionParser(String input) {
        this.input = input;
    }

    /**
     * Parses an expression.
     * @throws ValidationException on any syntax error.
     */
    public static FnExpr parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ValidationException("Update function expression cannot be empty");
        }
        UpdateFunctionParser parser = new UpdateFunctionParser(expression);
        FnExpr result = parser.parseIff();
        parser.skipWhitespace();
        if (parser.pos < parser.input.length()) {
            throw parser.error("Unexpected input");
        }
        return result;
    }

    private FnExpr parseIff() {
        FnExpr left = parseImp();
        while (consume("<=>")) {
            left = new FnExpr.Binary(BinaryOp.IFF, left, parseImp());
        }
        return left;
    }

    private FnExpr parseImp() {
        FnExpr left = parseBinary(BinaryOp.OR);
        if (consume("=>")) {
            return new FnExpr.Binary(BinaryOp.IMP, left, parseImp());
        }
        return left;
    }

    private FnExpr parseBinary(BinaryOp op) {
        FnExpr left = op == BinaryOp.AND ? parseUnary() : parseBinary(tighter(op));
        while (peekOperator(op)) {
            pos += op.symbol().length();
            FnExpr right = op == BinaryOp.AND ? parseUnary() : parseBinary(tighter(op));
            left = new FnExpr.Binary(op, left, right);
        }
        return left;
    }

    private FnExpr parseUnary() {
        skipWhitespace();
        if (pos >= input.length()) {
            throw error("Unexpected end of expression");
        }
        char c = input.charAt(pos);
        if (c == '!') {
            pos++;
            return new FnExpr.Not(parseUnary());
        }
        if (c == '(') {
            pos++;
            FnExpr inner = parseIff();
            if (!consume(")")) {
                throw error("Expected ')'");
            }
            return inner;
        }
        int start = pos;
        while (pos < input.length() && (Character.isLetterOrDigit(input.charAt(pos)) || input.charAt(pos) == '_')) {
            pos++;
        }
        String token = input.substring(start, pos);
        if (token.isEmpty()) {
            throw error("Unexpected character '" + c + "'");
        }
        if (token.equals("true")) {
            return new FnExpr.Const(true);
        }
        if (token.equals("false")) {
            return new FnExpr.Const(false);
        }
        if (!Identifier.isValid(token)) {
            pos = start;
            throw error("Invalid variable name '" + token + "'");
        }
        return new FnExpr.Var(VarId.of(token));
    }

    private static BinaryOp tighter(BinaryOp op) {
        return switch (op) {
            case OR -> BinaryOp.XOR;
            case XOR -> BinaryOp.AND;
            default -> throw new IllegalArgumentException("No tighter operator than " + op);
        };
    }

    private boolean peekOperator(BinaryOp op) {
        skipWhitespace();
        return input.startsWith(op.symbol(), pos);
    }

    private boolean consume(String token) {
        skipWhitespace();
        if (input.startsWith(token, pos)) {
            pos += token.length();
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private ValidationException error(String message) {
        return new ValidationException(message + " at position " + pos + " in update function '" + input + "'");
    }
}
