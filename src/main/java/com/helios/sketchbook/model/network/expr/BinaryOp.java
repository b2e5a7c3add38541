package com.helios.sketchbook.model.network.expr;

/**
 * Binary connectives of the update function language, listed from the loosest binding.
 */
public enum BinaryOp {
    IFF("<=>"),
    IMP("=>"),
    OR("|"),
    XOR("^"),
    AND("&");

    private final String symbol;

    BinaryOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean apply(boolean left, boolean right) {
        return switch (this) {
            case IFF -> left == right;
            case IMP -> !left || right;
            case OR -> left || right;
            case XOR -> left != right;
            case AND -> left && right;
        };
    }
}
