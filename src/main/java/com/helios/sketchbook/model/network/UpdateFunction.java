package com.helios.sketchbook.model.network;

import com.helios.sketchbook.model.network.expr.FnExpr;
import com.helios.sketchbook.model.network.expr.UpdateFunctionParser;

import java.util.Objects;

/**
 * An explicit update function of a variable.
 */
public record UpdateFunction(FnExpr expression) {

    public UpdateFunction {
        Objects.requireNonNull(expression, "Expression cannot be null");
    }

    public static UpdateFunction parse(String text) {
        return new UpdateFunction(UpdateFunctionParser.parse(text));
    }

    public String asText() {
        String rendered = expression.render();
        // Drop the outermost parentheses of a binary root.
        if (expression instanceof FnExpr.Binary) {
            return rendered.substring(1, rendered.length() - 1);
        }
        return rendered;
    }
}
