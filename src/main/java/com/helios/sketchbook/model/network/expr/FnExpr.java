package com.helios.sketchbook.model.network.expr;

import com.helios.sketchbook.model.ids.VarId;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Abstract syntax of an explicit update function.
 *
 * Instances are immutable and compare structurally.
 */
public interface FnExpr {

    /**
     * Evaluates the expression under a valuation of variables.
     */
    boolean evaluate(Predicate<VarId> valuation);

    /**
     * Adds every variable mentioned by the expression to {@code into}.
     */
    void collectVariables(Set<VarId> into);

    default Set<VarId> variables() {
        Set<VarId> result = new TreeSet<>();
        collectVariables(result);
        return result;
    }

    /**
     * Renders the expression in the syntax accepted by {@link UpdateFunctionParser}.
     */
    String render();

    record Const(boolean value) implements FnExpr {
        @Override
        public boolean evaluate(Predicate<VarId> valuation) {
            return value;
        }

        @Override
        public void collectVariables(Set<VarId> into) {
        }

        @Override
        public String render() {
            return value ? "true" : "false";
        }
    }

    record Var(VarId id) implements FnExpr {
        public Var {
            Objects.requireNonNull(id, "Variable cannot be null");
        }

        @Override
        public boolean evaluate(Predicate<VarId> valuation) {
            return valuation.test(id);
        }

        @Override
        public void collectVariables(Set<VarId> into) {
            into.add(id);
        }

        @Override
        public String render() {
            return id.asStr();
        }
    }

    record Not(FnExpr inner) implements FnExpr {
        @Override
        public boolean evaluate(Predicate<VarId> valuation) {
            return !inner.evaluate(valuation);
        }

        @Override
        public void collectVariables(Set<VarId> into) {
            inner.collectVariables(into);
        }

        @Override
        public String render() {
            return "!" + inner.render();
        }
    }

    record Binary(BinaryOp op, FnExpr left, FnExpr right) implements FnExpr {
        @Override
        public boolean evaluate(Predicate<VarId> valuation) {
            return op.apply(left.evaluate(valuation), right.evaluate(valuation));
        }

        @Override
        public void collectVariables(Set<VarId> into) {
            left.collectVariables(into);
            right.collectVariables(into);
        }

        @Override
        public String render() {
            return "(" + left.render() + " " + op.symbol() + " " + right.render() + ")";
        }
    }
}
