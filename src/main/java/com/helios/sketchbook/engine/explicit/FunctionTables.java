package com.helios.sketchbook.engine.explicit;

import com.helios.sketchbook.model.ids.VarId;
import com.helios.sketchbook.model.network.expr.BinaryOp;
import com.helios.sketchbook.model.network.expr.FnExpr;

import java.util.List;

/**
 * Truth-table arithmetic for functions of at most six inputs.
 *
 * A table is a {@code long} whose bit {@code r} is the function value on row {@code r};
 * bit {@code j} of the row index is the value of input {@code j}.
 */
final class FunctionTables {

    static final int MAX_TABLE_INPUTS = 6;

    private FunctionTables() {
    }

    static boolean value(long table, int row) {
        return ((table >>> row) & 1L) != 0;
    }

    static int rows(int arity) {
        return 1 << arity;
    }

    /** True if flipping input {@code j} changes the output on some row. */
    static boolean observable(long table, int arity, int j) {
        int bit = 1 << j;
        for (int row = 0; row < rows(arity); row++) {
            if ((row & bit) == 0 && value(table, row) != value(table, row | bit)) {
                return true;
            }
        }
        return false;
    }

    /** True if raising input {@code j} never lowers the output. */
    static boolean nonDecreasing(long table, int arity, int j) {
        int bit = 1 << j;
        for (int row = 0; row < rows(arity); row++) {
            if ((row & bit) == 0 && value(table, row) && !value(table, row | bit)) {
                return false;
            }
        }
        return true;
    }

    /** True if raising input {@code j} never raises the output. */
    static boolean nonIncreasing(long table, int arity, int j) {
        int bit = 1 << j;
        for (int row = 0; row < rows(arity); row++) {
            if ((row & bit) == 0 && !value(table, row) && value(table, row | bit)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Disjunctive normal form of a table, one minterm per true row. Constant tables become constants.
     */
    static FnExpr toExpr(long table, List<VarId> inputs) {
        int rows = rows(inputs.size());
        long mask = rows == 64 ? -1L : (1L << rows) - 1;
        if ((table & mask) == 0) {
            return new FnExpr.Const(false);
        }
        if ((table & mask) == mask) {
            return new FnExpr.Const(true);
        }
        FnExpr result = null;
        for (int row = 0; row < rows; row++) {
            if (!value(table, row)) {
                continue;
            }
            FnExpr minterm = null;
            for (int j = 0; j < inputs.size(); j++) {
                FnExpr literal = new FnExpr.Var(inputs.get(j));
                if (((row >>> j) & 1) == 0) {
                    literal = new FnExpr.Not(literal);
                }
                minterm = minterm == null ? literal : new FnExpr.Binary(BinaryOp.AND, minterm, literal);
            }
            result = result == null ? minterm : new FnExpr.Binary(BinaryOp.OR, result, minterm);
        }
        return result;
    }
}
