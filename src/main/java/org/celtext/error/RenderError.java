package org.celtext.error;

import org.celtext.ast.Expr;
import org.celtext.result.Cause;

/**
 * Failure to render an expression tree back to text.
 */
public sealed interface RenderError extends Cause {
    /**
     * Node that could not be rendered.
     */
    Expr expr();

    /**
     * Node kind the printer has no textual form for.
     */
    record Unimplemented(Expr expr) implements RenderError {
        @Override
        public String message() {
            return "unimplemented: " + describe(expr);
        }
    }

    /**
     * Operator call whose canonical name has no display symbol.
     */
    record UnknownOperator(
    Expr expr,
    String function) implements RenderError {
        @Override
        public String message() {
            return "cannot unmangle operator: " + function + " in " + describe(expr);
        }
    }

    /**
     * Tree shape the printer cannot express, e.g. an operator call with the wrong number of arguments.
     */
    record MalformedExpr(
    Expr expr,
    String reason) implements RenderError {
        @Override
        public String message() {
            return reason + " in " + describe(expr);
        }
    }

    private static String describe(Expr expr) {
        return expr.getClass()
                   .getSimpleName() + "#" + expr.id();
    }
}
