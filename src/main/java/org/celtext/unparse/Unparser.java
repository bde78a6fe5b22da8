package org.celtext.unparse;

import org.celtext.ast.Constant;
import org.celtext.ast.Entry;
import org.celtext.ast.Expr;
import org.celtext.ast.SourceInfo;
import org.celtext.error.RenderError;
import org.celtext.operator.Operators;
import org.celtext.result.Result;
import org.celtext.result.Unit;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Reconstructs human-readable source text from an expression tree and its source positions.
 *
 * <p>The output re-parses to an equivalent tree, though formatting is normalized:
 * <ul>
 *   <li>string literals are always double-quoted and re-escaped;</li>
 *   <li>bytes literals are written as {@code b"..."} with their content decoded as UTF-8, unescaped;
 *   byte sequences that are not valid UTF-8 become U+FFFD;</li>
 *   <li>doubles use the fewest digits needed to represent the value;</li>
 *   <li>spacing around punctuation may be lost;</li>
 *   <li>parentheses appear only where they affect operator precedence.</li>
 * </ul>
 */
public final class Unparser {
    private static final int DEFAULT_OUTPUT_CAPACITY = 64;

    private final SourceInfo info;
    private final UnparserConfig config;
    private final StringBuilder str;

    private Unparser(SourceInfo info, UnparserConfig config) {
        this.info = info;
        this.config = config;
        this.str = new StringBuilder(DEFAULT_OUTPUT_CAPACITY);
    }

    public static Result<String> unparse(Expr expr, SourceInfo info) {
        return unparse(expr, info, UnparserConfig.DEFAULT);
    }

    public static Result<String> unparse(Expr expr, SourceInfo info, UnparserConfig config) {
        var unparser = new Unparser(info, config);
        return unparser.visit(expr)
                       .map(unit -> unparser.applyLineBreaks());
    }

    private String applyLineBreaks() {
        if (!config.restoreLineBreaks() || !info.isMultiline()) {
            return str.toString();
        }
        var txt = str.toString()
                     .toCharArray();
        var breaks = info.lineOffsets()
                         .stream()
                         .sorted()
                         .toList();
        for (int br : breaks) {
            for (int i = Math.max(br - 1, 0); i < txt.length; i++) {
                if (txt[i] == ' ') {
                    txt[i] = '\n';
                    break;
                }
            }
        }
        return new String(txt);
    }

    private Result<Unit> visit(Expr expr) {
        if (expr instanceof Expr.Call call) {
            return visitCall(call);
        }
        if (expr instanceof Expr.Comprehension comprehension) {
            return Result.failure(new RenderError.Unimplemented(comprehension));
        }
        if (expr instanceof Expr.Const constant) {
            return visitConst(constant);
        }
        if (expr instanceof Expr.Ident ident) {
            return visitIdent(ident);
        }
        if (expr instanceof Expr.CreateList list) {
            return visitList(list);
        }
        if (expr instanceof Expr.Select select) {
            return visitSelect(select);
        }
        if (expr instanceof Expr.CreateStruct struct) {
            return struct.messageName()
                         .isPresent()
                   ? visitStructMessage(struct)
                   : visitStructMap(struct);
        }
        return Result.failure(new RenderError.MalformedExpr(expr, "unsupported expression kind"));
    }

    private Result<Unit> visitCall(Expr.Call call) {
        return switch (call.function()) {
            case Operators.CONDITIONAL -> visitCallConditional(call);
            case Operators.INDEX -> visitCallIndex(call);
            case Operators.LOGICAL_NOT, Operators.NEGATE -> visitCallUnary(call);
            case Operators.ADD,
                 Operators.DIVIDE,
                 Operators.EQUALS,
                 Operators.GREATER,
                 Operators.GREATER_EQUALS,
                 Operators.IN,
                 Operators.LESS,
                 Operators.LESS_EQUALS,
                 Operators.LOGICAL_AND,
                 Operators.LOGICAL_OR,
                 Operators.MODULO,
                 Operators.MULTIPLY,
                 Operators.NOT_EQUALS,
                 Operators.OLD_IN,
                 Operators.SUBTRACT -> visitCallBinary(call);
            default -> visitCallFunc(call);
        };
    }

    private Result<Unit> visitCallBinary(Expr.Call call) {
        if (call.args()
                .size() != 2) {
            return arityMismatch(call, 2);
        }
        var fun = call.function();
        var lhs = call.args()
                      .get(0);
        var rhs = call.args()
                      .get(1);
        // An equally binding rhs keeps its parentheses unless the operator forms a flat chain.
        boolean lhsParen = isLowerPrecedence(fun, lhs);
        boolean rhsParen = isLowerPrecedence(fun, rhs) || (Operators.isLeftRecursive(fun) && isSamePrecedence(fun, rhs));
        var symbol = Operators.displaySymbol(fun);
        if (symbol.isEmpty()) {
            return Result.failure(new RenderError.UnknownOperator(call, fun));
        }
        var result = visitMaybeNested(lhs, lhsParen);
        if (result.isFailure()) {
            return result;
        }
        str.append(' ');
        pad(call.id());
        str.append(symbol.get())
           .append(' ');
        return visitMaybeNested(rhs, rhsParen);
    }

    private Result<Unit> visitCallConditional(Expr.Call call) {
        if (call.args()
                .size() != 3) {
            return arityMismatch(call, 3);
        }
        var args = call.args();
        var result = visitMaybeNested(args.get(0), isSamePrecedence(Operators.CONDITIONAL, args.get(0)));
        if (result.isFailure()) {
            return result;
        }
        str.append(' ');
        pad(call.id());
        str.append("? ");
        result = visitMaybeNested(args.get(1), isSamePrecedence(Operators.CONDITIONAL, args.get(1)));
        if (result.isFailure()) {
            return result;
        }
        str.append(" : ");
        return visitMaybeNested(args.get(2), isSamePrecedence(Operators.CONDITIONAL, args.get(2)));
    }

    private Result<Unit> visitCallFunc(Expr.Call call) {
        if (call.target()
                .isPresent()) {
            var result = visit(call.target()
                                   .get());
            if (result.isFailure()) {
                return result;
            }
            str.append('.');
        }
        str.append(call.function());
        pad(call.id());
        str.append('(');
        var result = visitJoined(call.args(), ",");
        if (result.isFailure()) {
            return result;
        }
        str.append(')');
        return Result.unitResult();
    }

    private Result<Unit> visitCallIndex(Expr.Call call) {
        if (call.args()
                .size() != 2) {
            return arityMismatch(call, 2);
        }
        var result = visit(call.args()
                               .get(0));
        if (result.isFailure()) {
            return result;
        }
        pad(call.id());
        str.append('[');
        result = visit(call.args()
                           .get(1));
        if (result.isFailure()) {
            return result;
        }
        str.append(']');
        return Result.unitResult();
    }

    // Operands are never parenthesized: -(a + b) prints as -a + b.
    private Result<Unit> visitCallUnary(Expr.Call call) {
        if (call.args()
                .size() != 1) {
            return arityMismatch(call, 1);
        }
        var symbol = Operators.displaySymbol(call.function());
        if (symbol.isEmpty()) {
            return Result.failure(new RenderError.UnknownOperator(call, call.function()));
        }
        pad(call.id());
        str.append(symbol.get());
        return visit(call.args()
                         .get(0));
    }

    private Result<Unit> visitConst(Expr.Const expr) {
        pad(expr.id());
        var value = expr.value();
        if (value instanceof Constant.BoolValue bool) {
            str.append(bool.value());
        } else if (value instanceof Constant.BytesValue bytes) {
            // bytes are written raw, without re-escaping
            str.append("b\"")
               .append(new String(bytes.value(), StandardCharsets.UTF_8))
               .append('"');
        } else if (value instanceof Constant.DoubleValue dbl) {
            str.append(DoubleFormatter.format(dbl.value()));
        } else if (value instanceof Constant.Int64Value int64) {
            str.append(int64.value());
        } else if (value instanceof Constant.NullValue) {
            str.append("null");
        } else if (value instanceof Constant.StringValue string) {
            return appendQuoted(expr, string.value());
        } else if (value instanceof Constant.Uint64Value uint64) {
            str.append(Long.toUnsignedString(uint64.value()))
               .append('u');
        } else {
            return Result.failure(new RenderError.Unimplemented(expr));
        }
        return Result.unitResult();
    }

    private Result<Unit> appendQuoted(Expr.Const expr, String value) {
        try{
            str.append(StringQuoter.quote(value));
            return Result.unitResult();
        } catch (IllegalArgumentException e) {
            return Result.failure(new RenderError.MalformedExpr(expr, "string constant is not valid UTF-16: " + e.getMessage()));
        }
    }

    private Result<Unit> visitIdent(Expr.Ident ident) {
        pad(ident.id());
        str.append(ident.name());
        return Result.unitResult();
    }

    private Result<Unit> visitList(Expr.CreateList list) {
        pad(list.id());
        str.append('[');
        var result = visitJoined(list.elements(), ",");
        if (result.isFailure()) {
            return result;
        }
        str.append(']');
        return Result.unitResult();
    }

    private Result<Unit> visitSelect(Expr.Select select) {
        // a select produced by the has() macro
        if (select.testOnly()) {
            str.append("has(");
        }
        var result = visit(select.operand());
        if (result.isFailure()) {
            return result;
        }
        pad(select.id());
        str.append('.')
           .append(select.field());
        if (select.testOnly()) {
            str.append(')');
        }
        return Result.unitResult();
    }

    private Result<Unit> visitStructMessage(Expr.CreateStruct struct) {
        str.append(struct.messageName()
                         .get());
        pad(struct.id());
        str.append('{');
        var entries = struct.entries();
        for (int i = 0; i < entries.size(); i++) {
            if (!(entries.get(i) instanceof Entry.FieldEntry entry)) {
                return Result.failure(new RenderError.MalformedExpr(struct, "map entry in message construction"));
            }
            str.append(entry.field());
            pad(entry.id());
            str.append(": ");
            var result = visit(entry.value());
            if (result.isFailure()) {
                return result;
            }
            if (i < entries.size() - 1) {
                str.append(", ");
            }
        }
        str.append('}');
        return Result.unitResult();
    }

    private Result<Unit> visitStructMap(Expr.CreateStruct struct) {
        pad(struct.id());
        str.append('{');
        var entries = struct.entries();
        for (int i = 0; i < entries.size(); i++) {
            if (!(entries.get(i) instanceof Entry.MapEntry entry)) {
                return Result.failure(new RenderError.MalformedExpr(struct, "field entry in map literal"));
            }
            var result = visit(entry.key());
            if (result.isFailure()) {
                return result;
            }
            pad(entry.id());
            str.append(": ");
            result = visit(entry.value());
            if (result.isFailure()) {
                return result;
            }
            if (i < entries.size() - 1) {
                str.append(", ");
            }
        }
        str.append('}');
        return Result.unitResult();
    }

    private Result<Unit> visitJoined(List<Expr> exprs, String separator) {
        for (int i = 0; i < exprs.size(); i++) {
            var result = visit(exprs.get(i));
            if (result.isFailure()) {
                return result;
            }
            if (i < exprs.size() - 1) {
                str.append(separator);
            }
        }
        return Result.unitResult();
    }

    private Result<Unit> visitMaybeNested(Expr expr, boolean nested) {
        if (nested) {
            str.append('(');
        }
        var result = visit(expr);
        if (result.isFailure()) {
            return result;
        }
        if (nested) {
            str.append(')');
        }
        return Result.unitResult();
    }

    /**
     * Append spaces until the output reaches the recorded source offset of the node.
     * Offsets already passed are ignored.
     */
    private void pad(long id) {
        if (!config.restoreSpacing()) {
            return;
        }
        int next = info.position(id);
        while (str.length() < next) {
            str.append(' ');
        }
    }

    private static Result<Unit> arityMismatch(Expr.Call call, int expected) {
        return Result.failure(new RenderError.MalformedExpr(call,
                                                            "operator " + call.function() + " expects " + expected
                                                            + " argument(s), got " + call.args()
                                                                                         .size()));
    }

    /**
     * Whether {@code expr} is an operator call with the same precedence as {@code op}.
     */
    private static boolean isSamePrecedence(String op, Expr expr) {
        return operatorOf(expr).map(other -> Operators.precedence(op) == Operators.precedence(other))
                               .orElse(false);
    }

    /**
     * Whether {@code expr} is an operator call that binds looser than {@code op}.
     */
    private static boolean isLowerPrecedence(String op, Expr expr) {
        return operatorOf(expr).map(other -> Operators.precedence(other) < Operators.precedence(op))
                               .orElse(false);
    }

    private static Optional<String> operatorOf(Expr expr) {
        if (expr instanceof Expr.Call call && Operators.isOperator(call.function())) {
            return Optional.of(call.function());
        }
        return Optional.empty();
    }
}
