package org.celtext.ast;

import org.celtext.literal.Unescaper;
import org.celtext.result.Result;

import java.util.Arrays;
import java.util.Optional;

/**
 * Creates expression nodes for a single tree, handing out ids in increasing order so that no id
 * is ever reused within the tree. Not thread-safe; use one factory per tree.
 */
public final class ExprFactory {
    private long nextId;

    private ExprFactory(long firstId) {
        this.nextId = firstId;
    }

    public static ExprFactory exprFactory() {
        return new ExprFactory(1);
    }

    public static ExprFactory exprFactory(long firstId) {
        return new ExprFactory(firstId);
    }

    /**
     * Id that the next created node or entry will receive.
     */
    public long peekId() {
        return nextId;
    }

    public Expr.Ident ident(String name) {
        return new Expr.Ident(nextId(), name);
    }

    public Expr.Select select(Expr operand, String field) {
        return new Expr.Select(nextId(), operand, field, false);
    }

    public Expr.Select presenceTest(Expr operand, String field) {
        return new Expr.Select(nextId(), operand, field, true);
    }

    public Expr.Call call(String function, Expr... args) {
        return new Expr.Call(nextId(), Optional.empty(), function, Arrays.asList(args));
    }

    public Expr.Call memberCall(Expr target, String function, Expr... args) {
        return new Expr.Call(nextId(), Optional.of(target), function, Arrays.asList(args));
    }

    public Expr.CreateList list(Expr... elements) {
        return new Expr.CreateList(nextId(), Arrays.asList(elements));
    }

    public Expr.CreateStruct message(String messageName, Entry.FieldEntry... entries) {
        return new Expr.CreateStruct(nextId(), Optional.of(messageName), Arrays.asList(entries));
    }

    public Expr.CreateStruct map(Entry.MapEntry... entries) {
        return new Expr.CreateStruct(nextId(), Optional.empty(), Arrays.asList(entries));
    }

    public Entry.FieldEntry field(String field, Expr value) {
        return new Entry.FieldEntry(nextId(), field, value);
    }

    public Entry.MapEntry entry(Expr key, Expr value) {
        return new Entry.MapEntry(nextId(), key, value);
    }

    public Expr.Const constant(Constant value) {
        return new Expr.Const(nextId(), value);
    }

    public Expr.Const bool(boolean value) {
        return constant(new Constant.BoolValue(value));
    }

    public Expr.Const int64(long value) {
        return constant(new Constant.Int64Value(value));
    }

    public Expr.Const uint64(long value) {
        return constant(new Constant.Uint64Value(value));
    }

    public Expr.Const dbl(double value) {
        return constant(new Constant.DoubleValue(value));
    }

    public Expr.Const string(String value) {
        return constant(new Constant.StringValue(value));
    }

    public Expr.Const bytes(byte[] value) {
        return constant(new Constant.BytesValue(value));
    }

    public Expr.Const nullValue() {
        return constant(Constant.NullValue.INSTANCE);
    }

    /**
     * Decode a quoted string or bytes token and wrap the value in a constant node.
     * No id is consumed when decoding fails.
     */
    public Result<Expr.Const> literal(String token, boolean isBytes) {
        return Unescaper.unescape(token, isBytes)
                        .map(this::constant);
    }

    public Expr.Comprehension comprehension(String iterVar,
                                            Expr iterRange,
                                            String accuVar,
                                            Expr accuInit,
                                            Expr loopCondition,
                                            Expr loopStep,
                                            Expr result) {
        return new Expr.Comprehension(nextId(), iterVar, iterRange, accuVar, accuInit, loopCondition, loopStep, result);
    }

    private long nextId() {
        return nextId++ ;
    }
}
