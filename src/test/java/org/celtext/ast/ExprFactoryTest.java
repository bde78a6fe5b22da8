package org.celtext.ast;

import org.celtext.error.DecodeError;
import org.celtext.operator.Operators;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ExprFactoryTest {

    @Test
    void nodes_receiveIncreasingUniqueIds() {
        var f = ExprFactory.exprFactory();
        var a = f.ident("a");
        var b = f.ident("b");
        var sum = f.call(Operators.ADD, a, b);
        var entry = f.entry(f.string("k"), sum);
        var map = f.map(entry);

        var ids = List.of(a.id(), b.id(), sum.id(), entry.id(), map.id());
        assertEquals(1, a.id());
        assertThat(ids).isSorted();
        assertEquals(ids.size(), new HashSet<>(ids).size());
    }

    @Test
    void exprFactory_withFirstId_startsThere() {
        var f = ExprFactory.exprFactory(100);

        assertEquals(100, f.peekId());
        assertEquals(100, f.ident("x").id());
        assertEquals(101, f.peekId());
    }

    @Test
    void literal_validToken_createsConstant() {
        var f = ExprFactory.exprFactory();

        var string = f.literal("'''x''x'''", false).unwrap();
        var bytes = f.literal("'\\xff'", true).unwrap();

        assertEquals(new Constant.StringValue("x''x"), string.value());
        assertEquals(new Constant.BytesValue(new byte[]{(byte) 0xff}), bytes.value());
        assertEquals(1, string.id());
        assertEquals(2, bytes.id());
    }

    @Test
    void literal_invalidToken_consumesNoId() {
        var f = ExprFactory.exprFactory();

        var result = f.literal("'\\u00ff'", true);

        assertThat(result.cause()
                         .orElseThrow()).isInstanceOf(DecodeError.UnicodeEscapeInBytes.class);
        assertEquals(1, f.peekId());
    }

    @Test
    void call_copiesArguments() {
        var f = ExprFactory.exprFactory();
        var call = f.call("f", f.ident("a"));

        assertThrows(UnsupportedOperationException.class, () -> call.args().add(f.ident("b")));
        assertTrue(call.target().isEmpty());
    }

    @Test
    void presenceTest_marksSelectAsTestOnly() {
        var f = ExprFactory.exprFactory();

        assertTrue(f.presenceTest(f.ident("a"), "b").testOnly());
        assertFalse(f.select(f.ident("a"), "b").testOnly());
    }
}
