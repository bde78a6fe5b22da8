package org.celtext.ast;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConstantTest {

    @Test
    void bytesValue_comparesByContent() {
        var first = new Constant.BytesValue(new byte[]{1, 2, 3});
        var second = new Constant.BytesValue(new byte[]{1, 2, 3});

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, new Constant.BytesValue(new byte[]{1, 2}));
    }

    @Test
    void bytesValue_isDefensivelyCopied() {
        var raw = new byte[]{1, 2};
        var value = new Constant.BytesValue(raw);

        raw[0] = 9;
        value.value()[1] = 9;

        assertArrayEquals(new byte[]{1, 2}, value.value());
        assertEquals(2, value.size());
    }

    @Test
    void bytesValue_toString_showsHex() {
        assertEquals("BytesValue[c3bf]", new Constant.BytesValue(new byte[]{(byte) 0xc3, (byte) 0xbf}).toString());
    }

    @Test
    void uint64Value_toString_isUnsigned() {
        assertEquals("Uint64Value[18446744073709551615]", new Constant.Uint64Value(-1L).toString());
    }
}
