package org.celtext.operator;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class OperatorsTest {

    @Test
    void precedence_increasesFromConditionalToIndex() {
        assertThat(Operators.precedence(Operators.CONDITIONAL)).isLessThan(Operators.precedence(Operators.LOGICAL_OR));
        assertThat(Operators.precedence(Operators.LOGICAL_OR)).isLessThan(Operators.precedence(Operators.LOGICAL_AND));
        assertThat(Operators.precedence(Operators.LOGICAL_AND)).isLessThan(Operators.precedence(Operators.EQUALS));
        assertThat(Operators.precedence(Operators.EQUALS)).isLessThan(Operators.precedence(Operators.ADD));
        assertThat(Operators.precedence(Operators.ADD)).isLessThan(Operators.precedence(Operators.MULTIPLY));
        assertThat(Operators.precedence(Operators.MULTIPLY)).isLessThan(Operators.precedence(Operators.NEGATE));
        assertThat(Operators.precedence(Operators.NEGATE)).isLessThan(Operators.precedence(Operators.INDEX));
    }

    @Test
    void precedence_sameForOperatorsOfOneGroup() {
        assertEquals(Operators.precedence(Operators.ADD), Operators.precedence(Operators.SUBTRACT));
        assertEquals(Operators.precedence(Operators.MULTIPLY), Operators.precedence(Operators.MODULO));
        assertEquals(Operators.precedence(Operators.LESS), Operators.precedence(Operators.IN));
        assertEquals(Operators.precedence(Operators.IN), Operators.precedence(Operators.OLD_IN));
        assertEquals(Operators.precedence(Operators.LOGICAL_NOT), Operators.precedence(Operators.NEGATE));
    }

    @Test
    void precedence_unknownFunction_isZero() {
        assertEquals(0, Operators.precedence("size"));
        assertFalse(Operators.isOperator("size"));
        assertTrue(Operators.isOperator(Operators.INDEX));
    }

    @Test
    void isLeftRecursive_falseOnlyForLogicalAndOr() {
        assertFalse(Operators.isLeftRecursive(Operators.LOGICAL_AND));
        assertFalse(Operators.isLeftRecursive(Operators.LOGICAL_OR));
        assertTrue(Operators.isLeftRecursive(Operators.SUBTRACT));
        assertTrue(Operators.isLeftRecursive(Operators.EQUALS));
        assertTrue(Operators.isLeftRecursive(Operators.DIVIDE));
    }

    @Test
    void displaySymbol_knownOperators_returnsSourceSymbol() {
        assertEquals("+", Operators.displaySymbol(Operators.ADD).orElseThrow());
        assertEquals("-", Operators.displaySymbol(Operators.SUBTRACT).orElseThrow());
        assertEquals("-", Operators.displaySymbol(Operators.NEGATE).orElseThrow());
        assertEquals("!", Operators.displaySymbol(Operators.LOGICAL_NOT).orElseThrow());
        assertEquals("in", Operators.displaySymbol(Operators.IN).orElseThrow());
        assertEquals("in", Operators.displaySymbol(Operators.OLD_IN).orElseThrow());
        assertEquals("&&", Operators.displaySymbol(Operators.LOGICAL_AND).orElseThrow());
    }

    @Test
    void displaySymbol_regularFunction_isEmpty() {
        assertTrue(Operators.displaySymbol("size").isEmpty());
        assertTrue(Operators.displaySymbol("_unknown_").isEmpty());
    }

    @Test
    void displaySymbol_mixfixOperators_isEmpty() {
        assertTrue(Operators.displaySymbol(Operators.CONDITIONAL).isEmpty());
        assertTrue(Operators.displaySymbol(Operators.INDEX).isEmpty());
    }

    @Test
    void find_binarySymbol_returnsCanonicalName() {
        assertEquals(Operators.SUBTRACT, Operators.find("-").orElseThrow());
        assertEquals(Operators.IN, Operators.find("in").orElseThrow());
        assertEquals(Operators.LOGICAL_OR, Operators.find("||").orElseThrow());
        assertTrue(Operators.find("?").isEmpty());
        assertTrue(Operators.find("!").isEmpty());
    }

    @Test
    void lookup_returnsFullMetadata() {
        var metadata = Operators.lookup(Operators.LOGICAL_AND).orElseThrow();

        assertEquals(Operators.LOGICAL_AND, metadata.name());
        assertEquals("&&", metadata.symbol().orElseThrow());
        assertFalse(metadata.leftRecursive());
        assertTrue(Operators.lookup("size").isEmpty());
    }
}
