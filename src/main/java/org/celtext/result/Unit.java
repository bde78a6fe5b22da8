package org.celtext.result;

/**
 * Value-less success marker.
 */
public enum Unit {
    UNIT;

    public static Unit unit() {
        return UNIT;
    }
}
