package org.celtext.ast;

import java.util.Objects;

/**
 * Entry of a {@link Expr.CreateStruct}. Carries its own id for position lookup.
 */
public sealed interface Entry {

    long id();

    Expr value();

    /**
     * Message field initializer: {@code field: value}
     */
    record FieldEntry(long id, String field, Expr value) implements Entry {
        public FieldEntry {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * Map entry: {@code key: value}
     */
    record MapEntry(long id, Expr key, Expr value) implements Entry {
        public MapEntry {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }
    }
}
