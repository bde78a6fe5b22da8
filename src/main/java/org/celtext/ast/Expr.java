package org.celtext.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed expression node. Every node carries an id that is unique within its tree and serves as
 * the key into {@link SourceInfo}.
 */
public sealed interface Expr {

    long id();

    /**
     * Identifier reference: {@code a}
     */
    record Ident(long id, String name) implements Expr {
        public Ident {
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * Field selection: {@code a.b}, or {@code has(a.b)} when {@code testOnly} is set.
     */
    record Select(long id, Expr operand, String field, boolean testOnly) implements Expr {
        public Select {
            Objects.requireNonNull(operand, "operand");
            Objects.requireNonNull(field, "field");
        }
    }

    /**
     * Function or operator call: {@code f(x)}, {@code t.f(x)}, {@code a + b}
     */
    record Call(long id, Optional<Expr> target, String function, List<Expr> args) implements Expr {
        public Call {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(function, "function");
            args = List.copyOf(args);
        }
    }

    /**
     * List literal: {@code [a, b]}
     */
    record CreateList(long id, List<Expr> elements) implements Expr {
        public CreateList {
            elements = List.copyOf(elements);
        }
    }

    /**
     * Message construction {@code T{f: v}} when a message name is present, map literal {@code {k: v}} otherwise.
     */
    record CreateStruct(long id, Optional<String> messageName, List<Entry> entries) implements Expr {
        public CreateStruct {
            Objects.requireNonNull(messageName, "messageName");
            entries = List.copyOf(entries);
        }
    }

    /**
     * Literal constant.
     */
    record Const(long id, Constant value) implements Expr {
        public Const {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * Fold over a range produced by macro expansion ({@code all}, {@code exists}, {@code map}, ...).
     */
    record Comprehension(
    long id,
    String iterVar,
    Expr iterRange,
    String accuVar,
    Expr accuInit,
    Expr loopCondition,
    Expr loopStep,
    Expr result) implements Expr {}
}
