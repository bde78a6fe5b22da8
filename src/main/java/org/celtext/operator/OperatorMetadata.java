package org.celtext.operator;

import java.util.Optional;

/**
 * Static description of one operator recognized by the grammar.
 *
 * @param name          Canonical (mangled) function name, e.g. {@code _+_}
 * @param symbol        Source symbol, absent for operators with a mixfix form (conditional, index)
 * @param precedence    Binding rank; lower binds looser
 * @param leftRecursive Whether the grammar associates the operator left to right
 */
public record OperatorMetadata(
    String name,
    Optional<String> symbol,
    int precedence,
    boolean leftRecursive) {}
