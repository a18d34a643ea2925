package com.pineparser.ast;

/**
 * Expressions, including the structure expressions ({@code if}, {@code switch}, loops)
 * which yield a value in Pine Script and may appear on the right of a declaration.
 */
public sealed interface Expression extends Node permits
    Name,
    Constant,
    Attribute,
    Subscript,
    Call,
    BinOp,
    UnaryOp,
    BoolOp,
    Compare,
    Conditional,
    Tuple,
    Specialize,
    If,
    Switch,
    ForTo,
    ForIn,
    While {
}
