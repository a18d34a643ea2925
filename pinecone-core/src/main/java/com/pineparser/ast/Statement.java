package com.pineparser.ast;

public sealed interface Statement extends Node permits
    Expr,
    Assign,
    ReAssign,
    AugAssign,
    Import,
    FunctionDef,
    TypeDef,
    Break,
    Continue {
}
