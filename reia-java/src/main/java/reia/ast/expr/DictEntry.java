package reia.ast.expr;

public record DictEntry(Expr key, Expr value) {}
