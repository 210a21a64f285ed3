package reia.ast.expr;

public record Generator(int line, Expr pattern, Expr source) {}
