package reia.ast.expr;

public record Empty(int line) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitEmpty(this); }
}
