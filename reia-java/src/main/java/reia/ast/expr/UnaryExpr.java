package reia.ast.expr;

public record UnaryExpr(
        int line,
        String op,
        Expr expr
) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitUnary(this); }
}
