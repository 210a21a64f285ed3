package reia.ast.expr;

public record MatchExpr(int line, Expr left, Expr right) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitMatch(this); }
}
