package reia.ast.expr;

public record RangeLit(int line, Expr from, Expr to) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitRange(this); }
}
