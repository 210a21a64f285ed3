package reia.ast.expr;

public record FloatLit(int line, double value) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitFloat(this); }
}
