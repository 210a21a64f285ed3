package reia.ast.expr;

public record BoolLit(int line, boolean value) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitBool(this); }
}
