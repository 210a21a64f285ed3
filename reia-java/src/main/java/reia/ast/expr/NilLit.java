package reia.ast.expr;

public record NilLit(int line) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitNil(this); }
}
