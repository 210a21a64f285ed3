package reia.ast.expr;

public record IntegerLit(int line, long value) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitInteger(this); }
}
