package reia.ast.expr;

public record StringLit(int line, String characters) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitString(this); }
}
