package reia.ast.expr;

public record RegexpLit(int line, String pattern) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitRegexp(this); }
}
