package reia.ast.expr;

public record VarRef(int line, String name) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitVar(this); }
}
