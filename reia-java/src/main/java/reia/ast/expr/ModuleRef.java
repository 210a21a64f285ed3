package reia.ast.expr;

public record ModuleRef(int line, String name) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitModuleRef(this); }
}
