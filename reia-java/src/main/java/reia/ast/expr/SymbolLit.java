package reia.ast.expr;

public record SymbolLit(int line, String name) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitSymbol(this); }
}
