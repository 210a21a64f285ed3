package reia.ast.expr;

/**
 * Бинарный оператор. {@code op} хранится токеном исходного языка
 * ({@code "+"}, {@code "==="}, {@code "[]"}, ...), переименование делает lowering.
 */
public record BinaryExpr(
        int line,
        String op,
        Expr left,
        Expr right
) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitBinary(this); }
}
