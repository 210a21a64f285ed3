package reia.ast.expr;

import java.util.List;

/** Вызов значения (обычно лямбды). Блок пока не передаётся. */
public record VarCall(
        int line,
        Expr receiver,
        List<Expr> args,
        Expr block // может быть null
) implements Expr {
    public VarCall {
        args = List.copyOf(args);
    }

    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitVarCall(this); }
}
