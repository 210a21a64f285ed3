package reia.ast.expr;

import java.util.List;

public record LocalCall(
        int line,
        String name,
        List<Expr> args,
        Expr block // может быть null
) implements Expr {
    public LocalCall {
        args = List.copyOf(args);
    }

    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitLocalCall(this); }
}
