package reia.ast.expr;

import java.util.List;

public record TryExpr(int line, List<Expr> body, List<Catch> catches) implements Expr {
    public TryExpr {
        body = List.copyOf(body);
        catches = List.copyOf(catches);
    }

    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitTry(this); }
}
