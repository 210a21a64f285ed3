package reia.ast.expr;

import java.util.List;

public record Lambda(int line, List<Expr> params, List<Expr> body) implements Expr {
    public Lambda {
        params = List.copyOf(params);
        body = List.copyOf(body);
    }

    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitLambda(this); }
}
