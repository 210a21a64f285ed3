package reia.ast.expr;

import java.util.List;

public record TupleLit(int line, List<Expr> elements) implements Expr {
    public TupleLit {
        elements = List.copyOf(elements);
    }

    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitTuple(this); }
}
