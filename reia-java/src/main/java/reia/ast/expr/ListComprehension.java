package reia.ast.expr;

import java.util.List;

public record ListComprehension(int line, Expr result, List<Generator> generators) implements Expr {
    public ListComprehension {
        generators = List.copyOf(generators);
    }

    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitListComprehension(this); }
}
