package reia.ast.expr;

import java.util.List;

public record InterpolatedString(int line, List<Expr> segments) implements Expr {
    public InterpolatedString {
        segments = List.copyOf(segments);
    }

    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitInterpolatedString(this); }
}
