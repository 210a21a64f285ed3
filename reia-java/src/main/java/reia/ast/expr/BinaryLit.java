package reia.ast.expr;

import java.util.List;

public record BinaryLit(int line, List<BinSegment> segments) implements Expr {
    public BinaryLit {
        segments = List.copyOf(segments);
    }

    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitBinaryLit(this); }
}
