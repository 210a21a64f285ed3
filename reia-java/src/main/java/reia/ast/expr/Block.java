package reia.ast.expr;

import java.util.List;

public record Block(int line, List<Expr> exprs) implements Expr {
    public Block {
        exprs = List.copyOf(exprs);
    }

    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitBlock(this); }
}
