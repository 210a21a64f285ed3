package reia.ast.expr;

import java.util.List;

public record DictLit(int line, List<DictEntry> entries) implements Expr {
    public DictLit {
        entries = List.copyOf(entries);
    }

    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitDict(this); }
}
