package reia.ast.expr;

import java.util.List;

public record CaseExpr(int line, Expr subject, List<Clause> clauses) implements Expr {
    public CaseExpr {
        clauses = List.copyOf(clauses);
    }

    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitCase(this); }
}
