package reia.ast.expr;

import java.util.List;

/** Ветка case: несколько альтернативных образцов с общим телом. */
public record Clause(int line, List<Expr> patterns, List<Expr> body) {
    public Clause {
        patterns = List.copyOf(patterns);
        body = List.copyOf(body);
    }
}
