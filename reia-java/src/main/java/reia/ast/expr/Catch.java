package reia.ast.expr;

import java.util.List;

public record Catch(int line, Expr pattern, List<Expr> body) {
    public Catch {
        body = List.copyOf(body);
    }
}
