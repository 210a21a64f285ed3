package reia.ast.decl;

import reia.ast.expr.Expr;

import java.util.List;

public record FunctionDecl(
        int line,
        String name,
        List<Expr> params,
        Expr block, // блок-параметр, может быть null
        List<Expr> body
) {
    public FunctionDecl {
        params = List.copyOf(params);
        body = List.copyOf(body);
    }
}
