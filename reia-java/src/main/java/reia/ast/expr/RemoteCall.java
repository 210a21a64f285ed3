package reia.ast.expr;

import java.util.List;

public record RemoteCall(
        int line,
        Expr receiver,
        String method,
        List<Expr> args,
        Expr block // может быть null
) implements Expr {
    public RemoteCall {
        args = List.copyOf(args);
    }

    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitRemoteCall(this); }
}
