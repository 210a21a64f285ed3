package reia.ast.expr;

import java.util.List;

public record NativeCall(int line, String module, String function, List<Expr> args) implements Expr {
    public NativeCall {
        args = List.copyOf(args);
    }

    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitNativeCall(this); }
}
