package reia.ast.decl;

import java.util.List;

public record ClassDecl(
        int line,
        String name,
        List<FunctionDecl> methods
) implements UnitDecl {
    public ClassDecl {
        methods = List.copyOf(methods);
    }

    // методы компилируются так же, как функции модуля
    @Override
    public List<FunctionDecl> functions() { return methods; }
}
