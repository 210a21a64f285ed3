package reia.ast.decl;

import java.util.List;

public record ModuleDecl(
        int line,
        String name,
        List<FunctionDecl> functions
) implements UnitDecl {
    public ModuleDecl {
        functions = List.copyOf(functions);
    }
}
