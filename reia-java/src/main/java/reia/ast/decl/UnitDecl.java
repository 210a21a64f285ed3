package reia.ast.decl;

import java.util.List;

/** Единица компиляции верхнего уровня: модуль или класс. */
public sealed interface UnitDecl permits ModuleDecl, ClassDecl {
    int line();

    String name();

    List<FunctionDecl> functions();
}
