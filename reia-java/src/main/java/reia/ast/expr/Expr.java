package reia.ast.expr;

/**
 * Узел исходного дерева (после парсера). Все узлы неизменяемые и несут номер строки.
 */
public sealed interface Expr
        permits IntegerLit, FloatLit, SymbolLit, BoolLit, NilLit, VarRef,
        StringLit, InterpolatedString, RegexpLit, BinaryLit,
        Cons, Empty, TupleLit, DictLit, RangeLit, Lambda, ModuleRef,
        ListComprehension, CaseExpr, TryExpr, MatchExpr,
        UnaryExpr, BinaryExpr,
        LocalCall, RemoteCall, NativeCall, VarCall,
        Block {

    int line();

    <R> R accept(ExprVisitor<R> v);
}
