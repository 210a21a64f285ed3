package reia.ast.expr;

// один метод на вариант Expr: пропущенный случай ловится компилятором
public interface ExprVisitor<R> {
    R visitInteger(IntegerLit e);
    R visitFloat(FloatLit e);
    R visitSymbol(SymbolLit e);
    R visitBool(BoolLit e);
    R visitNil(NilLit e);
    R visitVar(VarRef e);

    R visitString(StringLit e);
    R visitInterpolatedString(InterpolatedString e);
    R visitRegexp(RegexpLit e);
    R visitBinaryLit(BinaryLit e);

    R visitCons(Cons e);
    R visitEmpty(Empty e);
    R visitTuple(TupleLit e);
    R visitDict(DictLit e);
    R visitRange(RangeLit e);
    R visitLambda(Lambda e);
    R visitModuleRef(ModuleRef e);

    R visitListComprehension(ListComprehension e);
    R visitCase(CaseExpr e);
    R visitTry(TryExpr e);
    R visitMatch(MatchExpr e);

    R visitUnary(UnaryExpr e);
    R visitBinary(BinaryExpr e);

    R visitLocalCall(LocalCall e);
    R visitRemoteCall(RemoteCall e);
    R visitNativeCall(NativeCall e);
    R visitVarCall(VarCall e);

    R visitBlock(Block e);
}
