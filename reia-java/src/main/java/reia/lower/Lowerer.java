package reia.lower;

import reia.ast.decl.FunctionDecl;
import reia.ast.decl.UnitDecl;
import reia.ast.expr.*;
import reia.erl.Erl;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static reia.erl.Erl.atom;
import static reia.erl.Erl.remote;
import static reia.erl.Erl.tuple;
import static reia.erl.Erl.var;

/**
 * Исходное дерево -> абстрактный формат Erlang.
 * Любая пользовательская функция имеет арность 2: (кортеж аргументов, блок).
 */
public final class Lowerer implements ExprVisitor<Erl.Expr> {
    public static final int CALL_ARITY = 2;

    private static final Map<String, String> RENAMED_BINARY_OPS = Map.of(
            "&", "band",
            "|", "bor",
            "^", "bxor",
            "<<", "bsl",
            ">>", "bsr",
            "%", "rem",
            "<=", "=<"
    );

    private final RuntimeTargets rt;
    private final LiteralEncoding encoding;

    public Lowerer() {
        this(LoweringOptions.defaults());
    }

    public Lowerer(LoweringOptions options) {
        this.rt = options.runtime();
        this.encoding = options.encoding();
    }

    // ---------- entry ----------

    /** Модуль и класс сворачиваются в одну и ту же форму модуля. */
    public Erl.Module lowerUnit(UnitDecl unit) {
        List<Erl.Function> functions = new ArrayList<>();
        for (FunctionDecl f : unit.functions()) {
            functions.add(lowerFunction(f));
        }
        return new Erl.Module(unit.line(), unit.name(), ClauseGrouper.group(functions));
    }

    public Erl.Function lowerFunction(FunctionDecl f) {
        int line = f.line();
        List<Erl.Expr> patterns = List.of(
                new Erl.Tuple(line, lowerAll(f.params())),
                lowerBlockArg(f.block(), line)
        );
        Erl.Clause clause = new Erl.Clause(line, patterns, List.of(), lowerAll(f.body()));
        return new Erl.Function(line, f.name(), CALL_ARITY, List.of(clause));
    }

    public Erl.Expr lower(Expr e) {
        return lower(e, 0);
    }

    // line - строка родителя, если узла нет
    private Erl.Expr lower(Expr e, int line) {
        if (e == null) throw new LoweringException(line, "missing node");
        return e.accept(this);
    }

    public List<Erl.Expr> lowerAll(List<? extends Expr> exprs) {
        List<Erl.Expr> out = new ArrayList<>(exprs.size());
        for (Expr e : exprs) out.add(lower(e));
        return out;
    }

    /**
     * Ветка с несколькими образцами раскрывается в несколько веток Erlang.
     * Тело переводится один раз и используется во всех раскрытых ветках.
     */
    public List<Erl.Clause> lowerClause(Clause c) {
        if (c.patterns().isEmpty()) {
            throw new LoweringException(c.line(), "clause without patterns");
        }
        // copyOf один раз: Erl.Clause повторно не копирует неизменяемый список
        List<Erl.Expr> body = List.copyOf(lowerAll(c.body()));
        List<Erl.Clause> out = new ArrayList<>(c.patterns().size());
        for (Expr pattern : c.patterns()) {
            out.add(new Erl.Clause(c.line(), List.of(lower(pattern)), List.of(), body));
        }
        return out;
    }

    /**
     * catch получает тройку (класс, причина, стек) и перед пользовательским кодом
     * сопоставляет объявленный образец с {exception, {класс, причина}}.
     */
    public Erl.Clause lowerCatch(Catch c) {
        int line = c.line();
        Erl.Expr raised = tuple(line, var(line, "__type"), var(line, "__reason"), var(line, "__lint"));
        Erl.Expr exception = tuple(line,
                atom(line, rt.exceptionTag()),
                tuple(line, var(line, "__type"), var(line, "__reason")));

        List<Erl.Expr> body = new ArrayList<>();
        body.add(new Erl.Match(line, lower(c.pattern(), line), exception));
        body.addAll(lowerAll(c.body()));
        return new Erl.Clause(line, List.of(raised), List.of(), body);
    }

    /** Источник генератора всегда приводится к списку вызовом to_list. */
    public Erl.Generate lowerGenerator(Generator g) {
        int line = g.line();
        Erl.Expr source = dispatch(line, g.source(), rt.toListMethod(), List.of(), new NilLit(line));
        return new Erl.Generate(line, lower(g.pattern(), line), source);
    }

    // ---------- terminals ----------

    @Override
    public Erl.Expr visitInteger(IntegerLit e) { return new Erl.Int(e.line(), e.value()); }

    @Override
    public Erl.Expr visitFloat(FloatLit e) { return new Erl.Float(e.line(), e.value()); }

    @Override
    public Erl.Expr visitSymbol(SymbolLit e) { return atom(e.line(), e.name()); }

    @Override
    public Erl.Expr visitBool(BoolLit e) { return atom(e.line(), e.value() ? "true" : "false"); }

    @Override
    public Erl.Expr visitNil(NilLit e) { return atom(e.line(), "nil"); }

    @Override
    public Erl.Expr visitVar(VarRef e) { return var(e.line(), e.name()); }

    // ---------- strings ----------

    @Override
    public Erl.Expr visitString(StringLit e) {
        int line = e.line();
        Erl.Expr chars = charsBinary(line, e.characters());
        if (encoding == LiteralEncoding.LEGACY) {
            return tuple(line, atom(line, rt.legacyStringTag()), chars);
        }
        return tuple(line, atom(line, rt.stringTag()), new Erl.Cons(line, chars, new Erl.Nil(line)));
    }

    // "a#{b}c" -> [a, b, c].join()
    @Override
    public Erl.Expr visitInterpolatedString(InterpolatedString e) {
        int line = e.line();
        return visitRemoteCall(new RemoteCall(
                line, Cons.of(line, e.segments()), rt.joinMethod(), List.of(), new NilLit(line)));
    }

    @Override
    public Erl.Expr visitRegexp(RegexpLit e) {
        int line = e.line();
        String tag = encoding == LiteralEncoding.LEGACY ? rt.legacyRegexpTag() : rt.regexpTag();
        return tuple(line, atom(line, tag), charsBinary(line, e.pattern()));
    }

    // TODO: выражения в сегментах, когда появится грамматика размеров/типов
    @Override
    public Erl.Expr visitBinaryLit(BinaryLit e) {
        List<Erl.BinElement> elements = new ArrayList<>(e.segments().size());
        for (BinSegment s : e.segments()) {
            elements.add(new Erl.BinElement(s.line(), segmentValue(s), segmentSize(s), s.typeSpecs()));
        }
        return new Erl.Bin(e.line(), elements);
    }

    private Erl.Expr segmentValue(BinSegment s) {
        Expr v = s.value();
        if (v instanceof IntegerLit i) return new Erl.Int(i.line(), i.value());
        if (v instanceof FloatLit f) return new Erl.Float(f.line(), f.value());
        if (v instanceof StringLit str) return new Erl.Str(str.line(), str.characters());
        throw new LoweringException(s.line(), "unsupported binary segment value: " + describe(v));
    }

    private Erl.Expr segmentSize(BinSegment s) {
        Expr size = s.size();
        if (size == null) return null;
        if (size instanceof IntegerLit || size instanceof VarRef) return lower(size);
        throw new LoweringException(s.line(), "unsupported binary segment size: " + describe(size));
    }

    // ---------- collections ----------

    @Override
    public Erl.Expr visitCons(Cons e) { return boxList(e.line(), consChain(e)); }

    @Override
    public Erl.Expr visitEmpty(Empty e) { return boxList(e.line(), new Erl.Nil(e.line())); }

    @Override
    public Erl.Expr visitTuple(TupleLit e) { return new Erl.Tuple(e.line(), lowerAll(e.elements())); }

    @Override
    public Erl.Expr visitDict(DictLit e) {
        int line = e.line();
        return new Erl.Call(line, remoteOf(line, rt.dictFromList()), List.of(dictPairs(e.entries(), line)));
    }

    @Override
    public Erl.Expr visitRange(RangeLit e) {
        int line = e.line();
        return tuple(line, atom(line, rt.rangeTag()), lower(e.from(), line), lower(e.to(), line));
    }

    @Override
    public Erl.Expr visitLambda(Lambda e) {
        int line = e.line();
        Erl.Clause clause = new Erl.Clause(line, lowerAll(e.params()), List.of(), lowerAll(e.body()));
        return new Erl.Fun(line, List.of(clause));
    }

    @Override
    public Erl.Expr visitModuleRef(ModuleRef e) {
        int line = e.line();
        return tuple(line, atom(line, rt.moduleTag()), atom(line, e.name()));
    }

    // ---------- control ----------

    @Override
    public Erl.Expr visitListComprehension(ListComprehension e) {
        List<Erl.Generate> generators = new ArrayList<>(e.generators().size());
        for (Generator g : e.generators()) generators.add(lowerGenerator(g));
        return new Erl.Lc(e.line(), lower(e.result(), e.line()), generators);
    }

    @Override
    public Erl.Expr visitCase(CaseExpr e) {
        List<Erl.Clause> clauses = new ArrayList<>();
        for (Clause c : e.clauses()) clauses.addAll(lowerClause(c));
        return new Erl.Case(e.line(), lower(e.subject(), e.line()), clauses);
    }

    @Override
    public Erl.Expr visitTry(TryExpr e) {
        List<Erl.Clause> catches = new ArrayList<>(e.catches().size());
        for (Catch c : e.catches()) catches.add(lowerCatch(c));
        return new Erl.Try(e.line(), lowerAll(e.body()), List.of(), catches, List.of());
    }

    @Override
    public Erl.Expr visitMatch(MatchExpr e) {
        return new Erl.Match(e.line(), lower(e.left(), e.line()), lower(e.right(), e.line()));
    }

    // ---------- operators ----------

    @Override
    public Erl.Expr visitUnary(UnaryExpr e) {
        String op = switch (e.op()) {
            case "!" -> "not";
            case "~" -> "bnot";
            default -> e.op();
        };
        return new Erl.Op(e.line(), op, lower(e.expr(), e.line()));
    }

    @Override
    public Erl.Expr visitBinary(BinaryExpr e) {
        int line = e.line();
        return switch (e.op()) {
            case "==" -> new Erl.Call(line, remoteOf(line, rt.compare()), List.of(lower(e.left(), line), lower(e.right(), line)));
            case "**" -> new Erl.Call(line, remoteOf(line, rt.pow()), List.of(lower(e.left(), line), lower(e.right(), line)));
            case "===" -> strictMatch(line, e.left(), e.right());
            case "[]" -> dispatch(line, e.left(), "[]", List.of(e.right()), new NilLit(line));
            default -> new Erl.BinOp(line,
                    RENAMED_BINARY_OPS.getOrDefault(e.op(), e.op()),
                    lower(e.left(), line),
                    lower(e.right(), line));
        };
    }

    // try L = R, true catch error:{badmatch, _} -> false end
    private Erl.Expr strictMatch(int line, Expr left, Expr right) {
        List<Erl.Expr> body = List.of(
                new Erl.Match(line, lower(left, line), lower(right, line)),
                atom(line, "true"));
        Erl.Expr badmatch = tuple(line,
                atom(line, "error"),
                tuple(line, atom(line, "badmatch"), var(line, "_")),
                var(line, "_"));
        Erl.Clause onFailure = new Erl.Clause(line, List.of(badmatch), List.of(), List.of(atom(line, "false")));
        return new Erl.Try(line, body, List.of(), List.of(onFailure), List.of());
    }

    // ---------- calls ----------

    @Override
    public Erl.Expr visitLocalCall(LocalCall e) {
        int line = e.line();
        return new Erl.Call(line, atom(line, e.name()), List.of(
                new Erl.Tuple(line, lowerAll(e.args())),
                lowerBlockArg(e.block(), line)));
    }

    @Override
    public Erl.Expr visitRemoteCall(RemoteCall e) {
        return dispatch(e.line(), e.receiver(), e.method(), e.args(), e.block());
    }

    // единственный вызов в обход диспетчеризации и соглашения (кортеж, блок)
    @Override
    public Erl.Expr visitNativeCall(NativeCall e) {
        int line = e.line();
        return new Erl.Call(line, remote(line, e.module(), e.function()), lowerAll(e.args()));
    }

    // блок не передаётся: пока поддерживается только прямое применение лямбды
    @Override
    public Erl.Expr visitVarCall(VarCall e) {
        return new Erl.Call(e.line(), lower(e.receiver(), e.line()), lowerAll(e.args()));
    }

    @Override
    public Erl.Expr visitBlock(Block e) { return new Erl.Block(e.line(), lowerAll(e.exprs())); }

    // ---------- helpers ----------

    private Erl.Expr dispatch(int line, Expr receiver, String method, List<Expr> args, Expr block) {
        return new Erl.Call(line, remoteOf(line, rt.dispatch()), List.of(
                lower(receiver, line),
                atom(line, method),
                new Erl.Tuple(line, lowerAll(args)),
                lowerBlockArg(block, line)));
    }

    private Erl.Expr lowerBlockArg(Expr block, int line) {
        return block == null ? atom(line, "nil") : lower(block);
    }

    private static Erl.Expr remoteOf(int line, RuntimeTargets.Remote target) {
        return remote(line, target.module(), target.function());
    }

    private static Erl.Expr charsBinary(int line, String chars) {
        Erl.BinElement element = new Erl.BinElement(line, new Erl.Str(line, chars), null, List.of());
        return new Erl.Bin(line, List.of(element));
    }

    // без рекурсии: литерал может содержать сотни тысяч элементов
    private Erl.Expr consChain(Cons first) {
        List<Cons> cells = new ArrayList<>();
        List<Erl.Expr> heads = new ArrayList<>();
        Expr rest = first;
        while (rest instanceof Cons c) {
            cells.add(c);
            heads.add(lower(c.head(), c.line()));
            rest = c.tail();
        }
        Erl.Expr chain = rest instanceof Empty empty
                ? new Erl.Nil(empty.line())
                : lower(rest, cells.get(cells.size() - 1).line()); // хвост образца [h | t]
        for (int i = cells.size() - 1; i >= 0; i--) {
            chain = new Erl.Cons(cells.get(i).line(), heads.get(i), chain);
        }
        return chain;
    }

    private Erl.Expr boxList(int line, Erl.Expr chain) {
        if (encoding == LiteralEncoding.LEGACY) {
            return tuple(line, atom(line, rt.listTag()), tuple(line, chain, atom(line, rt.listFlag())));
        }
        return chain;
    }

    // пары словаря - кортежи {K, V}, поэтому общий перевод списков здесь не подходит
    private Erl.Expr dictPairs(List<DictEntry> entries, int line) {
        List<Erl.Expr> pairs = new ArrayList<>(entries.size());
        for (DictEntry entry : entries) {
            pairs.add(tuple(line, lower(entry.key(), line), lower(entry.value(), line)));
        }
        Erl.Expr list = new Erl.Nil(line);
        for (int i = pairs.size() - 1; i >= 0; i--) {
            list = new Erl.Cons(line, pairs.get(i), list);
        }
        return list;
    }

    private static String describe(Expr e) {
        return e == null ? "null" : e.getClass().getSimpleName();
    }
}
