package reia.lower;

import reia.ast.decl.UnitDecl;
import reia.ast.expr.Expr;
import reia.erl.Erl;
import reia.io.AbstractFormatWriter;

import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Stream;

public final class ReiaCompiler {
    private static final Logger LOGGER = Logger.getLogger(ReiaCompiler.class.getName());

    private final LoweringOptions options;
    private final Lowerer lowerer;

    public ReiaCompiler() {
        this(LoweringOptions.defaults());
    }

    public ReiaCompiler(LoweringOptions options) {
        this.options = options;
        this.lowerer = new Lowerer(options);
    }

    // порядок результата совпадает с порядком входа, и при parallel тоже
    public List<Erl.Module> compile(List<? extends UnitDecl> units) {
        Stream<? extends UnitDecl> stream = options.parallel() ? units.parallelStream() : units.stream();
        List<Erl.Module> modules = stream.map(this::compileUnit).toList();
        LOGGER.fine(() -> String.format("lowered %d unit(s)", modules.size()));
        return modules;
    }

    public Erl.Module compileUnit(UnitDecl unit) {
        Erl.Module module = lowerer.lowerUnit(unit);
        LOGGER.fine(() -> String.format("%s: %d source function(s) -> %d function(s)",
                unit.name(), unit.functions().size(), module.functions().size()));
        LOGGER.finer(() -> AbstractFormatWriter.write(module));
        return module;
    }

    // верхний уровень без модуля: просто список выражений
    public List<Erl.Expr> compileExpressions(List<? extends Expr> exprs) {
        List<Erl.Expr> lowered = lowerer.lowerAll(exprs);
        LOGGER.fine(() -> String.format("lowered %d expression(s)", lowered.size()));
        return lowered;
    }
}
