package reia.erl;

import java.util.Arrays;
import java.util.List;

// подмножество абстрактного формата Erlang, которое принимает генератор кода
public final class Erl {
    private Erl() {}

    public sealed interface Expr permits Atom, Int, Float, Var, Str,
            Tuple, Cons, Nil, Bin, Match, Op, BinOp,
            Call, Remote, Fun, Case, Try, Lc, Block {
        int line();
    }

    // ---- терминалы ----
    public record Atom(int line, String name) implements Expr {}
    public record Int(int line, long value) implements Expr {}
    public record Float(int line, double value) implements Expr {}
    public record Var(int line, String name) implements Expr {}

    // строка символов, только как значение bin_element
    public record Str(int line, String value) implements Expr {}

    // ---- структуры ----
    public record Tuple(int line, List<Expr> elements) implements Expr {
        public Tuple {
            elements = List.copyOf(elements);
        }
    }

    public record Cons(int line, Expr head, Expr tail) implements Expr {}
    public record Nil(int line) implements Expr {}

    public record Bin(int line, List<BinElement> elements) implements Expr {
        public Bin {
            elements = List.copyOf(elements);
        }
    }

    /** size == null и пустой typeSpecs означают {@code default}. */
    public record BinElement(int line, Expr value, Expr size, List<String> typeSpecs) {
        public BinElement {
            typeSpecs = List.copyOf(typeSpecs);
        }
    }

    // ---- операции ----
    public record Match(int line, Expr pattern, Expr value) implements Expr {}
    public record Op(int line, String op, Expr operand) implements Expr {}
    public record BinOp(int line, String op, Expr left, Expr right) implements Expr {}

    // callee: Atom (локальная функция), Remote (module:function) или любое выражение
    public record Call(int line, Expr callee, List<Expr> args) implements Expr {
        public Call {
            args = List.copyOf(args);
        }
    }

    public record Remote(int line, Expr module, Expr function) implements Expr {}

    // ---- управление ----
    public record Fun(int line, List<Clause> clauses) implements Expr {
        public Fun {
            clauses = List.copyOf(clauses);
        }
    }

    public record Case(int line, Expr subject, List<Clause> clauses) implements Expr {
        public Case {
            clauses = List.copyOf(clauses);
        }
    }

    public record Try(
            int line,
            List<Expr> body,
            List<Clause> ofClauses,
            List<Clause> catchClauses,
            List<Expr> after
    ) implements Expr {
        public Try {
            body = List.copyOf(body);
            ofClauses = List.copyOf(ofClauses);
            catchClauses = List.copyOf(catchClauses);
            after = List.copyOf(after);
        }
    }

    public record Lc(int line, Expr result, List<Generate> generators) implements Expr {
        public Lc {
            generators = List.copyOf(generators);
        }
    }

    public record Generate(int line, Expr pattern, Expr source) {}

    public record Block(int line, List<Expr> body) implements Expr {
        public Block {
            body = List.copyOf(body);
        }
    }

    // ---- формы ----
    public record Clause(int line, List<Expr> patterns, List<Expr> guards, List<Expr> body) {
        public Clause {
            patterns = List.copyOf(patterns);
            guards = List.copyOf(guards);
            body = List.copyOf(body);
        }
    }

    public record Function(int line, String name, int arity, List<Clause> clauses) {
        public Function {
            clauses = List.copyOf(clauses);
        }
    }

    public record Module(int line, String name, List<Function> functions) {
        public Module {
            functions = List.copyOf(functions);
        }
    }

    // ---- конструкторы ----

    public static Atom atom(int line, String name) {
        return new Atom(line, name);
    }

    public static Var var(int line, String name) {
        return new Var(line, name);
    }

    public static Tuple tuple(int line, Expr... elements) {
        return new Tuple(line, Arrays.asList(elements));
    }

    public static Remote remote(int line, String module, String function) {
        return new Remote(line, atom(line, module), atom(line, function));
    }
}
