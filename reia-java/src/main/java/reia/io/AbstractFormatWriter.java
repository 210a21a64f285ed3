package reia.io;

import reia.erl.Erl;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Печать выходного дерева в синтаксисе термов абстрактного формата Erlang:
 * {@code {call,1,{remote,1,{atom,1,math},{atom,1,pow}},[...]}}.
 */
public final class AbstractFormatWriter {
    private static final Pattern BARE_ATOM = Pattern.compile("[a-z][a-zA-Z0-9_@]*");

    private static final Set<String> RESERVED = Set.of(
            "after", "and", "andalso", "band", "begin", "bnot", "bor", "bsl", "bsr", "bxor",
            "case", "catch", "cond", "div", "end", "fun", "if", "let", "not", "of", "or",
            "orelse", "receive", "rem", "try", "when", "xor"
    );

    private AbstractFormatWriter() {}

    // ---- public API ----

    /** Модуль печатается как список форм: атрибут module, затем функции. */
    public static String write(Erl.Module module) {
        StringBuilder sb = new StringBuilder("[{attribute,").append(module.line()).append(",module,");
        atom(sb, module.name());
        sb.append('}');
        for (Erl.Function f : module.functions()) {
            sb.append(',');
            function(sb, f);
        }
        return sb.append(']').toString();
    }

    public static String write(Erl.Function function) {
        StringBuilder sb = new StringBuilder();
        function(sb, function);
        return sb.toString();
    }

    public static String write(Erl.Expr expr) {
        StringBuilder sb = new StringBuilder();
        expr(sb, expr);
        return sb.toString();
    }

    // ---- internals ----

    private static void function(StringBuilder sb, Erl.Function f) {
        sb.append("{function,").append(f.line()).append(',');
        atom(sb, f.name());
        sb.append(',').append(f.arity()).append(',');
        clauses(sb, f.clauses());
        sb.append('}');
    }

    private static void clauses(StringBuilder sb, List<Erl.Clause> clauses) {
        sb.append('[');
        for (int i = 0; i < clauses.size(); i++) {
            if (i > 0) sb.append(',');
            Erl.Clause c = clauses.get(i);
            sb.append("{clause,").append(c.line()).append(',');
            exprs(sb, c.patterns());
            sb.append(',');
            exprs(sb, c.guards());
            sb.append(',');
            exprs(sb, c.body());
            sb.append('}');
        }
        sb.append(']');
    }

    private static void exprs(StringBuilder sb, List<Erl.Expr> exprs) {
        sb.append('[');
        for (int i = 0; i < exprs.size(); i++) {
            if (i > 0) sb.append(',');
            expr(sb, exprs.get(i));
        }
        sb.append(']');
    }

    private static void expr(StringBuilder sb, Erl.Expr e) {
        if (e instanceof Erl.Atom a) {
            open(sb, "atom", a.line());
            atom(sb, a.name());
        } else if (e instanceof Erl.Int i) {
            open(sb, "integer", i.line()).append(i.value());
        } else if (e instanceof Erl.Float f) {
            open(sb, "float", f.line()).append(Double.toString(f.value()).replace('E', 'e'));
        } else if (e instanceof Erl.Var v) {
            open(sb, "var", v.line());
            atom(sb, v.name());
        } else if (e instanceof Erl.Str s) {
            open(sb, "string", s.line());
            string(sb, s.value());
        } else if (e instanceof Erl.Tuple t) {
            open(sb, "tuple", t.line());
            exprs(sb, t.elements());
        } else if (e instanceof Erl.Cons c) {
            cons(sb, c);
            return;
        } else if (e instanceof Erl.Nil n) {
            sb.append("{nil,").append(n.line());
        } else if (e instanceof Erl.Bin b) {
            open(sb, "bin", b.line());
            binElements(sb, b.elements());
        } else if (e instanceof Erl.Match m) {
            open(sb, "match", m.line());
            expr(sb, m.pattern());
            sb.append(',');
            expr(sb, m.value());
        } else if (e instanceof Erl.Op op) {
            open(sb, "op", op.line());
            atom(sb, op.op());
            sb.append(',');
            expr(sb, op.operand());
        } else if (e instanceof Erl.BinOp op) {
            open(sb, "op", op.line());
            atom(sb, op.op());
            sb.append(',');
            expr(sb, op.left());
            sb.append(',');
            expr(sb, op.right());
        } else if (e instanceof Erl.Call c) {
            open(sb, "call", c.line());
            expr(sb, c.callee());
            sb.append(',');
            exprs(sb, c.args());
        } else if (e instanceof Erl.Remote r) {
            open(sb, "remote", r.line());
            expr(sb, r.module());
            sb.append(',');
            expr(sb, r.function());
        } else if (e instanceof Erl.Fun f) {
            open(sb, "'fun'", f.line()).append("{clauses,");
            clauses(sb, f.clauses());
            sb.append('}');
        } else if (e instanceof Erl.Case c) {
            open(sb, "'case'", c.line());
            expr(sb, c.subject());
            sb.append(',');
            clauses(sb, c.clauses());
        } else if (e instanceof Erl.Try t) {
            open(sb, "'try'", t.line());
            exprs(sb, t.body());
            sb.append(',');
            clauses(sb, t.ofClauses());
            sb.append(',');
            clauses(sb, t.catchClauses());
            sb.append(',');
            exprs(sb, t.after());
        } else if (e instanceof Erl.Lc lc) {
            open(sb, "lc", lc.line());
            expr(sb, lc.result());
            sb.append(",[");
            for (int i = 0; i < lc.generators().size(); i++) {
                if (i > 0) sb.append(',');
                Erl.Generate g = lc.generators().get(i);
                sb.append("{generate,").append(g.line()).append(',');
                expr(sb, g.pattern());
                sb.append(',');
                expr(sb, g.source());
                sb.append('}');
            }
            sb.append(']');
        } else if (e instanceof Erl.Block b) {
            open(sb, "block", b.line());
            exprs(sb, b.body());
        } else {
            throw new IllegalArgumentException("Unknown form: " + e);
        }
        sb.append('}');
    }

    // длинные списки печатаются без рекурсии по хвосту
    private static void cons(StringBuilder sb, Erl.Cons first) {
        int depth = 0;
        Erl.Expr rest = first;
        while (rest instanceof Erl.Cons c) {
            open(sb, "cons", c.line());
            expr(sb, c.head());
            sb.append(',');
            depth++;
            rest = c.tail();
        }
        expr(sb, rest);
        sb.append("}".repeat(depth));
    }

    private static StringBuilder open(StringBuilder sb, String tag, int line) {
        return sb.append('{').append(tag).append(',').append(line).append(',');
    }

    private static void binElements(StringBuilder sb, List<Erl.BinElement> elements) {
        sb.append('[');
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) sb.append(',');
            Erl.BinElement el = elements.get(i);
            sb.append("{bin_element,").append(el.line()).append(',');
            expr(sb, el.value());
            sb.append(',');
            if (el.size() == null) sb.append("default");
            else expr(sb, el.size());
            sb.append(',');
            if (el.typeSpecs().isEmpty()) {
                sb.append("default");
            } else {
                sb.append('[');
                for (int j = 0; j < el.typeSpecs().size(); j++) {
                    if (j > 0) sb.append(',');
                    atom(sb, el.typeSpecs().get(j));
                }
                sb.append(']');
            }
            sb.append('}');
        }
        sb.append(']');
    }

    private static void atom(StringBuilder sb, String name) {
        if (BARE_ATOM.matcher(name).matches() && !RESERVED.contains(name)) {
            sb.append(name);
            return;
        }
        sb.append('\'');
        escape(sb, name, '\'');
        sb.append('\'');
    }

    private static void string(StringBuilder sb, String s) {
        sb.append('"');
        escape(sb, s, '"');
        sb.append('"');
    }

    private static void escape(StringBuilder sb, String s, char quote) {
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (ch == quote || ch == '\\') sb.append('\\').append(ch);
            else if (ch == '\n') sb.append("\\n");
            else if (ch == '\t') sb.append("\\t");
            else if (ch == '\r') sb.append("\\r");
            else sb.append(ch);
        }
    }
}
