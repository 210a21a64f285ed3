package reia.ast.expr;

import java.util.List;

/**
 * Ячейка списка. Цепочка всегда заканчивается явным {@link Empty}
 * (или произвольным хвостом в образце вида {@code [h | t]}).
 */
public record Cons(int line, Expr head, Expr tail) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> v) { return v.visitCons(this); }

    /** Разворачивает последовательность выражений в цепочку ячеек с {@code Empty} в конце. */
    public static Expr of(int line, List<Expr> elements) {
        Expr tail = new Empty(line);
        for (int i = elements.size() - 1; i >= 0; i--) {
            tail = new Cons(line, elements.get(i), tail);
        }
        return tail;
    }
}
