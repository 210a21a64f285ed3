package reia.ast.expr;

import java.util.List;

/**
 * Сегмент бинарного литерала: значение, размер (null = default)
 * и список спецификаторов типа (пустой = default).
 */
public record BinSegment(int line, Expr value, Expr size, List<String> typeSpecs) {
    public BinSegment {
        typeSpecs = List.copyOf(typeSpecs);
    }

    public BinSegment(int line, Expr value) {
        this(line, value, null, List.of());
    }
}
