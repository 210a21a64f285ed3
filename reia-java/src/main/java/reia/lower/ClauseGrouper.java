package reia.lower;

import reia.erl.Erl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Склеивает определения с одинаковыми (имя, арность) в одну функцию с несколькими ветками.
 * Ветки идут в порядке объявления, строка берётся у первого определения,
 * группы - в порядке первого появления.
 */
public final class ClauseGrouper {
    private ClauseGrouper() {}

    private record Key(String name, int arity) {}

    private static final class Group {
        final int line;
        final List<Erl.Clause> clauses = new ArrayList<>();

        Group(int line) { this.line = line; }
    }

    public static List<Erl.Function> group(List<Erl.Function> functions) {
        Map<Key, Group> groups = new LinkedHashMap<>();
        for (Erl.Function f : functions) {
            Group g = groups.computeIfAbsent(new Key(f.name(), f.arity()), k -> new Group(f.line()));
            g.clauses.addAll(f.clauses());
        }

        List<Erl.Function> out = new ArrayList<>(groups.size());
        for (Map.Entry<Key, Group> e : groups.entrySet()) {
            Key k = e.getKey();
            out.add(new Erl.Function(e.getValue().line, k.name(), k.arity(), e.getValue().clauses));
        }
        return out;
    }
}
