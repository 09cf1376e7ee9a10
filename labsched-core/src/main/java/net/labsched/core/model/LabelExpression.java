package net.labsched.core.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Conjunction of label names written as {@code a+b+c}: a host matches when it carries every label.
 * Blank parts are dropped and duplicates collapse, keeping first-seen order.
 */
public record LabelExpression(List<String> labels) {
    private static final LabelExpression EMPTY = new LabelExpression(List.of());

    public LabelExpression {
        labels = List.copyOf(labels);
    }

    public static LabelExpression parse(String expr) {
        if (expr == null || expr.isBlank()) return EMPTY;
        var names = new LinkedHashSet<String>();
        for (String part : expr.split("\\+")) {
            String name = part.trim();
            if (!name.isEmpty()) names.add(name);
        }
        return names.isEmpty() ? EMPTY : new LabelExpression(new ArrayList<>(names));
    }

    public boolean isEmpty() { return labels.isEmpty(); }

    @Override public String toString() { return String.join("+", labels); }
}
