package com.qualsim.core.space;

import com.qualsim.core.error.UnknownLevelException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A named, totally ordered, finite list of levels (lowest first).
 * <p>
 * Every set-valued result returned from this type is listed in space order,
 * so callers can compare results with {@link List#equals(Object)}.
 *
 * @param name   unique name of the space
 * @param levels ordered level names, lowest first
 */
public record QualitativeSpace(String name, List<String> levels) {

    public QualitativeSpace {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Space name must not be blank");
        }
        if (levels == null || levels.isEmpty()) {
            throw new IllegalArgumentException("Space '" + name + "' must declare at least one level");
        }
        if (new HashSet<>(levels).size() != levels.size()) {
            throw new IllegalArgumentException("Space '" + name + "' declares duplicate levels: " + levels);
        }
        levels = List.copyOf(levels);
    }

    public boolean contains(String level) {
        return levels.contains(level);
    }

    /**
     * Position of a level within the ordering.
     *
     * @throws UnknownLevelException if the level is not part of this space
     */
    public int indexOf(String level) {
        int idx = levels.indexOf(level);
        if (idx < 0) {
            throw new UnknownLevelException(name, level);
        }
        return idx;
    }

    /**
     * Returns every level {@code l} of this space for which {@code l op pivot} holds.
     *
     * @param op    comparison operator
     * @param pivot the right-hand side; exactly one level for ordering operators. {@code equals} and
     *              {@code not_equals} given several levels behave as {@code in} and {@code not_in}
     * @return the satisfying levels in space order (possibly empty)
     */
    public List<String> expand(Operator op, List<String> pivot) {
        if (pivot == null || pivot.isEmpty()) {
            throw new IllegalArgumentException("Operator " + op.id() + " needs a value in space '" + name + "'");
        }
        pivot.forEach(this::indexOf);
        if (pivot.size() > 1 && (op == Operator.EQUALS || op == Operator.NOT_EQUALS)) {
            op = op == Operator.EQUALS ? Operator.IN : Operator.NOT_IN;
        }
        if (!op.isSetOperator() && pivot.size() != 1) {
            throw new IllegalArgumentException("Operator " + op.id() + " takes a single level, got " + pivot);
        }
        int p = op.isSetOperator() ? -1 : indexOf(pivot.get(0));
        Set<String> pivotSet = new HashSet<>(pivot);

        List<String> result = new ArrayList<>();
        for (int i = 0; i < levels.size(); i++) {
            String level = levels.get(i);
            boolean matches = switch (op) {
                case EQUALS -> i == p;
                case NOT_EQUALS -> i != p;
                case LESS_THAN -> i < p;
                case LESS_THAN_OR_EQUAL -> i <= p;
                case GREATER_THAN -> i > p;
                case GREATER_THAN_OR_EQUAL -> i >= p;
                case IN -> pivotSet.contains(level);
                case NOT_IN -> !pivotSet.contains(level);
            };
            if (matches) {
                result.add(level);
            }
        }
        return List.copyOf(result);
    }

    /**
     * Moves one level in the given direction, clamping at the ends.
     */
    public String step(String value, Trend direction) {
        int idx = indexOf(value);
        return switch (direction) {
            case UP -> levels.get(Math.min(idx + 1, levels.size() - 1));
            case DOWN -> levels.get(Math.max(idx - 1, 0));
            case NONE -> value;
        };
    }

    /**
     * Levels an attribute may have reached given its current levels and trend.
     * A downward trend admits everything at or below the highest current level;
     * an upward trend everything at or above the lowest.
     */
    public List<String> valueSetFromTrend(Collection<String> current, Trend trend) {
        List<String> ordered = ordered(current);
        if (ordered.isEmpty() || trend == Trend.NONE) {
            return ordered;
        }
        int low = indexOf(ordered.get(0));
        int high = indexOf(ordered.get(ordered.size() - 1));
        return trend == Trend.DOWN
                ? List.copyOf(levels.subList(0, high + 1))
                : List.copyOf(levels.subList(low, levels.size()));
    }

    /**
     * Sorts the given levels into space order, dropping duplicates.
     */
    public List<String> ordered(Collection<String> values) {
        Set<String> wanted = new HashSet<>();
        for (String value : values) {
            indexOf(value);
            wanted.add(value);
        }
        List<String> result = new ArrayList<>(wanted.size());
        for (String level : levels) {
            if (wanted.contains(level)) {
                result.add(level);
            }
        }
        return List.copyOf(result);
    }

    public List<String> intersect(Collection<String> a, Collection<String> b) {
        Set<String> other = new HashSet<>(b);
        return ordered(a.stream().filter(other::contains).toList());
    }

    public List<String> subtract(Collection<String> a, Collection<String> b) {
        Set<String> other = new HashSet<>(b);
        return ordered(a.stream().filter(v -> !other.contains(v)).toList());
    }

    public List<String> union(Collection<String> a, Collection<String> b) {
        List<String> all = new ArrayList<>(a);
        all.addAll(b);
        return ordered(all);
    }
}
