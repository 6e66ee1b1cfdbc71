package dumb.deduction.pattern;

import java.util.List;
import java.util.Set;

import static dumb.deduction.pattern.Kinds.*;

/**
 * Binding strength between node kinds, from tightest to loosest class.
 * Kinds outside every class are incomparable with anything.
 */
public enum Priority {
    /** The first kind binds more tightly. */
    HIGHER,
    SAME,
    LOWER,
    INCOMPARABLE;

    static final List<Set<String>> CLASSES = List.of(
            Set.of(COMPOSITE_NUMBER),
            Set.of(POINT),
            Set.of(MULT, DIV),
            Set.of(SUM, DIFFERENCE),
            Set.of(PROP_EQUAL, PROP_LESS, PROP_GREATER, PROP_LESS_OR_EQUAL, PROP_GREATER_OR_EQUAL),
            Set.of(PROP_AND, PROP_OR),
            Set.of(PROP_IMPLIES, PROP_IFF)
    );

    public static Priority of(String a, String b) {
        for (var c : CLASSES) {
            var hasA = c.contains(a);
            var hasB = c.contains(b);
            if (hasA && hasB) return SAME;
            if (hasA) return isRanked(b) ? HIGHER : INCOMPARABLE;
            if (hasB) return isRanked(a) ? LOWER : INCOMPARABLE;
        }
        return INCOMPARABLE;
    }

    private static boolean isRanked(String kind) {
        return CLASSES.stream().anyMatch(c -> c.contains(kind));
    }

    /** Whether a node of kind {@code child} may sit as the left operand of {@code parent}. */
    public static boolean canBeLeftChild(String parent, String child) {
        return of(parent, child) != HIGHER;
    }

    /** Whether a node of kind {@code child} may sit as the right operand of {@code parent}. */
    public static boolean canBeRightChild(String parent, String child) {
        var p = of(parent, child);
        return p != HIGHER && p != SAME;
    }
}
