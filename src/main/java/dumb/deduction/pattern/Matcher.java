package dumb.deduction.pattern;

import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

import static dumb.deduction.pattern.PatternTree.NONE;

/**
 * Structural matching of a pattern node against a target node of the same tree.
 * <p>
 * Matching never touches the tree: new metavariable assignments are collected in
 * {@link Bindings}, which the caller commits with {@link Bindings#commit} once a whole
 * insertion has succeeded.
 */
public enum Matcher {
    ;

    /** Staged assignments, plus the pairing of bound variables met so far. */
    public record Bindings(Map<Integer, Integer> assignments, Map<Integer, Integer> boundVars) {

        public static final Bindings EMPTY = new Bindings(Map.of(), Map.of());

        public Bindings {
            assignments = Map.copyOf(assignments);
            boundVars = Map.copyOf(boundVars);
        }

        Bindings withAssignment(int metavar, int value) {
            var m = new HashMap<>(assignments);
            m.put(metavar, value);
            return new Bindings(m, boundVars);
        }

        Bindings withBoundVar(int pattern, int target) {
            var m = new HashMap<>(boundVars);
            m.put(pattern, target);
            return new Bindings(assignments, m);
        }

        public void commit(PatternTree tree) {
            assignments.forEach(tree::assign);
        }
    }

    /**
     * Tries to make {@code pattern} equal to {@code target} by assigning unassigned
     * metavariables of the pattern. Metavariable types are checked permissively: an absent
     * type on either side matches anything.
     *
     * @return the extended bindings, or null when the nodes cannot match
     */
    public static @Nullable Bindings match(PatternTree tree, int pattern, int target, Bindings bindings) {
        var p = deref(tree, pattern, bindings);
        var t = deref(tree, target, bindings);
        if (p == t) return bindings;

        if (tree.isUnassignedMetavar(p)) {
            if (occurs(tree, p, t, bindings)) return null;
            var typed = matchTypes(tree, p, t, bindings);
            return typed == null ? null : typed.withAssignment(p, t);
        }
        if (tree.isUnassignedMetavar(t)) return null;

        var pk = tree.kind(p);
        if (!pk.equals(tree.kind(t))) return null;

        var current = bindings;
        if (pk.equals(Kinds.BOUND_VAR)) {
            var paired = current.boundVars().get(p);
            if (paired != null) return paired == t ? current : null;
            if (current.boundVars().containsValue(t)) return null;
            current = current.withBoundVar(p, t);
        } else if (!tree.info(p).equals(tree.info(t))) {
            return null;
        }

        var pc = tree.children(p);
        var tc = tree.children(t);
        if (pc.size() != tc.size()) return null;
        for (int i = 0; i < pc.size() && current != null; i++)
            current = match(tree, pc.get(i), tc.get(i), current);
        return current == null ? null : matchTypes(tree, p, t, current);
    }

    private static @Nullable Bindings matchTypes(PatternTree tree, int p, int t, Bindings bindings) {
        var pt = tree.mathType(p);
        var tt = tree.mathType(t);
        if (pt == NONE || tt == NONE) return bindings;
        return match(tree, pt, tt, bindings);
    }

    private static int deref(PatternTree tree, int h, Bindings bindings) {
        h = tree.resolve(h);
        Integer staged;
        while (tree.isUnassignedMetavar(h) && (staged = bindings.assignments().get(h)) != null)
            h = tree.resolve(staged);
        return h;
    }

    private static boolean occurs(PatternTree tree, int metavar, int h, Bindings bindings) {
        var r = deref(tree, h, bindings);
        if (r == metavar) return true;
        for (var c : tree.children(r))
            if (occurs(tree, metavar, c, bindings)) return true;
        return false;
    }
}
