package dumb.deduction.pattern;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Arena of pattern nodes addressed by integer handles, with one root and at most one cursor.
 * <p>
 * Assigned metavariables are transparent: {@link #kind}, {@link #info} and {@link #children}
 * answer for the value they are bound to, while the metavariable handle itself keeps its place
 * in the parent. Copies keep every handle, so a handle taken on one tree addresses the same
 * node in any of its copies.
 */
public final class PatternTree {

    public static final int NONE = -1;

    private static final int MAX_RESOLVE_DEPTH = 64;

    private final List<Node> nodes;
    private int root = NONE;
    private @Nullable Cursor cursor;

    /** Cursor position: just after item {@code pos} of the display shape of {@code node}. */
    public record Cursor(int node, int pos) {
    }

    public PatternTree() {
        this.nodes = new ArrayList<>();
    }

    private PatternTree(List<Node> nodes, int root, @Nullable Cursor cursor) {
        this.nodes = nodes;
        this.root = root;
        this.cursor = cursor;
    }

    /** A tree made of a single unassigned metavariable, marked. */
    public static PatternTree ofMetavar() {
        var t = new PatternTree();
        t.setRoot(t.addMetavar(NONE));
        t.setCursor(new Cursor(t.root(), 0));
        return t;
    }

    public int add(String kind, Map<String, String> info, List<Integer> children, int mathType) {
        children.forEach(this::check);
        if (mathType != NONE) check(mathType);
        nodes.add(new Node(kind, info, children, mathType));
        return nodes.size() - 1;
    }

    public int add(String kind, Integer... children) {
        return add(kind, Map.of(), List.of(children), NONE);
    }

    public int addLeaf(String kind, String key, String value) {
        return add(kind, Map.of(key, value), List.of(), NONE);
    }

    public int addMetavar(int mathType) {
        return add(Kinds.METAVAR, Map.of(), List.of(), mathType);
    }

    public int root() {
        return root;
    }

    public void setRoot(int root) {
        this.root = check(root);
    }

    public int size() {
        return nodes.size();
    }

    Node node(int h) {
        return nodes.get(check(h));
    }

    private int check(int h) {
        if (h < 0 || h >= nodes.size())
            throw new IllegalArgumentException("No node " + h + " in tree of size " + nodes.size());
        return h;
    }

    public boolean isMetavar(int h) {
        return node(h).isMetavar();
    }

    public boolean isAssigned(int h) {
        return node(h).assigned != NONE;
    }

    public boolean isUnassignedMetavar(int h) {
        return isMetavar(h) && !isAssigned(h);
    }

    /** The direct value of a metavariable, or {@link #NONE}. */
    public int assignedValue(int h) {
        return node(h).assigned;
    }

    /** Follows metavariable assignments down to a concrete node or an unassigned metavariable. */
    public int resolve(int h) {
        int depth = 0;
        while (node(h).isMetavar() && node(h).assigned != NONE) {
            h = node(h).assigned;
            if (++depth > MAX_RESOLVE_DEPTH)
                throw new IllegalStateException("Assignment cycle through node " + h);
        }
        return h;
    }

    public String kind(int h) {
        return node(resolve(h)).kind;
    }

    public Map<String, String> info(int h) {
        return Map.copyOf(node(resolve(h)).info);
    }

    public @Nullable String value(int h) {
        return node(resolve(h)).info.get(Kinds.VALUE);
    }

    public List<Integer> children(int h) {
        return List.copyOf(node(resolve(h)).children);
    }

    /** The declared type of a node, falling back to the type of its value. */
    public int mathType(int h) {
        var own = node(h).mathType;
        return own != NONE ? own : node(resolve(h)).mathType;
    }

    public void assign(int metavar, int value) {
        if (!isMetavar(metavar))
            throw new IllegalArgumentException("Cannot assign non-metavariable node " + metavar);
        if (metavar == check(value) || contains(value, metavar))
            throw new IllegalArgumentException("Assigning " + metavar + " to " + value + " would create a cycle");
        node(metavar).assigned = value;
    }

    /** Drops the assignment of a metavariable, and that of its type when the type is itself a metavariable. */
    public void clearAssignment(int metavar) {
        var n = node(metavar);
        if (!n.isMetavar()) return;
        n.assigned = NONE;
        if (n.mathType != NONE && isMetavar(n.mathType))
            node(n.mathType).assigned = NONE;
    }

    public void setInfo(int h, String key, String value) {
        node(resolve(h)).info.put(key, value);
    }

    /** The node whose effective children include {@code h}, or {@link #NONE} for the root. */
    public int parentOf(int h) {
        return root == NONE ? NONE : parentOf(root, h);
    }

    private int parentOf(int from, int h) {
        for (var c : children(from)) {
            if (c == h) return from;
            var p = parentOf(c, h);
            if (p != NONE) return p;
        }
        return NONE;
    }

    /** Whether {@code h} is {@code ancestor} or one of its effective descendants. */
    public boolean contains(int ancestor, int h) {
        if (ancestor == h) return true;
        var n = node(ancestor);
        if (n.assigned != NONE && contains(n.assigned, h)) return true;
        for (var c : n.children)
            if (contains(c, h)) return true;
        return false;
    }

    /** Metavariables under {@code h}, {@code h} included, in depth-first child order. */
    public List<Integer> metavars(int h, boolean unassignedOnly) {
        var out = new ArrayList<Integer>();
        collectMetavars(h, unassignedOnly, out);
        return out;
    }

    private void collectMetavars(int h, boolean unassignedOnly, List<Integer> out) {
        if (isMetavar(h) && !(unassignedOnly && isAssigned(h)))
            out.add(h);
        for (var c : children(h))
            collectMetavars(c, unassignedOnly, out);
    }

    public @Nullable Cursor cursor() {
        return cursor;
    }

    public void setCursor(@Nullable Cursor cursor) {
        if (cursor != null) check(cursor.node());
        this.cursor = cursor;
    }

    public PatternTree copy() {
        return new PatternTree(new ArrayList<>(nodes.stream().map(Node::copy).toList()), root, cursor);
    }

    /**
     * Appends every node reachable from the root of {@code other} under fresh handles.
     * Nodes shared in {@code other}, such as a common type, stay shared.
     *
     * @return the handle of the imported root
     */
    public int importTree(PatternTree other) {
        return importNode(other, other.root());
    }

    public int importNode(PatternTree other, int h) {
        var mapping = new HashMap<Integer, Integer>();
        reserve(other, h, mapping);
        mapping.forEach((from, to) -> nodes.set(to, other.node(from).remap(mapping::get)));
        return mapping.get(h);
    }

    private void reserve(PatternTree other, int h, Map<Integer, Integer> mapping) {
        if (h == NONE || mapping.containsKey(h)) return;
        mapping.put(h, nodes.size());
        nodes.add(null);
        var n = other.node(h);
        reserve(other, n.mathType, mapping);
        reserve(other, n.assigned, mapping);
        n.children.forEach(c -> reserve(other, c, mapping));
    }

    /** A standalone tree holding a copy of the subtree at {@code h}, without cursor. */
    public PatternTree subtree(int h) {
        var t = new PatternTree();
        t.setRoot(t.importNode(this, h));
        return t;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PatternTree t)) return false;
        return root == t.root && nodes.equals(t.nodes) && Objects.equals(cursor, t.cursor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, root, cursor);
    }

    /** S-expression of the effective tree, in the syntax read by {@link PatternParser}. */
    public String toSexpr(int h) {
        var r = resolve(h);
        var n = node(r);
        if (n.isMetavar()) return "?" + r;
        return switch (n.kind) {
            case Kinds.NUMBER -> n.info.getOrDefault(Kinds.VALUE, "0");
            case Kinds.POINT -> ".";
            case Kinds.CONSTANT -> n.info.getOrDefault(Kinds.NAME, "_");
            default -> {
                var sb = new StringBuilder("(").append(n.kind);
                if (n.info.containsKey(Kinds.NAME)) sb.append(' ').append(n.info.get(Kinds.NAME));
                if (n.info.containsKey(Kinds.VALUE)) sb.append(' ').append(n.info.get(Kinds.VALUE));
                n.children.forEach(c -> sb.append(' ').append(toSexpr(c)));
                yield sb.append(')').toString();
            }
        };
    }

    @Override
    public String toString() {
        return root == NONE ? "()" : toSexpr(root);
    }
}
