package dumb.deduction.pattern;

import dumb.deduction.pattern.PatternTree.Cursor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static dumb.deduction.pattern.PatternTree.NONE;

/**
 * Cursor navigation over a {@link PatternTree}, in display order.
 * <p>
 * The total list enumerates the display blocks of the whole tree: one entry per literal
 * token of each node's shape, as (node, token index). The cursor sits just after one of
 * these entries, or before all of them at position {@code (root, -1)}. Nothing is cached;
 * every query recomputes from the current tree.
 */
public class MarkedTree {

    private final PatternTree tree;
    private final Shapes shapes;

    /** Left, central and right children of a node relative to its own literal tokens. */
    public record Partition(List<Integer> left, List<Integer> central, List<Integer> right) {
    }

    public MarkedTree(PatternTree tree, Shapes shapes) {
        this.tree = tree;
        this.shapes = shapes;
    }

    public PatternTree tree() {
        return tree;
    }

    public Shapes shapes() {
        return shapes;
    }

    public MarkedTree copy() {
        return new MarkedTree(tree.copy(), shapes);
    }

    /** Shape items of {@code h}: {@code h} itself for each literal token, the child for each child reference. */
    public List<Integer> orderedChildren(int h) {
        var children = tree.children(h);
        var out = new ArrayList<Integer>();
        for (var token : shapes.shape(tree, h).tokens()) {
            if (!token.isChild()) out.add(h);
            else if (token.child() < children.size()) out.add(children.get(token.child()));
        }
        return out;
    }

    public List<Cursor> totalList() {
        var out = new ArrayList<Cursor>();
        if (tree.root() != NONE) collect(tree.root(), out);
        return out;
    }

    private void collect(int h, List<Cursor> out) {
        var items = orderedChildren(h);
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) == h) out.add(new Cursor(h, i));
            else collect(items.get(i), out);
        }
    }

    /** Index of the cursor in {@link #totalList()}, -1 when before the first block or unmarked. */
    public int currentIndex() {
        var c = tree.cursor();
        return c == null ? -1 : totalList().indexOf(c);
    }

    public int marked() {
        var c = tree.cursor();
        return c == null ? NONE : c.node();
    }

    public void setCursorAt(int h, int pos) {
        tree.setCursor(new Cursor(h, pos));
    }

    /** Places the cursor after the main symbol of {@code h}. */
    public void setCursorAt(int h) {
        setCursorAt(h, shapes.shape(tree, h).mainSymbol());
    }

    public void goToBeginning() {
        setCursorAt(tree.root(), -1);
    }

    public void goToEnd() {
        var l = totalList();
        if (!l.isEmpty()) tree.setCursor(l.get(l.size() - 1));
    }

    public boolean isAtBeginning() {
        var c = tree.cursor();
        return c != null && c.pos() == -1;
    }

    public boolean isAtEnd() {
        var l = totalList();
        return !l.isEmpty() && l.get(l.size() - 1).equals(tree.cursor());
    }

    public void increaseCursorPos() {
        var l = totalList();
        var idx = currentIndex();
        if (idx < l.size() - 1) tree.setCursor(l.get(idx + 1));
    }

    public void decreaseCursorPos() {
        var idx = currentIndex();
        if (idx > 0) tree.setCursor(totalList().get(idx - 1));
        else goToBeginning();
    }

    /** The node displayed right of the cursor. */
    public Optional<Integer> nextAfterMarked() {
        var l = totalList();
        var idx = currentIndex();
        return idx < l.size() - 1 ? Optional.of(l.get(idx + 1).node()) : Optional.empty();
    }

    public Optional<Integer> parentOfMarked() {
        var m = marked();
        if (m == NONE || m == tree.root()) return Optional.empty();
        var p = tree.parentOf(m);
        return p == NONE ? Optional.empty() : Optional.of(p);
    }

    public Optional<Integer> moveUp() {
        var p = parentOfMarked();
        p.ifPresent(this::setCursorAt);
        return p;
    }

    public Optional<Integer> nextUnassigned() {
        var l = totalList();
        var idx = currentIndex();
        return l.subList(idx + 1, l.size()).stream()
                .map(Cursor::node)
                .filter(tree::isUnassignedMetavar)
                .findFirst();
    }

    public Optional<Integer> previousUnassigned() {
        var l = totalList();
        var idx = currentIndex();
        Optional<Integer> found = Optional.empty();
        for (var c : l.subList(0, Math.max(idx, 0)))
            if (tree.isUnassignedMetavar(c.node())) found = Optional.of(c.node());
        return found;
    }

    public Optional<Integer> moveRightToNextUnassigned() {
        var m = nextUnassigned();
        m.ifPresent(this::setCursorAt);
        return m;
    }

    public Optional<Integer> moveLeftToPreviousUnassigned() {
        var m = previousUnassigned();
        m.ifPresent(this::setCursorAt);
        return m;
    }

    /** Marks the first unassigned metavariable of the tree, if any. */
    public boolean markFirstUnassigned() {
        for (var c : totalList()) {
            if (tree.isUnassignedMetavar(c.node())) {
                setCursorAt(c.node(), 0);
                return true;
            }
        }
        return false;
    }

    /**
     * Moves the cursor after an insertion at {@code assigned}: to its first unassigned
     * metavariable child, else to the first unassigned sibling, else after its main symbol.
     */
    public int moveAfterInsert(int assigned) {
        for (var child : orderedChildren(assigned)) {
            if (tree.isUnassignedMetavar(child)) {
                setCursorAt(child, 0);
                return child;
            }
        }
        var parent = tree.parentOf(assigned);
        if (parent != NONE) {
            for (var child : orderedChildren(parent)) {
                if (tree.isUnassignedMetavar(child)) {
                    setCursorAt(child, 0);
                    return child;
                }
            }
        }
        setCursorAt(assigned);
        return assigned;
    }

    /** Whether some block of {@code h} is at or before the cursor. */
    public boolean appearsLeftOfCursor(int h) {
        var l = totalList();
        var idx = currentIndex();
        return l.subList(0, idx + 1).stream().anyMatch(c -> c.node() == h);
    }

    /** Whether some block of {@code h} is after the cursor. */
    public boolean appearsRightOfCursor(int h) {
        var l = totalList();
        var idx = currentIndex();
        return l.subList(idx + 1, l.size()).stream().anyMatch(c -> c.node() == h);
    }

    public Partition partitionedChildren(int h) {
        var left = new ArrayList<Integer>();
        var rest = new ArrayList<Integer>();
        var seenSelf = false;
        var lastSelf = -1;
        for (var item : orderedChildren(h)) {
            if (item == h) {
                if (seenSelf) lastSelf = rest.size();
                seenSelf = true;
            } else if (seenSelf) {
                rest.add(item);
            } else {
                left.add(item);
            }
        }
        if (!seenSelf) return new Partition(List.of(), left, List.of());
        if (lastSelf == -1) return new Partition(left, List.of(), rest);
        return new Partition(left, rest.subList(0, lastSelf), rest.subList(lastSelf, rest.size()));
    }

    /** {@link #partitionedChildren} with each child replaced by the metavariables of its subtree. */
    public Partition partitionedMetavars(int h, boolean unassignedOnly) {
        var p = partitionedChildren(h);
        return new Partition(metavarsOf(p.left(), unassignedOnly), metavarsOf(p.central(), unassignedOnly),
                metavarsOf(p.right(), unassignedOnly));
    }

    private List<Integer> metavarsOf(List<Integer> children, boolean unassignedOnly) {
        var out = new ArrayList<Integer>();
        children.forEach(c -> out.addAll(tree.metavars(c, unassignedOnly)));
        return out;
    }

    @Override
    public String toString() {
        return tree + " @ " + tree.cursor();
    }
}
