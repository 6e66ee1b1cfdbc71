package dumb.deduction.pattern;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntUnaryOperator;

/**
 * One slot of a {@link PatternTree} arena. Children, type and assignment are handles into the
 * same arena; {@link PatternTree#NONE} marks an absent type or assignment.
 */
public final class Node {

    final String kind;
    final Map<String, String> info;
    final List<Integer> children;
    int mathType;
    int assigned = PatternTree.NONE;

    Node(String kind, Map<String, String> info, List<Integer> children, int mathType) {
        this.kind = Objects.requireNonNull(kind);
        this.info = new LinkedHashMap<>(info);
        this.children = new ArrayList<>(children);
        this.mathType = mathType;
    }

    public String kind() {
        return kind;
    }

    public boolean isMetavar() {
        return Kinds.METAVAR.equals(kind);
    }

    Node copy() {
        var n = new Node(kind, info, children, mathType);
        n.assigned = assigned;
        return n;
    }

    Node remap(IntUnaryOperator handles) {
        var n = new Node(kind, info, children.stream().map(handles::applyAsInt).toList(), mapHandle(mathType, handles));
        n.assigned = mapHandle(assigned, handles);
        return n;
    }

    private static int mapHandle(int h, IntUnaryOperator handles) {
        return h == PatternTree.NONE ? PatternTree.NONE : handles.applyAsInt(h);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Node n)) return false;
        return mathType == n.mathType && assigned == n.assigned && kind.equals(n.kind)
                && info.equals(n.info) && children.equals(n.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, info, children, mathType, assigned);
    }

    @Override
    public String toString() {
        return kind + info + children;
    }
}
