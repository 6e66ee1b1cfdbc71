package dumb.deduction.editor;

import dumb.deduction.pattern.Kinds;
import dumb.deduction.pattern.MarkedTree;
import dumb.deduction.pattern.PatternTree;
import dumb.deduction.pattern.Priority;
import dumb.deduction.pattern.Shapes;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static dumb.deduction.pattern.PatternTree.NONE;

/**
 * Renders a tree through its shapes. Parentheses are added around operands that bind more
 * loosely than their parent; they are display-only and take no cursor position.
 */
public final class Display {

    private Display() {
    }

    public static List<DisplayItem> render(MarkedTree t) {
        var out = new ArrayList<DisplayItem>();
        var tree = t.tree();
        if (tree.root() == NONE) return out;
        var cursor = tree.cursor();
        if (cursor != null && cursor.pos() == -1) out.add(DisplayItem.cursorMark());
        emit(t, tree.root(), out);
        return out;
    }

    public static String text(List<DisplayItem> items) {
        return items.stream().map(DisplayItem::text).collect(Collectors.joining());
    }

    /** Rendering with the cursor marker. */
    public static String marked(MarkedTree t) {
        return text(render(t));
    }

    /** Plain UTF-8 rendering without the cursor marker. */
    public static String utf8(MarkedTree t) {
        return text(render(t).stream().filter(i -> !i.cursor()).toList());
    }

    private static void emit(MarkedTree t, int h, List<DisplayItem> out) {
        var tree = t.tree();
        var shape = t.shapes().shape(tree, h);
        var children = tree.children(h);
        var partition = t.partitionedChildren(h);
        var tokens = shape.tokens();
        for (int i = 0; i < tokens.size(); i++) {
            var token = tokens.get(i);
            if (token.isChild()) {
                if (token.child() >= children.size()) continue;
                var child = children.get(token.child());
                var parens = needsParentheses(tree, h, child, partition.right().contains(child));
                if (parens) out.add(DisplayItem.text("("));
                emit(t, child, out);
                if (parens) out.add(DisplayItem.text(")"));
            } else {
                out.add(DisplayItem.text(literal(tree, h, token.text())));
                var c = tree.cursor();
                if (c != null && c.node() == h && c.pos() == i)
                    out.add(DisplayItem.cursorMark());
            }
        }
    }

    private static String literal(PatternTree tree, int h, String text) {
        return switch (text) {
            case Shapes.VALUE_SLOT -> String.valueOf(tree.info(h).getOrDefault(Kinds.VALUE, "?"));
            case Shapes.NAME_SLOT -> String.valueOf(tree.info(h).getOrDefault(Kinds.NAME, "?"));
            default -> text;
        };
    }

    private static boolean needsParentheses(PatternTree tree, int parent, int child, boolean rightOperand) {
        var p = Priority.of(tree.kind(parent), tree.kind(child));
        return p == Priority.HIGHER || (p == Priority.SAME && rightOperand);
    }
}
