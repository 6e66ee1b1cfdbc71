package dumb.deduction.editor;

import dumb.deduction.Configuration;
import dumb.deduction.pattern.Kinds;
import dumb.deduction.pattern.MarkedTree;
import dumb.deduction.pattern.PatternTree;
import dumb.deduction.pattern.Shapes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import static dumb.deduction.pattern.PatternTree.NONE;

/**
 * The expression being edited, with undo/redo over successful edits. Cursor moves are not
 * recorded in the history.
 */
public class Editor {

    private static final Logger logger = LoggerFactory.getLogger(Editor.class);

    private final Shapes shapes;
    private final Insertion insertion;
    private final Deque<MarkedTree> undo = new ArrayDeque<>();
    private final Deque<MarkedTree> redo = new ArrayDeque<>();
    private MarkedTree current;

    public enum Direction {LEFT, RIGHT, UP, BEGINNING, END, NEXT_HOLE, PREVIOUS_HOLE}

    public Editor(Shapes shapes, Configuration config) {
        this.shapes = shapes;
        this.insertion = new Insertion(config.checkTypes(), config.genericGrouping());
        this.current = new MarkedTree(PatternTree.ofMetavar(), shapes);
    }

    public MarkedTree current() {
        return current;
    }

    public boolean insert(PatternTree fragment) {
        var result = insertion.tryInsert(current, fragment);
        result.ifPresentOrElse(this::commit, () -> logger.info("Cannot insert {} here", fragment));
        return result.isPresent();
    }

    public void move(Direction direction) {
        switch (direction) {
            case LEFT -> current.decreaseCursorPos();
            case RIGHT -> current.increaseCursorPos();
            case UP -> current.moveUp();
            case BEGINNING -> current.goToBeginning();
            case END -> current.goToEnd();
            case NEXT_HOLE -> current.moveRightToNextUnassigned();
            case PREVIOUS_HOLE -> current.moveLeftToPreviousUnassigned();
        }
    }

    /** Unassigns the marked metavariable and steps the cursor left. */
    public boolean clearMarked() {
        var next = current.copy();
        var tree = next.tree();
        var m = next.marked();
        if (m == NONE || !tree.isMetavar(m) || !tree.isAssigned(m)) return false;
        tree.clearAssignment(m);
        next.setCursorAt(m, 0);
        next.decreaseCursorPos();
        commit(next);
        return true;
    }

    /** Wraps the marked value in parentheses. */
    public boolean insertParentheses() {
        var next = current.copy();
        var tree = next.tree();
        var m = next.marked();
        if (m == NONE || !tree.isMetavar(m)) return false;
        var value = tree.assignedValue(m);
        var inner = tree.addMetavar(NONE);
        var parens = tree.add(Kinds.GENERIC_PARENTHESES, inner);
        tree.clearAssignment(m);
        if (value != NONE) tree.assign(inner, value);
        tree.assign(m, parens);
        if (value != NONE) next.setCursorAt(m);
        else next.setCursorAt(inner, 0);
        commit(next);
        return true;
    }

    /**
     * {@code APPLICATION(f, ?x)} where {@code ?x} is typed by the domain of {@code function},
     * i.e. the first child of its type, when known.
     */
    public static PatternTree applicationOf(PatternTree function) {
        var t = new PatternTree();
        var f = t.importTree(function);
        var type = t.mathType(f);
        var domain = type != NONE && !t.children(type).isEmpty() ? t.children(type).get(0) : NONE;
        var arg = t.addMetavar(domain);
        t.setRoot(t.add(Kinds.APPLICATION, f, arg));
        return t;
    }

    public boolean undo() {
        if (undo.isEmpty()) return false;
        redo.push(current);
        current = undo.pop();
        return true;
    }

    public boolean redo() {
        if (redo.isEmpty()) return false;
        undo.push(current);
        current = redo.pop();
        return true;
    }

    public void reset() {
        undo.clear();
        redo.clear();
        current = new MarkedTree(PatternTree.ofMetavar(), shapes);
    }

    public List<DisplayItem> display() {
        return Display.render(current);
    }

    @Override
    public String toString() {
        return Display.marked(current);
    }

    private void commit(MarkedTree next) {
        undo.push(current);
        redo.clear();
        current = next;
    }
}
