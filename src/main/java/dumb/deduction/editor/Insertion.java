package dumb.deduction.editor;

import dumb.deduction.pattern.Kinds;
import dumb.deduction.pattern.MarkedTree;
import dumb.deduction.pattern.Matcher;
import dumb.deduction.pattern.Matcher.Bindings;
import dumb.deduction.pattern.PatternTree;
import dumb.deduction.pattern.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

import static dumb.deduction.pattern.PatternTree.NONE;

/**
 * Inserts an expression fragment into a marked tree, just right of the cursor in display order.
 * <p>
 * Every attempt runs on a fresh copy of the target, so the target itself is never modified and
 * a failed insertion leaves nothing behind. Anchors are tried in order: the marked node, then the
 * node right of the cursor, each one climbing through its metavariable ancestors.
 */
public class Insertion {

    private static final Logger logger = LoggerFactory.getLogger(Insertion.class);

    private final boolean checkTypes;
    private final boolean genericGrouping;

    public Insertion(boolean checkTypes, boolean genericGrouping) {
        this.checkTypes = checkTypes;
        this.genericGrouping = genericGrouping;
    }

    /** Assignments of a single attempt, applied to the tree only when the attempt succeeds. */
    private static final class Staged {
        Bindings bindings = Bindings.EMPTY;
        final List<int[]> forced = new ArrayList<>();

        void force(int metavar, int value) {
            forced.add(new int[]{metavar, value});
        }

        void commit(PatternTree tree) {
            bindings.commit(tree);
            forced.forEach(a -> tree.assign(a[0], a[1]));
        }
    }

    public Optional<MarkedTree> tryInsert(MarkedTree target, PatternTree fragment) {
        if (target.tree().cursor() == null) {
            logger.warn("Insertion into an unmarked tree");
            return Optional.empty();
        }
        var numeric = Kinds.NUMERIC.contains(fragment.kind(fragment.root()));
        if (numeric) {
            var merged = target.copy();
            if (insertNumber(merged, fragment)) {
                logger.debug("Merged {} into {}", fragment, merged);
                return Optional.of(merged);
            }
        }

        for (var anchor : anchors(target)) {
            var source = target.tree();
            if (source.isMetavar(anchor) && source.kind(anchor).equals(Kinds.GENERIC_NODE)) {
                var trial = target.copy();
                var n = trial.tree().importTree(fragment);
                if (substituteGenericNode(trial, anchor, n)) {
                    logger.debug("Substituted generic node {} by {}", anchor, fragment);
                    return Optional.of(trial);
                }
            }
            for (var mvar = anchor; mvar != NONE; mvar = source.parentOf(mvar)) {
                if (!source.isMetavar(mvar)) continue;
                var trial = target.copy();
                var n = trial.tree().importTree(fragment);
                if (insertIfYouCan(trial, n, mvar, source.parentOf(mvar))) {
                    logger.debug("Inserted {} at {}", fragment, mvar);
                    return Optional.of(trial);
                }
            }
        }

        if (genericGrouping && !numeric) {
            var trial = target.copy();
            var n = trial.tree().importTree(fragment);
            if (genericInsert(trial, n)) {
                logger.debug("Grouped {} with marked node", fragment);
                return Optional.of(trial);
            }
        }
        logger.debug("Could not insert {} into {}", fragment, target);
        return Optional.empty();
    }

    private static List<Integer> anchors(MarkedTree t) {
        var out = new LinkedHashSet<Integer>();
        out.add(t.marked());
        t.nextAfterMarked().ifPresent(out::add);
        return List.copyOf(out);
    }

    boolean priorityTests(MarkedTree t, int n, int mvar, int parent) {
        var tree = t.tree();
        var newKind = tree.kind(n);
        if (parent != NONE) {
            var p = t.partitionedChildren(parent);
            var ok = true;
            if (p.left().contains(mvar)) ok = Priority.canBeLeftChild(tree.kind(parent), newKind);
            else if (p.right().contains(mvar)) ok = Priority.canBeRightChild(tree.kind(parent), newKind);
            if (!ok) {
                logger.debug("{} cannot replace {} under {}", newKind, mvar, tree.kind(parent));
                return false;
            }
        }
        var ok = t.appearsLeftOfCursor(mvar)
                ? Priority.canBeLeftChild(newKind, tree.kind(mvar))
                : Priority.canBeRightChild(newKind, tree.kind(mvar));
        if (!ok) logger.debug("{} cannot become a child of {}", tree.kind(mvar), newKind);
        return ok;
    }

    private boolean insertIfYouCan(MarkedTree t, int n, int mvar, int parent) {
        var tree = t.tree();
        if (!priorityTests(t, n, mvar, parent)) return false;

        var staged = new Staged();
        if (tree.isAssigned(mvar) && !reAssign(t, mvar, n, staged)) return false;

        tree.clearAssignment(mvar);
        var b = Matcher.match(tree, mvar, n, staged.bindings);
        if (b != null) {
            staged.bindings = b;
        } else if (checkTypes) {
            return false;
        } else {
            logger.debug("Type check failed for {}, assigning anyway", mvar);
            staged.force(mvar, n);
        }
        staged.commit(tree);
        t.moveAfterInsert(mvar);
        return true;
    }

    /** Assigns {@code value} to the first metavariable of {@code mvars} that accepts it. */
    private boolean assign(PatternTree tree, List<Integer> mvars, int value, Staged staged) {
        for (var m : mvars) {
            var b = Matcher.match(tree, m, value, staged.bindings);
            if (b != null) {
                staged.bindings = b;
                return true;
            }
            if (!checkTypes) {
                staged.force(m, value);
                return true;
            }
        }
        return false;
    }

    /**
     * Moves the current value of {@code mvar} under the new node {@code n}, on the side of the
     * cursor it is displayed on, then moves the descendants now on the wrong side of {@code n}
     * to metavariables of the opposite side.
     */
    private boolean reAssign(MarkedTree t, int mvar, int n, Staged staged) {
        var tree = t.tree();
        var left = t.appearsLeftOfCursor(mvar);
        var right = t.appearsRightOfCursor(mvar);
        var slots = t.partitionedMetavars(n, true);
        var value = tree.assignedValue(mvar);

        var leftInsertion = left && assign(tree, slots.left(), value, staged);
        var rightInsertion = !leftInsertion && right && assign(tree, slots.right(), value, staged);
        if (!leftInsertion && !rightInsertion)
            return assign(tree, slots.central(), value, staged);

        var badChildren = leftInsertion ? firstRightDescendants(t, mvar) : firstLeftDescendants(t, mvar);
        var mvars = new ArrayList<>(leftInsertion ? slots.right() : slots.left());
        for (var child : badChildren) {
            var mathChild = tree.assignedValue(child);
            if (mathChild == NONE) continue;
            var placed = false;
            while (!mvars.isEmpty() && !placed) {
                var slot = mvars.remove(0);
                var b = Matcher.match(tree, slot, mathChild, staged.bindings);
                if (b != null) {
                    staged.bindings = b;
                    placed = true;
                } else if (!checkTypes) {
                    staged.force(slot, mathChild);
                    placed = true;
                }
            }
            if (!placed) {
                logger.debug("No room for displaced node {}", child);
                return false;
            }
            tree.clearAssignment(child);
        }
        return true;
    }

    /** Topmost descendants of {@code h} displayed right of the cursor. */
    List<Integer> firstRightDescendants(MarkedTree t, int h) {
        var tree = t.tree();
        if (tree.assignedValue(h) == NONE) return List.of();
        var children = tree.children(h);
        var leftChildren = children.stream().filter(c -> !t.appearsRightOfCursor(c)).toList();
        var rightChildren = children.stream().filter(c -> !t.appearsLeftOfCursor(c)).toList();
        var out = new ArrayList<Integer>();
        if (!leftChildren.isEmpty())
            out.addAll(firstRightDescendants(t, leftChildren.get(leftChildren.size() - 1)));
        out.addAll(rightChildren);
        return out;
    }

    /** Topmost descendants of {@code h} displayed left of the cursor. */
    List<Integer> firstLeftDescendants(MarkedTree t, int h) {
        var tree = t.tree();
        if (tree.assignedValue(h) == NONE) return List.of();
        var children = tree.children(h);
        var leftChildren = children.stream().filter(c -> !t.appearsRightOfCursor(c)).toList();
        var rightChildren = children.stream().filter(c -> !t.appearsLeftOfCursor(c)).toList();
        var out = new ArrayList<>(leftChildren);
        if (!rightChildren.isEmpty())
            out.addAll(firstLeftDescendants(t, rightChildren.get(0)));
        return out;
    }

    /** Replaces the generic node held by {@code mvar}, handing its two operands to {@code n}. */
    private boolean substituteGenericNode(MarkedTree t, int mvar, int n) {
        var tree = t.tree();
        var children = tree.children(mvar);
        if (children.size() != 2) return false;
        var mo1 = operand(tree, children.get(0));
        var mo2 = operand(tree, children.get(1));
        var slots = t.partitionedMetavars(n, true);
        var central = new ArrayList<>(slots.central());
        var staged = new Staged();
        if (mo1 != NONE) {
            if (!slots.left().isEmpty()) staged.force(slots.left().get(0), mo1);
            else if (!central.isEmpty()) staged.force(central.remove(0), mo1);
            else return false;
        }
        if (mo2 != NONE) {
            if (!slots.right().isEmpty()) staged.force(slots.right().get(0), mo2);
            else if (!central.isEmpty()) staged.force(central.remove(0), mo2);
            else return false;
        }
        staged.commit(tree);
        tree.clearAssignment(mvar);
        tree.assign(mvar, n);
        t.moveAfterInsert(mvar);
        return true;
    }

    private static int operand(PatternTree tree, int child) {
        return tree.isMetavar(child) ? tree.assignedValue(child) : child;
    }

    /** Merges a digit or decimal point into the number left or right of the cursor. */
    boolean insertNumber(MarkedTree t, PatternTree fragment) {
        var root = fragment.root();
        var digits = fragment.kind(root).equals(Kinds.POINT) ? "." : fragment.value(root);
        if (digits == null) return false;
        var tree = t.tree();
        var marked = t.marked();
        if (!t.isAtBeginning() && tree.kind(marked).equals(Kinds.NUMBER)) {
            var merged = mergeNumbers(tree.value(marked), digits);
            if (merged.isEmpty()) return false;
            tree.setInfo(marked, Kinds.VALUE, merged.get());
            t.setCursorAt(marked);
            return true;
        }
        var next = t.nextAfterMarked();
        if (next.isPresent() && tree.kind(next.get()).equals(Kinds.NUMBER)) {
            var merged = mergeNumbers(digits, tree.value(next.get()));
            if (merged.isEmpty()) return false;
            tree.setInfo(next.get(), Kinds.VALUE, merged.get());
            t.setCursorAt(next.get());
            return true;
        }
        return false;
    }

    static Optional<String> mergeNumbers(String left, String right) {
        var nb = left + right;
        return nb.chars().filter(c -> c == '.').count() < 2 ? Optional.of(nb) : Optional.empty();
    }

    /** Puts the marked value and {@code n} side by side under a {@link Kinds#GENERIC_NODE}. */
    private boolean genericInsert(MarkedTree t, int n) {
        var tree = t.tree();
        var m = t.marked();
        if (!tree.isMetavar(m)) return false;
        var left = tree.assignedValue(m);
        var a = tree.addMetavar(NONE);
        var b = tree.addMetavar(NONE);
        var g = tree.add(Kinds.GENERIC_NODE, a, b);
        tree.clearAssignment(m);
        if (left != NONE) {
            tree.assign(a, left);
            tree.assign(b, n);
            tree.assign(m, g);
            t.moveAfterInsert(b);
        } else {
            tree.assign(a, n);
            tree.assign(m, g);
            t.moveAfterInsert(a);
        }
        return true;
    }
}
