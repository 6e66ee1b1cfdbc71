package dumb.deduction.pattern;

import dumb.deduction.pattern.PatternParser.ParseException;
import dumb.deduction.pattern.PatternTree.Cursor;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MarkedTreeTest {

    private final Shapes shapes = Shapes.standard();

    private MarkedTree marked(String text) throws ParseException {
        return new MarkedTree(PatternParser.parseMarked(text, shapes), shapes);
    }

    @Test
    void totalListFollowsDisplayOrder() throws ParseException {
        var m = marked("(SUM 1 (MULT 2 3))");
        var t = m.tree();
        var root = t.root();
        var one = t.children(root).get(0);
        var mult = t.children(root).get(1);
        var two = t.children(mult).get(0);
        var three = t.children(mult).get(1);
        assertEquals(List.of(new Cursor(one, 0), new Cursor(root, 1), new Cursor(two, 0),
                new Cursor(mult, 1), new Cursor(three, 0)), m.totalList());
        assertEquals(List.of(one, root, mult), m.orderedChildren(root));
    }

    @Test
    void partitionOfInfixNode() throws ParseException {
        var m = marked("(SUM 1 2)");
        var t = m.tree();
        var c = t.children(t.root());
        var p = m.partitionedChildren(t.root());
        assertEquals(List.of(c.get(0)), p.left());
        assertEquals(List.of(), p.central());
        assertEquals(List.of(c.get(1)), p.right());
    }

    @Test
    void partitionOfQuantifier() throws ParseException {
        var m = marked("(QUANT_∀ R (BOUND_VAR x) (PROP_EQUAL 1 1))");
        var t = m.tree();
        var c = t.children(t.root());
        var p = m.partitionedChildren(t.root());
        assertEquals(List.of(), p.left());
        assertEquals(List.of(c.get(1), c.get(0)), p.central());
        assertEquals(List.of(c.get(2)), p.right());
    }

    @Test
    void partitionOfNodeWithoutOwnBlocks() throws ParseException {
        var m = marked("(COMPOSITE_NUMBER 1 2)");
        var t = m.tree();
        var p = m.partitionedChildren(t.root());
        assertEquals(List.of(t.children(t.root()).get(0)), p.left());
        assertEquals(List.of(t.children(t.root()).get(1)), p.right());
    }

    @Test
    void cursorWalksLeftAndRight() throws ParseException {
        var m = marked("(SUM 1 2)");
        var list = m.totalList();
        m.goToBeginning();
        assertTrue(m.isAtBeginning());
        assertEquals(-1, m.currentIndex());
        m.increaseCursorPos();
        assertEquals(list.get(0), m.tree().cursor());
        m.goToEnd();
        assertTrue(m.isAtEnd());
        m.increaseCursorPos();
        assertTrue(m.isAtEnd());
        m.decreaseCursorPos();
        assertEquals(list.get(1), m.tree().cursor());
        m.decreaseCursorPos();
        m.decreaseCursorPos();
        assertTrue(m.isAtBeginning());
    }

    @Test
    void findsHolesAroundCursor() throws ParseException {
        var m = marked("(SUM ?a (MULT 2 ?b))");
        var t = m.tree();
        var a = t.children(t.root()).get(0);
        var b = t.children(t.children(t.root()).get(1)).get(1);
        assertEquals(new Cursor(a, 0), t.cursor());
        assertEquals(Optional.of(b), m.nextUnassigned());
        assertEquals(Optional.of(b), m.moveRightToNextUnassigned());
        assertEquals(new Cursor(b, 0), t.cursor());
        assertEquals(Optional.empty(), m.nextUnassigned());
        assertEquals(Optional.of(a), m.moveLeftToPreviousUnassigned());
        assertEquals(Optional.empty(), m.previousUnassigned());
    }

    @Test
    void sidesOfCursor() throws ParseException {
        var m = marked("(SUM 1 2)");
        var t = m.tree();
        var c = t.children(t.root());
        m.setCursorAt(t.root());
        assertTrue(m.appearsLeftOfCursor(c.get(0)));
        assertFalse(m.appearsRightOfCursor(c.get(0)));
        assertTrue(m.appearsLeftOfCursor(t.root()));
        assertTrue(m.appearsRightOfCursor(c.get(1)));
        assertFalse(m.appearsLeftOfCursor(c.get(1)));
        assertEquals(Optional.of(c.get(1)), m.nextAfterMarked());
    }

    @Test
    void moveUpGoesToParentMainSymbol() throws ParseException {
        var m = marked("(SUM 1 (MULT 2 ?b))");
        var t = m.tree();
        var mult = t.children(t.root()).get(1);
        assertEquals(Optional.of(mult), m.moveUp());
        assertEquals(new Cursor(mult, 1), t.cursor());
        assertEquals(Optional.of(t.root()), m.moveUp());
        assertEquals(Optional.empty(), m.moveUp());
    }

    @Test
    void moveAfterInsertPrefersHoleChildrenThenSiblings() throws ParseException {
        var m = marked("(SUM ?a (MULT ?b ?c))");
        var t = m.tree();
        var mult = t.children(t.root()).get(1);
        var b = t.children(mult).get(0);
        var c = t.children(mult).get(1);
        assertEquals(b, m.moveAfterInsert(mult));

        t.assign(b, t.addLeaf(Kinds.NUMBER, Kinds.VALUE, "2"));
        assertEquals(c, m.moveAfterInsert(b));
        assertEquals(new Cursor(c, 0), t.cursor());
    }

    @Test
    void metavarsPartitionedBySide() throws ParseException {
        var m = marked("(PROP_EQUAL (SUM ?a ?b) ?c)");
        var t = m.tree();
        var p = m.partitionedMetavars(t.root(), true);
        var sum = t.children(t.root()).get(0);
        assertEquals(t.children(sum), p.left());
        assertEquals(List.of(t.children(t.root()).get(1)), p.right());
    }

    @Test
    void copyIsIndependent() throws ParseException {
        var m = marked("(SUM ?a ?b)");
        var copy = m.copy();
        copy.goToEnd();
        assertNotEquals(m.tree().cursor(), copy.tree().cursor());
        assertEquals(m.tree().size(), copy.tree().size());
    }
}
