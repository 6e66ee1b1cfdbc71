package dumb.deduction.editor;

import dumb.deduction.Configuration;
import dumb.deduction.editor.Editor.Direction;
import dumb.deduction.pattern.Kinds;
import dumb.deduction.pattern.PatternParser;
import dumb.deduction.pattern.PatternParser.ParseException;
import dumb.deduction.pattern.Shapes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static dumb.deduction.pattern.PatternTree.NONE;
import static org.junit.jupiter.api.Assertions.*;

class EditorTest {

    private Editor editor;

    @BeforeEach
    void setUp() {
        editor = new Editor(Shapes.standard(), new Configuration());
    }

    private void insert(String... fragments) throws ParseException {
        for (var f : fragments)
            assertTrue(editor.insert(PatternParser.parse(f)), () -> "could not insert " + f);
    }

    private String shown() {
        return Display.utf8(editor.current());
    }

    @Test
    void startsWithSingleHole() {
        assertEquals("□|", editor.toString());
        assertEquals(2, editor.display().size());
    }

    @Test
    void undoAndRedoEdits() throws ParseException {
        insert("(SUM ?a ?b)", "2");
        assertEquals("2 + □", shown());
        assertTrue(editor.undo());
        assertEquals("□ + □", shown());
        assertTrue(editor.undo());
        assertEquals("□", shown());
        assertFalse(editor.undo());
        assertTrue(editor.redo());
        assertTrue(editor.redo());
        assertEquals("2 + □", shown());
        assertFalse(editor.redo());
    }

    @Test
    void newEditDropsRedoHistory() throws ParseException {
        insert("(SUM ?a ?b)", "2");
        editor.undo();
        insert("x");
        assertEquals("x + □", shown());
        assertFalse(editor.redo());
    }

    @Test
    void clearMarkedEmptiesHole() throws ParseException {
        insert("(SUM ?a ?b)", "2", "3");
        assertTrue(editor.clearMarked());
        assertEquals("2 + |□", editor.toString());
        editor.move(Direction.NEXT_HOLE);
        assertFalse(editor.clearMarked());
        editor.undo();
        assertEquals("2 + 3", shown());
    }

    @Test
    void parenthesesAroundHoleOrValue() throws ParseException {
        assertTrue(editor.insertParentheses());
        assertEquals("(□|)", editor.toString());
        insert("2");
        assertEquals("(2)", shown());

        editor.reset();
        insert("7");
        assertTrue(editor.insertParentheses());
        assertEquals("(7)|", editor.toString());
        var t = editor.current().tree();
        assertEquals(Kinds.GENERIC_PARENTHESES, t.kind(t.root()));
    }

    @Test
    void cursorMovesAreNotEdits() throws ParseException {
        insert("(SUM ?a ?b)");
        editor.move(Direction.NEXT_HOLE);
        assertEquals("□ + □|", editor.toString());
        editor.move(Direction.PREVIOUS_HOLE);
        assertEquals("□| + □", editor.toString());
        editor.move(Direction.BEGINNING);
        assertEquals("|□ + □", editor.toString());
        editor.move(Direction.END);
        assertEquals("□ + □|", editor.toString());
        editor.move(Direction.UP);
        assertEquals("□ + |□", editor.toString());
        editor.move(Direction.RIGHT);
        assertEquals("□ + □|", editor.toString());

        assertTrue(editor.undo());
        assertEquals("□", shown());
    }

    @Test
    void applicationTakesFunctionDomainAsArgumentType() throws ParseException {
        var app = Editor.applicationOf(PatternParser.parse("(: f (FUNCTION R S))"));
        assertEquals(Kinds.APPLICATION, app.kind(app.root()));
        var arg = app.children(app.root()).get(1);
        assertTrue(app.isUnassignedMetavar(arg));
        var type = app.mathType(arg);
        assertNotEquals(NONE, type);
        assertEquals("R", app.info(type).get(Kinds.NAME));

        insert("(SUM ?a ?b)");
        assertTrue(editor.insert(app));
        assertEquals("f(□) + □", shown());
    }

    @Test
    void untypedFunctionGivesUntypedArgument() throws ParseException {
        var app = Editor.applicationOf(PatternParser.parse("g"));
        assertEquals(NONE, app.mathType(app.children(app.root()).get(1)));
    }
}
