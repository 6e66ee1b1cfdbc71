package dumb.deduction;

import dumb.deduction.editor.Editor.Direction;
import dumb.deduction.proof.ProofStep;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class UserActionTest {

    @Test
    void parsesEditingCommands() {
        assertEquals(Optional.of(new UserAction.InsertFragment("(SUM ?a ?b)")), UserAction.parse("insert (SUM ?a ?b)"));
        assertEquals(Optional.of(new UserAction.InsertFragment("2")), UserAction.parse("  i 2 "));
        assertEquals(Optional.of(new UserAction.MoveCursor(Direction.NEXT_HOLE)), UserAction.parse("next"));
        assertEquals(Optional.of(new UserAction.MoveCursor(Direction.BEGINNING)), UserAction.parse("HOME"));
        assertEquals(Optional.of(new UserAction.ClearMarked()), UserAction.parse("del"));
        assertEquals(Optional.of(new UserAction.InsertParentheses()), UserAction.parse("parens"));
        assertEquals(Optional.of(new UserAction.Undo()), UserAction.parse("undo"));
        assertEquals(Optional.of(new UserAction.WindowClosed()), UserAction.parse("quit"));
        assertEquals(Optional.of(new UserAction.HistoryUndo()), UserAction.parse("back"));
        assertEquals(Optional.of(new UserAction.HistoryRedo()), UserAction.parse("forward"));
    }

    @Test
    void parsesSubmit() {
        assertEquals(Optional.of(new UserAction.SubmitCode("s1", ProofStep.of("intro h"))),
                UserAction.parse("submit s1 intro h"));
        assertTrue(UserAction.parse("submit s1").isEmpty());
    }

    @Test
    void rejectsUnknownOrIncomplete() {
        assertTrue(UserAction.parse("").isEmpty());
        assertTrue(UserAction.parse("insert").isEmpty());
        assertTrue(UserAction.parse("dance").isEmpty());
    }
}
