package dumb.deduction;

import dumb.deduction.editor.Editor.Direction;
import dumb.deduction.proof.Exercise;
import dumb.deduction.proof.ProofStep;

import java.util.Locale;
import java.util.Optional;

/** Input to the {@link Coordinator} dispatch loop. */
public sealed interface UserAction {

    /** A fragment in pattern syntax, inserted at the cursor. */
    record InsertFragment(String pattern) implements UserAction {
    }

    record MoveCursor(Direction direction) implements UserAction {
    }

    record ClearMarked() implements UserAction {
    }

    record InsertParentheses() implements UserAction {
    }

    record SubmitCode(String label, ProofStep step) implements UserAction {
    }

    record StatementTriggered(Exercise exercise) implements UserAction {
    }

    record CancelPending() implements UserAction {
    }

    record Undo() implements UserAction {
    }

    record Redo() implements UserAction {
    }

    /** Takes the last proof step back, as opposed to {@link Undo} which acts on the expression. */
    record HistoryUndo() implements UserAction {
    }

    record HistoryRedo() implements UserAction {
    }

    record WindowClosed() implements UserAction {
    }

    /**
     * Reads a console command: {@code insert <pattern>}, {@code left}, {@code right}, {@code up},
     * {@code home}, {@code end}, {@code next}, {@code prev}, {@code delete}, {@code parens},
     * {@code submit <label> <code>}, {@code cancel}, {@code undo}, {@code redo}, {@code back},
     * {@code forward}, {@code quit}.
     */
    static Optional<UserAction> parse(String line) {
        var trimmed = line.strip();
        var space = trimmed.indexOf(' ');
        var cmd = (space < 0 ? trimmed : trimmed.substring(0, space)).toLowerCase(Locale.ROOT);
        var arg = space < 0 ? "" : trimmed.substring(space + 1).strip();
        UserAction action = switch (cmd) {
            case "insert", "i" -> arg.isEmpty() ? null : new InsertFragment(arg);
            case "left" -> new MoveCursor(Direction.LEFT);
            case "right" -> new MoveCursor(Direction.RIGHT);
            case "up" -> new MoveCursor(Direction.UP);
            case "home" -> new MoveCursor(Direction.BEGINNING);
            case "end" -> new MoveCursor(Direction.END);
            case "next" -> new MoveCursor(Direction.NEXT_HOLE);
            case "prev" -> new MoveCursor(Direction.PREVIOUS_HOLE);
            case "delete", "del" -> new ClearMarked();
            case "parens" -> new InsertParentheses();
            case "submit" -> {
                var sep = arg.indexOf(' ');
                yield sep < 0 ? null : new SubmitCode(arg.substring(0, sep), ProofStep.of(arg.substring(sep + 1)));
            }
            case "cancel" -> new CancelPending();
            case "undo" -> new Undo();
            case "redo" -> new Redo();
            case "back" -> new HistoryUndo();
            case "forward" -> new HistoryRedo();
            case "quit", "exit" -> new WindowClosed();
            default -> null;
        };
        return Optional.ofNullable(action);
    }
}
