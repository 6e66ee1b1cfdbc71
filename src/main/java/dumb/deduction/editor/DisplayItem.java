package dumb.deduction.editor;

/** A text token of a rendered tree, or the cursor marker. */
public record DisplayItem(String text, boolean cursor) {

    public static final String CURSOR_MARK = "|";

    public static DisplayItem text(String text) {
        return new DisplayItem(text, false);
    }

    public static DisplayItem cursorMark() {
        return new DisplayItem(CURSOR_MARK, true);
    }
}
