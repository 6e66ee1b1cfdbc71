package dumb.deduction.server;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The file sent to the prover: a fixed preamble, the history of labelled proof steps,
 * and an afterword holding the analysis code of the current request.
 */
public class VirtualFile {

    public record Entry(String label, String code) {
    }

    private final String preamble;
    private final List<Entry> history = new ArrayList<>();
    private final Deque<Entry> redo = new ArrayDeque<>();
    private String afterword = "";

    public VirtualFile(String preamble) {
        this.preamble = preamble;
    }

    public synchronized void insert(String label, String code) {
        history.add(new Entry(label, code));
        redo.clear();
    }

    public synchronized boolean undo() {
        if (history.isEmpty()) return false;
        redo.push(history.remove(history.size() - 1));
        return true;
    }

    /** Undoes the last entry only if it carries {@code label}. */
    public synchronized boolean undo(String label) {
        return label.equals(lastLabel()) && undo();
    }

    public synchronized boolean redo() {
        if (redo.isEmpty()) return false;
        history.add(redo.pop());
        return true;
    }

    /** Replaces the code of the last entry, keeping its label. */
    public synchronized boolean replaceLast(String code) {
        if (history.isEmpty()) return false;
        var last = history.remove(history.size() - 1);
        history.add(new Entry(last.label(), code));
        return true;
    }

    public synchronized @Nullable String lastLabel() {
        return history.isEmpty() ? null : history.get(history.size() - 1).label();
    }

    public synchronized List<Entry> history() {
        return List.copyOf(history);
    }

    public synchronized void setAfterword(String afterword) {
        this.afterword = afterword;
    }

    public synchronized String innerContents() {
        return history.stream().map(Entry::code).collect(Collectors.joining());
    }

    public synchronized String contents() {
        return preamble + innerContents() + afterword;
    }

    static int countLines(String text) {
        return (int) text.chars().filter(c -> c == '\n').count();
    }
}
