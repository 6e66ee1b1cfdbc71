package dumb.deduction.pattern;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Display layout of one node kind: literal tokens interleaved with child references.
 * The main symbol is the token the cursor lands on when the node itself is marked.
 */
public record Shape(List<Token> tokens, int mainSymbol) {

    public record Token(@Nullable String text, int child) {

        public static Token literal(String text) {
            return new Token(text, -1);
        }

        public static Token child(int index) {
            return new Token(null, index);
        }

        public boolean isChild() {
            return child >= 0;
        }
    }

    public Shape {
        tokens = List.copyOf(tokens);
        if (mainSymbol < 0 || mainSymbol >= tokens.size())
            throw new IllegalArgumentException("Main symbol " + mainSymbol + " outside shape " + tokens);
    }

    /** Strings become literal tokens and integers child references. */
    public static Shape of(Object... items) {
        var tokens = new ArrayList<Token>(items.length);
        for (var item : items) {
            if (item instanceof Integer i) tokens.add(Token.child(i));
            else if (item instanceof String s) tokens.add(Token.literal(s));
            else throw new IllegalArgumentException("Unexpected shape item " + item);
        }
        return new Shape(tokens, defaultMainSymbol(tokens));
    }

    /** First literal following a child, else the first literal, else the last token. */
    static int defaultMainSymbol(List<Token> tokens) {
        int firstLiteral = -1;
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).isChild()) continue;
            if (i > 0 && tokens.get(i - 1).isChild()) return i;
            if (firstLiteral < 0) firstLiteral = i;
        }
        return firstLiteral >= 0 ? firstLiteral : tokens.size() - 1;
    }
}
