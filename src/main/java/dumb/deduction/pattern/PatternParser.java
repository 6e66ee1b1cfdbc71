package dumb.deduction.pattern;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads pattern trees from s-expressions, e.g. {@code (SUM ?a (: ?b ?T) 1)}.
 */
public class PatternParser {

    private static final int CONTEXT_BUFFER_SIZE = 50;
    private static final Pattern NUMBER_LITERAL = Pattern.compile("\\d+(\\.\\d*)?|\\.\\d+");
    private static final Set<String> LEAF_KINDS = Set.of(Kinds.NUMBER, Kinds.CONSTANT, Kinds.LOCAL_CONSTANT, Kinds.BOUND_VAR);

    private final Reader reader;
    private final StringBuilder contextBuffer = new StringBuilder(CONTEXT_BUFFER_SIZE);
    private final PatternTree tree = new PatternTree();
    private final Map<String, Integer> metavars = new HashMap<>();
    private final Set<String> structural = new HashSet<>();
    private int currentChar = -2;
    private int line = 1;
    private int col = 0;

    private PatternParser(Reader reader) {
        this.reader = reader;
    }

    /** Parses exactly one expression; the resulting tree has no cursor. */
    public static PatternTree parse(String text) throws ParseException {
        try (var reader = new StringReader(text)) {
            var parser = new PatternParser(reader);
            parser.skipWhitespace();
            var root = parser.parseExpr(false);
            parser.skipWhitespace();
            if (parser.peek() != -1)
                throw parser.createParseException("Trailing input after expression");
            parser.tree.setRoot(root);
            return parser.tree;
        } catch (IOException e) {
            throw new ParseException("IO Error: " + e.getMessage());
        }
    }

    /** Parses and marks the first unassigned metavariable, or the root's main symbol. */
    public static PatternTree parseMarked(String text, Shapes shapes) throws ParseException {
        var t = parse(text);
        var m = new MarkedTree(t, shapes);
        if (!m.markFirstUnassigned())
            m.setCursorAt(t.root());
        return t;
    }

    private int peek() throws IOException {
        if (currentChar == -2) {
            currentChar = reader.read();
            if (contextBuffer.length() >= CONTEXT_BUFFER_SIZE)
                contextBuffer.deleteCharAt(0);
            if (currentChar != -1)
                contextBuffer.append((char) currentChar);
        }
        return currentChar;
    }

    private int consumeChar() throws IOException {
        var c = peek();
        if (c != -1) {
            currentChar = -2;
            if (c == '\n') {
                line++;
                col = 0;
            } else {
                col++;
            }
        }
        return c;
    }

    private void consumeChar(char expected) throws IOException, ParseException {
        var actual = consumeChar();
        if (actual != expected)
            throw createParseException("Expected '" + expected + "'", actual == -1 ? "EOF" : "'" + (char) actual + "'");
    }

    private void skipWhitespace() throws IOException {
        while (peek() != -1 && Character.isWhitespace(peek()))
            consumeChar();
    }

    private int parseExpr(boolean inType) throws IOException, ParseException {
        skipWhitespace();
        var c = peek();
        if (c == -1) throw createParseException("Unexpected EOF while parsing expression");
        return switch (c) {
            case '(' -> parseList(inType);
            case '?' -> parseMetavar(inType);
            case ')' -> throw createParseException("Unexpected ')'");
            default -> atom(parseSymbol());
        };
    }

    private int parseList(boolean inType) throws IOException, ParseException {
        consumeChar('(');
        skipWhitespace();
        if (peek() == '(' || peek() == '?' || peek() == ')')
            throw createParseException("Expected node kind after '('");
        var kind = parseSymbol();
        int result;
        if (kind.equals(":")) {
            result = parseExpr(inType);
            var type = parseExpr(true);
            var n = tree.node(result);
            if (n.mathType != PatternTree.NONE)
                throw createParseException("Type given twice");
            n.mathType = type;
        } else if (LEAF_KINDS.contains(kind)) {
            skipWhitespace();
            var key = kind.equals(Kinds.NUMBER) ? Kinds.VALUE : Kinds.NAME;
            result = tree.addLeaf(kind, key, parseSymbol());
        } else {
            var children = new ArrayList<Integer>();
            skipWhitespace();
            while (peek() != ')') {
                if (peek() == -1) throw createParseException("Unexpected EOF inside node " + kind);
                children.add(parseExpr(inType));
                skipWhitespace();
            }
            result = tree.add(kind, Map.of(), children, PatternTree.NONE);
        }
        skipWhitespace();
        consumeChar(')');
        return result;
    }

    private int parseMetavar(boolean inType) throws IOException, ParseException {
        consumeChar('?');
        var name = parseSymbol();
        if (!inType && !structural.add(name))
            throw createParseException("Metavariable ?" + name + " used twice outside a type");
        var existing = metavars.get(name);
        if (existing != null) return existing;
        var h = tree.addMetavar(PatternTree.NONE);
        metavars.put(name, h);
        return h;
    }

    private int atom(String symbol) {
        if (symbol.equals(".")) return tree.add(Kinds.POINT, Map.of(), List.of(), PatternTree.NONE);
        if (NUMBER_LITERAL.matcher(symbol).matches()) return tree.addLeaf(Kinds.NUMBER, Kinds.VALUE, symbol);
        return tree.addLeaf(Kinds.CONSTANT, Kinds.NAME, symbol);
    }

    private String parseSymbol() throws IOException, ParseException {
        var sb = new StringBuilder();
        while (peek() != -1 && !Character.isWhitespace(peek()) && peek() != '(' && peek() != ')')
            sb.append((char) consumeChar());
        if (sb.isEmpty()) throw createParseException("Empty symbol");
        return sb.toString();
    }

    private ParseException createParseException(String message) {
        return new ParseException(message, line, col, contextBuffer.toString());
    }

    private ParseException createParseException(String message, @Nullable String foundToken) {
        var foundInfo = foundToken != null ? " found " + foundToken : "";
        return new ParseException(message + foundInfo, line, col, contextBuffer.toString());
    }

    public static class ParseException extends Exception {
        private final int line;
        private final int col;
        private final String context;

        public ParseException(String message) {
            this(message, -1, -1, "");
        }

        public ParseException(String message, int line, int col, String context) {
            super(message);
            this.line = line;
            this.col = col;
            this.context = context;
        }

        public int line() {
            return line;
        }

        public int col() {
            return col;
        }

        @Override
        public String getMessage() {
            var location = (line != -1 && col != -1) ? " at line " + line + ", col " + col : "";
            var ctx = context.isEmpty() ? "" : " near '" + context.replace("\n", "\\n") + "'";
            return super.getMessage() + location + ctx;
        }
    }
}
