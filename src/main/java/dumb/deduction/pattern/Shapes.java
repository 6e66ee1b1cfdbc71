package dumb.deduction.pattern;

import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of display shapes by node kind. Each session owns its own instance.
 */
public class Shapes {

    public static final String HOLE = "□";
    public static final String VALUE_SLOT = "{value}";
    public static final String NAME_SLOT = "{name}";

    private final Map<String, Shape> byKind = new ConcurrentHashMap<>();

    public static Shapes standard() {
        var s = new Shapes();
        s.register(Kinds.METAVAR, Shape.of(HOLE));
        s.register(Kinds.NUMBER, Shape.of(VALUE_SLOT));
        s.register(Kinds.POINT, Shape.of("."));
        s.register(Kinds.CONSTANT, Shape.of(NAME_SLOT));
        s.register(Kinds.LOCAL_CONSTANT, Shape.of(NAME_SLOT));
        s.register(Kinds.BOUND_VAR, Shape.of(NAME_SLOT));
        s.register(Kinds.COMPOSITE_NUMBER, Shape.of(0, "", 1));
        s.register(Kinds.GENERIC_NODE, Shape.of(0, " ", 1));
        s.register(Kinds.GENERIC_PARENTHESES, Shape.of("(", 0, ")"));
        s.register(Kinds.APPLICATION, Shape.of(0, "(", 1, ")"));

        s.infix(Kinds.SUM, " + ");
        s.infix(Kinds.DIFFERENCE, " - ");
        s.infix(Kinds.MULT, " × ");
        s.infix(Kinds.DIV, "/");
        s.infix(Kinds.PROP_EQUAL, " = ");
        s.infix(Kinds.PROP_LESS, " < ");
        s.infix(Kinds.PROP_GREATER, " > ");
        s.infix(Kinds.PROP_LESS_OR_EQUAL, " ≤ ");
        s.infix(Kinds.PROP_GREATER_OR_EQUAL, " ≥ ");
        s.infix(Kinds.PROP_AND, " and ");
        s.infix(Kinds.PROP_OR, " or ");
        s.infix(Kinds.PROP_IMPLIES, " ⇒ ");
        s.infix(Kinds.PROP_IFF, " ⇔ ");
        s.infix(Kinds.PROP_BELONGS, " ∈ ");
        s.infix(Kinds.PROP_INCLUDED, " ⊂ ");
        s.infix(Kinds.SET_INTER, " ∩ ");
        s.infix(Kinds.SET_UNION, " ∪ ");
        s.register(Kinds.PROP_NOT, Shape.of("not ", 0));
        s.register(Kinds.QUANT_FORALL, new Shape(Shape.of("∀", 1, " ∈ ", 0, ", ", 2).tokens(), 0));
        s.register(Kinds.QUANT_EXISTS, new Shape(Shape.of("∃", 1, " ∈ ", 0, ", ", 2).tokens(), 0));
        return s;
    }

    public void register(String kind, Shape shape) {
        byKind.put(kind, shape);
    }

    public void infix(String kind, String symbol) {
        register(kind, Shape.of(0, symbol, 1));
    }

    /** The registered shape, or a functional layout {@code KIND(c0, c1, ...)} for unknown kinds. */
    public Shape shape(String kind, int arity) {
        var s = byKind.get(kind);
        if (s != null) return s;
        var items = new ArrayList<Object>();
        items.add(kind + "(");
        for (int i = 0; i < arity; i++) {
            if (i > 0) items.add(", ");
            items.add(i);
        }
        items.add(")");
        return new Shape(Shape.of(items.toArray()).tokens(), 0);
    }

    /** Shape of the effective node at {@code h}. */
    public Shape shape(PatternTree tree, int h) {
        return shape(tree.kind(h), tree.children(h).size());
    }
}
