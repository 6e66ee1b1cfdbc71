package dumb.deduction.pattern;

import java.util.Set;

/** Node kind names shared by the parser, the shape table and the priority table. */
public final class Kinds {

    public static final String METAVAR = "METAVAR";
    public static final String NUMBER = "NUMBER";
    public static final String POINT = "POINT";
    public static final String CONSTANT = "CONSTANT";
    public static final String LOCAL_CONSTANT = "LOCAL_CONSTANT";
    public static final String BOUND_VAR = "BOUND_VAR";
    public static final String APPLICATION = "APPLICATION";
    public static final String GENERIC_NODE = "GENERIC_NODE";
    public static final String GENERIC_PARENTHESES = "GENERIC_PARENTHESES";
    public static final String COMPOSITE_NUMBER = "COMPOSITE_NUMBER";

    public static final String SUM = "SUM";
    public static final String DIFFERENCE = "DIFFERENCE";
    public static final String MULT = "MULT";
    public static final String DIV = "DIV";
    public static final String PROP_EQUAL = "PROP_EQUAL";
    public static final String PROP_LESS = "PROP_<";
    public static final String PROP_GREATER = "PROP_>";
    public static final String PROP_LESS_OR_EQUAL = "PROP_≤";
    public static final String PROP_GREATER_OR_EQUAL = "PROP_≥";
    public static final String PROP_AND = "PROP_AND";
    public static final String PROP_OR = "PROP_OR";
    public static final String PROP_IMPLIES = "PROP_IMPLIES";
    public static final String PROP_IFF = "PROP_IFF";
    public static final String PROP_NOT = "PROP_NOT";
    public static final String PROP_BELONGS = "PROP_BELONGS";
    public static final String PROP_INCLUDED = "PROP_INCLUDED";
    public static final String SET_INTER = "SET_INTER";
    public static final String SET_UNION = "SET_UNION";
    public static final String QUANT_FORALL = "QUANT_∀";
    public static final String QUANT_EXISTS = "QUANT_∃";

    public static final String VALUE = "value";
    public static final String NAME = "name";

    /** Kinds whose insertion may be merged textually with an adjacent number. */
    public static final Set<String> NUMERIC = Set.of(NUMBER, POINT);

    private Kinds() {
    }
}
