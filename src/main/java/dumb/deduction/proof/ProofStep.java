package dumb.deduction.proof;

/**
 * Tactic code sent for one step of a proof. {@code orElseCount} is the number of
 * alternatives the prover must resolve into an effective code.
 */
public record ProofStep(String code, int orElseCount) {

    public ProofStep {
        if (orElseCount < 0) throw new IllegalArgumentException("Negative orElseCount");
    }

    public static ProofStep of(String code) {
        return new ProofStep(code, 0);
    }

    /** The code as a tactic block line, terminated by a comma and newline. */
    public String normalizedCode() {
        var c = code.strip();
        if (c.endsWith(",")) c = c.substring(0, c.length() - 1);
        return c + ",\n";
    }
}
