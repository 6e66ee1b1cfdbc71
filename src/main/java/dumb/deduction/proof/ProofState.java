package dumb.deduction.proof;

import java.util.List;

/** Raw analyses of a proof state: one hypothesis block per goal, and the targets block. */
public record ProofState(List<String> hypotheses, String targets) {

    public static final String GOAL_SEPARATOR = "¿¿¿";

    public ProofState {
        hypotheses = List.copyOf(hypotheses);
    }

    public int goalCount() {
        return hypotheses.size();
    }
}
