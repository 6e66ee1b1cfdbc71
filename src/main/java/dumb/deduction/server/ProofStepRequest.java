package dumb.deduction.server;

import dumb.deduction.proof.ProofStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Appends one proof step to the exercise file. When the step carries or-else alternatives,
 * the request also waits for the {@code EFFECTIVE CODE node code} lines telling which
 * alternative succeeded.
 */
public class ProofStepRequest extends HighLevelRequest {

    private static final Logger logger = LoggerFactory.getLogger(ProofStepRequest.class);

    private final ProofStep proofStep;
    private final String label;
    private final VirtualFile file;
    private final Map<Integer, Integer> effectiveCode = new HashMap<>();

    public ProofStepRequest(ProofStep proofStep, String label, VirtualFile file) {
        this.proofStep = proofStep;
        this.label = label;
        this.file = file;
    }

    @Override
    public String requestType() {
        return "ProofStep";
    }

    @Override
    protected void prepare() {
        file.insert(label, proofStep.normalizedCode());
    }

    @Override
    public String fileContents() {
        file.setAfterword(analysisCode() + "end\n");
        return file.contents();
    }

    @Override
    public synchronized void processEffectiveCode(String text) {
        for (var line : text.split("\n")) {
            if (!line.startsWith(EFFECTIVE_CODE_PREFIX)) continue;
            var parts = line.substring(EFFECTIVE_CODE_PREFIX.length()).trim().split("\\s+");
            try {
                effectiveCode.put(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
            } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
                logger.warn("Malformed effective code line '{}'", line);
            }
        }
    }

    public synchronized boolean effectiveCodeReceived() {
        return proofStep.orElseCount() > 0 && effectiveCode.size() >= proofStep.orElseCount();
    }

    @Override
    public synchronized boolean isComplete() {
        if (failed || noGoals) return true;
        return super.isComplete() && effectiveCode.size() >= proofStep.orElseCount();
    }

    @Override
    public synchronized void reset() {
        super.reset();
        effectiveCode.clear();
    }

    @Override
    protected ProofStep proofStep() {
        return proofStep;
    }

    @Override
    protected synchronized Map<Integer, Integer> effectiveCode() {
        return Map.copyOf(effectiveCode);
    }
}
