package dumb.deduction.server;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import dumb.deduction.backend.ProverMessage;
import dumb.deduction.proof.ProofStep;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProverResponse(
        @Nullable ProofStep proofStep,
        List<String> hypoAnalyses,
        @Nullable String targetsAnalysis,
        ErrorType errorType,
        List<ProverMessage> errors,
        Map<Integer, Integer> effectiveCode
) {

    public enum ErrorType {
        NONE(0), PROOF_ERROR(1), TIMEOUT(3);

        public final int code;

        ErrorType(int code) {
            this.code = code;
        }

        @JsonValue
        public int code() {
            return code;
        }
    }

    public ProverResponse {
        hypoAnalyses = List.copyOf(hypoAnalyses);
        errors = List.copyOf(errors);
        effectiveCode = Map.copyOf(effectiveCode);
    }

    public static ProverResponse timeout(@Nullable ProofStep proofStep) {
        return new ProverResponse(proofStep, List.of(), null, ErrorType.TIMEOUT, List.of(), Map.of());
    }

    public boolean isError() {
        return errorType != ErrorType.NONE;
    }
}
