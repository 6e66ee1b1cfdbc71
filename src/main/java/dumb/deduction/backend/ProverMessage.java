package dumb.deduction.backend;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** A diagnostic emitted by the prover for one position of a synced file. */
public record ProverMessage(
        @JsonProperty("seq_num") int seqNum,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("pos_line") int posLine,
        @JsonProperty("pos_col") int posCol,
        @JsonProperty("text") String text
) {

    public enum Severity {
        ERROR, WARNING, INFORMATION;

        @JsonCreator
        public static Severity of(String s) {
            return s == null ? INFORMATION : valueOf(s.toUpperCase(Locale.ROOT));
        }

        @JsonValue
        public String json() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public ProverMessage {
        if (severity == null) severity = Severity.INFORMATION;
        if (text == null) text = "";
    }
}
