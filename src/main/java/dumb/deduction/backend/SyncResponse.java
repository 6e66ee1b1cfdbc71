package dumb.deduction.backend;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SyncResponse(
        @JsonProperty("seq_num") int seqNum,
        @JsonProperty("response") String response,
        @JsonProperty("message") String message
) {

    public static final String FILE_INVALIDATED = "file invalidated";
    public static final String FILE_UNCHANGED = "file_unchanged";

    /** Whether the prover accepted the file and will report its messages. */
    public boolean accepted() {
        return "ok".equals(response) && (FILE_INVALIDATED.equals(message) || FILE_UNCHANGED.equals(message));
    }
}
