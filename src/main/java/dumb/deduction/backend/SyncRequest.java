package dumb.deduction.backend;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"seq_num", "command", "file_name", "content"})
public record SyncRequest(
        @JsonProperty("seq_num") int seqNum,
        @JsonProperty("file_name") String fileName,
        @JsonProperty("content") String content
) {

    @JsonProperty("command")
    public String command() {
        return "sync";
    }
}
