package dumb.deduction;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.deduction.proof.ProofState;
import dumb.deduction.server.ProverResponse;
import dumb.deduction.util.Json;

import java.util.Map;

public interface Event {

    String getEventType();

    default JsonNode toJson() {
        return Json.node(this);
    }

    /** A high-level request finished, failed or was abandoned after its last trial. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ProverResponseEvent(String requestType, int seqNum, ProverResponse response) implements Event {
        @Override
        public String getEventType() {
            return "ProverResponseEvent";
        }
    }

    record QueueEndedEvent() implements Event {
        @Override
        public String getEventType() {
            return "QueueEndedEvent";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record EffectiveCodeEvent(int seqNum, Map<Integer, Integer> choices) implements Event {
        @Override
        public String getEventType() {
            return "EffectiveCodeEvent";
        }
    }

    record InitialProofStatesEvent(Map<String, ProofState> statesByStatement) implements Event {
        @Override
        public String getEventType() {
            return "InitialProofStatesEvent";
        }
    }

    record BackendStateEvent(boolean running) implements Event {
        @Override
        public String getEventType() {
            return "BackendStateEvent";
        }
    }

    record FileChangedEvent(String innerContents) implements Event {
        @Override
        public String getEventType() {
            return "FileChangedEvent";
        }
    }
}
