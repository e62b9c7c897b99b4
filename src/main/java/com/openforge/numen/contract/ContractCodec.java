package com.openforge.numen.contract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * JSON form of an {@link AgentContract}: the stored payload, the version
 * snapshots and the cached artifact all use this one encoding.
 */
@Component
@RequiredArgsConstructor
public class ContractCodec {

    private final ObjectMapper objectMapper;

    public String encode(AgentContract contract) {
        try {
            return objectMapper.writeValueAsString(contract);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize contract " + contract.id(), e);
        }
    }

    /** Pretty-printed form written to disk. */
    public String encodePretty(AgentContract contract) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(contract);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize contract " + contract.id(), e);
        }
    }

    public AgentContract decode(String json) {
        try {
            return objectMapper.readValue(json, AgentContract.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored contract payload is not readable: " + e.getOriginalMessage(), e);
        }
    }

    public JsonNode toTree(AgentContract contract) {
        return objectMapper.valueToTree(contract);
    }

    /**
     * @throws JsonProcessingException when {@code json} is not valid JSON;
     *         the validator reports that as a difference instead of failing
     */
    public JsonNode readTree(String json) throws JsonProcessingException {
        return objectMapper.readTree(json);
    }
}
