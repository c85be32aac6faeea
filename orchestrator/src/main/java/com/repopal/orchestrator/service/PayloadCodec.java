package com.repopal.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repopal.orchestrator.stage.StageException;
import com.repopal.orchestrator.stage.StagePayload;
import org.springframework.stereotype.Component;

/**
 * JSON form of {@link StagePayload} as stored in stage_tasks.payload.
 */
@Component
public class PayloadCodec {

    private final ObjectMapper objectMapper;

    public PayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(StagePayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise stage payload", e);
        }
    }

    /**
     * @throws StageException FATAL if the stored JSON cannot be read back
     */
    public StagePayload decode(String json) {
        try {
            return objectMapper.readValue(json, StagePayload.class);
        } catch (JsonProcessingException e) {
            throw StageException.fatal("Corrupt stage payload: " + e.getOriginalMessage(), e);
        }
    }
}
