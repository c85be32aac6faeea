package com.repopal.orchestrator.stage;

import java.util.Map;

/**
 * What a handler hands back to the orchestrator on normal return.
 *
 * {@code failed} is for a stage that completed its work but whose subject failed
 * (e.g. the command exited non-zero): the pipeline ends FAILED without a retry.
 *
 * @param metadata merged into the pipeline's metadata on the next transition
 */
public record StageOutcome(StagePayload payload, boolean failed, String error, Map<String, Object> metadata) {

    public StageOutcome {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static StageOutcome advance(StagePayload payload, Map<String, Object> metadata) {
        return new StageOutcome(payload, false, null, metadata);
    }

    public static StageOutcome failed(StagePayload payload, String error, Map<String, Object> metadata) {
        return new StageOutcome(payload, true, error, metadata);
    }
}
