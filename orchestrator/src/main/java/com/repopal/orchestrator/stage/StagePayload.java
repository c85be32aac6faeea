package com.repopal.orchestrator.stage;

import com.repopal.orchestrator.event.StandardizedEvent;
import com.repopal.orchestrator.executor.dto.CommandRequest;
import com.repopal.orchestrator.executor.dto.ExecutionResult;

/**
 * Everything a stage needs, carried from one task to the next as JSON.
 * Each stage fills in one more field.
 *
 * @param command set by PROCESS
 * @param request set by DISPATCH
 * @param result  set by EXECUTE
 */
public record StagePayload(
        StandardizedEvent event,
        String            command,
        CommandRequest    request,
        ExecutionResult   result) {

    public static StagePayload of(StandardizedEvent event) {
        return new StagePayload(event, null, null, null);
    }

    public StagePayload withCommand(String command) {
        return new StagePayload(event, command, request, result);
    }

    public StagePayload withRequest(CommandRequest request) {
        return new StagePayload(event, command, request, result);
    }

    public StagePayload withResult(ExecutionResult result) {
        return new StagePayload(event, command, request, result);
    }
}
