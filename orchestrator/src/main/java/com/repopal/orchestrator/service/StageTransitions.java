package com.repopal.orchestrator.service;

import com.repopal.orchestrator.model.PipelineState;
import com.repopal.orchestrator.model.Stage;

import java.util.EnumMap;
import java.util.Map;

/**
 * What follows each stage on success. Handlers do not know this table.
 */
final class StageTransitions {

    /** @param next null for the last stage */
    record Transition(PipelineState onSuccess, Stage next) {}

    private static final Map<Stage, Transition> TABLE = new EnumMap<>(Stage.class);

    static {
        TABLE.put(Stage.PROCESS,         new Transition(PipelineState.DISPATCHING,        Stage.DISPATCH));
        TABLE.put(Stage.DISPATCH,        new Transition(PipelineState.EXECUTING,          Stage.EXECUTE));
        TABLE.put(Stage.EXECUTE,         new Transition(PipelineState.PROCESSING_RESULTS, Stage.PROCESS_RESULTS));
        TABLE.put(Stage.PROCESS_RESULTS, new Transition(PipelineState.COMPLETED,          null));
    }

    private StageTransitions() {}

    static Transition after(Stage stage) {
        return TABLE.get(stage);
    }
}
