package com.markrunner.dispatch.cli;

import com.markrunner.core.stage.PipelineProperties;
import com.markrunner.core.stage.StageDefinition;

import java.util.List;

final class CommandSupport {

    private CommandSupport() {}

    /**
     * All configured stages, or just the named one; empty when the name is unknown.
     */
    static List<StageDefinition> selectStages(PipelineProperties properties, String stageId) {
        if (stageId == null) {
            return properties.getStages();
        }
        return properties.stage(stageId).map(List::of).orElse(List.of());
    }
}
