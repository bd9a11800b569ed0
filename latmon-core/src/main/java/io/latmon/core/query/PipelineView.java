package io.latmon.core.query;

import java.util.List;

public interface PipelineView {
    List<String> activeSamplers();

    long droppedEvents();

    static PipelineView none() {
        return new PipelineView() {
            @Override
            public List<String> activeSamplers() {
                return List.of();
            }

            @Override
            public long droppedEvents() {
                return 0L;
            }
        };
    }
}
