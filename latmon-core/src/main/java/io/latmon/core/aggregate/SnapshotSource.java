package io.latmon.core.aggregate;

import io.latmon.core.model.ComponentClass;
import io.latmon.core.model.PerformanceSnapshot;
import java.util.List;

public interface SnapshotSource {
    List<PerformanceSnapshot> snapshot();

    PerformanceSnapshot snapshot(ComponentClass componentClass);
}
