package io.latmon.core.sampler;

import java.io.IOException;
import java.util.List;

public interface ProcessTable {
    List<ProcessInfo> snapshot() throws IOException;
}
