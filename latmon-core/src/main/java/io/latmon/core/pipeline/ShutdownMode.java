package io.latmon.core.pipeline;

public enum ShutdownMode {
    /** Stop sampling, persist everything already buffered, then terminate. */
    GRACEFUL,
    /** Terminate immediately; buffered events that were not yet persisted are discarded. */
    FORCED
}
