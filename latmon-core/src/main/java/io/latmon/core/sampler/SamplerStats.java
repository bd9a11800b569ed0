package io.latmon.core.sampler;

import io.latmon.core.model.ComponentClass;

public record SamplerStats(
    String name,
    ComponentClass componentClass,
    SamplerState state,
    long ticks,
    long failedTicks,
    long emitted,
    long rejected
) {
}
