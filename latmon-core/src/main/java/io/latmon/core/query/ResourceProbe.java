package io.latmon.core.query;

import io.latmon.core.model.ResourceUsage;

@FunctionalInterface
public interface ResourceProbe {
    ResourceUsage sample();
}
