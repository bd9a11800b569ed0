package io.latmon.core.sampler;

public enum SamplerState {
    IDLE,
    SCANNING,
    CLASSIFYING,
    EMITTING,
    SLEEPING,
    TERMINATED
}
