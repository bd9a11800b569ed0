package io.latmon.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RuleConfig(
    String name,
    String componentClass,
    String sourceKind,
    List<String> nameEquals,
    List<String> nameContains,
    List<String> commandContains,
    String namePattern,
    double minCpuPercent
) {
}
