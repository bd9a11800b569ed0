package io.latmon.core.sampler;

import io.latmon.core.model.ComponentClass;
import io.latmon.core.model.SourceKind;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Maps process attributes to a component class. A process matches when its name equals one
 * of {@code nameEquals}, its name contains one of {@code nameContains}, its command line contains
 * one of {@code commandContains}, or its name matches {@code namePattern}; all comparisons are
 * case-insensitive. A positive {@code minCpuPercent} additionally requires the process to be busier
 * than that threshold.
 */
public final class ClassificationRule {
    private final String name;
    private final ComponentClass target;
    private final SourceKind source;
    private final List<String> nameEquals;
    private final List<String> nameContains;
    private final List<String> commandContains;
    private final Pattern namePattern;
    private final double minCpuPercent;

    public ClassificationRule(
        String name,
        ComponentClass target,
        SourceKind source,
        List<String> nameEquals,
        List<String> nameContains,
        List<String> commandContains,
        String namePattern,
        double minCpuPercent
    ) {
        this.name = name == null || name.isBlank() ? String.valueOf(target) : name.trim();
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.source = source == null ? SourceKind.PROCESS_SCAN : source;
        this.nameEquals = lower(nameEquals);
        this.nameContains = lower(nameContains);
        this.commandContains = lower(commandContains);
        this.namePattern = namePattern == null || namePattern.isBlank()
            ? null
            : Pattern.compile(namePattern, Pattern.CASE_INSENSITIVE);
        this.minCpuPercent = minCpuPercent;
    }

    public boolean matches(ProcessInfo process) {
        if (minCpuPercent > 0 && process.cpuPercent() <= minCpuPercent) {
            return false;
        }
        String processName = process.name().toLowerCase(Locale.ROOT);
        if (nameEquals.contains(processName)) {
            return true;
        }
        for (String fragment : nameContains) {
            if (processName.contains(fragment)) {
                return true;
            }
        }
        if (!commandContains.isEmpty()) {
            String command = process.commandLine().toLowerCase(Locale.ROOT);
            for (String fragment : commandContains) {
                if (command.contains(fragment)) {
                    return true;
                }
            }
        }
        return namePattern != null && namePattern.matcher(process.name()).find();
    }

    public String name() {
        return name;
    }

    public ComponentClass target() {
        return target;
    }

    public SourceKind source() {
        return source;
    }

    public double minCpuPercent() {
        return minCpuPercent;
    }

    private static List<String> lower(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
            .filter(Objects::nonNull)
            .map(value -> value.trim().toLowerCase(Locale.ROOT))
            .filter(value -> !value.isEmpty())
            .toList();
    }
}
