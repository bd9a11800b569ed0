package io.latmon.core.sampler;

import io.latmon.core.bus.EventBus;
import io.latmon.core.model.ComponentClass;
import io.latmon.core.model.LatencyEvent;
import io.latmon.core.pipeline.CancellationToken;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls the process table for one component class on a fixed delay and publishes one event per
 * matching process. A failed scan skips the tick; cancellation is honoured between ticks, so the
 * tick in progress always completes.
 */
public final class Sampler implements Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(Sampler.class);

    private final String name;
    private final ComponentClass componentClass;
    private final Duration interval;
    private final ProcessTable processTable;
    private final List<ClassificationRule> rules;
    private final EventBus bus;
    private final Clock clock;
    private final CancellationToken token;

    private final AtomicReference<SamplerState> state = new AtomicReference<>(SamplerState.IDLE);
    private final AtomicLong ticks = new AtomicLong();
    private final AtomicLong failedTicks = new AtomicLong();
    private final AtomicLong emitted = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private Instant lastTimestamp = Instant.MIN;

    public Sampler(
        ComponentClass componentClass,
        Duration interval,
        ProcessTable processTable,
        List<ClassificationRule> rules,
        EventBus bus,
        Clock clock,
        CancellationToken token
    ) {
        this.componentClass = Objects.requireNonNull(componentClass, "componentClass must not be null");
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        this.name = componentClass.wireName() + "-sampler";
        this.interval = interval;
        this.processTable = Objects.requireNonNull(processTable, "processTable must not be null");
        this.rules = ClassificationRules.forClass(rules == null ? List.of() : rules, componentClass);
        this.bus = Objects.requireNonNull(bus, "bus must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.token = Objects.requireNonNull(token, "token must not be null");
    }

    @Override
    public void run() {
        LOG.info("Sampler {} started with interval {} ms and {} rule(s)", name, interval.toMillis(), rules.size());
        try {
            while (!token.isCancelled()) {
                tick();
                state.set(SamplerState.SLEEPING);
                if (token.await(interval)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            state.set(SamplerState.TERMINATED);
            LOG.info("Sampler {} terminated after {} tick(s), {} event(s) emitted", name, ticks.get(), emitted.get());
        }
    }

    /**
     * Runs a single scan-classify-emit cycle.
     *
     * @return number of events accepted by the bus
     */
    public int tick() {
        long started = System.nanoTime();
        ticks.incrementAndGet();
        state.set(SamplerState.SCANNING);
        List<ProcessInfo> processes;
        try {
            processes = processTable.snapshot();
        } catch (IOException | RuntimeException e) {
            failedTicks.incrementAndGet();
            LOG.warn("Sampler {} skipped tick: process table unavailable: {}", name, e.getMessage());
            return 0;
        }

        state.set(SamplerState.CLASSIFYING);
        List<Match> matches = new ArrayList<>();
        for (ProcessInfo process : processes) {
            for (ClassificationRule rule : rules) {
                if (rule.matches(process)) {
                    matches.add(new Match(process, rule));
                    break;
                }
            }
        }
        Duration scanElapsed = Duration.ofNanos(System.nanoTime() - started);

        state.set(SamplerState.EMITTING);
        int accepted = 0;
        for (Match match : matches) {
            LatencyEvent event = LatencyEvent.of(
                nextTimestamp(),
                componentClass,
                match.rule().source(),
                scanElapsed,
                describe(match.process())
            ).withMetadata(metadata(match));
            if (bus.publish(event)) {
                accepted++;
            } else {
                rejected.incrementAndGet();
            }
        }
        emitted.addAndGet(accepted);
        LOG.debug("Sampler {} tick: {} process(es), {} match(es), {} accepted", name, processes.size(), matches.size(), accepted);
        return accepted;
    }

    public String name() {
        return name;
    }

    public ComponentClass componentClass() {
        return componentClass;
    }

    public SamplerState state() {
        return state.get();
    }

    public SamplerStats stats() {
        return new SamplerStats(name, componentClass, state.get(), ticks.get(), failedTicks.get(), emitted.get(), rejected.get());
    }

    private Instant nextTimestamp() {
        Instant now = clock.instant();
        if (now.isBefore(lastTimestamp)) {
            now = lastTimestamp;
        }
        lastTimestamp = now;
        return now;
    }

    private String describe(ProcessInfo process) {
        return String.format(
            Locale.ROOT,
            "%s %d (%s) - CPU: %.1f%%, Memory: %dKB",
            componentClass.displayName(),
            process.pid(),
            process.name(),
            process.cpuPercent(),
            process.memoryBytes() / 1024
        );
    }

    private Map<String, Object> metadata(Match match) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("pid", match.process().pid());
        values.put("process_name", match.process().name());
        values.put("cpu_percent", Math.round(match.process().cpuPercent() * 10.0) / 10.0);
        values.put("memory_kb", match.process().memoryBytes() / 1024);
        values.put("rule", match.rule().name());
        return values;
    }

    private record Match(ProcessInfo process, ClassificationRule rule) {
    }
}
