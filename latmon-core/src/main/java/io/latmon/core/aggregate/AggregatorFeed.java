package io.latmon.core.aggregate;

import io.latmon.core.bus.EventSubscription;
import io.latmon.core.model.LatencyEvent;
import io.latmon.core.pipeline.CancellationToken;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains the aggregator's bus subscription until the bus is closed and empty or a forced stop.
 */
public final class AggregatorFeed implements Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(AggregatorFeed.class);
    private static final Duration POLL_INTERVAL = Duration.ofMillis(20);

    private final Aggregator aggregator;
    private final EventSubscription subscription;
    private final CancellationToken token;

    public AggregatorFeed(Aggregator aggregator, EventSubscription subscription, CancellationToken token) {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        this.subscription = Objects.requireNonNull(subscription, "subscription must not be null");
        this.token = Objects.requireNonNull(token, "token must not be null");
    }

    @Override
    public void run() {
        try {
            while (!token.isForced() && !subscription.isExhausted()) {
                Optional<LatencyEvent> next = subscription.poll(POLL_INTERVAL);
                next.ifPresent(aggregator::record);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            LOG.info("Aggregator feed stopped after {} event(s)", aggregator.ingested());
        }
    }
}
