package io.latmon.core.aggregate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class LogHistogramTest {
    private final BucketLayout layout = BucketLayout.doublingFromMillisecond();

    @Test
    void shouldReportZerosForEmptyHistogram() {
        LogHistogram histogram = new LogHistogram(layout);

        assertThat(histogram.count()).isZero();
        assertThat(histogram.minMicros()).isZero();
        assertThat(histogram.maxMicros()).isZero();
        assertThat(histogram.averageMicros()).isZero();
        assertThat(histogram.percentileMicros(99)).isZero();
    }

    @Test
    void shouldClampPercentilesToObservedRange() {
        LogHistogram histogram = new LogHistogram(layout);
        histogram.record(3_000);
        histogram.record(3_500);

        assertThat(histogram.percentileMicros(1)).isGreaterThanOrEqualTo(3_000.0);
        assertThat(histogram.percentileMicros(100)).isEqualTo(3_500.0);
        assertThat(histogram.averageMicros()).isCloseTo(3_250.0, within(0.001));
    }

    @Test
    void shouldMergeCountsAndExtremes() {
        LogHistogram left = new LogHistogram(layout);
        LogHistogram right = new LogHistogram(layout);
        left.record(1_500);
        right.record(90_000_000);
        right.record(-5);

        left.mergeFrom(right);

        assertThat(left.count()).isEqualTo(3);
        assertThat(left.minMicros()).isZero();
        assertThat(left.maxMicros()).isEqualTo(90_000_000L);

        left.reset();
        assertThat(left.count()).isZero();
        assertThat(left.bucketCount()).isEqualTo(layout.bucketCount());
    }
}
