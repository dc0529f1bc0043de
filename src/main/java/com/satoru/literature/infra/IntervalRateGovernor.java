package com.satoru.literature.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import io.github.bucket4j.UninterruptibleBlockingStrategy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Process-wide minimum spacing between outbound E-utilities requests, backed by a single-token bucket
 * that refills one token per interval.
 * <p>
 * The token is taken at the moment the caller proceeds, never reserved ahead of time, so the next
 * caller can only proceed one full interval after the previous one actually did.
 */
@Slf4j
public class IntervalRateGovernor implements RateGovernor {

    private final Bucket bucket;

    public IntervalRateGovernor(Duration minInterval) {
        if (minInterval == null || minInterval.isNegative()) {
            throw new IllegalArgumentException("Minimum interval must be zero or positive");
        }
        this.bucket = minInterval.isZero() ? null : createBucket(minInterval);
    }

    private static Bucket createBucket(Duration minInterval) {
        return Bucket.builder()
            .addLimit(Bandwidth.classic(1, Refill.greedy(1, minInterval)))
            .withNanosecondPrecision()
            .build();
    }

    @Override
    public long acquire() {
        if (bucket == null) {
            return System.nanoTime();
        }
        while (true) {
            ConsumptionProbe consumption = bucket.tryConsumeAndReturnRemaining(1);
            if (consumption.isConsumed()) {
                return System.nanoTime();
            }
            log.trace("Waiting {} ms for the next E-utilities slot", consumption.getNanosToWaitForRefill() / 1_000_000);
            // Interrupts are re-asserted once the park is over; the request still goes out.
            UninterruptibleBlockingStrategy.PARKING.parkUninterruptibly(consumption.getNanosToWaitForRefill());
        }
    }
}
