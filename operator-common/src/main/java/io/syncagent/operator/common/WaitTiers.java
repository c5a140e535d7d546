/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.operator.common;

import java.time.Duration;
import java.util.Objects;

/**
 * The three requeue delays used by the reconcilers. Tiny is used to poll transient states (schema not established yet,
 * remote deletion in progress), short to back off after failures and long as the steady-state resync interval.
 *
 * @param tiny          Delay for transient states
 * @param shortWait     Delay after failures
 * @param longWait      Delay after a successful pass
 */
public record WaitTiers(Duration tiny, Duration shortWait, Duration longWait) {
    /**
     * Default tiny delay
     */
    public static final Duration DEFAULT_TINY_WAIT = Duration.ofSeconds(3);

    /**
     * Default short delay
     */
    public static final Duration DEFAULT_SHORT_WAIT = Duration.ofSeconds(30);

    /**
     * Default long delay
     */
    public static final Duration DEFAULT_LONG_WAIT = Duration.ofMinutes(1);

    /**
     * Wait tiers with the default delays
     */
    public static final WaitTiers DEFAULT = new WaitTiers(DEFAULT_TINY_WAIT, DEFAULT_SHORT_WAIT, DEFAULT_LONG_WAIT);

    /**
     * Constructor
     *
     * @param tiny          Delay for transient states
     * @param shortWait     Delay after failures
     * @param longWait      Delay after a successful pass
     */
    public WaitTiers {
        Objects.requireNonNull(tiny, "tiny");
        Objects.requireNonNull(shortWait, "shortWait");
        Objects.requireNonNull(longWait, "longWait");

        if (tiny.isZero() || tiny.isNegative()) {
            throw new InvalidConfigurationException("The tiny wait has to be positive, but is " + tiny);
        } else if (tiny.compareTo(shortWait) >= 0 || shortWait.compareTo(longWait) >= 0) {
            throw new InvalidConfigurationException("The wait tiers have to satisfy tiny < short < long, but are " + tiny + ", " + shortWait + " and " + longWait);
        }
    }

    /**
     * @return  Result requeueing after the tiny delay
     */
    public RequeueResult requeueTiny() {
        return RequeueResult.after(tiny);
    }

    /**
     * @return  Result requeueing after the short delay
     */
    public RequeueResult requeueShort() {
        return RequeueResult.after(shortWait);
    }

    /**
     * @return  Result requeueing after the long delay
     */
    public RequeueResult requeueLong() {
        return RequeueResult.after(longWait);
    }
}
