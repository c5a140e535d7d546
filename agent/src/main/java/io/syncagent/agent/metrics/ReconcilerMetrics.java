/*
 * Copyright Sync Agent authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.syncagent.agent.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.syncagent.operator.common.MetricsProvider;
import io.syncagent.operator.common.RequeueResult;
import io.vertx.core.Future;

import java.util.function.Supplier;

/**
 * Metrics of a single reconciler. The metrics are tagged with the kind of the reconciled resources.
 */
public class ReconcilerMetrics {
    /**
     * Prefix used for all metrics of the agent
     */
    public static final String METRICS_PREFIX = "sync_agent.";

    private final MetricsProvider metricsProvider;
    private final Counter reconciliations;
    private final Counter successfulReconciliations;
    private final Counter failedReconciliations;
    private final Timer reconciliationsTimer;

    /**
     * Constructor
     *
     * @param kind              Kind of the reconciled resources
     * @param metricsProvider   Provider used to register the metrics
     */
    public ReconcilerMetrics(String kind, MetricsProvider metricsProvider) {
        this.metricsProvider = metricsProvider;

        Tags tags = Tags.of("kind", kind);
        this.reconciliations = metricsProvider.counter(METRICS_PREFIX + "reconciliations", "Number of reconciliations done by the agent", tags);
        this.successfulReconciliations = metricsProvider.counter(METRICS_PREFIX + "reconciliations.successful", "Number of reconciliations which completed without error", tags);
        this.failedReconciliations = metricsProvider.counter(METRICS_PREFIX + "reconciliations.failed", "Number of reconciliations which returned an error", tags);
        this.reconciliationsTimer = metricsProvider.timer(METRICS_PREFIX + "reconciliations.duration", "The time the reconciliation takes to complete", tags);
    }

    /**
     * Runs the reconciliation and records its outcome and duration
     *
     * @param reconciliation    Supplier starting the reconciliation
     *
     * @return  The future returned by the reconciliation
     */
    public Future<RequeueResult> record(Supplier<Future<RequeueResult>> reconciliation) {
        reconciliations.increment();
        Timer.Sample sample = Timer.start(metricsProvider.meterRegistry());

        return reconciliation.get()
                .onComplete(res -> {
                    sample.stop(reconciliationsTimer);

                    if (res.succeeded()) {
                        successfulReconciliations.increment();
                    } else {
                        failedReconciliations.increment();
                    }
                });
    }
}
