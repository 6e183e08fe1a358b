package com.keystone.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Micrometer counters for router dispatch outcomes.
 * <p>
 * Each dispatch increments {@value #METRIC_NAME} tagged with the HTTP method and an outcome of
 * either {@value #OUTCOME_MATCHED} or {@value #OUTCOME_NOT_FOUND}. Paths are never tags; unmatched
 * paths are client-controlled.
 */
public final class DispatchMetrics {

    /** Metric name for dispatched requests. */
    public static final String METRIC_NAME = "keystone.router.dispatch";

    /** Tag key for the HTTP method. */
    public static final String TAG_METHOD = "method";

    /** Tag key for the dispatch outcome. */
    public static final String TAG_OUTCOME = "outcome";

    /** Outcome when a registered handler was invoked. */
    public static final String OUTCOME_MATCHED = "matched";

    /** Outcome when the not-found response was produced. */
    public static final String OUTCOME_NOT_FOUND = "not_found";

    private final MeterRegistry registry;

    /**
     * @param registry the meter registry to record into
     */
    public DispatchMetrics(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    /** Records a dispatch that reached a registered handler. */
    public void recordMatched(String method) {
        counter(method, OUTCOME_MATCHED).increment();
    }

    /** Records a dispatch that fell through to the not-found response. */
    public void recordNotFound(String method) {
        counter(method, OUTCOME_NOT_FOUND).increment();
    }

    /**
     * Returns the current count for a method/outcome pair (0 if never recorded).
     */
    public double count(String method, String outcome) {
        Counter counter = registry.find(METRIC_NAME)
                .tag(TAG_METHOD, normalize(method))
                .tag(TAG_OUTCOME, outcome)
                .counter();
        return counter == null ? 0 : counter.count();
    }

    private Counter counter(String method, String outcome) {
        return Counter.builder(METRIC_NAME)
                .description("Requests dispatched by the router")
                .tag(TAG_METHOD, normalize(method))
                .tag(TAG_OUTCOME, outcome)
                .register(registry);
    }

    private static String normalize(String method) {
        return method == null || method.isBlank() ? "UNKNOWN" : method;
    }
}
