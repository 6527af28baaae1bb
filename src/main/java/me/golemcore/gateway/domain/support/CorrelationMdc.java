package me.golemcore.gateway.domain.support;

import org.slf4j.MDC;

/**
 * MDC key carrying the dispatch correlation id on gateway log lines.
 */
public final class CorrelationMdc {

    public static final String KEY = "correlationId";

    private CorrelationMdc() {
    }

    public static MDC.MDCCloseable put(String correlationId) {
        return MDC.putCloseable(KEY, correlationId);
    }
}
