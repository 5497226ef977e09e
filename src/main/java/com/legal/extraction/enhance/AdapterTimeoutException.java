package com.legal.extraction.enhance;

import java.time.Duration;

/**
 * The enhancement source did not answer within its time budget.
 */
public class AdapterTimeoutException extends EnhancementException {

    private final Duration timeout;

    public AdapterTimeoutException(String adapterName, Duration timeout) {
        super(adapterName, "Adapter " + adapterName + " timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
