package com.acdm.market.acdm_market.execution;

import lombok.Getter;

/**
 * A market call did not finish within the executor's timeout.
 *
 * If the call never started it was cancelled and will not run. Otherwise it is
 * still running and may yet commit, so its outcome is unknown to the caller.
 */
@Getter
public class MarketCallTimeoutException extends RuntimeException {

    private final long timeoutMillis;
    private final boolean started;

    public MarketCallTimeoutException(long timeoutMillis, boolean started) {
        super(started
                ? String.format("Market call still running after %d ms, its outcome is unknown", timeoutMillis)
                : String.format("Market call did not start within %d ms and was cancelled", timeoutMillis));
        this.timeoutMillis = timeoutMillis;
        this.started = started;
    }
}
