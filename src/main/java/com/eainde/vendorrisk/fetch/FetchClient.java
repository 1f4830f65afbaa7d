package com.eainde.vendorrisk.fetch;

import java.time.Duration;

/**
 * Bounded-timeout HTTP GET.
 * <p>
 * Implementations are shared by all runs and must be thread-safe. A non-2xx status is returned,
 * not thrown; only transport failures (connect errors, timeouts, oversized bodies) raise.
 */
public interface FetchClient {

    String USER_AGENT = "Vendor-Risk-Agent/1.0";

    FetchResponse get(String url, Duration timeout) throws FetchException;
}
