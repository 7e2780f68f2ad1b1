package com.vigil.monitoring.check;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Issues read-only GET requests on behalf of probes and smoke tests.
 * <p>
 * Non-2xx responses are returned, not thrown. Transport failures (connect refused, timeouts,
 * DNS) surface as unchecked exceptions.
 */
public interface HttpProber {

    HttpProbeResponse get(URI uri, Map<String, String> headers, Duration timeout);

    default HttpProbeResponse get(URI uri, Duration timeout) {
        return get(uri, Map.of(), timeout);
    }
}
