package com.vigil.monitoring.check;

import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResponseErrorHandler;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link HttpProber} backed by Spring's {@link RestTemplate}. One template is kept per timeout.
 */
public final class RestTemplateHttpProber implements HttpProber {

    private static final ResponseErrorHandler ACCEPT_ALL = new ResponseErrorHandler() {
        @Override
        public boolean hasError(ClientHttpResponse response) {
            return false;
        }

        @Override
        public void handleError(ClientHttpResponse response) {
            // never invoked, hasError is always false
        }
    };

    private final Map<Duration, RestTemplate> templates = new ConcurrentHashMap<>();
    private final String userAgent;

    public RestTemplateHttpProber(String userAgent) {
        this.userAgent = userAgent;
    }

    @Override
    public HttpProbeResponse get(URI uri, Map<String, String> headers, Duration timeout) {
        HttpHeaders httpHeaders = new HttpHeaders();
        if (userAgent != null) {
            httpHeaders.set(HttpHeaders.USER_AGENT, userAgent);
        }
        headers.forEach(httpHeaders::set);
        ResponseEntity<String> response = templateFor(timeout)
                .exchange(uri, HttpMethod.GET, new HttpEntity<>(httpHeaders), String.class);
        return new HttpProbeResponse(response.getStatusCode().value(), response.getBody());
    }

    private RestTemplate templateFor(Duration timeout) {
        return templates.computeIfAbsent(timeout, t -> {
            SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
            factory.setConnectTimeout((int) t.toMillis());
            factory.setReadTimeout((int) t.toMillis());
            RestTemplate template = new RestTemplate(factory);
            template.setErrorHandler(ACCEPT_ALL);
            return template;
        });
    }
}
