package com.vigil.monitoring.check;

/**
 * Status and body of a probe GET.
 *
 * @param statusCode HTTP status code
 * @param body       response body, empty when there was none
 */
public record HttpProbeResponse(int statusCode, String body) {

    public HttpProbeResponse {
        body = body != null ? body : "";
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 400;
    }

    public int bodyLength() {
        return body.length();
    }
}
