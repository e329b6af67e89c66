package org.catalogregistry.registry.common.http;

import java.util.Map;

/**
 * Status, headers and body of a completed request.
 */
public record HttpResponse(
    int statusCode,
    String statusText,
    Map<String, String> headers,
    String body
) {
    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }

    @Override
    public String toString() {
        var bodyPreview = body == null ? "" : body.substring(0, Math.min(body.length(), 200));
        return "HttpResponse{" + statusCode + " " + statusText + ", body=" + bodyPreview + "}";
    }
}
