package com.sage.search;

import com.sage.model.error.AccessDeniedException;
import com.sage.model.error.NetworkException;
import com.sage.model.error.ProviderTimeoutException;
import com.sage.model.error.RateLimitException;

import java.io.IOException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Shared HTTP plumbing for provider adapters: sends a request and maps status codes onto the error taxonomy.
 * 429 becomes {@link RateLimitException} (with Retry-After), 401/403 {@link AccessDeniedException},
 * timeouts {@link ProviderTimeoutException}, any other non-2xx {@link NetworkException}.
 */
public final class ProviderHttp {

    private ProviderHttp() {
    }

    public static HttpClient newClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public static String encode(String value) {
        return URLEncoder.encode(value != null ? value : "", StandardCharsets.UTF_8);
    }

    /** Sends the request and returns the body of a 2xx response. */
    public static String send(HttpClient client, HttpRequest request, String provider) throws IOException, InterruptedException {
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new ProviderTimeoutException(provider, "Timed out calling " + provider + ": " + e.getMessage(), e);
        }
        checkStatus(provider, request.uri().toString(), response.statusCode(), response.headers().firstValue("Retry-After"));
        return response.body();
    }

    public static void checkStatus(String provider, String url, int status, Optional<String> retryAfter) {
        if (status >= 200 && status < 300) return;
        if (status == 429) {
            throw new RateLimitException(provider, parseRetryAfter(retryAfter.orElse(null)));
        }
        if (status == 401 || status == 403) {
            throw new AccessDeniedException(provider, url, status);
        }
        if (status == 408 || status == 504) {
            throw new ProviderTimeoutException(provider, provider + " answered HTTP " + status);
        }
        throw new NetworkException(provider, provider + " answered HTTP " + status);
    }

    /** Parses a Retry-After value given in seconds; HTTP dates and garbage yield null. */
    public static Duration parseRetryAfter(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
