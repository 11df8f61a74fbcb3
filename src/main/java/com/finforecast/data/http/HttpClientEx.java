package com.finforecast.data.http;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Thin GET client. Every request carries the configured User-Agent; a non-2xx status is an
 * {@link IllegalStateException}.
 */
public class HttpClientEx {
    private final HttpClient client;
    private final String userAgent;

    public HttpClientEx(String userAgent) {
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(20))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.userAgent = userAgent == null || userAgent.isBlank() ? "finforecast/1.0" : userAgent.trim();
    }

    public String userAgent() {
        return userAgent;
    }

    public String getText(String url, int timeoutSeconds) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .GET()
                .header("User-Agent", userAgent)
                .header("Accept", "application/json")
                .build();
        HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) return resp.body();
        throw new IllegalStateException("HTTP " + resp.statusCode() + " for " + url);
    }
}
