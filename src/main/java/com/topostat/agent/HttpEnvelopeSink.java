package com.topostat.agent;

import com.topostat.config.TopostatProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Posts envelopes to the collector's {@code /api/v1/envelopes} endpoint.
 */
@Component
public class HttpEnvelopeSink implements EnvelopeSink {

    private static final Logger log = LoggerFactory.getLogger(HttpEnvelopeSink.class);

    static final String ENVELOPES_PATH = "/api/v1/envelopes";

    private final HttpClient httpClient;
    private final URI endpoint;
    private final Duration timeout;

    @Autowired
    public HttpEnvelopeSink(TopostatProperties properties) {
        this(properties.agent().serverUrl(), properties.agent().connectionTimeout());
    }

    public HttpEnvelopeSink(String serverUrl, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), serverUrl, timeout);
    }

    HttpEnvelopeSink(HttpClient httpClient, String serverUrl, Duration timeout) {
        this.httpClient = httpClient;
        this.endpoint = URI.create(stripTrailingSlash(serverUrl) + ENVELOPES_PATH);
        this.timeout = timeout;
    }

    @Override
    public void send(String envelopeJson) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(envelopeJson, StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new IOException("Collector at " + endpoint + " answered HTTP " + status + ": " + response.body());
        }
        log.debug("Envelope delivered to {} (HTTP {})", endpoint, status);
    }

    public URI getEndpoint() {
        return endpoint;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
