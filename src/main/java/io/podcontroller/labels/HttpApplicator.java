package io.podcontroller.labels;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.podcontroller.store.RetryPolicy;
import io.podcontroller.store.StoreException;
import io.podcontroller.store.WatchHandle;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static io.podcontroller.config.Constants.NODE_SELECTOR_QUERY_PARAM;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Read-only Applicator backed by a node inventory service. Matches are fetched with
 * {@code GET <endpoint>?selector=<selector>}, which answers with a JSON array of
 * {@code {"id": ..., "labels": {...}}} objects. Only node labels are served.
 * Watches poll the endpoint at a fixed interval.
 */
@Slf4j
public class HttpApplicator implements Applicator {

    private static final TypeReference<List<Map<String, Object>>> RESPONSE_TYPE = new TypeReference<>() {};

    private final HttpClient httpClient;
    private final String endpoint;
    private final Map<String, String> headers;
    private final RetryPolicy retryPolicy;
    private final Duration pollInterval;
    private final ObjectMapper objectMapper;

    public HttpApplicator(String endpoint, Map<String, String> headers, RetryPolicy retryPolicy, Duration pollInterval) {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build(),
            endpoint, headers, retryPolicy, pollInterval);
    }

    public HttpApplicator(HttpClient httpClient, String endpoint, Map<String, String> headers,
                          RetryPolicy retryPolicy, Duration pollInterval) {
        if (endpoint == null || endpoint.trim().isEmpty()) {
            throw new IllegalArgumentException("Node inventory endpoint cannot be null or empty");
        }
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.headers = headers != null ? Map.copyOf(headers) : Map.of();
        this.retryPolicy = retryPolicy;
        this.pollInterval = pollInterval;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public List<Labeled> getMatches(LabelSelector selector, LabelType type) throws StoreException {
        requireNodeType(type);
        String url = endpoint + "?" + NODE_SELECTOR_QUERY_PARAM + "=" + URLEncoder.encode(selector.toString(), UTF_8);
        return retryPolicy.call("query node inventory " + url, () -> {
            HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(60))
                .GET();
            headers.forEach(requestBuilder::header);

            HttpResponse<String> response = httpClient.send(requestBuilder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 500) {
                throw new IOException("node inventory returned status " + response.statusCode());
            }
            if (response.statusCode() != 200) {
                throw new StoreException("node inventory rejected query " + url + " with status "
                    + response.statusCode() + ": " + response.body());
            }
            return parseNodes(response.body(), selector);
        });
    }

    @SuppressWarnings("unchecked")
    private List<Labeled> parseNodes(String body, LabelSelector selector) throws StoreException {
        List<Map<String, Object>> entries;
        try {
            entries = objectMapper.readValue(body, RESPONSE_TYPE);
        } catch (IOException e) {
            throw new StoreException("Unparsable node inventory response: " + e.getMessage(), e);
        }
        List<Labeled> nodes = new ArrayList<>();
        for (Map<String, Object> entry : entries) {
            Object id = entry.get("id");
            if (id == null) {
                log.warn("Skipping node inventory entry without id: {}", entry);
                continue;
            }
            Map<String, String> labels = new HashMap<>();
            Object rawLabels = entry.get("labels");
            if (rawLabels instanceof Map) {
                ((Map<String, Object>) rawLabels).forEach((k, v) -> labels.put(k, String.valueOf(v)));
            }
            // The service filters already; re-check so a lenient server cannot widen the result
            if (selector.test(labels)) {
                nodes.add(new Labeled(LabelType.NODE, id.toString(), labels));
            }
        }
        return nodes;
    }

    @Override
    public Labeled getLabels(LabelType type, String id) throws StoreException {
        for (Labeled node : getMatches(LabelSelector.EVERYTHING, type)) {
            if (node.getId().equals(id)) {
                return node;
            }
        }
        return Labeled.empty(type, id);
    }

    @Override
    public WatchHandle watchMatches(LabelSelector selector, LabelType type, Consumer<List<Labeled>> listener) {
        requireNodeType(type);
        ScheduledExecutorService poller = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
            .setNameFormat("node-inventory-poll-%d")
            .setDaemon(true)
            .build());
        poller.scheduleWithFixedDelay(() -> {
            try {
                listener.accept(getMatches(selector, type));
            } catch (StoreException e) {
                log.warn("Node inventory poll for {} failed: {}", selector, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Node watch listener for {} failed: {}", selector, e.getMessage(), e);
            }
        }, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        return poller::shutdownNow;
    }

    private void requireNodeType(LabelType type) {
        if (type != LabelType.NODE) {
            throw new UnsupportedOperationException("node inventory only serves node labels, not " + type.getName());
        }
    }

    // =================================================================
    // WRITES ARE OWNED BY THE INVENTORY SERVICE
    // =================================================================

    @Override
    public void setLabel(LabelType type, String id, String key, String value) {
        throw readOnly();
    }

    @Override
    public void setLabels(LabelType type, String id, Map<String, String> labels) {
        throw readOnly();
    }

    @Override
    public void removeLabel(LabelType type, String id, String key) {
        throw readOnly();
    }

    @Override
    public void removeLabels(LabelType type, String id, Collection<String> keys) {
        throw readOnly();
    }

    @Override
    public void removeAllLabels(LabelType type, String id) {
        throw readOnly();
    }

    private UnsupportedOperationException readOnly() {
        return new UnsupportedOperationException("node inventory labels are read-only");
    }
}
