package com.permission.engine.config;

import com.permission.engine.core.error.ConfigurationLoadException;
import com.permission.engine.core.error.PermissionException;
import com.permission.engine.core.model.PermissionConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Fetches the configuration document with an HTTP GET.
 * Any status other than 200 is a {@link ConfigurationLoadException}.
 *
 * <pre>
 * HttpConfigurationSource source = HttpConfigurationSource.builder()
 *     .uri(URI.create("https://config.internal/permissions.json"))
 *     .header("Authorization", "Bearer " + token)
 *     .timeout(Duration.ofSeconds(5))
 *     .build();
 * </pre>
 */
public class HttpConfigurationSource implements ConfigurationSource {
    private static final Logger log = LoggerFactory.getLogger(HttpConfigurationSource.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final URI uri;
    private final Map<String, String> headers;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final JsonConfigurationCodec codec;

    private HttpConfigurationSource(Builder builder) {
        this.uri = Objects.requireNonNull(builder.uri, "uri is required");
        this.headers = Map.copyOf(builder.headers);
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = builder.httpClient != null ? builder.httpClient
                : HttpClient.newBuilder().connectTimeout(timeout).build();
        this.codec = builder.codec != null ? builder.codec : new JsonConfigurationCodec();
    }

    @Override
    public PermissionConfiguration load() {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ConfigurationLoadException(describe(), "Failed to fetch configuration from " + uri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConfigurationLoadException(describe(), "Interrupted while fetching configuration from " + uri, e);
        }
        return toConfiguration(response);
    }

    @Override
    public CompletableFuture<PermissionConfiguration> loadAsync() {
        return httpClient.sendAsync(request(), HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause() : error;
                        throw new ConfigurationLoadException(describe(),
                                "Failed to fetch configuration from " + uri, cause);
                    }
                    return toConfiguration(response);
                });
    }

    private HttpRequest request() {
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET();
        headers.forEach(request::header);
        return request.build();
    }

    private PermissionConfiguration toConfiguration(HttpResponse<String> response) {
        if (response.statusCode() != 200) {
            throw new ConfigurationLoadException(describe(),
                    "Failed to fetch configuration from " + uri + ": HTTP " + response.statusCode());
        }
        try {
            PermissionConfiguration configuration = codec.parse(response.body());
            log.debug("Fetched {} roles from {}", configuration.getRoles().size(), uri);
            return configuration;
        } catch (PermissionException e) {
            log.warn("Configuration fetched from {} is invalid: {}", uri, e.getMessage());
            throw e;
        }
    }

    @Override
    public String describe() {
        return "http:" + uri;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private URI uri;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private Duration timeout;
        private HttpClient httpClient;
        private JsonConfigurationCodec codec;

        public Builder uri(URI uri) {
            this.uri = uri;
            return this;
        }

        public Builder uri(String uri) {
            return uri(URI.create(uri));
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder codec(JsonConfigurationCodec codec) {
            this.codec = codec;
            return this;
        }

        public HttpConfigurationSource build() {
            return new HttpConfigurationSource(this);
        }
    }
}
