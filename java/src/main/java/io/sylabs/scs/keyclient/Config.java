package io.sylabs.scs.keyclient;

import java.net.http.HttpClient;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link KeyServiceClient} instances.
 *
 * <p>
 * Every field is optional. An unset field and an empty string are treated the same way, and the getters report both
 * as {@link Optional#empty()}. Validation of the base URL is deferred to {@link KeyServiceClient#create(Config)}.
 * </p>
 */
public final class Config {

    public static final String DEFAULT_BASE_URL = "https://keys.sylabs.io";

    private static final Config DEFAULTS = builder().build();

    private final String baseUrl;
    private final String authToken;
    private final String userAgent;
    private final HttpClient httpClient;

    private Config(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.authToken = builder.authToken;
        this.userAgent = builder.userAgent;
        this.httpClient = builder.httpClient;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return configuration with every field unset: default base URL, no token, no user agent, default transport.
     */
    public static Config defaults() {
        return DEFAULTS;
    }

    public Builder toBuilder() {
        return new Builder()
            .baseUrl(baseUrl)
            .authToken(authToken)
            .userAgent(userAgent)
            .httpClient(httpClient);
    }

    /**
     * @return base URL of the key service; {@link #DEFAULT_BASE_URL} is used when empty.
     */
    public Optional<String> getBaseUrl() {
        return nonEmpty(baseUrl);
    }

    /**
     * @return token sent in the {@code Authorization} header of each request.
     */
    public Optional<String> getAuthToken() {
        return nonEmpty(authToken);
    }

    /**
     * @return value sent in the {@code User-Agent} header of each request.
     */
    public Optional<String> getUserAgent() {
        return nonEmpty(userAgent);
    }

    /**
     * @return transport used to send requests; a shared default client is used when empty.
     */
    public Optional<HttpClient> getHttpClient() {
        return Optional.ofNullable(httpClient);
    }

    private static Optional<String> nonEmpty(String value) {
        return Optional.ofNullable(value).filter(s -> !s.isEmpty());
    }

    public static final class Builder {
        private String baseUrl;
        private String authToken;
        private String userAgent;
        private HttpClient httpClient;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder authToken(String authToken) {
            this.authToken = authToken;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Config build() {
            return new Config(this);
        }
    }
}
