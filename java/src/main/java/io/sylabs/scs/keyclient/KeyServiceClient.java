package io.sylabs.scs.keyclient;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.sylabs.scs.keyclient.internal.DefaultHttpClient;
import io.sylabs.scs.keyclient.internal.Json;
import io.sylabs.scs.keyclient.internal.SchemeNormalizer;
import io.sylabs.scs.keyclient.internal.UriResolver;

import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * <p>
 * Entry point for talking to a key service. A client holds a validated base URL, the optional credentials and user
 * agent to attach to every request, and the {@link HttpClient} that callers use to send the requests it builds.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>Accepts {@code http}, {@code https} and the legacy {@code hkp}/{@code hkps} base URLs. HKP URLs are rewritten
 *       to HTTP on port 11371 unless a port is given; HKPS URLs are rewritten to HTTPS.</li>
 *   <li>Builds requests only. It never sends them, so no method here performs network I/O.</li>
 *   <li>Is immutable: a single instance can be shared between threads, and every call to {@link #newRequest} returns a
 *       new request owned by the caller.</li>
 * </ul>
 */
public final class KeyServiceClient {

    private static final Logger LOGGER = Logger.getLogger(KeyServiceClient.class.getName());

    static final String AUTHORIZATION_SCHEME = "BEARER";
    private static final String JSON_CONTENT_TYPE = "application/json";

    private final URI baseUrl;
    private final String authToken;
    private final String userAgent;
    private final HttpClient httpClient;

    private KeyServiceClient(URI baseUrl, String authToken, String userAgent, HttpClient httpClient) {
        this.baseUrl = baseUrl;
        this.authToken = authToken;
        this.userAgent = userAgent;
        this.httpClient = httpClient;
    }

    /**
     * Creates a client using {@link Config#defaults()}.
     *
     * @throws KeyServiceException never in practice; the default base URL is always valid.
     */
    public static KeyServiceClient create() throws KeyServiceException {
        return create(null);
    }

    /**
     * Creates a client from the supplied configuration.
     *
     * @param config caller-supplied configuration; {@code null} is equivalent to {@link Config#defaults()}.
     * @return client bound to the normalized base URL.
     * @throws InvalidBaseUrlException    when the base URL cannot be parsed or its host is not a valid host name.
     * @throws UnsupportedSchemeException when the base URL scheme is not {@code http}, {@code https}, {@code hkp} or
     *                                    {@code hkps}.
     */
    public static KeyServiceClient create(Config config) throws KeyServiceException {
        Config cfg = config == null ? Config.defaults() : config;

        String rawBaseUrl = cfg.getBaseUrl().orElse(Config.DEFAULT_BASE_URL);
        URI parsed;
        try {
            parsed = new URI(rawBaseUrl);
        } catch (URISyntaxException ex) {
            throw new InvalidBaseUrlException(rawBaseUrl, ex);
        }
        URI baseUrl = SchemeNormalizer.normalize(parsed);
        try {
            // Host names such as "key_server" only parse as a registry authority, which the transport rejects.
            baseUrl.parseServerAuthority();
        } catch (URISyntaxException ex) {
            throw new InvalidBaseUrlException(rawBaseUrl, ex);
        }

        HttpClient httpClient = cfg.getHttpClient().orElseGet(DefaultHttpClient::instance);

        LOGGER.fine(() -> "[scs-key-client] using base URL " + baseUrl);
        return new KeyServiceClient(
            baseUrl,
            cfg.getAuthToken().orElse(null),
            cfg.getUserAgent().orElse(null),
            httpClient
        );
    }

    /**
     * @return normalized base URL; its scheme is always {@code http} or {@code https}.
     */
    public URI baseUrl() {
        return baseUrl;
    }

    public Optional<String> authToken() {
        return Optional.ofNullable(authToken);
    }

    public Optional<String> userAgent() {
        return Optional.ofNullable(userAgent);
    }

    /**
     * @return transport to send requests with; either the configured client or the shared default.
     */
    public HttpClient httpClient() {
        return httpClient;
    }

    /**
     * Builds a request without a body.
     *
     * @see #newRequest(String, String, String, InputStream)
     */
    public HttpRequest newRequest(String method, String path, String rawQuery) throws RequestConstructionException {
        return newRequest(method, path, rawQuery, null);
    }

    /**
     * Builds a request against the base URL.
     *
     * <p>
     * {@code path} is resolved relative to the base URL and cannot change its scheme, host or port. It must not be
     * derived from untrusted input without validation, since {@code ..} segments can still climb out of the base path.
     * </p>
     *
     * @param method   HTTP method token, for example {@code GET} or {@code POST}; empty means {@code GET}.
     * @param path     path relative to the base URL.
     * @param rawQuery encoded query string inserted verbatim; {@code null} or empty for none.
     * @param body     request body, or {@code null} for none. The stream is read when the request is sent and must not
     *                 be reused; closing it is the caller's responsibility.
     * @return a new request carrying {@code Authorization} and {@code User-Agent} headers when configured.
     * @throws RequestConstructionException when the method, the resolved URI or a header value is rejected.
     */
    public HttpRequest newRequest(String method, String path, String rawQuery, InputStream body)
        throws RequestConstructionException {
        HttpRequest.BodyPublisher publisher = body == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofInputStream(() -> body);
        return buildRequest(method, path, rawQuery, publisher, null, false);
    }

    /**
     * Builds a request whose body is {@code payload} encoded as JSON.
     *
     * @param payload value to encode; {@code null} sends no body and no {@code Content-Type}.
     * @return a new request with {@code Accept: application/json} and, when a payload is given,
     *     {@code Content-Type: application/json}.
     * @throws RequestConstructionException when the payload cannot be encoded or the request cannot be built.
     */
    public HttpRequest newJsonRequest(String method, String path, String rawQuery, Object payload)
        throws RequestConstructionException {
        if (payload == null) {
            return buildRequest(method, path, rawQuery, HttpRequest.BodyPublishers.noBody(), null, true);
        }
        byte[] body;
        try {
            body = Json.mapper().writeValueAsBytes(payload);
        } catch (JsonProcessingException ex) {
            throw new RequestConstructionException("encode request body: " + ex.getOriginalMessage(), ex);
        }
        return buildRequest(
            method, path, rawQuery, HttpRequest.BodyPublishers.ofByteArray(body), JSON_CONTENT_TYPE, true);
    }

    private HttpRequest buildRequest(
        String method,
        String path,
        String rawQuery,
        HttpRequest.BodyPublisher publisher,
        String contentType,
        boolean acceptJson
    ) throws RequestConstructionException {
        Objects.requireNonNull(method, "method");
        String resolvedMethod = method.isEmpty() ? "GET" : method;

        URI target;
        try {
            target = UriResolver.resolve(baseUrl, path, rawQuery);
        } catch (URISyntaxException ex) {
            throw new RequestConstructionException("resolve request URI: " + ex.getMessage(), ex);
        }

        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(target)
                .method(resolvedMethod, publisher);

            if (acceptJson) {
                builder.header("Accept", JSON_CONTENT_TYPE);
            }
            if (contentType != null) {
                builder.header("Content-Type", contentType);
            }
            if (authToken != null) {
                builder.header("Authorization", AUTHORIZATION_SCHEME + " " + authToken);
            }
            if (userAgent != null) {
                builder.header("User-Agent", userAgent);
            }
            return builder.build();
        } catch (IllegalArgumentException ex) {
            String message = String.format(Locale.ROOT,
                "build %s request for %s: %s", resolvedMethod, target, ex.getMessage());
            throw new RequestConstructionException(message, ex);
        }
    }
}
