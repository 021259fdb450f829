package io.sylabs.scs.keyclient.internal;

import io.sylabs.scs.keyclient.UnsupportedSchemeException;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Maps key service URLs onto the two schemes understood by the HTTP transport.
 *
 * <p>
 * Key servers have long been addressed with HKP scheme names. {@code hkp} is plain HTTP on port 11371 and
 * {@code hkps} is HTTPS on the usual port, so both are rewritten here and callers can pass either form.
 * </p>
 */
public final class SchemeNormalizer {

    public static final int HKP_DEFAULT_PORT = 11371;

    private static final Logger LOGGER = Logger.getLogger(SchemeNormalizer.class.getName());

    private SchemeNormalizer() {
    }

    /**
     * Normalizes the scheme of {@code uri}.
     *
     * @param uri parsed base URL; never modified.
     * @return {@code uri} itself for lower-case {@code http}/{@code https}, otherwise a new URI using {@code http} or
     *     {@code https}.
     * @throws UnsupportedSchemeException when the scheme is missing or not one of {@code http}, {@code https},
     *                                    {@code hkp}, {@code hkps}.
     */
    public static URI normalize(URI uri) throws UnsupportedSchemeException {
        Objects.requireNonNull(uri, "uri");
        String scheme = uri.getScheme() == null ? "" : uri.getScheme();
        String lower = scheme.toLowerCase(Locale.ROOT);

        if ("http".equals(lower) || "https".equals(lower)) {
            return scheme.equals(lower) ? uri : withScheme(uri, lower);
        }
        if ("hkp".equals(lower)) {
            URI rewritten;
            if (uri.getPort() == -1 && uri.getHost() != null) {
                rewritten = withDefaultPort(uri, "http", HKP_DEFAULT_PORT);
            } else {
                rewritten = withScheme(uri, "http");
            }
            LOGGER.fine(() -> "[scs-key-client] rewrote " + uri + " to " + rewritten);
            return rewritten;
        }
        if ("hkps".equals(lower)) {
            URI rewritten = withScheme(uri, "https");
            LOGGER.fine(() -> "[scs-key-client] rewrote " + uri + " to " + rewritten);
            return rewritten;
        }
        throw new UnsupportedSchemeException(scheme);
    }

    private static URI withScheme(URI uri, String scheme) {
        String original = uri.toString();
        return URI.create(scheme + original.substring(uri.getScheme().length()));
    }

    private static URI withDefaultPort(URI uri, String scheme, int port) {
        StringBuilder sb = new StringBuilder(scheme).append("://");
        if (uri.getRawUserInfo() != null) {
            sb.append(uri.getRawUserInfo()).append('@');
        }
        // getHost() keeps the brackets around IPv6 literals.
        sb.append(uri.getHost()).append(':').append(port);
        if (uri.getRawPath() != null) {
            sb.append(uri.getRawPath());
        }
        if (uri.getRawQuery() != null) {
            sb.append('?').append(uri.getRawQuery());
        }
        if (uri.getRawFragment() != null) {
            sb.append('#').append(uri.getRawFragment());
        }
        return URI.create(sb.toString());
    }
}
