package io.sylabs.scs.keyclient.internal;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;

/**
 * Resolves a request path and raw query against a base URL following RFC 3986 section 5.2.
 *
 * <p>
 * {@link URI#resolve(URI)} implements the older RFC 2396 rules. The two places where that matters for request
 * building are handled here: a base URL with an authority and an empty path merges as if its path were {@code /},
 * and an empty reference path keeps the base path. Dot segments are removed from the result, which
 * {@code URI.resolve} skips for absolute paths and {@code URI.normalize} does for {@code ..} only below the root.
 * The resolved URI always keeps the scheme and authority of the base.
 * </p>
 */
public final class UriResolver {

    private UriResolver() {
    }

    /**
     * @param base     absolute base URL.
     * @param path     decoded path, relative to {@code base}; characters not legal in a path are percent-encoded.
     * @param rawQuery already-encoded query string, inserted verbatim; {@code null} or empty for none.
     * @return absolute request URI.
     * @throws URISyntaxException when the path and query cannot form a URI reference.
     */
    public static URI resolve(URI base, String path, String rawQuery) throws URISyntaxException {
        Objects.requireNonNull(base, "base");
        String rawPath = encodePath(path);
        String query = rawQuery == null || rawQuery.isEmpty() ? null : rawQuery;

        if (rawPath.isEmpty()) {
            return build(base, removeDotSegments(base.getRawPath()), query != null ? query : base.getRawQuery());
        }
        if (rawPath.startsWith("//")) {
            // Would otherwise be read as a network-path reference naming another host.
            return build(base, removeDotSegments(rawPath), query);
        }

        URI effectiveBase = base;
        if (base.getRawAuthority() != null && (base.getRawPath() == null || base.getRawPath().isEmpty())) {
            effectiveBase = build(base, "/", base.getRawQuery());
        }

        // "./" keeps a first segment containing ':' from being read as a scheme.
        String referencePath = rawPath.startsWith("/") ? rawPath : "./" + rawPath;
        URI reference = new URI(query == null ? referencePath : referencePath + "?" + query);
        URI resolved = effectiveBase.resolve(reference);
        return build(base, removeDotSegments(resolved.getRawPath()), resolved.getRawQuery());
    }

    /**
     * Removes {@code .} and {@code ..} segments as described in RFC 3986 section 5.2.4. {@code ..} never climbs
     * above the root and empty segments are kept.
     */
    static String removeDotSegments(String path) {
        if (path == null || path.isEmpty()) {
            return path;
        }
        StringBuilder output = new StringBuilder(path.length());
        String input = path;
        while (!input.isEmpty()) {
            if (input.startsWith("../")) {
                input = input.substring(3);
            } else if (input.startsWith("./")) {
                input = input.substring(2);
            } else if (input.startsWith("/./")) {
                input = input.substring(2);
            } else if (input.equals("/.")) {
                input = "/";
            } else if (input.startsWith("/../")) {
                input = input.substring(3);
                removeLastSegment(output);
            } else if (input.equals("/..")) {
                input = "/";
                removeLastSegment(output);
            } else if (input.equals(".") || input.equals("..")) {
                input = "";
            } else {
                int next = input.indexOf('/', input.startsWith("/") ? 1 : 0);
                if (next == -1) {
                    output.append(input);
                    input = "";
                } else {
                    output.append(input, 0, next);
                    input = input.substring(next);
                }
            }
        }
        return output.toString();
    }

    private static void removeLastSegment(StringBuilder output) {
        int slash = output.lastIndexOf("/");
        output.setLength(Math.max(slash, 0));
    }

    private static String encodePath(String path) throws URISyntaxException {
        if (path == null || path.isEmpty()) {
            return "";
        }
        String encoded = new URI(null, null, "./" + path, null, null).getRawPath();
        return encoded.substring(2);
    }

    private static URI build(URI base, String rawPath, String rawQuery) throws URISyntaxException {
        StringBuilder sb = new StringBuilder(base.getScheme()).append(':');
        if (base.getRawAuthority() != null) {
            sb.append("//").append(base.getRawAuthority());
        }
        if (rawPath != null) {
            sb.append(rawPath);
        }
        if (rawQuery != null) {
            sb.append('?').append(rawQuery);
        }
        return new URI(sb.toString());
    }
}
