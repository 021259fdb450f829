package io.sylabs.scs.keyclient;

/**
 * Thrown when a base URL uses a scheme other than {@code http}, {@code https}, {@code hkp} or {@code hkps}.
 */
public final class UnsupportedSchemeException extends KeyServiceException {

    private static final long serialVersionUID = 1L;

    private final String scheme;

    public UnsupportedSchemeException(String scheme) {
        super("unsupported protocol scheme \"" + (scheme == null ? "" : scheme) + "\"");
        this.scheme = scheme == null ? "" : scheme;
    }

    /**
     * @return the offending scheme, or an empty string when the URL had none.
     */
    public String getScheme() {
        return scheme;
    }
}
