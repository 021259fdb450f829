package io.sylabs.scs.keyclient;

/**
 * Thrown when the configured (or default) base URL cannot be parsed as a URI.
 */
public final class InvalidBaseUrlException extends KeyServiceException {

    private static final long serialVersionUID = 1L;

    private final String baseUrl;

    public InvalidBaseUrlException(String baseUrl, Throwable cause) {
        super("invalid base URL \"" + baseUrl + "\": " + cause.getMessage(), cause);
        this.baseUrl = baseUrl;
    }

    /**
     * @return the base URL string that failed to parse.
     */
    public String getBaseUrl() {
        return baseUrl;
    }
}
