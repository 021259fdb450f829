package io.sylabs.scs.keyclient;

/**
 * Thrown when an outgoing request cannot be assembled from the resolved URL, method, headers and body.
 */
public final class RequestConstructionException extends KeyServiceException {

    private static final long serialVersionUID = 1L;

    public RequestConstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
