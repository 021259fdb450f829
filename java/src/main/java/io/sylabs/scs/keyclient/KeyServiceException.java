package io.sylabs.scs.keyclient;

/**
 * Base exception thrown by the key service client.
 */
public class KeyServiceException extends Exception {

    private static final long serialVersionUID = 1L;

    public KeyServiceException(String message) {
        super(message);
    }

    public KeyServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
