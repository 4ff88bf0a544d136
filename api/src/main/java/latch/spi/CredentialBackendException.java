package latch.spi;

/**
 * Exception thrown when the credential backend is unreachable or misbehaves.
 *
 * <p>Distinct from a rejected password, which is reported as {@code false}.
 */
public class CredentialBackendException extends RuntimeException {

    public CredentialBackendException(String message) {
        super(message);
    }

    public CredentialBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
