package latch.core.model.common;

import java.util.Optional;

/**
 * Status vocabulary for transports built on top of the session core.
 *
 * <p>Negative protocol outcomes map to a specific code: a rejected credential
 * is {@link #UNAUTHORIZED}, an unknown session id is {@link #NOT_FOUND}, and a
 * missing permission is {@link #FORBIDDEN}.
 */
public enum StatusCode {
    SUCCESS(200, "OK"),
    UNAUTHORIZED(401, "Unauthorized"),
    FORBIDDEN(403, "Forbidden"),
    NOT_FOUND(404, "Not Found");

    private final int code;
    private final String message;

    StatusCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int code() {
        return code;
    }

    public String message() {
        return message;
    }

    public boolean isSuccess() {
        return this == SUCCESS;
    }

    /**
     * Look up a status by its numeric code.
     *
     * @param code numeric status code
     * @return the matching status, or empty for codes outside the vocabulary
     */
    public static Optional<StatusCode> fromCode(int code) {
        for (StatusCode status : values()) {
            if (status.code == code) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return code + " " + message;
    }
}
