package latch.core.model.session;

/**
 * Outcome of authenticating a principal and creating a session for it.
 *
 * @param success   true if the credentials were accepted and a session exists
 * @param sessionId the session identifier; empty when rejected
 */
public record IssuanceResult(boolean success, String sessionId) {

    private static final IssuanceResult REJECTED = new IssuanceResult(false, "");

    public IssuanceResult {
        if (sessionId == null) {
            sessionId = "";
        }
        if (success && sessionId.isEmpty()) {
            throw new IllegalArgumentException("A successful issuance requires a session ID");
        }
    }

    public static IssuanceResult issued(String sessionId) {
        return new IssuanceResult(true, sessionId);
    }

    public static IssuanceResult rejected() {
        return REJECTED;
    }
}
