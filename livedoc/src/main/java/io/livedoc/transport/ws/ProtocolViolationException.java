package io.livedoc.transport.ws;

/**
 * Inbound frame that breaks the socket protocol (malformed JSON, unknown action, missing or invalid resource).
 * The session answers with an error frame and closes.
 */
public class ProtocolViolationException extends RuntimeException {

    private final String sessionId;

    public ProtocolViolationException(String sessionId, String message) {
        super(String.format("[%s] %s", sessionId, message));
        this.sessionId = sessionId;
    }

    public ProtocolViolationException(String sessionId, String message, Throwable cause) {
        super(String.format("[%s] %s", sessionId, message), cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * Message without the session prefix, as sent to the client.
     */
    public String clientMessage() {
        String prefix = "[" + sessionId + "] ";
        String msg = getMessage();
        return msg.startsWith(prefix) ? msg.substring(prefix.length()) : msg;
    }
}
