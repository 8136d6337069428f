package io.livedoc.domain.session;

/**
 * Why a session left the ACTIVE state, with the WebSocket close code sent to the client.
 */
public enum CloseReason {
    CLIENT_CLOSED(1000, true),
    SERVER_SHUTDOWN(1001, true),
    PROTOCOL_VIOLATION(1002, true),
    HANDSHAKE_FAILURE(1008, false),
    SEND_FAILURE(1011, false),
    TRANSPORT_FAILURE(1011, false),
    SUBSCRIBER_DISCONNECTED(4000, false),
    IDLE_TIMEOUT(4001, true);

    private final int closeCode;
    private final boolean flush;

    CloseReason(int closeCode, boolean flush) {
        this.closeCode = closeCode;
        this.flush = flush;
    }

    public int closeCode() {
        return closeCode;
    }

    /**
     * Whether buffered events are flushed before the transport is closed.
     */
    public boolean flushBeforeClose() {
        return flush;
    }

    /**
     * Wire name sent in the closing frame, e.g. {@code SubscriberDisconnected}.
     */
    public String wireName() {
        StringBuilder sb = new StringBuilder();
        for (String part : name().split("_")) {
            sb.append(part.charAt(0)).append(part.substring(1).toLowerCase());
        }
        return sb.toString();
    }
}
