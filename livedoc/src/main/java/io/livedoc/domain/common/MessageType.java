package io.livedoc.domain.common;

/**
 * Types of frames the socket service sends to clients.
 */
public enum MessageType {
    ACK,
    EVENT,
    HEARTBEAT,
    ERROR,
    CLOSING;

    public String wireName() {
        return name().toLowerCase();
    }
}
