package io.livedoc.domain.session;

/**
 * Lifecycle of one socket session.
 *
 * CONNECTING -> ACTIVE -> CLOSING -> CLOSED, or CONNECTING -> CLOSED on a failed handshake.
 */
public enum SessionState {
    CONNECTING,
    ACTIVE,
    CLOSING,
    CLOSED
}
