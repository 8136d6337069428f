package io.livedoc.transport.ws;

/**
 * Outbound side of one client connection.
 */
public interface FrameSink {

    /**
     * Queue a text frame. Exactly one callback method is invoked once the frame is written or has failed.
     */
    void send(String text, SendCallback callback);

    /**
     * Send a close frame with the given code and reason, then release the connection.
     */
    void close(int code, String reason);

    boolean isOpen();

    String remoteAddress();

    interface SendCallback {
        void onComplete();

        void onError(Throwable error);
    }
}
