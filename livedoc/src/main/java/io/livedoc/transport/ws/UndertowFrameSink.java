package io.livedoc.transport.ws;

import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * {@link FrameSink} over an Undertow WebSocket channel. Sends are asynchronous and never block the caller.
 */
final class UndertowFrameSink implements FrameSink {
    private static final Logger log = LoggerFactory.getLogger(UndertowFrameSink.class);

    private final WebSocketChannel channel;

    UndertowFrameSink(WebSocketChannel channel) {
        this.channel = channel;
    }

    @Override
    public void send(String text, SendCallback callback) {
        if (!channel.isOpen()) {
            callback.onError(new IOException("channel closed"));
            return;
        }
        WebSockets.sendText(text, channel, new WebSocketCallback<Void>() {
            @Override
            public void complete(WebSocketChannel ch, Void context) {
                callback.onComplete();
            }

            @Override
            public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                callback.onError(throwable);
            }
        });
    }

    @Override
    public void close(int code, String reason) {
        if (!channel.isOpen()) {
            return;
        }
        WebSockets.sendClose(code, reason, channel, new WebSocketCallback<Void>() {
            @Override
            public void complete(WebSocketChannel ch, Void context) {
                closeQuietly();
            }

            @Override
            public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                log.debug("[SOCKET] Close frame to {} failed: {}", remoteAddress(), throwable.toString());
                closeQuietly();
            }
        });
    }

    private void closeQuietly() {
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("[SOCKET] Channel close failed for {}: {}", remoteAddress(), e.toString());
        }
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen() && !channel.isCloseFrameSent();
    }

    @Override
    public String remoteAddress() {
        return String.valueOf(channel.getSourceAddress());
    }
}
