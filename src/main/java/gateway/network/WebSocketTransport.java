package gateway.network;

import gateway.registry.HandshakeException;
import gateway.registry.Transport;
import gateway.registry.TransportClosedException;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshakerFactory;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link Transport} over a Netty channel that is still speaking HTTP. {@link #accept()} runs the
 * WebSocket opening handshake on the upgrade request; afterwards each {@link #send} is one text frame.
 */
public class WebSocketTransport implements Transport {

    private final Channel channel;
    private final FullHttpRequest request;
    private final String webSocketUrl;
    private final int maxFrameSize;
    private final AtomicBoolean released = new AtomicBoolean(false);

    private volatile WebSocketServerHandshaker handshaker;
    private volatile boolean open = false;

    public WebSocketTransport(Channel channel, FullHttpRequest request, String webSocketUrl, int maxFrameSize) {
        this.channel = channel;
        // Held until the handshake has consumed it
        this.request = request.retain();
        this.webSocketUrl = webSocketUrl;
        this.maxFrameSize = maxFrameSize;
    }

    @Override
    public CompletableFuture<Void> accept() {
        CompletableFuture<Void> accepted = new CompletableFuture<>();
        try {
            WebSocketServerHandshakerFactory factory = new WebSocketServerHandshakerFactory(webSocketUrl, null, true, maxFrameSize);
            handshaker = factory.newHandshaker(request);
            if (handshaker == null) {
                WebSocketServerHandshakerFactory.sendUnsupportedVersionResponse(channel).addListener(ChannelFutureListener.CLOSE);
                accepted.completeExceptionally(new HandshakeException("Unsupported WebSocket version"));
                return accepted;
            }
            handshaker.handshake(channel, request).addListener((ChannelFutureListener) f -> {
                if (f.isSuccess()) {
                    open = true;
                    accepted.complete(null);
                } else {
                    accepted.completeExceptionally(new HandshakeException("WebSocket handshake failed", f.cause()));
                    channel.close();
                }
            });
        } catch (RuntimeException e) {
            reject(HttpResponseStatus.BAD_REQUEST, e.getMessage());
            accepted.completeExceptionally(new HandshakeException("Not a WebSocket handshake: " + e.getMessage(), e));
        } finally {
            release();
        }
        return accepted;
    }

    @Override
    public CompletableFuture<Void> close(int code) {
        if (!open) {
            CompletableFuture<Void> failed = new CompletableFuture<>();
            failed.completeExceptionally(new TransportClosedException(String.valueOf(channel.id())));
            return failed;
        }
        open = false;
        // Writes the close frame, then closes the channel
        return toCompletable(handshaker.close(channel, new CloseWebSocketFrame(code, null)));
    }

    @Override
    public CompletableFuture<Void> send(String payload) {
        if (!isOpen()) {
            CompletableFuture<Void> failed = new CompletableFuture<>();
            failed.completeExceptionally(new TransportClosedException(String.valueOf(channel.id())));
            return failed;
        }
        return toCompletable(channel.writeAndFlush(new TextWebSocketFrame(payload)));
    }

    @Override
    public boolean isOpen() {
        return open && channel.isActive();
    }

    /**
     * The peer closed first or the channel dropped; the transport must not be closed again.
     */
    public void markPeerClosed() {
        open = false;
    }

    /**
     * Answers the upgrade request with a plain HTTP error and closes the channel.
     */
    public void reject(HttpResponseStatus status, String reason) {
        if (!channel.isActive()) return;
        String body = reason == null ? status.reasonPhrase() : reason;
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status,
                Unpooled.copiedBuffer(body, StandardCharsets.UTF_8));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=UTF-8");
        HttpUtil.setContentLength(response, response.content().readableBytes());
        channel.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }

    public void release() {
        if (released.compareAndSet(false, true)) {
            request.release();
        }
    }

    public Channel getChannel() {
        return channel;
    }

    static CompletableFuture<Void> toCompletable(ChannelFuture future) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        future.addListener(f -> {
            if (f.isSuccess()) result.complete(null);
            else if (f.isCancelled()) result.cancel(false);
            else result.completeExceptionally(f.cause());
        });
        return result;
    }
}
