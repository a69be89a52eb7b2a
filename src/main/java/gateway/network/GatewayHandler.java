package gateway.network;

import com.fasterxml.jackson.databind.node.ObjectNode;
import gateway.GatewayException;
import gateway.broker.BrokerBridge;
import gateway.protocol.MessageEnvelope;
import gateway.registry.Connection;
import gateway.registry.ConnectionRegistry;
import gateway.registry.HandshakeException;
import gateway.utils.Log;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.util.ReferenceCountUtil;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletionException;

/**
 * Per-channel handler: turns an HTTP upgrade on the configured path into a registered
 * {@link Connection}, then forwards the client's text frames to the broker.
 * <p>
 * Upgrade query parameters: {@code id} (generated when absent) and {@code topic}, the pattern
 * the connection subscribes to.
 */
public class GatewayHandler extends ChannelInboundHandlerAdapter {

    private final BrokerBridge bridge;
    private final ConnectionRegistry registry;
    private final String path;
    private final int maxFrameSize;

    private WebSocketTransport transport;
    private volatile Connection connection;

    public GatewayHandler(BrokerBridge bridge, String path, int maxFrameSize) {
        this.bridge = bridge;
        this.registry = bridge.getRegistry();
        this.path = path;
        this.maxFrameSize = maxFrameSize;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        try {
            if (msg instanceof FullHttpRequest) {
                handleUpgrade(ctx, (FullHttpRequest) msg);
            } else if (msg instanceof WebSocketFrame) {
                handleFrame(ctx, (WebSocketFrame) msg);
            }
        } finally {
            ReferenceCountUtil.release(msg);
        }
    }

    private void handleUpgrade(ChannelHandlerContext ctx, FullHttpRequest req) {
        transport = new WebSocketTransport(ctx.channel(), req, webSocketUrl(req), maxFrameSize);

        if (!req.decoderResult().isSuccess()) {
            refuse(HttpResponseStatus.BAD_REQUEST, "Malformed request");
            return;
        }
        QueryStringDecoder query = new QueryStringDecoder(req.uri());
        if (!path.equals(query.path())) {
            refuse(HttpResponseStatus.NOT_FOUND, "No WebSocket endpoint at " + query.path());
            return;
        }
        if (!bridge.getLifecycle().isActive()) {
            refuse(HttpResponseStatus.SERVICE_UNAVAILABLE, "Gateway is " + bridge.getLifecycle());
            return;
        }

        String id = param(query, "id");
        if (id == null) id = UUID.randomUUID().toString();
        String pattern = param(query, "topic");
        final String connectionId = id;

        try {
            registry.newConnection(transport, connectionId, pattern).whenComplete((registered, err) -> {
                if (err == null) {
                    connection = registered;
                    Log.info("🔌 Connection " + connectionId + " open"
                            + (registered.hasPattern() ? " on " + registered.getPattern() : " (broadcasts only)")
                            + ", " + registry.size() + " active");
                    return;
                }
                Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
                Log.warn("Connection " + connectionId + " rejected: " + cause.getMessage());
                if (!(cause instanceof HandshakeException)) {
                    // Handshake went through but the connection could not be registered
                    ctx.channel().close();
                }
            });
        } catch (IllegalStateException e) {
            refuse(HttpResponseStatus.CONFLICT, e.getMessage());
        }
    }

    private void handleFrame(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (connection == null) return;

        if (frame instanceof CloseWebSocketFrame) {
            CloseWebSocketFrame close = (CloseWebSocketFrame) frame;
            transport.markPeerClosed();
            ctx.writeAndFlush(new CloseWebSocketFrame(close.statusCode(), close.reasonText()))
               .addListener(ChannelFutureListener.CLOSE);
            removeDeparted();
        } else if (frame instanceof PingWebSocketFrame) {
            ctx.writeAndFlush(new PongWebSocketFrame(frame.content().retain()));
        } else if (frame instanceof TextWebSocketFrame) {
            onClientMessage(((TextWebSocketFrame) frame).text());
        } else if (!(frame instanceof PongWebSocketFrame)) {
            Log.warn("Connection " + connection.getId() + " sent an unsupported " + frame.getClass().getSimpleName());
        }
    }

    /**
     * Validates the client's envelope, re-tags it canonically and publishes it on the broker channel.
     */
    void onClientMessage(String text) {
        String id = connection == null ? "?" : connection.getId();
        ObjectNode tagged;
        try {
            MessageEnvelope.Untagged envelope = MessageEnvelope.untagBrokerMessage(text);
            tagged = MessageEnvelope.tagClientMessage(envelope.getRemainder(), envelope.getTopic());
        } catch (GatewayException e) {
            Log.warn("Dropping message from " + id + ": " + e.getMessage());
            return;
        }
        bridge.publish(tagged.toString()).whenComplete((ignored, err) -> {
            if (err != null) {
                Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
                Log.warn("Publish from " + id + " failed: " + cause.getMessage());
            }
        });
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (transport != null) transport.markPeerClosed();
        removeDeparted();
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Log.warn("Channel " + ctx.channel().remoteAddress() + " failed: " + cause.getMessage());
        ctx.close();
    }

    private void removeDeparted() {
        Connection c = connection;
        if (c == null || !c.isOpen()) return;
        try {
            registry.rawRemoveConnection(c);
            Log.info("Connection " + c.getId() + " left, " + registry.size() + " active");
        } catch (IllegalStateException e) {
            // shutdown got there first
            Log.debug("Connection " + c.getId() + " already removed: " + e.getMessage());
        }
    }

    private void refuse(HttpResponseStatus status, String reason) {
        Log.debug("Refusing upgrade: " + status + " " + reason);
        transport.reject(status, reason);
        transport.release();
    }

    private String webSocketUrl(FullHttpRequest req) {
        String host = req.headers().get(HttpHeaderNames.HOST, "localhost");
        return "ws://" + host + path;
    }

    private static String param(QueryStringDecoder query, String name) {
        List<String> values = query.parameters().get(name);
        if (values == null || values.isEmpty() || values.get(0).isEmpty()) return null;
        return values.get(0);
    }

    Connection getConnection() {
        return connection;
    }
}
