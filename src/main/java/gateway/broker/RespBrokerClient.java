package gateway.broker;

import gateway.protocol.netty.NettyRespDecoder;
import gateway.protocol.netty.NettyRespEncoder;
import gateway.protocol.netty.RespError;
import gateway.utils.Log;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link BrokerClient} speaking RESP to a Redis compatible server.
 * <p>
 * A subscribed RESP connection can no longer publish, so the client keeps two links: one for
 * PUBLISH (request/reply, replies matched in order) and one for SUBSCRIBE (server push).
 * There is no reconnect; a lost link is logged and publishes fail from then on.
 */
public class RespBrokerClient implements BrokerClient {

    private final EventLoopGroup group;
    private final Channel publisher;
    private final Channel subscriber;
    private final ReplyHandler replies;
    private final BlockingQueue<BrokerMessage> inbox;

    RespBrokerClient(EventLoopGroup group, Channel publisher, ReplyHandler replies, Channel subscriber, BlockingQueue<BrokerMessage> inbox) {
        this.group = group;
        this.publisher = publisher;
        this.replies = replies;
        this.subscriber = subscriber;
        this.inbox = inbox;
    }

    public static RespBrokerClient connect(String host, int port, String password, long timeoutMillis) throws InterruptedException {
        EventLoopGroup group = new NioEventLoopGroup(1);
        try {
            BlockingQueue<BrokerMessage> inbox = new LinkedBlockingQueue<>();
            ReplyHandler publishReplies = new ReplyHandler();
            ReplyHandler subscribeReplies = new ReplyHandler();

            Channel publisher = open(group, host, port, timeoutMillis, publishReplies);
            Channel subscriber = open(group, host, port, timeoutMillis, subscribeReplies, new PushHandler(inbox));

            if (password != null && !password.isEmpty()) {
                await(publishReplies.command(publisher, "AUTH", password), timeoutMillis, "AUTH");
                await(subscribeReplies.command(subscriber, "AUTH", password), timeoutMillis, "AUTH");
            }
            Log.info("Connected to broker at " + host + ":" + port);
            return new RespBrokerClient(group, publisher, publishReplies, subscriber, inbox);
        } catch (RuntimeException | InterruptedException e) {
            group.shutdownGracefully();
            throw e;
        }
    }

    private static Channel open(EventLoopGroup group, String host, int port, long timeoutMillis, ChannelHandler... handlers) throws InterruptedException {
        Bootstrap b = new Bootstrap();
        b.group(group)
         .channel(NioSocketChannel.class)
         .option(ChannelOption.TCP_NODELAY, true)
         .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeoutMillis)
         .handler(new ChannelInitializer<SocketChannel>() {
             @Override
             public void initChannel(SocketChannel ch) throws Exception {
                 ch.pipeline().addLast(new NettyRespDecoder());
                 ch.pipeline().addLast(new NettyRespEncoder());
                 ch.pipeline().addLast(handlers);
             }
         });
        ChannelFuture f = b.connect(host, port).await();
        if (!f.isSuccess()) {
            throw new BrokerException("Cannot connect to broker at " + host + ":" + port, f.cause());
        }
        return f.channel();
    }

    private static void await(CompletableFuture<Object> reply, long timeoutMillis, String what) throws InterruptedException {
        try {
            reply.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new BrokerException(what + " failed: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new BrokerException(what + " timed out after " + timeoutMillis + " ms");
        }
    }

    @Override
    public CompletableFuture<Void> publish(String channel, String payload) {
        return replies.command(publisher, "PUBLISH", channel, payload).thenApply(ignored -> null);
    }

    @Override
    public CompletableFuture<Void> subscribe(String channel) {
        // The acknowledgement arrives on the push link as a meta message
        CompletableFuture<Void> written = new CompletableFuture<>();
        subscriber.writeAndFlush(Arrays.asList("SUBSCRIBE", channel)).addListener(f -> {
            if (f.isSuccess()) written.complete(null);
            else written.completeExceptionally(new BrokerException("SUBSCRIBE " + channel + " failed", f.cause()));
        });
        return written;
    }

    @Override
    public BrokerMessage nextMessage() throws InterruptedException {
        return inbox.take();
    }

    @Override
    public void close() {
        publisher.close();
        subscriber.close();
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }

    /**
     * Matches replies to commands in the order the commands were written.
     */
    static class ReplyHandler extends SimpleChannelInboundHandler<Object> {
        private final Deque<CompletableFuture<Object>> pending = new ArrayDeque<>();

        CompletableFuture<Object> command(Channel channel, String... args) {
            CompletableFuture<Object> reply = new CompletableFuture<>();
            synchronized (pending) {
                if (!channel.isActive()) {
                    reply.completeExceptionally(new BrokerException("Broker link is closed"));
                    return reply;
                }
                pending.addLast(reply);
                channel.writeAndFlush(Arrays.asList(args)).addListener(f -> {
                    if (!f.isSuccess()) {
                        synchronized (pending) {
                            pending.remove(reply);
                        }
                        reply.completeExceptionally(new BrokerException(args[0] + " could not be written", f.cause()));
                    }
                });
            }
            return reply;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
            if (msg instanceof List) {
                // Push frames are handled further down the pipeline
                ctx.fireChannelRead(msg);
                return;
            }
            CompletableFuture<Object> reply;
            synchronized (pending) {
                reply = pending.pollFirst();
            }
            if (reply == null) {
                Log.debug("Unsolicited broker reply: " + msg);
                return;
            }
            if (msg instanceof RespError) {
                reply.completeExceptionally(new BrokerException(((RespError) msg).getMessage()));
            } else {
                reply.complete(msg);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            Log.error("Broker link " + ctx.channel().remoteAddress() + " closed");
            synchronized (pending) {
                CompletableFuture<Object> reply;
                while ((reply = pending.pollFirst()) != null) {
                    reply.completeExceptionally(new BrokerException("Broker link closed"));
                }
            }
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            Log.error("Broker link error: " + cause.getMessage());
            ctx.close();
        }
    }

    /**
     * Turns pub/sub push arrays ({@code message}, {@code subscribe}, {@code unsubscribe}) into {@link BrokerMessage}s.
     */
    static class PushHandler extends SimpleChannelInboundHandler<List<Object>> {
        private final BlockingQueue<BrokerMessage> inbox;

        PushHandler(BlockingQueue<BrokerMessage> inbox) {
            this.inbox = inbox;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, List<Object> frame) {
            BrokerMessage message = toMessage(frame);
            if (message == null) {
                Log.warn("Ignoring unexpected push frame from broker (" + frame.size() + " elements)");
                return;
            }
            inbox.add(message);
        }

        static BrokerMessage toMessage(List<Object> frame) {
            if (frame.size() < 2) return null;
            String kind = text(frame.get(0));
            String channel = text(frame.get(1));
            if (kind == null || channel == null) return null;

            switch (kind.toLowerCase()) {
                case "message":
                    return frame.size() == 3 ? BrokerMessage.message(channel, text(frame.get(2))) : null;
                case "subscribe":
                    return BrokerMessage.subscribed(channel);
                case "unsubscribe":
                    return BrokerMessage.unsubscribed(channel);
                default:
                    return null;
            }
        }

        private static String text(Object element) {
            if (element instanceof byte[]) return new String((byte[]) element, StandardCharsets.UTF_8);
            if (element instanceof String) return (String) element;
            return null;
        }
    }
}
