package gateway.network;

import gateway.broker.BrokerBridge;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;

public class GatewayInitializer extends ChannelInitializer<SocketChannel> {

    private final BrokerBridge bridge;
    private final String path;
    private final int maxFrameSize;

    public GatewayInitializer(BrokerBridge bridge, String path, int maxFrameSize) {
        this.bridge = bridge;
        this.path = path;
        this.maxFrameSize = maxFrameSize;
    }

    @Override
    public void initChannel(SocketChannel ch) throws Exception {
        // The handshake swaps the HTTP codec for WebSocket frame codecs
        ch.pipeline().addLast(new HttpServerCodec());
        ch.pipeline().addLast(new HttpObjectAggregator(maxFrameSize));
        ch.pipeline().addLast(new GatewayHandler(bridge, path, maxFrameSize));
    }
}
