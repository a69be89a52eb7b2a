package gateway;

import gateway.broker.BrokerBridge;
import gateway.broker.BrokerClient;
import gateway.broker.LocalBroker;
import gateway.broker.RespBrokerClient;
import gateway.network.GatewayInitializer;
import gateway.registry.ConnectionRegistry;
import gateway.routing.Broadcaster;
import gateway.routing.DeliveryExecutor;
import gateway.utils.Log;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;

import java.util.concurrent.TimeUnit;

/**
 * Project: topic gateway
 * WebSocket front end multiplexing client connections onto one shared broker channel.
 */
public class Gateway {

    private final Config config;
    private final BrokerBridge bridge;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public Gateway(Config config, BrokerClient client) {
        this.config = config;
        this.bridge = assemble(config, client);
    }

    /**
     * Wires registry, delivery pool, broadcaster and bridge around one broker client.
     */
    public static BrokerBridge assemble(Config config, BrokerClient client) {
        Lifecycle lifecycle = new Lifecycle();
        ConnectionRegistry registry = new ConnectionRegistry();
        DeliveryExecutor executor = new DeliveryExecutor(config.delivery.threads, config.delivery.queueCapacity,
                config.delivery.overflowPolicy, config.delivery.sendTimeoutMillis);
        Broadcaster broadcaster = new Broadcaster(registry, executor, lifecycle);
        return new BrokerBridge(client, config.broker.channel, registry, broadcaster, executor, lifecycle, config.routing);
    }

    public static BrokerClient connectBroker(Config config) throws InterruptedException {
        if ("resp".equalsIgnoreCase(config.broker.type)) {
            return RespBrokerClient.connect(config.broker.host, config.broker.port, config.broker.password, config.broker.timeoutMillis);
        }
        Log.info("Using in-process broker; messages stay inside this JVM");
        return new LocalBroker().newClient();
    }

    /**
     * Subscribes to the broker and binds the WebSocket listener.
     */
    public void start() throws InterruptedException {
        bridge.startup();

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
         .channel(NioServerSocketChannel.class)
         .childHandler(new GatewayInitializer(bridge, config.path, config.maxFrameSize));

        ChannelFuture f = b.bind(config.port).sync();
        serverChannel = f.channel();
        Log.info("🔥 Ready on port " + config.port + ", path " + config.path + ", channel '" + bridge.getChannel() + "' (" + bridge.getRoutingMode() + ")");
    }

    /**
     * Stops accepting, shuts the bridge down (closing every connection) and releases the event loops.
     */
    public void stop() {
        if (serverChannel != null) serverChannel.close().syncUninterruptibly();
        bridge.shutdown();
        if (bossGroup != null) bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        if (workerGroup != null) workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }

    public void awaitTermination() throws InterruptedException {
        if (serverChannel != null) serverChannel.closeFuture().sync();
    }

    public BrokerBridge getBridge() {
        return bridge;
    }

    public static void main(String[] args) throws Exception {
        Config config = Config.load(args.length > 0 ? args[0] : "gateway.yaml");
        Log.setDebug(config.debug);
        Log.info("\n--- GATEWAY v" + config.version + " ---\n");

        Gateway gateway = new Gateway(config, connectBroker(config));
        gateway.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            Log.info("\n🛑 Shutting down...");
            gateway.stop();
        }));

        gateway.awaitTermination();
    }
}
