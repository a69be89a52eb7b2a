package gateway.broker;

import gateway.Config;
import gateway.FakeTransport;
import gateway.Gateway;
import gateway.GatewayException;
import gateway.Lifecycle;
import gateway.registry.CloseCode;
import gateway.registry.ConnectionRegistry;
import gateway.routing.DeliveryReport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static gateway.TestUtil.eventually;
import static org.junit.jupiter.api.Assertions.*;

public class BrokerBridgeTest {

    private final LocalBroker broker = new LocalBroker();
    private final List<BrokerBridge> bridges = new ArrayList<>();

    @AfterEach
    public void teardown() {
        for (BrokerBridge bridge : bridges) bridge.shutdown();
    }

    private BrokerBridge bridge(String channel, RoutingMode mode, int threads) {
        Config config = new Config();
        config.broker.channel = channel;
        config.routing = mode;
        config.delivery.threads = threads;
        config.delivery.sendTimeoutMillis = 60_000;
        BrokerBridge bridge = Gateway.assemble(config, broker.newClient());
        bridges.add(bridge);
        return bridge;
    }

    private FakeTransport connect(BrokerBridge bridge, String id, String pattern) {
        FakeTransport t = new FakeTransport();
        bridge.getRegistry().newConnection(t, id, pattern).join();
        return t;
    }

    @Test
    public void testStartupSubscribesAndRunsLoop() {
        BrokerBridge bridge = bridge("chat/lobby", RoutingMode.CHANNEL, 2);
        bridge.startup();

        assertEquals(1, broker.getNumSub("chat/lobby"));
        assertTrue(bridge.isRunning());
        assertThrows(IllegalStateException.class, bridge::startup);
    }

    @Test
    public void testChannelNameIsTheTopic() throws Exception {
        BrokerBridge bridge = bridge("chat/lobby", RoutingMode.CHANNEL, 2);
        FakeTransport chat = connect(bridge, "chat", "chat/+");
        FakeTransport news = connect(bridge, "news", "news/#");
        bridge.startup();

        broker.publish("chat/lobby", "hello");

        eventually(() -> !chat.sent.isEmpty(), "delivery to chat/+");
        Thread.sleep(50);
        // The subscribe ack is never forwarded
        assertEquals(Collections.singletonList("hello"), chat.sent);
        assertTrue(news.sent.isEmpty());
    }

    @Test
    public void testBrokerOrderIsKept() throws Exception {
        BrokerBridge bridge = bridge("t", RoutingMode.CHANNEL, 1);
        FakeTransport t = connect(bridge, "c1", "t");
        bridge.startup();

        for (int i = 0; i < 20; i++) broker.publish("t", "m" + i);

        eventually(() -> t.sent.size() == 20, "20 deliveries");
        for (int i = 0; i < 20; i++) assertEquals("m" + i, t.sent.get(i));
    }

    @Test
    public void testOwnPublishEchoesBack() throws Exception {
        BrokerBridge bridge = bridge("room", RoutingMode.CHANNEL, 2);
        FakeTransport t = connect(bridge, "c1", "room");
        bridge.startup();

        bridge.publish("ping").join();

        eventually(() -> t.sent.contains("ping"), "echo of own publish");
    }

    @Test
    public void testGatewaysShareStateThroughBroker() throws Exception {
        BrokerBridge a = bridge("shared", RoutingMode.CHANNEL, 2);
        BrokerBridge b = bridge("shared", RoutingMode.CHANNEL, 2);
        FakeTransport onA = connect(a, "a1", "shared");
        FakeTransport onB = connect(b, "b1", "#");
        a.startup();
        b.startup();

        a.publish("from-a").join();

        eventually(() -> onB.sent.contains("from-a"), "delivery on the other gateway");
        eventually(() -> onA.sent.contains("from-a"), "delivery on the publishing gateway");
    }

    @Test
    public void testEnvelopeRouting() throws Exception {
        BrokerBridge bridge = bridge("bus", RoutingMode.ENVELOPE, 2);
        FakeTransport room = connect(bridge, "room", "room/+");
        FakeTransport other = connect(bridge, "other", "other/#");
        FakeTransport plain = connect(bridge, "plain", null);
        bridge.startup();

        broker.publish("bus", "{\"type\":\"send\",\"topic\":\"room/1\",\"text\":\"hi\"}");
        broker.publish("bus", "not json at all");
        broker.publish("bus", "{\"type\":\"broadcast\",\"topic\":null,\"text\":\"all\"}");

        eventually(() -> plain.sent.size() == 1, "broadcast reaches patternless connection");
        eventually(() -> room.sent.size() == 2, "send and broadcast reach room/+");
        assertEquals("{\"text\":\"hi\"}", room.sent.get(0));
        assertEquals("{\"text\":\"all\"}", room.sent.get(1));
        assertEquals(Collections.singletonList("{\"text\":\"all\"}"), other.sent);
    }

    @Test
    public void testShutdownCancelsDeliveriesAndClosesConnections() throws Exception {
        BrokerBridge bridge = bridge("t", RoutingMode.CHANNEL, 1);
        ConnectionRegistry registry = bridge.getRegistry();
        FakeTransport slow1 = FakeTransport.stalled();
        FakeTransport slow2 = FakeTransport.stalled();
        FakeTransport idle = new FakeTransport();
        registry.newConnection(slow1, "s1", "t/#").join();
        registry.newConnection(slow2, "s2", "t/#").join();
        registry.newConnection(idle, "idle", "elsewhere").join();
        bridge.startup();

        CompletableFuture<DeliveryReport> first = bridge.getBroadcaster().send("t/1", "a");
        CompletableFuture<DeliveryReport> second = bridge.getBroadcaster().send("t/2", "b");

        bridge.shutdown();

        DeliveryReport r1 = first.get(5, TimeUnit.SECONDS);
        DeliveryReport r2 = second.get(5, TimeUnit.SECONDS);
        assertEquals(2, r1.getCancelled().size());
        assertEquals(2, r2.getCancelled().size());

        for (FakeTransport t : new FakeTransport[] { slow1, slow2, idle }) {
            assertEquals(1, t.closeCalls.get());
            assertEquals(CloseCode.SERVICE_RESTART, t.lastCloseCode);
        }
        assertTrue(registry.isEmpty());
        assertEquals(Lifecycle.State.STOPPED, bridge.getLifecycle().get());
        assertFalse(bridge.isRunning());
        assertEquals(0, broker.getNumSub("t"));
    }

    @Test
    public void testShutdownSkipsCloseForDeadTransports() {
        BrokerBridge bridge = bridge("t", RoutingMode.CHANNEL, 1);
        FakeTransport alive = connect(bridge, "alive", null);
        FakeTransport dead = connect(bridge, "dead", null);
        dead.peerDisconnect();

        bridge.shutdown();

        assertEquals(1, alive.closeCalls.get());
        assertEquals(0, dead.closeCalls.get());
        assertTrue(bridge.getRegistry().isEmpty());
    }

    @Test
    public void testNothingMovesAfterShutdown() throws Exception {
        BrokerBridge bridge = bridge("t", RoutingMode.CHANNEL, 1);
        bridge.startup();
        bridge.shutdown();
        bridge.shutdown();

        CompletionException e = assertThrows(CompletionException.class, () -> bridge.publish("late").join());
        assertTrue(e.getCause() instanceof GatewayException);
        assertEquals(0, bridge.getBroadcaster().broadcast("late").get(1, TimeUnit.SECONDS).attempted());
        assertThrows(IllegalStateException.class, bridge::startup);
    }
}
