package gateway.routing;

import gateway.FakeTransport;
import gateway.Lifecycle;
import gateway.registry.ConnectionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class BroadcasterTest {

    private ConnectionRegistry registry;
    private DeliveryExecutor executor;
    private Lifecycle lifecycle;
    private Broadcaster broadcaster;

    @BeforeEach
    public void setup() {
        registry = new ConnectionRegistry();
        executor = new DeliveryExecutor(4, 64, OverflowPolicy.BLOCK, 300);
        lifecycle = new Lifecycle();
        broadcaster = new Broadcaster(registry, executor, lifecycle);
    }

    @AfterEach
    public void teardown() {
        executor.shutdown();
    }

    private FakeTransport connect(String id, String pattern) {
        FakeTransport t = new FakeTransport();
        registry.newConnection(t, id, pattern).join();
        return t;
    }

    @Test
    public void testSendReachesOnlyMatchingPatterns() throws Exception {
        FakeTransport room = connect("room", "room/+");
        FakeTransport all = connect("all", "#");
        FakeTransport other = connect("other", "other/#");
        FakeTransport none = connect("none", null);

        DeliveryReport report = broadcaster.send("room/42", "msg").get(5, TimeUnit.SECONDS);

        assertEquals(Arrays.asList("room", "all"), report.getDelivered());
        assertTrue(report.isClean());
        assertEquals(Collections.singletonList("msg"), room.sent);
        assertEquals(Collections.singletonList("msg"), all.sent);
        assertTrue(other.sent.isEmpty());
        assertTrue(none.sent.isEmpty());
    }

    @Test
    public void testBroadcastIgnoresPatterns() throws Exception {
        FakeTransport room = connect("room", "room/+");
        FakeTransport none = connect("none", null);

        DeliveryReport report = broadcaster.broadcast("hi").get(5, TimeUnit.SECONDS);

        assertEquals(2, report.getDelivered().size());
        assertEquals(Collections.singletonList("hi"), room.sent);
        assertEquals(Collections.singletonList("hi"), none.sent);
    }

    @Test
    public void testOneFailingConnectionDoesNotStopOthers() throws Exception {
        FakeTransport first = connect("first", "t/#");
        registry.newConnection(FakeTransport.failing(), "broken", "t/#").join();
        registry.newConnection(FakeTransport.stalled(), "stuck", "t/#").join();
        FakeTransport last = connect("last", "t/#");

        DeliveryReport report = broadcaster.send("t/1", "payload").get(5, TimeUnit.SECONDS);

        assertEquals(Arrays.asList("first", "last"), report.getDelivered());
        assertEquals(2, report.getFailed().size());
        assertTrue(report.getFailed().containsKey("broken"));
        assertTrue(report.getFailed().containsKey("stuck"));
        assertEquals(1, first.sent.size());
        assertEquals(1, last.sent.size());
    }

    @Test
    public void testNoMatchGivesEmptyReport() throws Exception {
        connect("a", "a/#");
        DeliveryReport report = broadcaster.send("b/1", "x").get(1, TimeUnit.SECONDS);
        assertEquals(0, report.attempted());
    }

    @Test
    public void testAttemptsFollowRegistryOrder() throws Exception {
        DeliveryExecutor single = new DeliveryExecutor(1, 64, OverflowPolicy.BLOCK, 1000);
        Broadcaster ordered = new Broadcaster(registry, single, lifecycle);
        List<String> order = new CopyOnWriteArrayList<>();
        for (String id : Arrays.asList("c3", "c1", "c2")) {
            registry.newConnection(new FakeTransport() {
                @Override
                public CompletableFuture<Void> send(String payload) {
                    order.add(id);
                    return super.send(payload);
                }
            }, id, "x").join();
        }

        ordered.send("x", "m").get(5, TimeUnit.SECONDS);
        single.shutdown();

        assertEquals(Arrays.asList("c3", "c1", "c2"), order);
    }

    @Test
    public void testNothingScheduledOnceShutdownStarted() throws Exception {
        FakeTransport t = connect("c1", "#");
        lifecycle.beginShutdown();

        DeliveryReport sent = broadcaster.send("a", "x").get(1, TimeUnit.SECONDS);
        DeliveryReport broadcast = broadcaster.broadcast("y").get(1, TimeUnit.SECONDS);

        assertEquals(0, sent.attempted());
        assertEquals(0, broadcast.attempted());
        assertTrue(t.sent.isEmpty());
        assertEquals(0, executor.inFlightCount());
    }
}
