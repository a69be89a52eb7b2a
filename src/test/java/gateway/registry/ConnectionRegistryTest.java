package gateway.registry;

import gateway.FakeTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

public class ConnectionRegistryTest {

    private ConnectionRegistry registry;

    @BeforeEach
    public void setup() {
        registry = new ConnectionRegistry();
    }

    @Test
    public void testNewConnectionRegisters() {
        FakeTransport t = new FakeTransport();
        Connection c = registry.newConnection(t, "c1", "room/+").join();

        assertEquals(1, registry.size());
        assertSame(c, registry.get("c1"));
        assertTrue(registry.isRegistered(c));
        assertEquals("room/+", c.getPattern());
        assertTrue(c.isOpen());
        assertTrue(t.isOpen());
    }

    @Test
    public void testRemoveConnectionClosesOnce() {
        FakeTransport t = new FakeTransport();
        Connection c = registry.newConnection(t, "c1", "room/+").join();

        registry.removeConnection(c, CloseCode.NORMAL_CLOSURE).join();

        assertTrue(registry.isEmpty());
        assertEquals(1, t.closeCalls.get());
        assertEquals(CloseCode.NORMAL_CLOSURE, t.lastCloseCode);
        assertEquals(Connection.State.CLOSED, c.getState());
    }

    @Test
    public void testRawRemoveNeverCloses() {
        FakeTransport t = new FakeTransport();
        Connection c = registry.newConnection(t, "c1", null).join();
        t.peerDisconnect();

        registry.rawRemoveConnection(c);

        assertTrue(registry.isEmpty());
        assertEquals(0, t.closeCalls.get());
    }

    @Test
    public void testFailedHandshakeIsNotRegistered() {
        FakeTransport t = new FakeTransport();
        t.rejectHandshake = true;

        CompletableFuture<Connection> f = registry.newConnection(t, "c1", "a/#");
        CompletionException e = assertThrows(CompletionException.class, f::join);
        assertTrue(e.getCause() instanceof HandshakeException);
        assertTrue(registry.isEmpty());
    }

    @Test
    public void testAcceptThrowingIsAHandshakeFailure() {
        Transport exploding = new FakeTransport() {
            @Override
            public CompletableFuture<Void> accept() {
                throw new IllegalArgumentException("bad upgrade");
            }
        };
        CompletionException e = assertThrows(CompletionException.class,
                () -> registry.newConnection(exploding, "c1", null).join());
        assertTrue(e.getCause() instanceof HandshakeException);
        assertEquals("bad upgrade", e.getCause().getCause().getMessage());
        assertTrue(registry.isEmpty());
    }

    @Test
    public void testDuplicateIdRejected() {
        registry.newConnection(new FakeTransport(), "c1", null).join();
        assertThrows(IllegalStateException.class, () -> registry.newConnection(new FakeTransport(), "c1", null));
        assertEquals(1, registry.size());
    }

    @Test
    public void testDoubleRemovalIsCallerError() {
        FakeTransport t = new FakeTransport();
        Connection c = registry.newConnection(t, "c1", null).join();
        registry.removeConnection(c, CloseCode.NORMAL_CLOSURE).join();

        assertThrows(IllegalStateException.class, () -> registry.rawRemoveConnection(c));
        assertThrows(IllegalStateException.class, () -> registry.disconnect(c));
        assertEquals(1, t.closeCalls.get());
    }

    @Test
    public void testGracefulCloseOnDeadTransport() {
        FakeTransport t = new FakeTransport();
        Connection c = registry.newConnection(t, "c1", null).join();
        t.peerDisconnect();

        TransportClosedException e = assertThrows(TransportClosedException.class,
                () -> registry.removeConnection(c, CloseCode.NORMAL_CLOSURE));
        assertEquals("c1", e.getConnectionId());
        // Still registered, the raw path takes over
        assertEquals(1, registry.size());
        assertTrue(c.isOpen());

        registry.rawRemoveConnection(c);
        assertTrue(registry.isEmpty());
        assertEquals(0, t.closeCalls.get());
    }

    @Test
    public void testRemovingUnregisteredConnectionLeavesItUsable() {
        FakeTransport t = new FakeTransport();
        Connection c = new Connection(t, "c1", "room/+");

        assertThrows(IllegalStateException.class, () -> registry.rawRemoveConnection(c));
        assertThrows(IllegalStateException.class, () -> registry.removeConnection(c, CloseCode.NORMAL_CLOSURE));
        assertEquals(Connection.State.OPEN, c.getState());
        assertEquals(0, t.closeCalls.get());

        assertSame(c, registry.connect(c).join());
        assertTrue(registry.isRegistered(c));
    }

    @Test
    public void testClosedConnectionIsNeverReAdded() {
        Connection c = registry.newConnection(new FakeTransport(), "c1", null).join();
        registry.rawRemoveConnection(c);

        assertThrows(IllegalStateException.class, () -> registry.connect(c));
        assertTrue(registry.isEmpty());
    }

    @Test
    public void testSnapshotKeepsInsertionOrder() {
        registry.newConnection(new FakeTransport(), "b", null).join();
        registry.newConnection(new FakeTransport(), "a", null).join();
        registry.newConnection(new FakeTransport(), "c", null).join();
        Connection a = registry.get("a");
        registry.rawRemoveConnection(a);
        registry.newConnection(new FakeTransport(), "a", null).join();

        List<Connection> snapshot = registry.snapshot();
        assertEquals("b", snapshot.get(0).getId());
        assertEquals("c", snapshot.get(1).getId());
        assertEquals("a", snapshot.get(2).getId());
    }

    @Test
    public void testEmptyPatternMeansBroadcastOnly() {
        Connection c = registry.newConnection(new FakeTransport(), "c1", "").join();
        assertFalse(c.hasPattern());
        assertNull(c.getPattern());
    }
}
