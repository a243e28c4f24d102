package io.github.shangor.peer.transfer.core.service;

import io.github.shangor.peer.transfer.core.model.FileMetadata;
import io.github.shangor.peer.transfer.core.model.TransferDirection;
import io.github.shangor.peer.transfer.core.model.TransferRecord;
import io.github.shangor.peer.transfer.core.util.TransferSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class SessionRegistryTest {

    private final SessionRegistry registry = new SessionRegistry();
    private final InMemoryTransport transport = new InMemoryTransport("local");
    private final ConnectionRegistry connections = new ConnectionRegistry(transport, registry);
    private final ExecutorService verifier = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        transport.close();
        verifier.shutdownNow();
    }

    private ReceiverSession session(String id, String peerId) {
        FileMetadata metadata = new FileMetadata(id, id + ".bin", 100, null, null, false, 0, false);
        TransferRecord record = new TransferRecord(metadata, peerId, "local", TransferDirection.INCOMING);
        return new ReceiverSession(record, metadata, peerId, connections, new TransferListener() {
        }, TransferSettings.defaults(), new ChecksumService(), verifier);
    }

    @Test
    void addAndLookUp() throws CapacityException {
        ReceiverSession session = registry.add(session("t1", "p1"));

        assertSame(session, registry.get("t1"));
        assertTrue(registry.contains("t1"));
        assertEquals(1, registry.all().size());
    }

    @Test
    void duplicateIdIsRefused() throws CapacityException {
        ReceiverSession first = registry.add(session("t1", "p1"));

        CapacityException e = assertThrows(CapacityException.class, () -> registry.add(session("t1", "p2")));

        assertEquals(TransferErrorKind.CAPACITY, e.getKind());
        assertSame(first, registry.get("t1"));
    }

    @Test
    void forPeerFiltersByOwner() throws CapacityException {
        registry.add(session("t1", "p1"));
        registry.add(session("t2", "p2"));
        registry.add(session("t3", "p1"));

        assertEquals(2, registry.forPeer("p1").size());
        assertEquals(1, registry.forPeer("p2").size());
        assertTrue(registry.forPeer("p3").isEmpty());
    }

    @Test
    void removeForgetsSession() throws CapacityException {
        registry.add(session("t1", "p1"));

        assertNotNull(registry.remove("t1"));
        assertNull(registry.remove("t1"));
        assertFalse(registry.contains("t1"));
        assertTrue(registry.all().isEmpty());
    }
}
