package io.github.shangor.peer.transfer.core.service;

import io.github.shangor.peer.transfer.core.io.ByteArrayFileSource;
import io.github.shangor.peer.transfer.core.model.FileMetadata;
import io.github.shangor.peer.transfer.core.model.PeerInfo;
import io.github.shangor.peer.transfer.core.model.TransferDirection;
import io.github.shangor.peer.transfer.core.model.TransferRecord;
import io.github.shangor.peer.transfer.core.model.TransferStatus;
import io.github.shangor.peer.transfer.core.protocol.FileChunkMessage;
import io.github.shangor.peer.transfer.core.protocol.ProtocolException;
import io.github.shangor.peer.transfer.core.protocol.ProtocolIO;
import io.github.shangor.peer.transfer.core.protocol.ProtocolMessage;
import io.github.shangor.peer.transfer.core.protocol.ProtocolMessageType;
import io.github.shangor.peer.transfer.core.util.TransferSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class FileTransferServiceTest {

    private static final int MIB = 1024 * 1024;
    private static final long TIMEOUT_MS = 20_000;

    @TempDir
    Path tempDir;

    private InMemoryTransport senderTransport;
    private InMemoryTransport receiverTransport;
    private FileTransferService sender;
    private FileTransferService receiver;
    private final List<FileMetadata> offers = new CopyOnWriteArrayList<>();
    private Supplier<String> receiverIds = TransferIdGenerator::randomId;

    @AfterEach
    void tearDown() {
        if (sender != null) {
            sender.close();
            senderTransport.close();
        }
        if (receiver != null) {
            receiver.close();
            receiverTransport.close();
        }
    }

    private TransferSettings settings(boolean fec, double ratio, long maxFileSize) {
        return new TransferSettings(MIB, 256 * 1024, 4 * MIB, false, fec, ratio, 8, false, maxFileSize,
                64L * MIB, tempDir, false);
    }

    private void start(TransferSettings senderSettings, TransferSettings receiverSettings, boolean autoAccept) {
        senderTransport = new InMemoryTransport("alice");
        receiverTransport = new InMemoryTransport("bob");
        sender = new FileTransferService(new PeerInfo("alice", "Alice"), senderTransport, senderSettings);
        receiver = new FileTransferService(new PeerInfo("bob", "Bob"), receiverTransport, receiverSettings,
                receiverIds);
        receiver.addListener(new TransferListener() {
            @Override
            public void onFileRequest(String peerId, FileMetadata metadata, PeerInfo from) {
                offers.add(metadata);
                if (autoAccept) {
                    receiver.acceptFileTransfer(peerId, metadata);
                }
            }
        });
        InMemoryTransport.link(senderTransport, receiverTransport);
    }

    @Test
    void tenMegabytesWithoutFecSendsTenChunks() throws IOException {
        start(settings(false, 0.0, 64L * MIB), settings(false, 0.0, 64L * MIB), true);
        AtomicInteger chunks = new AtomicInteger();
        senderTransport.setFilter(frame -> {
            if (decode(frame).type() == ProtocolMessageType.FILE_CHUNK) {
                chunks.incrementAndGet();
            }
            return true;
        });
        byte[] data = randomBytes(10 * MIB);

        FileMetadata metadata = sender.sendFileRequest("bob", new ByteArrayFileSource("big.bin", null, data));

        assertNotNull(metadata);
        awaitStatus(sender, metadata.getId(), TransferStatus.COMPLETED);
        awaitStatus(receiver, metadata.getId(), TransferStatus.COMPLETED);
        assertEquals(10, chunks.get());
        ReceivedFile received = receiver.getReceivedFile(metadata.getId());
        assertTrue(received.isVerified());
        assertArrayEquals(data, received.readAllBytes());
        assertEquals(sender.getTransfer(metadata.getId()).getChecksum(), received.getChecksum());
    }

    @Test
    void droppedChunkIsRecoveredByParity() throws IOException {
        start(settings(true, 0.2, 64L * MIB), settings(true, 0.2, 64L * MIB), true);
        senderTransport.setFilter(frame -> {
            ProtocolMessage message = decode(frame);
            if (message.type() != ProtocolMessageType.FILE_CHUNK) {
                return true;
            }
            FileChunkMessage chunk = (FileChunkMessage) message;
            return chunk.parity() || chunk.index() != 2;
        });
        byte[] data = randomBytes(5_000_000);

        FileMetadata metadata = sender.sendFileRequest("bob", new ByteArrayFileSource("lossy.bin", null, data));

        assertNotNull(metadata);
        awaitStatus(receiver, metadata.getId(), TransferStatus.COMPLETED);
        assertArrayEquals(data, receiver.getReceivedFile(metadata.getId()).readAllBytes());
        assertEquals(TransferStatus.COMPLETED, sender.getTransfer(metadata.getId()).getStatus());
    }

    @Test
    void twoLostChunksUnderOneParityFailIntegrity() throws IOException {
        start(settings(true, 0.2, 64L * MIB), settings(true, 0.2, 64L * MIB), true);
        senderTransport.setFilter(frame -> {
            ProtocolMessage message = decode(frame);
            if (message.type() != ProtocolMessageType.FILE_CHUNK) {
                return true;
            }
            FileChunkMessage chunk = (FileChunkMessage) message;
            return chunk.parity() || (chunk.index() != 1 && chunk.index() != 3);
        });
        AtomicReference<TransferException> failure = new AtomicReference<>();
        receiver.addListener(new TransferListener() {
            @Override
            public void onTransferFailed(TransferRecord record, TransferException cause) {
                failure.set(cause);
            }
        });

        FileMetadata metadata = sender.sendFileRequest("bob",
                new ByteArrayFileSource("broken.bin", null, randomBytes(5_000_000)));

        assertNotNull(metadata);
        awaitStatus(receiver, metadata.getId(), TransferStatus.INTEGRITY_ERROR);
        await(() -> failure.get() != null, "failure event");
        assertEquals(TransferErrorKind.INTEGRITY, failure.get().getKind());
        ReceivedFile flagged = receiver.getReceivedFile(metadata.getId());
        assertNotNull(flagged);
        assertFalse(flagged.isVerified());
    }

    @Test
    void disconnectMidTransferFailsBothSides() {
        start(settings(false, 0.0, 64L * MIB), settings(false, 0.0, 64L * MIB), true);
        AtomicInteger chunks = new AtomicInteger();
        senderTransport.setFilter(frame -> {
            if (decode(frame).type() == ProtocolMessageType.FILE_CHUNK && chunks.incrementAndGet() == 4) {
                senderTransport.disconnect("bob");
                return false;
            }
            return true;
        });

        FileMetadata metadata = sender.sendFileRequest("bob",
                new ByteArrayFileSource("cut.bin", null, randomBytes(10 * MIB)));

        assertNotNull(metadata);
        awaitStatus(sender, metadata.getId(), TransferStatus.FAILED);
        awaitStatus(receiver, metadata.getId(), TransferStatus.FAILED);
        TransferRecord incoming = receiver.getActiveTransfers().get(0);
        assertEquals(TransferStatus.FAILED, incoming.getStatus());
        assertEquals(3L * MIB, incoming.getBytesTransferred());
        assertTrue(incoming.getProgress() < 100);
        assertNull(receiver.getReceivedFile(metadata.getId()));
        assertFalse(sender.connections().isConnected("bob"));
    }

    @Test
    void duplicateRequestIsRejectedWithoutTouchingFirstTransfer() throws Exception {
        start(settings(false, 0.0, 64L * MIB), settings(false, 0.0, 64L * MIB), true);
        AtomicReference<byte[]> requestFrame = new AtomicReference<>();
        senderTransport.setFilter(frame -> {
            if (decode(frame).type() == ProtocolMessageType.FILE_REQUEST) {
                requestFrame.set(frame);
            }
            return true;
        });
        AtomicInteger rejects = new AtomicInteger();
        receiverTransport.setFilter(frame -> {
            if (decode(frame).type() == ProtocolMessageType.FILE_REJECT) {
                rejects.incrementAndGet();
            }
            return true;
        });
        byte[] data = randomBytes(3 * MIB);

        FileMetadata metadata = sender.sendFileRequest("bob", new ByteArrayFileSource("once.bin", null, data));
        assertNotNull(metadata);
        await(() -> requestFrame.get() != null, "request sent");
        assertTrue(senderTransport.send("bob", requestFrame.get()));

        await(() -> rejects.get() == 1, "duplicate rejected");
        awaitStatus(sender, metadata.getId(), TransferStatus.COMPLETED);
        awaitStatus(receiver, metadata.getId(), TransferStatus.COMPLETED);
        assertEquals(1, offers.size());
        assertEquals(1, receiver.getActiveTransfers().size());
        assertArrayEquals(data, receiver.getReceivedFile(metadata.getId()).readAllBytes());
    }

    @Test
    void progressIsMonotonicAndReachesHundredOnlyAtEnd() {
        start(settings(true, 0.2, 64L * MIB), settings(true, 0.2, 64L * MIB), true);
        List<Integer> sent = new CopyOnWriteArrayList<>();
        List<Integer> received = new CopyOnWriteArrayList<>();
        sender.addListener(new TransferListener() {
            @Override
            public void onProgress(TransferRecord record) {
                sent.add(record.getProgress());
            }
        });
        receiver.addListener(new TransferListener() {
            @Override
            public void onProgress(TransferRecord record) {
                received.add(record.getProgress());
            }
        });

        FileMetadata metadata = sender.sendFileRequest("bob",
                new ByteArrayFileSource("steady.bin", null, randomBytes(6 * MIB + 12345)));

        assertNotNull(metadata);
        awaitStatus(receiver, metadata.getId(), TransferStatus.COMPLETED);
        assertProgression(sent);
        assertProgression(received);
    }

    @Test
    void cancelStopsStreamAndNotifiesPeer() throws Exception {
        start(settings(false, 0.0, 64L * MIB), settings(false, 0.0, 64L * MIB), true);
        AtomicInteger chunks = new AtomicInteger();
        CountDownLatch secondChunk = new CountDownLatch(1);
        CountDownLatch resume = new CountDownLatch(1);
        senderTransport.setFilter(frame -> {
            if (decode(frame).type() == ProtocolMessageType.FILE_CHUNK && chunks.incrementAndGet() == 2) {
                secondChunk.countDown();
                resume.await(TIMEOUT_MS, TimeUnit.MILLISECONDS);
            }
            return true;
        });
        AtomicReference<TransferException> failure = new AtomicReference<>();
        sender.addListener(new TransferListener() {
            @Override
            public void onTransferFailed(TransferRecord record, TransferException cause) {
                failure.set(cause);
            }
        });

        FileMetadata metadata = sender.sendFileRequest("bob",
                new ByteArrayFileSource("stop.bin", null, randomBytes(10 * MIB)));
        assertNotNull(metadata);
        assertTrue(secondChunk.await(TIMEOUT_MS, TimeUnit.MILLISECONDS));

        assertTrue(sender.cancelTransfer(metadata.getId()));
        resume.countDown();

        awaitStatus(sender, metadata.getId(), TransferStatus.FAILED);
        awaitStatus(receiver, metadata.getId(), TransferStatus.FAILED);
        await(() -> failure.get() != null, "failure event");
        assertEquals(TransferErrorKind.CANCELLED, failure.get().getKind());
        Thread.sleep(200);
        assertEquals(2, chunks.get());
        assertFalse(sender.cancelTransfer(metadata.getId()));
    }

    @Test
    void rejectedRequestEndsBothSides() {
        start(settings(false, 0.0, 64L * MIB), settings(false, 0.0, 64L * MIB), false);
        AtomicReference<TransferRecord> rejected = new AtomicReference<>();
        sender.addListener(new TransferListener() {
            @Override
            public void onTransferRejected(TransferRecord record) {
                rejected.set(record);
            }
        });

        FileMetadata metadata = sender.sendFileRequest("bob",
                new ByteArrayFileSource("no.txt", "text/plain", randomBytes(2048)));
        assertNotNull(metadata);
        await(() -> offers.size() == 1, "request received");
        assertEquals(TransferStatus.PENDING, receiver.getTransfer(metadata.getId()).getStatus());

        assertTrue(receiver.rejectFileTransfer("alice", offers.get(0)));

        awaitStatus(sender, metadata.getId(), TransferStatus.REJECTED);
        assertEquals(TransferStatus.REJECTED, receiver.getTransfer(metadata.getId()).getStatus());
        await(() -> rejected.get() != null, "rejected event");
        assertFalse(receiver.acceptFileTransfer("alice", offers.get(0)));
    }

    @Test
    void receiverRejectsOversizedRequest() {
        start(settings(false, 0.0, 64L * MIB), settings(false, 0.0, MIB), true);

        FileMetadata metadata = sender.sendFileRequest("bob",
                new ByteArrayFileSource("huge.bin", null, randomBytes(2 * MIB)));

        assertNotNull(metadata);
        awaitStatus(sender, metadata.getId(), TransferStatus.REJECTED);
        assertTrue(offers.isEmpty());
        assertNull(receiver.getTransfer(metadata.getId()));
    }

    @Test
    void requestFailsWithoutPeerOrWithInvalidSize() {
        start(settings(false, 0.0, MIB), settings(false, 0.0, MIB), true);

        assertNull(sender.sendFileRequest("carol", new ByteArrayFileSource("a.bin", null, new byte[10])));
        assertNull(sender.sendFileRequest("bob", new ByteArrayFileSource("empty.bin", null, new byte[0])));
        assertNull(sender.sendFileRequest("bob", new ByteArrayFileSource("big.bin", null, new byte[MIB + 1])));
        assertTrue(sender.getActiveTransfers().isEmpty());
    }

    @Test
    void sendFileOnlyRunsAfterAccept() {
        start(settings(false, 0.0, 64L * MIB), settings(false, 0.0, 64L * MIB), false);
        ByteArrayFileSource source = new ByteArrayFileSource("later.bin", null, randomBytes(MIB / 2));

        FileMetadata metadata = sender.sendFileRequest("bob", source);
        assertNotNull(metadata);
        assertFalse(sender.sendFile("bob", source, metadata));
        assertFalse(sender.sendFile("bob", new ByteArrayFileSource("other.bin", null, new byte[1]), metadata));

        await(() -> offers.size() == 1, "request received");
        assertTrue(receiver.acceptFileTransfer("alice", offers.get(0)));
        awaitStatus(receiver, metadata.getId(), TransferStatus.COMPLETED);
        assertTrue(sender.sendFile("bob", source, metadata));
    }

    @Test
    void clearFinishedForgetsEndedTransfers() {
        start(settings(false, 0.0, 64L * MIB), settings(false, 0.0, 64L * MIB), true);

        FileMetadata metadata = sender.sendFileRequest("bob",
                new ByteArrayFileSource("done.bin", null, randomBytes(1000)));
        assertNotNull(metadata);
        awaitStatus(receiver, metadata.getId(), TransferStatus.COMPLETED);
        awaitStatus(sender, metadata.getId(), TransferStatus.COMPLETED);

        assertEquals(1, receiver.clearFinished());
        assertNull(receiver.getReceivedFile(metadata.getId()));
        assertTrue(receiver.getActiveTransfers().isEmpty());
        assertEquals(1, sender.clearFinished());
    }

    @Test
    void clearTransferLeavesOtherTransfersAlone() throws IOException {
        start(settings(false, 0.0, 64L * MIB), settings(false, 0.0, 64L * MIB), true);
        byte[] second = randomBytes(3000);

        FileMetadata first = sender.sendFileRequest("bob", new ByteArrayFileSource("one.bin", null, randomBytes(2000)));
        FileMetadata other = sender.sendFileRequest("bob", new ByteArrayFileSource("two.bin", null, second));
        assertNotNull(first);
        assertNotNull(other);
        awaitStatus(receiver, first.getId(), TransferStatus.COMPLETED);
        awaitStatus(receiver, other.getId(), TransferStatus.COMPLETED);

        assertTrue(receiver.clearTransfer(first.getId()));
        assertFalse(receiver.clearTransfer(first.getId()));
        assertFalse(receiver.clearTransfer("unknown"));

        assertNull(receiver.getTransfer(first.getId()));
        ReceivedFile kept = receiver.getReceivedFile(other.getId());
        assertNotNull(kept);
        assertArrayEquals(second, kept.readAllBytes());
    }

    @Test
    void clearTransferKeepsRunningTransfer() {
        start(settings(false, 0.0, 64L * MIB), settings(false, 0.0, 64L * MIB), false);

        FileMetadata metadata = sender.sendFileRequest("bob", new ByteArrayFileSource("wait.bin", null, new byte[10]));
        assertNotNull(metadata);
        await(() -> offers.size() == 1, "request received");

        assertFalse(sender.clearTransfer(metadata.getId()));
        assertFalse(receiver.clearTransfer(metadata.getId()));
        assertNotNull(receiver.getTransfer(metadata.getId()));
    }

    @Test
    void offerSkipsIdHeldByIncomingTransfer() {
        Queue<String> planned = new ConcurrentLinkedQueue<>();
        receiverIds = () -> planned.isEmpty() ? TransferIdGenerator.randomId() : planned.poll();
        start(settings(false, 0.0, 64L * MIB), settings(false, 0.0, 64L * MIB), false);

        FileMetadata incoming = sender.sendFileRequest("bob", new ByteArrayFileSource("in.bin", null, new byte[10]));
        assertNotNull(incoming);
        await(() -> offers.size() == 1, "request received");
        planned.add(incoming.getId());

        FileMetadata outgoing = receiver.sendFileRequest("alice",
                new ByteArrayFileSource("out.bin", null, new byte[10]));

        assertNotNull(outgoing);
        assertTrue(planned.isEmpty());
        assertNotEquals(incoming.getId(), outgoing.getId());
        assertEquals(TransferDirection.INCOMING, receiver.getTransfer(incoming.getId()).getDirection());
        assertEquals(TransferDirection.OUTGOING, receiver.getTransfer(outgoing.getId()).getDirection());
    }

    @Test
    void undecodableFrameIsDroppedWithoutClosingConnection() {
        start(settings(false, 0.0, 64L * MIB), settings(false, 0.0, 64L * MIB), true);

        assertTrue(senderTransport.send("bob", new byte[]{99, 1, 2, 3}));
        FileMetadata metadata = sender.sendFileRequest("bob",
                new ByteArrayFileSource("after.bin", null, randomBytes(4096)));

        assertNotNull(metadata);
        awaitStatus(receiver, metadata.getId(), TransferStatus.COMPLETED);
        assertTrue(receiver.connections().isConnected("alice"));
    }

    private static void assertProgression(List<Integer> values) {
        assertFalse(values.isEmpty());
        for (int i = 1; i < values.size(); i++) {
            assertTrue(values.get(i) > values.get(i - 1), "progress went from " + values.get(i - 1) + " to "
                    + values.get(i));
        }
        assertEquals(100, values.get(values.size() - 1));
        assertEquals(1, values.stream().filter(v -> v == 100).count());
    }

    private static void awaitStatus(FileTransferService service, String id, TransferStatus status) {
        await(() -> {
            TransferRecord record = service.getTransfer(id);
            return record != null && record.getStatus() == status;
        }, "transfer " + id + " to reach " + status);
    }

    private static void await(BooleanSupplier condition, String what) {
        long deadline = System.currentTimeMillis() + TIMEOUT_MS;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out waiting for " + what);
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted waiting for " + what);
            }
        }
    }

    private static ProtocolMessage decode(byte[] frame) {
        try {
            return ProtocolIO.fromByteArray(frame);
        } catch (ProtocolException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static byte[] randomBytes(int length) {
        byte[] data = new byte[length];
        new Random(length).nextBytes(data);
        return data;
    }
}
