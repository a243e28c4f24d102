package io.github.shangor.peer.transfer.core.service;

import io.github.shangor.peer.transfer.core.codec.ChunkCompressor;
import io.github.shangor.peer.transfer.core.io.FileSource;
import io.github.shangor.peer.transfer.core.io.SliceReader;
import io.github.shangor.peer.transfer.core.model.FileMetadata;
import io.github.shangor.peer.transfer.core.model.PeerInfo;
import io.github.shangor.peer.transfer.core.model.TransferDirection;
import io.github.shangor.peer.transfer.core.model.TransferRecord;
import io.github.shangor.peer.transfer.core.model.TransferStatus;
import io.github.shangor.peer.transfer.core.net.PeerTransport;
import io.github.shangor.peer.transfer.core.protocol.FileRejectMessage;
import io.github.shangor.peer.transfer.core.protocol.FileRequestMessage;
import io.github.shangor.peer.transfer.core.util.TransferSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Entry point of the transfer engine for one local peer.
 *
 * <p>Offers files to peers, answers their offers, streams accepted files and reports every
 * state change to the registered {@link TransferListener}s. Finished transfers stay listed in
 * {@link #getActiveTransfers()} until {@link #clearFinished()}.
 */
public class FileTransferService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FileTransferService.class);
    private static final int MAX_ID_ATTEMPTS = 8;

    private final PeerInfo localPeer;
    private final TransferSettings settings;
    private final SessionRegistry sessions = new SessionRegistry();
    private final ConnectionRegistry connections;
    private final TransferIdGenerator idGenerator;
    private final ChecksumService checksumService = new ChecksumService();
    private final List<TransferListener> listeners = new CopyOnWriteArrayList<>();
    private final TransferListener events = new ListenerFanOut();
    private final ExecutorService pumpExecutor = Executors.newFixedThreadPool(
            Math.max(2, Runtime.getRuntime().availableProcessors()));
    private final ExecutorService readerExecutor = Executors.newSingleThreadExecutor();
    private final ExecutorService verifyExecutor = Executors.newSingleThreadExecutor();

    public FileTransferService(PeerInfo localPeer, PeerTransport transport, TransferSettings settings) {
        this(localPeer, transport, settings, TransferIdGenerator::randomId);
    }

    FileTransferService(PeerInfo localPeer, PeerTransport transport, TransferSettings settings,
                        Supplier<String> idCandidates) {
        this.localPeer = Objects.requireNonNull(localPeer, "localPeer");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.idGenerator = new TransferIdGenerator(sessions::contains, idCandidates);
        this.connections = new ConnectionRegistry(transport, sessions);
        this.connections.setHandler(new RequestHandler());
    }

    public PeerInfo localPeer() {
        return localPeer;
    }

    public TransferSettings settings() {
        return settings;
    }

    public ConnectionRegistry connections() {
        return connections;
    }

    public void addListener(TransferListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(TransferListener listener) {
        listeners.remove(listener);
    }

    /**
     * Offers a file to a peer. The stream starts by itself when the peer accepts.
     *
     * @return the offered metadata, or null if the peer is not connected, the file is empty or
     *         above the size limit, or the request could not be sent
     */
    public FileMetadata sendFileRequest(String peerId, FileSource source) {
        Objects.requireNonNull(source, "source");
        if (!connections.isConnected(peerId)) {
            log.warn("Cannot offer {} to {}: peer not connected", source.name(), peerId);
            return null;
        }
        long size = source.size();
        if (size <= 0) {
            log.warn("Cannot offer empty file {}", source.name());
            return null;
        }
        if (size > settings.maxFileSize()) {
            log.warn("Cannot offer {}: {} bytes exceeds limit of {}", source.name(), size, settings.maxFileSize());
            return null;
        }
        boolean compressed = settings.compressionEnabled()
                && ChunkCompressor.shouldCompress(source.name(), source.mimeType(), size);
        FileMetadata metadata = null;
        for (int attempt = 1; metadata == null; attempt++) {
            FileMetadata candidate = new FileMetadata(idGenerator.nextId(), source.name(), size, source.mimeType(),
                    null, settings.fecEnabled(), settings.fecParityRatio(), compressed);
            TransferRecord record = new TransferRecord(candidate, localPeer.id(), peerId, TransferDirection.OUTGOING);
            SenderSession session = new SenderSession(record, candidate, peerId, connections, events, source,
                    new SliceReader(source, readerExecutor), settings, pumpExecutor);
            try {
                sessions.add(session);
                metadata = candidate;
            } catch (CapacityException e) {
                idGenerator.release(candidate.getId());
                if (attempt >= MAX_ID_ATTEMPTS) {
                    log.warn("Cannot offer {}: {}", source.name(), e.getMessage());
                    return null;
                }
                log.debug("Transfer id {} taken meanwhile, picking another", candidate.getId());
            }
        }
        if (!connections.send(peerId, new FileRequestMessage(metadata, localPeer))) {
            log.warn("Failed to send file request {} to {}", metadata.getId(), peerId);
            sessions.remove(metadata.getId());
            idGenerator.release(metadata.getId());
            return null;
        }
        log.info("Offered {} ({} bytes) to {} as transfer {}", metadata.getName(), size, peerId, metadata.getId());
        return metadata;
    }

    /**
     * Makes sure the stream of an accepted offer is running. The stream already starts by
     * itself when the accept arrives, so this only matters to callers that drive it explicitly.
     *
     * @return false if there is no offer of {@code metadata} to {@code peerId} with this source,
     *         or the peer has not accepted it
     */
    public boolean sendFile(String peerId, FileSource source, FileMetadata metadata) {
        TransferSession session = sessions.get(metadata.getId());
        if (!(session instanceof SenderSession) || !session.peerId().equals(peerId)) {
            log.warn("No outgoing transfer {} to {}", metadata.getId(), peerId);
            return false;
        }
        SenderSession sender = (SenderSession) session;
        if (sender.source() != source) {
            log.warn("Transfer {} was offered with a different source", metadata.getId());
            return false;
        }
        return sender.ensureStarted();
    }

    public boolean acceptFileTransfer(String peerId, FileMetadata metadata) {
        ReceiverSession session = incoming(peerId, metadata);
        return session != null && session.accept();
    }

    public boolean rejectFileTransfer(String peerId, FileMetadata metadata) {
        ReceiverSession session = incoming(peerId, metadata);
        return session != null && session.reject();
    }

    /**
     * Cancels a transfer in either direction. The peer is notified.
     *
     * @return false if the transfer is unknown or already finished
     */
    public boolean cancelTransfer(String transferId) {
        TransferSession session = sessions.get(transferId);
        if (session == null) {
            return false;
        }
        return session.cancel();
    }

    /**
     * Snapshots of all known transfers, oldest first, finished ones included.
     */
    public List<TransferRecord> getActiveTransfers() {
        List<TransferRecord> records = new ArrayList<>();
        for (TransferSession session : sessions.all()) {
            records.add(session.snapshot());
        }
        records.sort(Comparator.comparing(TransferRecord::getCreatedAt));
        return records;
    }

    public TransferRecord getTransfer(String transferId) {
        TransferSession session = sessions.get(transferId);
        return session == null ? null : session.snapshot();
    }

    /**
     * @return the assembled file of a completed or integrity-flagged incoming transfer, else null
     */
    public ReceivedFile getReceivedFile(String transferId) {
        TransferSession session = sessions.get(transferId);
        if (!(session instanceof ReceiverSession)) {
            return null;
        }
        return ((ReceiverSession) session).receivedFile();
    }

    /**
     * Forgets finished transfers and frees the buffers they kept.
     *
     * @return the number of transfers removed
     */
    public int clearFinished() {
        int removed = 0;
        for (TransferSession session : sessions.all()) {
            if (forget(session)) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Forgets one finished transfer and frees its buffer. Other transfers are left alone.
     *
     * @return false if the transfer is unknown or still running
     */
    public boolean clearTransfer(String transferId) {
        TransferSession session = sessions.get(transferId);
        return session != null && forget(session);
    }

    private boolean forget(TransferSession session) {
        if (!session.isTerminal() || sessions.remove(session.id()) == null) {
            return false;
        }
        session.releaseOnce();
        idGenerator.release(session.id());
        return true;
    }

    public boolean disconnect(String peerId) {
        return connections.disconnect(peerId);
    }

    @Override
    public void close() {
        for (TransferSession session : sessions.all()) {
            if (!session.isTerminal()) {
                session.cancel();
            }
            session.releaseOnce();
        }
        pumpExecutor.shutdownNow();
        readerExecutor.shutdownNow();
        verifyExecutor.shutdownNow();
    }

    private ReceiverSession incoming(String peerId, FileMetadata metadata) {
        TransferSession session = sessions.get(metadata.getId());
        if (!(session instanceof ReceiverSession) || !session.peerId().equals(peerId)) {
            log.warn("No incoming transfer {} from {}", metadata.getId(), peerId);
            return null;
        }
        return (ReceiverSession) session;
    }

    private void onFileRequest(String peerId, FileRequestMessage request) {
        FileMetadata metadata = request.metadata();
        try {
            if (metadata.getSize() > settings.maxFileSize()) {
                throw new CapacityException("File " + metadata.getName() + " of " + metadata.getSize()
                        + " bytes exceeds limit of " + settings.maxFileSize());
            }
            TransferRecord record = new TransferRecord(metadata, request.from().id(), localPeer.id(),
                    TransferDirection.INCOMING);
            sessions.add(new ReceiverSession(record, metadata, peerId, connections, events, settings,
                    checksumService, verifyExecutor));
        } catch (CapacityException e) {
            log.warn("Rejecting file request {} from {}: {}", metadata.getId(), peerId, e.getMessage());
            connections.send(peerId, new FileRejectMessage(metadata));
            return;
        }
        log.info("Peer {} offers {} ({} bytes) as transfer {}", request.from().displayName(), metadata.getName(),
                metadata.getSize(), metadata.getId());
        events.onFileRequest(peerId, metadata, request.from());
    }

    private class RequestHandler implements ConnectionRegistry.RequestHandler {
        @Override
        public void onPeerConnected(String peerId) {
            events.onPeerConnected(peerId);
        }

        @Override
        public void onPeerDisconnected(String peerId) {
            events.onPeerDisconnected(peerId);
        }

        @Override
        public void onFileRequest(String peerId, FileRequestMessage request) {
            FileTransferService.this.onFileRequest(peerId, request);
        }
    }

    /**
     * Forwards each event to every listener; a failing listener does not stop the others or the
     * session that raised the event.
     */
    private class ListenerFanOut implements TransferListener {
        private void each(String event, Consumer<TransferListener> call) {
            for (TransferListener listener : listeners) {
                try {
                    call.accept(listener);
                } catch (RuntimeException e) {
                    log.error("Listener {} failed handling {}", listener, event, e);
                }
            }
        }

        @Override
        public void onPeerConnected(String peerId) {
            each("peer connected", l -> l.onPeerConnected(peerId));
        }

        @Override
        public void onPeerDisconnected(String peerId) {
            each("peer disconnected", l -> l.onPeerDisconnected(peerId));
        }

        @Override
        public void onFileRequest(String peerId, FileMetadata metadata, PeerInfo from) {
            each("file request", l -> l.onFileRequest(peerId, metadata, from));
        }

        @Override
        public void onTransferAccepted(TransferRecord record) {
            each("accepted", l -> l.onTransferAccepted(record));
        }

        @Override
        public void onTransferRejected(TransferRecord record) {
            each("rejected", l -> l.onTransferRejected(record));
        }

        @Override
        public void onStatusChanged(TransferRecord record, TransferStatus previous) {
            each("status change", l -> l.onStatusChanged(record, previous));
        }

        @Override
        public void onProgress(TransferRecord record) {
            each("progress", l -> l.onProgress(record));
        }

        @Override
        public void onTransferCompleted(TransferRecord record) {
            each("completed", l -> l.onTransferCompleted(record));
        }

        @Override
        public void onTransferFailed(TransferRecord record, TransferException cause) {
            each("failed", l -> l.onTransferFailed(record, cause));
        }
    }
}
