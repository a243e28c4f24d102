package io.github.shangor.peer.transfer.core.service;

import io.github.shangor.peer.transfer.core.net.PeerTransport;
import io.github.shangor.peer.transfer.core.net.PeerTransportListener;
import io.github.shangor.peer.transfer.core.protocol.FileChunkMessage;
import io.github.shangor.peer.transfer.core.protocol.FileCompleteMessage;
import io.github.shangor.peer.transfer.core.protocol.FileRequestMessage;
import io.github.shangor.peer.transfer.core.protocol.ProtocolException;
import io.github.shangor.peer.transfer.core.protocol.ProtocolIO;
import io.github.shangor.peer.transfer.core.protocol.ProtocolMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks connected peers, encodes outbound messages and routes inbound ones.
 *
 * <p>{@code FILE_REQUEST} goes to the {@link RequestHandler}; every other message goes to the
 * session named by its transfer id, provided that session belongs to the sending peer. Frames
 * that do not decode are logged and dropped without touching the connection. When a peer goes
 * away every unfinished session with it fails.
 */
public class ConnectionRegistry implements PeerTransportListener {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    /**
     * Receives connection events and new requests, which have no session yet.
     */
    public interface RequestHandler {
        void onPeerConnected(String peerId);

        void onPeerDisconnected(String peerId);

        void onFileRequest(String peerId, FileRequestMessage request);
    }

    private final PeerTransport transport;
    private final SessionRegistry sessions;
    private final Set<String> peers = ConcurrentHashMap.newKeySet();
    private volatile RequestHandler handler;

    public ConnectionRegistry(PeerTransport transport, SessionRegistry sessions) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        transport.setListener(this);
    }

    public void setHandler(RequestHandler handler) {
        this.handler = handler;
    }

    public String localPeerId() {
        return transport.localPeerId();
    }

    /**
     * Registers a peer whose connection is up. Connecting a known peer is a no-op.
     *
     * @return true if the peer was not known before
     */
    public boolean connect(String peerId) {
        if (!peers.add(peerId)) {
            return false;
        }
        log.info("Peer {} connected", peerId);
        RequestHandler h = handler;
        if (h != null) {
            h.onPeerConnected(peerId);
        }
        return true;
    }

    /**
     * Closes the connection to a peer and fails its unfinished sessions. Disconnecting an
     * unknown peer is a no-op.
     *
     * @return true if the peer was connected
     */
    public boolean disconnect(String peerId) {
        if (!peers.remove(peerId)) {
            return false;
        }
        transport.disconnect(peerId);
        peerLost(peerId);
        return true;
    }

    public boolean isConnected(String peerId) {
        return peers.contains(peerId) && transport.isConnected(peerId);
    }

    public boolean isWritable(String peerId) {
        return peers.contains(peerId) && transport.isWritable(peerId);
    }

    public Set<String> connectedPeers() {
        return Collections.unmodifiableSet(new HashSet<>(peers));
    }

    /**
     * @return false if the peer is not connected, the message cannot be encoded or the
     *         transport refuses it
     */
    public boolean send(String peerId, ProtocolMessage message) {
        if (!peers.contains(peerId)) {
            log.debug("Not sending {} to unknown peer {}", message.type(), peerId);
            return false;
        }
        byte[] frame;
        try {
            frame = ProtocolIO.toByteArray(message);
        } catch (IOException e) {
            log.warn("Failed to encode {} for peer {}", message.type(), peerId, e);
            return false;
        }
        return transport.send(peerId, frame);
    }

    @Override
    public void onPeerConnected(String peerId) {
        connect(peerId);
    }

    @Override
    public void onPeerDisconnected(String peerId) {
        if (peers.remove(peerId)) {
            peerLost(peerId);
        }
    }

    @Override
    public void onMessage(String peerId, byte[] frame) {
        ProtocolMessage message;
        try {
            message = ProtocolIO.fromByteArray(frame);
        } catch (ProtocolException e) {
            log.warn("Dropping frame of {} bytes from {}: {}", frame == null ? 0 : frame.length, peerId,
                    e.getMessage());
            return;
        }
        if (!peers.contains(peerId)) {
            connect(peerId);
        }
        try {
            dispatch(peerId, message);
        } catch (RuntimeException e) {
            log.error("Failed to handle {} for transfer {} from {}", message.type(), message.transferId(), peerId, e);
        }
    }

    private void dispatch(String peerId, ProtocolMessage message) {
        switch (message.type()) {
            case FILE_REQUEST -> {
                RequestHandler h = handler;
                if (h == null) {
                    log.warn("No handler for file request {} from {}", message.transferId(), peerId);
                    return;
                }
                h.onFileRequest(peerId, (FileRequestMessage) message);
            }
            case FILE_ACCEPT -> {
                SenderSession session = senderSession(peerId, message);
                if (session != null) {
                    session.onAccepted();
                }
            }
            case FILE_REJECT -> {
                SenderSession session = senderSession(peerId, message);
                if (session != null) {
                    session.onRejected();
                }
            }
            case FILE_CHUNK -> {
                ReceiverSession session = receiverSession(peerId, message);
                if (session != null) {
                    session.onChunk((FileChunkMessage) message);
                }
            }
            case FILE_COMPLETE -> {
                ReceiverSession session = receiverSession(peerId, message);
                if (session != null) {
                    session.onFileComplete((FileCompleteMessage) message);
                }
            }
            case FILE_CANCEL -> {
                TransferSession session = owned(peerId, message);
                if (session != null) {
                    session.onRemoteCancel();
                }
            }
        }
    }

    private SenderSession senderSession(String peerId, ProtocolMessage message) {
        TransferSession session = owned(peerId, message);
        if (session == null) {
            return null;
        }
        if (!(session instanceof SenderSession)) {
            log.warn("Dropping {} for incoming transfer {} from {}", message.type(), message.transferId(), peerId);
            return null;
        }
        return (SenderSession) session;
    }

    private ReceiverSession receiverSession(String peerId, ProtocolMessage message) {
        TransferSession session = owned(peerId, message);
        if (session == null) {
            return null;
        }
        if (!(session instanceof ReceiverSession)) {
            log.warn("Dropping {} for outgoing transfer {} from {}", message.type(), message.transferId(), peerId);
            return null;
        }
        return (ReceiverSession) session;
    }

    private TransferSession owned(String peerId, ProtocolMessage message) {
        TransferSession session = sessions.get(message.transferId());
        if (session == null) {
            log.debug("Dropping {} for unknown transfer {} from {}", message.type(), message.transferId(), peerId);
            return null;
        }
        if (!session.peerId().equals(peerId)) {
            log.warn("Dropping {} for transfer {}: sent by {}, owned by {}", message.type(), message.transferId(),
                    peerId, session.peerId());
            return null;
        }
        return session;
    }

    private void peerLost(String peerId) {
        log.info("Peer {} disconnected", peerId);
        for (TransferSession session : sessions.forPeer(peerId)) {
            if (!session.isTerminal()) {
                session.onPeerDisconnected();
            }
        }
        RequestHandler h = handler;
        if (h != null) {
            h.onPeerDisconnected(peerId);
        }
    }
}
