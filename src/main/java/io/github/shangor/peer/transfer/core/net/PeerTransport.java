package io.github.shangor.peer.transfer.core.net;

import java.util.Set;

/**
 * Ordered, reliable, message-based channel to remote peers identified by id.
 */
public interface PeerTransport extends AutoCloseable {

    String localPeerId();

    void setListener(PeerTransportListener listener);

    /**
     * Queues one frame for the peer.
     *
     * @return false if the peer is not connected or the frame was refused
     */
    boolean send(String peerId, byte[] frame);

    /**
     * @return false while the peer's outbound buffer is above its high-water mark
     */
    boolean isWritable(String peerId);

    boolean isConnected(String peerId);

    Set<String> connectedPeers();

    /**
     * Closes the connection to the peer. Unknown peers are ignored.
     */
    void disconnect(String peerId);

    @Override
    void close();
}
