package io.github.shangor.peer.transfer.core.net;

/**
 * Inbound side of a {@link PeerTransport}. Callbacks for one peer arrive in order on a
 * single thread.
 */
public interface PeerTransportListener {

    void onPeerConnected(String peerId);

    void onPeerDisconnected(String peerId);

    void onMessage(String peerId, byte[] frame);
}
