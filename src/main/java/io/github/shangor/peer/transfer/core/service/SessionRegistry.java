package io.github.shangor.peer.transfer.core.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sessions of one endpoint keyed by transfer id. At most one session exists per id.
 */
public class SessionRegistry {
    private final Map<String, TransferSession> sessions = new ConcurrentHashMap<>();

    /**
     * @throws CapacityException if a session with the same id is already registered
     */
    public <T extends TransferSession> T add(T session) throws CapacityException {
        TransferSession existing = sessions.putIfAbsent(session.id(), session);
        if (existing != null) {
            throw new CapacityException("Transfer " + session.id() + " already exists ("
                    + existing.direction() + ", " + existing.status() + ")");
        }
        return session;
    }

    public TransferSession get(String id) {
        return sessions.get(id);
    }

    public boolean contains(String id) {
        return sessions.containsKey(id);
    }

    public TransferSession remove(String id) {
        return sessions.remove(id);
    }

    public List<TransferSession> all() {
        return new ArrayList<>(sessions.values());
    }

    public List<TransferSession> forPeer(String peerId) {
        List<TransferSession> result = new ArrayList<>();
        for (TransferSession session : sessions.values()) {
            if (session.peerId().equals(peerId)) {
                result.add(session);
            }
        }
        return result;
    }
}
