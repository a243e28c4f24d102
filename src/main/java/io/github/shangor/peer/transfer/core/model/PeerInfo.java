package io.github.shangor.peer.transfer.core.model;

import java.util.Objects;

/**
 * Identity of a remote endpoint as announced in a file request. The name is optional.
 */
public record PeerInfo(String id, String name) {
    public PeerInfo {
        Objects.requireNonNull(id, "id");
    }

    public static PeerInfo of(String id) {
        return new PeerInfo(id, null);
    }

    public String displayName() {
        return name == null || name.isBlank() ? id : name;
    }
}
