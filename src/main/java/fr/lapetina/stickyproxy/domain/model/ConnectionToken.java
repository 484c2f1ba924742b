package fr.lapetina.stickyproxy.domain.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Opaque key linking a sticky session to the upstream address it was pinned to.
 *
 * A fresh token is minted every time a session is (re)routed, so a stale
 * token never resolves to the new association.
 */
public record ConnectionToken(UUID value) {

    public ConnectionToken {
        Objects.requireNonNull(value, "Token value is required");
    }

    public static ConnectionToken random() {
        return new ConnectionToken(UUID.randomUUID());
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
