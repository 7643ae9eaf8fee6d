package com.forecastalpha.analysis.datasource;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/**
 * Process-local store of validated connections keyed by an opaque token.
 */
@Repository
public class ConnectionRegistry {

    private final Map<String, ConnectionDescriptor> storage = new ConcurrentHashMap<>();

    public String register(ConnectionDescriptor descriptor) {
        String connectionId = UUID.randomUUID().toString();
        storage.put(connectionId, descriptor);
        return connectionId;
    }

    public Optional<ConnectionDescriptor> resolve(String connectionId) {
        if (connectionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(storage.get(connectionId));
    }

    public boolean remove(String connectionId) {
        return connectionId != null && storage.remove(connectionId) != null;
    }

    public int size() {
        return storage.size();
    }
}
