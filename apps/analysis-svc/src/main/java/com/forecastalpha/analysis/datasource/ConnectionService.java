package com.forecastalpha.analysis.datasource;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ConnectionService {

    private static final Logger log = LoggerFactory.getLogger(ConnectionService.class);

    private final ConnectionRegistry connectionRegistry;
    private final TableSourceFactory tableSourceFactory;

    public ConnectionService(ConnectionRegistry connectionRegistry, TableSourceFactory tableSourceFactory) {
        this.connectionRegistry = connectionRegistry;
        this.tableSourceFactory = tableSourceFactory;
    }

    /**
     * Validates the connection before registering it.
     *
     * @return the opaque connection id
     * @throws ConnectionFailedException when the store cannot be reached
     */
    public String connect(ConnectionDescriptor descriptor) {
        try {
            tableSourceFactory.open(descriptor).validateConnection();
        } catch (DataSourceException ex) {
            log.warn("Connection to {} failed: {}", descriptor.redactedUrl(), ex.getMessage());
            throw new ConnectionFailedException(ex.getMessage(), ex);
        }
        String connectionId = connectionRegistry.register(descriptor);
        log.info("Registered connection {} to {}", connectionId, descriptor.redactedUrl());
        return connectionId;
    }

    public List<TableInfo> listTables(String connectionId) {
        ConnectionDescriptor descriptor = connectionRegistry.resolve(connectionId)
                .orElseThrow(() -> new UnknownConnectionException(connectionId));
        return tableSourceFactory.open(descriptor).listTables();
    }

    public boolean disconnect(String connectionId) {
        boolean removed = connectionRegistry.remove(connectionId);
        if (removed) {
            log.info("Removed connection {}", connectionId);
        }
        return removed;
    }
}
