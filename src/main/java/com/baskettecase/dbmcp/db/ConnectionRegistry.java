package com.baskettecase.dbmcp.db;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only mapping from logical database name to its {@link ConnectionProfile}.
 *
 * Built once at startup from the registry file and never mutated afterwards,
 * so it can be shared across concurrent tool calls without locking.
 */
public final class ConnectionRegistry {

    private final Map<String, ConnectionProfile> profiles;

    public ConnectionRegistry(Map<String, ConnectionProfile> profiles) {
        this.profiles = Collections.unmodifiableMap(new LinkedHashMap<>(profiles));
    }

    public static ConnectionRegistry empty() {
        return new ConnectionRegistry(Map.of());
    }

    public Optional<ConnectionProfile> find(String databaseName) {
        if (databaseName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(profiles.get(databaseName));
    }

    public boolean contains(String databaseName) {
        return databaseName != null && profiles.containsKey(databaseName);
    }

    public Set<String> names() {
        return profiles.keySet();
    }

    public Map<String, ConnectionProfile> asMap() {
        return profiles;
    }

    public int size() {
        return profiles.size();
    }
}
