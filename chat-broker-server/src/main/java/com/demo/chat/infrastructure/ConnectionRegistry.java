package com.demo.chat.infrastructure;

import com.demo.chat.domain.Connection;
import com.demo.chat.domain.ConnectionNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live connections and the user to connections index. Purely a data
 * structure: it never calls other components.
 */
@Component
@Slf4j
public class ConnectionRegistry {

    private final ConcurrentHashMap<String, Connection> connections = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> connectionsByUser = new ConcurrentHashMap<>();

    public String register(Connection connection) {
        Connection previous = connections.putIfAbsent(connection.getConnectionId(), connection);
        if (previous != null) {
            throw new IllegalStateException("Connection already registered: " + connection.getConnectionId());
        }
        log.info("Connection registered: connectionId={}, remote={}, total={}",
            connection.getConnectionId(), connection.getRemoteAddress(), connections.size());
        return connection.getConnectionId();
    }

    /**
     * Indexes the connection under its user.
     *
     * @throws ConnectionNotFoundException if the connection is not registered
     */
    public void setUser(String connectionId, String userId) {
        if (!connections.containsKey(connectionId)) {
            throw new ConnectionNotFoundException(connectionId);
        }
        connectionsByUser.compute(userId, (id, ids) -> {
            Set<String> target = ids != null ? ids : ConcurrentHashMap.newKeySet();
            target.add(connectionId);
            return target;
        });
    }

    /**
     * Removes the connection. Unknown ids are ignored.
     *
     * @return the user id if this was that user's last connection
     */
    public Optional<String> unregister(String connectionId) {
        Connection removed = connections.remove(connectionId);
        if (removed == null) {
            return Optional.empty();
        }
        String userId = removed.getUserId();
        log.info("Connection unregistered: connectionId={}, userId={}, total={}",
            connectionId, userId, connections.size());
        if (userId == null) {
            return Optional.empty();
        }
        boolean[] last = new boolean[1];
        connectionsByUser.computeIfPresent(userId, (id, ids) -> {
            ids.remove(connectionId);
            last[0] = ids.isEmpty();
            return last[0] ? null : ids;
        });
        return last[0] ? Optional.of(userId) : Optional.empty();
    }

    public List<String> connectionsOf(String userId) {
        Set<String> ids = connectionsByUser.get(userId);
        return ids != null ? new ArrayList<>(ids) : List.of();
    }

    public boolean hasConnections(String userId) {
        Set<String> ids = connectionsByUser.get(userId);
        return ids != null && !ids.isEmpty();
    }

    public void touch(String connectionId, Instant now) {
        Connection connection = connections.get(connectionId);
        if (connection != null) {
            connection.touch(now);
        }
    }

    public boolean isStale(String connectionId, Instant now, Duration timeout) {
        Connection connection = connections.get(connectionId);
        return connection != null && connection.isStale(now, timeout);
    }

    public Optional<Connection> find(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public Collection<Connection> all() {
        return List.copyOf(connections.values());
    }

    public int count() {
        return connections.size();
    }
}
