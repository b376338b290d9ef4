package com.demo.chat.domain;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Future;

/**
 * One accepted client connection. State transitions and liveness updates are
 * serialized on the instance so that a touch can never race a stale
 * termination.
 */
public class Connection {

    @Getter
    private final String connectionId;
    @Getter
    private final String remoteAddress;
    @Getter
    private final Instant connectedAt;

    private ConnectionState state = ConnectionState.CONNECTED;
    private boolean authPending;
    private String userId;
    private String displayName;
    private Instant lastLivenessAt;
    private Future<?> pendingAuthentication;
    private boolean released;

    public Connection(String connectionId, String remoteAddress, Instant connectedAt) {
        this.connectionId = connectionId;
        this.remoteAddress = remoteAddress;
        this.connectedAt = connectedAt;
        this.lastLivenessAt = connectedAt;
    }

    public synchronized ConnectionState getState() {
        return state;
    }

    public synchronized String getUserId() {
        return userId;
    }

    public synchronized String getDisplayName() {
        return displayName;
    }

    public synchronized Instant getLastLivenessAt() {
        return lastLivenessAt;
    }

    public synchronized boolean isAuthenticated() {
        return state == ConnectionState.AUTHENTICATED;
    }

    public synchronized boolean isClosed() {
        return state == ConnectionState.CLOSED;
    }

    public synchronized boolean isAuthPending() {
        return authPending;
    }

    /**
     * Claims the single authentication slot. Fails when the connection is
     * already authenticated, closed, or has a validation in flight.
     */
    public synchronized boolean beginAuthentication() {
        if (state != ConnectionState.CONNECTED || authPending) {
            return false;
        }
        authPending = true;
        return true;
    }

    public synchronized void trackAuthentication(Future<?> future) {
        this.pendingAuthentication = future;
    }

    /**
     * Binds the identity. The user id is set exactly once; a result that
     * arrives after close is rejected.
     */
    public synchronized boolean completeAuthentication(String userId, String displayName) {
        if (state != ConnectionState.CONNECTED || !authPending) {
            return false;
        }
        this.userId = userId;
        this.displayName = displayName;
        this.state = ConnectionState.AUTHENTICATED;
        this.authPending = false;
        this.pendingAuthentication = null;
        return true;
    }

    public synchronized boolean abortAuthentication() {
        if (state != ConnectionState.CONNECTED || !authPending) {
            return false;
        }
        authPending = false;
        pendingAuthentication = null;
        return true;
    }

    public synchronized void touch(Instant now) {
        if (state != ConnectionState.CLOSED && now.isAfter(lastLivenessAt)) {
            lastLivenessAt = now;
        }
    }

    public synchronized boolean isStale(Instant now, Duration timeout) {
        return state != ConnectionState.CLOSED
            && Duration.between(lastLivenessAt, now).compareTo(timeout) > 0;
    }

    /**
     * Closes the connection if it has been silent longer than {@code timeout}.
     */
    public synchronized boolean closeIfStale(Instant now, Duration timeout) {
        if (!isStale(now, timeout)) {
            return false;
        }
        close();
        return true;
    }

    /**
     * @return true only for the call that moved the connection to CLOSED
     */
    public synchronized boolean close() {
        if (state == ConnectionState.CLOSED) {
            return false;
        }
        state = ConnectionState.CLOSED;
        authPending = false;
        if (pendingAuthentication != null) {
            pendingAuthentication.cancel(false);
            pendingAuthentication = null;
        }
        return true;
    }

    /**
     * Closes the connection and claims its disconnect cleanup.
     *
     * @return true for exactly one caller over the connection's lifetime
     */
    public synchronized boolean release() {
        close();
        if (released) {
            return false;
        }
        released = true;
        return true;
    }
}
