package com.demo.chat.infrastructure;

import com.demo.chat.domain.CloseReason;

/**
 * Outbound side of a client connection.
 */
public interface ConnectionTransport {

    /**
     * Queues a serialized frame. Never blocks on a slow peer.
     *
     * @return false if the connection is gone or could not accept the frame
     */
    boolean send(String connectionId, String frame);

    void ping(String connectionId);

    void close(String connectionId, CloseReason reason);
}
