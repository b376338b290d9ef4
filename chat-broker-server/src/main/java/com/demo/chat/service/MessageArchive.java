package com.demo.chat.service;

import com.demo.chat.domain.Message;

import java.util.List;

/**
 * Durable copy of room history. The in-memory log stays authoritative; the
 * archive receives every append and amendment and is read once when a room's
 * log opens.
 */
public interface MessageArchive {

    void append(Message message);

    /**
     * Overwrites the archived message with the same id. Unknown ids are ignored.
     */
    void replace(Message message);

    /**
     * Newest {@code limit} archived messages of the room, oldest first.
     */
    List<Message> load(String roomId, int limit);

    void purge(String roomId);

    boolean isDurable();
}
