package com.example.livequiz.gateway;

import com.example.livequiz.messages.outbound.ServerEvent;

/**
 * Delivery primitives of the connection layer: room membership, room-wide broadcast
 * and unicast to one connected identity. Implementations never throw on delivery failure.
 */
public interface BroadcastGateway {

    void subscribe(String roomCode, String participantId);

    void unsubscribe(String roomCode, String participantId);

    /** Forgets all memberships of a room. */
    void dropRoom(String roomCode);

    void broadcast(String roomCode, ServerEvent event);

    void sendTo(String participantId, ServerEvent event);
}
