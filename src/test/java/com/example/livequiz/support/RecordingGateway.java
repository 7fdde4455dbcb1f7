package com.example.livequiz.support;

import com.example.livequiz.gateway.BroadcastGateway;
import com.example.livequiz.messages.outbound.ServerEvent;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** In-memory BroadcastGateway that records every delivery for assertions. */
public class RecordingGateway implements BroadcastGateway {

    /**
     * One pushed event; {@code room} tells whether {@code target} is a room code or a participant id.
     * {@code recipients} is the room membership at send time, or just the target for direct sends.
     */
    public record Delivery(String target, boolean room, ServerEvent event, Set<String> recipients) { }

    private final List<Delivery> deliveries = new ArrayList<>();
    private final Map<String, Set<String>> members = new HashMap<>();

    @Override
    public synchronized void subscribe(String roomCode, String participantId) {
        members.computeIfAbsent(roomCode, k -> new HashSet<>()).add(participantId);
    }

    @Override
    public synchronized void unsubscribe(String roomCode, String participantId) {
        Set<String> ids = members.get(roomCode);
        if (ids != null) ids.remove(participantId);
    }

    @Override
    public synchronized void dropRoom(String roomCode) {
        members.remove(roomCode);
    }

    @Override
    public synchronized void broadcast(String roomCode, ServerEvent event) {
        deliveries.add(new Delivery(roomCode, true, event, membersOf(roomCode)));
    }

    @Override
    public synchronized void sendTo(String participantId, ServerEvent event) {
        deliveries.add(new Delivery(participantId, false, event, Set.of(participantId)));
    }

    // --- assertions helpers ---

    public synchronized Set<String> membersOf(String roomCode) {
        return new HashSet<>(members.getOrDefault(roomCode, Set.of()));
    }

    public synchronized List<Delivery> all() {
        return new ArrayList<>(deliveries);
    }

    public synchronized <T extends ServerEvent> List<T> broadcastsTo(String roomCode, Class<T> type) {
        List<T> out = new ArrayList<>();
        for (Delivery d : deliveries) {
            if (d.room() && d.target().equals(roomCode) && type.isInstance(d.event())) out.add(type.cast(d.event()));
        }
        return out;
    }

    public synchronized <T extends ServerEvent> List<T> sentTo(String participantId, Class<T> type) {
        List<T> out = new ArrayList<>();
        for (Delivery d : deliveries) {
            if (!d.room() && d.target().equals(participantId) && type.isInstance(d.event())) out.add(type.cast(d.event()));
        }
        return out;
    }

    /** Everything that reached this identity, directly or through a room it was in at the time. */
    public synchronized <T extends ServerEvent> List<T> receivedBy(String participantId, Class<T> type) {
        List<T> out = new ArrayList<>();
        for (Delivery d : deliveries) {
            if (d.recipients().contains(participantId) && type.isInstance(d.event())) out.add(type.cast(d.event()));
        }
        return out;
    }

    public synchronized <T extends ServerEvent> T last(List<T> events) {
        return events.isEmpty() ? null : events.get(events.size() - 1);
    }

    public synchronized void clear() {
        deliveries.clear();
    }
}
