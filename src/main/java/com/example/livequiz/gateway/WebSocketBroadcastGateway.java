package com.example.livequiz.gateway;

import com.example.livequiz.messages.outbound.ServerEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * BroadcastGateway over Spring WebSocket sessions. The session id is the participant id.
 * Sessions are wrapped in {@link ConcurrentWebSocketSessionDecorator} because several rooms
 * (and timer threads) may push to one socket at the same time.
 */
@Component
public class WebSocketBroadcastGateway implements BroadcastGateway {

    private static final Logger log = LoggerFactory.getLogger(WebSocketBroadcastGateway.class);

    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ObjectWriter writer;

    /** participantId → session */
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    /** roomCode → participant ids */
    private final Map<String, Set<String>> members = new ConcurrentHashMap<>();

    public WebSocketBroadcastGateway(ObjectMapper objectMapper) {
        this.writer = objectMapper.writerFor(ServerEvent.class);
    }

    // --- connection tracking (called by the WebSocket handler) ---

    public void register(WebSocketSession session) {
        sessions.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
    }

    public void unregister(WebSocketSession session) {
        String id = session.getId();
        sessions.remove(id);
        for (Set<String> ids : members.values()) ids.remove(id);
    }

    public int connectionCount() {
        return sessions.size();
    }

    // --- BroadcastGateway ---

    @Override
    public void subscribe(String roomCode, String participantId) {
        if (roomCode == null || participantId == null) return;
        members.computeIfAbsent(roomCode, k -> ConcurrentHashMap.newKeySet()).add(participantId);
    }

    @Override
    public void unsubscribe(String roomCode, String participantId) {
        if (roomCode == null || participantId == null) return;
        Set<String> ids = members.get(roomCode);
        if (ids != null) ids.remove(participantId);
    }

    @Override
    public void dropRoom(String roomCode) {
        if (roomCode == null) return;
        members.remove(roomCode);
    }

    @Override
    public void broadcast(String roomCode, ServerEvent event) {
        Set<String> ids = members.get(roomCode);
        if (ids == null || ids.isEmpty()) return;
        String json = toJson(event);
        if (json == null) return;
        for (String id : List.copyOf(ids)) {
            send(id, json);
        }
    }

    @Override
    public void sendTo(String participantId, ServerEvent event) {
        if (participantId == null) return;
        String json = toJson(event);
        if (json != null) send(participantId, json);
    }

    // --- helpers ---

    private String toJson(ServerEvent event) {
        try {
            return writer.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize event {}", event, e);
            return null;
        }
    }

    private void send(String participantId, String json) {
        WebSocketSession session = sessions.get(participantId);
        if (session == null) {
            log.debug("Send skipped: no open session for participant={}", participantId);
            return;
        }
        try {
            if (session.isOpen()) {
                session.sendMessage(new TextMessage(json));
            } else {
                sessions.remove(participantId);
            }
        } catch (IOException | RuntimeException e) {
            log.warn("WS send failed (participant={}): {}", participantId, e.toString());
        }
    }
}
