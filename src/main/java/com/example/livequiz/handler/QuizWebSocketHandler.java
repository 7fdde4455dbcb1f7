package com.example.livequiz.handler;

import com.example.livequiz.gateway.WebSocketBroadcastGateway;
import com.example.livequiz.messages.inbound.ClientMessage;
import com.example.livequiz.messages.inbound.CreateQuiz;
import com.example.livequiz.messages.inbound.JoinQuiz;
import com.example.livequiz.messages.inbound.NextQuestion;
import com.example.livequiz.messages.inbound.StartQuiz;
import com.example.livequiz.messages.inbound.SubmitAnswer;
import com.example.livequiz.messages.outbound.JoinError;
import com.example.livequiz.service.QuizSessionService;
import com.example.livequiz.service.RoomNotFoundException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Set;

/**
 * WebSocket handler for the quiz socket.
 * - The WebSocket session id is the participant identity for host and players
 * - Frames are JSON objects with a "type" (createQuiz, startQuiz, nextQuestion, joinQuiz, submitAnswer)
 * - Heartbeat: replies "pong" to "ping"
 * - On close: the identity is disconnected from whatever room it hosted or joined
 */
@Component
public class QuizWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(QuizWebSocketHandler.class);

    private final QuizSessionService quizService;
    private final WebSocketBroadcastGateway gateway;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    public QuizWebSocketHandler(QuizSessionService quizService,
                                WebSocketBroadcastGateway gateway,
                                ObjectMapper objectMapper,
                                Validator validator) {
        this.quizService = quizService;
        this.gateway = gateway;
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        gateway.register(session);
        log.info("WS OPEN id={} remote={}", session.getId(), session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) throws Exception {
        final String id = session.getId();
        final String payload = message.getPayload();

        if ("ping".equals(payload)) {
            try { if (session.isOpen()) session.sendMessage(new TextMessage("pong")); }
            catch (Exception e) { log.warn("WS pong send failed (id={}): {}", id, e.toString()); }
            return;
        }

        ClientMessage msg;
        try {
            msg = objectMapper.readValue(payload, ClientMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("WS unreadable frame from id={}: {}", id, e.getOriginalMessage());
            return;
        }
        if (msg == null) return;

        try {
            dispatch(id, msg);
        } catch (RuntimeException e) {
            log.error("WS handleTextMessage failed (id={}, type={})", id, msg.getClass().getSimpleName(), e);
        }
    }

    /** Routes one decoded frame from {@code participantId} to the quiz service. */
    void dispatch(String participantId, ClientMessage msg) {
        Set<ConstraintViolation<ClientMessage>> violations = validator.validate(msg);
        if (!violations.isEmpty()) {
            log.warn("WS invalid {} from id={}: {}", msg.getClass().getSimpleName(), participantId, violations.size());
            if (msg instanceof JoinQuiz) {
                gateway.sendTo(participantId, new JoinError(JoinError.ROOM_NOT_FOUND));
            }
            return;
        }

        if (msg instanceof CreateQuiz create) {
            quizService.createQuiz(participantId, create.toQuiz());
        } else if (msg instanceof StartQuiz start) {
            quizService.startQuiz(participantId, start.roomCode());
        } else if (msg instanceof NextQuestion next) {
            quizService.nextQuestion(participantId, next.roomCode());
        } else if (msg instanceof JoinQuiz join) {
            try {
                quizService.join(participantId, join.roomCode(), join.name());
            } catch (RoomNotFoundException e) {
                log.info("Join rejected id={} room={}", participantId, e.getRoomCode());
                gateway.sendTo(participantId, new JoinError(JoinError.ROOM_NOT_FOUND));
            }
        } else if (msg instanceof SubmitAnswer submit) {
            quizService.submitAnswer(participantId, submit.roomCode(), submit.answer());
        } else {
            log.debug("Ignored message: {}", msg);
        }
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.error("WS ERROR id={} : transport error", session.getId(), exception);
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        final String id = session.getId();
        log.info("WS CLOSE id={} code={} reason={}", id, status.getCode(), status.getReason());
        try {
            quizService.disconnect(id);
        } catch (RuntimeException e) {
            log.error("WS afterConnectionClosed handling failed (id={})", id, e);
        } finally {
            gateway.unregister(session);
        }
    }
}
