package com.example.livequiz.handler;

import com.example.livequiz.gateway.WebSocketBroadcastGateway;
import com.example.livequiz.messages.outbound.JoinError;
import com.example.livequiz.model.Quiz;
import com.example.livequiz.service.QuizSessionService;
import com.example.livequiz.service.RoomNotFoundException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class QuizWebSocketHandlerTest {

    private static Validator validator;

    private QuizSessionService service;
    private WebSocketBroadcastGateway gateway;
    private QuizWebSocketHandler handler;
    private WebSocketSession session;

    @BeforeAll
    static void initValidator() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @BeforeEach
    void setUp() {
        service = mock(QuizSessionService.class);
        gateway = mock(WebSocketBroadcastGateway.class);
        handler = new QuizWebSocketHandler(service, gateway, new ObjectMapper(), validator);

        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("s1");
        when(session.isOpen()).thenReturn(true);
    }

    private void receive(String json) throws Exception {
        handler.handleTextMessage(session, new TextMessage(json));
    }

    @Test
    void ping_isAnsweredWithPong() throws Exception {
        receive("ping");

        ArgumentCaptor<TextMessage> cap = ArgumentCaptor.forClass(TextMessage.class);
        verify(session).sendMessage(cap.capture());
        assertEquals("pong", cap.getValue().getPayload());
        verifyNoInteractions(service);
    }

    @Test
    void createQuiz_passesQuizToService_acceptingTimeLimitAlias() throws Exception {
        receive("{\"type\":\"createQuiz\",\"title\":\"Trivia\",\"questions\":["
                + "{\"prompt\":\"2+2?\",\"choices\":[\"3\",\"4\"],\"correctAnswer\":\"4\",\"timeLimit\":15},"
                + "{\"prompt\":\"Sky?\",\"choices\":[\"blue\",\"red\"],\"correctAnswer\":\"blue\",\"timeLimitSeconds\":30}]}");

        ArgumentCaptor<Quiz> cap = ArgumentCaptor.forClass(Quiz.class);
        verify(service).createQuiz(eq("s1"), cap.capture());
        Quiz quiz = cap.getValue();
        assertEquals("Trivia", quiz.title());
        assertEquals(2, quiz.size());
        assertEquals(15, quiz.question(0).timeLimitSeconds());
        assertEquals(30, quiz.question(1).timeLimitSeconds());
        assertEquals(List.of("3", "4"), quiz.question(0).choices());
        assertEquals("4", quiz.question(0).correctAnswer());
    }

    @Test
    void hostAndPlayerActions_areRoutedWithSessionIdAsIdentity() throws Exception {
        receive("{\"type\":\"startQuiz\",\"roomCode\":\"AB12\"}");
        receive("{\"type\":\"nextQuestion\",\"roomCode\":\"AB12\"}");
        receive("{\"type\":\"joinQuiz\",\"roomCode\":\"ab12\",\"name\":\"Alice\"}");
        receive("{\"type\":\"submitAnswer\",\"roomCode\":\"AB12\",\"answer\":\"4\"}");

        verify(service).startQuiz("s1", "AB12");
        verify(service).nextQuestion("s1", "AB12");
        verify(service).join("s1", "ab12", "Alice");
        verify(service).submitAnswer("s1", "AB12", "4");
    }

    @Test
    void numericAnswer_isReadAsText() throws Exception {
        receive("{\"type\":\"submitAnswer\",\"roomCode\":\"AB12\",\"answer\":4}");
        verify(service).submitAnswer("s1", "AB12", "4");
    }

    @Test
    void joinOfUnknownRoom_repliesJoinError() throws Exception {
        when(service.join(anyString(), anyString(), any())).thenThrow(new RoomNotFoundException("ZZZZ"));

        receive("{\"type\":\"joinQuiz\",\"roomCode\":\"zzzz\",\"name\":\"Alice\"}");

        verify(gateway).sendTo("s1", new JoinError(JoinError.ROOM_NOT_FOUND));
    }

    @Test
    void joinWithBlankCode_repliesJoinError_withoutTouchingService() throws Exception {
        receive("{\"type\":\"joinQuiz\",\"roomCode\":\"  \",\"name\":\"Alice\"}");

        verify(gateway).sendTo("s1", new JoinError(JoinError.ROOM_NOT_FOUND));
        verifyNoInteractions(service);
    }

    @Test
    void startWithoutCode_isIgnored() throws Exception {
        receive("{\"type\":\"startQuiz\"}");
        verifyNoInteractions(service);
        verify(gateway, never()).sendTo(anyString(), any());
    }

    @Test
    void unknownTypeAndMalformedFrames_areIgnored() throws Exception {
        receive("{\"type\":\"launchRockets\"}");
        receive("{not json");
        receive("{\"roomCode\":\"AB12\"}");

        verifyNoInteractions(service);
        verify(session, never()).close(any());
    }

    @Test
    void serviceFailure_doesNotEscapeHandler() {
        doThrow(new IllegalStateException("boom")).when(service).createQuiz(anyString(), any());

        assertDoesNotThrow(() -> receive("{\"type\":\"createQuiz\",\"title\":\"T\",\"questions\":[]}"));
    }

    @Test
    void open_registersSessionWithGateway() {
        handler.afterConnectionEstablished(session);
        verify(gateway).register(session);
    }

    @Test
    void close_disconnectsIdentity_andUnregisters() {
        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        verify(service).disconnect("s1");
        verify(gateway).unregister(session);
    }

    @Test
    void close_unregistersEvenIfDisconnectFails() {
        doThrow(new IllegalStateException("boom")).when(service).disconnect("s1");

        assertDoesNotThrow(() -> handler.afterConnectionClosed(session, CloseStatus.GOING_AWAY));
        verify(gateway).unregister(session);
    }
}
