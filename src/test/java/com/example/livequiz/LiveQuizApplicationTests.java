package com.example.livequiz;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the app on a random port and plays host + player over real sockets.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class LiveQuizApplicationTests {

    @LocalServerPort
    private int port;

    private final ObjectMapper mapper = new ObjectMapper();

    private static final class Inbox extends TextWebSocketHandler {
        final BlockingQueue<String> frames = new LinkedBlockingQueue<>();

        @Override
        protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
            frames.add(message.getPayload());
        }
    }

    private WebSocketSession connect(Inbox inbox) throws Exception {
        return new StandardWebSocketClient()
                .execute(inbox, "ws://localhost:" + port + "/quizSocket")
                .get(5, TimeUnit.SECONDS);
    }

    /** Next frame of the given type, skipping others. */
    private JsonNode next(Inbox inbox, String type) throws Exception {
        long deadline = System.currentTimeMillis() + 5_000;
        while (System.currentTimeMillis() < deadline) {
            String raw = inbox.frames.poll(250, TimeUnit.MILLISECONDS);
            if (raw == null || "pong".equals(raw)) continue;
            JsonNode node = mapper.readTree(raw);
            if (type.equals(node.path("type").asText())) return node;
        }
        fail("no '" + type + "' frame received");
        return null;
    }

    @Test
    void hostCreatesRoom_playerJoinsAnswers_hostLeaves() throws Exception {
        Inbox hostInbox = new Inbox();
        Inbox playerInbox = new Inbox();
        WebSocketSession host = connect(hostInbox);
        WebSocketSession player = connect(playerInbox);

        host.sendMessage(new TextMessage("{\"type\":\"createQuiz\",\"title\":\"Socket Quiz\",\"questions\":["
                + "{\"prompt\":\"2+2?\",\"choices\":[\"3\",\"4\"],\"correctAnswer\":\"4\",\"timeLimitSeconds\":30}]}"));
        String roomCode = next(hostInbox, "quizCreated").get("roomCode").asText();
        assertEquals(4, roomCode.length());

        player.sendMessage(new TextMessage("{\"type\":\"joinQuiz\",\"roomCode\":\"" + roomCode.toLowerCase()
                + "\",\"name\":\"Alice\"}"));
        JsonNode joined = next(playerInbox, "joinedRoom");
        assertEquals("Socket Quiz", joined.get("quizTitle").asText());
        assertEquals("Alice", next(hostInbox, "playerJoined").get("players").get(0).get("name").asText());

        host.sendMessage(new TextMessage("{\"type\":\"startQuiz\",\"roomCode\":\"" + roomCode + "\"}"));
        JsonNode question = next(playerInbox, "newQuestion");
        assertEquals("2+2?", question.get("prompt").asText());
        assertFalse(question.has("correctAnswer"));

        player.sendMessage(new TextMessage("{\"type\":\"submitAnswer\",\"roomCode\":\"" + roomCode + "\",\"answer\":\"4\"}"));
        assertEquals(10, next(playerInbox, "scoreUpdate").get("score").asInt());
        JsonNode board = next(hostInbox, "updateLeaderboard").get("leaderboard");
        assertEquals(10, board.get(0).get("score").asInt());

        host.close();
        assertEquals(roomCode, next(playerInbox, "hostDisconnected").get("roomCode").asText());
        player.close();
    }

    @Test
    void joinOfUnknownRoom_getsJoinError() throws Exception {
        Inbox inbox = new Inbox();
        WebSocketSession player = connect(inbox);

        player.sendMessage(new TextMessage("{\"type\":\"joinQuiz\",\"roomCode\":\"ZZZZ\",\"name\":\"Bob\"}"));

        assertEquals("Room not found. Please check the code.", next(inbox, "joinError").get("message").asText());
        player.close();
    }
}
