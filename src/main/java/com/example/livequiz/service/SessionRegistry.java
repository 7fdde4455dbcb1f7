package com.example.livequiz.service;

import com.example.livequiz.config.QuizProperties;
import com.example.livequiz.model.Quiz;
import com.example.livequiz.model.QuizSession;
import com.example.livequiz.timer.QuestionTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;

/**
 * One live QuizSession per room code. Owns the lifecycle pairing of a session
 * and its quiz: both are created together and removed together.
 */
@Service
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, QuizSession> sessions = new ConcurrentHashMap<>();

    private final QuizCatalog catalog;
    private final RoomCodeGenerator codes;
    private final ScheduledExecutorService scheduler;
    private final int maxAttempts;

    @Autowired
    public SessionRegistry(QuizCatalog catalog,
                           RoomCodeGenerator codes,
                           ScheduledExecutorService scheduler,
                           QuizProperties props) {
        this(catalog, codes, scheduler, props.getRoomCodeAttempts());
    }

    public SessionRegistry(QuizCatalog catalog,
                           RoomCodeGenerator codes,
                           ScheduledExecutorService scheduler,
                           int maxAttempts) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.codes = Objects.requireNonNull(codes, "codes");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    // ========================================================================
    //  CREATE / LOOKUP / REMOVE
    // ========================================================================

    /**
     * Stores the quiz and opens a lobby for it under a fresh room code.
     * Codes are claimed with putIfAbsent; a collision draws a new code.
     *
     * @throws IllegalStateException when no free code was found within the attempt budget
     */
    public QuizSession create(Quiz quiz, String hostId) {
        Objects.requireNonNull(quiz, "quiz");
        Objects.requireNonNull(hostId, "hostId");

        String quizId = catalog.add(quiz);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String code = codes.next();
            QuizSession session = new QuizSession(code, quizId, quiz.title(), hostId, new QuestionTimer(scheduler));
            if (sessions.putIfAbsent(code, session) == null) {
                return session;
            }
            log.debug("Room code collision code={} attempt={}", code, attempt);
        }
        catalog.remove(quizId);
        throw new IllegalStateException("No free room code after " + maxAttempts + " attempts");
    }

    /** Case-insensitive lookup; null when no live session has this code. */
    public QuizSession get(String roomCode) {
        String code = RoomCodeGenerator.normalize(roomCode);
        if (code.isEmpty()) return null;
        return sessions.get(code);
    }

    public boolean exists(String roomCode) {
        return get(roomCode) != null;
    }

    /** Removes the session and its quiz, but only if this exact session is still registered. */
    public boolean remove(QuizSession session) {
        if (session == null) return false;
        boolean removed = sessions.remove(session.getCode(), session);
        if (removed) catalog.remove(session.getQuizId());
        return removed;
    }

    /** Removes whatever session is registered under the code, together with its quiz. */
    public QuizSession remove(String roomCode) {
        QuizSession session = get(roomCode);
        return remove(session) ? session : null;
    }

    /** Snapshot of live sessions, for scans such as disconnect handling. */
    public List<QuizSession> all() {
        return new ArrayList<>(sessions.values());
    }

    public int size() {
        return sessions.size();
    }
}
