package com.example.livequiz.service;

import com.example.livequiz.config.QuizProperties;
import com.example.livequiz.gateway.BroadcastGateway;
import com.example.livequiz.messages.outbound.HostDisconnected;
import com.example.livequiz.messages.outbound.JoinedRoom;
import com.example.livequiz.messages.outbound.NewQuestion;
import com.example.livequiz.messages.outbound.PlayerJoined;
import com.example.livequiz.messages.outbound.PlayerView;
import com.example.livequiz.messages.outbound.QuestionTimeout;
import com.example.livequiz.messages.outbound.QuizCreated;
import com.example.livequiz.messages.outbound.QuizFinished;
import com.example.livequiz.messages.outbound.ScoreUpdate;
import com.example.livequiz.messages.outbound.Standing;
import com.example.livequiz.messages.outbound.UpdateLeaderboard;
import com.example.livequiz.model.Participant;
import com.example.livequiz.model.Question;
import com.example.livequiz.model.Quiz;
import com.example.livequiz.model.QuizSession;
import com.example.livequiz.model.SessionPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Quiz session state machine: lobby → question i (open, then closed for the reveal) → finished.
 *
 * Every transition runs under {@code synchronized (session)}; one monitor per room, none shared.
 * Events are pushed while the monitor is held so each room sees them in transition order.
 */
@Service
public class QuizSessionService {

    private static final Logger log = LoggerFactory.getLogger(QuizSessionService.class);

    private static final int MAX_NAME_LENGTH = 80;

    private final SessionRegistry registry;
    private final QuizCatalog catalog;
    private final BroadcastGateway gateway;
    private final ScheduledExecutorService scheduler;
    private final QuizProperties props;

    public QuizSessionService(SessionRegistry registry,
                              QuizCatalog catalog,
                              BroadcastGateway gateway,
                              ScheduledExecutorService scheduler,
                              QuizProperties props) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.props = Objects.requireNonNull(props, "props");
    }

    // ========================================================================
    //  HOST: CREATE / START / NEXT
    // ========================================================================

    /**
     * Registers the quiz, opens a lobby hosted by {@code hostId} and replies {@code quizCreated}.
     * A host owns one room at a time: a room this identity still hosts is torn down first.
     */
    public QuizSession createQuiz(String hostId, Quiz quiz) {
        Objects.requireNonNull(hostId, "hostId");
        Objects.requireNonNull(quiz, "quiz");

        for (QuizSession previous : registry.all()) {
            synchronized (previous) {
                if (!previous.isClosed() && previous.isHost(hostId)) {
                    log.info("Host {} opens a new room; closing room={}", hostId, previous.getCode());
                    gateway.unsubscribe(previous.getCode(), hostId);
                    closeLocked(previous);
                }
            }
        }

        QuizSession session = registry.create(quiz, hostId);
        gateway.subscribe(session.getCode(), hostId);
        gateway.sendTo(hostId, new QuizCreated(session.getCode(), session.getQuizId()));

        log.info("Quiz created room={} quizId={} host={} questions={}",
                session.getCode(), session.getQuizId(), hostId, quiz.size());
        return session;
    }

    /** Shows the first question. Only from the lobby; a repeated start is ignored. */
    public void startQuiz(String hostId, String roomCode) {
        QuizSession session = registry.get(roomCode);
        if (session == null) {
            log.info("Start ignored: room {} not found", roomCode);
            return;
        }
        synchronized (session) {
            if (!acceptsHostAction(session, hostId, "start")) return;
            if (session.getPhase() != SessionPhase.LOBBY) {
                log.info("Start ignored: room={} already started (phase={})", session.getCode(), session.getPhase());
                return;
            }
            advanceLocked(session);
            log.info("Quiz started room={}", session.getCode());
        }
    }

    /** Manual advance by the host; cancels the running question timer. */
    public void nextQuestion(String hostId, String roomCode) {
        QuizSession session = registry.get(roomCode);
        if (session == null) {
            log.debug("Next ignored: room {} not found", roomCode);
            return;
        }
        synchronized (session) {
            if (!acceptsHostAction(session, hostId, "next")) return;
            log.info("Next question requested room={}", session.getCode());
            advanceLocked(session);
        }
    }

    private boolean acceptsHostAction(QuizSession session, String callerId, String action) {
        if (session.isClosed()) {
            log.debug("{} ignored: room={} already closed", action, session.getCode());
            return false;
        }
        if (!session.isHost(callerId)) {
            log.warn("{} ignored: {} is not host of room={}", action, callerId, session.getCode());
            return false;
        }
        return true;
    }

    // ========================================================================
    //  TRANSITIONS (caller holds the session monitor)
    // ========================================================================

    /**
     * Cursor +1. Broadcasts the next question and arms its timer, or the final ranking
     * when the cursor moved past the last question. No-op once finished.
     */
    private void advanceLocked(QuizSession session) {
        if (session.getPhase() == SessionPhase.FINISHED) {
            log.debug("Advance ignored: room={} already finished", session.getCode());
            return;
        }
        Quiz quiz = quizOf(session);
        if (quiz == null) return;

        session.getTimer().cancel();
        int index = session.openNextQuestion();

        if (quiz.hasQuestion(index)) {
            Question q = quiz.question(index);
            int limit = q.effectiveTimeLimitSeconds(props.getDefaultTimeLimitSeconds());
            gateway.broadcast(session.getCode(), NewQuestion.of(index, quiz.size(), q, limit));
            session.getTimer().arm(TimeUnit.SECONDS.toMillis(limit), token -> onQuestionTimeout(session, token));
            log.info("Question {}/{} shown room={} limit={}s", index + 1, quiz.size(), session.getCode(), limit);
        } else {
            session.finish(quiz.size());
            List<Standing> ranking = Standing.listOf(session.getRanking());
            gateway.broadcast(session.getCode(), new QuizFinished(ranking));
            log.info("Quiz finished room={} players={}", session.getCode(), ranking.size());
        }
    }

    /** Question timer callback. Only the live token gets through. */
    void onQuestionTimeout(QuizSession session, long token) {
        try {
            synchronized (session) {
                if (session.isClosed() || !session.getTimer().claim(token)) {
                    log.debug("Stale question timer ignored room={} token={}", session.getCode(), token);
                    return;
                }
                Quiz quiz = quizOf(session);
                if (quiz == null) return;

                final int index = session.getCurrentQuestionIndex();
                if (!quiz.hasQuestion(index)) return;

                session.closeQuestion();
                gateway.broadcast(session.getCode(),
                        new QuestionTimeout(quiz.question(index).correctAnswer(), Standing.mapOf(session.getRoster())));
                log.info("Question timed out room={} index={}", session.getCode(), index);

                scheduler.schedule(() -> advanceAfterReveal(session, index),
                        props.getRevealGraceMs(), TimeUnit.MILLISECONDS);
            }
        } catch (RuntimeException e) {
            log.error("Question timeout handling failed (room={})", session.getCode(), e);
        }
    }

    /**
     * Grace-delay callback. Advances only if the room still shows the revealed answer of
     * {@code index}; a manual advance in between makes this a no-op.
     */
    void advanceAfterReveal(QuizSession session, int index) {
        try {
            synchronized (session) {
                if (session.isClosed()
                        || session.getCurrentQuestionIndex() != index
                        || session.getPhase() != SessionPhase.QUESTION_CLOSED) {
                    log.debug("Stale reveal advance ignored room={} index={} (now index={}, phase={})",
                            session.getCode(), index, session.getCurrentQuestionIndex(), session.getPhase());
                    return;
                }
                advanceLocked(session);
            }
        } catch (RuntimeException e) {
            log.error("Auto-advance failed (room={})", session.getCode(), e);
        }
    }

    private Quiz quizOf(QuizSession session) {
        Quiz quiz = catalog.find(session.getQuizId()).orElse(null);
        if (quiz == null) {
            log.warn("Quiz {} missing for room={}", session.getQuizId(), session.getCode());
        }
        return quiz;
    }

    // ========================================================================
    //  PLAYER: JOIN / SUBMIT
    // ========================================================================

    /**
     * Adds the participant to the room (case-insensitive code), replies {@code joinedRoom}
     * and refreshes everyone's roster.
     *
     * @throws RoomNotFoundException when no live room has this code
     */
    public QuizSession join(String participantId, String roomCode, String requestedName) {
        Objects.requireNonNull(participantId, "participantId");
        QuizSession session = registry.get(roomCode);
        if (session == null) throw new RoomNotFoundException(RoomCodeGenerator.normalize(roomCode));

        synchronized (session) {
            if (session.isClosed()) throw new RoomNotFoundException(session.getCode());

            boolean fresh = !session.hasParticipant(participantId);
            if (fresh) {
                Participant p = new Participant(participantId, normalizeName(requestedName));
                session.addParticipant(p);
                gateway.subscribe(session.getCode(), participantId);
                log.info("{} ({}) joined room={}", p.getName(), participantId, session.getCode());
            } else {
                log.debug("Re-join of {} in room={}", participantId, session.getCode());
            }

            List<PlayerView> players = PlayerView.listOf(session.getRoster());
            gateway.sendTo(participantId, new JoinedRoom(session.getCode(), session.getTitle(), players));
            if (fresh) {
                gateway.broadcast(session.getCode(), new PlayerJoined(players, session.getTitle()));
            }
        }
        return session;
    }

    /**
     * First answer per participant and question counts; anything else is dropped silently.
     * On acceptance the host gets the sorted leaderboard and the player their own score.
     */
    public void submitAnswer(String participantId, String roomCode, String answer) {
        QuizSession session = registry.get(roomCode);
        if (session == null) {
            log.debug("Answer ignored: room {} not found", roomCode);
            return;
        }
        synchronized (session) {
            if (session.isClosed() || session.getPhase() != SessionPhase.QUESTION_OPEN) {
                log.debug("Answer ignored: room={} not accepting answers (phase={})", session.getCode(), session.getPhase());
                return;
            }
            Participant p = session.getParticipant(participantId);
            if (p == null) {
                log.debug("Answer ignored: {} is not in room={}", participantId, session.getCode());
                return;
            }
            Quiz quiz = quizOf(session);
            if (quiz == null) return;

            int index = session.getCurrentQuestionIndex();
            boolean correct = quiz.question(index).isCorrect(answer);
            if (!p.recordAnswer(index, answer, correct, props.getPointsPerCorrectAnswer())) {
                log.debug("Duplicate answer ignored: {} room={} index={}", participantId, session.getCode(), index);
                return;
            }
            log.info("Answer submitted room={} by {}. Answer: {}, Correct: {}", session.getCode(), p.getName(), answer, correct);

            gateway.sendTo(session.getHostId(), new UpdateLeaderboard(Standing.listOf(session.getRanking())));
            gateway.sendTo(participantId, new ScoreUpdate(p.getScore()));
        }
    }

    // ========================================================================
    //  DISCONNECT / CLOSE
    // ========================================================================

    /**
     * Host → every room it hosts is torn down. Player → removed from every roster it is on,
     * with a roster refresh per room. Unknown identities are a no-op.
     */
    public void disconnect(String participantId) {
        if (participantId == null) return;
        List<QuizSession> sessions = registry.all();
        boolean matched = false;

        // hosted rooms close regardless of any roster the identity is also on
        for (QuizSession session : sessions) {
            synchronized (session) {
                if (!session.isClosed() && session.isHost(participantId)) {
                    log.info("Host {} disconnected from room={}", participantId, session.getCode());
                    closeLocked(session);
                    matched = true;
                }
            }
        }

        for (QuizSession session : sessions) {
            synchronized (session) {
                if (session.isClosed()) continue;
                Participant removed = session.removeParticipant(participantId);
                if (removed == null) continue;

                gateway.unsubscribe(session.getCode(), participantId);
                gateway.broadcast(session.getCode(),
                        new PlayerJoined(PlayerView.listOf(session.getRoster()), session.getTitle()));
                log.info("{} ({}) disconnected from room={}", removed.getName(), participantId, session.getCode());
                matched = true;
            }
        }

        if (!matched) log.debug("Disconnect of {} matched no room", participantId);
    }

    private void closeLocked(QuizSession session) {
        session.markClosed();
        session.getTimer().cancel();
        registry.remove(session);
        gateway.broadcast(session.getCode(), new HostDisconnected(session.getCode()));
        gateway.dropRoom(session.getCode());
    }

    // ========================================================================
    //  MISC HELPERS
    // ========================================================================

    static String normalizeName(String s) {
        String t = (s == null) ? "" : s.trim();
        if (t.isEmpty()) t = "Guest";
        if (t.length() > MAX_NAME_LENGTH) t = t.substring(0, MAX_NAME_LENGTH);
        return t;
    }

    public int activeSessionCount() {
        return registry.size();
    }
}
