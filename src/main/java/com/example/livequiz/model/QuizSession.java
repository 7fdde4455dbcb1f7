package com.example.livequiz.model;

import com.example.livequiz.timer.QuestionTimer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Live state of one room: roster/leaderboard, question cursor, host binding and question timer.
 * QuizSessionService synchronizes on QuizSession instances, so this class itself does not add extra locking.
 */
public class QuizSession {

    /** Cursor value before the first question. */
    public static final int NOT_STARTED = -1;

    // ---------------------------------------------------------------------
    // Identity
    // ---------------------------------------------------------------------

    private final String code;
    private final String quizId;
    private final String title;
    private final String hostId;

    // ---------------------------------------------------------------------
    // Progress
    // ---------------------------------------------------------------------

    private SessionPhase phase = SessionPhase.LOBBY;
    private int currentQuestionIndex = NOT_STARTED;
    private final QuestionTimer timer;

    /** Set once the room is torn down; late timer callbacks check it. */
    private boolean closed = false;

    /** Participants by id; insertion order is join order. */
    private final Map<String, Participant> participants = new LinkedHashMap<>();

    public QuizSession(String code, String quizId, String title, String hostId, QuestionTimer timer) {
        this.code = Objects.requireNonNull(code, "code");
        this.quizId = Objects.requireNonNull(quizId, "quizId");
        this.title = (title == null || title.isBlank()) ? Quiz.UNTITLED : title;
        this.hostId = Objects.requireNonNull(hostId, "hostId");
        this.timer = Objects.requireNonNull(timer, "timer");
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public String getCode() { return code; }
    public String getQuizId() { return quizId; }
    public String getTitle() { return title; }
    public String getHostId() { return hostId; }
    public QuestionTimer getTimer() { return timer; }

    public boolean isHost(String participantId) {
        return hostId.equals(participantId);
    }

    public SessionPhase getPhase() { return phase; }
    public int getCurrentQuestionIndex() { return currentQuestionIndex; }

    public boolean isClosed() { return closed; }

    // ---------------------------------------------------------------------
    // Transitions (called by QuizSessionService under the session monitor)
    // ---------------------------------------------------------------------

    /** Moves the cursor forward by one and opens that question. */
    public int openNextQuestion() {
        currentQuestionIndex++;
        phase = SessionPhase.QUESTION_OPEN;
        return currentQuestionIndex;
    }

    public void closeQuestion() {
        if (phase == SessionPhase.QUESTION_OPEN) phase = SessionPhase.QUESTION_CLOSED;
    }

    /** Parks the cursor at {@code questionCount} (one past the last question). */
    public void finish(int questionCount) {
        currentQuestionIndex = Math.max(currentQuestionIndex, questionCount);
        phase = SessionPhase.FINISHED;
    }

    public void markClosed() {
        closed = true;
    }

    // ---------------------------------------------------------------------
    // Roster / leaderboard
    // ---------------------------------------------------------------------

    /** Snapshot in join order. */
    public List<Participant> getRoster() {
        return new ArrayList<>(participants.values());
    }

    public Participant getParticipant(String participantId) {
        if (participantId == null) return null;
        return participants.get(participantId);
    }

    public boolean hasParticipant(String participantId) {
        return participantId != null && participants.containsKey(participantId);
    }

    public void addParticipant(Participant p) {
        if (p == null) return;
        participants.putIfAbsent(p.getId(), p);
    }

    public Participant removeParticipant(String participantId) {
        if (participantId == null) return null;
        return participants.remove(participantId);
    }

    /** Highest score first; equal scores keep join order. */
    public List<Participant> getRanking() {
        List<Participant> ranked = getRoster();
        ranked.sort(Comparator.comparingInt(Participant::getScore).reversed());
        return ranked;
    }

    @Override
    public String toString() {
        return "QuizSession{" +
                "code='" + code + '\'' +
                ", phase=" + phase +
                ", index=" + currentQuestionIndex +
                ", participants=" + participants.size() +
                ", closed=" + closed +
                '}';
    }
}
