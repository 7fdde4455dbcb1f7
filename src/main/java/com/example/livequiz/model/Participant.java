package com.example.livequiz.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Roster entry and leaderboard entry in one: display name, cumulative score and answer history.
 * Mutated only under the owning session's monitor.
 */
public class Participant {

    private final String id;
    private final String name;
    private int score;
    private final List<AnswerRecord> answers = new ArrayList<>();

    public Participant(String id, String name) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
    }

    // identity
    public String getId() { return id; }
    public String getName() { return name; }

    // scoring
    public int getScore() { return score; }

    public List<AnswerRecord> getAnswers() { return Collections.unmodifiableList(answers); }

    public boolean hasAnswered(int questionIndex) {
        for (AnswerRecord a : answers) {
            if (a.questionIndex() == questionIndex) return true;
        }
        return false;
    }

    /**
     * Appends an answer for the given question and awards {@code points} when correct.
     * Returns false (and changes nothing) if this question was already answered.
     */
    public boolean recordAnswer(int questionIndex, String answer, boolean correct, int points) {
        if (hasAnswered(questionIndex)) return false;
        answers.add(new AnswerRecord(questionIndex, answer, correct));
        if (correct) score += points;
        return true;
    }

    @Override
    public String toString() {
        return "Participant{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", score=" + score +
                ", answers=" + answers.size() +
                '}';
    }
}
