package com.example.livequiz.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One authored question. Only {@code correctAnswer} and {@code timeLimitSeconds}
 * matter to the session; prompt and choices are passed through to clients.
 */
public record Question(
        String prompt,
        List<String> choices,
        String correctAnswer,
        @JsonAlias("timeLimit") Integer timeLimitSeconds
) {

    public Question {
        choices = (choices == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(choices));
    }

    /** Time limit in seconds, or {@code fallback} when missing or not positive. */
    public int effectiveTimeLimitSeconds(int fallback) {
        return (timeLimitSeconds == null || timeLimitSeconds <= 0) ? fallback : timeLimitSeconds;
    }

    /** Exact, case-sensitive comparison against the authored answer. */
    public boolean isCorrect(String answer) {
        return correctAnswer != null && correctAnswer.equals(answer);
    }
}
