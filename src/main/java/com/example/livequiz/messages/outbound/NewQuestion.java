package com.example.livequiz.messages.outbound;

import com.example.livequiz.model.Question;

import java.util.List;

/** Room-wide. Never carries the correct answer. */
public record NewQuestion(
        int questionIndex,
        int totalQuestions,
        String prompt,
        List<String> choices,
        int timeLimitSeconds
) implements ServerEvent {

    public static NewQuestion of(int index, int total, Question q, int timeLimitSeconds) {
        return new NewQuestion(index, total, q.prompt(), q.choices(), timeLimitSeconds);
    }
}
