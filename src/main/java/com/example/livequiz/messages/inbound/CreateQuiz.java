package com.example.livequiz.messages.inbound;

import com.example.livequiz.model.Question;
import com.example.livequiz.model.Quiz;

import java.util.List;

/** Host: register a question set and open a room for it. */
public record CreateQuiz(String title, List<Question> questions) implements ClientMessage {

    public Quiz toQuiz() {
        return new Quiz(title, questions);
    }
}
