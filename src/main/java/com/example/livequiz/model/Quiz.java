package com.example.livequiz.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Immutable question set submitted by a host. */
public record Quiz(String title, List<Question> questions) {

    public static final String UNTITLED = "Untitled quiz";

    public Quiz {
        title = (title == null || title.isBlank()) ? UNTITLED : title.trim();
        if (questions == null) {
            questions = List.of();
        } else {
            List<Question> copy = new ArrayList<>(questions);
            copy.removeIf(Objects::isNull);
            questions = Collections.unmodifiableList(copy);
        }
    }

    public int size() {
        return questions.size();
    }

    public boolean hasQuestion(int index) {
        return index >= 0 && index < questions.size();
    }

    public Question question(int index) {
        return questions.get(index);
    }
}
