package com.example.livequiz.service;

import com.example.livequiz.model.Quiz;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/** Authored quizzes by id. Entries are immutable, so reads need no lock. */
@Service
public class QuizCatalog {

    private final Map<String, Quiz> quizzes = new ConcurrentHashMap<>();

    /** Stores the quiz under a fresh {@code quiz-<uuid>} id. */
    public String add(Quiz quiz) {
        Objects.requireNonNull(quiz, "quiz");
        String id = "quiz-" + UUID.randomUUID();
        quizzes.put(id, quiz);
        return id;
    }

    public Optional<Quiz> find(String quizId) {
        if (quizId == null) return Optional.empty();
        return Optional.ofNullable(quizzes.get(quizId));
    }

    public void remove(String quizId) {
        if (quizId != null) quizzes.remove(quizId);
    }

    public int size() {
        return quizzes.size();
    }
}
