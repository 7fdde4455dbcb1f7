package com.example.livequiz.messages.outbound;

/** To host only. */
public record QuizCreated(String roomCode, String quizId) implements ServerEvent { }
