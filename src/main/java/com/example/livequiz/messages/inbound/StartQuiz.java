package com.example.livequiz.messages.inbound;

import jakarta.validation.constraints.NotBlank;

/** Host: show the first question. */
public record StartQuiz(@NotBlank String roomCode) implements ClientMessage { }
