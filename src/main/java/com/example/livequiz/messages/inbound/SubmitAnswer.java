package com.example.livequiz.messages.inbound;

import jakarta.validation.constraints.NotBlank;

/** Player: answer the question currently on screen. */
public record SubmitAnswer(@NotBlank String roomCode, String answer) implements ClientMessage { }
