package com.example.livequiz.messages.inbound;

import jakarta.validation.constraints.NotBlank;

/** Player: enter a room by its code. Name may be blank ("Guest"). */
public record JoinQuiz(@NotBlank String roomCode, String name) implements ClientMessage { }
