package com.example.livequiz.messages.inbound;

import jakarta.validation.constraints.NotBlank;

/** Host: skip ahead to the next question (or finish). */
public record NextQuestion(@NotBlank String roomCode) implements ClientMessage { }
