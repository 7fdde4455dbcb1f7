package com.example.livequiz.messages.outbound;

/** To the submitting player only: their own cumulative score. */
public record ScoreUpdate(int score) implements ServerEvent { }
