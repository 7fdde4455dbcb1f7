package com.example.livequiz.messages.outbound;

import java.util.Map;

/** Room-wide. {@code results} is keyed by participant id, in join order. */
public record QuestionTimeout(String correctAnswer, Map<String, Standing> results) implements ServerEvent { }
