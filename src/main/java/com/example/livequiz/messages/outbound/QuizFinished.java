package com.example.livequiz.messages.outbound;

import java.util.List;

/** Room-wide final ranking. */
public record QuizFinished(List<Standing> leaderboard) implements ServerEvent { }
