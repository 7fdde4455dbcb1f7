package com.example.livequiz.messages.outbound;

import java.util.List;

/** Room-wide roster refresh, sent on join and on player disconnect. */
public record PlayerJoined(List<PlayerView> players, String quizTitle) implements ServerEvent { }
