package com.example.livequiz.messages.outbound;

import java.util.List;

/** To the joining player only. */
public record JoinedRoom(String roomCode, String quizTitle, List<PlayerView> players) implements ServerEvent { }
