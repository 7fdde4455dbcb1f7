package com.example.livequiz.messages.outbound;

import java.util.List;

/** To host only, after each accepted answer. Sorted by score, highest first. */
public record UpdateLeaderboard(List<Standing> leaderboard) implements ServerEvent { }
