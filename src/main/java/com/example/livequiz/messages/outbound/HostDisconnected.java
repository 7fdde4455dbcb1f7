package com.example.livequiz.messages.outbound;

/** Room-wide. The room is gone after this. */
public record HostDisconnected(String roomCode) implements ServerEvent { }
