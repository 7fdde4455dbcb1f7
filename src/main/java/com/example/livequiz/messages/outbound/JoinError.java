package com.example.livequiz.messages.outbound;

public record JoinError(String message) implements ServerEvent {

    public static final String ROOM_NOT_FOUND = "Room not found. Please check the code.";
}
