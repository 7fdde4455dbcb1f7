package com.example.livequiz.service;

/** A join named a room code with no live session behind it. */
public class RoomNotFoundException extends RuntimeException {

    private final String roomCode;

    public RoomNotFoundException(String roomCode) {
        super("Room not found: " + roomCode);
        this.roomCode = roomCode;
    }

    public String getRoomCode() {
        return roomCode;
    }
}
