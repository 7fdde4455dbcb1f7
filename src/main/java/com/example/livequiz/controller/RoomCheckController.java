package com.example.livequiz.controller;

import com.example.livequiz.service.SessionRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/rooms")
public class RoomCheckController {

    private final SessionRegistry registry;

    public RoomCheckController(SessionRegistry registry) {
        this.registry = registry;
    }

    // Returns true if a live room answers to this code (case-insensitive)
    @GetMapping("/{roomCode}/exists")
    public boolean exists(@PathVariable String roomCode) {
        return registry.exists(roomCode);
    }
}
