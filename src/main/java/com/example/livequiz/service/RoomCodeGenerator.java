package com.example.livequiz.service;

import com.example.livequiz.config.QuizProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.Random;

/** Short upper-case alphanumeric codes players can type. */
@Component
public class RoomCodeGenerator {

    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    private final Random random;
    private final int length;

    @Autowired
    public RoomCodeGenerator(QuizProperties props) {
        this(new SecureRandom(), props.getRoomCodeLength());
    }

    public RoomCodeGenerator(Random random, int length) {
        if (length < 1) throw new IllegalArgumentException("room code length must be positive: " + length);
        this.random = random;
        this.length = length;
    }

    public String next() {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    /** Room codes compare case-insensitively; this is the canonical form. */
    public static String normalize(String roomCode) {
        return (roomCode == null) ? "" : roomCode.trim().toUpperCase(Locale.ROOT);
    }
}
