package com.example.livequiz.messages.outbound;

import com.example.livequiz.model.Participant;

import java.util.ArrayList;
import java.util.List;

public record PlayerView(String id, String name, int score) {

    public static PlayerView of(Participant p) {
        return new PlayerView(p.getId(), p.getName(), p.getScore());
    }

    public static List<PlayerView> listOf(List<Participant> roster) {
        List<PlayerView> out = new ArrayList<>(roster.size());
        for (Participant p : roster) out.add(of(p));
        return out;
    }
}
