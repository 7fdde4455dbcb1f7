package com.example.livequiz.messages.outbound;

import com.example.livequiz.model.AnswerRecord;
import com.example.livequiz.model.Participant;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Leaderboard row: score plus answer history (snapshot). */
public record Standing(String id, String name, int score, List<AnswerRecord> answers) {

    public static Standing of(Participant p) {
        return new Standing(p.getId(), p.getName(), p.getScore(), List.copyOf(p.getAnswers()));
    }

    public static List<Standing> listOf(List<Participant> ranked) {
        List<Standing> out = new ArrayList<>(ranked.size());
        for (Participant p : ranked) out.add(of(p));
        return out;
    }

    public static Map<String, Standing> mapOf(List<Participant> roster) {
        Map<String, Standing> out = new LinkedHashMap<>();
        for (Participant p : roster) out.put(p.getId(), of(p));
        return out;
    }
}
