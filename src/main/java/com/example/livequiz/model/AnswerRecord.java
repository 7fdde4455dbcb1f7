package com.example.livequiz.model;

/** One accepted answer of a participant. At most one per question index. */
public record AnswerRecord(int questionIndex, String answer, boolean correct) { }
