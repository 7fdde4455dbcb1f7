package com.example.livequiz.messages.inbound;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** Frames sent by host and player clients, discriminated by {@code type}. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CreateQuiz.class, name = "createQuiz"),
        @JsonSubTypes.Type(value = StartQuiz.class, name = "startQuiz"),
        @JsonSubTypes.Type(value = NextQuestion.class, name = "nextQuestion"),
        @JsonSubTypes.Type(value = JoinQuiz.class, name = "joinQuiz"),
        @JsonSubTypes.Type(value = SubmitAnswer.class, name = "submitAnswer")
})
public interface ClientMessage { }
