package com.example.livequiz.messages.outbound;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** Frames pushed to clients. Serialized with a {@code type} discriminator. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = QuizCreated.class, name = "quizCreated"),
        @JsonSubTypes.Type(value = JoinedRoom.class, name = "joinedRoom"),
        @JsonSubTypes.Type(value = JoinError.class, name = "joinError"),
        @JsonSubTypes.Type(value = ScoreUpdate.class, name = "scoreUpdate"),
        @JsonSubTypes.Type(value = UpdateLeaderboard.class, name = "updateLeaderboard"),
        @JsonSubTypes.Type(value = NewQuestion.class, name = "newQuestion"),
        @JsonSubTypes.Type(value = QuestionTimeout.class, name = "questionTimeout"),
        @JsonSubTypes.Type(value = QuizFinished.class, name = "quizFinished"),
        @JsonSubTypes.Type(value = PlayerJoined.class, name = "playerJoined"),
        @JsonSubTypes.Type(value = HostDisconnected.class, name = "hostDisconnected")
})
public interface ServerEvent { }
