package com.example.livequiz.model;

public enum SessionPhase {
    /** Created, players may join, no question shown yet. */
    LOBBY,
    /** A question is on screen and accepts answers until its timer fires. */
    QUESTION_OPEN,
    /** Time is up; correct answer is on screen until the grace delay advances. */
    QUESTION_CLOSED,
    /** Past the last question. Terminal. */
    FINISHED
}
