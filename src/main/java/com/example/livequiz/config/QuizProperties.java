package com.example.livequiz.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** Game tuning, bound from {@code app.quiz.*}. Defaults are the standard game rules. */
@ConfigurationProperties("app.quiz")
public class QuizProperties {

  /** Points for a correct answer (flat, no speed bonus). */
  private int pointsPerCorrectAnswer = 10;

  /** Pause between "time's up" and the next question. */
  private long revealGraceMs = 2_500L;

  /** Used when a question has no positive time limit. */
  private int defaultTimeLimitSeconds = 20;

  private int roomCodeLength = 4;

  /** Collision retries before room creation gives up. */
  private int roomCodeAttempts = 32;

  /** Worker threads for question/grace timers. */
  private int timerThreads = 2;

  // --- getters/setters ---

  public int getPointsPerCorrectAnswer() { return pointsPerCorrectAnswer; }
  public void setPointsPerCorrectAnswer(int pointsPerCorrectAnswer) { this.pointsPerCorrectAnswer = pointsPerCorrectAnswer; }

  public long getRevealGraceMs() { return revealGraceMs; }
  public void setRevealGraceMs(long revealGraceMs) { this.revealGraceMs = revealGraceMs; }

  public int getDefaultTimeLimitSeconds() { return defaultTimeLimitSeconds; }
  public void setDefaultTimeLimitSeconds(int defaultTimeLimitSeconds) { this.defaultTimeLimitSeconds = defaultTimeLimitSeconds; }

  public int getRoomCodeLength() { return roomCodeLength; }
  public void setRoomCodeLength(int roomCodeLength) { this.roomCodeLength = roomCodeLength; }

  public int getRoomCodeAttempts() { return roomCodeAttempts; }
  public void setRoomCodeAttempts(int roomCodeAttempts) { this.roomCodeAttempts = roomCodeAttempts; }

  public int getTimerThreads() { return timerThreads; }
  public void setTimerThreads(int timerThreads) { this.timerThreads = timerThreads; }
}
