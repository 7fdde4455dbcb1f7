package com.example.livequiz.controller;

import com.example.livequiz.service.QuizSessionService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

  private final QuizSessionService quizService;

  @Value("${spring.profiles.active:default}")
  private String activeProfile = "default";

  public HealthController(QuizSessionService quizService) {
    this.quizService = quizService;
  }

  /** Liveness probe */
  @GetMapping("/healthz")
  public String healthz() {
    return "ok";
  }

  /** Human-readable status; state is memory-only */
  @GetMapping("/admin/health")
  public Map<String, Object> adminHealth() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("app", "ok");
    m.put("profile", activeProfile);
    m.put("activeSessions", quizService.activeSessionCount());
    return m;
  }
}
