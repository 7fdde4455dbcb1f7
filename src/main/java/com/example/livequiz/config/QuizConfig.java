package com.example.livequiz.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(QuizProperties.class)
public class QuizConfig {

  /** Shared by every room's question and grace timers. */
  @Bean(destroyMethod = "shutdownNow")
  public ScheduledExecutorService quizTimerScheduler(QuizProperties props) {
    AtomicInteger seq = new AtomicInteger();
    return Executors.newScheduledThreadPool(Math.max(1, props.getTimerThreads()), r -> {
      Thread t = new Thread(r, "quiz-timer-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }
}
