package com.example.livequiz.config;

import com.example.livequiz.handler.QuizWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

  private final QuizWebSocketHandler handler;
  private final String wsPath;
  private final List<String> originPatterns;

  public WebSocketConfig(QuizWebSocketHandler handler,
                         @Value("${app.websocket.path:/quizSocket}") String wsPath,
                         @Value("${app.websocket.allowed-origins:*}") String originsCsv) {
    this.handler = handler;
    this.wsPath = wsPath;
    this.originPatterns = toOriginPatterns(originsCsv);
  }

  /** CSV of origin patterns; blank means any origin. */
  static List<String> toOriginPatterns(String originsCsv) {
    List<String> patterns = Arrays.stream((originsCsv == null ? "" : originsCsv).split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .distinct()
        .collect(Collectors.toList());
    return patterns.isEmpty() ? List.of("*") : patterns;
  }

  @Override
  public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
    registry.addHandler(handler, wsPath)
            .setAllowedOriginPatterns(originPatterns.toArray(String[]::new));
  }
}
