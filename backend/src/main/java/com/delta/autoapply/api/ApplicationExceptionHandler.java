package com.delta.autoapply.api;

import com.delta.autoapply.apply.ai.AiCollaboratorException;
import com.delta.autoapply.apply.model.IllegalSessionStateException;
import com.delta.autoapply.apply.platform.UnsupportedPlatformException;
import com.delta.autoapply.apply.service.UnknownSessionException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApplicationExceptionHandler {

  @ExceptionHandler(IllegalSessionStateException.class)
  public ResponseEntity<Map<String, String>> handleIllegalState(IllegalSessionStateException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "illegal_session_state", "message", ex.getMessage()));
  }

  @ExceptionHandler(UnknownSessionException.class)
  public ResponseEntity<Map<String, String>> handleUnknownSession(UnknownSessionException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "unknown_session", "message", ex.getMessage()));
  }

  @ExceptionHandler(UnsupportedPlatformException.class)
  public ResponseEntity<Map<String, String>> handleUnsupportedPlatform(UnsupportedPlatformException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "unsupported_platform", "message", ex.getMessage()));
  }

  @ExceptionHandler(AiCollaboratorException.class)
  public ResponseEntity<Map<String, String>> handleAiUnavailable(AiCollaboratorException ex) {
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(Map.of("error", "ai_unavailable", "message", ex.getMessage()));
  }
}
