package com.example.partyrooms.rooms.web;

import com.example.partyrooms.error.RoomException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps room failures onto HTTP statuses; body is {ok:false, code, message}. */
@RestControllerAdvice
public class RoomExceptionAdvice {

  private static final Logger log = LoggerFactory.getLogger(RoomExceptionAdvice.class);

  @ExceptionHandler(RoomException.class)
  public ResponseEntity<ErrorView> room(RoomException e) {
    HttpStatus status = switch (e.getKind()) {
      case NOT_FOUND     -> HttpStatus.NOT_FOUND;
      case CONFLICT      -> HttpStatus.CONFLICT;
      case FORBIDDEN     -> HttpStatus.FORBIDDEN;
      case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
      case RATE_LIMITED  -> HttpStatus.TOO_MANY_REQUESTS;
      case TRANSIENT     -> HttpStatus.SERVICE_UNAVAILABLE;
    };
    if (status.is5xxServerError()) log.warn("Room request failed: {}", e.toString());
    return ResponseEntity.status(status).body(new ErrorView(e.getCode(), e.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorView> unreadable(HttpMessageNotReadableException e) {
    return ResponseEntity.badRequest().body(new ErrorView("INVALID_INPUT", "Malformed request body"));
  }

  /** Compact error body */
  public static final class ErrorView {
    public boolean ok = false;
    public String code;
    public String message;
    public ErrorView(String code, String message) {
      this.code = code;
      this.message = (message == null ? "Internal error" : message);
    }
  }
}
