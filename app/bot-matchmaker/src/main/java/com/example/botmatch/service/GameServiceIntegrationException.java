/*
 * Where: Bot matchmaker service layer
 * What: Represents a failed call to the game server
 * Why: Callers decide per reason whether to skip the tick or drop the request
 */
package com.example.botmatch.service;

public class GameServiceIntegrationException extends RuntimeException {

  public enum Reason {
    FORBIDDEN,
    NOT_FOUND,
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;

  public GameServiceIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public GameServiceIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
