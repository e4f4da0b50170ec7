package com.codeheadsystems.loginticket.server.exceptions;

/**
 * Thrown when an ID token cannot be turned into a login ticket.
 */
public class TicketVerificationException extends RuntimeException {

  /**
   * Instantiates a new Ticket verification exception.
   *
   * @param message the message
   */
  public TicketVerificationException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Ticket verification exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public TicketVerificationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
