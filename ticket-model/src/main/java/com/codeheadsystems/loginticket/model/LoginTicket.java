package com.codeheadsystems.loginticket.model;

import java.util.Objects;
import java.util.Optional;

/**
 * The verified result of an ID token: its decoded envelope and claim set.
 * <p>
 * A ticket is created by a verifier only after the token's signature, issuer, audience and
 * expiry have been checked. The ticket itself performs no validation and never throws; it
 * carries the values it was given and exposes them through read-only accessors.
 * <p>
 * Instances are immutable and safe to share between threads.
 */
public final class LoginTicket {

  private final String envelope;
  private final TokenPayload payload;

  /**
   * Instantiates a new Login ticket.
   *
   * @param envelope the decoded token header, or null if not provided
   * @param payload  the decoded claim set, or null if not provided
   */
  public LoginTicket(final String envelope, final TokenPayload payload) {
    this.envelope = envelope;
    this.payload = payload;
  }

  /**
   * Gets envelope.
   *
   * @return the envelope, or empty if the ticket was built without one
   */
  public Optional<String> getEnvelope() {
    return Optional.ofNullable(envelope);
  }

  /**
   * Gets payload.
   *
   * @return the payload, or empty if the ticket was built without one
   */
  public Optional<TokenPayload> getPayload() {
    return Optional.ofNullable(payload);
  }

  /**
   * Returns the stable user identifier carried in the {@code sub} claim.
   * <p>
   * Empty when there is no payload or when {@code sub} is null or empty. An empty result means
   * the ticket holds no usable identity; it is up to the caller to reject the request.
   *
   * @return the user id
   */
  public Optional<String> getUserId() {
    return getPayload()
        .map(TokenPayload::subject)
        .filter(sub -> !sub.isEmpty());
  }

  /**
   * Returns the envelope and payload together. This can contain various information about the
   * user session.
   *
   * @return the attributes
   */
  public TicketAttributes getAttributes() {
    return new TicketAttributes(getEnvelope(), getPayload());
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LoginTicket)) {
      return false;
    }
    final LoginTicket that = (LoginTicket) o;
    return Objects.equals(envelope, that.envelope) && Objects.equals(payload, that.payload);
  }

  @Override
  public int hashCode() {
    return Objects.hash(envelope, payload);
  }

  // The envelope is left out so tokens never end up in logs.
  @Override
  public String toString() {
    return "LoginTicket{userId=" + getUserId().orElse(null)
        + ", hasEnvelope=" + (envelope != null)
        + ", hasPayload=" + (payload != null) + '}';
  }
}
