package com.codeheadsystems.loginticket.server.auth;

import com.codeheadsystems.loginticket.model.LoginTicket;
import com.codeheadsystems.loginticket.model.TokenPayload;
import java.security.Principal;
import java.util.Optional;

/**
 * The authenticated user behind a {@link LoginTicket}.
 *
 * @param userId   the {@code sub} claim
 * @param issuer   the {@code iss} claim
 * @param audience the {@code aud} claim
 */
public record TicketPrincipal(String userId, String issuer, String audience) implements Principal {

  /**
   * Builds a principal from a ticket. Empty when the ticket carries no usable user id, in which
   * case the request should be rejected.
   *
   * @param ticket the ticket
   * @return the principal
   */
  public static Optional<TicketPrincipal> fromTicket(final LoginTicket ticket) {
    return ticket.getUserId().map(userId -> {
      final TokenPayload payload = ticket.getPayload().orElseThrow();
      return new TicketPrincipal(userId, payload.issuer(), payload.audience());
    });
  }

  @Override
  public String getName() {
    return userId;
  }
}
