package com.codeheadsystems.loginticket.model;

import java.util.Optional;

/**
 * Read-only view of a {@link LoginTicket}'s envelope and payload.
 *
 * @param envelope the decoded token header, if the ticket has one
 * @param payload  the decoded claim set, if the ticket has one
 */
public record TicketAttributes(Optional<String> envelope, Optional<TokenPayload> payload) {
}
