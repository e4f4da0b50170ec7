package com.codeheadsystems.loginticket.server.config;

import java.util.List;

/**
 * Settings for {@link com.codeheadsystems.loginticket.server.auth.LoginTicketVerifier}.
 *
 * @param issuers                 accepted {@code iss} values
 * @param audiences               accepted {@code aud} values, the application's client ids
 * @param clockSkewSeconds        leeway applied to {@code exp}, {@code iat} and {@code nbf}
 * @param maxTokenLifetimeSeconds how far in the future {@code exp} may lie
 */
public record TicketVerifierConfig(List<String> issuers,
                                   List<String> audiences,
                                   long clockSkewSeconds,
                                   long maxTokenLifetimeSeconds) {

  /**
   * Issuers of Google ID tokens.
   */
  public static final List<String> GOOGLE_ISSUERS =
      List.of("accounts.google.com", "https://accounts.google.com");

  /**
   * The constant DEFAULT_CLOCK_SKEW_SECONDS.
   */
  public static final long DEFAULT_CLOCK_SKEW_SECONDS = 300;

  /**
   * The constant DEFAULT_MAX_TOKEN_LIFETIME_SECONDS.
   */
  public static final long DEFAULT_MAX_TOKEN_LIFETIME_SECONDS = 86400;

  /**
   * Validates and copies the lists.
   */
  public TicketVerifierConfig {
    if (issuers == null || issuers.isEmpty()) {
      throw new IllegalArgumentException("At least one issuer is required");
    }
    if (audiences == null || audiences.isEmpty()) {
      throw new IllegalArgumentException("At least one audience is required");
    }
    if (clockSkewSeconds < 0) {
      throw new IllegalArgumentException("clockSkewSeconds must not be negative: " + clockSkewSeconds);
    }
    if (maxTokenLifetimeSeconds <= 0) {
      throw new IllegalArgumentException(
          "maxTokenLifetimeSeconds must be positive: " + maxTokenLifetimeSeconds);
    }
    issuers = List.copyOf(issuers);
    audiences = List.copyOf(audiences);
  }

  /**
   * Config for Google ID tokens addressed to the given client ids, with default leeway and
   * lifetime.
   *
   * @param audiences the client ids
   */
  public TicketVerifierConfig(final List<String> audiences) {
    this(GOOGLE_ISSUERS, audiences, DEFAULT_CLOCK_SKEW_SECONDS, DEFAULT_MAX_TOKEN_LIFETIME_SECONDS);
  }
}
